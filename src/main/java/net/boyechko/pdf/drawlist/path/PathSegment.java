/*
 * PDF-Drawlist - PDF content stream interpretation into draw command lists
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.drawlist.path;

import net.boyechko.pdf.drawlist.command.DrawCommand;

/** One accumulated path element, already in device (y-down) coordinates. */
public sealed interface PathSegment {

    /** The path-mutation command the backend applies to the open path. */
    DrawCommand toCommand();

    record MoveTo(double x, double y) implements PathSegment {
        @Override
        public DrawCommand toCommand() {
            return new DrawCommand.MoveTo(x, y);
        }
    }

    record LineTo(double x, double y) implements PathSegment {
        @Override
        public DrawCommand toCommand() {
            return new DrawCommand.LineTo(x, y);
        }
    }

    record CurveTo(double x1, double y1, double x2, double y2, double x3, double y3)
            implements PathSegment {
        @Override
        public DrawCommand toCommand() {
            return new DrawCommand.CurveTo(x1, y1, x2, y2, x3, y3);
        }
    }

    record Rect(double x, double y, double width, double height) implements PathSegment {
        @Override
        public DrawCommand toCommand() {
            return new DrawCommand.AddRectangle(x, y, width, height);
        }
    }

    record Close() implements PathSegment {
        @Override
        public DrawCommand toCommand() {
            return new DrawCommand.ClosePath();
        }
    }
}

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

import java.util.List;
import net.boyechko.pdf.drawlist.state.GraphicsState;
import net.boyechko.pdf.drawlist.state.LineCap;
import net.boyechko.pdf.drawlist.state.LineJoin;
import net.boyechko.pdf.drawlist.state.RgbaColor;

/** Stroke style handed to the backend with {@code SetPen}. */
public record Pen(
        RgbaColor color,
        double width,
        LineCap cap,
        LineJoin join,
        List<Double> dashes,
        double dashPhase) {

    public static final Pen TRANSPARENT =
            new Pen(RgbaColor.TRANSPARENT, 1.0, LineCap.BUTT, LineJoin.MITER, List.of(), 0);

    public Pen {
        dashes = List.copyOf(dashes);
    }

    public static Pen from(GraphicsState state) {
        return new Pen(
                state.strokeColorWithAlpha(),
                state.lineWidth(),
                state.lineCap(),
                state.lineJoin(),
                state.dashArray(),
                state.dashPhase());
    }

    public boolean isDashed() {
        return !dashes.isEmpty();
    }
}

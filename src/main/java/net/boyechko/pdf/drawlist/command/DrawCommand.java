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
package net.boyechko.pdf.drawlist.command;

import java.util.Locale;
import net.boyechko.pdf.drawlist.font.FontSpec;
import net.boyechko.pdf.drawlist.image.Bitmap;
import net.boyechko.pdf.drawlist.path.Brush;
import net.boyechko.pdf.drawlist.path.FillRule;
import net.boyechko.pdf.drawlist.path.Pen;
import net.boyechko.pdf.drawlist.state.RgbaColor;

/**
 * One backend instruction. Commands are applied in order; {@link CreatePath} opens a path that
 * the following path-mutation commands extend until {@link DrawPath} paints it. All
 * coordinates are device space (y down).
 */
public sealed interface DrawCommand {

    DrawKind kind();

    /** Short human-readable rendering used by listings. */
    default String describe() {
        return kind().tag();
    }

    record ConcatTransform(double a, double b, double c, double d, double e, double f)
            implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.CONCAT_TRANSFORM;
        }

        @Override
        public String describe() {
            return kind().tag() + "(" + fmt(a, b, c, d, e, f) + ")";
        }
    }

    record PushState() implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.PUSH_STATE;
        }
    }

    record PopState() implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.POP_STATE;
        }
    }

    /**
     * Selects the font for the following text. {@code displayFont} is sized for drawing and
     * {@code metricsFont} for measuring; hosts scale them independently.
     */
    record SetFont(FontSpec displayFont, FontSpec metricsFont, RgbaColor color)
            implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.SET_FONT;
        }

        @Override
        public String describe() {
            return kind().tag() + "(" + displayFont + ", " + color + ")";
        }
    }

    record SetPen(Pen pen) implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.SET_PEN;
        }
    }

    record SetBrush(Brush brush) implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.SET_BRUSH;
        }
    }

    record DrawText(String text, double x, double y) implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.DRAW_TEXT;
        }

        @Override
        public String describe() {
            return kind().tag() + "(\"" + text + "\", " + fmt(x, y) + ")";
        }
    }

    record DrawBitmap(Bitmap bitmap, double x, double y, double width, double height)
            implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.DRAW_BITMAP;
        }

        @Override
        public String describe() {
            return kind().tag()
                    + "("
                    + bitmap.width()
                    + "x"
                    + bitmap.height()
                    + " px, "
                    + fmt(x, y, width, height)
                    + ")";
        }
    }

    record CreatePath() implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.CREATE_PATH;
        }
    }

    record MoveTo(double x, double y) implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.MOVE_TO;
        }

        @Override
        public String describe() {
            return kind().tag() + "(" + fmt(x, y) + ")";
        }
    }

    record LineTo(double x, double y) implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.LINE_TO;
        }

        @Override
        public String describe() {
            return kind().tag() + "(" + fmt(x, y) + ")";
        }
    }

    record CurveTo(double x1, double y1, double x2, double y2, double x3, double y3)
            implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.CURVE_TO;
        }

        @Override
        public String describe() {
            return kind().tag() + "(" + fmt(x1, y1, x2, y2, x3, y3) + ")";
        }
    }

    record AddRectangle(double x, double y, double width, double height) implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.ADD_RECTANGLE;
        }

        @Override
        public String describe() {
            return kind().tag() + "(" + fmt(x, y, width, height) + ")";
        }
    }

    record ClosePath() implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.CLOSE_PATH;
        }
    }

    record DrawPath(FillRule rule) implements DrawCommand {
        @Override
        public DrawKind kind() {
            return DrawKind.DRAW_PATH;
        }

        @Override
        public String describe() {
            return kind().tag() + "(" + rule + ")";
        }
    }

    private static String fmt(double... values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format(Locale.ROOT, "%.2f", values[i]));
        }
        return sb.toString();
    }
}

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

import java.util.Arrays;
import java.util.Optional;

/** Path-painting operators with their stroke, fill, winding and implicit-close behaviour. */
public enum PaintOp {
    STROKE("S", true, false, FillRule.NONZERO_WINDING, false),
    CLOSE_STROKE("s", true, false, FillRule.NONZERO_WINDING, true),
    FILL("f", false, true, FillRule.NONZERO_WINDING, false),
    FILL_COMPAT("F", false, true, FillRule.NONZERO_WINDING, false),
    FILL_EVEN_ODD("f*", false, true, FillRule.EVEN_ODD, false),
    FILL_STROKE("B", true, true, FillRule.NONZERO_WINDING, false),
    FILL_STROKE_EVEN_ODD("B*", true, true, FillRule.EVEN_ODD, false),
    CLOSE_FILL_STROKE("b", true, true, FillRule.NONZERO_WINDING, true),
    CLOSE_FILL_STROKE_EVEN_ODD("b*", true, true, FillRule.EVEN_ODD, true),
    END_PATH("n", false, false, FillRule.NONZERO_WINDING, false);

    private final String operator;
    private final boolean strokes;
    private final boolean fills;
    private final FillRule rule;
    private final boolean closesPath;

    PaintOp(String operator, boolean strokes, boolean fills, FillRule rule, boolean closesPath) {
        this.operator = operator;
        this.strokes = strokes;
        this.fills = fills;
        this.rule = rule;
        this.closesPath = closesPath;
    }

    public String operator() {
        return operator;
    }

    public boolean strokes() {
        return strokes;
    }

    public boolean fills() {
        return fills;
    }

    /** Winding rule; meaningless (but still reported) when {@link #fills()} is false. */
    public FillRule rule() {
        return rule;
    }

    public boolean closesPath() {
        return closesPath;
    }

    public static Optional<PaintOp> fromOperator(String operator) {
        return Arrays.stream(values()).filter(op -> op.operator.equals(operator)).findFirst();
    }
}

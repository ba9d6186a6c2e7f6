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
package net.boyechko.pdf.drawlist.interpret;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** The content stream operator set, grouped as in ISO 32000-1 Table 51. */
public enum Operator {
    // General graphics state
    LINE_WIDTH("w"),
    LINE_CAP("J"),
    LINE_JOIN("j"),
    MITER_LIMIT("M"),
    DASH("d"),
    RENDERING_INTENT("ri"),
    FLATNESS("i"),
    EXT_GSTATE("gs"),

    // Special graphics state
    SAVE("q"),
    RESTORE("Q"),
    CONCAT_MATRIX("cm"),

    // Path construction
    MOVE_TO("m"),
    LINE_TO("l"),
    CURVE_TO("c"),
    CURVE_TO_V("v"),
    CURVE_TO_Y("y"),
    CLOSE_SUBPATH("h"),
    RECTANGLE("re"),

    // Path painting
    STROKE("S"),
    CLOSE_STROKE("s"),
    FILL("f"),
    FILL_COMPAT("F"),
    FILL_EVEN_ODD("f*"),
    FILL_STROKE("B"),
    FILL_STROKE_EVEN_ODD("B*"),
    CLOSE_FILL_STROKE("b"),
    CLOSE_FILL_STROKE_EVEN_ODD("b*"),
    END_PATH("n"),

    // Clipping
    CLIP("W"),
    CLIP_EVEN_ODD("W*"),

    // Text objects and state
    BEGIN_TEXT("BT"),
    END_TEXT("ET"),
    CHAR_SPACING("Tc"),
    WORD_SPACING("Tw"),
    HORIZONTAL_SCALING("Tz"),
    LEADING("TL"),
    FONT("Tf"),
    RENDER_MODE("Tr"),
    RISE("Ts"),

    // Text positioning
    MOVE_TEXT("Td"),
    MOVE_TEXT_SET_LEADING("TD"),
    TEXT_MATRIX("Tm"),
    NEXT_LINE("T*"),

    // Text showing
    SHOW_TEXT("Tj"),
    SHOW_TEXT_ARRAY("TJ"),
    NEXT_LINE_SHOW("'"),
    NEXT_LINE_SPACING_SHOW("\""),

    // Type 3 fonts
    GLYPH_WIDTH("d0"),
    GLYPH_WIDTH_BBOX("d1"),

    // Colour
    STROKE_COLOR_SPACE("CS"),
    FILL_COLOR_SPACE("cs"),
    STROKE_COLOR("SC"),
    STROKE_COLOR_N("SCN"),
    FILL_COLOR("sc"),
    FILL_COLOR_N("scn"),
    STROKE_GRAY("G"),
    FILL_GRAY("g"),
    STROKE_RGB("RG"),
    FILL_RGB("rg"),
    STROKE_CMYK("K"),
    FILL_CMYK("k"),

    // Shading, inline images, XObjects
    SHADING("sh"),
    INLINE_IMAGE("BI"),
    INLINE_IMAGE_DATA("ID"),
    INLINE_IMAGE_END("EI"),
    XOBJECT("Do"),

    // Marked content
    MARK_POINT("MP"),
    MARK_POINT_PROPS("DP"),
    BEGIN_MARKED("BMC"),
    BEGIN_MARKED_PROPS("BDC"),
    END_MARKED("EMC"),

    // Compatibility
    BEGIN_COMPAT("BX"),
    END_COMPAT("EX");

    private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();

    static {
        for (Operator op : values()) {
            BY_SYMBOL.put(op.symbol, op);
        }
    }

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}

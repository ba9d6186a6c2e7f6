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
package net.boyechko.pdf.drawlist.state;

/** Line join styles, indexed by their PDF operand value. */
public enum LineJoin {
    MITER,
    ROUND,
    BEVEL;

    /** Maps the {@code j} operand (0, 1, 2) to a join style. */
    public static LineJoin fromPdf(int code) {
        LineJoin[] values = values();
        if (code < 0 || code >= values.length) {
            throw new IllegalArgumentException("Unknown line join style " + code);
        }
        return values[code];
    }
}

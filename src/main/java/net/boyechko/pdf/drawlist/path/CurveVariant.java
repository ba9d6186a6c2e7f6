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

/** The three cubic Bézier forms of the content stream. */
public enum CurveVariant {
    /** {@code c}: both control points given. */
    EXPLICIT(6),
    /** {@code v}: the first control point is the current point. */
    INITIAL_IMPLICIT(4),
    /** {@code y}: the second control point is the end point. */
    FINAL_IMPLICIT(4);

    private final int operandCount;

    CurveVariant(int operandCount) {
        this.operandCount = operandCount;
    }

    public int operandCount() {
        return operandCount;
    }
}

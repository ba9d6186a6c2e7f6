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

/**
 * A text matrix {@code [a b c d e f]} in double precision, so positions set with {@code Tm} or
 * {@code Td} come back exactly as written.
 */
public record TextMatrix(double a, double b, double c, double d, double e, double f) {
    public static final TextMatrix IDENTITY = new TextMatrix(1, 0, 0, 1, 0, 0);

    public static TextMatrix translation(double e, double f) {
        return new TextMatrix(1, 0, 0, 1, e, f);
    }

    /** Same rotation and skew, translation replaced. */
    public TextMatrix withTranslation(double newE, double newF) {
        return new TextMatrix(a, b, c, d, newE, newF);
    }
}

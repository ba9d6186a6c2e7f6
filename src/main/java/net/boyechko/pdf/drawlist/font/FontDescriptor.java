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
package net.boyechko.pdf.drawlist.font;

/**
 * A base font name from a font resource together with the host face chosen for it.
 *
 * @param baseFont the {@code /BaseFont} value as declared in the document
 * @param faceName host face name used for drawing, e.g. "Arial"
 * @param known whether the base font matched one of the standard families
 */
public record FontDescriptor(
        String baseFont,
        FontFamily family,
        String faceName,
        boolean bold,
        boolean italic,
        boolean known) {}

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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import java.util.Optional;

/** Named resources visible to a page or form content stream. */
public interface ResourceScope {

    /** Identifies the resource dictionary; used to key cached form expansions. */
    String scopeId();

    /** The {@code /BaseFont} of the named font resource, without the leading slash. */
    Optional<String> baseFont(String fontName);

    Optional<PdfStream> xObject(String name);

    Optional<PdfDictionary> extGState(String name);

    Optional<PdfObject> colorSpace(String name);

    /** The whole {@code /ColorSpace} category, for tokenizers that size inline images. */
    default Optional<PdfDictionary> colorSpaces() {
        return Optional.empty();
    }

    /** The scope of a form XObject: its own resources, or this scope's if it declares none. */
    ResourceScope forForm(PdfStream form);
}

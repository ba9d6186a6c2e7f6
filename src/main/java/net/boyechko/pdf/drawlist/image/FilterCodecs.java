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
package net.boyechko.pdf.drawlist.image;

import com.itextpdf.kernel.pdf.PdfDictionary;

/** Byte-level decoders for the codec stages of {@link StreamFilter#CHAIN_ORDER}. */
public interface FilterCodecs {

    /**
     * Decodes one stage.
     *
     * @param decodeParams the stage's decode parameters, may be null
     * @param width image width in samples, needed by CCITT-Fax
     * @param height image height in rows, needed by CCITT-Fax
     * @throws DecodeException if the data is corrupt for this filter
     */
    byte[] decode(
            StreamFilter filter, byte[] data, PdfDictionary decodeParams, int width, int height)
            throws DecodeException;
}

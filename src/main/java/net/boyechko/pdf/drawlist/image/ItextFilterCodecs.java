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
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.filters.ASCII85DecodeFilter;
import com.itextpdf.kernel.pdf.filters.CCITTFaxDecodeFilter;
import com.itextpdf.kernel.pdf.filters.FlateDecodeFilter;
import com.itextpdf.kernel.pdf.filters.IFilterHandler;
import com.itextpdf.kernel.pdf.filters.LZWDecodeFilter;
import java.util.EnumMap;
import java.util.Map;

/** {@link FilterCodecs} backed by iText's filter handlers; predictors are honoured. */
public class ItextFilterCodecs implements FilterCodecs {
    private final Map<StreamFilter, IFilterHandler> handlers = new EnumMap<>(StreamFilter.class);

    public ItextFilterCodecs() {
        handlers.put(StreamFilter.LZW, new LZWDecodeFilter());
        handlers.put(StreamFilter.ASCII85, new ASCII85DecodeFilter());
        handlers.put(StreamFilter.FLATE, new FlateDecodeFilter());
        handlers.put(StreamFilter.CCITT_FAX, new CCITTFaxDecodeFilter());
    }

    @Override
    public byte[] decode(
            StreamFilter filter, byte[] data, PdfDictionary decodeParams, int width, int height)
            throws DecodeException {
        IFilterHandler handler = handlers.get(filter);
        if (handler == null) {
            throw new DecodeException("No codec for " + filter.pdfName());
        }
        // Handlers read the image geometry from the stream dictionary
        PdfDictionary streamDict = new PdfDictionary();
        streamDict.put(PdfName.Width, new PdfNumber(width));
        streamDict.put(PdfName.Height, new PdfNumber(height));
        try {
            byte[] decoded =
                    handler.decode(data, new PdfName(filter.pdfName()), decodeParams, streamDict);
            if (decoded == null) {
                throw new DecodeException(filter.pdfName() + " produced no data");
            }
            return decoded;
        } catch (RuntimeException e) {
            throw new DecodeException(filter.pdfName() + " failed: " + e.getMessage(), e);
        }
    }
}

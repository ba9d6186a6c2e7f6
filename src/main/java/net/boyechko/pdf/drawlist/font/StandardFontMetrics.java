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

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Widths from the AFM metrics iText ships for the 14 standard fonts. Only known descriptors
 * have metrics; anything else yields empty so the caller falls back to the device extent.
 */
public class StandardFontMetrics implements TextMetrics {
    private static final Logger logger = LoggerFactory.getLogger(StandardFontMetrics.class);

    private final Map<String, PdfFont> fonts = new HashMap<>();

    @Override
    public OptionalDouble width(String text, FontDescriptor font, double size) {
        if (!font.known()) {
            return OptionalDouble.empty();
        }
        PdfFont pdfFont = load(standardName(font));
        if (pdfFont == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(pdfFont.getWidth(text, (float) size));
    }

    private PdfFont load(String name) {
        if (fonts.containsKey(name)) {
            return fonts.get(name);
        }
        PdfFont font = null;
        try {
            font = PdfFontFactory.createFont(name);
        } catch (IOException e) {
            logger.warn("No built-in metrics for {}: {}", name, e.getMessage());
        }
        fonts.put(name, font);
        return font;
    }

    /** Maps a descriptor onto one of the standard-14 names. */
    static String standardName(FontDescriptor font) {
        return switch (font.family()) {
            case MONOSPACE -> pick(font, StandardFonts.COURIER, StandardFonts.COURIER_BOLD,
                    StandardFonts.COURIER_OBLIQUE, StandardFonts.COURIER_BOLDOBLIQUE);
            case SERIF -> pick(font, StandardFonts.TIMES_ROMAN, StandardFonts.TIMES_BOLD,
                    StandardFonts.TIMES_ITALIC, StandardFonts.TIMES_BOLDITALIC);
            case SANS_SERIF -> pick(font, StandardFonts.HELVETICA, StandardFonts.HELVETICA_BOLD,
                    StandardFonts.HELVETICA_OBLIQUE, StandardFonts.HELVETICA_BOLDOBLIQUE);
            case SYMBOLIC -> font.faceName().equals("Wingdings")
                    ? StandardFonts.ZAPFDINGBATS
                    : StandardFonts.SYMBOL;
        };
    }

    private static String pick(
            FontDescriptor font, String regular, String bold, String italic, String boldItalic) {
        if (font.bold() && font.italic()) return boldItalic;
        if (font.bold()) return bold;
        if (font.italic()) return italic;
        return regular;
    }
}

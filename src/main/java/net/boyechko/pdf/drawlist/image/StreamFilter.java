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

import java.util.List;
import java.util.Optional;

/** Stream filters by full name and inline-image abbreviation. */
public enum StreamFilter {
    LZW("LZWDecode", "LZW"),
    ASCII85("ASCII85Decode", "A85"),
    FLATE("FlateDecode", "Fl"),
    CCITT_FAX("CCITTFaxDecode", "CCF"),
    DCT("DCTDecode", "DCT"),
    ASCII_HEX("ASCIIHexDecode", "AHx"),
    RUN_LENGTH("RunLengthDecode", "RL"),
    JBIG2("JBIG2Decode", null),
    JPX("JPXDecode", null),
    CRYPT("Crypt", null);

    /** Codec stages, in the order they are applied whatever the declared order. */
    public static final List<StreamFilter> CHAIN_ORDER = List.of(LZW, ASCII85, FLATE, CCITT_FAX);

    private final String pdfName;
    private final String abbreviation;

    StreamFilter(String pdfName, String abbreviation) {
        this.pdfName = pdfName;
        this.abbreviation = abbreviation;
    }

    public String pdfName() {
        return pdfName;
    }

    public boolean isChainStage() {
        return CHAIN_ORDER.contains(this);
    }

    /** Looks up a filter by name, with or without a leading slash. */
    public static Optional<StreamFilter> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String bare = name.startsWith("/") ? name.substring(1) : name;
        for (StreamFilter filter : values()) {
            if (filter.pdfName.equals(bare) || bare.equals(filter.abbreviation)) {
                return Optional.of(filter);
            }
        }
        return Optional.empty();
    }
}

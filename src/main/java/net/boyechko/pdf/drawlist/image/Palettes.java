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

/** Built-in RGB palettes for de-indexing. */
public final class Palettes {
    private Palettes() {}

    /** Index 0 black, index 1 white. */
    public static byte[] blackWhite() {
        return new byte[] {0, 0, 0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
    }

    /** Linear ramp from black to white with {@code 2^depth} entries. */
    public static byte[] grayRamp(int depth) {
        if (depth != 1 && depth != 2 && depth != 4 && depth != 8) {
            throw new IllegalArgumentException("Unsupported gray depth: " + depth);
        }
        int entries = 1 << depth;
        byte[] palette = new byte[entries * 3];
        for (int i = 0; i < entries; i++) {
            byte level = (byte) (i * 255 / (entries - 1));
            palette[i * 3] = level;
            palette[i * 3 + 1] = level;
            palette[i * 3 + 2] = level;
        }
        return palette;
    }

    /** Expands a one-byte-per-entry gray lookup into an RGB palette. */
    public static byte[] expandGray(byte[] grayLookup) {
        byte[] palette = new byte[grayLookup.length * 3];
        for (int i = 0; i < grayLookup.length; i++) {
            palette[i * 3] = grayLookup[i];
            palette[i * 3 + 1] = grayLookup[i];
            palette[i * 3 + 2] = grayLookup[i];
        }
        return palette;
    }
}

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

/**
 * Expands packed palette indices into colour samples.
 *
 * <p>Rows start on a byte boundary. Within a byte, samples are read from the most significant
 * bits down, so at depth 1 bit 7 is the first pixel. Indices beyond the palette come out as
 * zero bytes (black); samples past the end of short data read as index 0.
 */
public final class Deindexer {
    public static final int RGB_CHUNK = 3;

    private Deindexer() {}

    public static byte[] deindex(int width, int height, byte[] data, int depth, byte[] palette) {
        return deindex(width, height, data, depth, palette, RGB_CHUNK);
    }

    /**
     * @return exactly {@code width * height * chunk} bytes
     * @throws IllegalArgumentException if the depth is unsupported or the output would not fit in
     *     an array
     */
    public static byte[] deindex(
            int width, int height, byte[] data, int depth, byte[] palette, int chunk) {
        if (depth != 1 && depth != 2 && depth != 4 && depth != 8) {
            throw new IllegalArgumentException("Unsupported sample depth: " + depth);
        }
        byte[] out = new byte[Bitmap.byteCount(width, height, chunk)];
        long stride = ((long) width * depth + 7) / 8;
        int sampleMask = (1 << depth) - 1;
        int entries = palette.length / chunk;

        int pos = 0;
        for (int row = 0; row < height; row++) {
            long rowStart = row * stride;
            for (int col = 0; col < width; col++) {
                long bitOffset = (long) col * depth;
                long byteIndex = rowStart + bitOffset / 8;
                int value = byteIndex < data.length ? data[(int) byteIndex] & 0xFF : 0;
                int shift = (int) (8 - depth - (bitOffset % 8));
                int index = (value >> shift) & sampleMask;
                if (index < entries) {
                    System.arraycopy(palette, index * chunk, out, pos, chunk);
                }
                pos += chunk;
            }
        }
        return out;
    }
}

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

/** Rewrites pixels inside a colour-key range to the key colour. */
public final class ColorKeyMasker {
    private ColorKeyMasker() {}

    public record Result(byte[] rgb, int maskedCount) {}

    /** Returns a rewritten copy of {@code rgb}; the input is left untouched. */
    public static Result apply(byte[] rgb, ImageMaskSpec.ColorKey key) {
        if (rgb.length % 3 != 0) {
            throw new IllegalArgumentException(
                    "RGB data length is not a multiple of 3: " + rgb.length);
        }
        byte[] out = rgb.clone();
        byte keyRed = (byte) key.redHigh();
        byte keyGreen = (byte) key.greenHigh();
        byte keyBlue = (byte) key.blueHigh();
        int masked = 0;
        for (int i = 0; i < out.length; i += 3) {
            if (key.contains(out[i] & 0xFF, out[i + 1] & 0xFF, out[i + 2] & 0xFF)) {
                out[i] = keyRed;
                out[i + 1] = keyGreen;
                out[i + 2] = keyBlue;
                masked++;
            }
        }
        return new Result(out, masked);
    }
}

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
import net.boyechko.pdf.drawlist.state.RgbColor;

/** The {@code /Mask} of an image: either a colour-key range or a separate stencil image. */
public sealed interface ImageMaskSpec {

    /** Inclusive per-channel ranges; pixels inside all three are masked out. */
    record ColorKey(int redLow, int redHigh, int greenLow, int greenHigh, int blueLow, int blueHigh)
            implements ImageMaskSpec {

        public ColorKey {
            for (int value : new int[] {redLow, redHigh, greenLow, greenHigh, blueLow, blueHigh}) {
                if (value < 0 || value > 255) {
                    throw new IllegalArgumentException("Colour-key value out of 0..255: " + value);
                }
            }
        }

        /** Builds a key from the six-value {@code /Mask} array (low, high per channel). */
        public static ColorKey of(List<Integer> values) {
            if (values.size() != 6) {
                throw new IllegalArgumentException(
                        "Colour-key mask needs 6 values, got " + values.size());
            }
            return new ColorKey(
                    values.get(0), values.get(1), values.get(2),
                    values.get(3), values.get(4), values.get(5));
        }

        /** The colour masked pixels are rewritten to: the upper bound of each range. */
        public RgbColor keyColor() {
            return new RgbColor(redHigh, greenHigh, blueHigh);
        }

        public boolean contains(int red, int green, int blue) {
            return red >= redLow && red <= redHigh
                    && green >= greenLow && green <= greenHigh
                    && blue >= blueLow && blue <= blueHigh;
        }
    }

    /** A 1-bit mask image; white marks transparent pixels once de-indexed. */
    record Explicit(ImageResource mask) implements ImageMaskSpec {}
}

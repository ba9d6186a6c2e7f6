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

import net.boyechko.pdf.drawlist.state.RgbColor;

/** Transparency attached to a decoded bitmap. */
public sealed interface BitmapMask {

    boolean isTransparent(Bitmap bitmap, int x, int y);

    /** Pixels equal to {@code key} are transparent. */
    record ColorKeyed(RgbColor key) implements BitmapMask {
        @Override
        public boolean isTransparent(Bitmap bitmap, int x, int y) {
            return bitmap.pixel(x, y).equals(key);
        }
    }

    /**
     * A black/white stencil, possibly at a different resolution from the image; white pixels
     * are transparent.
     */
    record Stencil(int width, int height, byte[] rgb) implements BitmapMask {
        @Override
        public boolean isTransparent(Bitmap bitmap, int x, int y) {
            int mx = (int) ((long) x * width / bitmap.width());
            int my = (int) ((long) y * height / bitmap.height());
            int offset = (my * width + mx) * 3;
            return (rgb[offset] & 0xFF) == 0xFF
                    && (rgb[offset + 1] & 0xFF) == 0xFF
                    && (rgb[offset + 2] & 0xFF) == 0xFF;
        }
    }
}

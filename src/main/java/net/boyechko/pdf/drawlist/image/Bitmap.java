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

import java.awt.image.BufferedImage;
import java.util.Optional;
import net.boyechko.pdf.drawlist.state.RgbColor;

/** A decoded raster: packed 8-bit RGB, row by row, with an optional mask. */
public final class Bitmap {
    /** Largest sample array a decoded image may need. */
    public static final int MAX_BYTES = Integer.MAX_VALUE - 8;

    private final int width;
    private final int height;
    private final byte[] rgb;
    private final BitmapMask mask;
    private final int maskedPixelCount;

    public Bitmap(int width, int height, byte[] rgb) {
        this(width, height, rgb, null, 0);
    }

    private Bitmap(int width, int height, byte[] rgb, BitmapMask mask, int maskedPixelCount) {
        int expected = byteCount(width, height, 3);
        if (rgb.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " RGB bytes for " + width + "x" + height
                            + ", got " + rgb.length);
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb;
        this.mask = mask;
        this.maskedPixelCount = maskedPixelCount;
    }

    /**
     * The size of a {@code width} by {@code height} sample array with {@code chunk} bytes per
     * pixel.
     *
     * @throws IllegalArgumentException if a dimension is negative or the array would be larger
     *     than {@link #MAX_BYTES}
     */
    public static int byteCount(int width, int height, int chunk) {
        long pixels = (long) width * height;
        if (width < 0 || height < 0 || chunk < 1 || pixels > MAX_BYTES / chunk) {
            throw new IllegalArgumentException(
                    "Image " + width + "x" + height + " with " + chunk
                            + " bytes per pixel does not fit in an array");
        }
        return (int) (pixels * chunk);
    }

    /** Converts a decoded image (the JPEG path) to packed RGB; alpha is dropped. */
    public static Bitmap fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] rgb = new byte[byteCount(w, h, 3)];
        int pos = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                rgb[pos++] = (byte) (argb >> 16);
                rgb[pos++] = (byte) (argb >> 8);
                rgb[pos++] = (byte) argb;
            }
        }
        return new Bitmap(w, h, rgb);
    }

    public Bitmap withMask(BitmapMask mask, int maskedPixelCount) {
        return new Bitmap(width, height, rgb, mask, maskedPixelCount);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** A copy of the packed RGB samples. */
    public byte[] rgb() {
        return rgb.clone();
    }

    public Optional<BitmapMask> mask() {
        return Optional.ofNullable(mask);
    }

    /** Pixels rewritten by colour-key masking; 0 for other masks. */
    public int maskedPixelCount() {
        return maskedPixelCount;
    }

    public RgbColor pixel(int x, int y) {
        int offset = (y * width + x) * 3;
        return new RgbColor(rgb[offset] & 0xFF, rgb[offset + 1] & 0xFF, rgb[offset + 2] & 0xFF);
    }

    /** ARGB image for hosts; masked pixels get alpha 0. */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int pos = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = rgb[pos++] & 0xFF;
                int g = rgb[pos++] & 0xFF;
                int b = rgb[pos++] & 0xFF;
                int alpha = mask != null && mask.isTransparent(this, x, y) ? 0 : 0xFF;
                image.setRGB(x, y, (alpha << 24) | (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    @Override
    public String toString() {
        return "Bitmap[" + width + "x" + height + (mask != null ? ", masked" : "") + "]";
    }
}

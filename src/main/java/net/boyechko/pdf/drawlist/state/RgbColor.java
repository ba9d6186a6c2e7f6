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
package net.boyechko.pdf.drawlist.state;

/** An opaque 8-bit-per-channel RGB color. */
public record RgbColor(int red, int green, int blue) {
    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor WHITE = new RgbColor(255, 255, 255);

    public RgbColor {
        if (!inByteRange(red) || !inByteRange(green) || !inByteRange(blue)) {
            throw new IllegalArgumentException(
                    "RGB components must be in 0..255: " + red + "," + green + "," + blue);
        }
    }

    /** RGB operands in 0..1; each channel is truncated after scaling to 0..255. */
    public static RgbColor fromRgb(double r, double g, double b) {
        return new RgbColor(truncate(r), truncate(g), truncate(b));
    }

    /** Grayscale (0=black, 1=white) replicated across all three channels. */
    public static RgbColor fromGray(double gray) {
        int level = round(gray);
        return new RgbColor(level, level, level);
    }

    /** R=(1-C)(1-K), G=(1-M)(1-K), B=(1-Y)(1-K). */
    public static RgbColor fromCmyk(double c, double m, double y, double k) {
        double black = 1 - clamp(k);
        return new RgbColor(
                round((1 - clamp(c)) * black),
                round((1 - clamp(m)) * black),
                round((1 - clamp(y)) * black));
    }

    /** Composes this color with a transparency in 0..1 (1 = opaque). */
    public RgbaColor withAlpha(double transparency) {
        return new RgbaColor(red, green, blue, round(transparency));
    }

    private static int truncate(double unit) {
        return (int) (clamp(unit) * 255);
    }

    private static int round(double unit) {
        return (int) Math.round(clamp(unit) * 255);
    }

    private static double clamp(double unit) {
        if (Double.isNaN(unit)) return 0;
        return Math.max(0.0, Math.min(1.0, unit));
    }

    private static boolean inByteRange(int value) {
        return value >= 0 && value <= 255;
    }
}

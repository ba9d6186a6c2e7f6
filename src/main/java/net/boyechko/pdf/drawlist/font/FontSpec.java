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

import java.util.Locale;

/** A descriptor at a concrete point size. */
public record FontSpec(FontDescriptor descriptor, double size) {
    public static final double MIN_SIZE = 1.0;

    public FontSpec {
        if (!(size > 0)) {
            throw new IllegalArgumentException("Font size must be positive: " + size);
        }
    }

    /** A font at {@code size}, raised to {@link #MIN_SIZE} when smaller. */
    public static FontSpec of(FontDescriptor descriptor, double size) {
        return new FontSpec(descriptor, Math.max(MIN_SIZE, size));
    }

    public FontSpec scaled(double factor) {
        return new FontSpec(descriptor, size * factor);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(descriptor.faceName());
        if (descriptor.bold()) sb.append(" Bold");
        if (descriptor.italic()) sb.append(" Italic");
        sb.append(' ').append(String.format(Locale.ROOT, "%.1f", size)).append("pt");
        return sb.toString();
    }
}

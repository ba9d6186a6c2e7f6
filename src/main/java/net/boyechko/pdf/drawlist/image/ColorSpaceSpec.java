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

/** The declared colour space of an image, reduced to the cases the pipeline distinguishes. */
public sealed interface ColorSpaceSpec {

    String name();

    record DeviceRgb() implements ColorSpaceSpec {
        @Override
        public String name() {
            return "DeviceRGB";
        }
    }

    record DeviceGray() implements ColorSpaceSpec {
        @Override
        public String name() {
            return "DeviceGray";
        }
    }

    /**
     * A palette colour space.
     *
     * @param hival highest valid index
     * @param lookup packed base-space entries, {@code hival + 1} of them
     */
    record Indexed(ColorSpaceSpec base, int hival, byte[] lookup) implements ColorSpaceSpec {
        @Override
        public String name() {
            return "Indexed/" + base.name();
        }
    }

    /** Any colour space the pipeline cannot convert: CMYK, Lab, ICCBased, Cal*, Pattern… */
    record Unsupported(String name) implements ColorSpaceSpec {}

    /** No {@code /ColorSpace} entry, as for stencil masks. */
    record Absent() implements ColorSpaceSpec {
        @Override
        public String name() {
            return "none";
        }
    }
}

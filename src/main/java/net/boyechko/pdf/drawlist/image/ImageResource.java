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

/**
 * An image XObject or inline image as the decode pipeline sees it.
 *
 * @param filters declared filter chain in declaration order
 * @param mask colour-key or explicit mask, or null
 * @param data the still-encoded payload
 */
public record ImageResource(
        int width,
        int height,
        int bitsPerComponent,
        ColorSpaceSpec colorSpace,
        List<FilterStage> filters,
        ImageMaskSpec mask,
        byte[] data) {

    public ImageResource {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Image size must be positive: " + width + "x" + height);
        }
        filters = List.copyOf(filters);
    }

    public boolean hasFilter(StreamFilter filter) {
        return filters.stream().anyMatch(stage -> stage.filter().orElse(null) == filter);
    }

    /** The stage declaring {@code filter}, or null when the chain does not use it. */
    public FilterStage stage(StreamFilter filter) {
        return filters.stream()
                .filter(stage -> stage.filter().orElse(null) == filter)
                .findFirst()
                .orElse(null);
    }

    @Override
    public String toString() {
        return "ImageResource["
                + width
                + "x"
                + height
                + "x"
                + bitsPerComponent
                + ", "
                + colorSpace.name()
                + ", filters="
                + filters.stream().map(FilterStage::name).toList()
                + ", "
                + data.length
                + " bytes]";
    }
}

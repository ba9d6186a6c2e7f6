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

import java.util.List;
import net.boyechko.pdf.drawlist.path.FillRule;
import net.boyechko.pdf.drawlist.path.PathSegment;

/**
 * A clipping path recorded by {@code W}/{@code W*}. Regions are kept on the graphics state so
 * the shape is available to a backend, but they are never intersected with painting.
 */
public record ClipRegion(List<PathSegment> segments, FillRule rule) {
    public ClipRegion {
        segments = List.copyOf(segments);
    }
}

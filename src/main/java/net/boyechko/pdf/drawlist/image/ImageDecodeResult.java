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

import net.boyechko.pdf.drawlist.issue.IssueType;

/** Outcome of decoding one image: a bitmap, or the reason none was produced. */
public sealed interface ImageDecodeResult {

    record Decoded(Bitmap bitmap) implements ImageDecodeResult {}

    /**
     * @param cause key identifying the distinct cause, e.g. the filter or colour-space name
     */
    record Skipped(IssueType reason, String cause, String detail) implements ImageDecodeResult {}
}

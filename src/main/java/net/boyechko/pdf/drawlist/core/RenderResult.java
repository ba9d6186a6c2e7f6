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
package net.boyechko.pdf.drawlist.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.drawlist.issue.IssueList;
import net.boyechko.pdf.drawlist.issue.IssueType;

/**
 * Outcome of one render session.
 *
 * @param pages drawings of the rendered pages, in page order
 * @param issues every issue reported during the session
 * @param missingFonts base fonts that had no known substitute, in first-seen order
 */
public record RenderResult(List<PageDrawing> pages, IssueList issues, Set<String> missingFonts) {

    public RenderResult {
        pages = List.copyOf(pages);
        missingFonts = Collections.unmodifiableSet(new LinkedHashSet<>(missingFonts));
    }

    public int totalCommands() {
        return pages.stream().mapToInt(p -> p.commands().size()).sum();
    }

    public int totalBitmaps() {
        return pages.stream().mapToInt(PageDrawing::bitmapCount).sum();
    }

    public long failedPages() {
        return issues.countOf(IssueType.PAGE_FAILED);
    }
}

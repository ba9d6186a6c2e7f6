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

import net.boyechko.pdf.drawlist.issue.Issue;

/** Interface for reporting progress and results of rendering a document. */
public interface RenderListener {
    void onDocumentStart(int pageCount);

    void onPageStart(int pageNum);

    void onPageRendered(PageDrawing drawing);

    void onSummary(RenderResult result);

    default void onIssue(Issue issue) {}

    default void onInfo(String message) {}

    default void onError(String message) {}

    /** A listener that ignores every event. */
    static RenderListener silent() {
        return new RenderListener() {
            @Override
            public void onDocumentStart(int pageCount) {}

            @Override
            public void onPageStart(int pageNum) {}

            @Override
            public void onPageRendered(PageDrawing drawing) {}

            @Override
            public void onSummary(RenderResult result) {}
        };
    }
}

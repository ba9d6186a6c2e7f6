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

/**
 * An inclusive, 1-based page range. {@code last == null} means "to the end of the document".
 */
public record PageRange(int first, Integer last) {

    public PageRange {
        if (first < 1) {
            throw new IllegalArgumentException("First page must be at least 1: " + first);
        }
        if (last != null && last < first) {
            throw new IllegalArgumentException("Page range is reversed: " + first + "-" + last);
        }
    }

    public static PageRange all() {
        return new PageRange(1, null);
    }

    /** Parses {@code N} or {@code N-M}. */
    public static PageRange parse(String text) {
        String value = text.trim();
        try {
            int dash = value.indexOf('-');
            if (dash < 0) {
                int page = Integer.parseInt(value);
                return new PageRange(page, page);
            }
            return new PageRange(
                    Integer.parseInt(value.substring(0, dash).trim()),
                    Integer.parseInt(value.substring(dash + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page range: " + text, e);
        }
    }

    /** First page to render in a document with {@code pageCount} pages. */
    public int firstIn(int pageCount) {
        return Math.min(first, pageCount + 1);
    }

    /** Last page to render in a document with {@code pageCount} pages. */
    public int lastIn(int pageCount) {
        return last == null ? pageCount : Math.min(last, pageCount);
    }

    @Override
    public String toString() {
        return last == null ? first + "-" : first + "-" + last;
    }
}

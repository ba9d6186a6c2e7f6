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
package net.boyechko.pdf.drawlist.issue;

/**
 * Where an issue was found: page number, the resource scope being interpreted, and the
 * operator being dispatched. Any component may be null.
 */
public record IssueLoc(Integer pageNum, String scopeId, String operator) {

    public static IssueLoc none() {
        return new IssueLoc(null, null, null);
    }

    public static IssueLoc atPage(int pageNum) {
        return new IssueLoc(pageNum, null, null);
    }

    public static IssueLoc inScope(String scopeId) {
        return new IssueLoc(null, scopeId, null);
    }

    public static IssueLoc atOperator(Integer pageNum, String scopeId, String operator) {
        return new IssueLoc(pageNum, scopeId, operator);
    }

    /** Returns page number if available, null otherwise. */
    public Integer page() {
        return pageNum;
    }

    public IssueLoc withPage(Integer page) {
        return new IssueLoc(page, scopeId, operator);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (pageNum != null) {
            sb.append("page ").append(pageNum);
        }
        if (scopeId != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("scope ").append(scopeId);
        }
        if (operator != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("operator '").append(operator).append("'");
        }
        return sb.toString();
    }
}

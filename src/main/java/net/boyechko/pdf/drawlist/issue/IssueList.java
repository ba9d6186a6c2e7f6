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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** List of issues collected while rendering one or more pages. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    /** Returns the subset of this list with the given type. */
    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public long countOf(IssueType type) {
        return stream().filter(issue -> issue.type() == type).count();
    }

    /** Returns true if any issue has ERROR severity. */
    public boolean hasErrors() {
        return stream().anyMatch(issue -> issue.severity() == IssueSev.ERROR);
    }

    /** Groups issues by type, preserving first-seen order. */
    public Map<IssueType, IssueList> groupedByType() {
        return stream()
                .collect(
                        Collectors.groupingBy(
                                Issue::type,
                                LinkedHashMap::new,
                                Collectors.toCollection(IssueList::new)));
    }
}

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

import java.util.HashSet;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects issues for one interpreter or document session. Each (type, cause) pair is
 * reported at most once; later occurrences are only logged at debug level.
 */
public class IssueReporter {
    private static final Logger logger = LoggerFactory.getLogger(IssueReporter.class);

    private final IssueList issues = new IssueList();
    private final Set<String> reportedCauses = new HashSet<>();
    private final Consumer<Issue> sink;
    private Integer currentPage;

    public IssueReporter() {
        this(issue -> {});
    }

    public IssueReporter(Consumer<Issue> sink) {
        this.sink = sink != null ? sink : issue -> {};
    }

    /** Sets the page number attached to subsequent issues; null outside page processing. */
    public void setCurrentPage(Integer pageNum) {
        this.currentPage = pageNum;
    }

    public Integer currentPage() {
        return currentPage;
    }

    /**
     * Reports an issue unless the same type and cause key was already reported.
     *
     * @return true if the issue was recorded, false if it was a repeat
     */
    public boolean reportOnce(
            IssueType type, IssueSev sev, String causeKey, IssueLoc where, String message) {
        String key = type.name() + "\u0000" + causeKey;
        if (!reportedCauses.add(key)) {
            logger.debug("Repeated {} ({}): {}", type, causeKey, message);
            return false;
        }
        report(type, sev, where, message);
        return true;
    }

    /** Reports an issue unconditionally. */
    public void report(IssueType type, IssueSev sev, IssueLoc where, String message) {
        IssueLoc located = where;
        if (located == null) {
            located = IssueLoc.none();
        }
        if (located.pageNum() == null && currentPage != null) {
            located = located.withPage(currentPage);
        }
        Issue issue = new Issue(type, sev, located, message);
        switch (sev) {
            case ERROR -> logger.error("{}", issue);
            case WARNING -> logger.warn("{}", issue);
            case INFO -> logger.info("{}", issue);
        }
        issues.add(issue);
        sink.accept(issue);
    }

    public IssueList issues() {
        return issues;
    }

    public boolean wasReported(IssueType type, String causeKey) {
        return reportedCauses.contains(type.name() + "\u0000" + causeKey);
    }
}

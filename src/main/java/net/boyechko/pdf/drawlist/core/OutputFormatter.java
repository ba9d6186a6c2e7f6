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

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.issue.Issue;
import net.boyechko.pdf.drawlist.issue.IssueList;
import net.boyechko.pdf.drawlist.issue.IssueType;

/** Prints render progress, command listings and summaries in boxed sections. */
public class OutputFormatter {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "✗";
    private static final String WARNING = "▸";
    private static final String INFO = "ℹ";

    private static final String INDENT = "│ ";
    private static final int BOX_WIDTH = 68;
    private static final int SUMMARY_WIDTH = BOX_WIDTH + 2;

    private boolean boxOpen = false;

    public OutputFormatter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
    }

    public void printDocumentHeader(String inputPath, int pageCount) {
        String pages = pageCount == 1 ? "1 page" : pageCount + " pages";
        printLine(inputPath + " (" + pages + ")", INFO);
    }

    public void printPageHeader(PageDrawing drawing) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            return;
        }
        closeBoxIfOpen();
        String title =
                String.format(
                        Locale.ROOT,
                        "Page %d  %.0f x %.0f",
                        drawing.pageNum(),
                        drawing.width(),
                        drawing.height());
        int filler = Math.max(0, BOX_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "┐");
        boxOpen = true;
    }

    /** Prints the page's command count, and every command when verbose. */
    public void printCommands(PageDrawing drawing) {
        List<DrawCommand> commands = drawing.commands();
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            int depth = 0;
            for (DrawCommand command : commands) {
                if (command instanceof DrawCommand.PopState) {
                    depth = Math.max(0, depth - 1);
                }
                printDetail("  ".repeat(depth) + command.describe());
                if (command instanceof DrawCommand.PushState) {
                    depth++;
                }
            }
        }
        printLine(
                commands.size() + " command(s), " + drawing.bitmapCount() + " bitmap(s)",
                commands.isEmpty() ? WARNING : SUCCESS);
    }

    public void printIssueGroup(String groupLabel, List<Issue> issues) {
        if (issues.isEmpty()) return;

        Set<Integer> pages =
                issues.stream()
                        .map(i -> i.where().page())
                        .filter(Objects::nonNull)
                        .collect(Collectors.toCollection(TreeSet::new));

        printWarning(buildGroupSummary(groupLabel, issues.size(), pages));

        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            for (Issue issue : issues) {
                printDetail(issue.message());
            }
        }
    }

    public void printSummary(RenderResult result) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            return;
        }
        closeBoxIfOpen();
        String title = "Summary";
        int pad = Math.max(0, SUMMARY_WIDTH - ("┏━ " + title).length());
        output.println(INDENT + "┏━ " + title + " " + "━".repeat(pad) + "┓");

        printLine(
                result.pages().size()
                        + " page(s), "
                        + result.totalCommands()
                        + " command(s), "
                        + result.totalBitmaps()
                        + " bitmap(s)",
                SUCCESS);
        IssueList issues = result.issues();
        if (issues.isEmpty()) {
            printLine("No issues", SUCCESS);
        } else {
            for (Map.Entry<IssueType, IssueList> group : issues.groupedByType().entrySet()) {
                printIssueGroup(group.getKey().groupLabel(), group.getValue());
            }
        }
        if (!result.missingFonts().isEmpty()) {
            printLine("Missing fonts: " + String.join(", ", result.missingFonts()), INFO);
        }
        output.println(INDENT + "┗" + "━".repeat(SUMMARY_WIDTH) + "┛");
    }

    public void printSuccess(String message) {
        printLine(message, SUCCESS);
    }

    public void printError(String message) {
        closeBoxIfOpen();
        output.println(INDENT + ERROR + " " + message);
    }

    public void printWarning(String message) {
        printLine(message, WARNING);
    }

    public void printInfo(String message) {
        printLine(message, INFO);
    }

    public void printDetail(String message) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            output.println(INDENT + "  " + message);
        }
    }

    public boolean isAtLeast(VerbosityLevel level) {
        return verbosity.isAtLeast(level);
    }

    public void finish() {
        closeBoxIfOpen();
    }

    private void closeBoxIfOpen() {
        if (boxOpen) {
            output.println("└" + "─".repeat(BOX_WIDTH + 2) + "┘");
            boxOpen = false;
        }
    }

    private void printLine(String message, String icon) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            output.println(INDENT + icon + " " + message);
        }
    }

    private String buildGroupSummary(String groupLabel, int count, Set<Integer> pages) {
        StringBuilder sb = new StringBuilder();
        sb.append(count).append(" ").append(groupLabel);

        if (!pages.isEmpty()) {
            sb.append(" (");
            if (pages.size() == 1) {
                sb.append("page ").append(pages.iterator().next());
            } else {
                sb.append("pages ").append(formatPageRange(pages));
            }
            sb.append(")");
        }
        return sb.toString();
    }

    private static String formatPageRange(Set<Integer> pages) {
        int min = pages.stream().min(Integer::compareTo).orElse(0);
        int max = pages.stream().max(Integer::compareTo).orElse(0);
        if (max - min + 1 == pages.size()) {
            return min + "-" + max;
        }
        return pages.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}

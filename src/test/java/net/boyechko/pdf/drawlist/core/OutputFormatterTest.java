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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.issue.Issue;
import net.boyechko.pdf.drawlist.issue.IssueList;
import net.boyechko.pdf.drawlist.issue.IssueLoc;
import net.boyechko.pdf.drawlist.issue.IssueSev;
import net.boyechko.pdf.drawlist.issue.IssueType;
import org.junit.jupiter.api.Test;

public class OutputFormatterTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @Test
    void rendersMockRunForVisualTuning() {
        OutputFormatter formatter = formatter(VerbosityLevel.VERBOSE);
        formatter.printDocumentHeader("samples/brochure.pdf", 2);
        formatter.printPageHeader(samplePage(1));
        formatter.printCommands(samplePage(1));
        formatter.printPageHeader(PageDrawing.empty(2, 612, 792));
        formatter.printCommands(PageDrawing.empty(2, 612, 792));
        formatter.printSummary(sampleResult());
        formatter.printSuccess("3 image(s) written to out");

        String rendered = normalize(buffer);

        System.out.println("--- Mocked Output Preview ---");
        System.out.print(rendered);
        System.out.println("--- End Preview ---");
    }

    @Test
    void normalOutputShowsTotalsButNotCommands() {
        OutputFormatter formatter = formatter(VerbosityLevel.NORMAL);
        formatter.printPageHeader(samplePage(1));
        formatter.printCommands(samplePage(1));

        String rendered = normalize(buffer);
        assertTrue(rendered.contains("Page 1  595 x 842"));
        assertTrue(rendered.contains("4 command(s), 0 bitmap(s)"));
        assertFalse(rendered.contains("DrawText"));
    }

    @Test
    void verboseOutputIndentsSavedState() {
        OutputFormatter formatter = formatter(VerbosityLevel.VERBOSE);
        formatter.printCommands(samplePage(1));

        assertTrue(normalize(buffer).contains("    DrawText(\"Hi\", 10.00, -20.00)"));
    }

    @Test
    void summaryGroupsIssuesByType() {
        formatter(VerbosityLevel.NORMAL).printSummary(sampleResult());

        String rendered = normalize(buffer);
        assertTrue(rendered.contains("Summary"));
        assertTrue(rendered.contains("1 page(s), 4 command(s), 0 bitmap(s)"));
        assertTrue(rendered.contains("2 unknown content stream operators (pages 1-2)"));
        assertTrue(rendered.contains("1 fonts without a known substitute (page 1)"));
        assertTrue(rendered.contains("Missing fonts: ComicSans"));
    }

    @Test
    void summaryWithoutIssuesSaysSo() {
        RenderResult clean = new RenderResult(List.of(samplePage(1)), new IssueList(), Set.of());

        formatter(VerbosityLevel.NORMAL).printSummary(clean);

        assertTrue(normalize(buffer).contains("No issues"));
    }

    @Test
    void quietOutputOmitsEverythingButErrors() {
        OutputFormatter formatter = formatter(VerbosityLevel.QUIET);
        formatter.printPageHeader(samplePage(1));
        formatter.printCommands(samplePage(1));
        formatter.printSummary(sampleResult());
        assertEquals("", normalize(buffer));

        formatter.printError("Rendering failed");
        assertTrue(normalize(buffer).contains("✗ Rendering failed"));
    }

    // == helpers ==

    private OutputFormatter formatter(VerbosityLevel verbosity) {
        return new OutputFormatter(
                new PrintStream(buffer, true, StandardCharsets.UTF_8), verbosity);
    }

    private static PageDrawing samplePage(int pageNum) {
        return new PageDrawing(
                pageNum,
                595,
                842,
                List.of(
                        new DrawCommand.PushState(),
                        new DrawCommand.ConcatTransform(1, 0, 0, 1, 0, 0),
                        new DrawCommand.DrawText("Hi", 10, -20),
                        new DrawCommand.PopState()));
    }

    private static RenderResult sampleResult() {
        IssueList issues = new IssueList();
        issues.add(
                new Issue(
                        IssueType.UNKNOWN_OPERATOR,
                        IssueSev.WARNING,
                        IssueLoc.atOperator(1, "page-1", "xx"),
                        "Operator 'xx' is not recognised"));
        issues.add(
                new Issue(
                        IssueType.UNKNOWN_FONT,
                        IssueSev.INFO,
                        IssueLoc.atPage(1),
                        "No substitute for ComicSans"));
        issues.add(
                new Issue(
                        IssueType.UNKNOWN_OPERATOR,
                        IssueSev.WARNING,
                        IssueLoc.atOperator(2, "page-2", "yy"),
                        "Operator 'yy' is not recognised"));
        return new RenderResult(List.of(samplePage(1)), issues, Set.of("ComicSans"));
    }

    private String normalize(ByteArrayOutputStream buffer) {
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }
}

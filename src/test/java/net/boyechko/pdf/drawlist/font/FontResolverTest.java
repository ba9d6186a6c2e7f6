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
package net.boyechko.pdf.drawlist.font;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import net.boyechko.pdf.drawlist.issue.IssueReporter;
import net.boyechko.pdf.drawlist.issue.IssueSev;
import net.boyechko.pdf.drawlist.issue.IssueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test suite for FontResolver. */
public class FontResolverTest {

    private IssueReporter reporter;
    private FontResolver resolver;

    @BeforeEach
    void setUp() {
        reporter = new IssueReporter();
        resolver = new FontResolver(reporter);
    }

    @Test
    void knownFontIsNotReported() {
        FontDescriptor font = resolver.resolve("Courier-Bold");

        assertEquals(FontFamily.MONOSPACE, font.family());
        assertTrue(font.bold());
        assertTrue(resolver.missingFonts().isEmpty());
        assertTrue(reporter.issues().isEmpty());
    }

    @Test
    void unknownFontsAreCollectedOnceInOrder() {
        resolver.resolve("Futura");
        resolver.resolve("Optima");
        resolver.resolve("Futura");

        assertEquals(List.of("Futura", "Optima"), List.copyOf(resolver.missingFonts()));
        assertEquals(2, reporter.issues().countOf(IssueType.UNKNOWN_FONT));
        assertEquals(IssueSev.INFO, reporter.issues().get(0).severity());
    }

    @Test
    void blankNameResolvesToDefault() {
        assertEquals(resolver.defaultFont(), resolver.resolve(""));
        assertEquals(resolver.defaultFont(), resolver.resolve(null));
        assertTrue(resolver.missingFonts().isEmpty());
    }

    @Test
    void defaultFontIsHelveticaSubstitute() {
        FontDescriptor font = resolver.defaultFont();

        assertEquals("Helvetica", font.baseFont());
        assertEquals("Arial", font.faceName());
        assertTrue(font.known());
    }

    @Test
    void missingFontsViewIsReadOnly() {
        resolver.resolve("Futura");
        Set<String> missing = resolver.missingFonts();

        assertThrows(UnsupportedOperationException.class, () -> missing.add("Optima"));
    }

    @Test
    void customTableDrivesResolution() {
        FontResolver custom =
                new FontResolver(
                        reporter, FontSubstitutions.fromResource("/font-substitutions-mono.yaml"));

        assertEquals("DejaVu Sans Mono", custom.resolve("Helvetica").faceName());
        assertEquals(Set.of("Helvetica"), custom.missingFonts());
    }

    @Test
    void standardMetricsOnlyForKnownFonts() {
        StandardFontMetrics metrics = new StandardFontMetrics();

        assertTrue(metrics.width("abc", resolver.resolve("Helvetica"), 10).isPresent());
        assertTrue(metrics.width("abc", resolver.resolve("Futura"), 10).isEmpty());
        assertEquals(
                "Helvetica-BoldOblique",
                StandardFontMetrics.standardName(resolver.resolve("Arial,BoldItalic")));
    }
}

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
package net.boyechko.pdf.drawlist.interpret;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.command.DrawCommand.DrawText;
import net.boyechko.pdf.drawlist.command.DrawCommand.SetFont;
import net.boyechko.pdf.drawlist.font.FontResolver;
import net.boyechko.pdf.drawlist.font.FontSpec;
import net.boyechko.pdf.drawlist.font.TextExtent;
import net.boyechko.pdf.drawlist.font.TextMetrics;
import net.boyechko.pdf.drawlist.issue.IssueReporter;
import net.boyechko.pdf.drawlist.issue.IssueType;
import net.boyechko.pdf.drawlist.state.GraphicsState;
import net.boyechko.pdf.drawlist.state.RgbColor;
import net.boyechko.pdf.drawlist.state.RgbaColor;
import net.boyechko.pdf.drawlist.state.TextMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test suite for TextLayout. */
public class TextLayoutTest {

    // 5 units per character for standard fonts
    private static final TextMetrics FIXED_METRICS =
            (text, font, size) -> OptionalDouble.of(text.length() * 5.0);

    private final List<FontSpec> measuredWith = new ArrayList<>();
    // 4 units per character, height 12, descent 2
    private final TextExtent fixedExtent =
            (text, font) -> {
                measuredWith.add(font);
                return new TextExtent.Extent(text.length() * 4.0, 12, 2);
            };

    private IssueReporter reporter;
    private FontResolver fontResolver;
    private GraphicsState state;

    @BeforeEach
    void setUp() {
        reporter = new IssueReporter();
        fontResolver = new FontResolver(reporter);
        state = new GraphicsState();
        state.setTextMatrices(TextMatrix.translation(50, 100));
    }

    @Test
    void knownFontUsesPreciseMetrics() {
        state.setFont("F1", "Helvetica", 10);
        state.setFillColor(new RgbColor(0, 0, 255));

        List<DrawCommand> out = layout(1.0, 1.0).show(bytes("Hello"), state);

        assertEquals(2, out.size());
        SetFont setFont = (SetFont) out.get(0);
        assertEquals("Arial", setFont.displayFont().descriptor().faceName());
        assertEquals(10.0, setFont.displayFont().size());
        assertEquals(new RgbaColor(0, 0, 255, 255), setFont.color());
        assertEquals(new DrawText("Hello", 50, -110), out.get(1));
        assertEquals(75.0, state.textX());
    }

    @Test
    void unknownFontFallsBackToDeviceExtent() {
        state.setFont("F1", "ComicSans", 10);

        layout(1.0, 1.0).show(bytes("abc"), state);

        assertEquals(62.0, state.textX());
        assertTrue(fontResolver.missingFonts().contains("ComicSans"));
        assertEquals(1, reporter.issues().countOf(IssueType.UNKNOWN_FONT));
    }

    @Test
    void wordSpacingSplitsIntoRuns() {
        state.setFont("F1", "Helvetica", 10);
        state.setWordSpacing(3);

        List<DrawCommand> out = layout(1.0, 1.0).show(bytes("a b"), state);

        assertEquals(3, out.size());
        assertEquals(new DrawText("a ", 50, -110), out.get(1));
        // "a " is 10 wide, plus 3 word spacing
        assertEquals(new DrawText("b ", 63, -110), out.get(2));
    }

    @Test
    void runsKeepTrailingSpace() {
        assertEquals(List.of("ab"), TextLayout.runs("ab", 0));
        assertEquals(List.of("a ", "b "), TextLayout.runs("a b", 1));
        assertEquals(List.of("a ", " "), TextLayout.runs("a ", 1));
    }

    @Test
    void textRiseLiftsBaseline() {
        state.setFont("F1", "Helvetica", 10);
        state.setTextRise(5);

        List<DrawCommand> out = layout(1.0, 1.0).show(bytes("x"), state);

        assertEquals(-115.0, ((DrawText) out.get(1)).y());
    }

    @Test
    void displayAndMetricsFontsScaleIndependently() {
        state.setFont("F1", "Times-Roman", 10);

        List<DrawCommand> out = layout(0.5, 2.0).show(bytes("x"), state);

        SetFont setFont = (SetFont) out.get(0);
        assertEquals(20.0, setFont.displayFont().size());
        assertEquals(5.0, setFont.metricsFont().size());
        assertEquals(5.0, measuredWith.get(0).size());
    }

    @Test
    void missingFontUsesDefaultAtMinimumSize() {
        List<DrawCommand> out = layout(1.0, 1.0).show(bytes("x"), state);

        SetFont setFont = (SetFont) out.get(0);
        assertEquals(fontResolver.defaultFont(), setFont.displayFont().descriptor());
        assertEquals(FontSpec.MIN_SIZE, setFont.displayFont().size());
    }

    // == helpers ==

    private TextLayout layout(double metricsScale, double sizeScale) {
        return new TextLayout(fontResolver, FIXED_METRICS, fixedExtent, metricsScale, sizeScale);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }
}

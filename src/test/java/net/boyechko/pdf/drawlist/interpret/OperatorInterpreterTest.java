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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.command.DrawCommand.AddRectangle;
import net.boyechko.pdf.drawlist.command.DrawCommand.ConcatTransform;
import net.boyechko.pdf.drawlist.command.DrawCommand.CreatePath;
import net.boyechko.pdf.drawlist.command.DrawCommand.DrawBitmap;
import net.boyechko.pdf.drawlist.command.DrawCommand.DrawPath;
import net.boyechko.pdf.drawlist.command.DrawCommand.DrawText;
import net.boyechko.pdf.drawlist.command.DrawCommand.PopState;
import net.boyechko.pdf.drawlist.command.DrawCommand.PushState;
import net.boyechko.pdf.drawlist.command.DrawCommand.SetBrush;
import net.boyechko.pdf.drawlist.command.DrawCommand.SetFont;
import net.boyechko.pdf.drawlist.command.DrawCommand.SetPen;
import net.boyechko.pdf.drawlist.command.DrawKind;
import net.boyechko.pdf.drawlist.document.ItextContentTokenizer;
import net.boyechko.pdf.drawlist.document.PdfResourceScope;
import net.boyechko.pdf.drawlist.font.TextExtent;
import net.boyechko.pdf.drawlist.font.TextMetrics;
import net.boyechko.pdf.drawlist.issue.IssueReporter;
import net.boyechko.pdf.drawlist.issue.IssueType;
import net.boyechko.pdf.drawlist.path.Brush;
import net.boyechko.pdf.drawlist.path.FillRule;
import net.boyechko.pdf.drawlist.path.Pen;
import net.boyechko.pdf.drawlist.state.GraphicsState;
import net.boyechko.pdf.drawlist.state.RgbColor;
import net.boyechko.pdf.drawlist.state.RgbaColor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test suite for OperatorInterpreter over tokenized content and in-memory resources. */
public class OperatorInterpreterTest {

    private static final TextExtent FIXED_EXTENT =
            (text, font) -> new TextExtent.Extent(text.length() * 6.0, 12, 3);

    private IssueReporter reporter;
    private PdfDictionary resources;
    private OperatorInterpreter interpreter;

    @BeforeEach
    void setUp() {
        reporter = new IssueReporter();
        resources = new PdfDictionary();
        interpreter = interpreterBuilder().build();
    }

    // ── Graphics state ──────────────────────────────────────────────

    @Test
    void concatFlipsIntoDeviceSpace() throws Exception {
        List<DrawCommand> out = interpret("1 2 3 4 10 20 cm").commands();

        assertEquals(List.of(new ConcatTransform(1, -2, -3, 4, 10, -20)), out);
    }

    @Test
    void saveAndRestoreBracketStateChanges() throws Exception {
        InterpretationResult result = interpret("q 5 w 1 0 0 RG Q");

        assertEquals(List.of(new PushState(), new PopState()), result.commands());
        assertEquals(1.0, result.finalState().lineWidth());
        assertEquals(RgbColor.BLACK, result.finalState().strokeColor());
        assertEquals(0, result.implicitlyClosedSaves());
    }

    @Test
    void restoreWithoutSaveResetsToInitialState() throws Exception {
        InterpretationResult result = interpret("5 w Q 7 w Q");

        assertEquals(List.of(new PopState(), new PopState()), result.commands());
        assertEquals(1.0, result.finalState().lineWidth());
        assertEquals(1, reporter.issues().countOf(IssueType.STATE_STACK_UNDERFLOW));
    }

    @Test
    void openSavesAreClosedAtEndOfStream() throws Exception {
        InterpretationResult result = interpret("q 3 w q 4 w");

        assertEquals(
                List.of(new PushState(), new PushState(), new PopState(), new PopState()),
                result.commands());
        assertEquals(2, result.implicitlyClosedSaves());
        assertEquals(1.0, result.finalState().lineWidth());
        assertEquals(1, reporter.issues().countOf(IssueType.UNBALANCED_STATE_STACK));
    }

    @Test
    void extGStateEntriesAreApplied() throws Exception {
        PdfDictionary gs = new PdfDictionary();
        gs.put(new PdfName("LW"), new PdfNumber(4));
        gs.put(new PdfName("ca"), new PdfNumber(0.5));
        gs.put(new PdfName("D"), dash(new PdfArray(new float[] {3, 1}), 2));
        gs.put(new PdfName("TK"), PdfBoolean.TRUE);
        addResource(PdfName.ExtGState, "GS1", gs);

        GraphicsState state = interpret("/GS1 gs /GS1 gs").finalState();

        assertEquals(4.0, state.lineWidth());
        assertEquals(0.5, state.fillAlpha());
        assertEquals(List.of(3.0, 1.0), state.dashArray());
        assertEquals(2.0, state.dashPhase());
        assertEquals(1, reporter.issues().countOf(IssueType.UNHANDLED_EXTGSTATE_KEY));
    }

    @Test
    void missingExtGStateIsReported() throws Exception {
        interpret("/GS9 gs");

        assertEquals(1, reporter.issues().countOf(IssueType.MISSING_RESOURCE));
    }

    // ── Paths ───────────────────────────────────────────────────────

    @Test
    void filledRectangleEmitsPathCommands() throws Exception {
        List<DrawCommand> out = interpret("0 0 1 rg 10 10 50 20 re f").commands();

        assertEquals(
                List.of(
                        new SetPen(Pen.TRANSPARENT),
                        new SetBrush(new Brush(new RgbaColor(0, 0, 255, 255))),
                        new CreatePath(),
                        new AddRectangle(10, -30, 50, 20),
                        new DrawPath(FillRule.NONZERO_WINDING)),
                out);
    }

    @Test
    void strokeUsesCurrentPen() throws Exception {
        List<DrawCommand> out = interpret("0.5 G 3 w 1 J [2 1] 0 d 0 0 m 10 0 l S").commands();

        Pen pen = ((SetPen) out.get(0)).pen();
        assertEquals(new RgbaColor(128, 128, 128, 255), pen.color());
        assertEquals(3.0, pen.width());
        assertEquals(List.of(2.0, 1.0), pen.dashes());
        assertEquals(new SetBrush(Brush.TRANSPARENT), out.get(1));
    }

    @Test
    void clipPathIsRecordedNotPainted() throws Exception {
        InterpretationResult result = interpret("0 0 100 100 re W n");

        assertEquals(1, result.finalState().clipRegions().size());
        assertEquals(new SetPen(Pen.TRANSPARENT), result.commands().get(0));
    }

    // ── Text ────────────────────────────────────────────────────────

    @Test
    void shownTextIsPositionedFromTextMatrix() throws Exception {
        addFont("F1", "Helvetica-Bold");

        List<DrawCommand> out = interpret("BT /F1 12 Tf 100 700 Td (Hi) Tj ET").commands();

        assertEquals(2, out.size());
        SetFont setFont = (SetFont) out.get(0);
        assertTrue(setFont.displayFont().descriptor().bold());
        assertEquals(12.0, setFont.displayFont().size());
        assertEquals(new DrawText("Hi", 100, -709), out.get(1));
    }

    @Test
    void textPositionIsNotRoundedToFloat() throws Exception {
        addFont("F1", "Helvetica");

        List<DrawCommand> out = interpret("BT /F1 10 Tf 0.1 700.3 Td (A) Tj ET").commands();

        assertEquals(0.1, ((DrawText) out.get(1)).x());
        assertEquals(0.0 - 700.3 - 9, ((DrawText) out.get(1)).y());
    }

    @Test
    void textOperatorsOutsideTextObjectAreIgnored() throws Exception {
        addFont("F1", "Helvetica");

        List<DrawCommand> out = interpret("/F1 12 Tf (Hi) Tj 10 10 Td").commands();

        assertTrue(out.isEmpty());
    }

    @Test
    void nextLineUsesLeading() throws Exception {
        addFont("F1", "Courier");

        List<DrawCommand> out =
                interpret("BT /F1 10 Tf 14 TL 0 700 Td (a) Tj (b) ' ET").commands();

        assertEquals(new DrawText("b", 0, -(686 + 9)), out.get(3));
    }

    @Test
    void textArrayShowsEveryString() throws Exception {
        addFont("F1", "Times-Roman");

        List<DrawCommand> out = interpret("BT /F1 10 Tf [(A) -120 (B)] TJ ET").commands();

        assertEquals(4, out.size());
        assertEquals("A", ((DrawText) out.get(1)).text());
        assertEquals("B", ((DrawText) out.get(3)).text());
        assertEquals(6.0, ((DrawText) out.get(3)).x());
    }

    @Test
    void missingFontIsReportedAndDefaultUsed() throws Exception {
        List<DrawCommand> out = interpret("BT /F7 10 Tf (x) Tj ET").commands();

        assertEquals(1, reporter.issues().countOf(IssueType.MISSING_RESOURCE));
        assertEquals("Arial", ((SetFont) out.get(0)).displayFont().descriptor().faceName());
    }

    @Test
    void fontScalesReachSetFont() throws Exception {
        interpreter = interpreterBuilder().withFontScales(0.5, 2.0).build();
        addFont("F1", "Helvetica");

        SetFont setFont = (SetFont) interpret("BT /F1 10 Tf (x) Tj ET").commands().get(0);

        assertEquals(20.0, setFont.displayFont().size());
        assertEquals(5.0, setFont.metricsFont().size());
    }

    // ── Colour ──────────────────────────────────────────────────────

    @Test
    void namedDeviceColorSpaceIsResolved() throws Exception {
        addResource(PdfName.ColorSpace, "CS0", PdfName.DeviceGray);

        GraphicsState state = interpret("/CS0 cs 0.2 sc").finalState();

        assertEquals(new RgbColor(51, 51, 51), state.fillColor());
    }

    @Test
    void patternColorsAreUnsupported() throws Exception {
        GraphicsState state = interpret("1 0 0 rg /Pattern cs /P1 scn").finalState();

        assertEquals(RgbColor.BLACK, state.fillColor());
        assertEquals(1, reporter.issues().countOf(IssueType.UNSUPPORTED_COLOR_SPACE));
    }

    @Test
    void cmykOperatorsConvertToRgb() throws Exception {
        GraphicsState state = interpret("0 1 0 0 k 0 0 0 1 K").finalState();

        assertEquals(new RgbColor(255, 0, 255), state.fillColor());
        assertEquals(RgbColor.BLACK, state.strokeColor());
    }

    // ── Error handling ──────────────────────────────────────────────

    @Test
    void unknownOperatorIsReportedOnce() throws Exception {
        List<DrawCommand> out = interpret("1 zz 2 zz q Q").commands();

        assertEquals(List.of(new PushState(), new PopState()), out);
        assertEquals(1, reporter.issues().countOf(IssueType.UNKNOWN_OPERATOR));
    }

    @Test
    void malformedOperandsSkipOnlyThatOperator() throws Exception {
        InterpretationResult result = interpret("1 2 re (wide) w 4 w");

        assertEquals(4.0, result.finalState().lineWidth());
        assertEquals(2, reporter.issues().countOf(IssueType.MALFORMED_OPERANDS));
    }

    @Test
    void shadingIsUnsupported() throws Exception {
        interpret("/Sh1 sh /Sh1 sh");

        assertEquals(1, reporter.issues().countOf(IssueType.UNSUPPORTED_OPERATOR));
    }

    @Test
    void markedContentCarriesNoDrawing() throws Exception {
        assertTrue(interpret("/Span <</MCID 0>> BDC EMC /Artifact BMC EMC").commands().isEmpty());
        assertTrue(reporter.issues().isEmpty());
    }

    // ── XObjects ────────────────────────────────────────────────────

    @Test
    void imageXObjectBecomesBitmap() throws Exception {
        addResource(PdfName.XObject, "Im1", rgbImage(new byte[] {1, 2, 3}));

        List<DrawCommand> out = interpret("/Im1 Do").commands();

        DrawBitmap draw = (DrawBitmap) out.get(0);
        assertEquals(new RgbColor(1, 2, 3), draw.bitmap().pixel(0, 0));
        assertEquals(-1.0, draw.y());
        assertEquals(1.0, draw.width());
    }

    @Test
    void imageTransformIsFolded() throws Exception {
        addResource(PdfName.XObject, "Im1", rgbImage(new byte[] {1, 2, 3}));

        List<DrawCommand> out = interpret("q 200 0 0 100 10 20 cm /Im1 Do Q").commands();

        assertEquals(new ConcatTransform(1, 0, 0, 1, 10, -20), out.get(1));
        DrawBitmap draw = (DrawBitmap) out.get(2);
        assertEquals(-100.0, draw.y());
        assertEquals(200.0, draw.width());
        assertEquals(100.0, draw.height());
    }

    @Test
    void undecodableImageIsSkippedAndReported() throws Exception {
        PdfStream image = rgbImage(new byte[4]);
        image.put(PdfName.ColorSpace, PdfName.DeviceCMYK);
        addResource(PdfName.XObject, "Im1", image);

        assertTrue(interpret("/Im1 Do /Im1 Do").commands().isEmpty());
        assertEquals(1, reporter.issues().countOf(IssueType.UNSUPPORTED_COLOR_SPACE));
    }

    @Test
    void skippedImageDoesNotStopThePage() throws Exception {
        PdfStream image = rgbImage(new byte[4]);
        image.put(PdfName.ColorSpace, PdfName.DeviceCMYK);
        addResource(PdfName.XObject, "Im1", image);

        List<DrawCommand> out = interpret("/Im1 Do 0 0 10 10 re f").commands();

        assertTrue(out.stream().noneMatch(c -> c.kind() == DrawKind.DRAW_BITMAP));
        assertTrue(out.contains(new AddRectangle(0, -10, 10, 10)));
        assertEquals(DrawKind.DRAW_PATH, out.get(out.size() - 1).kind());
    }

    @Test
    void oversizedImageIsReportedAndPageContinues() throws Exception {
        PdfStream image = new PdfStream(new byte[16]);
        image.put(PdfName.Subtype, PdfName.Image);
        image.put(PdfName.Width, new PdfNumber(40000));
        image.put(PdfName.Height, new PdfNumber(40000));
        image.put(PdfName.BitsPerComponent, new PdfNumber(8));
        image.put(PdfName.ColorSpace, PdfName.DeviceGray);
        addResource(PdfName.XObject, "Im1", image);

        List<DrawCommand> out = interpret("/Im1 Do 0 0 10 10 re f").commands();

        assertEquals(1, reporter.issues().countOf(IssueType.IMAGE_DECODE_FAILED));
        assertTrue(out.stream().noneMatch(c -> c.kind() == DrawKind.DRAW_BITMAP));
        assertTrue(out.contains(new AddRectangle(0, -10, 10, 10)));
    }

    @Test
    void inlineImageBecomesBitmap() throws Exception {
        List<DrawCommand> out =
                interpret("q 20 0 0 10 5 5 cm BI /W 2 /H 1 /BPC 8 /CS /RGB ID abcdef EI Q")
                        .commands();

        assertEquals(DrawKind.DRAW_BITMAP, out.get(2).kind());
        DrawBitmap draw = (DrawBitmap) out.get(2);
        assertEquals(new RgbColor('a', 'b', 'c'), draw.bitmap().pixel(0, 0));
        assertEquals(new RgbColor('d', 'e', 'f'), draw.bitmap().pixel(1, 0));
        assertEquals(20.0, draw.width());
    }

    @Test
    void inlineImageInFormUsesFormColorSpaces() throws Exception {
        PdfDictionary colorSpaces = new PdfDictionary();
        colorSpaces.put(new PdfName("CS0"), PdfName.DeviceGray);
        PdfDictionary formResources = new PdfDictionary();
        formResources.put(PdfName.ColorSpace, colorSpaces);
        PdfStream form = form("BI /W 3 /H 1 /BPC 8 /CS /CS0 ID xyz EI");
        form.put(PdfName.Resources, formResources);
        addResource(PdfName.XObject, "Fm1", form);

        List<DrawCommand> out = interpret("/Fm1 Do").commands();

        DrawBitmap draw =
                (DrawBitmap)
                        out.stream()
                                .filter(c -> c.kind() == DrawKind.DRAW_BITMAP)
                                .findFirst()
                                .orElseThrow();
        assertEquals(new RgbColor('x', 'x', 'x'), draw.bitmap().pixel(0, 0));
        assertEquals(3, draw.bitmap().width());
        assertTrue(reporter.issues().isEmpty());
    }

    @Test
    void formIsExpandedInsideSaveRestore() throws Exception {
        PdfStream form = form("0 0 10 10 re f");
        form.put(PdfName.Matrix, new PdfArray(new float[] {2, 0, 0, 2, 5, 5}));
        addResource(PdfName.XObject, "Fm1", form);

        List<DrawCommand> out = interpret("/Fm1 Do /Fm1 Do").commands();

        List<DrawCommand> expansion =
                List.of(
                        new PushState(),
                        new ConcatTransform(2, 0, 0, 2, 5, -5),
                        new SetPen(Pen.TRANSPARENT),
                        new SetBrush(new Brush(new RgbaColor(0, 0, 0, 255))),
                        new CreatePath(),
                        new AddRectangle(0, -10, 10, 10),
                        new DrawPath(FillRule.NONZERO_WINDING),
                        new PopState());
        assertEquals(expansion, out.subList(0, 8));
        assertEquals(expansion, out.subList(8, 16));
        assertEquals(1, interpreter.formCache().expansionCount());
    }

    @Test
    void formStateChangesDoNotLeak() throws Exception {
        addResource(PdfName.XObject, "Fm1", form("9 w 1 0 0 rg"));

        GraphicsState state = interpret("/Fm1 Do").finalState();

        assertEquals(1.0, state.lineWidth());
        assertEquals(RgbColor.BLACK, state.fillColor());
    }

    @Test
    void unbalancedFormSavesAreClosed() throws Exception {
        addResource(PdfName.XObject, "Fm1", form("q q"));

        List<DrawCommand> out = interpret("/Fm1 Do").commands();

        long pushes = out.stream().filter(c -> c.kind() == DrawKind.PUSH_STATE).count();
        long pops = out.stream().filter(c -> c.kind() == DrawKind.POP_STATE).count();
        assertEquals(pushes, pops);
    }

    @Test
    void recursiveFormIsCut() throws Exception {
        addResource(PdfName.XObject, "Fm1", form("/Fm1 Do"));

        List<DrawCommand> out = interpret("/Fm1 Do").commands();

        assertEquals(
                List.of(new PushState(), new ConcatTransform(1, 0, 0, 1, 0, 0), new PopState()),
                out);
        assertEquals(1, reporter.issues().countOf(IssueType.RECURSIVE_FORM));
    }

    @Test
    void formDepthIsLimited() throws Exception {
        interpreter = interpreterBuilder().withMaxFormDepth(1).build();
        addResource(PdfName.XObject, "Fm1", form("/Fm2 Do"));
        addResource(PdfName.XObject, "Fm2", form("0 0 1 1 re f"));

        List<DrawCommand> out = interpret("/Fm1 Do").commands();

        assertTrue(out.stream().noneMatch(c -> c.kind() == DrawKind.DRAW_PATH));
        assertEquals(1, reporter.issues().countOf(IssueType.RECURSIVE_FORM));
    }

    @Test
    void missingXObjectIsReportedOnce() throws Exception {
        interpret("/Im9 Do /Im9 Do");

        assertEquals(1, reporter.issues().countOf(IssueType.MISSING_RESOURCE));
    }

    @Test
    void builderRequiresTokenizer() {
        assertThrows(
                IllegalStateException.class,
                () -> new OperatorInterpreter.OperatorInterpreterBuilder().build());
    }

    // == helpers ==

    private OperatorInterpreter.OperatorInterpreterBuilder interpreterBuilder() {
        return new OperatorInterpreter.OperatorInterpreterBuilder()
                .withReporter(reporter)
                .withTokenizer(new ItextContentTokenizer())
                .withTextMetrics(TextMetrics.none())
                .withTextExtent(FIXED_EXTENT);
    }

    private InterpretationResult interpret(String content) throws IOException {
        PdfResourceScope scope = PdfResourceScope.forPage(resources, 1);
        List<ContentOperation> ops =
                new ItextContentTokenizer()
                        .tokenize(content.getBytes(StandardCharsets.ISO_8859_1), scope);
        return interpreter.interpret(ops, scope);
    }

    private void addResource(PdfName category, String name, PdfObject value) {
        PdfDictionary dict = resources.getAsDictionary(category);
        if (dict == null) {
            dict = new PdfDictionary();
            resources.put(category, dict);
        }
        dict.put(new PdfName(name), value);
    }

    private void addFont(String name, String baseFont) {
        PdfDictionary font = new PdfDictionary();
        font.put(PdfName.Type, PdfName.Font);
        font.put(PdfName.BaseFont, new PdfName(baseFont));
        addResource(PdfName.Font, name, font);
    }

    private static PdfStream rgbImage(byte[] samples) {
        PdfStream image = new PdfStream(samples);
        image.put(PdfName.Subtype, PdfName.Image);
        image.put(PdfName.Width, new PdfNumber(1));
        image.put(PdfName.Height, new PdfNumber(1));
        image.put(PdfName.BitsPerComponent, new PdfNumber(8));
        image.put(PdfName.ColorSpace, PdfName.DeviceRGB);
        return image;
    }

    private static PdfStream form(String content) {
        PdfStream form = new PdfStream(content.getBytes(StandardCharsets.ISO_8859_1));
        form.put(PdfName.Subtype, PdfName.Form);
        return form;
    }

    private static PdfArray dash(PdfArray pattern, double phase) {
        PdfArray dash = new PdfArray();
        dash.add(pattern);
        dash.add(new PdfNumber(phase));
        return dash;
    }
}

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

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.io.image.ImageData;
import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import com.itextpdf.kernel.pdf.xobject.PdfFormXObject;
import com.itextpdf.layout.element.Paragraph;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.pdf.drawlist.PdfTestBase;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.document.PdfCustodian;
import net.boyechko.pdf.drawlist.image.Bitmap;
import net.boyechko.pdf.drawlist.interpret.FormCacheScope;
import net.boyechko.pdf.drawlist.issue.Issue;
import net.boyechko.pdf.drawlist.issue.IssueType;
import net.boyechko.pdf.drawlist.state.RgbColor;
import net.boyechko.pdf.drawlist.ui.LoggingListener;
import org.junit.jupiter.api.Test;

/** Test suite for DocumentRenderService. */
public class DocumentRenderServiceTest extends PdfTestBase {

    @Test
    void everyPageIsRenderedInOrder() throws Exception {
        Path pdf =
                createCanvasPdf(
                        (canvas, page) -> canvas.rectangle(10, 10, 50, 50).fill(),
                        (canvas, page) -> canvas.moveTo(0, 0).lineTo(100, 100).stroke());

        RenderResult result = render(pdf, PageRange.all());

        assertEquals(2, result.pages().size());
        PageDrawing first = result.pages().get(0);
        assertEquals(1, first.pageNum());
        assertEquals(595.0, first.width());
        assertEquals(842.0, first.height());
        assertTrue(first.commands().contains(new DrawCommand.AddRectangle(10, -60, 50, 50)));
        assertTrue(
                result.pages().get(1).commands().contains(new DrawCommand.LineTo(100, -100)));
        assertTrue(result.issues().isEmpty(), () -> "unexpected issues: " + result.issues());
    }

    @Test
    void pageRangeLimitsRenderedPages() throws Exception {
        Path pdf = createCanvasPdf(emptyPage(), emptyPage(), emptyPage());

        RenderResult result = render(pdf, PageRange.parse("2-3"));

        assertEquals(
                List.of(2, 3),
                result.pages().stream().map(PageDrawing::pageNum).collect(Collectors.toList()));
    }

    @Test
    void rangePastTheEndRendersNothing() throws Exception {
        Path pdf = createCanvasPdf(emptyPage());
        RecordingListener listener = new RecordingListener();

        RenderResult result =
                new DocumentRenderService.DocumentRenderServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(pdf))
                        .withListener(listener)
                        .withPageRange(new PageRange(5, null))
                        .build()
                        .render();

        assertTrue(result.pages().isEmpty());
        assertEquals(List.of("document 1", "summary 0"), listener.events);
    }

    @Test
    void listenerFollowsRenderProgress() throws Exception {
        Path pdf = createCanvasPdf(emptyPage(), emptyPage(), emptyPage());
        RecordingListener listener = new RecordingListener();

        new DocumentRenderService.DocumentRenderServiceBuilder()
                .withPdfCustodian(new PdfCustodian(pdf))
                .withListener(listener)
                .withSettings(RenderSettings.defaults())
                .withPageRange(new PageRange(2, 2))
                .build()
                .render();

        assertEquals(
                List.of("document 3", "page 2", "rendered 2", "summary 1"), listener.events);
    }

    @Test
    void custodianIsRequired() {
        assertThrows(
                IllegalStateException.class,
                () -> new DocumentRenderService.DocumentRenderServiceBuilder().build());
    }

    @Test
    void standardFontTextIsDrawn() throws Exception {
        Path pdf =
                createCanvasPdf(
                        (canvas, page) ->
                                canvas.beginText()
                                        .setFontAndSize(
                                                PdfFontFactory.createFont(StandardFonts.HELVETICA),
                                                12)
                                        .moveText(72, 700)
                                        .showText("Hello")
                                        .endText());

        RenderResult result = render(pdf, PageRange.all());

        assertTrue(result.missingFonts().isEmpty());
        assertEquals("Hello", drawnText(result.pages().get(0)));
    }

    @Test
    void layoutParagraphTextIsDrawn() throws Exception {
        Path pdf =
                createTestPdf(
                        (pdfDoc, document) -> document.add(new Paragraph("Drawlist sample")));

        RenderResult result = render(pdf, PageRange.all());

        assertTrue(drawnText(result.pages().get(0)).contains("Drawlist"));
    }

    @Test
    void unknownFontsAreCollectedAndReported() throws Exception {
        Path pdf =
                createCanvasPdf(
                        (canvas, page) -> {
                            PdfDictionary font = new PdfDictionary();
                            font.put(PdfName.Type, PdfName.Font);
                            font.put(PdfName.Subtype, PdfName.Type1);
                            font.put(PdfName.BaseFont, new PdfName("ComicSans"));
                            PdfDictionary fonts = new PdfDictionary();
                            fonts.put(new PdfName("F9"), font);
                            page.getResources().getPdfObject().put(PdfName.Font, fonts);
                            writeRaw(canvas, "BT /F9 12 Tf 72 700 Td (Hi) Tj ET\n");
                        });
        RecordingListener listener = new RecordingListener();

        RenderResult result =
                new DocumentRenderService.DocumentRenderServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(pdf))
                        .withListener(listener)
                        .build()
                        .render();

        assertEquals(List.of("ComicSans"), List.copyOf(result.missingFonts()));
        assertEquals(1, result.issues().countOf(IssueType.UNKNOWN_FONT));
        assertEquals(1, listener.issues.size());
        assertEquals(1, listener.issues.get(0).where().page());
        assertEquals("Hi", drawnText(result.pages().get(0)));
    }

    @Test
    void imagesAreDecodedIntoBitmaps() throws Exception {
        byte[] rgb = {(byte) 255, 0, 0, 0, 0, (byte) 255};
        ImageData image = ImageDataFactory.create(2, 1, 3, 8, rgb, null);
        Path pdf = createCanvasPdf((canvas, page) -> canvas.addImageAt(image, 100, 100, false));

        RenderResult result = render(pdf, PageRange.all());

        assertEquals(1, result.totalBitmaps());
        Bitmap bitmap = result.pages().get(0).bitmaps().get(0);
        assertEquals(2, bitmap.width());
        assertEquals(1, bitmap.height());
        assertEquals(new RgbColor(255, 0, 0), bitmap.pixel(0, 0));
        assertEquals(new RgbColor(0, 0, 255), bitmap.pixel(1, 0));
    }

    @Test
    void inlineImagesAreDecodedIntoBitmaps() throws Exception {
        Path pdf =
                createCanvasPdf(
                        (canvas, page) -> {
                            PdfDictionary colorSpaces = new PdfDictionary();
                            colorSpaces.put(new PdfName("CS0"), PdfName.DeviceGray);
                            page.getResources().getPdfObject().put(PdfName.ColorSpace, colorSpaces);
                            writeRaw(
                                    canvas,
                                    "q 2 0 0 1 10 10 cm "
                                            + "BI /W 2 /H 1 /BPC 8 /CS /RGB ID abcdef EI Q\n"
                                            + "q BI /W 1 /H 1 /BPC 8 /CS /CS0 ID z EI Q\n"
                                            + "0 0 10 10 re f\n");
                        });

        RenderResult result = render(pdf, PageRange.all());

        assertEquals(0, result.failedPages());
        List<Bitmap> bitmaps = result.pages().get(0).bitmaps();
        assertEquals(2, bitmaps.size());
        assertEquals(new RgbColor('a', 'b', 'c'), bitmaps.get(0).pixel(0, 0));
        assertEquals(new RgbColor('z', 'z', 'z'), bitmaps.get(1).pixel(0, 0));
        assertTrue(
                result.pages()
                        .get(0)
                        .commands()
                        .contains(new DrawCommand.AddRectangle(0, -10, 10, 10)));
    }

    @Test
    void sharedFormIsExpandedOnEveryPage() throws Exception {
        List<PdfFormXObject> shared = new ArrayList<>();
        TestPageContent drawForm =
                (canvas, page) -> {
                    if (shared.isEmpty()) {
                        PdfFormXObject form = new PdfFormXObject(new Rectangle(10, 10));
                        new PdfCanvas(form, canvas.getDocument())
                                .rectangle(0, 0, 10, 10)
                                .fill()
                                .release();
                        shared.add(form);
                    }
                    canvas.addXObjectAt(shared.get(0), 50, 50);
                };
        Path pdf = createCanvasPdf(drawForm, drawForm);

        RenderResult result =
                new DocumentRenderService.DocumentRenderServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(pdf))
                        .withSettings(
                                RenderSettings.defaults()
                                        .withFormCacheScope(FormCacheScope.DOCUMENT))
                        .withListener(LoggingListener.withConsoleOutput())
                        .build()
                        .render();

        DrawCommand rect = new DrawCommand.AddRectangle(0, -10, 10, 10);
        assertTrue(result.pages().get(0).commands().contains(rect));
        assertTrue(result.pages().get(1).commands().contains(rect));
        assertEquals(0, result.failedPages());
    }

    // == helpers ==

    private static RenderResult render(Path pdf, PageRange range) throws Exception {
        return new DocumentRenderService.DocumentRenderServiceBuilder()
                .withPdfCustodian(new PdfCustodian(pdf))
                .withSettings(RenderSettings.defaults())
                .withPageRange(range)
                .build()
                .render();
    }

    private static TestPageContent emptyPage() {
        return (canvas, page) -> {};
    }

    private static void writeRaw(PdfCanvas canvas, String content) {
        canvas.getContentStream()
                .getOutputStream()
                .writeBytes(content.getBytes(StandardCharsets.US_ASCII));
    }

    private static String drawnText(PageDrawing drawing) {
        return drawing.commands().stream()
                .filter(DrawCommand.DrawText.class::isInstance)
                .map(c -> ((DrawCommand.DrawText) c).text())
                .collect(Collectors.joining());
    }

    private static class RecordingListener implements RenderListener {
        final List<String> events = new ArrayList<>();
        final List<Issue> issues = new ArrayList<>();

        @Override
        public void onDocumentStart(int pageCount) {
            events.add("document " + pageCount);
        }

        @Override
        public void onPageStart(int pageNum) {
            events.add("page " + pageNum);
        }

        @Override
        public void onPageRendered(PageDrawing drawing) {
            events.add("rendered " + drawing.pageNum());
        }

        @Override
        public void onSummary(RenderResult result) {
            events.add("summary " + result.pages().size());
        }

        @Override
        public void onIssue(Issue issue) {
            issues.add(issue);
        }
    }
}

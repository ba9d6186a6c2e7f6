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

import com.itextpdf.kernel.exceptions.PdfException;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.drawlist.document.ItextContentTokenizer;
import net.boyechko.pdf.drawlist.document.PdfCustodian;
import net.boyechko.pdf.drawlist.document.PdfResourceScope;
import net.boyechko.pdf.drawlist.font.FontResolver;
import net.boyechko.pdf.drawlist.interpret.ContentOperation;
import net.boyechko.pdf.drawlist.interpret.ContentTokenizer;
import net.boyechko.pdf.drawlist.interpret.FormCache;
import net.boyechko.pdf.drawlist.interpret.InterpretationResult;
import net.boyechko.pdf.drawlist.interpret.OperatorInterpreter;
import net.boyechko.pdf.drawlist.issue.IssueLoc;
import net.boyechko.pdf.drawlist.issue.IssueReporter;
import net.boyechko.pdf.drawlist.issue.IssueSev;
import net.boyechko.pdf.drawlist.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Renders the pages of a PDF document into draw command lists. */
public class DocumentRenderService {
    private static final Logger logger = LoggerFactory.getLogger(DocumentRenderService.class);

    private final PdfCustodian custodian;
    private final RenderListener listener;
    private final RenderSettings settings;
    private final PageRange pageRange;

    public static class DocumentRenderServiceBuilder {
        private PdfCustodian custodian;
        private RenderListener listener;
        private RenderSettings settings;
        private PageRange pageRange = PageRange.all();

        public DocumentRenderServiceBuilder withPdfCustodian(PdfCustodian custodian) {
            this.custodian = custodian;
            return this;
        }

        public DocumentRenderServiceBuilder withListener(RenderListener listener) {
            this.listener = listener;
            return this;
        }

        public DocumentRenderServiceBuilder withSettings(RenderSettings settings) {
            this.settings = settings;
            return this;
        }

        public DocumentRenderServiceBuilder withPageRange(PageRange pageRange) {
            this.pageRange = pageRange;
            return this;
        }

        public DocumentRenderService build() {
            if (custodian == null) {
                throw new IllegalStateException(
                        "PdfCustodian must be provided via withPdfCustodian(...) "
                                + "before building DocumentRenderService");
            }
            if (listener == null) {
                listener = RenderListener.silent();
            }
            if (settings == null) {
                settings = RenderSettings.fromEnvironment();
            }
            if (pageRange == null) {
                pageRange = PageRange.all();
            }
            return new DocumentRenderService(this);
        }
    }

    private DocumentRenderService(DocumentRenderServiceBuilder builder) {
        this.custodian = builder.custodian;
        this.listener = builder.listener;
        this.settings = builder.settings;
        this.pageRange = builder.pageRange;
    }

    /**
     * Renders every page in the configured range. Fonts and form expansions are shared across
     * the pages of one call; a page that fails is reported and rendered empty.
     *
     * @throws IOException if the document cannot be opened
     */
    public RenderResult render() throws IOException {
        IssueReporter reporter = new IssueReporter(listener::onIssue);
        FontResolver fontResolver = new FontResolver(reporter);
        FormCache formCache = new FormCache();
        ContentTokenizer tokenizer = new ItextContentTokenizer();
        OperatorInterpreter interpreter =
                new OperatorInterpreter.OperatorInterpreterBuilder()
                        .withReporter(reporter)
                        .withFontResolver(fontResolver)
                        .withFormCache(formCache)
                        .withTokenizer(tokenizer)
                        .withFontScales(settings.fontScaleMetrics(), settings.fontScaleSize())
                        .withFormCacheScope(settings.formCacheScope())
                        .withMaxFormDepth(settings.maxFormDepth())
                        .build();

        List<PageDrawing> pages = new ArrayList<>();
        try (PdfDocument doc = custodian.openForReading()) {
            int pageCount = doc.getNumberOfPages();
            listener.onDocumentStart(pageCount);
            int first = pageRange.firstIn(pageCount);
            int last = pageRange.lastIn(pageCount);
            logger.debug("Rendering pages {}-{} of {}", first, last, pageCount);

            for (int pageNum = first; pageNum <= last; pageNum++) {
                listener.onPageStart(pageNum);
                reporter.setCurrentPage(pageNum);
                PageDrawing drawing =
                        renderPage(interpreter, tokenizer, doc.getPage(pageNum), pageNum);
                pages.add(drawing);
                listener.onPageRendered(drawing);
            }
        } finally {
            reporter.setCurrentPage(null);
            logger.debug(
                    "Form cache held {} expansion(s) over {} form(s)",
                    formCache.expansionCount(),
                    formCache.size());
            formCache.clear();
        }

        RenderResult result =
                new RenderResult(pages, reporter.issues(), fontResolver.missingFonts());
        listener.onSummary(result);
        return result;
    }

    private PageDrawing renderPage(
            OperatorInterpreter interpreter,
            ContentTokenizer tokenizer,
            PdfPage page,
            int pageNum) {
        Rectangle mediaBox = mediaBoxOf(page, pageNum);
        try {
            PdfDictionary resources = page.getResources().getPdfObject();
            PdfResourceScope scope = PdfResourceScope.forPage(resources, pageNum);
            List<ContentOperation> operations = tokenizer.tokenize(page.getContentBytes(), scope);
            logger.debug("Page {}: {} operation(s) in scope {}", pageNum, operations.size(), scope);

            InterpretationResult result = interpreter.interpret(operations, scope);
            return new PageDrawing(
                    pageNum, mediaBox.getWidth(), mediaBox.getHeight(), result.commands());
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to interpret page {}", pageNum, e);
            interpreter
                    .reporter()
                    .report(
                            IssueType.PAGE_FAILED,
                            IssueSev.ERROR,
                            IssueLoc.atPage(pageNum),
                            "Page " + pageNum + " could not be interpreted: " + e.getMessage());
            return PageDrawing.empty(pageNum, mediaBox.getWidth(), mediaBox.getHeight());
        }
    }

    private static Rectangle mediaBoxOf(PdfPage page, int pageNum) {
        try {
            return page.getMediaBox();
        } catch (PdfException e) {
            logger.warn("Page {} has no usable MediaBox; assuming {}", pageNum, PageSize.DEFAULT);
            return PageSize.DEFAULT;
        }
    }
}

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
package net.boyechko.pdf.drawlist.document;

import com.itextpdf.io.source.PdfTokenizer;
import com.itextpdf.io.source.RandomAccessFileOrArray;
import com.itextpdf.io.source.RandomAccessSourceFactory;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfLiteral;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfResources;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.canvas.parser.util.PdfCanvasParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.drawlist.interpret.ContentOperation;
import net.boyechko.pdf.drawlist.interpret.ContentTokenizer;
import net.boyechko.pdf.drawlist.interpret.Operator;
import net.boyechko.pdf.drawlist.interpret.ResourceScope;

/**
 * Tokenizes content streams with iText's {@link PdfCanvasParser}.
 *
 * <p>The parser reads an inline image ({@code BI ... ID ... EI}) itself and hands it back as an
 * {@code EI} carrying the image stream; that comes out here as a single {@code BI} operation
 * whose only operand is the stream.
 */
public class ItextContentTokenizer implements ContentTokenizer {
    private final PdfDictionary colorSpaces;

    public ItextContentTokenizer() {
        this(null);
    }

    /**
     * @param colorSpaces the {@code /ColorSpace} resource dictionary used to size unfiltered
     *     inline images that name a colour space resource; may be null
     */
    public ItextContentTokenizer(PdfDictionary colorSpaces) {
        this.colorSpaces = colorSpaces;
    }

    @Override
    public List<ContentOperation> tokenize(byte[] content) throws IOException {
        return tokenize(content, colorSpaces);
    }

    /** Inline images resolve named colour spaces against {@code resources}. */
    @Override
    public List<ContentOperation> tokenize(byte[] content, ResourceScope resources)
            throws IOException {
        return tokenize(content, resources.colorSpaces().orElse(colorSpaces));
    }

    private static List<ContentOperation> tokenize(byte[] content, PdfDictionary colorSpaces)
            throws IOException {
        List<ContentOperation> operations = new ArrayList<>();
        if (content == null || content.length == 0) {
            return operations;
        }
        PdfTokenizer tokenizer =
                new PdfTokenizer(
                        new RandomAccessFileOrArray(
                                new RandomAccessSourceFactory().createSource(content)));
        PdfCanvasParser parser = new PdfCanvasParser(tokenizer, resourcesWith(colorSpaces));
        try {
            List<PdfObject> tokens = new ArrayList<>();
            while (!parser.parse(tokens).isEmpty()) {
                PdfLiteral operator = (PdfLiteral) tokens.get(tokens.size() - 1);
                List<PdfObject> operands = tokens.subList(0, tokens.size() - 1);
                operations.add(toOperation(operator.toString(), operands));
            }
        } finally {
            tokenizer.close();
        }
        return operations;
    }

    private static ContentOperation toOperation(String symbol, List<PdfObject> operands) {
        if (Operator.INLINE_IMAGE_END.symbol().equals(symbol)
                && operands.size() == 1
                && operands.get(0) instanceof PdfStream image) {
            return ContentOperation.of(Operator.INLINE_IMAGE.symbol(), image);
        }
        return new ContentOperation(symbol, operands);
    }

    private static PdfResources resourcesWith(PdfDictionary colorSpaces) {
        PdfDictionary resources = new PdfDictionary();
        if (colorSpaces != null) {
            resources.put(PdfName.ColorSpace, colorSpaces);
        }
        return new PdfResources(resources);
    }
}

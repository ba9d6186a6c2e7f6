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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.exceptions.PdfException;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.pdf.drawlist.interpret.ContentOperation;
import org.junit.jupiter.api.Test;

/** Test suite for ItextContentTokenizer. */
public class ItextContentTokenizerTest {

    private final ItextContentTokenizer tokenizer = new ItextContentTokenizer();

    @Test
    void splitsOperandsFromOperators() throws Exception {
        List<ContentOperation> ops = tokenize("q 1 0 0 1 10 20 cm /F1 12 Tf Q");

        assertEquals(List.of("q", "cm", "Tf", "Q"), operators(ops));
        assertEquals(6, ops.get(1).operands().size());
        assertEquals(20, ((PdfNumber) ops.get(1).operands().get(5)).intValue());
        assertEquals(new PdfName("F1"), ops.get(2).operands().get(0));
    }

    @Test
    void keepsStringsAndArrays() throws Exception {
        List<ContentOperation> ops = tokenize("[(Hel) -40 (lo)] TJ (W\\(x\\)) Tj");

        PdfArray array = (PdfArray) ops.get(0).operands().get(0);
        assertEquals(3, array.size());
        assertEquals("W(x)", ((PdfString) ops.get(1).operands().get(0)).getValue());
    }

    @Test
    void quoteOperatorsAreTokens() throws Exception {
        List<ContentOperation> ops = tokenize("(a) ' 1 2 (b) \"");

        assertEquals("'", ops.get(0).operator());
        assertEquals("\"", ops.get(1).operator());
        assertEquals(3, ops.get(1).operands().size());
    }

    @Test
    void inlineImageBecomesSingleOperation() throws Exception {
        List<ContentOperation> ops = tokenize("q BI /W 2 /H 1 /BPC 8 /CS /RGB ID abcdef EI Q");

        assertEquals(List.of("q", "BI", "Q"), operators(ops));
        PdfStream image = (PdfStream) ops.get(1).operands().get(0);
        assertEquals(2, image.getAsNumber(PdfName.Width).intValue());
        assertEquals("abcdef", new String(image.getBytes(false), StandardCharsets.ISO_8859_1));
    }

    @Test
    void inlineImageResolvesNamedColorSpace() throws Exception {
        PdfDictionary colorSpaces = new PdfDictionary();
        colorSpaces.put(new PdfName("CS0"), PdfName.DeviceGray);
        ItextContentTokenizer withSpaces = new ItextContentTokenizer(colorSpaces);

        List<ContentOperation> ops =
                withSpaces.tokenize(
                        "BI /W 3 /H 1 /BPC 8 /CS /CS0 ID xyz EI"
                                .getBytes(StandardCharsets.ISO_8859_1));

        PdfStream image = (PdfStream) ops.get(0).operands().get(0);
        assertEquals("xyz", new String(image.getBytes(false), StandardCharsets.ISO_8859_1));
    }

    @Test
    void inlineImageResolvesColorSpaceFromScope() throws Exception {
        PdfDictionary colorSpaces = new PdfDictionary();
        colorSpaces.put(new PdfName("CS0"), PdfName.DeviceRGB);
        PdfDictionary resources = new PdfDictionary();
        resources.put(PdfName.ColorSpace, colorSpaces);

        List<ContentOperation> ops =
                tokenizer.tokenize(
                        "q BI /W 1 /H 1 /BPC 8 /CS /CS0 ID rgb EI Q"
                                .getBytes(StandardCharsets.ISO_8859_1),
                        PdfResourceScope.forPage(resources, 1));

        assertEquals(List.of("q", "BI", "Q"), operators(ops));
        PdfStream image = (PdfStream) ops.get(1).operands().get(0);
        assertEquals("rgb", new String(image.getBytes(false), StandardCharsets.ISO_8859_1));
    }

    @Test
    void namedColorSpaceWithoutResourcesFails() {
        assertThrows(PdfException.class, () -> tokenize("BI /W 1 /H 1 /BPC 8 /CS /CS0 ID a EI"));
    }

    @Test
    void emptyContentHasNoOperations() throws Exception {
        assertTrue(tokenizer.tokenize(new byte[0]).isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenize("% only a comment\n").isEmpty());
    }

    private List<ContentOperation> tokenize(String content) throws Exception {
        return tokenizer.tokenize(content.getBytes(StandardCharsets.ISO_8859_1));
    }

    private static List<String> operators(List<ContentOperation> ops) {
        return ops.stream().map(ContentOperation::operator).toList();
    }
}

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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.ReaderProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Opens PDF documents read-only, with an optional user password. */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private final Path inputPath;
    private final String password;

    public PdfCustodian(Path inputPath, String password) {
        this.inputPath = inputPath;
        this.password = password;
    }

    public PdfCustodian(Path inputPath) {
        this(inputPath, null);
    }

    public Path getInputPath() {
        return inputPath;
    }

    public PdfDocument openForReading() throws IOException {
        ReaderProperties readerProps = new ReaderProperties();
        if (password != null) {
            readerProps.setPassword(password.getBytes(StandardCharsets.ISO_8859_1));
        }
        PdfReader pdfReader = new PdfReader(inputPath.toString(), readerProps);
        PdfDocument doc = new PdfDocument(pdfReader);
        if (pdfReader.isEncrypted()) {
            logger.debug(
                    "Opened encrypted PDF {} (permissions {})",
                    inputPath,
                    pdfReader.getPermissions());
        }
        return doc;
    }
}

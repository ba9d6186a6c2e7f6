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

import com.itextpdf.kernel.pdf.PdfObject;
import java.util.List;

/**
 * One tokenized (operands, operator) pair. An inline image arrives as operator {@code BI}
 * with a single {@code PdfStream} operand holding the image dictionary and sample bytes.
 */
public record ContentOperation(String operator, List<PdfObject> operands) {

    public ContentOperation {
        operands = List.copyOf(operands);
    }

    public static ContentOperation of(String operator, PdfObject... operands) {
        return new ContentOperation(operator, List.of(operands));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PdfObject operand : operands) {
            sb.append(operand).append(' ');
        }
        return sb.append(operator).toString();
    }
}

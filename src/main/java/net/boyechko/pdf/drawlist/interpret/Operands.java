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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import java.util.List;

/** Typed access to the operands of one operation. */
final class Operands {
    private final String operator;
    private final List<PdfObject> values;

    Operands(ContentOperation op) {
        this.operator = op.operator();
        this.values = op.operands();
    }

    int size() {
        return values.size();
    }

    Operands require(int count) throws OperandException {
        if (values.size() < count) {
            throw new OperandException(
                    operator + " needs " + count + " operands, got " + values.size());
        }
        return this;
    }

    PdfObject get(int index) throws OperandException {
        require(index + 1);
        return values.get(index);
    }

    double number(int index) throws OperandException {
        if (get(index) instanceof PdfNumber number) {
            return number.doubleValue();
        }
        throw mismatch(index, "number");
    }

    int integer(int index) throws OperandException {
        return (int) number(index);
    }

    /** All operands as numbers; fails if any is not numeric. */
    double[] numbers() throws OperandException {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = number(i);
        }
        return result;
    }

    /** The first {@code count} operands as numbers. */
    double[] numbers(int count) throws OperandException {
        require(count);
        double[] result = new double[count];
        for (int i = 0; i < count; i++) {
            result[i] = number(i);
        }
        return result;
    }

    String name(int index) throws OperandException {
        if (get(index) instanceof PdfName name) {
            return name.getValue();
        }
        throw mismatch(index, "name");
    }

    byte[] string(int index) throws OperandException {
        if (get(index) instanceof PdfString string) {
            return string.getValueBytes();
        }
        throw mismatch(index, "string");
    }

    PdfArray array(int index) throws OperandException {
        if (get(index) instanceof PdfArray array) {
            return array;
        }
        throw mismatch(index, "array");
    }

    PdfStream stream(int index) throws OperandException {
        if (get(index) instanceof PdfStream stream) {
            return stream;
        }
        throw mismatch(index, "inline image");
    }

    private OperandException mismatch(int index, String expected) {
        return new OperandException(
                operator + " operand " + index + " should be a " + expected + ": "
                        + values.get(index));
    }
}

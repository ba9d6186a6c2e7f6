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
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.drawlist.issue.IssueLoc;
import net.boyechko.pdf.drawlist.issue.IssueReporter;
import net.boyechko.pdf.drawlist.issue.IssueSev;
import net.boyechko.pdf.drawlist.issue.IssueType;
import net.boyechko.pdf.drawlist.state.GraphicsState;
import net.boyechko.pdf.drawlist.state.LineCap;
import net.boyechko.pdf.drawlist.state.LineJoin;

/** Copies the recognised entries of an {@code /ExtGState} dictionary onto a graphics state. */
final class ExtGStateApplier {
    private final IssueReporter reporter;

    ExtGStateApplier(IssueReporter reporter) {
        this.reporter = reporter;
    }

    /**
     * @throws IllegalArgumentException if a line cap or join code is out of range
     */
    void apply(PdfDictionary extGState, GraphicsState state, IssueLoc where) {
        for (PdfName key : extGState.keySet()) {
            PdfObject value = extGState.get(key);
            switch (key.getValue()) {
                case "Type" -> {}
                case "SA" -> state.setStrokeAdjustment(isTrue(value));
                case "CA" -> state.setStrokeAlpha(number(value, state.strokeAlpha()));
                case "ca" -> state.setFillAlpha(number(value, state.fillAlpha()));
                case "LW" -> state.setLineWidth(number(value, state.lineWidth()));
                case "LC" -> state.setLineCap(LineCap.fromPdf((int) number(value, 0)));
                case "LJ" -> state.setLineJoin(LineJoin.fromPdf((int) number(value, 0)));
                case "ML" -> state.setMiterLimit(number(value, state.miterLimit()));
                case "D" -> applyDash(value, state);
                case "RI" -> state.setRenderingIntent(nameOf(value));
                case "FL" -> state.setFlatness(number(value, state.flatness()));
                case "OP" -> {
                    state.setOverprintStroke(isTrue(value));
                    if (!extGState.containsKey(new PdfName("op"))) {
                        state.setOverprintFill(isTrue(value));
                    }
                }
                case "op" -> state.setOverprintFill(isTrue(value));
                case "OPM" -> state.setOverprintMode((int) number(value, 0));
                case "BM" -> state.setBlendMode(blendModeName(value));
                default -> reporter.reportOnce(
                        IssueType.UNHANDLED_EXTGSTATE_KEY,
                        IssueSev.WARNING,
                        key.getValue(),
                        where,
                        "ExtGState key /" + key.getValue() + " is not handled");
            }
        }
    }

    private static void applyDash(PdfObject value, GraphicsState state) {
        if (value instanceof PdfArray dash && dash.size() == 2) {
            PdfArray pattern = dash.getAsArray(0);
            PdfNumber phase = dash.getAsNumber(1);
            if (pattern != null && phase != null) {
                List<Double> lengths = new ArrayList<>();
                for (PdfObject length : pattern) {
                    if (length instanceof PdfNumber n) {
                        lengths.add(n.doubleValue());
                    }
                }
                state.setDash(lengths, phase.doubleValue());
            }
        }
    }

    private static String blendModeName(PdfObject value) {
        if (value instanceof PdfArray modes && !modes.isEmpty()) {
            return nameOf(modes.get(0));
        }
        String name = nameOf(value);
        return name != null ? name : GraphicsState.NORMAL_BLEND_MODE;
    }

    private static double number(PdfObject value, double fallback) {
        return value instanceof PdfNumber n ? n.doubleValue() : fallback;
    }

    private static boolean isTrue(PdfObject value) {
        return value instanceof PdfBoolean b && b.getValue();
    }

    private static String nameOf(PdfObject value) {
        return value instanceof PdfName name ? name.getValue() : null;
    }
}

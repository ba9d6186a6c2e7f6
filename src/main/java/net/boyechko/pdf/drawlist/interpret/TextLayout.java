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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.font.FontDescriptor;
import net.boyechko.pdf.drawlist.font.FontResolver;
import net.boyechko.pdf.drawlist.font.FontSpec;
import net.boyechko.pdf.drawlist.font.TextExtent;
import net.boyechko.pdf.drawlist.font.TextMetrics;
import net.boyechko.pdf.drawlist.state.GraphicsState;

/**
 * Positions shown strings. Each string gets one {@code SetFont}, then one {@code DrawText}
 * per run; with non-zero word spacing the string is split at spaces and every run keeps a
 * trailing space. After each run the text matrix x advances by width plus word spacing.
 */
public class TextLayout {
    private final FontResolver fontResolver;
    private final TextMetrics metrics;
    private final TextExtent extent;
    private final double fontScaleMetrics;
    private final double fontScaleSize;

    public TextLayout(
            FontResolver fontResolver,
            TextMetrics metrics,
            TextExtent extent,
            double fontScaleMetrics,
            double fontScaleSize) {
        this.fontResolver = fontResolver;
        this.metrics = metrics;
        this.extent = extent;
        this.fontScaleMetrics = fontScaleMetrics;
        this.fontScaleSize = fontScaleSize;
    }

    /** Lays out one string operand, advancing the text matrix of {@code state}. */
    public List<DrawCommand> show(byte[] encoded, GraphicsState state) {
        String text = new String(encoded, StandardCharsets.ISO_8859_1);
        FontDescriptor descriptor =
                state.baseFont() != null
                        ? fontResolver.resolve(state.baseFont())
                        : fontResolver.defaultFont();
        FontSpec base = FontSpec.of(descriptor, state.fontSize());
        FontSpec displayFont = base.scaled(fontScaleSize);
        FontSpec metricsFont = base.scaled(fontScaleMetrics);

        List<DrawCommand> out = new ArrayList<>();
        out.add(new DrawCommand.SetFont(displayFont, metricsFont, state.fillColorWithAlpha()));
        for (String run : runs(text, state.wordSpacing())) {
            out.add(layoutRun(run, base, metricsFont, state));
        }
        return out;
    }

    static List<String> runs(String text, double wordSpacing) {
        if (wordSpacing == 0) {
            return List.of(text);
        }
        List<String> runs = new ArrayList<>();
        for (String word : text.split(" ", -1)) {
            runs.add(word + " ");
        }
        return runs;
    }

    private DrawCommand layoutRun(
            String run, FontSpec base, FontSpec metricsFont, GraphicsState state) {
        FontDescriptor descriptor = base.descriptor();
        double x = state.textX();
        double y = state.textY() + state.textRise();
        TextExtent.Extent measured = extent.measure(run, metricsFont);
        double width =
                descriptor.known()
                        ? metrics.width(run, descriptor, base.size()).orElse(measured.width())
                        : measured.width();
        state.advanceText(width + state.wordSpacing());
        return new DrawCommand.DrawText(
                run, x, 0.0 - y - (measured.height() - measured.descent()));
    }
}

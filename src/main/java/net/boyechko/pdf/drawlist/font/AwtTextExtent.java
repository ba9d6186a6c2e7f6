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
package net.boyechko.pdf.drawlist.font;

import java.awt.Font;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;
import java.awt.geom.Rectangle2D;

/** Text extents from {@code java.awt.Font}; works headless. */
public class AwtTextExtent implements TextExtent {
    private static final FontRenderContext FRC = new FontRenderContext(null, true, true);

    @Override
    public Extent measure(String text, FontSpec spec) {
        Font font = toAwtFont(spec);
        Rectangle2D bounds = font.getStringBounds(text, FRC);
        LineMetrics metrics = font.getLineMetrics(text, FRC);
        return new Extent(bounds.getWidth(), metrics.getHeight(), metrics.getDescent());
    }

    static Font toAwtFont(FontSpec spec) {
        FontDescriptor d = spec.descriptor();
        int style = (d.bold() ? Font.BOLD : Font.PLAIN) | (d.italic() ? Font.ITALIC : Font.PLAIN);
        return new Font(d.faceName(), style, 1).deriveFont((float) spec.size());
    }
}

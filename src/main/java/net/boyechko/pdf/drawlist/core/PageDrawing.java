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

import java.util.List;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.image.Bitmap;

/**
 * The draw commands of one page.
 *
 * @param pageNum 1-based page number
 * @param width MediaBox width in PDF units
 * @param height MediaBox height in PDF units
 * @param commands commands after the transform fold pass
 */
public record PageDrawing(int pageNum, double width, double height, List<DrawCommand> commands) {

    public PageDrawing {
        commands = List.copyOf(commands);
    }

    public static PageDrawing empty(int pageNum, double width, double height) {
        return new PageDrawing(pageNum, width, height, List.of());
    }

    /** Bitmaps in drawing order. */
    public List<Bitmap> bitmaps() {
        return commands.stream()
                .filter(DrawCommand.DrawBitmap.class::isInstance)
                .map(c -> ((DrawCommand.DrawBitmap) c).bitmap())
                .toList();
    }

    public int bitmapCount() {
        return bitmaps().size();
    }
}

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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.command.DrawCommand.ConcatTransform;
import net.boyechko.pdf.drawlist.command.DrawCommand.DrawBitmap;

/**
 * Moves the scale of a transform into the bitmap draw that immediately follows it.
 *
 * <p>Images live on the unit square and get their size from the preceding {@code cm}; the
 * backend wants explicit destination sizes instead. {@code ConcatTransform(a,b,c,d,e,f)}
 * followed by {@code DrawBitmap(bmp,x,y,w,h)} becomes {@code ConcatTransform(1,b/a,c/d,1,e,f)}
 * and {@code DrawBitmap(bmp,x,-d,a,d)}. Pairs with a zero diagonal are left alone.
 */
public final class TransformFoldPass {
    private TransformFoldPass() {}

    public static List<DrawCommand> apply(List<DrawCommand> commands) {
        List<DrawCommand> out = new ArrayList<>(commands);
        for (int i = 0; i + 1 < out.size(); i++) {
            if (out.get(i) instanceof ConcatTransform ct
                    && out.get(i + 1) instanceof DrawBitmap bmp
                    && ct.a() != 0
                    && ct.d() != 0) {
                out.set(
                        i,
                        new ConcatTransform(
                                1.0, ct.b() / ct.a(), ct.c() / ct.d(), 1.0, ct.e(), ct.f()));
                out.set(
                        i + 1,
                        new DrawBitmap(bmp.bitmap(), bmp.x(), 0.0 - ct.d(), ct.a(), ct.d()));
                i++;
            }
        }
        return out;
    }
}

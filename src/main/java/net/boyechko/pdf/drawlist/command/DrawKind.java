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
package net.boyechko.pdf.drawlist.command;

/** Tags of the closed draw-command set a backend must support. */
public enum DrawKind {
    CONCAT_TRANSFORM("ConcatTransform"),
    PUSH_STATE("PushState"),
    POP_STATE("PopState"),
    SET_FONT("SetFont"),
    SET_PEN("SetPen"),
    SET_BRUSH("SetBrush"),
    DRAW_TEXT("DrawText"),
    DRAW_BITMAP("DrawBitmap"),
    CREATE_PATH("CreatePath"),
    MOVE_TO("MoveTo"),
    LINE_TO("LineTo"),
    CURVE_TO("CurveTo"),
    ADD_RECTANGLE("AddRectangle"),
    CLOSE_PATH("ClosePath"),
    DRAW_PATH("DrawPath");

    private final String tag;

    DrawKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

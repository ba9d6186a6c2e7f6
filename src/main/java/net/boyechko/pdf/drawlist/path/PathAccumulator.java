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
package net.boyechko.pdf.drawlist.path;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.state.ClipRegion;
import net.boyechko.pdf.drawlist.state.GraphicsState;

/**
 * Builds the current path from {@code m l c v y re h} and turns it into draw commands when a
 * painting operator arrives.
 *
 * <p>Input points are in PDF user space (y up). The y component of every point is negated on
 * ingestion, so segments and emitted commands are in device space (y down).
 */
public class PathAccumulator {
    private final List<PathSegment> segments = new ArrayList<>();
    private double currentX;
    private double currentY;
    private double subpathStartX;
    private double subpathStartY;
    private FillRule pendingClip;

    public void moveTo(double x, double y) {
        currentX = x;
        currentY = flip(y);
        subpathStartX = currentX;
        subpathStartY = currentY;
        segments.add(new PathSegment.MoveTo(currentX, currentY));
    }

    public void lineTo(double x, double y) {
        currentX = x;
        currentY = flip(y);
        segments.add(new PathSegment.LineTo(currentX, currentY));
    }

    /**
     * Appends a cubic Bézier segment.
     *
     * @param coords user-space coordinates, six for {@link CurveVariant#EXPLICIT} (x1 y1 x2 y2 x3
     *     y3) and four for the implicit variants (the two points the operator carries)
     */
    public void curveTo(CurveVariant variant, double... coords) {
        if (coords.length != variant.operandCount()) {
            throw new IllegalArgumentException(
                    variant + " curve needs " + variant.operandCount() + " coordinates, got "
                            + coords.length);
        }
        PathSegment.CurveTo curve =
                switch (variant) {
                    case EXPLICIT -> new PathSegment.CurveTo(
                            coords[0], flip(coords[1]),
                            coords[2], flip(coords[3]),
                            coords[4], flip(coords[5]));
                    case INITIAL_IMPLICIT -> new PathSegment.CurveTo(
                            currentX, currentY,
                            coords[0], flip(coords[1]),
                            coords[2], flip(coords[3]));
                    case FINAL_IMPLICIT -> new PathSegment.CurveTo(
                            coords[0], flip(coords[1]),
                            coords[2], flip(coords[3]),
                            coords[2], flip(coords[3]));
                };
        currentX = curve.x3();
        currentY = curve.y3();
        segments.add(curve);
    }

    /** Appends a rectangle, normalised to a non-negative height with its top-left origin. */
    public void rect(double x, double y, double width, double height) {
        double top = flip(y);
        PathSegment.Rect rect =
                height < 0
                        ? new PathSegment.Rect(x, top, width, flip(height))
                        : new PathSegment.Rect(x, top - height, width, height);
        segments.add(rect);
        currentX = x;
        currentY = top;
        subpathStartX = currentX;
        subpathStartY = currentY;
    }

    public void close() {
        segments.add(new PathSegment.Close());
        currentX = subpathStartX;
        currentY = subpathStartY;
    }

    /** Marks the current path as the next clipping region ({@code W} or {@code W*}). */
    public void clip(FillRule rule) {
        pendingClip = rule;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public List<PathSegment> segments() {
        return List.copyOf(segments);
    }

    /**
     * Resolves the accumulated path with a painting operator. Emits the pen, the brush, and the
     * path itself, records a pending clip on {@code state}, and clears the accumulator.
     */
    public List<DrawCommand> resolve(PaintOp op, GraphicsState state) {
        try {
            if (op.closesPath()) {
                close();
            }
            if (pendingClip != null) {
                state.addClipRegion(new ClipRegion(segments, pendingClip));
            }

            List<DrawCommand> out = new ArrayList<>(segments.size() + 4);
            out.add(new DrawCommand.SetPen(op.strokes() ? Pen.from(state) : Pen.TRANSPARENT));
            out.add(
                    new DrawCommand.SetBrush(
                            op.fills() ? Brush.from(state) : Brush.TRANSPARENT));
            out.add(new DrawCommand.CreatePath());
            for (PathSegment segment : segments) {
                out.add(segment.toCommand());
            }
            out.add(new DrawCommand.DrawPath(op.rule()));
            return out;
        } finally {
            reset();
        }
    }

    /** Discards the path and any pending clip. */
    public void reset() {
        segments.clear();
        pendingClip = null;
        currentX = 0;
        currentY = 0;
        subpathStartX = 0;
        subpathStartY = 0;
    }

    // 0.0 - y, not -y, so a zero coordinate stays +0.0
    private static double flip(double y) {
        return 0.0 - y;
    }
}

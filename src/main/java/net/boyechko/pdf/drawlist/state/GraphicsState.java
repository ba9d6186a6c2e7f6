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
package net.boyechko.pdf.drawlist.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Current paint and text parameters of one interpreter scope.
 *
 * <p>Every field holds an immutable value (records such as {@link TextMatrix}, immutable
 * lists), so {@link #copy()} is a structural copy that shares nothing mutable with the
 * original, and {@link #restoreFrom(GraphicsState)} is plain field assignment.
 */
public final class GraphicsState {
    public static final double MIN_LINE_WIDTH = 1.0;
    public static final double DEFAULT_MITER_LIMIT = 10.0;
    public static final String NORMAL_BLEND_MODE = "Normal";

    // Paint
    private RgbColor strokeColor = RgbColor.BLACK;
    private RgbColor fillColor = RgbColor.BLACK;
    private String strokeColorSpace = "DeviceGray";
    private String fillColorSpace = "DeviceGray";
    private double strokeAlpha = 1.0;
    private double fillAlpha = 1.0;

    // Line style
    private double lineWidth = MIN_LINE_WIDTH;
    private LineCap lineCap = LineCap.BUTT;
    private LineJoin lineJoin = LineJoin.MITER;
    private List<Double> dashArray = List.of();
    private double dashPhase = 0;
    private double miterLimit = DEFAULT_MITER_LIMIT;
    private boolean strokeAdjustment = false;

    // Printer-only parameters, stored but not acted on
    private boolean overprintStroke = false;
    private boolean overprintFill = false;
    private int overprintMode = 0;
    private String renderingIntent = null;
    private double flatness = 0;
    private String blendMode = NORMAL_BLEND_MODE;

    private List<ClipRegion> clipRegions = List.of();

    // Text state
    private TextMatrix textMatrix = TextMatrix.IDENTITY;
    private TextMatrix textLineMatrix = TextMatrix.IDENTITY;
    private double charSpacing = 0;
    private double wordSpacing = 0;
    private double horizontalScaling = 1.0;
    private double leading = 0;
    private String fontResource = null;
    private String baseFont = null;
    private double fontSize = 0;
    private double textRise = 0;
    private int textRenderMode = 0;

    public GraphicsState() {}

    private GraphicsState(GraphicsState other) {
        restoreFrom(other);
    }

    /** Returns an independent copy of this state. */
    public GraphicsState copy() {
        return new GraphicsState(this);
    }

    /** Replaces every field of this state with the values held by {@code saved}. */
    public void restoreFrom(GraphicsState saved) {
        strokeColor = saved.strokeColor;
        fillColor = saved.fillColor;
        strokeColorSpace = saved.strokeColorSpace;
        fillColorSpace = saved.fillColorSpace;
        strokeAlpha = saved.strokeAlpha;
        fillAlpha = saved.fillAlpha;
        lineWidth = saved.lineWidth;
        lineCap = saved.lineCap;
        lineJoin = saved.lineJoin;
        dashArray = saved.dashArray;
        dashPhase = saved.dashPhase;
        miterLimit = saved.miterLimit;
        strokeAdjustment = saved.strokeAdjustment;
        overprintStroke = saved.overprintStroke;
        overprintFill = saved.overprintFill;
        overprintMode = saved.overprintMode;
        renderingIntent = saved.renderingIntent;
        flatness = saved.flatness;
        blendMode = saved.blendMode;
        clipRegions = saved.clipRegions;
        textMatrix = saved.textMatrix;
        textLineMatrix = saved.textLineMatrix;
        charSpacing = saved.charSpacing;
        wordSpacing = saved.wordSpacing;
        horizontalScaling = saved.horizontalScaling;
        leading = saved.leading;
        fontResource = saved.fontResource;
        baseFont = saved.baseFont;
        fontSize = saved.fontSize;
        textRise = saved.textRise;
        textRenderMode = saved.textRenderMode;
    }

    /** Stroke color composed with the stroke transparency. */
    public RgbaColor strokeColorWithAlpha() {
        return strokeColor.withAlpha(strokeAlpha);
    }

    /** Fill color composed with the fill transparency; used for shapes and text. */
    public RgbaColor fillColorWithAlpha() {
        return fillColor.withAlpha(fillAlpha);
    }

    // ── Paint ───────────────────────────────────────────────────────────

    public RgbColor strokeColor() {
        return strokeColor;
    }

    public void setStrokeColor(RgbColor strokeColor) {
        this.strokeColor = Objects.requireNonNull(strokeColor);
    }

    public RgbColor fillColor() {
        return fillColor;
    }

    public void setFillColor(RgbColor fillColor) {
        this.fillColor = Objects.requireNonNull(fillColor);
    }

    public String strokeColorSpace() {
        return strokeColorSpace;
    }

    public void setStrokeColorSpace(String strokeColorSpace) {
        this.strokeColorSpace = strokeColorSpace;
    }

    public String fillColorSpace() {
        return fillColorSpace;
    }

    public void setFillColorSpace(String fillColorSpace) {
        this.fillColorSpace = fillColorSpace;
    }

    public double strokeAlpha() {
        return strokeAlpha;
    }

    public void setStrokeAlpha(double strokeAlpha) {
        this.strokeAlpha = clampUnit(strokeAlpha);
    }

    public double fillAlpha() {
        return fillAlpha;
    }

    public void setFillAlpha(double fillAlpha) {
        this.fillAlpha = clampUnit(fillAlpha);
    }

    // ── Line style ──────────────────────────────────────────────────────

    public double lineWidth() {
        return lineWidth;
    }

    /** Sets the line width, clamped to at least {@link #MIN_LINE_WIDTH}. */
    public void setLineWidth(double lineWidth) {
        this.lineWidth = Math.max(lineWidth, MIN_LINE_WIDTH);
    }

    public LineCap lineCap() {
        return lineCap;
    }

    public void setLineCap(LineCap lineCap) {
        this.lineCap = Objects.requireNonNull(lineCap);
    }

    public LineJoin lineJoin() {
        return lineJoin;
    }

    public void setLineJoin(LineJoin lineJoin) {
        this.lineJoin = Objects.requireNonNull(lineJoin);
    }

    public List<Double> dashArray() {
        return dashArray;
    }

    public double dashPhase() {
        return dashPhase;
    }

    public void setDash(List<Double> dashArray, double dashPhase) {
        this.dashArray = List.copyOf(dashArray);
        this.dashPhase = dashPhase;
    }

    public double miterLimit() {
        return miterLimit;
    }

    public void setMiterLimit(double miterLimit) {
        this.miterLimit = miterLimit;
    }

    public boolean strokeAdjustment() {
        return strokeAdjustment;
    }

    public void setStrokeAdjustment(boolean strokeAdjustment) {
        this.strokeAdjustment = strokeAdjustment;
    }

    // ── Printer-only and compositing parameters ─────────────────────────

    public boolean overprintStroke() {
        return overprintStroke;
    }

    public void setOverprintStroke(boolean overprintStroke) {
        this.overprintStroke = overprintStroke;
    }

    public boolean overprintFill() {
        return overprintFill;
    }

    public void setOverprintFill(boolean overprintFill) {
        this.overprintFill = overprintFill;
    }

    public int overprintMode() {
        return overprintMode;
    }

    public void setOverprintMode(int overprintMode) {
        this.overprintMode = overprintMode;
    }

    public String renderingIntent() {
        return renderingIntent;
    }

    public void setRenderingIntent(String renderingIntent) {
        this.renderingIntent = renderingIntent;
    }

    public double flatness() {
        return flatness;
    }

    public void setFlatness(double flatness) {
        this.flatness = flatness;
    }

    public String blendMode() {
        return blendMode;
    }

    public void setBlendMode(String blendMode) {
        this.blendMode = blendMode;
    }

    // ── Clipping (recorded, never applied) ──────────────────────────────

    public List<ClipRegion> clipRegions() {
        return clipRegions;
    }

    public void addClipRegion(ClipRegion region) {
        List<ClipRegion> regions = new ArrayList<>(clipRegions);
        regions.add(region);
        clipRegions = List.copyOf(regions);
    }

    // ── Text state ──────────────────────────────────────────────────────

    public TextMatrix textMatrix() {
        return textMatrix;
    }

    public TextMatrix textLineMatrix() {
        return textLineMatrix;
    }

    /** Sets both the text matrix and the text line matrix ({@code Tm}, and {@code BT}). */
    public void setTextMatrices(TextMatrix matrix) {
        this.textMatrix = matrix;
        this.textLineMatrix = matrix;
    }

    /**
     * Offsets the translation of the text line matrix and copies it into the text matrix. The
     * rotation/skew components are left alone.
     */
    public void translateTextLine(double dx, double dy) {
        textLineMatrix =
                textLineMatrix.withTranslation(textLineMatrix.e() + dx, textLineMatrix.f() + dy);
        textMatrix = textLineMatrix;
    }

    /** Moves the text matrix x translation forward by {@code dx}. */
    public void advanceText(double dx) {
        textMatrix = textMatrix.withTranslation(textMatrix.e() + dx, textMatrix.f());
    }

    public double textX() {
        return textMatrix.e();
    }

    public double textY() {
        return textMatrix.f();
    }

    public double charSpacing() {
        return charSpacing;
    }

    public void setCharSpacing(double charSpacing) {
        this.charSpacing = charSpacing;
    }

    public double wordSpacing() {
        return wordSpacing;
    }

    public void setWordSpacing(double wordSpacing) {
        this.wordSpacing = wordSpacing;
    }

    public double horizontalScaling() {
        return horizontalScaling;
    }

    /** Sets horizontal scaling as a fraction (the {@code Tz} operand divided by 100). */
    public void setHorizontalScaling(double horizontalScaling) {
        this.horizontalScaling = horizontalScaling;
    }

    public double leading() {
        return leading;
    }

    public void setLeading(double leading) {
        this.leading = leading;
    }

    public String fontResource() {
        return fontResource;
    }

    public String baseFont() {
        return baseFont;
    }

    public double fontSize() {
        return fontSize;
    }

    public void setFont(String fontResource, String baseFont, double fontSize) {
        this.fontResource = fontResource;
        this.baseFont = baseFont;
        this.fontSize = fontSize;
    }

    public double textRise() {
        return textRise;
    }

    public void setTextRise(double textRise) {
        this.textRise = textRise;
    }

    public int textRenderMode() {
        return textRenderMode;
    }

    public void setTextRenderMode(int textRenderMode) {
        this.textRenderMode = textRenderMode;
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphicsState other)) return false;
        return Double.compare(strokeAlpha, other.strokeAlpha) == 0
                && Double.compare(fillAlpha, other.fillAlpha) == 0
                && Double.compare(lineWidth, other.lineWidth) == 0
                && Double.compare(dashPhase, other.dashPhase) == 0
                && Double.compare(miterLimit, other.miterLimit) == 0
                && strokeAdjustment == other.strokeAdjustment
                && overprintStroke == other.overprintStroke
                && overprintFill == other.overprintFill
                && overprintMode == other.overprintMode
                && Double.compare(flatness, other.flatness) == 0
                && Double.compare(charSpacing, other.charSpacing) == 0
                && Double.compare(wordSpacing, other.wordSpacing) == 0
                && Double.compare(horizontalScaling, other.horizontalScaling) == 0
                && Double.compare(leading, other.leading) == 0
                && Double.compare(fontSize, other.fontSize) == 0
                && Double.compare(textRise, other.textRise) == 0
                && textRenderMode == other.textRenderMode
                && strokeColor.equals(other.strokeColor)
                && fillColor.equals(other.fillColor)
                && Objects.equals(strokeColorSpace, other.strokeColorSpace)
                && Objects.equals(fillColorSpace, other.fillColorSpace)
                && lineCap == other.lineCap
                && lineJoin == other.lineJoin
                && dashArray.equals(other.dashArray)
                && Objects.equals(renderingIntent, other.renderingIntent)
                && Objects.equals(blendMode, other.blendMode)
                && clipRegions.equals(other.clipRegions)
                && textMatrix.equals(other.textMatrix)
                && textLineMatrix.equals(other.textLineMatrix)
                && Objects.equals(fontResource, other.fontResource)
                && Objects.equals(baseFont, other.baseFont);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                strokeColor,
                fillColor,
                strokeAlpha,
                fillAlpha,
                lineWidth,
                lineCap,
                lineJoin,
                dashArray,
                textMatrix,
                textLineMatrix,
                fontResource,
                fontSize);
    }

    @Override
    public String toString() {
        return "GraphicsState[stroke="
                + strokeColor
                + "@"
                + strokeAlpha
                + ", fill="
                + fillColor
                + "@"
                + fillAlpha
                + ", lineWidth="
                + lineWidth
                + ", font="
                + baseFont
                + " "
                + fontSize
                + ", tm="
                + textMatrix
                + "]";
    }
}

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

import com.itextpdf.kernel.exceptions.PdfException;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.font.AwtTextExtent;
import net.boyechko.pdf.drawlist.font.FontResolver;
import net.boyechko.pdf.drawlist.font.StandardFontMetrics;
import net.boyechko.pdf.drawlist.font.TextExtent;
import net.boyechko.pdf.drawlist.font.TextMetrics;
import net.boyechko.pdf.drawlist.image.Bitmap;
import net.boyechko.pdf.drawlist.image.FilterCodecs;
import net.boyechko.pdf.drawlist.image.ImageDecodePipeline;
import net.boyechko.pdf.drawlist.image.ImageDecodeResult;
import net.boyechko.pdf.drawlist.image.ImageResource;
import net.boyechko.pdf.drawlist.image.ImageResourceReader;
import net.boyechko.pdf.drawlist.image.ItextFilterCodecs;
import net.boyechko.pdf.drawlist.issue.IssueLoc;
import net.boyechko.pdf.drawlist.issue.IssueReporter;
import net.boyechko.pdf.drawlist.issue.IssueSev;
import net.boyechko.pdf.drawlist.issue.IssueType;
import net.boyechko.pdf.drawlist.path.CurveVariant;
import net.boyechko.pdf.drawlist.path.FillRule;
import net.boyechko.pdf.drawlist.path.PaintOp;
import net.boyechko.pdf.drawlist.path.PathAccumulator;
import net.boyechko.pdf.drawlist.state.GraphicsState;
import net.boyechko.pdf.drawlist.state.LineCap;
import net.boyechko.pdf.drawlist.state.LineJoin;
import net.boyechko.pdf.drawlist.state.RgbColor;
import net.boyechko.pdf.drawlist.state.TextMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets tokenized content stream operations into draw commands.
 *
 * <p>Each call to {@link #interpret} starts a fresh scope: default graphics state, empty save
 * stack, no open text object. Form XObjects re-enter the interpreter in a nested scope and
 * their expansions are cached in the {@link FormCache}. The finished top-level list goes
 * through {@link TransformFoldPass} once.
 *
 * <p>An instance is single-threaded. Issues are deduplicated for the lifetime of its {@link
 * IssueReporter}.
 */
public class OperatorInterpreter {
    private static final Logger logger = LoggerFactory.getLogger(OperatorInterpreter.class);

    public static final int DEFAULT_MAX_FORM_DEPTH = 12;

    private static final List<DrawCommand> NONE = List.of();

    private final IssueReporter reporter;
    private final FontResolver fontResolver;
    private final TextLayout textLayout;
    private final ImageDecodePipeline imagePipeline;
    private final FormCache formCache;
    private final ContentTokenizer tokenizer;
    private final FormCacheScope formCacheScope;
    private final int maxFormDepth;
    private final ExtGStateApplier extGStateApplier;
    private final Deque<FormKey> formsInProgress = new ArrayDeque<>();

    public static class OperatorInterpreterBuilder {
        private IssueReporter reporter;
        private FontResolver fontResolver;
        private TextMetrics textMetrics;
        private TextExtent textExtent;
        private FilterCodecs filterCodecs;
        private FormCache formCache;
        private ContentTokenizer tokenizer;
        private FormCacheScope formCacheScope = FormCacheScope.RESOURCES;
        private double fontScaleMetrics = 1.0;
        private double fontScaleSize = 1.0;
        private int maxFormDepth = DEFAULT_MAX_FORM_DEPTH;

        public OperatorInterpreterBuilder withReporter(IssueReporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public OperatorInterpreterBuilder withFontResolver(FontResolver fontResolver) {
            this.fontResolver = fontResolver;
            return this;
        }

        public OperatorInterpreterBuilder withTextMetrics(TextMetrics textMetrics) {
            this.textMetrics = textMetrics;
            return this;
        }

        public OperatorInterpreterBuilder withTextExtent(TextExtent textExtent) {
            this.textExtent = textExtent;
            return this;
        }

        public OperatorInterpreterBuilder withFilterCodecs(FilterCodecs filterCodecs) {
            this.filterCodecs = filterCodecs;
            return this;
        }

        public OperatorInterpreterBuilder withFormCache(FormCache formCache) {
            this.formCache = formCache;
            return this;
        }

        public OperatorInterpreterBuilder withTokenizer(ContentTokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        public OperatorInterpreterBuilder withFormCacheScope(FormCacheScope formCacheScope) {
            this.formCacheScope = formCacheScope;
            return this;
        }

        public OperatorInterpreterBuilder withFontScales(double metrics, double size) {
            this.fontScaleMetrics = metrics;
            this.fontScaleSize = size;
            return this;
        }

        public OperatorInterpreterBuilder withMaxFormDepth(int maxFormDepth) {
            this.maxFormDepth = maxFormDepth;
            return this;
        }

        public OperatorInterpreter build() {
            if (tokenizer == null) {
                throw new IllegalStateException(
                        "ContentTokenizer must be provided via withTokenizer(...) "
                                + "before building OperatorInterpreter");
            }
            if (reporter == null) {
                reporter = new IssueReporter();
            }
            if (fontResolver == null) {
                fontResolver = new FontResolver(reporter);
            }
            if (textMetrics == null) {
                textMetrics = new StandardFontMetrics();
            }
            if (textExtent == null) {
                textExtent = new AwtTextExtent();
            }
            if (filterCodecs == null) {
                filterCodecs = new ItextFilterCodecs();
            }
            if (formCache == null) {
                formCache = new FormCache();
            }
            return new OperatorInterpreter(this);
        }
    }

    private OperatorInterpreter(OperatorInterpreterBuilder builder) {
        this.reporter = builder.reporter;
        this.fontResolver = builder.fontResolver;
        this.textLayout =
                new TextLayout(
                        builder.fontResolver,
                        builder.textMetrics,
                        builder.textExtent,
                        builder.fontScaleMetrics,
                        builder.fontScaleSize);
        this.imagePipeline = new ImageDecodePipeline(builder.filterCodecs);
        this.formCache = builder.formCache;
        this.tokenizer = builder.tokenizer;
        this.formCacheScope = builder.formCacheScope;
        this.maxFormDepth = builder.maxFormDepth;
        this.extGStateApplier = new ExtGStateApplier(builder.reporter);
    }

    /** Interprets one page or form content stream with a fresh graphics state. */
    public InterpretationResult interpret(
            List<ContentOperation> operations, ResourceScope resources) {
        Frame frame = new Frame(resources, new GraphicsState(), 0);
        run(frame, operations);
        int closed = frame.closeOutstandingSaves();
        return new InterpretationResult(
                TransformFoldPass.apply(frame.out), frame.state.copy(), closed);
    }

    public IssueReporter reporter() {
        return reporter;
    }

    public FormCache formCache() {
        return formCache;
    }

    /** One interpreter scope: a page, or a form being expanded. */
    private final class Frame {
        private final ResourceScope resources;
        private final int depth;
        private final GraphicsState initial;
        private final Deque<GraphicsState> saved = new ArrayDeque<>();
        private final PathAccumulator path = new PathAccumulator();
        private final List<DrawCommand> out = new ArrayList<>();
        private GraphicsState state;
        private boolean inText;

        private Frame(ResourceScope resources, GraphicsState start, int depth) {
            this.resources = resources;
            this.depth = depth;
            this.initial = start.copy();
            this.state = start;
        }

        private IssueLoc at(String operator) {
            return IssueLoc.atOperator(null, resources.scopeId(), operator);
        }

        /** Pops every save still open at end of stream, emitting the matching PopStates. */
        private int closeOutstandingSaves() {
            path.reset();
            int open = saved.size();
            if (open > 0) {
                reporter.reportOnce(
                        IssueType.UNBALANCED_STATE_STACK,
                        IssueSev.WARNING,
                        resources.scopeId(),
                        IssueLoc.inScope(resources.scopeId()),
                        open + " save(s) still open at end of content stream; closing them");
                while (!saved.isEmpty()) {
                    state = saved.pop();
                    out.add(new DrawCommand.PopState());
                }
            }
            return open;
        }
    }

    private void run(Frame frame, List<ContentOperation> operations) {
        for (ContentOperation op : operations) {
            Optional<Operator> operator = Operator.fromSymbol(op.operator());
            if (operator.isEmpty()) {
                reporter.reportOnce(
                        IssueType.UNKNOWN_OPERATOR,
                        IssueSev.WARNING,
                        op.operator(),
                        frame.at(op.operator()),
                        "Operator '" + op.operator() + "' is not recognised");
                continue;
            }
            try {
                frame.out.addAll(dispatch(frame, operator.get(), new Operands(op)));
            } catch (OperandException | IllegalArgumentException e) {
                reporter.reportOnce(
                        IssueType.MALFORMED_OPERANDS,
                        IssueSev.WARNING,
                        op.operator(),
                        frame.at(op.operator()),
                        "Skipped '" + op + "': " + e.getMessage());
            }
        }
    }

    private List<DrawCommand> dispatch(Frame frame, Operator operator, Operands args)
            throws OperandException {
        GraphicsState gs = frame.state;
        return switch (operator) {
            // ── General graphics state ─────────────────────────────────
            case LINE_WIDTH -> set(() -> gs.setLineWidth(args.number(0)));
            case LINE_CAP -> set(() -> gs.setLineCap(LineCap.fromPdf(args.integer(0))));
            case LINE_JOIN -> set(() -> gs.setLineJoin(LineJoin.fromPdf(args.integer(0))));
            case MITER_LIMIT -> set(() -> gs.setMiterLimit(args.number(0)));
            case DASH -> setDash(gs, args);
            case RENDERING_INTENT -> set(() -> gs.setRenderingIntent(args.name(0)));
            case FLATNESS -> set(() -> gs.setFlatness(args.number(0)));
            case EXT_GSTATE -> applyExtGState(frame, args);

            // ── Special graphics state ─────────────────────────────────
            case SAVE -> save(frame);
            case RESTORE -> restore(frame);
            case CONCAT_MATRIX -> concat(args);

            // ── Path construction and painting ─────────────────────────
            case MOVE_TO -> set(() -> frame.path.moveTo(args.number(0), args.number(1)));
            case LINE_TO -> set(() -> frame.path.lineTo(args.number(0), args.number(1)));
            case CURVE_TO -> curve(frame, CurveVariant.EXPLICIT, args);
            case CURVE_TO_V -> curve(frame, CurveVariant.INITIAL_IMPLICIT, args);
            case CURVE_TO_Y -> curve(frame, CurveVariant.FINAL_IMPLICIT, args);
            case CLOSE_SUBPATH -> set(frame.path::close);
            case RECTANGLE -> rectangle(frame, args);
            case STROKE,
                    CLOSE_STROKE,
                    FILL,
                    FILL_COMPAT,
                    FILL_EVEN_ODD,
                    FILL_STROKE,
                    FILL_STROKE_EVEN_ODD,
                    CLOSE_FILL_STROKE,
                    CLOSE_FILL_STROKE_EVEN_ODD,
                    END_PATH -> paint(frame, operator);
            case CLIP -> set(() -> frame.path.clip(FillRule.NONZERO_WINDING));
            case CLIP_EVEN_ODD -> set(() -> frame.path.clip(FillRule.EVEN_ODD));

            // ── Text objects and text state ────────────────────────────
            case BEGIN_TEXT -> beginText(frame);
            case END_TEXT -> set(() -> frame.inText = false);
            case CHAR_SPACING -> set(() -> gs.setCharSpacing(args.number(0)));
            case WORD_SPACING -> set(() -> gs.setWordSpacing(args.number(0)));
            case HORIZONTAL_SCALING -> set(() -> gs.setHorizontalScaling(args.number(0) / 100));
            case LEADING -> set(() -> gs.setLeading(args.number(0)));
            case FONT -> selectFont(frame, args);
            case RENDER_MODE -> set(() -> gs.setTextRenderMode(args.integer(0)));
            case RISE -> set(() -> gs.setTextRise(args.number(0)));

            // ── Text positioning and showing ───────────────────────────
            case MOVE_TEXT -> inText(frame, operator, () -> moveText(gs, args, false));
            case MOVE_TEXT_SET_LEADING -> inText(frame, operator, () -> moveText(gs, args, true));
            case TEXT_MATRIX -> inText(frame, operator, () -> setTextMatrix(gs, args));
            case NEXT_LINE -> inText(frame, operator, () -> nextLine(gs));
            case SHOW_TEXT -> showText(frame, operator, () -> textLayout.show(args.string(0), gs));
            case SHOW_TEXT_ARRAY -> showText(frame, operator, () -> showArray(gs, args.array(0)));
            case NEXT_LINE_SHOW -> showText(frame, operator, () -> nextLineShow(gs, args));
            case NEXT_LINE_SPACING_SHOW -> showText(
                    frame, operator, () -> nextLineSpacingShow(gs, args));

            // ── Colour ─────────────────────────────────────────────────
            case STROKE_COLOR_SPACE -> set(() -> {
                gs.setStrokeColorSpace(args.name(0));
                gs.setStrokeColor(RgbColor.BLACK);
            });
            case FILL_COLOR_SPACE -> set(() -> {
                gs.setFillColorSpace(args.name(0));
                gs.setFillColor(RgbColor.BLACK);
            });
            case STROKE_COLOR, STROKE_COLOR_N -> setColorComponents(frame, operator, args, true);
            case FILL_COLOR, FILL_COLOR_N -> setColorComponents(frame, operator, args, false);
            case STROKE_GRAY -> set(() -> {
                gs.setStrokeColorSpace(DEVICE_GRAY);
                gs.setStrokeColor(RgbColor.fromGray(args.number(0)));
            });
            case FILL_GRAY -> set(() -> {
                gs.setFillColorSpace(DEVICE_GRAY);
                gs.setFillColor(RgbColor.fromGray(args.number(0)));
            });
            case STROKE_RGB -> set(() -> {
                double[] rgb = args.numbers(3);
                gs.setStrokeColorSpace(DEVICE_RGB);
                gs.setStrokeColor(RgbColor.fromRgb(rgb[0], rgb[1], rgb[2]));
            });
            case FILL_RGB -> set(() -> {
                double[] rgb = args.numbers(3);
                gs.setFillColorSpace(DEVICE_RGB);
                gs.setFillColor(RgbColor.fromRgb(rgb[0], rgb[1], rgb[2]));
            });
            case STROKE_CMYK -> set(() -> {
                double[] cmyk = args.numbers(4);
                gs.setStrokeColorSpace(DEVICE_CMYK);
                gs.setStrokeColor(RgbColor.fromCmyk(cmyk[0], cmyk[1], cmyk[2], cmyk[3]));
            });
            case FILL_CMYK -> set(() -> {
                double[] cmyk = args.numbers(4);
                gs.setFillColorSpace(DEVICE_CMYK);
                gs.setFillColor(RgbColor.fromCmyk(cmyk[0], cmyk[1], cmyk[2], cmyk[3]));
            });

            // ── XObjects and images ────────────────────────────────────
            case XOBJECT -> invokeXObject(frame, args.name(0));
            case INLINE_IMAGE -> drawImage(frame, args.stream(0), "inline image", operator);
            case INLINE_IMAGE_DATA, INLINE_IMAGE_END -> {
                logger.debug("Stray '{}' outside an inline image", operator.symbol());
                yield NONE;
            }

            // ── Unsupported ────────────────────────────────────────────
            case SHADING, GLYPH_WIDTH, GLYPH_WIDTH_BBOX -> unsupported(frame, operator);

            // ── Marked content and compatibility sections carry no drawing ──
            case MARK_POINT,
                    MARK_POINT_PROPS,
                    BEGIN_MARKED,
                    BEGIN_MARKED_PROPS,
                    END_MARKED,
                    BEGIN_COMPAT,
                    END_COMPAT -> NONE;
        };
    }

    private static final String DEVICE_GRAY = "DeviceGray";
    private static final String DEVICE_RGB = "DeviceRGB";
    private static final String DEVICE_CMYK = "DeviceCMYK";

    @FunctionalInterface
    private interface StateChange {
        void apply() throws OperandException;
    }

    @FunctionalInterface
    private interface Emitter {
        List<DrawCommand> emit() throws OperandException;
    }

    private static List<DrawCommand> set(StateChange change) throws OperandException {
        change.apply();
        return NONE;
    }

    // ── Graphics state ──────────────────────────────────────────────────

    private static List<DrawCommand> setDash(GraphicsState gs, Operands args)
            throws OperandException {
        PdfArray pattern = args.array(0);
        List<Double> lengths = new ArrayList<>();
        for (PdfObject length : pattern) {
            if (!(length instanceof PdfNumber number)) {
                throw new OperandException("d dash array holds a non-number: " + length);
            }
            lengths.add(number.doubleValue());
        }
        gs.setDash(lengths, args.number(1));
        return NONE;
    }

    private List<DrawCommand> applyExtGState(Frame frame, Operands args) throws OperandException {
        String name = args.name(0);
        Optional<PdfDictionary> extGState = frame.resources.extGState(name);
        if (extGState.isEmpty()) {
            missingResource(frame, "ExtGState", name, Operator.EXT_GSTATE);
            return NONE;
        }
        extGStateApplier.apply(
                extGState.get(), frame.state, frame.at(Operator.EXT_GSTATE.symbol()));
        return NONE;
    }

    private static List<DrawCommand> save(Frame frame) {
        frame.saved.push(frame.state.copy());
        return List.of(new DrawCommand.PushState());
    }

    private List<DrawCommand> restore(Frame frame) {
        if (frame.saved.isEmpty()) {
            reporter.reportOnce(
                    IssueType.STATE_STACK_UNDERFLOW,
                    IssueSev.WARNING,
                    frame.resources.scopeId(),
                    frame.at(Operator.RESTORE.symbol()),
                    "Restore without a matching save; resetting to the initial state");
            frame.state = frame.initial.copy();
        } else {
            frame.state = frame.saved.pop();
        }
        return List.of(new DrawCommand.PopState());
    }

    /** Emits the matrix with b, c and f negated for the y-down device space. */
    private static List<DrawCommand> concat(Operands args) throws OperandException {
        double[] m = args.numbers(6);
        return List.of(
                new DrawCommand.ConcatTransform(
                        m[0], 0.0 - m[1], 0.0 - m[2], m[3], m[4], 0.0 - m[5]));
    }

    // ── Paths ───────────────────────────────────────────────────────────

    private static List<DrawCommand> curve(Frame frame, CurveVariant variant, Operands args)
            throws OperandException {
        frame.path.curveTo(variant, args.numbers(variant.operandCount()));
        return NONE;
    }

    private static List<DrawCommand> rectangle(Frame frame, Operands args)
            throws OperandException {
        double[] r = args.numbers(4);
        frame.path.rect(r[0], r[1], r[2], r[3]);
        return NONE;
    }

    private static List<DrawCommand> paint(Frame frame, Operator operator) {
        PaintOp op =
                PaintOp.fromOperator(operator.symbol())
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Not a paint operator: " + operator));
        return frame.path.resolve(op, frame.state);
    }

    // ── Text ────────────────────────────────────────────────────────────

    private static List<DrawCommand> beginText(Frame frame) {
        frame.inText = true;
        frame.state.setTextMatrices(TextMatrix.IDENTITY);
        return NONE;
    }

    private List<DrawCommand> selectFont(Frame frame, Operands args) throws OperandException {
        String resourceName = args.name(0);
        double size = args.number(1);
        Optional<String> baseFont = frame.resources.baseFont(resourceName);
        if (baseFont.isEmpty()) {
            missingResource(frame, "Font", resourceName, Operator.FONT);
            frame.state.setFont(resourceName, null, size);
            return NONE;
        }
        fontResolver.resolve(baseFont.get());
        frame.state.setFont(resourceName, baseFont.get(), size);
        return NONE;
    }

    private static List<DrawCommand> inText(Frame frame, Operator operator, StateChange change)
            throws OperandException {
        if (!frame.inText) {
            logger.debug("'{}' outside BT/ET ignored", operator.symbol());
            return NONE;
        }
        change.apply();
        return NONE;
    }

    private static List<DrawCommand> showText(Frame frame, Operator operator, Emitter emitter)
            throws OperandException {
        if (!frame.inText) {
            logger.debug("'{}' outside BT/ET ignored", operator.symbol());
            return NONE;
        }
        return emitter.emit();
    }

    private static void moveText(GraphicsState gs, Operands args, boolean setLeading)
            throws OperandException {
        double tx = args.number(0);
        double ty = args.number(1);
        if (setLeading) {
            gs.setLeading(0.0 - ty);
        }
        gs.translateTextLine(tx, ty);
    }

    private static void setTextMatrix(GraphicsState gs, Operands args) throws OperandException {
        double[] m = args.numbers(6);
        gs.setTextMatrices(new TextMatrix(m[0], m[1], m[2], m[3], m[4], m[5]));
    }

    private static void nextLine(GraphicsState gs) {
        gs.translateTextLine(0, 0.0 - gs.leading());
    }

    /** Shows each string of a {@code TJ} array; numeric adjustments are ignored. */
    private List<DrawCommand> showArray(GraphicsState gs, PdfArray items) {
        List<DrawCommand> out = new ArrayList<>();
        for (PdfObject item : items) {
            if (item instanceof PdfString string) {
                out.addAll(textLayout.show(string.getValueBytes(), gs));
            }
        }
        return out;
    }

    private List<DrawCommand> nextLineShow(GraphicsState gs, Operands args)
            throws OperandException {
        byte[] text = args.string(0);
        nextLine(gs);
        return textLayout.show(text, gs);
    }

    private List<DrawCommand> nextLineSpacingShow(GraphicsState gs, Operands args)
            throws OperandException {
        double wordSpacing = args.number(0);
        double charSpacing = args.number(1);
        byte[] text = args.string(2);
        gs.setWordSpacing(wordSpacing);
        gs.setCharSpacing(charSpacing);
        nextLine(gs);
        return textLayout.show(text, gs);
    }

    // ── Colour ──────────────────────────────────────────────────────────

    private List<DrawCommand> setColorComponents(
            Frame frame, Operator operator, Operands args, boolean stroke)
            throws OperandException {
        GraphicsState gs = frame.state;
        String space = stroke ? gs.strokeColorSpace() : gs.fillColorSpace();
        String device = deviceSpace(frame.resources, space);
        if (device == null) {
            reporter.reportOnce(
                    IssueType.UNSUPPORTED_COLOR_SPACE,
                    IssueSev.WARNING,
                    space,
                    frame.at(operator.symbol()),
                    "Colours in colour space "
                            + space
                            + " are not supported; keeping previous colour");
            return NONE;
        }
        double[] c = args.numbers();
        RgbColor color =
                switch (c.length) {
                    case 1 -> RgbColor.fromGray(c[0]);
                    case 3 -> RgbColor.fromRgb(c[0], c[1], c[2]);
                    case 4 -> RgbColor.fromCmyk(c[0], c[1], c[2], c[3]);
                    default -> throw new OperandException(
                            operator.symbol() + " expects 1, 3 or 4 components, got " + c.length);
                };
        if (stroke) {
            gs.setStrokeColor(color);
        } else {
            gs.setFillColor(color);
        }
        return NONE;
    }

    /** Resolves a colour space name to a device space name, or null if it is not one. */
    private static String deviceSpace(ResourceScope resources, String space) {
        if (isDeviceSpace(space)) {
            return space;
        }
        Optional<PdfObject> named = resources.colorSpace(space);
        if (named.isPresent()
                && named.get() instanceof PdfName name
                && isDeviceSpace(name.getValue())) {
            return name.getValue();
        }
        return null;
    }

    private static boolean isDeviceSpace(String space) {
        return DEVICE_GRAY.equals(space) || DEVICE_RGB.equals(space) || DEVICE_CMYK.equals(space);
    }

    // ── XObjects ────────────────────────────────────────────────────────

    private List<DrawCommand> invokeXObject(Frame frame, String name) {
        Optional<PdfStream> xObject = frame.resources.xObject(name);
        if (xObject.isEmpty()) {
            missingResource(frame, "XObject", name, Operator.XOBJECT);
            return NONE;
        }
        PdfStream stream = xObject.get();
        PdfName subtype = stream.getAsName(PdfName.Subtype);
        if (PdfName.Image.equals(subtype)) {
            return drawImage(frame, stream, "image " + name, Operator.XOBJECT);
        } else if (PdfName.Form.equals(subtype)) {
            return drawForm(frame, name, stream);
        }
        reporter.reportOnce(
                IssueType.UNSUPPORTED_OPERATOR,
                IssueSev.WARNING,
                "Do/" + subtype,
                frame.at(Operator.XOBJECT.symbol()),
                "XObject " + name + " has unsupported subtype " + subtype);
        return NONE;
    }

    private List<DrawCommand> drawImage(
            Frame frame, PdfStream stream, String label, Operator operator) {
        IssueLoc where = frame.at(operator.symbol());
        try {
            ImageResourceReader reader =
                    new ImageResourceReader(
                            cs -> frame.resources.colorSpace(cs.getValue()).orElse(null));
            ImageResource image = reader.read(stream);
            ImageDecodeResult result = imagePipeline.decode(image);
            if (result instanceof ImageDecodeResult.Decoded decoded) {
                Bitmap bitmap = decoded.bitmap();
                return List.of(
                        new DrawCommand.DrawBitmap(
                                bitmap, 0, 0.0 - bitmap.height(), bitmap.width(), bitmap.height()));
            }
            ImageDecodeResult.Skipped skipped = (ImageDecodeResult.Skipped) result;
            reporter.reportOnce(
                    skipped.reason(),
                    IssueSev.WARNING,
                    skipped.cause(),
                    where,
                    "Skipped " + label + ": " + skipped.detail());
        } catch (RuntimeException e) {
            logger.debug("Image {} failed to decode", label, e);
            reporter.reportOnce(
                    IssueType.IMAGE_DECODE_FAILED,
                    IssueSev.WARNING,
                    String.valueOf(e.getMessage()),
                    where,
                    "Skipped " + label + ": " + e.getMessage());
        }
        return NONE;
    }

    private List<DrawCommand> drawForm(Frame frame, String name, PdfStream form) {
        FormKey key = formCacheScope.keyFor(frame.resources, name);
        if (formsInProgress.contains(key) || frame.depth >= maxFormDepth) {
            reporter.reportOnce(
                    IssueType.RECURSIVE_FORM,
                    IssueSev.WARNING,
                    key.toString(),
                    frame.at(Operator.XOBJECT.symbol()),
                    "Form " + name + " is already being expanded or nests deeper than "
                            + maxFormDepth + " levels; skipped");
            return NONE;
        }
        return formCache.getOrExpand(key, () -> expandForm(frame, key, form));
    }

    /** Runs {@code q, cm(Matrix), content, Q} in a nested scope seeded with the caller's state. */
    private List<DrawCommand> expandForm(Frame caller, FormKey key, PdfStream form) {
        formsInProgress.push(key);
        try {
            ResourceScope formResources = caller.resources.forForm(form);
            List<ContentOperation> ops = new ArrayList<>();
            ops.add(ContentOperation.of(Operator.SAVE.symbol()));
            ops.add(new ContentOperation(Operator.CONCAT_MATRIX.symbol(), formMatrix(form)));
            ops.addAll(tokenizer.tokenize(form.getBytes(), formResources));
            ops.add(ContentOperation.of(Operator.RESTORE.symbol()));

            Frame frame = new Frame(formResources, caller.state.copy(), caller.depth + 1);
            run(frame, ops);
            frame.closeOutstandingSaves();
            logger.debug("Expanded form {} ({} operations)", key, ops.size());
            return frame.out;
        } catch (IOException | PdfException e) {
            reporter.reportOnce(
                    IssueType.MISSING_RESOURCE,
                    IssueSev.WARNING,
                    "Form/" + key,
                    caller.at(Operator.XOBJECT.symbol()),
                    "Content of form " + key.name() + " could not be read: " + e.getMessage());
            return NONE;
        } finally {
            formsInProgress.pop();
        }
    }

    private static List<PdfObject> formMatrix(PdfStream form) {
        PdfArray matrix = form.getAsArray(PdfName.Matrix);
        if (matrix != null && matrix.size() == 6) {
            List<PdfObject> values = new ArrayList<>();
            for (PdfObject value : matrix) {
                values.add(value);
            }
            return values;
        }
        return List.of(
                new PdfNumber(1), new PdfNumber(0), new PdfNumber(0),
                new PdfNumber(1), new PdfNumber(0), new PdfNumber(0));
    }

    // == helpers ==

    private List<DrawCommand> unsupported(Frame frame, Operator operator) {
        reporter.reportOnce(
                IssueType.UNSUPPORTED_OPERATOR,
                IssueSev.WARNING,
                operator.symbol(),
                frame.at(operator.symbol()),
                "Operator '" + operator.symbol() + "' is not supported");
        return NONE;
    }

    private void missingResource(Frame frame, String kind, String name, Operator operator) {
        reporter.reportOnce(
                IssueType.MISSING_RESOURCE,
                IssueSev.WARNING,
                kind + "/" + name + "@" + frame.resources.scopeId(),
                frame.at(operator.symbol()),
                kind + " resource " + name + " not found");
    }
}

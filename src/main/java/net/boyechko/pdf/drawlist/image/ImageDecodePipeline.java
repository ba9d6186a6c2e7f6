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
package net.boyechko.pdf.drawlist.image;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;
import javax.imageio.ImageIO;
import net.boyechko.pdf.drawlist.image.ColorSpaceSpec.Absent;
import net.boyechko.pdf.drawlist.image.ColorSpaceSpec.DeviceGray;
import net.boyechko.pdf.drawlist.image.ColorSpaceSpec.DeviceRgb;
import net.boyechko.pdf.drawlist.image.ColorSpaceSpec.Indexed;
import net.boyechko.pdf.drawlist.image.ImageDecodeResult.Decoded;
import net.boyechko.pdf.drawlist.image.ImageDecodeResult.Skipped;
import net.boyechko.pdf.drawlist.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes an {@link ImageResource} into an RGB {@link Bitmap}: filter chain, colour
 * resolution, de-indexing, then masking.
 *
 * <p>Data problems never throw; they come back as {@link Skipped}.
 */
public class ImageDecodePipeline {
    private static final Logger logger = LoggerFactory.getLogger(ImageDecodePipeline.class);

    private final FilterCodecs codecs;

    public ImageDecodePipeline(FilterCodecs codecs) {
        this.codecs = codecs;
    }

    public ImageDecodeResult decode(ImageResource image) {
        Optional<Skipped> badFilter = checkFilters(image);
        if (badFilter.isPresent()) {
            return badFilter.get();
        }
        boolean jpeg = image.hasFilter(StreamFilter.DCT);
        if (!jpeg && !isConvertible(image)) {
            String cause = colorSpaceCause(image);
            return new Skipped(
                    IssueType.UNSUPPORTED_COLOR_SPACE,
                    cause,
                    "Cannot convert " + cause + " at " + image.bitsPerComponent() + " bits");
        }

        try {
            byte[] data = runFilterChain(image);
            Bitmap bitmap =
                    jpeg
                            ? decodeJpeg(data)
                            : new Bitmap(image.width(), image.height(), toRgb(image, data));
            bitmap = applyMask(image, bitmap);
            logger.debug("Decoded {} to {}", image, bitmap);
            return new Decoded(bitmap);
        } catch (DecodeException | IllegalArgumentException e) {
            return new Skipped(IssueType.IMAGE_DECODE_FAILED, e.getMessage(), e.getMessage());
        }
    }

    /** Applies the codec stages present in the chain, in {@link StreamFilter#CHAIN_ORDER}. */
    byte[] runFilterChain(ImageResource image) throws DecodeException {
        byte[] data = image.data();
        for (StreamFilter filter : StreamFilter.CHAIN_ORDER) {
            FilterStage stage = image.stage(filter);
            if (stage != null) {
                data =
                        codecs.decode(
                                filter, data, stage.decodeParams(), image.width(), image.height());
            }
        }
        return data;
    }

    // == helpers ==

    private static Optional<Skipped> checkFilters(ImageResource image) {
        for (FilterStage stage : image.filters()) {
            Optional<StreamFilter> filter = stage.filter();
            boolean decodable =
                    filter.isPresent()
                            && (filter.get().isChainStage() || filter.get() == StreamFilter.DCT);
            if (!decodable) {
                return Optional.of(
                        new Skipped(
                                IssueType.UNSUPPORTED_FILTER,
                                stage.name(),
                                "Image filter /" + stage.name() + " is not supported"));
            }
        }
        return Optional.empty();
    }

    private static boolean isConvertible(ImageResource image) {
        int depth = image.bitsPerComponent();
        boolean indexableDepth = depth == 1 || depth == 2 || depth == 4 || depth == 8;
        ColorSpaceSpec cs = image.colorSpace();
        if (cs instanceof DeviceRgb) {
            return depth == 8;
        } else if (cs instanceof DeviceGray) {
            return indexableDepth;
        } else if (cs instanceof Indexed indexed) {
            return indexableDepth
                    && (indexed.base() instanceof DeviceRgb
                            || indexed.base() instanceof DeviceGray);
        } else if (cs instanceof Absent) {
            return depth == 1;
        }
        return false;
    }

    private static String colorSpaceCause(ImageResource image) {
        ColorSpaceSpec cs = image.colorSpace();
        if (cs instanceof DeviceRgb || cs instanceof DeviceGray || cs instanceof Absent) {
            return cs.name() + "@" + image.bitsPerComponent();
        }
        return cs.name();
    }

    private static byte[] toRgb(ImageResource image, byte[] data) throws DecodeException {
        int w = image.width();
        int h = image.height();
        int depth = image.bitsPerComponent();
        ColorSpaceSpec cs = image.colorSpace();
        if ((long) w * h > Bitmap.MAX_BYTES / Deindexer.RGB_CHUNK) {
            throw new DecodeException("Image " + w + "x" + h + " is too large to decode");
        }

        if (cs instanceof DeviceRgb) {
            int needed = Bitmap.byteCount(w, h, Deindexer.RGB_CHUNK);
            if (data.length < needed) {
                throw new DecodeException(
                        "RGB image " + w + "x" + h + " needs " + needed + " bytes, got "
                                + data.length);
            }
            return data.length == needed ? data : Arrays.copyOf(data, needed);
        }
        return Deindexer.deindex(w, h, data, depth, palette(cs, depth));
    }

    private static byte[] palette(ColorSpaceSpec cs, int depth) {
        if (cs instanceof Indexed indexed) {
            return indexed.base() instanceof DeviceGray
                    ? Palettes.expandGray(indexed.lookup())
                    : indexed.lookup();
        } else if (cs instanceof DeviceGray) {
            return Palettes.grayRamp(depth);
        }
        return Palettes.blackWhite();
    }

    private static Bitmap decodeJpeg(byte[] data) throws DecodeException {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                throw new DecodeException("DCTDecode: no JPEG reader accepted the data");
            }
            return Bitmap.fromImage(image);
        } catch (IOException e) {
            throw new DecodeException("DCTDecode failed: " + e.getMessage(), e);
        }
    }

    private Bitmap applyMask(ImageResource image, Bitmap bitmap) throws DecodeException {
        ImageMaskSpec mask = image.mask();
        if (mask instanceof ImageMaskSpec.ColorKey key) {
            ColorKeyMasker.Result result = ColorKeyMasker.apply(bitmap.rgb(), key);
            logger.debug("Colour key masked {} pixels", result.maskedCount());
            return new Bitmap(bitmap.width(), bitmap.height(), result.rgb())
                    .withMask(new BitmapMask.ColorKeyed(key.keyColor()), result.maskedCount());
        } else if (mask instanceof ImageMaskSpec.Explicit explicit) {
            ImageResource stencil = explicit.mask();
            Optional<Skipped> badFilter = checkFilters(stencil);
            if (badFilter.isPresent()) {
                throw new DecodeException("Mask " + badFilter.get().detail());
            }
            byte[] bits = runFilterChain(stencil);
            byte[] rgb =
                    Deindexer.deindex(
                            stencil.width(), stencil.height(), bits, 1, Palettes.blackWhite());
            return bitmap.withMask(
                    new BitmapMask.Stencil(stencil.width(), stencil.height(), rgb), 0);
        }
        return bitmap;
    }
}

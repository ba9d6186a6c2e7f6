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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an image XObject or inline-image stream into an {@link ImageResource}. Inline-image
 * abbreviations ({@code W H BPC CS F DP IM}) are accepted alongside the full key names.
 */
public class ImageResourceReader {
    private static final Logger logger = LoggerFactory.getLogger(ImageResourceReader.class);

    private static final PdfName W = new PdfName("W");
    private static final PdfName H = new PdfName("H");
    private static final PdfName BPC = new PdfName("BPC");
    private static final PdfName CS = new PdfName("CS");
    private static final PdfName F = new PdfName("F");
    private static final PdfName DP = new PdfName("DP");
    private static final PdfName IM = new PdfName("IM");

    private static final int MAX_COLOR_SPACE_NESTING = 4;

    private final Function<PdfName, PdfObject> namedColorSpaces;

    /**
     * @param namedColorSpaces looks up a {@code /ColorSpace} resource by name; returns null when
     *     absent
     */
    public ImageResourceReader(Function<PdfName, PdfObject> namedColorSpaces) {
        this.namedColorSpaces = namedColorSpaces;
    }

    /**
     * @throws IllegalArgumentException if the stream lacks a usable size or carries a malformed
     *     colour-key mask
     */
    public ImageResource read(PdfStream stream) {
        int width = intValue(stream, PdfName.Width, W);
        int height = intValue(stream, PdfName.Height, H);
        boolean stencil = isTrue(entry(stream, PdfName.ImageMask, IM));
        PdfObject bpcObj = entry(stream, PdfName.BitsPerComponent, BPC);
        int bpc = bpcObj instanceof PdfNumber n ? n.intValue() : stencil ? 1 : 8;

        ColorSpaceSpec colorSpace = colorSpace(entry(stream, PdfName.ColorSpace, CS), 0);
        List<FilterStage> filters =
                filters(entry(stream, PdfName.Filter, F), entry(stream, PdfName.DecodeParms, DP));

        byte[] data = stream.getBytes(false);
        if (data == null) {
            data = new byte[0];
        }
        return new ImageResource(width, height, bpc, colorSpace, filters, mask(stream), data);
    }

    // == helpers ==

    private ImageMaskSpec mask(PdfStream stream) {
        PdfObject mask = stream.get(PdfName.Mask);
        if (mask instanceof PdfArray range) {
            List<Integer> values = new ArrayList<>();
            for (PdfObject value : range) {
                if (!(value instanceof PdfNumber number)) {
                    throw new IllegalArgumentException(
                            "Colour-key mask holds a non-number: " + value);
                }
                values.add(number.intValue());
            }
            return ImageMaskSpec.ColorKey.of(values);
        } else if (mask instanceof PdfStream maskStream) {
            return new ImageMaskSpec.Explicit(read(maskStream));
        }
        if (stream.containsKey(PdfName.SMask)) {
            logger.debug("Soft mask ignored; image drawn opaque");
        }
        return null;
    }

    ColorSpaceSpec colorSpace(PdfObject cs, int nesting) {
        if (cs == null) {
            return new ColorSpaceSpec.Absent();
        }
        if (nesting > MAX_COLOR_SPACE_NESTING) {
            return new ColorSpaceSpec.Unsupported("nested");
        }
        if (cs instanceof PdfName name) {
            String value = name.getValue();
            switch (value) {
                case "DeviceRGB", "RGB":
                    return new ColorSpaceSpec.DeviceRgb();
                case "DeviceGray", "G":
                    return new ColorSpaceSpec.DeviceGray();
                case "DeviceCMYK", "CMYK", "Pattern":
                    return new ColorSpaceSpec.Unsupported(value);
                default:
                    PdfObject named = namedColorSpaces.apply(name);
                    return named != null
                            ? colorSpace(named, nesting + 1)
                            : new ColorSpaceSpec.Unsupported(value);
            }
        }
        if (cs instanceof PdfArray array && !array.isEmpty()) {
            PdfName family = array.getAsName(0);
            if (family == null) {
                return new ColorSpaceSpec.Unsupported("unnamed");
            }
            if ((PdfName.Indexed.equals(family) || new PdfName("I").equals(family))
                    && array.size() >= 4) {
                ColorSpaceSpec base = colorSpace(array.get(1), nesting + 1);
                PdfNumber hival = array.getAsNumber(2);
                byte[] lookup = lookupBytes(array.get(3));
                if (hival == null || lookup == null) {
                    return new ColorSpaceSpec.Unsupported("Indexed");
                }
                return new ColorSpaceSpec.Indexed(base, hival.intValue(), lookup);
            }
            if (array.size() == 1) {
                return colorSpace(family, nesting + 1);
            }
            return new ColorSpaceSpec.Unsupported(family.getValue());
        }
        return new ColorSpaceSpec.Unsupported(String.valueOf(cs));
    }

    private static byte[] lookupBytes(PdfObject lookup) {
        if (lookup instanceof PdfString string) {
            return string.getValueBytes();
        } else if (lookup instanceof PdfStream stream) {
            return stream.getBytes();
        }
        return null;
    }

    private static List<FilterStage> filters(PdfObject filterObj, PdfObject paramsObj) {
        List<FilterStage> stages = new ArrayList<>();
        if (filterObj instanceof PdfName name) {
            stages.add(new FilterStage(name.getValue(), paramsAt(paramsObj, 0)));
        } else if (filterObj instanceof PdfArray array) {
            for (int i = 0; i < array.size(); i++) {
                PdfName name = array.getAsName(i);
                if (name != null) {
                    stages.add(new FilterStage(name.getValue(), paramsAt(paramsObj, i)));
                }
            }
        }
        return stages;
    }

    private static PdfDictionary paramsAt(PdfObject paramsObj, int index) {
        if (paramsObj instanceof PdfDictionary dict && index == 0) {
            return dict;
        } else if (paramsObj instanceof PdfArray array && index < array.size()) {
            return array.getAsDictionary(index);
        }
        return null;
    }

    private static PdfObject entry(PdfDictionary dict, PdfName key, PdfName abbreviation) {
        PdfObject value = dict.get(key);
        return value != null ? value : dict.get(abbreviation);
    }

    private static int intValue(PdfDictionary dict, PdfName key, PdfName abbreviation) {
        PdfObject value = entry(dict, key, abbreviation);
        if (!(value instanceof PdfNumber number)) {
            throw new IllegalArgumentException("Image has no /" + key.getValue());
        }
        return number.intValue();
    }

    private static boolean isTrue(PdfObject value) {
        return value instanceof PdfBoolean bool && bool.getValue();
    }
}

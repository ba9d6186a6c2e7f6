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

import java.util.Locale;
import java.util.function.Function;
import net.boyechko.pdf.drawlist.interpret.FormCacheScope;
import net.boyechko.pdf.drawlist.interpret.OperatorInterpreter;

/**
 * Host-tunable rendering settings.
 *
 * @param fontScaleMetrics factor applied to the font size used for measuring text
 * @param fontScaleSize factor applied to the font size used for drawing text
 * @param formCacheScope how widely form expansions are shared
 * @param maxFormDepth deepest form nesting expanded before a form is skipped
 */
public record RenderSettings(
        double fontScaleMetrics,
        double fontScaleSize,
        FormCacheScope formCacheScope,
        int maxFormDepth) {

    public static final String PROP_FONT_SCALE_METRICS = "drawlist.font.scaleMetrics";
    public static final String PROP_FONT_SCALE_SIZE = "drawlist.font.scaleSize";
    public static final String PROP_FORM_CACHE_SCOPE = "drawlist.formCache.scope";
    public static final String PROP_MAX_FORM_DEPTH = "drawlist.form.maxDepth";

    public RenderSettings {
        if (fontScaleMetrics <= 0 || fontScaleSize <= 0) {
            throw new IllegalArgumentException(
                    "Font scales must be positive: " + fontScaleMetrics + ", " + fontScaleSize);
        }
        if (maxFormDepth < 1) {
            throw new IllegalArgumentException(
                    "Max form depth must be at least 1: " + maxFormDepth);
        }
        if (formCacheScope == null) {
            formCacheScope = FormCacheScope.RESOURCES;
        }
    }

    public static RenderSettings defaults() {
        return new RenderSettings(
                1.0, 1.0, FormCacheScope.RESOURCES, OperatorInterpreter.DEFAULT_MAX_FORM_DEPTH);
    }

    /**
     * Resolves each setting from a JVM system property, then the matching {@code DRAWLIST_*}
     * environment variable, then the default.
     */
    public static RenderSettings fromEnvironment() {
        return fromLookup(RenderSettings::lookupEnvironment);
    }

    static RenderSettings fromLookup(Function<String, String> lookup) {
        RenderSettings d = defaults();
        return new RenderSettings(
                parseDouble(lookup, PROP_FONT_SCALE_METRICS, d.fontScaleMetrics()),
                parseDouble(lookup, PROP_FONT_SCALE_SIZE, d.fontScaleSize()),
                parseScope(lookup.apply(PROP_FORM_CACHE_SCOPE), d.formCacheScope()),
                (int) parseDouble(lookup, PROP_MAX_FORM_DEPTH, d.maxFormDepth()));
    }

    public RenderSettings withFontScales(double metrics, double size) {
        return new RenderSettings(metrics, size, formCacheScope, maxFormDepth);
    }

    public RenderSettings withFormCacheScope(FormCacheScope scope) {
        return new RenderSettings(fontScaleMetrics, fontScaleSize, scope, maxFormDepth);
    }

    public RenderSettings withMaxFormDepth(int depth) {
        return new RenderSettings(fontScaleMetrics, fontScaleSize, formCacheScope, depth);
    }

    /** Parses {@code document} or {@code resources}, case-insensitively. */
    public static FormCacheScope parseScope(String value, FormCacheScope fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return FormCacheScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown form cache scope: " + value, e);
        }
    }

    /** {@code drawlist.font.scaleMetrics} becomes {@code DRAWLIST_FONT_SCALE_METRICS}. */
    static String environmentName(String property) {
        return property.replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('.', '_')
                .toUpperCase(Locale.ROOT);
    }

    private static String lookupEnvironment(String property) {
        String sysProp = System.getProperty(property);
        if (sysProp != null) return sysProp;
        return System.getenv(environmentName(property));
    }

    private static double parseDouble(
            Function<String, String> lookup, String property, double fallback) {
        String value = lookup.apply(property);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Setting " + property + " is not a number: " + value, e);
        }
    }
}

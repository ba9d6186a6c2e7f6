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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Base-font to host-face substitution table. A base font takes the face of the first rule whose
 * {@code match} fragment occurs in its lower-cased name; bold and italic are detected by marker
 * fragments.
 */
public final class FontSubstitutions {
    private static final String DEFAULT_RESOURCE = "/font-substitutions.yaml";
    private static final Logger logger = LoggerFactory.getLogger(FontSubstitutions.class);

    private static FontSubstitutions defaultTable;

    public List<Rule> rules;
    public Rule fallback;
    public List<String> bold_markers;
    public List<String> italic_markers;

    public static final class Rule {
        /** Lower-case fragment of the base font name; unused on the fallback rule. */
        public String match;

        /** One of the {@link FontFamily} names. */
        public String family;

        public String face;
    }

    public FontSubstitutions() {
        this.rules = new ArrayList<>();
        this.bold_markers = new ArrayList<>();
        this.italic_markers = new ArrayList<>();
    }

    /**
     * Loads a table from a classpath resource.
     *
     * @param resourcePath path starting with "/" for an absolute resource path
     */
    public static FontSubstitutions fromResource(String resourcePath) {
        try (var inputStream = FontSubstitutions.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            var yaml = new Yaml(new Constructor(FontSubstitutions.class, new LoaderOptions()));
            FontSubstitutions table = yaml.load(inputStream);
            table.validate();
            logger.debug(
                    "Loaded {} font substitution rules from resource {}",
                    table.rules.size(),
                    resourcePath);
            return table;
        } catch (Exception e) {
            logger.error(
                    "Failed to load font substitutions from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load font substitutions from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Loads the bundled table once. */
    public static synchronized FontSubstitutions loadDefault() {
        if (defaultTable == null) {
            defaultTable = fromResource(DEFAULT_RESOURCE);
        }
        return defaultTable;
    }

    /**
     * Describes {@code baseFont}; {@link FontDescriptor#known()} is false if only the fallback
     * fit.
     */
    public FontDescriptor describe(String baseFont) {
        String name = baseFont.toLowerCase(Locale.ROOT);
        boolean bold = containsAny(name, bold_markers);
        boolean italic = containsAny(name, italic_markers);
        for (Rule rule : rules) {
            if (name.contains(rule.match)) {
                return new FontDescriptor(
                        baseFont, FontFamily.valueOf(rule.family), rule.face, bold, italic, true);
            }
        }
        return new FontDescriptor(
                baseFont, FontFamily.valueOf(fallback.family), fallback.face, bold, italic, false);
    }

    private void validate() {
        if (fallback == null || fallback.face == null) {
            throw new IllegalArgumentException("Font substitution table has no fallback face");
        }
        if (rules == null) rules = new ArrayList<>();
        if (bold_markers == null) bold_markers = new ArrayList<>();
        if (italic_markers == null) italic_markers = new ArrayList<>();
        FontFamily.valueOf(fallback.family);
        for (Rule rule : rules) {
            if (rule.match == null || rule.match.isBlank() || rule.face == null) {
                throw new IllegalArgumentException(
                        "Incomplete font substitution rule: " + rule.match);
            }
            rule.match = rule.match.toLowerCase(Locale.ROOT);
            FontFamily.valueOf(rule.family);
        }
    }

    private static boolean containsAny(String name, List<String> fragments) {
        for (String fragment : fragments) {
            if (name.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}

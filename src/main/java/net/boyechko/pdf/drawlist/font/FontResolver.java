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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import net.boyechko.pdf.drawlist.issue.IssueLoc;
import net.boyechko.pdf.drawlist.issue.IssueReporter;
import net.boyechko.pdf.drawlist.issue.IssueSev;
import net.boyechko.pdf.drawlist.issue.IssueType;

/**
 * Guesses a host face for a document base font by name using a {@link FontSubstitutions}
 * table. Base fonts that match none of its rules take the fallback face and are collected in
 * {@link #missingFonts()} for the session that owns this resolver.
 */
public class FontResolver {
    static final String DEFAULT_BASE_FONT = "Helvetica";

    private final IssueReporter reporter;
    private final FontSubstitutions substitutions;
    private final Set<String> missingFonts = new LinkedHashSet<>();

    public FontResolver(IssueReporter reporter) {
        this(reporter, FontSubstitutions.loadDefault());
    }

    public FontResolver(IssueReporter reporter, FontSubstitutions substitutions) {
        this.reporter = reporter;
        this.substitutions = substitutions;
    }

    /** The descriptor used when a font resource cannot be found at all. */
    public FontDescriptor defaultFont() {
        return substitutions.describe(DEFAULT_BASE_FONT);
    }

    public FontDescriptor resolve(String baseFont) {
        if (baseFont == null || baseFont.isBlank()) {
            return defaultFont();
        }
        FontDescriptor descriptor = substitutions.describe(baseFont);
        if (!descriptor.known() && missingFonts.add(baseFont)) {
            reporter.reportOnce(
                    IssueType.UNKNOWN_FONT,
                    IssueSev.INFO,
                    baseFont,
                    IssueLoc.none(),
                    "Unknown font " + baseFont + ", substituting " + descriptor.faceName());
        }
        return descriptor;
    }

    /** Unknown base font names seen so far, in first-seen order. */
    public Set<String> missingFonts() {
        return Collections.unmodifiableSet(missingFonts);
    }
}

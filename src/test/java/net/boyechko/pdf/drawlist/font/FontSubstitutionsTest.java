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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Test suite for FontSubstitutions. */
public class FontSubstitutionsTest {

    @Test
    void bundledTableCoversStandardFamilies() {
        FontSubstitutions table = FontSubstitutions.loadDefault();

        assertEquals("Courier New", table.describe("Courier-Oblique").faceName());
        assertEquals(FontFamily.SERIF, table.describe("Times-BoldItalic").family());
        assertEquals(FontFamily.SYMBOLIC, table.describe("ZapfDingbats").family());
        assertEquals("Wingdings", table.describe("ZapfDingbats").faceName());
    }

    @Test
    void styleMarkersAreDetected() {
        FontDescriptor font = FontSubstitutions.loadDefault().describe("Helvetica-BoldOblique");

        assertTrue(font.bold());
        assertTrue(font.italic());
        assertTrue(font.known());
        assertEquals("Helvetica-BoldOblique", font.baseFont());
    }

    @Test
    void matchingIgnoresCaseAndSubsetPrefix() {
        FontDescriptor font = FontSubstitutions.loadDefault().describe("ABCDEF+TIMES-ROMAN");

        assertEquals("Times New Roman", font.faceName());
        assertTrue(font.known());
    }

    @Test
    void unmatchedFontTakesFallback() {
        FontDescriptor font = FontSubstitutions.loadDefault().describe("Futura-Bold");

        assertFalse(font.known());
        assertEquals("Arial", font.faceName());
        assertTrue(font.bold());
    }

    @Test
    void customTableIsLoadedFromResource() {
        FontSubstitutions table = FontSubstitutions.fromResource("/font-substitutions-mono.yaml");

        FontDescriptor garamond = table.describe("AGaramondPro-Black");
        assertEquals("EB Garamond", garamond.faceName());
        assertTrue(garamond.bold());
        assertEquals(FontFamily.MONOSPACE, table.describe("Helvetica").family());
        assertFalse(table.describe("Helvetica").known());
    }

    @Test
    void tableWithoutFallbackIsRejected() {
        assertThrows(
                RuntimeException.class,
                () -> FontSubstitutions.fromResource("/font-substitutions-broken.yaml"));
    }

    @Test
    void missingResourceIsRejected() {
        RuntimeException e =
                assertThrows(
                        RuntimeException.class,
                        () -> FontSubstitutions.fromResource("/no-such-table.yaml"));
        assertTrue(e.getMessage().contains("/no-such-table.yaml"));
    }
}

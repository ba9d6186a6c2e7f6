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
package net.boyechko.pdf.drawlist.document;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import java.util.Optional;
import net.boyechko.pdf.drawlist.interpret.ResourceScope;

/** A {@link ResourceScope} over a {@code /Resources} dictionary. */
public class PdfResourceScope implements ResourceScope {
    private final PdfDictionary resources;
    private final String scopeId;

    /**
     * @param resources the resource dictionary, or null for a page without one
     * @param fallbackId scope id used when the dictionary is not an indirect object
     */
    public PdfResourceScope(PdfDictionary resources, String fallbackId) {
        this.resources = resources == null ? new PdfDictionary() : resources;
        this.scopeId = scopeIdOf(resources, fallbackId);
    }

    public static PdfResourceScope forPage(PdfDictionary resources, int pageNum) {
        return new PdfResourceScope(resources, "page-" + pageNum);
    }

    private static String scopeIdOf(PdfDictionary resources, String fallbackId) {
        PdfIndirectReference ref = resources == null ? null : resources.getIndirectReference();
        return ref != null ? "res-" + ref.getObjNumber() : fallbackId;
    }

    @Override
    public String scopeId() {
        return scopeId;
    }

    /** Returns the {@code /BaseFont}, or an empty string for a font that declares none. */
    @Override
    public Optional<String> baseFont(String fontName) {
        PdfDictionary font = category(PdfName.Font).getAsDictionary(new PdfName(fontName));
        if (font == null) {
            return Optional.empty();
        }
        PdfName baseFont = font.getAsName(PdfName.BaseFont);
        return Optional.of(baseFont == null ? "" : baseFont.getValue());
    }

    @Override
    public Optional<PdfStream> xObject(String name) {
        return Optional.ofNullable(category(PdfName.XObject).getAsStream(new PdfName(name)));
    }

    @Override
    public Optional<PdfDictionary> extGState(String name) {
        return Optional.ofNullable(category(PdfName.ExtGState).getAsDictionary(new PdfName(name)));
    }

    @Override
    public Optional<PdfObject> colorSpace(String name) {
        return Optional.ofNullable(category(PdfName.ColorSpace).get(new PdfName(name)));
    }

    @Override
    public Optional<PdfDictionary> colorSpaces() {
        return Optional.ofNullable(resources.getAsDictionary(PdfName.ColorSpace));
    }

    /** A form without its own {@code /Resources} inherits this scope. */
    @Override
    public ResourceScope forForm(PdfStream form) {
        PdfDictionary formResources = form.getAsDictionary(PdfName.Resources);
        if (formResources == null) {
            return this;
        }
        PdfIndirectReference formRef = form.getIndirectReference();
        String fallback =
                formRef != null ? "form-" + formRef.getObjNumber() : scopeId + "/form";
        return new PdfResourceScope(formResources, fallback);
    }

    private PdfDictionary category(PdfName key) {
        PdfDictionary dict = resources.getAsDictionary(key);
        return dict == null ? new PdfDictionary() : dict;
    }

    @Override
    public String toString() {
        return "PdfResourceScope[" + scopeId + "]";
    }
}

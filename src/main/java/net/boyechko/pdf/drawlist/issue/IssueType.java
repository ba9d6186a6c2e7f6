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
package net.boyechko.pdf.drawlist.issue;

/** Represents the kind of problem met while interpreting a content stream. */
public enum IssueType {
    // Unsupported constructs (reported once per cause, processing continues)
    UNKNOWN_OPERATOR("unknown content stream operators"),
    UNSUPPORTED_OPERATOR("unsupported content stream operators"),
    UNSUPPORTED_COLOR_SPACE("unsupported color spaces"),
    UNSUPPORTED_FILTER("unsupported stream filters"),
    UNHANDLED_EXTGSTATE_KEY("unhandled ExtGState keys"),
    UNKNOWN_FONT("fonts without a known substitute"),

    // Resource lookups
    MISSING_RESOURCE("resources not found in scope"),
    RECURSIVE_FORM("form XObjects skipped to stop recursion"),

    // Decode failures (scoped to a single image)
    IMAGE_DECODE_FAILED("images that could not be decoded"),

    // Structural problems
    MALFORMED_OPERANDS("operators with malformed operands"),
    STATE_STACK_UNDERFLOW("restores without a matching save"),
    UNBALANCED_STATE_STACK("saves left open at end of stream"),
    PAGE_FAILED("pages that could not be interpreted");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}

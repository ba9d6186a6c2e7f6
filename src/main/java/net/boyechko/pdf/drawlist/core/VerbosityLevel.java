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

/**
 * How much the command-line front end prints.
 *
 * <ul>
 *   <li>QUIET - errors and the one-line result only
 *   <li>NORMAL - per-page totals and the issue summary (default)
 *   <li>VERBOSE - every draw command and every issue message
 *   <li>DEBUG - everything, including interpreter debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0, "error"),
    NORMAL(1, "warn"),
    VERBOSE(2, "info"),
    DEBUG(3, "debug");

    private final int level;
    private final String logLevel;

    VerbosityLevel(int level, String logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    /** Logback level name for the root logger at this verbosity. */
    public String logLevel() {
        return logLevel;
    }

    /**
     * @param other the level to compare against
     * @return true if this level is at least as verbose as other
     */
    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}

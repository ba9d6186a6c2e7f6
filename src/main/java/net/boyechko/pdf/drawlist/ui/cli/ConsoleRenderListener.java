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
package net.boyechko.pdf.drawlist.ui.cli;

import java.io.PrintStream;
import net.boyechko.pdf.drawlist.core.OutputFormatter;
import net.boyechko.pdf.drawlist.core.PageDrawing;
import net.boyechko.pdf.drawlist.core.RenderListener;
import net.boyechko.pdf.drawlist.core.RenderResult;
import net.boyechko.pdf.drawlist.core.VerbosityLevel;

public class ConsoleRenderListener implements RenderListener {
    private final OutputFormatter formatter;
    private final String inputLabel;

    public ConsoleRenderListener(PrintStream output, VerbosityLevel verbosity, String inputLabel) {
        this.formatter = new OutputFormatter(output, verbosity);
        this.inputLabel = inputLabel;
    }

    @Override
    public void onDocumentStart(int pageCount) {
        formatter.printDocumentHeader(inputLabel, pageCount);
    }

    @Override
    public void onPageStart(int pageNum) {}

    @Override
    public void onPageRendered(PageDrawing drawing) {
        formatter.printPageHeader(drawing);
        formatter.printCommands(drawing);
    }

    @Override
    public void onSummary(RenderResult result) {
        formatter.printSummary(result);
    }

    @Override
    public void onInfo(String message) {
        formatter.printInfo(message);
    }

    @Override
    public void onError(String message) {
        formatter.printError(message);
    }

    public void onSuccess(String message) {
        formatter.printSuccess(message);
    }
}

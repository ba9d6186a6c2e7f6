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
package net.boyechko.pdf.drawlist.interpret;

import java.util.List;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import net.boyechko.pdf.drawlist.state.GraphicsState;

/**
 * Output of interpreting one content stream.
 *
 * @param commands the folded command list
 * @param finalState the current graphics state after the last operator
 * @param implicitlyClosedSaves saves still open at end of stream, closed by the interpreter
 */
public record InterpretationResult(
        List<DrawCommand> commands, GraphicsState finalState, int implicitlyClosedSaves) {

    public InterpretationResult {
        commands = List.copyOf(commands);
    }
}

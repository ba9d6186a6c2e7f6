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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import net.boyechko.pdf.drawlist.command.DrawCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expanded form XObjects for one rendering session. Entries are immutable lists and are
 * shared by every caller that splices them. Not thread-safe: give each worker its own cache.
 */
public class FormCache {
    private static final Logger logger = LoggerFactory.getLogger(FormCache.class);

    private final Map<FormKey, List<DrawCommand>> expansions = new HashMap<>();
    private int expansionCount;

    /** Returns the cached expansion for {@code key}, running {@code expander} on a miss. */
    public List<DrawCommand> getOrExpand(FormKey key, Supplier<List<DrawCommand>> expander) {
        List<DrawCommand> cached = expansions.get(key);
        if (cached != null) {
            logger.debug("Form {} served from cache", key);
            return cached;
        }
        List<DrawCommand> expanded = List.copyOf(expander.get());
        expansionCount++;
        expansions.put(key, expanded);
        logger.debug("Form {} expanded to {} commands", key, expanded.size());
        return expanded;
    }

    public boolean contains(FormKey key) {
        return expansions.containsKey(key);
    }

    /** Number of expansions performed since creation. */
    public int expansionCount() {
        return expansionCount;
    }

    public int size() {
        return expansions.size();
    }

    /** Drops all entries at the end of a session; the expansion counter is kept. */
    public void clear() {
        expansions.clear();
    }
}

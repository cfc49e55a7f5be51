/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura@gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.fifo.queue;

/**
 * Coarse state of a queue, derived from its measure and capacity each time it is asked for.
 */
public enum FifoState {
    EMPTY,
    PARTIAL,
    FULL;

    /**
     * Fullness wins over emptiness, so a queue with capacity zero reports {@link #FULL} even when it holds
     * nothing.
     */
    static FifoState of(boolean full, int itemCount) {
        if (full) return FULL;
        return itemCount == 0 ? EMPTY : PARTIAL;
    }
}

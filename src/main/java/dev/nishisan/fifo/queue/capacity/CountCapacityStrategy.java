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

package dev.nishisan.fifo.queue.capacity;

/**
 * Every item counts as one, so the queue measure is the number of stored items.
 */
public final class CountCapacityStrategy implements CapacityStrategy<Object> {

    private static final CountCapacityStrategy INSTANCE = new CountCapacityStrategy();

    private CountCapacityStrategy() {
    }

    public static CountCapacityStrategy instance() {
        return INSTANCE;
    }

    @Override
    public long measureOf(Object item) {
        return 1L;
    }

    @Override
    public String name() {
        return "count";
    }
}

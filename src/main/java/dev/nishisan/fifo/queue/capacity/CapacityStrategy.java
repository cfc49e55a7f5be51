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
 * Defines how much room an item takes inside a {@link dev.nishisan.fifo.queue.BoundedFifo} and when the
 * queue is considered full.
 * <p>
 * The queue keeps a running measure: it adds {@link #measureOf(Object)} when an item is appended and
 * subtracts it when the item leaves. Implementations must therefore return the same value for the same
 * item every time and must not mutate the item.
 * <p>
 * A strategy is chosen when the queue is opened and never changes afterwards.
 *
 * @param <T> item type the strategy can measure
 */
public interface CapacityStrategy<T> {

    /**
     * Returns the contribution of a single item to the queue measure.
     *
     * @param item stored item, never {@code null}
     * @return non-negative measure in the strategy unit
     */
    long measureOf(T item);

    /**
     * Evaluates the fullness test. A limit of zero makes the queue permanently full.
     *
     * @param currentMeasure accumulated measure of the stored items
     * @param capacityLimit  configured bound, in the same unit
     * @return true when no further item fits
     */
    default boolean isFull(long currentMeasure, long capacityLimit) {
        return currentMeasure >= capacityLimit;
    }

    /**
     * Short label used in logs and {@code toString()} output.
     *
     * @return strategy name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}

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
 * Measures each item by its declared {@link Weighted#weight()}. The queue measure becomes the sum of the
 * weights of the stored items and the capacity is expressed in the same unit.
 *
 * @param <T> weighted item type
 */
public final class WeightedCapacityStrategy<T extends Weighted> implements CapacityStrategy<T> {

    public static <T extends Weighted> WeightedCapacityStrategy<T> create() {
        return new WeightedCapacityStrategy<>();
    }

    private WeightedCapacityStrategy() {
    }

    @Override
    public long measureOf(T item) {
        return item.weight();
    }

    @Override
    public String name() {
        return "weighted";
    }
}

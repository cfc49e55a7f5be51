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

package dev.nishisan.fifo.stats.list;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Keeps the last {@code capacity} samples of a numeric series. Adding to a full list drops the oldest
 * sample.
 */
public class FixedSizeList<E extends Number> {
    private final Deque<E> samples;
    private final int capacity;
    private final String name;

    public FixedSizeList(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive.");
        }
        this.capacity = capacity;
        this.name = name;
        this.samples = new ArrayDeque<>(capacity);
    }

    public synchronized void add(E element) {
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(element);
    }

    public synchronized int size() {
        return samples.size();
    }

    public synchronized double getAverage() {
        return samples.stream()
                .mapToDouble(Number::doubleValue)
                .average()
                .orElse(0.0);
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }
}

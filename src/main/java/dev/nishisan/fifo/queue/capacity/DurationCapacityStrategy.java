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

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Weighs items by their {@link TimedItem#duration()}, converted to a fixed {@link TimeUnit}. A queue using
 * this strategy holds "N milliseconds of frames" rather than "N frames". Conversion truncates, so items
 * shorter than one unit weigh zero.
 *
 * @param <T> timed item type
 */
public final class DurationCapacityStrategy<T extends TimedItem> implements CapacityStrategy<T> {

    private final TimeUnit unit;

    public DurationCapacityStrategy(TimeUnit unit) {
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    @Override
    public long measureOf(T item) {
        return unit.convert(item.duration());
    }

    /**
     * Expresses a capacity given as a duration in this strategy's unit.
     *
     * @param capacity capacity as a span of time
     * @return capacity in {@link #unit()}
     */
    public long toCapacity(Duration capacity) {
        Objects.requireNonNull(capacity, "capacity");
        if (capacity.isNegative()) throw new IllegalArgumentException("negative");
        return unit.convert(capacity);
    }

    public TimeUnit unit() {
        return unit;
    }

    @Override
    public String name() {
        return "duration(" + unit.name().toLowerCase(Locale.ROOT) + ")";
    }
}

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

package dev.nishisan.fifo.stats.dto;

import java.util.concurrent.atomic.AtomicLong;

public class HitCounterDTO {
    private final String name;
    private final AtomicLong currentValue = new AtomicLong(0L);
    private long lastCalcNanos;
    private long lastValue = 0L;
    private volatile double currentRate = 0D;

    public HitCounterDTO(String name) {
        this.name = name;
        this.lastCalcNanos = System.nanoTime();
    }

    public void increment() {
        this.currentValue.incrementAndGet();
    }

    public void increment(long value) {
        this.currentValue.addAndGet(value);
    }

    /**
     * Recomputes the hits-per-second rate since the previous call.
     *
     * @return the new rate
     */
    public synchronized double calc() {
        long now = System.nanoTime();
        long deltaT = now - this.lastCalcNanos;
        long value = this.currentValue.get();
        if (deltaT > 0) {
            this.currentRate = (value - this.lastValue) / (deltaT / 1_000_000_000D);
        }
        this.lastValue = value;
        this.lastCalcNanos = now;
        return this.currentRate;
    }

    public String getName() {
        return name;
    }

    public long getValue() {
        return currentValue.get();
    }

    public double getRate() {
        return currentRate;
    }
}

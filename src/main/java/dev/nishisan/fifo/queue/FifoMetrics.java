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
 * Names of the statistics a {@link BoundedFifo} publishes through its {@code StatsUtils}.
 */
public final class FifoMetrics {
    public static final String PUSH_EVENT = "fifo.push";
    public static final String PUSH_FULL_EVENT = "fifo.push.full";
    public static final String EVICTED_EVENT = "fifo.evicted";
    public static final String PULL_EVENT = "fifo.pull";
    public static final String PULL_TIMEOUT_EVENT = "fifo.pull.timeout";
    public static final String CLEAR_EVENT = "fifo.clear";
    public static final String RELEASE_FAILED_EVENT = "fifo.release.failed";

    public static final String SIZE_VALUE = "fifo.size";
    public static final String WEIGHTED_SIZE_VALUE = "fifo.weighted_size";

    public static final String PULL_WAIT_AVERAGE = "fifo.pull.wait_nanos";

    private FifoMetrics() {
    }
}

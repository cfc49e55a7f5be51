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

package dev.nishisan.fifo.stats;

import dev.nishisan.fifo.stats.dto.HitCounterDTO;
import dev.nishisan.fifo.stats.dto.SimpleValueDTO;
import dev.nishisan.fifo.stats.list.FixedSizeList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;


/**
 * Collects hit counters, current values and rolling averages for a single component.
 * <p>
 * When built with an interval, a daemon thread recalculates counter rates and dumps every statistic at
 * DEBUG level on that period until {@link #shutdown()} is called. A disabled instance accepts every
 * notification and records nothing.
 */
public class StatsUtils {

    private static final Logger logger = LoggerFactory.getLogger(StatsUtils.class);
    private static final int AVERAGE_WINDOW = 10;

    private final ConcurrentMap<String, HitCounterDTO> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SimpleValueDTO> values = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, FixedSizeList<Long>> averages = new ConcurrentHashMap<>();
    private final boolean enabled;
    private final ScheduledExecutorService statsExecutor;

    /**
     * Builds an enabled instance without the periodic dump thread.
     */
    public StatsUtils() {
        this.enabled = true;
        this.statsExecutor = null;
    }

    /**
     * Builds an enabled instance that calculates and dumps stats every {@code interval}.
     *
     * @param interval positive period between dumps
     */
    public StatsUtils(Duration interval) {
        Objects.requireNonNull(interval);
        if (interval.isNegative() || interval.isZero()) throw new IllegalArgumentException("positive");
        this.enabled = true;
        this.statsExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fifo-stats-worker");
            t.setDaemon(true);
            return t;
        });
        long nanos = interval.toNanos();
        this.statsExecutor.scheduleWithFixedDelay(() -> calcStats(true), nanos, nanos, TimeUnit.NANOSECONDS);
    }

    private StatsUtils(boolean enabled) {
        this.enabled = enabled;
        this.statsExecutor = null;
    }

    /**
     * @return an instance that ignores every notification
     */
    public static StatsUtils disabled() {
        return new StatsUtils(false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Increments the named counter, creating it on first use.
     *
     * @param counter counter name
     */
    public void notifyHitCounter(String counter) {
        if (!enabled) return;
        counters.computeIfAbsent(counter, HitCounterDTO::new).increment();
    }

    /**
     * Sets the named value, creating it on first use.
     *
     * @param name  value name
     * @param value new value
     */
    public void notifyCurrentValue(String name, long value) {
        if (!enabled) return;
        SimpleValueDTO existing = values.putIfAbsent(name, new SimpleValueDTO(name, value));
        if (existing != null) {
            existing.setValue(value);
        }
    }

    /**
     * Adds a sample to the named average, which keeps the last ten samples.
     *
     * @param name  average name
     * @param value sample
     */
    public void notifyAverageCounter(String name, long value) {
        if (!enabled) return;
        averages.computeIfAbsent(name, n -> new FixedSizeList<>(n, AVERAGE_WINDOW)).add(value);
    }

    /**
     * @param counterName counter name
     * @return the counter value, or -1 when the counter does not exist
     */
    public Long getCounterValue(String counterName) {
        HitCounterDTO metric = counters.get(counterName);
        if (metric == null) {
            logger.warn("Counter:[{}] Not Found", counterName);
            return -1L;
        }
        return metric.getValue();
    }

    public Long getCounterValueOrNull(String counterName) {
        HitCounterDTO metric = counters.get(counterName);
        return metric == null ? null : metric.getValue();
    }

    public Double getCounterRate(String counterName) {
        HitCounterDTO metric = counters.get(counterName);
        return metric == null ? null : metric.getRate();
    }

    public Long getCurrentValueOrNull(String name) {
        SimpleValueDTO value = values.get(name);
        return value == null ? null : value.getValue();
    }

    public Double getAverageOrNull(String name) {
        FixedSizeList<Long> samples = averages.get(name);
        return samples == null ? null : samples.getAverage();
    }

    /**
     * Recalculates counter rates and, when {@code print} is set, logs every statistic at DEBUG level.
     *
     * @param print whether to log the result
     */
    public void calcStats(boolean print) {
        if (!counters.isEmpty()) {
            if (print)
                logger.debug(" ---------------------------------------------------------------------------------------------");
            counters.entrySet().stream().sorted(Map.Entry.comparingByKey()).forEach(entry -> {
                HitCounterDTO v = entry.getValue();
                v.calc();
                if (print)
                    logger.debug(String.format("  Stats:  [%-35s]:=[%10.3f]/s Current Value:(%11d)", entry.getKey(), v.getRate(), v.getValue()));
            });
        }
        if (print) {
            values.entrySet().stream().sorted(Map.Entry.comparingByKey()).forEach(entry ->
                    logger.debug(String.format("  Value:  [%-35s]:=[%10d]", entry.getKey(), entry.getValue().getValue())));
            averages.entrySet().stream().sorted(Map.Entry.comparingByKey()).forEach(entry ->
                    logger.debug(String.format("  Average: [%-34s]:=[%10.3f]", entry.getKey(), entry.getValue().getAverage())));
        }
    }

    /**
     * Stops the periodic dump thread, if any. Counters stay readable.
     */
    public void shutdown() {
        if (statsExecutor != null) {
            statsExecutor.shutdownNow();
        }
    }
}

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

import dev.nishisan.fifo.queue.capacity.CapacityStrategy;
import dev.nishisan.fifo.queue.capacity.CountCapacityStrategy;
import dev.nishisan.fifo.queue.capacity.DurationCapacityStrategy;
import dev.nishisan.fifo.queue.capacity.TimedItem;
import dev.nishisan.fifo.queue.capacity.Weighted;
import dev.nishisan.fifo.queue.capacity.WeightedCapacityStrategy;
import dev.nishisan.fifo.queue.exceptions.FifoReleaseException;
import dev.nishisan.fifo.stats.StatsUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Thread-safe, capacity-limited FIFO meant to sit between a producer and a consumer inside a processing
 * pipeline, for instance to buffer decoded frames between a capture thread and an encoder thread.
 * <p>
 * What "full" means is delegated to a {@link CapacityStrategy}: counting items, summing a declared weight,
 * or summing a playback duration. The strategy's measure is kept incrementally as items enter and leave;
 * the queue is full when that measure reaches the configured capacity. The capacity may change at any time
 * and only affects later evaluations; nothing is evicted when it shrinks.
 * <p>
 * Pushing into a full queue applies the {@link OverflowPolicy} fixed at construction. Under
 * {@link OverflowPolicy#REJECT} the item stays with the caller; under {@link OverflowPolicy#EVICT_OLDEST}
 * the head is discarded (and released through the {@link ItemReleaser}) before the new item is appended.
 * Both outcomes report {@link PushStatus#FULL}; {@link #getEvictedCount()} tells them apart.
 * <p>
 * Every operation runs under one {@link ReentrantLock}. Only {@link #pull()} and the timed pulls wait, on a
 * condition signalled once per stored item. Several consumers may wait at once; each one re-checks the
 * queue after waking because another consumer may have taken the item first. No fairness among waiting
 * consumers is promised.
 * <p>
 * A fresh queue has capacity zero unless configured otherwise, which makes it full until
 * {@link #setCapacity(long)} is called.
 *
 * @param <T> item type
 */
public class BoundedFifo<T> implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(BoundedFifo.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<T> items = new ArrayDeque<>();
    private final CapacityStrategy<? super T> strategy;
    private final ItemReleaser<? super T> releaser;
    private final OverflowPolicy overflowPolicy;
    private final StatsUtils statsUtils;

    private long capacity, weightedSize, evictedCount;

    private BoundedFifo(CapacityStrategy<? super T> strategy, ItemReleaser<? super T> releaser, Options.Snapshot options) {
        this.strategy = strategy;
        this.releaser = releaser;
        this.overflowPolicy = options.overflowPolicy;
        this.capacity = options.capacity;
        if (!options.statsEnabled) {
            this.statsUtils = StatsUtils.disabled();
        } else if (options.statsIntervalNanos > 0) {
            this.statsUtils = new StatsUtils(Duration.ofNanos(options.statsIntervalNanos));
        } else {
            this.statsUtils = new StatsUtils();
        }
    }

    /**
     * Opens a queue with an explicit strategy and releaser.
     *
     * @param strategy measures items and decides fullness
     * @param releaser releases items the queue discards by itself
     * @param options  configuration; a snapshot is taken, later changes to {@code options} have no effect
     * @param <T>      item type
     * @return a new empty queue
     */
    public static <T> BoundedFifo<T> open(CapacityStrategy<? super T> strategy, ItemReleaser<? super T> releaser, Options options) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(releaser, "releaser");
        Objects.requireNonNull(options, "options");
        return new BoundedFifo<>(strategy, releaser, options.snapshot());
    }

    /**
     * Opens a queue of plain values that need no release.
     */
    public static <T> BoundedFifo<T> open(CapacityStrategy<? super T> strategy, Options options) {
        return open(strategy, ItemReleaser.none(), options);
    }

    /**
     * Opens a queue holding at most {@code capacity} items.
     */
    public static <T> BoundedFifo<T> counting(long capacity, OverflowPolicy policy) {
        return open(CountCapacityStrategy.instance(), Options.defaults().withCapacity(capacity).withOverflowPolicy(policy));
    }

    /**
     * Opens a queue holding items whose weights add up to less than {@code capacity} before it turns full.
     */
    public static <T extends Weighted> BoundedFifo<T> weighted(long capacity, OverflowPolicy policy) {
        return open(WeightedCapacityStrategy.<T>create(), Options.defaults().withCapacity(capacity).withOverflowPolicy(policy));
    }

    /**
     * Opens a queue bounded by the total playback duration of its items, measured in the options' weight
     * unit. The options' capacity is read in that same unit.
     */
    public static <T extends TimedItem> BoundedFifo<T> timed(Options options) {
        Objects.requireNonNull(options, "options");
        return open(new DurationCapacityStrategy<T>(options.weightUnit), options);
    }

    /**
     * Opens a queue holding up to {@code capacity} worth of playback time, accounted in {@code unit}.
     */
    public static <T extends TimedItem> BoundedFifo<T> timed(Duration capacity, TimeUnit unit, OverflowPolicy policy) {
        DurationCapacityStrategy<T> durationStrategy = new DurationCapacityStrategy<>(unit);
        return open(durationStrategy, Options.defaults()
                .withCapacity(durationStrategy.toCapacity(capacity))
                .withOverflowPolicy(policy)
                .withWeightUnit(unit));
    }

    /**
     * Appends an item, applying the overflow policy when the queue is full.
     * <p>
     * When the queue is full and empty at the same time (capacity zero), there is nothing to evict and the
     * item is rejected whatever the policy.
     *
     * @param item item to store, not {@code null}
     * @return {@link PushStatus#SUCCESS} when appended to a non-full queue, {@link PushStatus#FULL} otherwise
     * @throws IllegalArgumentException if the strategy measures the item as negative, or if adding it would
     *                                  overflow the weighted size; the queue is left unchanged in both cases
     */
    public PushStatus push(T item) {
        Objects.requireNonNull(item, "item");
        T evicted = null;
        lock.lock();
        try {
            statsUtils.notifyHitCounter(FifoMetrics.PUSH_EVENT);
            if (strategy.isFull(weightedSize, capacity)) {
                statsUtils.notifyHitCounter(FifoMetrics.PUSH_FULL_EVENT);
                if (overflowPolicy == OverflowPolicy.REJECT || items.isEmpty()) {
                    return PushStatus.FULL;
                }
                long measure = measureForInsert(item);
                evicted = removeFirstLocked();
                evictedCount++;
                statsUtils.notifyHitCounter(FifoMetrics.EVICTED_EVENT);
                appendLocked(item, measure);
                return PushStatus.FULL;
            }
            appendLocked(item, measureForInsert(item));
            return PushStatus.SUCCESS;
        } finally {
            lock.unlock();
            if (evicted != null) {
                releaseEvicted(evicted);
            }
        }
    }

    /**
     * Removes the oldest item, waiting as long as needed for one to arrive. Interrupts do not end the wait;
     * the interrupt status is restored before returning.
     *
     * @return the oldest item, now owned by the caller
     */
    public T pull() {
        long started = System.nanoTime();
        lock.lock();
        try {
            while (items.isEmpty()) {
                notEmpty.awaitUninterruptibly();
            }
            return takeFirstLocked(started);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest item, waiting at most {@code timeout}. The budget is shared by every wake-up, so
     * spurious or stolen wake-ups do not extend the total wait. Interrupts do not end the wait; the
     * interrupt status is restored before returning.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return the item, or a timeout result when none arrived in time
     */
    public PullResult<T> pull(long timeout, TimeUnit unit) {
        long started = System.nanoTime();
        long deadline = started + unit.toNanos(timeout);
        boolean interrupted = false;
        lock.lock();
        try {
            while (items.isEmpty()) {
                long nanos = deadline - System.nanoTime();
                if (nanos <= 0L) {
                    statsUtils.notifyHitCounter(FifoMetrics.PULL_TIMEOUT_EVENT);
                    return PullResult.timeout();
                }
                try {
                    notEmpty.awaitNanos(nanos);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            return PullResult.success(takeFirstLocked(started));
        } finally {
            lock.unlock();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Same as {@link #pull(long, TimeUnit)} with a {@link Duration} budget.
     */
    public PullResult<T> pull(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return pull(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Returns the oldest item without removing it.
     *
     * @return the head of the queue, or empty
     */
    public Optional<T> peek() {
        lock.lock();
        try {
            return Optional.ofNullable(items.peekFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of stored items, whatever the strategy
     */
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return accumulated measure of the stored items; equals {@link #size()} for the counting strategy
     */
    public long weightedSize() {
        lock.lock();
        try {
            return weightedSize;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Changes the bound used by later pushes and fullness checks. Stored items are left alone even if they
     * now exceed the bound.
     *
     * @param capacity new bound in the strategy unit, zero or more
     */
    public void setCapacity(long capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
        lock.lock();
        try {
            logger.debug("Capacity of {} queue changed from {} to {}", strategy.name(), this.capacity, capacity);
            this.capacity = capacity;
        } finally {
            lock.unlock();
        }
    }

    public long getCapacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return whether a push right now would hit the overflow policy
     */
    public boolean isFull() {
        lock.lock();
        try {
            return strategy.isFull(weightedSize, capacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the current state, computed from the measure and the capacity
     */
    public FifoState state() {
        lock.lock();
        try {
            return FifoState.of(strategy.isFull(weightedSize, capacity), items.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every stored item and resets the measure to zero in one step, then releases the removed
     * items. Releasing happens after the lock is dropped; other threads already see an empty queue.
     *
     * @throws FifoReleaseException if any item failed to release; all other items were still released
     */
    public void clear() {
        List<T> discarded;
        lock.lock();
        try {
            discarded = new ArrayList<>(items);
            items.clear();
            weightedSize = 0;
            statsUtils.notifyHitCounter(FifoMetrics.CLEAR_EVENT);
            publishSizeLocked();
        } finally {
            lock.unlock();
        }
        if (!discarded.isEmpty()) {
            logger.debug("Cleared {} items from {} queue", discarded.size(), strategy.name());
        }
        releaseAll(discarded);
    }

    /**
     * @return how many items {@link OverflowPolicy#EVICT_OLDEST} has discarded so far
     */
    public long getEvictedCount() {
        lock.lock();
        try {
            return evictedCount;
        } finally {
            lock.unlock();
        }
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public CapacityStrategy<? super T> getStrategy() {
        return strategy;
    }

    public StatsUtils getStats() {
        return statsUtils;
    }

    /**
     * Clears the queue, releasing what is left, and stops the stats thread.
     */
    @Override
    public void close() {
        try {
            clear();
        } finally {
            statsUtils.shutdown();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "BoundedFifo{strategy=" + strategy.name() + ", policy=" + overflowPolicy
                    + ", size=" + items.size() + ", weightedSize=" + weightedSize + ", capacity=" + capacity + "}";
        } finally {
            lock.unlock();
        }
    }

    private long measureForInsert(T item) {
        long measure = strategy.measureOf(item);
        if (measure < 0) {
            throw new IllegalArgumentException("negative measure " + measure + " for item " + item);
        }
        // checked against the total before any eviction, so the sum of stored measures always fits a long
        if (measure > Long.MAX_VALUE - weightedSize) {
            throw new IllegalArgumentException("measure " + measure + " for item " + item
                    + " overflows weighted size " + weightedSize);
        }
        return measure;
    }

    private void appendLocked(T item, long measure) {
        items.addLast(item);
        weightedSize += measure;
        publishSizeLocked();
        notEmpty.signal();
    }

    private T removeFirstLocked() {
        T item = items.pollFirst();
        weightedSize -= strategy.measureOf(item);
        if (items.isEmpty()) {
            if (weightedSize != 0) {
                logger.warn("Weighted size of empty {} queue was {}; an item changed its measure while queued",
                        strategy.name(), weightedSize);
            }
            weightedSize = 0;
        }
        return item;
    }

    private T takeFirstLocked(long startedNanos) {
        T item = removeFirstLocked();
        statsUtils.notifyHitCounter(FifoMetrics.PULL_EVENT);
        statsUtils.notifyAverageCounter(FifoMetrics.PULL_WAIT_AVERAGE, System.nanoTime() - startedNanos);
        publishSizeLocked();
        return item;
    }

    private void publishSizeLocked() {
        statsUtils.notifyCurrentValue(FifoMetrics.SIZE_VALUE, items.size());
        statsUtils.notifyCurrentValue(FifoMetrics.WEIGHTED_SIZE_VALUE, weightedSize);
    }

    private void releaseEvicted(T item) {
        try {
            releaser.release(item);
        } catch (Exception e) {
            statsUtils.notifyHitCounter(FifoMetrics.RELEASE_FAILED_EVENT);
            logger.warn("Failed to release evicted item {}", item, e);
        }
    }

    private void releaseAll(List<T> discarded) {
        Exception first = null;
        int failed = 0;
        for (T item : discarded) {
            try {
                releaser.release(item);
            } catch (Exception e) {
                failed++;
                statsUtils.notifyHitCounter(FifoMetrics.RELEASE_FAILED_EVENT);
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            logger.warn("{} of {} cleared items failed to release", failed, discarded.size());
            throw new FifoReleaseException(failed + " of " + discarded.size() + " cleared items failed to release", first, failed);
        }
    }

    /**
     * Configuration for a queue: initial capacity, overflow policy, statistics and the unit used to weigh
     * timed items. Instances are mutable builders; the queue keeps a {@link Snapshot}.
     */
    public static final class Options {
        long capacity = 0L;
        OverflowPolicy overflowPolicy = OverflowPolicy.EVICT_OLDEST;
        boolean statsEnabled = true;
        long statsIntervalNanos = 0L;
        TimeUnit weightUnit = TimeUnit.MILLISECONDS;

        private Options() {
        }

        /**
         * Returns options with capacity zero, {@link OverflowPolicy#EVICT_OLDEST}, statistics collected
         * without a periodic dump, and timed items weighed in milliseconds.
         *
         * @return new options instance with default values
         */
        public static Options defaults() {
            return new Options();
        }

        /**
         * Sets the initial bound, in the unit of the strategy the queue is opened with.
         *
         * @param capacity zero or more
         * @return this builder for chaining
         */
        public Options withCapacity(long capacity) {
            if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
            this.capacity = capacity;
            return this;
        }

        public Options withOverflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = Objects.requireNonNull(overflowPolicy);
            return this;
        }

        /**
         * Enables or disables statistics. A disabled queue starts no thread and records no counters.
         *
         * @param enabled true to collect statistics
         * @return this builder for chaining
         */
        public Options withStats(boolean enabled) {
            this.statsEnabled = enabled;
            return this;
        }

        /**
         * Sets the period of the DEBUG stats dump. {@link Duration#ZERO} disables the dump thread while
         * still collecting counters.
         *
         * @param interval dump period
         * @return this builder for chaining
         */
        public Options withStatsInterval(Duration interval) {
            Objects.requireNonNull(interval);
            if (interval.isNegative()) throw new IllegalArgumentException("negative");
            this.statsIntervalNanos = interval.toNanos();
            return this;
        }

        /**
         * Sets the unit timed items are weighed in, and therefore the unit of the capacity of a timed queue.
         *
         * @param weightUnit time unit
         * @return this builder for chaining
         */
        public Options withWeightUnit(TimeUnit weightUnit) {
            this.weightUnit = Objects.requireNonNull(weightUnit);
            return this;
        }

        public long capacity() {
            return capacity;
        }

        public OverflowPolicy overflowPolicy() {
            return overflowPolicy;
        }

        public boolean statsEnabled() {
            return statsEnabled;
        }

        public Duration statsInterval() {
            return Duration.ofNanos(statsIntervalNanos);
        }

        public TimeUnit weightUnit() {
            return weightUnit;
        }

        public Snapshot snapshot() {
            return new Snapshot(this);
        }

        /**
         * Immutable view of option values taken when a queue is opened.
         */
        public static class Snapshot {
            final long capacity, statsIntervalNanos;
            final OverflowPolicy overflowPolicy;
            final boolean statsEnabled;
            final TimeUnit weightUnit;

            Snapshot(Options o) {
                this.capacity = o.capacity;
                this.statsIntervalNanos = o.statsIntervalNanos;
                this.overflowPolicy = o.overflowPolicy;
                this.statsEnabled = o.statsEnabled;
                this.weightUnit = o.weightUnit;
            }
        }
    }
}

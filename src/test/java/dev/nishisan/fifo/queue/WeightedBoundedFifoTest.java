package dev.nishisan.fifo.queue;

import dev.nishisan.fifo.queue.capacity.DurationCapacityStrategy;
import dev.nishisan.fifo.queue.capacity.Weighted;
import dev.nishisan.fifo.queue.capacity.WeightedCapacityStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WeightedBoundedFifoTest {

    record Chunk(String name, long weight) implements Weighted {
    }

    static final class ResizableChunk implements Weighted {
        volatile long weight;

        ResizableChunk(long weight) {
            this.weight = weight;
        }

        @Override
        public long weight() {
            return weight;
        }
    }

    @Test
    void weightedSizeShouldTrackSumOfWeights() {
        try (BoundedFifo<Chunk> fifo = BoundedFifo.weighted(1_000, OverflowPolicy.REJECT)) {
            List<Chunk> chunks = List.of(new Chunk("a", 7), new Chunk("b", 120), new Chunk("c", 0), new Chunk("d", 33));
            chunks.forEach(fifo::push);
            assertEquals(4, fifo.size());
            assertEquals(160L, fifo.weightedSize());

            Chunk first = fifo.pull();
            assertEquals("a", first.name());
            assertEquals(153L, fifo.weightedSize());

            fifo.clear();
            assertEquals(0L, fifo.weightedSize());
            assertEquals(0, fifo.size());
        }
    }

    @Test
    void zeroWeightItemsMayRemainWhileMeasureIsZero() {
        try (BoundedFifo<Chunk> fifo = BoundedFifo.weighted(10, OverflowPolicy.REJECT)) {
            fifo.push(new Chunk("a", 0));
            fifo.push(new Chunk("b", 0));
            assertEquals(2, fifo.size());
            assertEquals(0L, fifo.weightedSize());
            assertEquals(FifoState.PARTIAL, fifo.state());
        }
    }

    @Test
    void queueShouldBeFullOnceWeightReachesCapacity() {
        try (BoundedFifo<Chunk> fifo = BoundedFifo.weighted(100, OverflowPolicy.REJECT)) {
            assertEquals(PushStatus.SUCCESS, fifo.push(new Chunk("a", 60)));
            assertFalse(fifo.isFull());
            // fullness is tested before the push, so one item may overshoot the bound
            assertEquals(PushStatus.SUCCESS, fifo.push(new Chunk("b", 60)));
            assertTrue(fifo.isFull());
            assertEquals(PushStatus.FULL, fifo.push(new Chunk("c", 1)));
            assertEquals(120L, fifo.weightedSize());
        }
    }

    @Test
    void evictionShouldSubtractEvictedWeight() {
        try (BoundedFifo<Chunk> fifo = BoundedFifo.weighted(100, OverflowPolicy.EVICT_OLDEST)) {
            fifo.push(new Chunk("a", 50));
            fifo.push(new Chunk("b", 50));
            assertEquals(PushStatus.FULL, fifo.push(new Chunk("c", 20)));
            assertEquals(2, fifo.size());
            assertEquals(70L, fifo.weightedSize());
            assertEquals("b", fifo.pull().name());
            assertEquals("c", fifo.pull().name());
            assertEquals(0L, fifo.weightedSize());
        }
    }

    @Test
    void weightShouldBeQueriedOncePerInsertionAndOncePerRemoval() {
        try (BoundedFifo<TestFrame> fifo = BoundedFifo.open(WeightedCapacityStrategy.<TestFrame>create(),
                BoundedFifo.Options.defaults().withCapacity(1_000).withOverflowPolicy(OverflowPolicy.REJECT))) {
            TestFrame frame = new TestFrame(1);
            fifo.push(frame);
            assertEquals(1, frame.weighCount.get());
            fifo.pull();
            assertEquals(2, frame.weighCount.get());
        }
    }

    @Test
    void negativeWeightShouldBeRejectedWithoutChangingQueue() {
        try (BoundedFifo<Chunk> fifo = BoundedFifo.weighted(100, OverflowPolicy.REJECT)) {
            fifo.push(new Chunk("a", 5));
            assertThrows(IllegalArgumentException.class, () -> fifo.push(new Chunk("bad", -1)));
            assertEquals(1, fifo.size());
            assertEquals(5L, fifo.weightedSize());
        }
    }

    @Test
    void weightOverflowingTotalShouldBeRejectedWithoutChangingQueue() {
        try (BoundedFifo<Chunk> fifo = BoundedFifo.weighted(Long.MAX_VALUE, OverflowPolicy.REJECT)) {
            assertEquals(PushStatus.SUCCESS, fifo.push(new Chunk("huge", Long.MAX_VALUE - 1)));
            assertThrows(IllegalArgumentException.class, () -> fifo.push(new Chunk("small", 10)));
            assertEquals(1, fifo.size());
            assertEquals(Long.MAX_VALUE - 1, fifo.weightedSize());
            assertFalse(fifo.isFull());
            assertEquals(PushStatus.SUCCESS, fifo.push(new Chunk("one", 1)));
            assertTrue(fifo.isFull());
        }
    }

    @Test
    void weightOverflowingTotalShouldNotEvictUnderEvictOldest() {
        try (BoundedFifo<Chunk> fifo = BoundedFifo.weighted(Long.MAX_VALUE, OverflowPolicy.EVICT_OLDEST)) {
            fifo.push(new Chunk("huge", Long.MAX_VALUE - 1));
            assertThrows(IllegalArgumentException.class, () -> fifo.push(new Chunk("small", 10)));
            assertEquals(0L, fifo.getEvictedCount());
            assertEquals("huge", fifo.peek().orElseThrow().name());
            assertEquals(Long.MAX_VALUE - 1, fifo.weightedSize());
        }
    }

    @Test
    void durationOverflowingTotalShouldBeRejected() {
        BoundedFifo.Options options = BoundedFifo.Options.defaults()
                .withWeightUnit(TimeUnit.NANOSECONDS)
                .withCapacity(Long.MAX_VALUE)
                .withOverflowPolicy(OverflowPolicy.REJECT);
        try (BoundedFifo<TestFrame> fifo = BoundedFifo.timed(options)) {
            Duration longest = Duration.ofDays(106_751);
            assertEquals(PushStatus.SUCCESS, fifo.push(new TestFrame(1, longest)));
            assertThrows(IllegalArgumentException.class, () -> fifo.push(new TestFrame(2, longest)));
            assertEquals(1, fifo.size());
            assertEquals(longest.toNanos(), fifo.weightedSize());
        }
    }

    @Test
    void emptiedQueueShouldMeasureZeroWhenWeightChangedWhileQueued() {
        try (BoundedFifo<ResizableChunk> fifo = BoundedFifo.weighted(100, OverflowPolicy.REJECT)) {
            ResizableChunk chunk = new ResizableChunk(10);
            fifo.push(chunk);
            chunk.weight = 4;
            assertSame(chunk, fifo.pull());
            assertEquals(0, fifo.size());
            assertEquals(0L, fifo.weightedSize());
        }
    }

    @Test
    void timedQueueShouldBoundByPlaybackDuration() {
        try (BoundedFifo<TestFrame> fifo = BoundedFifo.timed(Duration.ofMillis(100), TimeUnit.MILLISECONDS, OverflowPolicy.REJECT)) {
            assertEquals(100L, fifo.getCapacity());
            int accepted = 0;
            while (fifo.push(new TestFrame(accepted, Duration.ofMillis(40))) == PushStatus.SUCCESS) {
                accepted++;
            }
            assertEquals(3, accepted);
            assertEquals(120L, fifo.weightedSize());
            assertTrue(fifo.getStrategy() instanceof DurationCapacityStrategy);
        }
    }

    @Test
    void timedQueueFromOptionsShouldUseConfiguredUnit() {
        BoundedFifo.Options options = BoundedFifo.Options.defaults()
                .withWeightUnit(TimeUnit.MICROSECONDS)
                .withCapacity(50_000)
                .withOverflowPolicy(OverflowPolicy.EVICT_OLDEST);
        try (BoundedFifo<TestFrame> fifo = BoundedFifo.timed(options)) {
            fifo.push(new TestFrame(1, Duration.ofMillis(20)));
            assertEquals(20_000L, fifo.weightedSize());
        }
    }
}

package dev.nishisan.fifo.queue;

import dev.nishisan.fifo.queue.capacity.WeightedCapacityStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerArray;

import static org.junit.jupiter.api.Assertions.*;

class BoundedFifoConcurrencyTest {

    private static final int PRODUCERS = 6;
    private static final int PER_PRODUCER = 2_000;
    private static final int CONSUMERS = 6;

    @Test
    void everyTagShouldBeDeliveredExactlyOnceWithCountStrategy() throws Exception {
        try (BoundedFifo<Integer> fifo = BoundedFifo.counting(16, OverflowPolicy.REJECT)) {
            AtomicIntegerArray received = new AtomicIntegerArray(PRODUCERS * PER_PRODUCER);
            runProducersAndConsumers(fifo, id -> id, tag -> tag, received);
            assertAllReceivedOnce(received);
            assertTrue(fifo.isEmpty());
            assertEquals(0L, fifo.weightedSize());
        }
    }

    @Test
    void everyTagShouldBeDeliveredExactlyOnceWithWeightedStrategy() throws Exception {
        BoundedFifo.Options options = BoundedFifo.Options.defaults()
                .withCapacity(100)
                .withOverflowPolicy(OverflowPolicy.REJECT);
        try (BoundedFifo<TestFrame> fifo = BoundedFifo.open(WeightedCapacityStrategy.<TestFrame>create(), options)) {
            AtomicIntegerArray received = new AtomicIntegerArray(PRODUCERS * PER_PRODUCER);
            runProducersAndConsumers(fifo, id -> new TestFrame(id, Duration.ofMillis(12)), TestFrame::id, received);
            assertAllReceivedOnce(received);
            assertEquals(0, fifo.size());
            assertEquals(0L, fifo.weightedSize());
        }
    }

    private <T> void runProducersAndConsumers(BoundedFifo<T> fifo,
                                              java.util.function.IntFunction<T> factory,
                                              java.util.function.ToIntFunction<T> tagOf,
                                              AtomicIntegerArray received) throws Exception {
        ExecutorService exec = Executors.newFixedThreadPool(PRODUCERS + CONSUMERS);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            for (int p = 0; p < PRODUCERS; p++) {
                final int producer = p;
                futures.add(exec.submit(() -> {
                    start.await();
                    for (int i = 0; i < PER_PRODUCER; i++) {
                        T item = factory.apply(producer * PER_PRODUCER + i);
                        while (fifo.push(item) != PushStatus.SUCCESS) {
                            Thread.sleep(1);
                        }
                    }
                    return null;
                }));
            }

            for (int c = 0; c < CONSUMERS; c++) {
                futures.add(exec.submit(() -> {
                    start.await();
                    int consecutiveTimeouts = 0;
                    while (consecutiveTimeouts < 2) {
                        PullResult<T> r = fifo.pull(200, TimeUnit.MILLISECONDS);
                        if (r.isTimeout()) {
                            consecutiveTimeouts++;
                        } else {
                            consecutiveTimeouts = 0;
                            received.incrementAndGet(tagOf.applyAsInt(r.item()));
                        }
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            exec.shutdownNow();
        }
    }

    private static void assertAllReceivedOnce(AtomicIntegerArray received) {
        for (int i = 0; i < received.length(); i++) {
            assertEquals(1, received.get(i), "tag " + i + " delivered " + received.get(i) + " times");
        }
    }
}

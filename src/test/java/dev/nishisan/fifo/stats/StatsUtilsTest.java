package dev.nishisan.fifo.stats;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class StatsUtilsTest {

    private StatsUtils statsUtils;

    @BeforeEach
    void setUp() {
        statsUtils = new StatsUtils();
    }

    @AfterEach
    void tearDown() {
        statsUtils.shutdown();
    }

    @Test
    void testNotifyHitCounter() {
        statsUtils.notifyHitCounter("testCounter");
        assertEquals(1L, statsUtils.getCounterValue("testCounter"));
        statsUtils.notifyHitCounter("testCounter");
        assertEquals(2L, statsUtils.getCounterValue("testCounter"));
    }

    @Test
    void testGetCounterValueNotFound() {
        assertEquals(-1L, statsUtils.getCounterValue("nonExistent"));
        assertNull(statsUtils.getCounterValueOrNull("nonExistent"));
    }

    @Test
    void testNotifyCurrentValue() {
        statsUtils.notifyCurrentValue("size", 3L);
        statsUtils.notifyCurrentValue("size", 7L);
        assertEquals(7L, statsUtils.getCurrentValueOrNull("size"));
    }

    @Test
    void testAverageKeepsLastTenSamples() {
        for (long i = 1; i <= 10; i++) {
            statsUtils.notifyAverageCounter("avg", 100L);
        }
        statsUtils.notifyAverageCounter("avg", 200L);
        assertEquals(110.0, statsUtils.getAverageOrNull("avg"));
        assertNull(statsUtils.getAverageOrNull("missing"));
    }

    @Test
    void testDisabledStatsRecordNothing() {
        StatsUtils disabled = StatsUtils.disabled();
        disabled.notifyHitCounter("hits");
        disabled.notifyCurrentValue("value", 1L);
        disabled.notifyAverageCounter("avg", 1L);
        assertFalse(disabled.isEnabled());
        assertNull(disabled.getCounterValueOrNull("hits"));
        assertNull(disabled.getCurrentValueOrNull("value"));
        assertNull(disabled.getAverageOrNull("avg"));
    }

    @Test
    void testPeriodicCalcUpdatesRates() {
        StatsUtils periodic = new StatsUtils(Duration.ofMillis(50));
        try {
            for (int i = 0; i < 100; i++) {
                periodic.notifyHitCounter("hits");
            }
            await().atMost(Duration.ofSeconds(2)).until(() -> periodic.getCounterRate("hits") > 0D);
        } finally {
            periodic.shutdown();
        }
    }

    @Test
    void testIntervalMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new StatsUtils(Duration.ZERO));
    }
}

package com.thesis.mlfq.config;

import com.thesis.mlfq.MlfqScheduler;
import com.thesis.mlfq.model.DispatchOrder;
import com.thesis.mlfq.model.ExhaustionPolicy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SchedulerConfigTest {

    @Test
    void shouldUseDefaultsForEmptyEnvironment() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of());

        assertEquals(3, config.numLevels);
        assertArrayEquals(new long[] {2, 4, 8}, config.timeQuanta);
        assertEquals(100L, config.boostInterval);
        assertEquals(DispatchOrder.LIFO, config.dispatchOrder);
        assertEquals(ExhaustionPolicy.DROP, config.exhaustionPolicy);
    }

    @Test
    void shouldReadAllVariables() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
            SchedulerConfig.ENV_LEVELS, "2",
            SchedulerConfig.ENV_TIME_QUANTA, " 3, 6 ",
            SchedulerConfig.ENV_BOOST_INTERVAL, "40",
            SchedulerConfig.ENV_DISPATCH_ORDER, "fifo",
            SchedulerConfig.ENV_EXHAUSTION_POLICY, "Requeue"
        ));

        assertEquals(2, config.numLevels);
        assertArrayEquals(new long[] {3, 6}, config.timeQuanta);
        assertEquals(40L, config.boostInterval);
        assertEquals(DispatchOrder.FIFO, config.dispatchOrder);
        assertEquals(ExhaustionPolicy.REQUEUE, config.exhaustionPolicy);
    }

    @Test
    void shouldDeriveQuantaFromLevelCount() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(SchedulerConfig.ENV_LEVELS, "5"));
        assertArrayEquals(new long[] {2, 4, 8, 16, 32}, config.timeQuanta);
    }

    @Test
    void shouldClampLevelsToUpperBound() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(SchedulerConfig.ENV_LEVELS, "64"));

        assertEquals(SchedulerConfig.MAX_LEVELS, config.numLevels);
        assertEquals(32, config.numLevels);
        assertEquals(32, config.timeQuanta.length);
        assertEquals(2L << 31, config.timeQuanta[31]);
        for (int i = 1; i < config.timeQuanta.length; i++) {
            assertEquals(config.timeQuanta[i - 1] * 2, config.timeQuanta[i]);
        }
    }

    @Test
    void shouldFallBackOnMalformedValues() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
            SchedulerConfig.ENV_LEVELS, "0",
            SchedulerConfig.ENV_TIME_QUANTA, "a,b",
            SchedulerConfig.ENV_BOOST_INTERVAL, "soon",
            SchedulerConfig.ENV_DISPATCH_ORDER, "random"
        ));

        assertEquals(1, config.numLevels);
        assertArrayEquals(new long[] {2}, config.timeQuanta);
        assertEquals(100L, config.boostInterval);
        assertEquals(DispatchOrder.LIFO, config.dispatchOrder);
    }

    @Test
    void shouldRejectMismatchedQuantaWhenBuildingScheduler() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
            SchedulerConfig.ENV_LEVELS, "2",
            SchedulerConfig.ENV_TIME_QUANTA, "1,2,3"
        ));
        assertThrows(IllegalArgumentException.class, () -> new MlfqScheduler(config));
    }
}

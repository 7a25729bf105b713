package com.thesis.mlfq;

import com.thesis.mlfq.config.SchedulerConfig;
import com.thesis.mlfq.metrics.SchedulerStatistics;
import com.thesis.mlfq.model.DispatchOrder;
import com.thesis.mlfq.model.ExecutionRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MlfqSimulationTest {

    private static List<String> completions(SchedulerStatistics stats) {
        List<String> out = new ArrayList<>();
        for (SchedulerStatistics.Completion completion : stats.getCompletions()) {
            out.add(completion.processId + "@" + completion.clock);
        }
        return out;
    }

    @Test
    void shouldDrainDemoScenarioWithLifoDispatch() {
        MlfqScheduler scheduler = new MlfqScheduler(3, new long[] {2, 4, 8});
        List<Long> order = new ArrayList<>();
        scheduler.addListener(r -> order.add(r.getProcessId()));

        MlfqSimulation.runScenario(scheduler);

        assertEquals(List.of(2L, 1L, 1L, 2L, 3L, 3L, 1L), order);
        assertTrue(scheduler.isIdle());
        assertEquals(118L, scheduler.getCurrentTime());

        SchedulerStatistics stats = scheduler.getStatistics();
        assertEquals(7L, stats.getDispatchCount());
        assertEquals(18L, stats.getExecutedWork());
        assertEquals(3L, stats.getCompletionCount());
        assertEquals(4L, stats.getDemotionCount());
        assertEquals(0L, stats.getDropCount());
        assertEquals(0L, stats.getBoostCount());
        assertEquals(List.of("2@9", "3@14", "1@18"), completions(stats));
    }

    @Test
    void shouldDrainDemoScenarioWithFifoDispatch() {
        SchedulerConfig config = new SchedulerConfig();
        config.dispatchOrder = DispatchOrder.FIFO;
        MlfqScheduler scheduler = new MlfqScheduler(config);
        List<ExecutionRecord> records = new ArrayList<>();
        scheduler.addListener(records::add);

        MlfqSimulation.runScenario(scheduler);

        List<Long> order = new ArrayList<>();
        for (ExecutionRecord record : records) {
            order.add(record.getProcessId());
        }
        assertEquals(List.of(1L, 2L, 3L, 1L, 2L, 3L, 1L), order);
        assertEquals(List.of("2@13", "3@14", "1@18"), completions(scheduler.getStatistics()));
        assertTrue(scheduler.isIdle());
    }

    @Test
    void shouldBuildSchedulerFromConfig() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
            SchedulerConfig.ENV_LEVELS, "4",
            SchedulerConfig.ENV_BOOST_INTERVAL, "50"
        ));
        MlfqSimulation simulation = new MlfqSimulation(config);

        MlfqScheduler scheduler = simulation.getScheduler();
        assertEquals(4, scheduler.getNumLevels());
        assertEquals(16L, scheduler.getTimeQuantum(3));
        assertEquals(50L, scheduler.getBoostInterval());
    }

    @Test
    void shouldRunEndToEnd() {
        MlfqSimulation simulation = new MlfqSimulation(new SchedulerConfig());
        simulation.run();

        assertTrue(simulation.getScheduler().isIdle());
        assertEquals(3L, simulation.getScheduler().getStatistics().getCompletionCount());
    }
}

package com.thesis.mlfq.trace;

import com.thesis.mlfq.MlfqScheduler;
import com.thesis.mlfq.model.Process;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TierDumpTest {

    @Test
    void shouldFormatEveryTierOnItsOwnLine() {
        MlfqScheduler scheduler = new MlfqScheduler(2, new long[] {2, 4});
        scheduler.addProcess(new Process(7, 0, 4));
        scheduler.addProcess(new Process(8, 0, 1, 3));

        assertEquals(
            "Queue 0: [Process{id=7, priority=0, remaining_time=4, total_executed_time=0}, "
                + "Process{id=8, priority=0, remaining_time=1, total_executed_time=3}]\n"
                + "Queue 1: []",
            TierDump.format(scheduler));
    }

    @Test
    void shouldFormatEmptyScheduler() {
        MlfqScheduler scheduler = new MlfqScheduler(3, new long[] {2, 4, 8});
        assertEquals("Queue 0: []\nQueue 1: []\nQueue 2: []", TierDump.format(scheduler));
    }
}

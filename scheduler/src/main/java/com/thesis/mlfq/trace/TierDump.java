package com.thesis.mlfq.trace;

import com.thesis.mlfq.MlfqScheduler;
import com.thesis.mlfq.model.Process;

import java.util.List;

/**
 * Debug rendering of the tier contents of a scheduler.
 */
public final class TierDump {
    
    private TierDump() {
    }
    
    /**
     * Format every tier as {@code Queue <index>: [..]}, one line per tier,
     * processes listed oldest first.
     */
    public static String format(MlfqScheduler scheduler) {
        StringBuilder sb = new StringBuilder();
        List<List<Process>> tiers = scheduler.getTiers();
        for (int i = 0; i < tiers.size(); i++) {
            sb.append("Queue ").append(i).append(": ").append(tiers.get(i));
            if (i < tiers.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}

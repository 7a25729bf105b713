package com.thesis.mlfq.metrics;

import com.thesis.mlfq.model.ExecutionRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Counters collected while a scheduler runs.
 * 
 * Tracks dispatches (overall and per tier), executed work, completions,
 * demotions, lowest-tier drops and requeues, and boosts. Completions are
 * kept as (id, time) pairs in completion order, one per finished process,
 * so duplicate ids are counted separately.
 * 
 * Not thread-safe; owned by a single scheduler.
 */
public class SchedulerStatistics {
    
    private final long[] dispatchesPerTier;
    private long dispatchCount = 0;
    private long executedWork = 0;
    private long completionCount = 0;
    private long demotionCount = 0;
    private long dropCount = 0;
    private long requeueCount = 0;
    private long boostCount = 0;
    private long boostedProcessCount = 0;
    
    private final List<Completion> completions = new ArrayList<>();
    
    public SchedulerStatistics(int numLevels) {
        this.dispatchesPerTier = new long[numLevels];
    }
    
    /**
     * Account for one dispatch.
     */
    public void recordDispatch(ExecutionRecord record) {
        dispatchCount++;
        dispatchesPerTier[record.getTierIndex()]++;
        executedWork += record.getExecutedTime();
        if (record.isCompleted()) {
            completionCount++;
            completions.add(new Completion(record.getProcessId(), record.getClock()));
        }
    }
    
    public void recordDemotion() {
        demotionCount++;
    }
    
    public void recordDrop() {
        dropCount++;
    }
    
    public void recordRequeue() {
        requeueCount++;
    }
    
    public void recordBoost(int movedProcesses) {
        boostCount++;
        boostedProcessCount += movedProcesses;
    }
    
    // Getters
    public long getDispatchCount() {
        return dispatchCount;
    }
    
    public long getDispatchCount(int tierIndex) {
        return dispatchesPerTier[tierIndex];
    }
    
    public long getExecutedWork() {
        return executedWork;
    }
    
    public long getCompletionCount() {
        return completionCount;
    }
    
    public long getDemotionCount() {
        return demotionCount;
    }
    
    public long getDropCount() {
        return dropCount;
    }
    
    public long getRequeueCount() {
        return requeueCount;
    }
    
    public long getBoostCount() {
        return boostCount;
    }
    
    public long getBoostedProcessCount() {
        return boostedProcessCount;
    }
    
    /**
     * Completed processes with their finishing clock, in completion order.
     */
    public List<Completion> getCompletions() {
        return new ArrayList<>(completions);
    }
    
    /**
     * Get statistics summary for logging/debugging.
     */
    public String getStatisticsSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("\n========================================\n");
        sb.append("  MLFQ STATISTICS SUMMARY\n");
        sb.append("========================================\n");
        sb.append(String.format("Dispatches:        %d\n", dispatchCount));
        sb.append(String.format("Executed work:     %d\n", executedWork));
        sb.append(String.format("Completed:         %d\n", completionCount));
        sb.append(String.format("Demotions:         %d\n", demotionCount));
        sb.append(String.format("Dropped (lowest):  %d\n", dropCount));
        sb.append(String.format("Requeued (lowest): %d\n", requeueCount));
        sb.append(String.format("Boosts:            %d (%d processes moved)\n", boostCount, boostedProcessCount));
        sb.append("\nPer-tier dispatches:\n");
        
        for (int i = 0; i < dispatchesPerTier.length; i++) {
            sb.append(String.format("  Tier %d: %d (%.1f%%)\n", i, dispatchesPerTier[i],
                dispatchCount > 0 ? (dispatchesPerTier[i] * 100.0 / dispatchCount) : 0.0));
        }
        
        if (!completions.isEmpty()) {
            sb.append("\nCompletion times:\n");
            for (Completion completion : completions) {
                sb.append(String.format("  Process %d: t=%d\n", completion.processId, completion.clock));
            }
        }
        sb.append("========================================\n");
        
        return sb.toString();
    }
    
    /**
     * Reset all statistics.
     */
    public void reset() {
        Arrays.fill(dispatchesPerTier, 0);
        dispatchCount = 0;
        executedWork = 0;
        completionCount = 0;
        demotionCount = 0;
        dropCount = 0;
        requeueCount = 0;
        boostCount = 0;
        boostedProcessCount = 0;
        completions.clear();
    }
    
    /**
     * A process finishing at a given clock value.
     */
    public static class Completion {
        public final long processId;
        public final long clock;
        
        public Completion(long processId, long clock) {
            this.processId = processId;
            this.clock = clock;
        }
        
        @Override
        public String toString() {
            return String.format("Completion{process=%d, t=%d}", processId, clock);
        }
    }
}

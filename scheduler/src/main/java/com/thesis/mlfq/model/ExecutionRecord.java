package com.thesis.mlfq.model;

/**
 * Records a single dispatch for the execution trace
 */
public class ExecutionRecord {
    
    /** Destination tier used when the process left tracking. */
    public static final int NO_TIER = -1;
    
    private final long processId;
    private final int tierIndex;
    private final long executedTime;
    private final long remainingTime;
    private final int nextTier;
    private final long clock;
    
    public ExecutionRecord(long processId, int tierIndex, long executedTime,
                           long remainingTime, int nextTier, long clock) {
        this.processId = processId;
        this.tierIndex = tierIndex;
        this.executedTime = executedTime;
        this.remainingTime = remainingTime;
        this.nextTier = nextTier;
        this.clock = clock;
    }
    
    // Getters
    public long getProcessId() {
        return processId;
    }
    
    public int getTierIndex() {
        return tierIndex;
    }
    
    public long getExecutedTime() {
        return executedTime;
    }
    
    public long getRemainingTime() {
        return remainingTime;
    }
    
    /**
     * Tier the process was placed in after this dispatch, or {@link #NO_TIER}
     * if it completed or was dropped.
     */
    public int getNextTier() {
        return nextTier;
    }
    
    public long getClock() {
        return clock;
    }
    
    public boolean isCompleted() {
        return remainingTime == 0;
    }
    
    @Override
    public String toString() {
        return String.format("ExecutionRecord{process=%d, tier=%d, executed=%d, remaining=%d, next=%d, clock=%d}",
            processId, tierIndex, executedTime, remainingTime, nextTier, clock);
    }
}

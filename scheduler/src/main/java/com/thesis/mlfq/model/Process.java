package com.thesis.mlfq.model;

/**
 * A simulated process tracked by the MLFQ scheduler.
 * 
 * Created by the caller and mutated in place by the scheduler
 * during dispatch and boost. Tier membership is positional; the
 * priority field only mirrors the tier it was last placed in.
 * 
 * While a process sits in a tier it belongs to the scheduler; only the
 * scheduler should call {@link #execute} or {@link #setPriority} on it.
 * A queued process drained from outside is discarded as completed on its
 * next dispatch.
 */
public class Process {
    
    private final long id;
    private int priority;
    private long remainingTime;
    private long totalExecutedTime;
    
    public Process(long id, int priority, long remainingTime) {
        this(id, priority, remainingTime, 0);
    }
    
    public Process(long id, int priority, long remainingTime, long totalExecutedTime) {
        if (remainingTime < 0) {
            throw new IllegalArgumentException("remainingTime must be >= 0, got " + remainingTime);
        }
        if (totalExecutedTime < 0) {
            throw new IllegalArgumentException("totalExecutedTime must be >= 0, got " + totalExecutedTime);
        }
        this.id = id;
        this.priority = priority;
        this.remainingTime = remainingTime;
        this.totalExecutedTime = totalExecutedTime;
    }
    
    /**
     * Run this process for at most {@code quantum} work units.
     * 
     * @param quantum Upper bound on the work done in this slice
     * @return The amount of work actually executed
     */
    public long execute(long quantum) {
        long executed = Math.min(remainingTime, Math.max(0, quantum));
        remainingTime -= executed;
        totalExecutedTime += executed;
        return executed;
    }
    
    public boolean isFinished() {
        return remainingTime == 0;
    }
    
    // Getters
    public long getId() {
        return id;
    }
    
    public int getPriority() {
        return priority;
    }
    
    public void setPriority(int priority) {
        this.priority = priority;
    }
    
    public long getRemainingTime() {
        return remainingTime;
    }
    
    public long getTotalExecutedTime() {
        return totalExecutedTime;
    }
    
    @Override
    public String toString() {
        return String.format("Process{id=%d, priority=%d, remaining_time=%d, total_executed_time=%d}",
            id, priority, remainingTime, totalExecutedTime);
    }
}

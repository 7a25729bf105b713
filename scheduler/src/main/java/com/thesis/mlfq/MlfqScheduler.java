package com.thesis.mlfq;

import com.thesis.mlfq.config.SchedulerConfig;
import com.thesis.mlfq.metrics.SchedulerStatistics;
import com.thesis.mlfq.model.DispatchOrder;
import com.thesis.mlfq.model.ExecutionRecord;
import com.thesis.mlfq.model.ExhaustionPolicy;
import com.thesis.mlfq.model.Process;
import com.thesis.mlfq.strategy.SelectionStrategy;
import com.thesis.mlfq.trace.ExecutionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Multi-Level Feedback Queue scheduler.
 * 
 * Keeps one queue per priority tier (index 0 = highest priority):
 * - Dispatch runs one process of a tier for at most that tier's quantum
 * - Unfinished processes are demoted to the next tier
 * - Advancing the clock onto a multiple of the boost interval moves
 *   every process back to tier 0
 * 
 * Processes are owned by the scheduler while queued: callers may read
 * them through {@link #getTiers()} but must not mutate them.
 * 
 * Not thread-safe: a scheduler must be driven by one thread at a time.
 * 
 * @author Vicente (Thesis Project)
 */
public class MlfqScheduler {
    
    private static final Logger LOG = LoggerFactory.getLogger(MlfqScheduler.class);
    
    public static final long DEFAULT_BOOST_INTERVAL = 100;
    
    private final int numLevels;
    private final long[] timeQuanta;
    private final long boostInterval;
    private final DispatchOrder dispatchOrder;
    private final ExhaustionPolicy exhaustionPolicy;
    
    private final List<Deque<Process>> tiers;
    private final SelectionStrategy selectionStrategy;
    private final SchedulerStatistics statistics;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    
    private long currentTime = 0;
    
    public MlfqScheduler(int numLevels, long[] timeQuanta) {
        this(numLevels, timeQuanta, DEFAULT_BOOST_INTERVAL, DispatchOrder.LIFO, ExhaustionPolicy.DROP);
    }
    
    public MlfqScheduler(SchedulerConfig config) {
        this(config.numLevels, config.timeQuanta, config.boostInterval,
            config.dispatchOrder, config.exhaustionPolicy);
    }
    
    public MlfqScheduler(int numLevels, long[] timeQuanta, long boostInterval,
                         DispatchOrder dispatchOrder, ExhaustionPolicy exhaustionPolicy) {
        if (numLevels <= 0) {
            throw new IllegalArgumentException("numLevels must be positive, got " + numLevels);
        }
        if (timeQuanta == null || timeQuanta.length != numLevels) {
            throw new IllegalArgumentException("Expected " + numLevels + " time quanta, got "
                + (timeQuanta == null ? "none" : timeQuanta.length));
        }
        for (int i = 0; i < timeQuanta.length; i++) {
            if (timeQuanta[i] < 0) {
                throw new IllegalArgumentException("Time quantum of tier " + i + " is negative: " + timeQuanta[i]);
            }
        }
        if (boostInterval <= 0) {
            throw new IllegalArgumentException("boostInterval must be positive, got " + boostInterval);
        }
        
        this.numLevels = numLevels;
        this.timeQuanta = timeQuanta.clone();
        this.boostInterval = boostInterval;
        this.dispatchOrder = Objects.requireNonNull(dispatchOrder, "dispatchOrder");
        this.exhaustionPolicy = Objects.requireNonNull(exhaustionPolicy, "exhaustionPolicy");
        this.selectionStrategy = SelectionStrategy.forOrder(dispatchOrder);
        this.statistics = new SchedulerStatistics(numLevels);
        
        this.tiers = new ArrayList<>(numLevels);
        for (int i = 0; i < numLevels; i++) {
            tiers.add(new ArrayDeque<>());
        }
    }
    
    /**
     * Place a process at the tail of the tier named by its priority.
     * Out-of-range priorities are clamped to the lowest tier.
     */
    public void addProcess(Process process) {
        Objects.requireNonNull(process, "process");
        if (process.isFinished()) {
            LOG.debug("[MLFQ] Ignoring finished process {}", process.getId());
            return;
        }
        
        int priority = process.getPriority();
        if (priority < 0 || priority >= numLevels) {
            LOG.debug("[MLFQ] Process {} priority {} out of range, clamping to tier {}",
                process.getId(), priority, numLevels - 1);
            priority = numLevels - 1;
            process.setPriority(priority);
        }
        tiers.get(priority).addLast(process);
    }
    
    /**
     * CORE METHOD: run the next process of a tier for one quantum.
     * 
     * @param tierIndex Tier to dispatch from
     * @return The execution record, or empty if the tier had no process
     * @throws IndexOutOfBoundsException if the tier does not exist
     * @throws ArithmeticException if the slice would overflow the clock
     */
    public Optional<ExecutionRecord> executeProcess(int tierIndex) {
        Deque<Process> tier = tiers.get(Objects.checkIndex(tierIndex, numLevels));
        Process process = selectionStrategy.select(tier);
        if (process == null) {
            return Optional.empty();
        }
        
        long slice = Math.min(process.getRemainingTime(), timeQuanta[tierIndex]);
        long newTime;
        try {
            newTime = Math.addExact(currentTime, slice);
        } catch (ArithmeticException e) {
            selectionStrategy.putBack(tier, process);
            throw e;
        }
        
        long executed = process.execute(slice);
        currentTime = newTime;
        
        int nextTier = ExecutionRecord.NO_TIER;
        if (!process.isFinished()) {
            nextTier = requeueUnfinished(process, tierIndex);
        }
        // Completed processes are not re-added to any tier
        
        ExecutionRecord record = new ExecutionRecord(process.getId(), tierIndex, executed,
            process.getRemainingTime(), nextTier, currentTime);
        LOG.info("Executed Process ID: {}, Time Executed: {}, Time Remaining: {}",
            record.getProcessId(), record.getExecutedTime(), record.getRemainingTime());
        
        statistics.recordDispatch(record);
        for (ExecutionListener listener : listeners) {
            listener.onExecuted(record);
        }
        return Optional.of(record);
    }
    
    /**
     * Demote, requeue or drop a process that used up its quantum.
     * 
     * @return The tier it now belongs to, or {@link ExecutionRecord#NO_TIER}
     */
    private int requeueUnfinished(Process process, int tierIndex) {
        if (tierIndex + 1 < numLevels) {
            process.setPriority(tierIndex + 1);
            tiers.get(tierIndex + 1).addLast(process);
            statistics.recordDemotion();
            return tierIndex + 1;
        }
        
        if (exhaustionPolicy == ExhaustionPolicy.REQUEUE) {
            tiers.get(tierIndex).addLast(process);
            statistics.recordRequeue();
            return tierIndex;
        }
        
        LOG.warn("[MLFQ] Process {} exhausted the lowest tier with {} units left, dropping it",
            process.getId(), process.getRemainingTime());
        statistics.recordDrop();
        return ExecutionRecord.NO_TIER;
    }
    
    /**
     * Move every process in tiers 1..N-1 to the tail of tier 0.
     * 
     * @return Number of processes moved
     */
    public int priorityBoost() {
        Deque<Process> top = tiers.get(0);
        int moved = 0;
        for (int i = 1; i < numLevels; i++) {
            Deque<Process> tier = tiers.get(i);
            Process process;
            while ((process = tier.pollFirst()) != null) {
                process.setPriority(0);
                top.addLast(process);
                moved++;
            }
        }
        statistics.recordBoost(moved);
        LOG.info("[MLFQ] Priority boost at t={}: {} process(es) moved to tier 0", currentTime, moved);
        return moved;
    }
    
    /**
     * Advance the clock and boost when it lands on a multiple of the boost interval.
     * 
     * @param elapsed Non-negative amount of time to add
     * @return true if a boost was performed
     */
    public boolean updateTime(long elapsed) {
        if (elapsed < 0) {
            throw new IllegalArgumentException("elapsed must be >= 0, got " + elapsed);
        }
        if (elapsed > Long.MAX_VALUE - currentTime) {
            throw new IllegalArgumentException("elapsed " + elapsed + " would overflow the clock at t=" + currentTime);
        }
        currentTime += elapsed;
        if (currentTime % boostInterval == 0) {
            priorityBoost();
            return true;
        }
        return false;
    }
    
    // Inspection
    
    /**
     * Snapshot of all tiers, each listed oldest first. The lists are copies,
     * the processes in them are the live queued instances.
     */
    public List<List<Process>> getTiers() {
        List<List<Process>> snapshot = new ArrayList<>(numLevels);
        for (Deque<Process> tier : tiers) {
            snapshot.add(Collections.unmodifiableList(new ArrayList<>(tier)));
        }
        return Collections.unmodifiableList(snapshot);
    }
    
    public List<Process> getTier(int tierIndex) {
        Objects.checkIndex(tierIndex, numLevels);
        return Collections.unmodifiableList(new ArrayList<>(tiers.get(tierIndex)));
    }
    
    public boolean isTierEmpty(int tierIndex) {
        return tiers.get(Objects.checkIndex(tierIndex, numLevels)).isEmpty();
    }
    
    public int tierSize(int tierIndex) {
        return tiers.get(Objects.checkIndex(tierIndex, numLevels)).size();
    }
    
    public int processCount() {
        int count = 0;
        for (Deque<Process> tier : tiers) {
            count += tier.size();
        }
        return count;
    }
    
    /**
     * True when no tier holds a process.
     */
    public boolean isIdle() {
        return processCount() == 0;
    }
    
    public int getNumLevels() {
        return numLevels;
    }
    
    public long getTimeQuantum(int tierIndex) {
        return timeQuanta[Objects.checkIndex(tierIndex, numLevels)];
    }
    
    public long[] getTimeQuanta() {
        return timeQuanta.clone();
    }
    
    public long getCurrentTime() {
        return currentTime;
    }
    
    public long getBoostInterval() {
        return boostInterval;
    }
    
    public DispatchOrder getDispatchOrder() {
        return dispatchOrder;
    }
    
    public ExhaustionPolicy getExhaustionPolicy() {
        return exhaustionPolicy;
    }
    
    public SchedulerStatistics getStatistics() {
        return statistics;
    }
    
    public void addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }
    
    public void removeListener(ExecutionListener listener) {
        listeners.remove(listener);
    }
}

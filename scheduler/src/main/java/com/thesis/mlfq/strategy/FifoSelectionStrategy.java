package com.thesis.mlfq.strategy;

import com.thesis.mlfq.model.Process;

import java.util.Deque;

/**
 * First-In-First-Out Strategy
 * 
 * Runs the oldest process of the tier first, giving the usual
 * round-robin fairness within a tier.
 */
public class FifoSelectionStrategy implements SelectionStrategy {
    
    @Override
    public Process select(Deque<Process> tier) {
        return tier.pollFirst();
    }
    
    @Override
    public void putBack(Deque<Process> tier, Process process) {
        tier.addFirst(process);
    }
    
    @Override
    public String getName() {
        return "FIFO";
    }
}

package com.thesis.mlfq.strategy;

import com.thesis.mlfq.model.Process;

import java.util.Deque;

/**
 * Last-In-First-Out Strategy
 * 
 * Runs the most recently added process of the tier first.
 * This is the default order.
 */
public class LifoSelectionStrategy implements SelectionStrategy {
    
    @Override
    public Process select(Deque<Process> tier) {
        // Tail holds the latest arrival
        return tier.pollLast();
    }
    
    @Override
    public void putBack(Deque<Process> tier, Process process) {
        tier.addLast(process);
    }
    
    @Override
    public String getName() {
        return "LIFO";
    }
}

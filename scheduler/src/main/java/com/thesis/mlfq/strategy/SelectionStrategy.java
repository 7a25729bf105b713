package com.thesis.mlfq.strategy;

import com.thesis.mlfq.model.DispatchOrder;
import com.thesis.mlfq.model.Process;

import java.util.Deque;

/**
 * Interface for intra-tier selection strategies
 * 
 * Each strategy decides which process of a single tier runs next.
 * The tier deque is ordered by arrival: head is the oldest entry,
 * tail the most recent.
 */
public interface SelectionStrategy {
    
    /**
     * Remove and return the next process to run from the given tier
     * 
     * @param tier Processes of one tier, oldest first
     * @return The selected process, or null if the tier is empty
     */
    Process select(Deque<Process> tier);
    
    /**
     * Undo a {@link #select} so the tier is back in its previous order
     */
    void putBack(Deque<Process> tier, Process process);
    
    /**
     * Get the name of this strategy
     */
    String getName();
    
    /**
     * Strategy implementing the given dispatch order
     */
    static SelectionStrategy forOrder(DispatchOrder order) {
        switch (order) {
            case FIFO:
                return new FifoSelectionStrategy();
            case LIFO:
            default:
                return new LifoSelectionStrategy();
        }
    }
}

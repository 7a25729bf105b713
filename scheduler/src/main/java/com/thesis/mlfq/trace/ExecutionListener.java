package com.thesis.mlfq.trace;

import com.thesis.mlfq.model.ExecutionRecord;

/**
 * Receives the execution trace of a scheduler, one record per dispatch.
 * Called synchronously on the dispatching thread.
 */
@FunctionalInterface
public interface ExecutionListener {
    
    void onExecuted(ExecutionRecord record);
}

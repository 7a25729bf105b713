package com.thesis.mlfq.model;

/**
 * What happens to an unfinished process that used up its quantum
 * in the lowest tier
 */
public enum ExhaustionPolicy {
    DROP,       // Discard from tracking (default)
    REQUEUE     // Round-robin in place at the lowest tier
}

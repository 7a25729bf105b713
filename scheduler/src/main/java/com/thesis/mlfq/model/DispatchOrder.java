package com.thesis.mlfq.model;

/**
 * Order in which processes are picked from within one tier
 */
public enum DispatchOrder {
    LIFO,   // Most recently added runs next (default)
    FIFO    // Oldest runs next
}

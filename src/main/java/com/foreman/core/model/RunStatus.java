package com.foreman.core.model;

/**
 * Overall outcome of a scheduler run.
 */
public enum RunStatus {
    COMPLETED,  // every task completed
    PARTIAL,    // drained, but some tasks failed or were blocked
    STALLED,    // iteration ceiling reached with work left
    CANCELLED
}

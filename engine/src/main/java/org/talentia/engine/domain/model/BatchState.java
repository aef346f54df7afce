package org.talentia.engine.domain.model;

/**
 * Stages an assignment batch passes through. REJECTED and PARTIAL_FAILURE are terminal.
 */
public enum BatchState {
    RECEIVED,
    POSITIONS_RESOLVED,
    RECOMMENDATIONS_COMPUTED,
    CAPACITY_RESERVED,
    PERSISTED,
    STATUS_UPDATED,
    COMPLETED,
    REJECTED,
    PARTIAL_FAILURE
}

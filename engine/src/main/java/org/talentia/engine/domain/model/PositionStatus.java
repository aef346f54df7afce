package org.talentia.engine.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a position: open, in progress, then filled, cancelled or on hold.
 */
public enum PositionStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    FILLED("filled"),
    CANCELLED("cancelled"),
    ON_HOLD("on_hold");

    /** Statuses that count against a recruiter's capacity. */
    public static final Set<PositionStatus> ACTIVE = EnumSet.of(OPEN, IN_PROGRESS);

    private final String value;

    PositionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Filled and cancelled positions never take part in allocation, not even with force.
     */
    public boolean isClosed() {
        return this == FILLED || this == CANCELLED;
    }

    public static PositionStatus fromValue(String value) {
        for (PositionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown position status: " + value);
    }
}

package org.talentia.engine.domain.model;

public enum AssignmentStatus {
    ASSIGNED("assigned"),
    SUPERSEDED("superseded"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String value;

    AssignmentStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AssignmentStatus fromValue(String value) {
        for (AssignmentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown assignment status: " + value);
    }
}

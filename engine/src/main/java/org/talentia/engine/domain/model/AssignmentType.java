package org.talentia.engine.domain.model;

public enum AssignmentType {
    AUTO("auto"),
    MANUAL("manual");

    private final String value;

    AssignmentType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AssignmentType fromValue(String value) {
        for (AssignmentType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown assignment type: " + value);
    }
}

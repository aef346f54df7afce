package org.talentia.engine.domain.model;

/**
 * Reporting queue a position is grouped into. Not an eligibility filter.
 */
public enum QueueType {
    CRITICAL("critical"),
    TECHNICAL("technical"),
    GENERAL("general");

    private final String value;

    QueueType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}

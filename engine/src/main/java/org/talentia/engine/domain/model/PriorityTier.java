package org.talentia.engine.domain.model;

/**
 * Business priority of a position. Each tier carries its SLA budget and the
 * constants used by the priority classifier.
 */
public enum PriorityTier {
    P1(3, 600.0, 40.0),
    P2(7, 300.0, 20.0),
    P3(14, 100.0, 10.0);

    private final int slaDays;
    private final double baseScore;
    private final double escalationPerDay;

    PriorityTier(int slaDays, double baseScore, double escalationPerDay) {
        this.slaDays = slaDays;
        this.baseScore = baseScore;
        this.escalationPerDay = escalationPerDay;
    }

    public int getSlaDays() {
        return slaDays;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public double getEscalationPerDay() {
        return escalationPerDay;
    }

    /**
     * Sort rank, 0 being the most urgent tier.
     */
    public int rank() {
        return ordinal();
    }
}

package org.talentia.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-criterion sub-scores of a fit score, each in [0,1].
 */
public final class ScoreBreakdown {

    public static final String ZONE = "zone";
    public static final String CAPABILITY = "capability";
    public static final String WORKLOAD = "workload";

    private final double zone;
    private final double capability;
    private final double workload;

    public ScoreBreakdown(double zone, double capability, double workload) {
        this.zone = zone;
        this.capability = capability;
        this.workload = workload;
    }

    /**
     * Rebuilds a breakdown from its stored map form. Missing criteria read as 0.
     */
    public static ScoreBreakdown fromMap(Map<String, Double> values) {
        return new ScoreBreakdown(
                values.getOrDefault(ZONE, 0.0),
                values.getOrDefault(CAPABILITY, 0.0),
                values.getOrDefault(WORKLOAD, 0.0));
    }

    public double getZone() {
        return zone;
    }

    public double getCapability() {
        return capability;
    }

    public double getWorkload() {
        return workload;
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(ZONE, zone);
        map.put(CAPABILITY, capability);
        map.put(WORKLOAD, workload);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoreBreakdown)) {
            return false;
        }
        ScoreBreakdown that = (ScoreBreakdown) o;
        return Double.compare(zone, that.zone) == 0
                && Double.compare(capability, that.capability) == 0
                && Double.compare(workload, that.workload) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(zone, capability, workload);
    }

    @Override
    public String toString() {
        return String.format("{zone=%.2f, capability=%.2f, workload=%.2f}", zone, capability, workload);
    }
}

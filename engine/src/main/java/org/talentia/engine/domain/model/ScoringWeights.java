package org.talentia.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable weights and thresholds for recruiter fit scoring.
 * Defaults: zone 0.30, capability 0.30, workload 0.40.
 */
public final class ScoringWeights {

    private final Map<String, Double> values;

    // Weight keys
    public static final String WEIGHT_ZONE = "weight_zone";
    public static final String WEIGHT_CAPABILITY = "weight_capability";
    public static final String WEIGHT_WORKLOAD = "weight_workload";

    // Criterion constants
    public static final String ZONE_PRIMARY = "zone_primary";
    public static final String ZONE_SECONDARY = "zone_secondary";
    public static final String ZONE_FLOOR = "zone_floor";
    public static final String OVERQUALIFIED_STEP = "overqualified_step";
    public static final String OVERQUALIFIED_FLOOR = "overqualified_floor";
    public static final String UNDERQUALIFIED_STEP = "underqualified_step";
    public static final String WORKLOAD_EXPONENT = "workload_exponent";

    private ScoringWeights(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates weights from a map; keys not present fall back to the defaults.
     */
    public static ScoringWeights fromMap(Map<String, Double> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Double> merged = new HashMap<>(defaults().values);
        merged.putAll(overrides);
        ScoringWeights weights = new ScoringWeights(merged);
        weights.validate();
        return weights;
    }

    public static ScoringWeights defaults() {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(WEIGHT_ZONE, 0.30);
        defaults.put(WEIGHT_CAPABILITY, 0.30);
        defaults.put(WEIGHT_WORKLOAD, 0.40);
        defaults.put(ZONE_PRIMARY, 1.0);
        defaults.put(ZONE_SECONDARY, 0.5);
        defaults.put(ZONE_FLOOR, 0.1);
        defaults.put(OVERQUALIFIED_STEP, 0.15);
        defaults.put(OVERQUALIFIED_FLOOR, 0.4);
        defaults.put(UNDERQUALIFIED_STEP, 0.35);
        defaults.put(WORKLOAD_EXPONENT, 2.0);
        return new ScoringWeights(defaults);
    }

    private void validate() {
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0 || entry.getValue().isNaN()) {
                throw new IllegalArgumentException("Invalid scoring value for " + entry.getKey() + ": " + entry.getValue());
            }
        }
        if (weightSum() <= 0) {
            throw new IllegalArgumentException("At least one scoring weight must be positive");
        }
    }

    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown scoring key: " + key);
        }
        return value;
    }

    public double getZoneWeight() {
        return get(WEIGHT_ZONE);
    }

    public double getCapabilityWeight() {
        return get(WEIGHT_CAPABILITY);
    }

    public double getWorkloadWeight() {
        return get(WEIGHT_WORKLOAD);
    }

    public double weightSum() {
        return getZoneWeight() + getCapabilityWeight() + getWorkloadWeight();
    }

    @Override
    public String toString() {
        return "ScoringWeights" + values;
    }
}

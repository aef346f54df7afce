package org.talentia.engine.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate figures for one assignment batch.
 */
public final class AssignmentStats {

    private final int totalAssigned;
    private final int totalFailed;
    private final double averageScore;
    private final Map<PriorityTier, Integer> byPriority;

    public AssignmentStats(int totalAssigned, int totalFailed, double averageScore, Map<PriorityTier, Integer> byPriority) {
        this.totalAssigned = totalAssigned;
        this.totalFailed = totalFailed;
        this.averageScore = averageScore;
        Map<PriorityTier, Integer> copy = new EnumMap<>(PriorityTier.class);
        copy.putAll(byPriority);
        this.byPriority = Collections.unmodifiableMap(copy);
    }

    public int getTotalAssigned() {
        return totalAssigned;
    }

    public int getTotalFailed() {
        return totalFailed;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public Map<PriorityTier, Integer> getByPriority() {
        return byPriority;
    }

    @Override
    public String toString() {
        return String.format("AssignmentStats{assigned=%d, failed=%d, avg=%.2f, byPriority=%s}",
                totalAssigned, totalFailed, averageScore, byPriority);
    }
}

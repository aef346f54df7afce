package org.talentia.engine.domain.model;

import java.util.Objects;

/**
 * Urgency of a position: the score used to order work, its reporting queue
 * and the terms the score was built from.
 */
public final class PriorityResult {

    private final double score;
    private final QueueType queue;
    private final double baseScore;
    private final double escalation;
    private final double deprioritization;
    private final double overdueDays;
    private final String explanation;

    public PriorityResult(double score, QueueType queue, double baseScore, double escalation,
                          double deprioritization, double overdueDays, String explanation) {
        this.score = score;
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.baseScore = baseScore;
        this.escalation = escalation;
        this.deprioritization = deprioritization;
        this.overdueDays = overdueDays;
        this.explanation = Objects.requireNonNull(explanation, "explanation must not be null");
    }

    public double getScore() {
        return score;
    }

    public QueueType getQueue() {
        return queue;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public double getEscalation() {
        return escalation;
    }

    public double getDeprioritization() {
        return deprioritization;
    }

    public double getOverdueDays() {
        return overdueDays;
    }

    public String getExplanation() {
        return explanation;
    }

    public boolean isOverdue() {
        return overdueDays > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriorityResult)) {
            return false;
        }
        PriorityResult that = (PriorityResult) o;
        return Double.compare(score, that.score) == 0
                && Double.compare(baseScore, that.baseScore) == 0
                && Double.compare(escalation, that.escalation) == 0
                && Double.compare(deprioritization, that.deprioritization) == 0
                && Double.compare(overdueDays, that.overdueDays) == 0
                && queue == that.queue
                && explanation.equals(that.explanation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, queue, baseScore, escalation, deprioritization, overdueDays, explanation);
    }

    @Override
    public String toString() {
        return String.format("PriorityResult{score=%.2f, queue=%s, overdueDays=%.2f}", score, queue, overdueDays);
    }
}

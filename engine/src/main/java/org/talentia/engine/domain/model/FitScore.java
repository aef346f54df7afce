package org.talentia.engine.domain.model;

import java.util.Objects;

/**
 * Outcome of scoring one recruiter against one position.
 */
public final class FitScore {

    private final double score;
    private final ScoreBreakdown breakdown;
    private final String explanation;

    public FitScore(double score, ScoreBreakdown breakdown, String explanation) {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
        this.score = score;
        this.breakdown = Objects.requireNonNull(breakdown, "breakdown must not be null");
        this.explanation = Objects.requireNonNull(explanation, "explanation must not be null");
    }

    public double getScore() {
        return score;
    }

    public ScoreBreakdown getBreakdown() {
        return breakdown;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FitScore)) {
            return false;
        }
        FitScore that = (FitScore) o;
        return Double.compare(score, that.score) == 0
                && breakdown.equals(that.breakdown)
                && explanation.equals(that.explanation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, breakdown, explanation);
    }

    @Override
    public String toString() {
        return String.format("FitScore{score=%.4f, breakdown=%s, explanation='%s'}", score, breakdown, explanation);
    }
}

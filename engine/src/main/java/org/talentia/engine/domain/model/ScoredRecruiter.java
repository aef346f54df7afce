package org.talentia.engine.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A recruiter paired with its fit score for one position.
 * Natural order puts the best candidate first: higher score, then lower
 * current load, then lower recruiter id.
 */
public final class ScoredRecruiter implements Comparable<ScoredRecruiter> {

    private static final Comparator<ScoredRecruiter> RANKING = Comparator
            .comparingDouble((ScoredRecruiter s) -> s.getScore()).reversed()
            .thenComparingInt(s -> s.getRecruiter().getCurrentLoad())
            .thenComparing(s -> s.getRecruiter().getId());

    private final Recruiter recruiter;
    private final FitScore fitScore;

    public ScoredRecruiter(Recruiter recruiter, FitScore fitScore) {
        this.recruiter = Objects.requireNonNull(recruiter, "recruiter must not be null");
        this.fitScore = Objects.requireNonNull(fitScore, "fitScore must not be null");
    }

    public Recruiter getRecruiter() {
        return recruiter;
    }

    public FitScore getFitScore() {
        return fitScore;
    }

    public double getScore() {
        return fitScore.getScore();
    }

    @Override
    public int compareTo(ScoredRecruiter other) {
        return RANKING.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoredRecruiter)) {
            return false;
        }
        ScoredRecruiter that = (ScoredRecruiter) o;
        return recruiter.equals(that.recruiter) && fitScore.equals(that.fitScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recruiter, fitScore);
    }

    @Override
    public String toString() {
        return String.format("ScoredRecruiter{id='%s', score=%.4f, load=%d/%d}",
                recruiter.getId(), getScore(), recruiter.getCurrentLoad(), recruiter.getCapacity());
    }
}

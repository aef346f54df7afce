package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.FitScore;
import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.Recruiter;

/**
 * Scores how well a recruiter fits a position.
 */
public interface FitScorer {

    /**
     * Calculate the fit of a recruiter for a position.
     * Higher score = better fit, always within [0,1].
     *
     * @param position the position to fill
     * @param recruiter the candidate, with its current load resolved
     * @return score, per-criterion breakdown and explanation
     */
    FitScore score(Position position, Recruiter recruiter);

    /**
     * Eligibility gate applied before scoring: active, not deleted and below capacity.
     */
    boolean isEligible(Recruiter recruiter);
}

package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ScoredRecruiter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Ranks recruiters for a position. Side-effect free.
 */
public interface RecommendationRanker {

    /**
     * Top-K eligible recruiters for a position, best first.
     * Recruiters at or over capacity are never returned.
     *
     * @param position the position to fill
     * @param recruiters candidate recruiters
     * @param k maximum number of results, at least 1
     */
    List<ScoredRecruiter> rank(Position position, Collection<Recruiter> recruiters, int k);

    /**
     * The single best recruiter for a position, if any is eligible.
     */
    Optional<ScoredRecruiter> best(Position position, Collection<Recruiter> recruiters);
}

package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ScoredRecruiter;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class RecommendationRankerImpl implements RecommendationRanker {

    private static final Logger LOG = Logger.getLogger(RecommendationRankerImpl.class.getName());

    private final FitScorer fitScorer;

    public RecommendationRankerImpl(FitScorer fitScorer) {
        this.fitScorer = Objects.requireNonNull(fitScorer, "fitScorer must not be null");
    }

    @Override
    public List<ScoredRecruiter> rank(Position position, Collection<Recruiter> recruiters, int k) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(recruiters, "recruiters must not be null");
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1");
        }

        List<ScoredRecruiter> ranked = recruiters.stream()
                .filter(fitScorer::isEligible)
                .map(r -> new ScoredRecruiter(r, fitScorer.score(position, r)))
                .sorted() // Best first: score desc, load asc, id asc
                .limit(k)
                .collect(Collectors.toList());

        if (ranked.isEmpty()) {
            LOG.fine(() -> "No eligible recruiters for position " + position.getId());
        }
        return ranked;
    }

    @Override
    public Optional<ScoredRecruiter> best(Position position, Collection<Recruiter> recruiters) {
        List<ScoredRecruiter> top = rank(position, recruiters, 1);
        return top.isEmpty() ? Optional.empty() : Optional.of(top.get(0));
    }
}

package org.talentia.engine.domain.service;

import org.talentia.engine.domain.error.NotFoundException;
import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.PositionSuggestions;
import org.talentia.engine.domain.model.PrioritizedPosition;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ScoredRecruiter;
import org.talentia.engine.repository.PositionRepository;
import org.talentia.engine.repository.RecruiterRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class SuggestionServiceImpl implements SuggestionService {

    private static final Logger LOG = Logger.getLogger(SuggestionServiceImpl.class.getName());

    private final PositionRepository positionRepository;
    private final RecruiterRepository recruiterRepository;
    private final PriorityClassifier priorityClassifier;
    private final RecommendationRanker ranker;
    private final Messages messages;
    private final int suggestionCount;
    private final Clock clock;

    public SuggestionServiceImpl(PositionRepository positionRepository, RecruiterRepository recruiterRepository,
                                 PriorityClassifier priorityClassifier, RecommendationRanker ranker,
                                 Messages messages, int suggestionCount, Clock clock) {
        this.positionRepository = Objects.requireNonNull(positionRepository, "positionRepository must not be null");
        this.recruiterRepository = Objects.requireNonNull(recruiterRepository, "recruiterRepository must not be null");
        this.priorityClassifier = Objects.requireNonNull(priorityClassifier, "priorityClassifier must not be null");
        this.ranker = Objects.requireNonNull(ranker, "ranker must not be null");
        this.messages = Objects.requireNonNull(messages, "messages must not be null");
        if (suggestionCount < 1) {
            throw new IllegalArgumentException("suggestionCount must be at least 1");
        }
        this.suggestionCount = suggestionCount;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<PositionSuggestions> suggestAll(int limit, boolean interleave) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        Instant now = clock.instant();
        List<Recruiter> recruiters = recruiterRepository.findEligible();

        // Ordered over every active position; the limit only applies afterwards
        List<PrioritizedPosition> prioritized = priorityClassifier.prioritize(positionRepository.findActive(), now);
        if (interleave) {
            prioritized = priorityClassifier.interleaveByQueue(prioritized);
        }
        if (prioritized.size() > limit) {
            prioritized = prioritized.subList(0, limit);
        }

        List<PositionSuggestions> result = new ArrayList<>(prioritized.size());
        for (PrioritizedPosition entry : prioritized) {
            result.add(new PositionSuggestions(entry.getPosition(), entry.getPriority(),
                    rank(entry.getPosition(), recruiters, suggestionCount)));
        }
        LOG.fine(() -> String.format("Computed suggestions for %d position(s) against %d recruiter(s)",
                result.size(), recruiters.size()));
        return result;
    }

    @Override
    public PositionSuggestions suggestFor(String positionId, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1");
        }
        Position position = positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException(messages.get("error.position_not_found")));
        return new PositionSuggestions(position, priorityClassifier.classify(position, clock.instant()),
                rank(position, recruiterRepository.findEligible(), k));
    }

    // The recruiter already holding the position is not suggested again
    private List<ScoredRecruiter> rank(Position position, List<Recruiter> recruiters, int k) {
        List<Recruiter> candidates = recruiters.stream()
                .filter(r -> !r.getId().equals(position.getRecruiterId()))
                .collect(Collectors.toList());
        return ranker.rank(position, candidates, k);
    }
}

package org.talentia.engine.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.talentia.engine.domain.model.FitScore;
import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.PriorityTier;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ScoreBreakdown;
import org.talentia.engine.domain.model.ScoredRecruiter;
import org.talentia.engine.domain.model.ScoringWeights;
import org.talentia.engine.domain.model.Zone;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.talentia.engine.domain.model.SampleData.position;
import static org.talentia.engine.domain.model.SampleData.recruiter;

@ExtendWith(MockitoExtension.class)
class RecommendationRankerImplTest {

    private final Position position = position("pos-1", Zone.LIMA, PriorityTier.P1).build();

    @Mock
    private FitScorer fitScorer;

    @Test
    @DisplayName("ranks by score and never returns excluded recruiters")
    void ranksAndExcludes() {
        RecommendationRanker ranker = new RecommendationRankerImpl(
                new FitScorerImpl(ScoringWeights.defaults(), Messages.spanish()));
        List<Recruiter> recruiters = Arrays.asList(
                recruiter("outside", Zone.ICA).build(),
                recruiter("full", Zone.LIMA).capacity(2).currentLoad(2).build(),
                recruiter("inactive", Zone.LIMA).active(false).build(),
                recruiter("local", Zone.LIMA).build(),
                recruiter("nearby", Zone.CHAO).secondaryZones(Collections.singletonList(Zone.LIMA)).build());

        List<ScoredRecruiter> ranked = ranker.rank(position, recruiters, 5);

        assertThat(ids(ranked)).containsExactly("local", "nearby", "outside");
    }

    @Test
    @DisplayName("breaks score ties by lower load, then by id")
    void tieBreaks() {
        FitScore sameScore = new FitScore(0.8, new ScoreBreakdown(1.0, 1.0, 0.5), "x");
        when(fitScorer.isEligible(any())).thenReturn(true);
        when(fitScorer.score(any(), any())).thenReturn(sameScore);
        RecommendationRanker ranker = new RecommendationRankerImpl(fitScorer);

        List<Recruiter> recruiters = Arrays.asList(
                recruiter("r-c", Zone.LIMA).currentLoad(1).build(),
                recruiter("r-b", Zone.LIMA).currentLoad(4).build(),
                recruiter("r-a", Zone.LIMA).currentLoad(1).build());

        assertThat(ids(ranker.rank(position, recruiters, 3))).containsExactly("r-a", "r-c", "r-b");
    }

    @Test
    @DisplayName("limits the result to k and returns nothing when no one is eligible")
    void limitsAndEmpties() {
        RecommendationRanker ranker = new RecommendationRankerImpl(
                new FitScorerImpl(ScoringWeights.defaults(), Messages.spanish()));
        List<Recruiter> recruiters = Arrays.asList(
                recruiter("a", Zone.LIMA).build(),
                recruiter("b", Zone.LIMA).build(),
                recruiter("c", Zone.LIMA).build());

        assertThat(ranker.rank(position, recruiters, 2)).hasSize(2);
        assertThat(ranker.best(position, Collections.singletonList(
                recruiter("busy", Zone.LIMA).capacity(1).currentLoad(1).build()))).isEmpty();
        assertThatThrownBy(() -> ranker.rank(position, recruiters, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static List<String> ids(List<ScoredRecruiter> ranked) {
        return ranked.stream().map(sr -> sr.getRecruiter().getId()).collect(Collectors.toList());
    }
}

package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.FitScore;
import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ScoreBreakdown;
import org.talentia.engine.domain.model.ScoringWeights;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of FitScorer using a normalized weighted sum.
 *
 * Score formula (higher = better):
 *   score = (w_zone * zone + w_capability * capability + w_workload * workload)
 *         / (w_zone + w_capability + w_workload)
 *
 *   zone       = 1.0 primary, 0.5 secondary, 0.1 otherwise
 *   capability = 1.0 when the recruiter is at or one level above the requirement,
 *                decays by 0.15 per extra level above (floor 0.4),
 *                by 0.35 per level below (floor 0.0)
 *   workload   = 1 - (load / capacity)^2
 */
public final class FitScorerImpl implements FitScorer {

    private static final Logger LOG = Logger.getLogger(FitScorerImpl.class.getName());

    private static final double LOW_LOAD_THRESHOLD = 0.75;
    private static final double MEDIUM_LOAD_THRESHOLD = 0.4;

    private final ScoringWeights weights;
    private final Messages messages;

    public FitScorerImpl(ScoringWeights weights, Messages messages) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.messages = Objects.requireNonNull(messages, "messages must not be null");
    }

    @Override
    public boolean isEligible(Recruiter recruiter) {
        return recruiter.isEligible() && !recruiter.isAtCapacity();
    }

    @Override
    public FitScore score(Position position, Recruiter recruiter) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(recruiter, "recruiter must not be null");

        double zone = calculateZoneScore(position, recruiter);
        double capability = calculateCapabilityScore(position, recruiter);
        double workload = calculateWorkloadScore(recruiter);
        ScoreBreakdown breakdown = new ScoreBreakdown(round4(zone), round4(capability), round4(workload));

        double weighted = weights.getZoneWeight() * zone
                + weights.getCapabilityWeight() * capability
                + weights.getWorkloadWeight() * workload;
        double score = round4(clamp(weighted / weights.weightSum()));

        LOG.fine(() -> String.format(
                "Scored %s for %s: zone=%.2f, capability=%.2f, workload=%.2f, total=%.4f",
                recruiter.getId(), position.getId(), zone, capability, workload, score));

        return new FitScore(score, breakdown, explain(position, recruiter, zone, capability, workload));
    }

    /**
     * Zone affinity. Never zero, since cross-zone coverage is sometimes acceptable.
     */
    private double calculateZoneScore(Position position, Recruiter recruiter) {
        if (position.getZone() == recruiter.getPrimaryZone()) {
            return weights.get(ScoringWeights.ZONE_PRIMARY);
        }
        if (recruiter.getSecondaryZones().contains(position.getZone())) {
            return weights.get(ScoringWeights.ZONE_SECONDARY);
        }
        return weights.get(ScoringWeights.ZONE_FLOOR);
    }

    /**
     * Capability fit. Under-qualification is penalized more than modest over-qualification.
     */
    private double calculateCapabilityScore(Position position, Recruiter recruiter) {
        int gap = recruiter.getCapabilityLevel() - position.getRequiredLevel();
        if (gap == 0 || gap == 1) {
            return 1.0;
        }
        if (gap > 1) {
            double penalty = weights.get(ScoringWeights.OVERQUALIFIED_STEP) * (gap - 1);
            return Math.max(weights.get(ScoringWeights.OVERQUALIFIED_FLOOR), 1.0 - penalty);
        }
        return Math.max(0.0, 1.0 - weights.get(ScoringWeights.UNDERQUALIFIED_STEP) * -gap);
    }

    /**
     * Load headroom, decreasing non-linearly as the recruiter approaches capacity.
     */
    private double calculateWorkloadScore(Recruiter recruiter) {
        if (recruiter.isAtCapacity()) {
            return 0.0;
        }
        double ratio = (double) recruiter.getCurrentLoad() / recruiter.getCapacity();
        return clamp(1.0 - Math.pow(ratio, weights.get(ScoringWeights.WORKLOAD_EXPONENT)));
    }

    /**
     * Names the one or two criteria with the largest weighted contribution.
     */
    private String explain(Position position, Recruiter recruiter, double zone, double capability, double workload) {
        List<Contribution> contributions = new ArrayList<>();
        contributions.add(new Contribution(0, weights.getZoneWeight() * zone, zoneKey(position, recruiter)));
        contributions.add(new Contribution(1, weights.getCapabilityWeight() * capability, capabilityKey(position, recruiter)));
        contributions.add(new Contribution(2, weights.getWorkloadWeight() * workload, workloadKey(workload)));
        contributions.sort(Comparator
                .comparingDouble((Contribution c) -> c.value).reversed()
                .thenComparingInt(c -> c.order));

        List<String> reasons = new ArrayList<>(2);
        reasons.add(messages.get(contributions.get(0).messageKey));
        if (contributions.get(1).value > 0) {
            reasons.add(messages.get(contributions.get(1).messageKey));
        }
        return String.join(", ", reasons);
    }

    private String zoneKey(Position position, Recruiter recruiter) {
        if (position.getZone() == recruiter.getPrimaryZone()) {
            return "fit.zone.primary";
        }
        if (recruiter.getSecondaryZones().contains(position.getZone())) {
            return "fit.zone.secondary";
        }
        return "fit.zone.none";
    }

    private String capabilityKey(Position position, Recruiter recruiter) {
        int gap = recruiter.getCapabilityLevel() - position.getRequiredLevel();
        if (gap < 0) {
            return "fit.capability.under";
        }
        if (gap > 1) {
            return "fit.capability.over";
        }
        return "fit.capability.match";
    }

    private String workloadKey(double workload) {
        if (workload >= LOW_LOAD_THRESHOLD) {
            return "fit.workload.low";
        }
        if (workload >= MEDIUM_LOAD_THRESHOLD) {
            return "fit.workload.medium";
        }
        return "fit.workload.high";
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    private static final class Contribution {
        private final int order;
        private final double value;
        private final String messageKey;

        private Contribution(int order, double value, String messageKey) {
            this.order = order;
            this.value = value;
            this.messageKey = messageKey;
        }
    }
}

package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.PrioritizedPosition;
import org.talentia.engine.domain.model.PriorityResult;
import org.talentia.engine.domain.model.PriorityTier;
import org.talentia.engine.domain.model.QueueType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Priority scoring for positions.
 *
 * Score formula (higher = more urgent):
 *   score = base(tier)
 *         + min(MAX_ESCALATION, overdue_days * escalation_per_day(tier))
 *         - ASSIGNED_PENALTY if the position already has a recruiter
 *
 * Queues: P1 positions are critical; the rest are split by required
 * capability level (1-2 technical, 3+ general).
 */
public final class PriorityClassifierImpl implements PriorityClassifier {

    static final double MAX_ESCALATION = 300.0;
    static final double ASSIGNED_PENALTY = 50.0;
    static final int TECHNICAL_MAX_LEVEL = 2;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    // Queue slots per interleave cycle: two critical, one technical, one general
    private static final QueueType[] INTERLEAVE_CYCLE = {
            QueueType.CRITICAL, QueueType.CRITICAL, QueueType.TECHNICAL, QueueType.GENERAL
    };

    private final Messages messages;

    public PriorityClassifierImpl(Messages messages) {
        this.messages = Objects.requireNonNull(messages, "messages must not be null");
    }

    @Override
    public PriorityResult classify(Position position, Instant now) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(now, "now must not be null");

        PriorityTier tier = position.getPriority();
        double overdueDays = overdueDays(position, now);
        double escalation = Math.min(MAX_ESCALATION, overdueDays * tier.getEscalationPerDay());
        double deprioritization = position.hasRecruiter() ? ASSIGNED_PENALTY : 0.0;

        double score = round2(Math.max(0.0, tier.getBaseScore() + escalation - deprioritization));
        QueueType queue = classifyQueue(position);

        return new PriorityResult(score, queue, tier.getBaseScore(), round2(escalation),
                deprioritization, round2(overdueDays), explain(position, now, score, queue, overdueDays));
    }

    @Override
    public List<PrioritizedPosition> prioritize(List<Position> positions, Instant now) {
        return positions.stream()
                .map(p -> new PrioritizedPosition(p, classify(p, now)))
                .sorted(Comparator
                        .comparingDouble((PrioritizedPosition pp) -> pp.getPriority().getScore()).reversed()
                        .thenComparing(pp -> pp.getPosition().effectiveSlaDeadline())
                        .thenComparing(pp -> pp.getPosition().getId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<PrioritizedPosition> interleaveByQueue(List<PrioritizedPosition> prioritized) {
        Map<QueueType, Deque<PrioritizedPosition>> byQueue = new EnumMap<>(QueueType.class);
        for (QueueType queue : QueueType.values()) {
            byQueue.put(queue, new ArrayDeque<>());
        }
        for (PrioritizedPosition pp : prioritized) {
            byQueue.get(pp.getQueue()).addLast(pp);
        }

        List<PrioritizedPosition> result = new ArrayList<>(prioritized.size());
        int cycle = 0;
        while (result.size() < prioritized.size()) {
            QueueType preferred = INTERLEAVE_CYCLE[cycle % INTERLEAVE_CYCLE.length];
            PrioritizedPosition next = byQueue.get(preferred).pollFirst();
            if (next == null) {
                // Slot's queue is drained: fall back in fixed queue order
                for (QueueType fallback : QueueType.values()) {
                    next = byQueue.get(fallback).pollFirst();
                    if (next != null) {
                        break;
                    }
                }
            }
            result.add(next);
            cycle++;
        }
        return result;
    }

    @Override
    public Map<QueueType, Integer> queueCounts(List<PrioritizedPosition> prioritized) {
        Map<QueueType, Integer> counts = new EnumMap<>(QueueType.class);
        for (QueueType queue : QueueType.values()) {
            counts.put(queue, 0);
        }
        for (PrioritizedPosition pp : prioritized) {
            counts.merge(pp.getQueue(), 1, Integer::sum);
        }
        return counts;
    }

    private QueueType classifyQueue(Position position) {
        if (position.getPriority() == PriorityTier.P1) {
            return QueueType.CRITICAL;
        }
        if (position.getRequiredLevel() <= TECHNICAL_MAX_LEVEL) {
            return QueueType.TECHNICAL;
        }
        return QueueType.GENERAL;
    }

    /**
     * Fractional days past the SLA deadline, 0 when not yet due.
     */
    private double overdueDays(Position position, Instant now) {
        long overdueMillis = now.toEpochMilli() - position.effectiveSlaDeadline().toEpochMilli();
        if (overdueMillis <= 0) {
            return 0.0;
        }
        return overdueMillis / MILLIS_PER_DAY;
    }

    private String explain(Position position, Instant now, double score, QueueType queue, double overdueDays) {
        List<String> parts = new ArrayList<>();
        if (overdueDays > 0) {
            parts.add(messages.get("priority.overdue", formatDays(overdueDays)));
        } else {
            double remaining = (position.effectiveSlaDeadline().toEpochMilli() - now.toEpochMilli()) / MILLIS_PER_DAY;
            parts.add(messages.get("priority.due", formatDays(remaining)));
        }
        if (position.hasRecruiter()) {
            parts.add(messages.get("priority.assigned"));
        }
        return messages.get("priority.explanation",
                String.format(Locale.ROOT, "%.0f", score),
                messages.get("queue." + queue.getValue()),
                String.join(", ", parts));
    }

    private static String formatDays(double days) {
        return String.format(Locale.ROOT, "%.1f", days);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.PrioritizedPosition;
import org.talentia.engine.domain.model.PriorityResult;
import org.talentia.engine.domain.model.QueueType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Computes how urgent a position is and which reporting queue it belongs to.
 */
public interface PriorityClassifier {

    /**
     * Classify a position at the given instant.
     * Pure: identical position and instant always give an identical result.
     *
     * @param position the position to classify
     * @param now the evaluation instant
     * @return priority score (higher = more urgent), queue and explanation
     */
    PriorityResult classify(Position position, Instant now);

    /**
     * Classify positions and sort them by priority score, most urgent first.
     * Ties keep the earlier SLA deadline first, then the lower position id.
     */
    List<PrioritizedPosition> prioritize(List<Position> positions, Instant now);

    /**
     * Interleave prioritized positions by queue in a 2:1:1 ratio
     * (critical : technical : general), keeping order within each queue.
     */
    List<PrioritizedPosition> interleaveByQueue(List<PrioritizedPosition> prioritized);

    /**
     * Count positions per queue.
     */
    Map<QueueType, Integer> queueCounts(List<PrioritizedPosition> prioritized);
}

package org.talentia.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read-only workload redistribution proposal. Nothing is moved until a
 * coordinator acts on it.
 */
public final class RedistributionPlan {

    private final boolean balanced;
    private final List<RedistributionMove> moves;
    private final int overloadedCount;
    private final int availableCount;
    private final String summary;

    public RedistributionPlan(boolean balanced, List<RedistributionMove> moves, int overloadedCount,
                              int availableCount, String summary) {
        this.balanced = balanced;
        this.moves = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(moves, "moves must not be null")));
        this.overloadedCount = overloadedCount;
        this.availableCount = availableCount;
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
    }

    public boolean isBalanced() {
        return balanced;
    }

    public List<RedistributionMove> getMoves() {
        return moves;
    }

    public int getTotalCasesToMove() {
        return moves.stream().mapToInt(RedistributionMove::getCasesToMove).sum();
    }

    public int getOverloadedCount() {
        return overloadedCount;
    }

    public int getAvailableCount() {
        return availableCount;
    }

    public String getSummary() {
        return summary;
    }
}

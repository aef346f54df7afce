package org.talentia.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary returned for a successful (fully or partially) assignment batch.
 */
public final class AssignmentBatchResult {

    private final String batchId;
    private final BatchState state;
    private final List<AssignmentView> assignments;
    private final AssignmentStats stats;
    private final String message;
    private final String warning;

    public AssignmentBatchResult(String batchId, BatchState state, List<AssignmentView> assignments,
                                 AssignmentStats stats, String message, String warning) {
        this.batchId = Objects.requireNonNull(batchId, "batchId must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.assignments = Collections.unmodifiableList(assignments);
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.warning = warning;
    }

    public String getBatchId() {
        return batchId;
    }

    public BatchState getState() {
        return state;
    }

    public List<AssignmentView> getAssignments() {
        return assignments;
    }

    public AssignmentStats getStats() {
        return stats;
    }

    public String getMessage() {
        return message;
    }

    public Optional<String> getWarning() {
        return Optional.ofNullable(warning);
    }
}

package org.talentia.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted link between one position and one recruiter.
 * Only status and stage change after creation.
 */
public final class Assignment {

    /** Stage every automatic assignment starts in. */
    public static final String INITIAL_STAGE = "assigned";

    private final String id;
    private final String positionId;
    private final String recruiterId;
    private final double score;
    private final ScoreBreakdown breakdown;
    private final String explanation;
    private final AssignmentType type;
    private final AssignmentStatus status;
    private final String currentStage;
    private final Instant assignedAt;
    private final String reservationBatchId;

    private Assignment(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.positionId = Objects.requireNonNull(builder.positionId, "positionId must not be null");
        this.recruiterId = Objects.requireNonNull(builder.recruiterId, "recruiterId must not be null");
        this.score = builder.score;
        this.breakdown = Objects.requireNonNull(builder.breakdown, "breakdown must not be null");
        this.explanation = builder.explanation != null ? builder.explanation : "";
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.currentStage = builder.currentStage != null ? builder.currentStage : INITIAL_STAGE;
        this.assignedAt = Objects.requireNonNull(builder.assignedAt, "assignedAt must not be null");
        this.reservationBatchId = builder.reservationBatchId;
    }

    public String getId() {
        return id;
    }

    public String getPositionId() {
        return positionId;
    }

    public String getRecruiterId() {
        return recruiterId;
    }

    public double getScore() {
        return score;
    }

    public ScoreBreakdown getBreakdown() {
        return breakdown;
    }

    public String getExplanation() {
        return explanation;
    }

    public AssignmentType getType() {
        return type;
    }

    public AssignmentStatus getStatus() {
        return status;
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public String getReservationBatchId() {
        return reservationBatchId;
    }

    @Override
    public String toString() {
        return String.format("Assignment{id='%s', position='%s', recruiter='%s', score=%.4f, status=%s}",
                id, positionId, recruiterId, score, status);
    }

    /**
     * Builder for Assignment.
     */
    public static final class Builder {
        private String id;
        private String positionId;
        private String recruiterId;
        private double score;
        private ScoreBreakdown breakdown;
        private String explanation;
        private AssignmentType type = AssignmentType.AUTO;
        private AssignmentStatus status = AssignmentStatus.ASSIGNED;
        private String currentStage;
        private Instant assignedAt;
        private String reservationBatchId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder positionId(String positionId) {
            this.positionId = positionId;
            return this;
        }

        public Builder recruiterId(String recruiterId) {
            this.recruiterId = recruiterId;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder breakdown(ScoreBreakdown breakdown) {
            this.breakdown = breakdown;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder type(AssignmentType type) {
            this.type = type;
            return this;
        }

        public Builder status(AssignmentStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentStage(String currentStage) {
            this.currentStage = currentStage;
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder reservationBatchId(String reservationBatchId) {
            this.reservationBatchId = reservationBatchId;
            return this;
        }

        public Assignment build() {
            return new Assignment(this);
        }
    }
}

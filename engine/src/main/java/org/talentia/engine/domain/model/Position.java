package org.talentia.engine.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of a staffing requisition as read from the datastore.
 * The engine only changes a position through its status and recruiter.
 */
public final class Position {

    private final String id;
    private final String title;
    private final Zone zone;
    private final PriorityTier priority;
    private final int requiredLevel;
    private final int headcount;
    private final PositionStatus status;
    private final Instant openedAt;
    private final Instant slaDeadline;
    private final Instant assignedAt;
    private final Instant closedAt;
    private final String recruiterId;

    private Position(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.title = builder.title != null ? builder.title : "";
        this.zone = Objects.requireNonNull(builder.zone, "zone must not be null");
        this.priority = Objects.requireNonNull(builder.priority, "priority must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.openedAt = Objects.requireNonNull(builder.openedAt, "openedAt must not be null");
        if (builder.requiredLevel < 1 || builder.requiredLevel > 5) {
            throw new IllegalArgumentException("requiredLevel must be between 1 and 5");
        }
        if (builder.headcount < 1) {
            throw new IllegalArgumentException("headcount must be at least 1");
        }
        this.requiredLevel = builder.requiredLevel;
        this.headcount = builder.headcount;
        this.slaDeadline = builder.slaDeadline;
        this.assignedAt = builder.assignedAt;
        this.closedAt = builder.closedAt;
        this.recruiterId = builder.recruiterId;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public Zone getZone() {
        return zone;
    }

    public PriorityTier getPriority() {
        return priority;
    }

    public int getRequiredLevel() {
        return requiredLevel;
    }

    public int getHeadcount() {
        return headcount;
    }

    public PositionStatus getStatus() {
        return status;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public Instant getSlaDeadline() {
        return slaDeadline;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public String getRecruiterId() {
        return recruiterId;
    }

    public boolean hasRecruiter() {
        return recruiterId != null && !recruiterId.isEmpty();
    }

    /**
     * SLA deadline, derived from the tier budget when the datastore has none.
     */
    public Instant effectiveSlaDeadline() {
        if (slaDeadline != null) {
            return slaDeadline;
        }
        return openedAt.plus(Duration.ofDays(priority.getSlaDays()));
    }

    /**
     * Share of the SLA window elapsed at the given instant: above 1 once the
     * deadline has passed, 1 when the window is empty.
     */
    public double slaProgress(Instant now) {
        long total = Duration.between(openedAt, effectiveSlaDeadline()).toMillis();
        if (total <= 0) {
            return 1.0;
        }
        return (double) Duration.between(openedAt, now).toMillis() / total;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .zone(zone)
                .priority(priority)
                .requiredLevel(requiredLevel)
                .headcount(headcount)
                .status(status)
                .openedAt(openedAt)
                .slaDeadline(slaDeadline)
                .assignedAt(assignedAt)
                .closedAt(closedAt)
                .recruiterId(recruiterId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Position)) {
            return false;
        }
        return id.equals(((Position) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Position{id='%s', zone=%s, priority=%s, level=%d, status=%s}",
                id, zone, priority, requiredLevel, status);
    }

    /**
     * Builder for Position.
     */
    public static final class Builder {
        private String id;
        private String title;
        private Zone zone;
        private PriorityTier priority = PriorityTier.P3;
        private int requiredLevel = 1;
        private int headcount = 1;
        private PositionStatus status = PositionStatus.OPEN;
        private Instant openedAt;
        private Instant slaDeadline;
        private Instant assignedAt;
        private Instant closedAt;
        private String recruiterId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder zone(Zone zone) {
            this.zone = zone;
            return this;
        }

        public Builder priority(PriorityTier priority) {
            this.priority = priority;
            return this;
        }

        public Builder requiredLevel(int requiredLevel) {
            this.requiredLevel = requiredLevel;
            return this;
        }

        public Builder headcount(int headcount) {
            this.headcount = headcount;
            return this;
        }

        public Builder status(PositionStatus status) {
            this.status = status;
            return this;
        }

        public Builder openedAt(Instant openedAt) {
            this.openedAt = openedAt;
            return this;
        }

        public Builder slaDeadline(Instant slaDeadline) {
            this.slaDeadline = slaDeadline;
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder recruiterId(String recruiterId) {
            this.recruiterId = recruiterId;
            return this;
        }

        public Position build() {
            return new Position(this);
        }
    }
}

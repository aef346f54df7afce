package org.talentia.engine.domain.model;

import java.util.Objects;

public final class PrioritizedPosition {

    private final Position position;
    private final PriorityResult priority;

    public PrioritizedPosition(Position position, PriorityResult priority) {
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
    }

    public Position getPosition() {
        return position;
    }

    public PriorityResult getPriority() {
        return priority;
    }

    public QueueType getQueue() {
        return priority.getQueue();
    }
}

package org.talentia.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read-only recommendation for one position: its urgency and the best ranked recruiters.
 */
public final class PositionSuggestions {

    private final Position position;
    private final PriorityResult priority;
    private final List<ScoredRecruiter> suggestions;

    public PositionSuggestions(Position position, PriorityResult priority, List<ScoredRecruiter> suggestions) {
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.suggestions = Collections.unmodifiableList(suggestions);
    }

    public Position getPosition() {
        return position;
    }

    public PriorityResult getPriority() {
        return priority;
    }

    public List<ScoredRecruiter> getSuggestions() {
        return suggestions;
    }
}

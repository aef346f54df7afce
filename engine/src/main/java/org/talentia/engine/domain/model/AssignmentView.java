package org.talentia.engine.domain.model;

import java.util.Objects;

/**
 * Assignment joined with the recruiter and position display fields.
 */
public final class AssignmentView {

    private final Assignment assignment;
    private final String recruiterName;
    private final String positionTitle;
    private final Zone positionZone;
    private final PriorityTier positionPriority;

    public AssignmentView(Assignment assignment, String recruiterName, String positionTitle,
                          Zone positionZone, PriorityTier positionPriority) {
        this.assignment = Objects.requireNonNull(assignment, "assignment must not be null");
        this.recruiterName = recruiterName;
        this.positionTitle = positionTitle;
        this.positionZone = positionZone;
        this.positionPriority = positionPriority;
    }

    public Assignment getAssignment() {
        return assignment;
    }

    public String getRecruiterName() {
        return recruiterName;
    }

    public String getPositionTitle() {
        return positionTitle;
    }

    public Zone getPositionZone() {
        return positionZone;
    }

    public PriorityTier getPositionPriority() {
        return positionPriority;
    }
}

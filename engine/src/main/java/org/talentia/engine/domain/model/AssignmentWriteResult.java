package org.talentia.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of storing a batch of assignments.
 *
 * Superseded assignments were active for a reassigned position and are no
 * longer. Rejected assignments were not stored because their position was
 * closed, deleted or claimed by another batch once its row was locked.
 */
public final class AssignmentWriteResult {

    private static final AssignmentWriteResult EMPTY =
            new AssignmentWriteResult(Collections.emptyList(), Collections.emptyList());

    private final List<Assignment> superseded;
    private final List<Assignment> rejected;

    public AssignmentWriteResult(List<Assignment> superseded, List<Assignment> rejected) {
        this.superseded = Collections.unmodifiableList(new ArrayList<>(superseded));
        this.rejected = Collections.unmodifiableList(new ArrayList<>(rejected));
    }

    public static AssignmentWriteResult empty() {
        return EMPTY;
    }

    public List<Assignment> getSuperseded() {
        return superseded;
    }

    public List<Assignment> getRejected() {
        return rejected;
    }

    public boolean hasRejected() {
        return !rejected.isEmpty();
    }
}

package org.talentia.engine.repository;

import org.talentia.engine.domain.model.Assignment;
import org.talentia.engine.domain.model.AssignmentFilter;
import org.talentia.engine.domain.model.AssignmentWriteResult;
import org.talentia.engine.domain.model.AssignmentView;
import org.talentia.engine.domain.model.PageResult;

import java.util.List;

public interface AssignmentRepository {

    /**
     * Insert new assignments in a single transaction.
     *
     * Each position row is locked before its assignment is written. A position
     * that is closed or deleted is skipped, and so is one that is no longer
     * open or already holds an active assignment, unless reassign is set. With
     * reassign, the active assignment is marked superseded in the same
     * transaction.
     *
     * @return the superseded and the skipped assignments
     */
    AssignmentWriteResult insertAll(List<Assignment> assignments, boolean reassign);

    /**
     * Page of assignments joined with recruiter and position display fields, newest first.
     */
    PageResult<AssignmentView> find(AssignmentFilter filter);
}

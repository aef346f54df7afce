package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.AssignmentBatchResult;
import org.talentia.engine.domain.model.AssignmentFilter;
import org.talentia.engine.domain.model.AssignmentRequest;
import org.talentia.engine.domain.model.AssignmentView;
import org.talentia.engine.domain.model.PageResult;

/**
 * Runs automatic assignment of positions to recruiters.
 */
public interface AssignmentOrchestrator {

    /**
     * Assign one or more positions to the best available recruiters.
     *
     * Capacity is reserved for the whole batch at once. Positions whose
     * recruiter ran out of capacity are reported as failed while the rest of
     * the batch is still assigned.
     *
     * @param request a single position id or a list of ids
     * @return the created assignments, stats and a localized summary
     * @throws org.talentia.engine.domain.error.ValidationException for a malformed request
     * @throws org.talentia.engine.domain.error.NotFoundException when no requested position exists
     * @throws org.talentia.engine.domain.error.ConflictException when nothing could be assigned
     * @throws org.talentia.engine.domain.error.PersistenceException when assignments could not be saved
     */
    AssignmentBatchResult assign(AssignmentRequest request);

    /**
     * Page through stored assignments, newest first.
     */
    PageResult<AssignmentView> listAssignments(AssignmentFilter filter);
}

package org.talentia.engine.repository;

import org.talentia.engine.domain.model.Recruiter;

import java.util.List;

/**
 * Read access to recruiters. The load counter is only ever written through
 * the capacity reservation coordinator.
 */
public interface RecruiterRepository {

    /**
     * Active, not soft-deleted recruiters that can take work (capacity above
     * zero), ordered by id.
     */
    List<Recruiter> findEligible();

    /**
     * Every active, not soft-deleted recruiter ordered by id, whatever its capacity.
     */
    List<Recruiter> findActive();
}

package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.ReservationResult;

import java.util.List;
import java.util.Map;

/**
 * Sole owner of recruiter load mutations.
 *
 * Every check-and-increment runs inside one datastore transaction under row
 * locks, so no caller can observe or act on a partially applied batch.
 */
public interface CapacityReservationCoordinator {

    /**
     * Atomically reserve capacity for a batch.
     * Each recruiter is accepted only if its post-increment load stays within
     * capacity; rejected recruiters keep their load.
     *
     * @param batchId identifier the accepted reservations are recorded under
     * @param increments increment (at least 1) per recruiter id
     * @return one result per requested recruiter
     */
    List<ReservationResult> reserveBatch(String batchId, Map<String, Integer> increments);

    /**
     * Release every reservation of a batch that is not yet released.
     * Releasing the same batch twice is a no-op the second time.
     *
     * @return the reservations released by this call
     */
    List<ReservationResult> release(String batchId);

    /**
     * Give back part of one recruiter's reservation in a batch. The rest of
     * the batch stays reserved; a reservation brought to zero counts as released.
     *
     * @return the amount released, 0 when no open reservation covers it
     */
    int release(String batchId, String recruiterId, int amount);

    /**
     * Decrement a recruiter's load outside any batch, clamped at zero.
     *
     * @return the new load, or 0 when the recruiter is unknown
     */
    int decrementLoad(String recruiterId, int amount);
}

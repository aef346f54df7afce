package org.talentia.engine.repository;

import org.talentia.engine.domain.model.Position;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access to positions. Soft-deleted positions are never returned.
 */
public interface PositionRepository {

    Optional<Position> findById(String positionId);

    /**
     * Positions with the given ids; only OPEN ones when openOnly is set.
     */
    List<Position> findByIds(Collection<String> positionIds, boolean openOnly);

    /**
     * Every position still counted as active work (open or in progress), oldest first.
     */
    List<Position> findActive();

    /**
     * Move positions to in progress under their new recruiter. A position is
     * only updated while it is not closed and the recruiter holds its active
     * assignment.
     *
     * @param recruiterByPosition recruiter id keyed by position id
     * @return number of rows updated
     */
    int markAssigned(Map<String, String> recruiterByPosition, Instant assignedAt);
}

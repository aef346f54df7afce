package org.talentia.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inbound allocation request: a single position id or a list of ids, plus the
 * force flag that allows reassigning positions that are not open.
 */
public final class AssignmentRequest {

    private final String positionId;
    private final List<String> positionIds;
    private final boolean force;

    public AssignmentRequest(String positionId, List<String> positionIds, boolean force) {
        this.positionId = positionId;
        this.positionIds = positionIds != null
                ? Collections.unmodifiableList(new ArrayList<>(positionIds))
                : null;
        this.force = force;
    }

    public static AssignmentRequest single(String positionId, boolean force) {
        return new AssignmentRequest(positionId, null, force);
    }

    public static AssignmentRequest batch(List<String> positionIds, boolean force) {
        return new AssignmentRequest(null, positionIds, force);
    }

    public String getPositionId() {
        return positionId;
    }

    public List<String> getPositionIds() {
        return positionIds;
    }

    public boolean isForce() {
        return force;
    }

    public boolean isSingle() {
        return positionId != null;
    }
}

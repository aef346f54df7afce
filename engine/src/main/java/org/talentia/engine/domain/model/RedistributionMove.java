package org.talentia.engine.domain.model;

import java.util.Objects;

/**
 * Proposed transfer of cases from an overloaded recruiter to one with room.
 */
public final class RedistributionMove {

    private final Recruiter from;
    private final Recruiter to;
    private final int casesToMove;
    private final boolean zoneMatch;

    public RedistributionMove(Recruiter from, Recruiter to, int casesToMove, boolean zoneMatch) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.to = Objects.requireNonNull(to, "to must not be null");
        if (casesToMove < 1) {
            throw new IllegalArgumentException("casesToMove must be at least 1");
        }
        this.casesToMove = casesToMove;
        this.zoneMatch = zoneMatch;
    }

    public Recruiter getFrom() {
        return from;
    }

    public Recruiter getTo() {
        return to;
    }

    public int getCasesToMove() {
        return casesToMove;
    }

    /**
     * True when the two recruiters share a zone.
     */
    public boolean isZoneMatch() {
        return zoneMatch;
    }

    @Override
    public String toString() {
        return String.format("RedistributionMove{from='%s', to='%s', cases=%d, zoneMatch=%s}",
                from.getId(), to.getId(), casesToMove, zoneMatch);
    }
}

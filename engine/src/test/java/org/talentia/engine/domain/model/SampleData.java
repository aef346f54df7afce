package org.talentia.engine.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Builders for recruiters and positions used across tests.
 */
public final class SampleData {

    public static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private SampleData() {
    }

    public static Recruiter.Builder recruiter(String id, Zone primaryZone) {
        return new Recruiter.Builder()
                .id(id)
                .name("Recruiter " + id)
                .primaryZone(primaryZone)
                .capabilityLevel(3)
                .capacity(10)
                .currentLoad(0)
                .active(true);
    }

    public static Position.Builder position(String id, Zone zone, PriorityTier priority) {
        return new Position.Builder()
                .id(id)
                .title("Position " + id)
                .zone(zone)
                .priority(priority)
                .requiredLevel(3)
                .status(PositionStatus.OPEN)
                .openedAt(NOW.minus(Duration.ofDays(1)));
    }
}

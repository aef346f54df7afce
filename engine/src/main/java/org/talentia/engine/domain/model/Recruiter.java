package org.talentia.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a recruiter, including the load counter as read at
 * snapshot time. The counter itself is owned by the datastore.
 */
public final class Recruiter {

    /** Hard cap applied when no per-recruiter capacity is configured. */
    public static final int DEFAULT_CAPACITY = 13;

    private final String id;
    private final String name;
    private final Zone primaryZone;
    private final List<Zone> secondaryZones;
    private final int capabilityLevel;
    private final int capacity;
    private final int currentLoad;
    private final boolean active;
    private final boolean deleted;

    private Recruiter(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.primaryZone = Objects.requireNonNull(builder.primaryZone, "primaryZone must not be null");
        this.secondaryZones = Collections.unmodifiableList(new ArrayList<>(builder.secondaryZones));
        if (builder.capabilityLevel < 1 || builder.capabilityLevel > 5) {
            throw new IllegalArgumentException("capabilityLevel must be between 1 and 5");
        }
        // Zero capacity is a recruiter taking no new work
        if (builder.capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        this.capabilityLevel = builder.capabilityLevel;
        this.capacity = builder.capacity;
        this.currentLoad = Math.max(0, builder.currentLoad);
        this.active = builder.active;
        this.deleted = builder.deleted;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Zone getPrimaryZone() {
        return primaryZone;
    }

    public List<Zone> getSecondaryZones() {
        return secondaryZones;
    }

    public int getCapabilityLevel() {
        return capabilityLevel;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getCurrentLoad() {
        return currentLoad;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * Active, not soft-deleted recruiters take part in allocation.
     */
    public boolean isEligible() {
        return active && !deleted;
    }

    public boolean isAtCapacity() {
        return currentLoad >= capacity;
    }

    public int headroom() {
        return Math.max(0, capacity - currentLoad);
    }

    /**
     * Copy of this snapshot with a different load, used for batch-local projections.
     */
    public Recruiter withCurrentLoad(int load) {
        return toBuilder().currentLoad(load).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .primaryZone(primaryZone)
                .secondaryZones(secondaryZones)
                .capabilityLevel(capabilityLevel)
                .capacity(capacity)
                .currentLoad(currentLoad)
                .active(active)
                .deleted(deleted);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Recruiter)) {
            return false;
        }
        return id.equals(((Recruiter) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Recruiter{id='%s', name='%s', zone=%s, level=%d, load=%d/%d}",
                id, name, primaryZone, capabilityLevel, currentLoad, capacity);
    }

    /**
     * Builder for Recruiter.
     */
    public static final class Builder {
        private String id;
        private String name;
        private Zone primaryZone;
        private List<Zone> secondaryZones = new ArrayList<>();
        private int capabilityLevel = 1;
        private int capacity = DEFAULT_CAPACITY;
        private int currentLoad;
        private boolean active = true;
        private boolean deleted;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder primaryZone(Zone primaryZone) {
            this.primaryZone = primaryZone;
            return this;
        }

        public Builder secondaryZones(List<Zone> secondaryZones) {
            this.secondaryZones = secondaryZones != null ? new ArrayList<>(secondaryZones) : new ArrayList<>();
            return this;
        }

        public Builder capabilityLevel(int capabilityLevel) {
            this.capabilityLevel = capabilityLevel;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder currentLoad(int currentLoad) {
            this.currentLoad = currentLoad;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder deleted(boolean deleted) {
            this.deleted = deleted;
            return this;
        }

        public Recruiter build() {
            return new Recruiter(this);
        }
    }
}

package org.talentia.engine.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One audit log record. Details are stored as JSON.
 */
public final class AuditEntry {

    public static final String ACTOR_SYSTEM = "system";
    public static final String ACTION_ASSIGN = "assign";
    public static final String ENTITY_ASSIGNMENT = "assignment";

    private final String id;
    private final String actorType;
    private final String actorId;
    private final String action;
    private final String entityType;
    private final String entityId;
    private final Map<String, Object> details;
    private final Instant createdAt;

    public AuditEntry(String id, String actorType, String actorId, String action, String entityType,
                      String entityId, Map<String, Object> details, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.actorType = Objects.requireNonNull(actorType, "actorType must not be null");
        this.actorId = actorId;
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.entityType = Objects.requireNonNull(entityType, "entityType must not be null");
        this.entityId = entityId;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public String getId() {
        return id;
    }

    public String getActorType() {
        return actorType;
    }

    public String getActorId() {
        return actorId;
    }

    public String getAction() {
        return action;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}

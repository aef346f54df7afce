package org.talentia.engine.repository.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.talentia.engine.domain.model.AuditEntry;
import org.talentia.engine.repository.AuditLogRepository;

import java.util.Objects;

public class JdbcAuditLogRepository implements AuditLogRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcAuditLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void record(AuditEntry entry) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO audit_log (id, actor_type, actor_id, action, entity_type, entity_id, details, created_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    entry.getId(),
                    entry.getActorType(),
                    entry.getActorId(),
                    entry.getAction(),
                    entry.getEntityType(),
                    entry.getEntityId(),
                    objectMapper.writeValueAsString(entry.getDetails()),
                    JdbcTimestamps.toTimestamp(entry.getCreatedAt()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit details", e);
        }
    }
}

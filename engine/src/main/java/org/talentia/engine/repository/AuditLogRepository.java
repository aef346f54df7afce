package org.talentia.engine.repository;

import org.talentia.engine.domain.model.AuditEntry;

/**
 * Append-only audit trail.
 */
public interface AuditLogRepository {

    void record(AuditEntry entry);
}

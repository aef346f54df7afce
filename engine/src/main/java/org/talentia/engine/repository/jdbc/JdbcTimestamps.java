package org.talentia.engine.repository.jdbc;

import java.sql.Timestamp;
import java.time.Instant;

final class JdbcTimestamps {

    private JdbcTimestamps() {
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}

package org.talentia.engine.repository.jdbc;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.Zone;
import org.talentia.engine.repository.RecruiterRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class JdbcRecruiterRepository implements RecruiterRepository {

    // Capacity is bound as the first parameter: a NULL column falls back to the configured default
    static final String COLUMNS = "id, name, primary_zone, secondary_zones, capability_level, "
            + "COALESCE(capacity, ?) AS capacity, current_load, is_active, deleted_at";

    private static final RowMapper<Recruiter> ROW_MAPPER = (rs, rowNum) -> new Recruiter.Builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .primaryZone(Zone.fromValue(rs.getString("primary_zone")))
            .secondaryZones(parseZones(rs.getString("secondary_zones")))
            .capabilityLevel(rs.getInt("capability_level"))
            .capacity(rs.getInt("capacity"))
            .currentLoad(rs.getInt("current_load"))
            .active(rs.getBoolean("is_active"))
            .deleted(rs.getTimestamp("deleted_at") != null)
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final int defaultCapacity;

    public JdbcRecruiterRepository(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, Recruiter.DEFAULT_CAPACITY);
    }

    public JdbcRecruiterRepository(JdbcTemplate jdbcTemplate, int defaultCapacity) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        if (defaultCapacity < 1) {
            throw new IllegalArgumentException("defaultCapacity must be at least 1");
        }
        this.defaultCapacity = defaultCapacity;
    }

    @Override
    public List<Recruiter> findEligible() {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM recruiters WHERE is_active = TRUE AND deleted_at IS NULL "
                        + "AND COALESCE(capacity, ?) > 0 ORDER BY id",
                ROW_MAPPER, defaultCapacity, defaultCapacity);
    }

    @Override
    public List<Recruiter> findActive() {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM recruiters WHERE is_active = TRUE AND deleted_at IS NULL ORDER BY id",
                ROW_MAPPER, defaultCapacity);
    }

    /**
     * Secondary zones are stored as an ordered, comma separated list of zone names.
     */
    static List<Zone> parseZones(String value) {
        List<Zone> zones = new ArrayList<>();
        if (value == null || value.trim().isEmpty()) {
            return zones;
        }
        for (String part : value.split(",")) {
            if (!part.trim().isEmpty()) {
                zones.add(Zone.fromValue(part));
            }
        }
        return zones;
    }
}

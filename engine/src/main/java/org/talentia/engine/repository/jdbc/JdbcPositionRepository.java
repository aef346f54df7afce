package org.talentia.engine.repository.jdbc;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;
import org.talentia.engine.domain.model.AssignmentStatus;
import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.PositionStatus;
import org.talentia.engine.domain.model.PriorityTier;
import org.talentia.engine.domain.model.Zone;
import org.talentia.engine.repository.PositionRepository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class JdbcPositionRepository implements PositionRepository {

    private static final String COLUMNS = "id, title, zone, priority, required_level, headcount, status, "
            + "opened_at, sla_deadline, assigned_at, closed_at, recruiter_id";

    private static final RowMapper<Position> ROW_MAPPER = (rs, rowNum) -> new Position.Builder()
            .id(rs.getString("id"))
            .title(rs.getString("title"))
            .zone(Zone.fromValue(rs.getString("zone")))
            .priority(PriorityTier.valueOf(rs.getString("priority")))
            .requiredLevel(rs.getInt("required_level"))
            .headcount(rs.getInt("headcount"))
            .status(PositionStatus.fromValue(rs.getString("status")))
            .openedAt(JdbcTimestamps.toInstant(rs.getTimestamp("opened_at")))
            .slaDeadline(JdbcTimestamps.toInstant(rs.getTimestamp("sla_deadline")))
            .assignedAt(JdbcTimestamps.toInstant(rs.getTimestamp("assigned_at")))
            .closedAt(JdbcTimestamps.toInstant(rs.getTimestamp("closed_at")))
            .recruiterId(rs.getString("recruiter_id"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcPositionRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
    }

    @Override
    public Optional<Position> findById(String positionId) {
        List<Position> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM positions WHERE id = ? AND deleted_at IS NULL",
                ROW_MAPPER, positionId);
        return rows.stream().findFirst();
    }

    @Override
    public List<Position> findByIds(Collection<String> positionIds, boolean openOnly) {
        if (positionIds.isEmpty()) {
            return Collections.emptyList();
        }
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS
                + " FROM positions WHERE id IN (:ids) AND deleted_at IS NULL");
        MapSqlParameterSource params = new MapSqlParameterSource("ids", new ArrayList<>(positionIds));
        if (openOnly) {
            sql.append(" AND status = :status");
            params.addValue("status", PositionStatus.OPEN.getValue());
        }
        sql.append(" ORDER BY id");
        return namedJdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
    }

    @Override
    public List<Position> findActive() {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM positions WHERE status IN (?, ?) AND deleted_at IS NULL "
                        + "ORDER BY opened_at, id",
                ROW_MAPPER,
                PositionStatus.OPEN.getValue(), PositionStatus.IN_PROGRESS.getValue());
    }

    @Override
    public int markAssigned(Map<String, String> recruiterByPosition, Instant assignedAt) {
        if (recruiterByPosition.isEmpty()) {
            return 0;
        }
        Timestamp ts = JdbcTimestamps.toTimestamp(assignedAt);
        Integer updated = transactionTemplate.execute(status -> {
            int count = 0;
            for (Map.Entry<String, String> entry : recruiterByPosition.entrySet()) {
                // A batch that lost its assignment to a later one must not overwrite the position
                count += jdbcTemplate.update(
                        "UPDATE positions SET status = ?, recruiter_id = ?, assigned_at = ? "
                                + "WHERE id = ? AND deleted_at IS NULL AND status IN (?, ?, ?) "
                                + "AND EXISTS (SELECT 1 FROM assignments a WHERE a.position_id = positions.id "
                                + "AND a.recruiter_id = ? AND a.status = ?)",
                        PositionStatus.IN_PROGRESS.getValue(), entry.getValue(), ts, entry.getKey(),
                        PositionStatus.OPEN.getValue(), PositionStatus.IN_PROGRESS.getValue(),
                        PositionStatus.ON_HOLD.getValue(),
                        entry.getValue(), AssignmentStatus.ASSIGNED.getValue());
            }
            return count;
        });
        return updated != null ? updated : 0;
    }
}

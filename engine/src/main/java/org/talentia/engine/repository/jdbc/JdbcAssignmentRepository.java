package org.talentia.engine.repository.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;
import org.talentia.engine.domain.model.Assignment;
import org.talentia.engine.domain.model.AssignmentFilter;
import org.talentia.engine.domain.model.AssignmentStatus;
import org.talentia.engine.domain.model.AssignmentType;
import org.talentia.engine.domain.model.AssignmentView;
import org.talentia.engine.domain.model.AssignmentWriteResult;
import org.talentia.engine.domain.model.PageResult;
import org.talentia.engine.domain.model.PositionStatus;
import org.talentia.engine.domain.model.PriorityTier;
import org.talentia.engine.domain.model.ScoreBreakdown;
import org.talentia.engine.domain.model.Zone;
import org.talentia.engine.repository.AssignmentRepository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

public class JdbcAssignmentRepository implements AssignmentRepository {

    private static final TypeReference<Map<String, Double>> BREAKDOWN_TYPE = new TypeReference<>() {
    };

    private static final Logger LOG = Logger.getLogger(JdbcAssignmentRepository.class.getName());

    private static final String POSITION_LOCK_SQL =
            "SELECT status FROM positions WHERE id = ? AND deleted_at IS NULL FOR UPDATE";

    private static final String COLUMNS = "a.id, a.position_id, a.recruiter_id, a.score, a.score_breakdown, "
            + "a.explanation, a.assignment_type, a.status, a.current_stage, a.assigned_at, a.reservation_batch_id";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Assignment> assignmentMapper = (rs, rowNum) -> mapAssignment(rs);

    public JdbcAssignmentRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                    ObjectMapper objectMapper) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public AssignmentWriteResult insertAll(List<Assignment> assignments, boolean reassign) {
        if (assignments.isEmpty()) {
            return AssignmentWriteResult.empty();
        }
        AssignmentWriteResult result = transactionTemplate.execute(status -> {
            List<Assignment> superseded = new ArrayList<>();
            List<Assignment> rejected = new ArrayList<>();
            Instant now = Instant.now();
            for (Assignment assignment : assignments) {
                // The position lock serializes concurrent batches claiming the same position
                List<String> locked = jdbcTemplate.queryForList(POSITION_LOCK_SQL, String.class,
                        assignment.getPositionId());
                List<Assignment> active = jdbcTemplate.query(
                        "SELECT " + COLUMNS + " FROM assignments a WHERE a.position_id = ? AND a.status = ? FOR UPDATE",
                        assignmentMapper, assignment.getPositionId(), AssignmentStatus.ASSIGNED.getValue());
                if (!claimable(locked, active, reassign)) {
                    LOG.info(() -> "Position " + assignment.getPositionId() + " is no longer assignable, skipping "
                            + assignment.getId());
                    rejected.add(assignment);
                    continue;
                }

                superseded.addAll(active);
                jdbcTemplate.update(
                        "UPDATE assignments SET status = ? WHERE position_id = ? AND status = ?",
                        AssignmentStatus.SUPERSEDED.getValue(), assignment.getPositionId(),
                        AssignmentStatus.ASSIGNED.getValue());
                jdbcTemplate.update(
                        "INSERT INTO assignments (id, position_id, recruiter_id, score, score_breakdown, explanation, "
                                + "assignment_type, status, current_stage, assigned_at, reservation_batch_id, created_at) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                        assignment.getId(),
                        assignment.getPositionId(),
                        assignment.getRecruiterId(),
                        assignment.getScore(),
                        writeBreakdown(assignment.getBreakdown()),
                        assignment.getExplanation(),
                        assignment.getType().getValue(),
                        assignment.getStatus().getValue(),
                        assignment.getCurrentStage(),
                        JdbcTimestamps.toTimestamp(assignment.getAssignedAt()),
                        assignment.getReservationBatchId(),
                        JdbcTimestamps.toTimestamp(now));
            }
            return new AssignmentWriteResult(superseded, rejected);
        });
        return result != null ? result : AssignmentWriteResult.empty();
    }

    private static boolean claimable(List<String> positionStatus, List<Assignment> active, boolean reassign) {
        if (positionStatus.isEmpty()) {
            return false;
        }
        PositionStatus status = PositionStatus.fromValue(positionStatus.get(0));
        if (status.isClosed()) {
            return false;
        }
        return reassign || (status == PositionStatus.OPEN && active.isEmpty());
    }

    @Override
    public PageResult<AssignmentView> find(AssignmentFilter filter) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (filter.getPositionId() != null) {
            where.append(" AND a.position_id = :positionId");
            params.addValue("positionId", filter.getPositionId());
        }
        if (filter.getRecruiterId() != null) {
            where.append(" AND a.recruiter_id = :recruiterId");
            params.addValue("recruiterId", filter.getRecruiterId());
        }
        if (filter.getStatus() != null) {
            where.append(" AND a.status = :status");
            params.addValue("status", filter.getStatus().getValue());
        }

        Long total = namedJdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM assignments a" + where, params, Long.class);

        params.addValue("limit", filter.getPerPage());
        params.addValue("offset", filter.offset());
        List<AssignmentView> rows = namedJdbcTemplate.query(
                "SELECT " + COLUMNS + ", r.name AS recruiter_name, p.title AS position_title, "
                        + "p.zone AS position_zone, p.priority AS position_priority "
                        + "FROM assignments a "
                        + "LEFT JOIN recruiters r ON r.id = a.recruiter_id "
                        + "LEFT JOIN positions p ON p.id = a.position_id"
                        + where
                        + " ORDER BY a.created_at DESC, a.id DESC LIMIT :limit OFFSET :offset",
                params,
                (rs, rowNum) -> new AssignmentView(
                        mapAssignment(rs),
                        rs.getString("recruiter_name"),
                        rs.getString("position_title"),
                        rs.getString("position_zone") != null ? Zone.fromValue(rs.getString("position_zone")) : null,
                        rs.getString("position_priority") != null
                                ? PriorityTier.valueOf(rs.getString("position_priority"))
                                : null));

        return new PageResult<>(rows, total != null ? total : 0L, filter.getPage(), filter.getPerPage());
    }

    private Assignment mapAssignment(ResultSet rs) throws SQLException {
        return new Assignment.Builder()
                .id(rs.getString("id"))
                .positionId(rs.getString("position_id"))
                .recruiterId(rs.getString("recruiter_id"))
                .score(rs.getDouble("score"))
                .breakdown(readBreakdown(rs.getString("score_breakdown")))
                .explanation(rs.getString("explanation"))
                .type(AssignmentType.fromValue(rs.getString("assignment_type")))
                .status(AssignmentStatus.fromValue(rs.getString("status")))
                .currentStage(rs.getString("current_stage"))
                .assignedAt(JdbcTimestamps.toInstant(rs.getTimestamp("assigned_at")))
                .reservationBatchId(rs.getString("reservation_batch_id"))
                .build();
    }

    private String writeBreakdown(ScoreBreakdown breakdown) {
        try {
            return objectMapper.writeValueAsString(breakdown.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize score breakdown", e);
        }
    }

    private ScoreBreakdown readBreakdown(String json) {
        try {
            return ScoreBreakdown.fromMap(objectMapper.readValue(json, BREAKDOWN_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize score breakdown", e);
        }
    }
}

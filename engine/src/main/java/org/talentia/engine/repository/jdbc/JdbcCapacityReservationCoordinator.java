package org.talentia.engine.repository.jdbc;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ReservationResult;
import org.talentia.engine.domain.service.CapacityReservationCoordinator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Capacity coordinator backed by row locks on the recruiters table.
 *
 * Recruiter rows are locked in ascending id order so two concurrent batches
 * touching overlapping recruiters cannot deadlock. The capacity check and the
 * increment are a single conditional UPDATE, which keeps {@code current_load}
 * within {@code capacity} even if a caller skipped the lock.
 */
public class JdbcCapacityReservationCoordinator implements CapacityReservationCoordinator {

    private static final Logger LOG = Logger.getLogger(JdbcCapacityReservationCoordinator.class.getName());

    private static final String LOCK_SQL = "SELECT id FROM recruiters WHERE id = ? FOR UPDATE";
    private static final String RESERVE_SQL = "UPDATE recruiters SET current_load = current_load + ?, updated_at = ? "
            + "WHERE id = ? AND is_active = TRUE AND deleted_at IS NULL AND current_load + ? <= COALESCE(capacity, ?)";
    private static final String LOAD_SQL = "SELECT current_load FROM recruiters WHERE id = ?";
    private static final String DECREMENT_SQL = "UPDATE recruiters SET current_load = GREATEST(0, current_load - ?), "
            + "updated_at = ? WHERE id = ? AND deleted_at IS NULL";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int defaultCapacity;

    public JdbcCapacityReservationCoordinator(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                              Clock clock) {
        this(jdbcTemplate, transactionTemplate, clock, Recruiter.DEFAULT_CAPACITY);
    }

    public JdbcCapacityReservationCoordinator(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                              Clock clock, int defaultCapacity) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultCapacity = defaultCapacity;
    }

    @Override
    public List<ReservationResult> reserveBatch(String batchId, Map<String, Integer> increments) {
        Objects.requireNonNull(batchId, "batchId must not be null");
        Objects.requireNonNull(increments, "increments must not be null");
        if (increments.isEmpty()) {
            return Collections.emptyList();
        }
        for (Map.Entry<String, Integer> entry : increments.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 1) {
                throw new IllegalArgumentException("Increment for " + entry.getKey() + " must be at least 1");
            }
        }

        // Lock order is the sorted recruiter id
        Map<String, Integer> ordered = new TreeMap<>(increments);
        List<ReservationResult> batch = transactionTemplate.execute(status -> {
            List<ReservationResult> reserved = new ArrayList<>(ordered.size());
            for (Map.Entry<String, Integer> entry : ordered.entrySet()) {
                reserved.add(reserveOne(batchId, entry.getKey(), entry.getValue()));
            }
            return reserved;
        });
        List<ReservationResult> results = batch != null ? batch : Collections.<ReservationResult>emptyList();

        long accepted = results.stream().filter(ReservationResult::isSuccess).count();
        LOG.info(() -> String.format("Reservation batch %s: %d/%d recruiters accepted",
                batchId, accepted, ordered.size()));
        return results;
    }

    private ReservationResult reserveOne(String batchId, String recruiterId, int increment) {
        List<String> locked = jdbcTemplate.queryForList(LOCK_SQL, String.class, recruiterId);
        if (locked.isEmpty()) {
            LOG.warning(() -> "Reservation rejected, unknown recruiter " + recruiterId);
            return new ReservationResult(recruiterId, increment, false, -1);
        }

        int updated = jdbcTemplate.update(RESERVE_SQL,
                increment, JdbcTimestamps.toTimestamp(clock.instant()), recruiterId, increment, defaultCapacity);
        Integer load = jdbcTemplate.queryForObject(LOAD_SQL, Integer.class, recruiterId);
        int newLoad = load != null ? load : -1;

        if (updated != 1) {
            LOG.fine(() -> String.format("Reservation rejected for %s: +%d exceeds capacity (load %d)",
                    recruiterId, increment, newLoad));
            return new ReservationResult(recruiterId, increment, false, newLoad);
        }

        jdbcTemplate.update(
                "INSERT INTO capacity_reservations (batch_id, recruiter_id, amount, released, created_at) "
                        + "VALUES (?, ?, ?, FALSE, ?)",
                batchId, recruiterId, increment, JdbcTimestamps.toTimestamp(clock.instant()));
        return new ReservationResult(recruiterId, increment, true, newLoad);
    }

    @Override
    public List<ReservationResult> release(String batchId) {
        Objects.requireNonNull(batchId, "batchId must not be null");
        List<ReservationResult> released = transactionTemplate.execute(status -> {
            Map<String, Integer> pending = new TreeMap<>();
            jdbcTemplate.query(
                    "SELECT recruiter_id, amount FROM capacity_reservations WHERE batch_id = ? AND released = FALSE",
                    rs -> {
                        pending.put(rs.getString("recruiter_id"), rs.getInt("amount"));
                    },
                    batchId);

            List<ReservationResult> results = new ArrayList<>(pending.size());
            for (Map.Entry<String, Integer> entry : pending.entrySet()) {
                String recruiterId = entry.getKey();
                int amount = entry.getValue();
                jdbcTemplate.queryForList(LOCK_SQL, String.class, recruiterId);
                // Only the caller that flips the flag gives the load back
                int flipped = jdbcTemplate.update(
                        "UPDATE capacity_reservations SET released = TRUE, released_at = ? "
                                + "WHERE batch_id = ? AND recruiter_id = ? AND released = FALSE",
                        JdbcTimestamps.toTimestamp(clock.instant()), batchId, recruiterId);
                if (flipped != 1) {
                    continue;
                }
                jdbcTemplate.update(DECREMENT_SQL, amount, JdbcTimestamps.toTimestamp(clock.instant()), recruiterId);
                results.add(new ReservationResult(recruiterId, amount, true, currentLoad(recruiterId)));
            }
            return results;
        });

        List<ReservationResult> result = released != null ? released : Collections.<ReservationResult>emptyList();
        if (result.isEmpty()) {
            LOG.fine(() -> "Nothing to release for batch " + batchId);
        } else {
            LOG.log(Level.INFO, () -> String.format("Released batch %s for %d recruiters", batchId, result.size()));
        }
        return result;
    }

    @Override
    public int release(String batchId, String recruiterId, int amount) {
        Objects.requireNonNull(batchId, "batchId must not be null");
        Objects.requireNonNull(recruiterId, "recruiterId must not be null");
        if (amount < 1) {
            throw new IllegalArgumentException("amount must be at least 1");
        }
        Integer released = transactionTemplate.execute(status -> {
            jdbcTemplate.queryForList(LOCK_SQL, String.class, recruiterId);
            int updated = jdbcTemplate.update(
                    "UPDATE capacity_reservations SET released = TRUE, released_at = ? "
                            + "WHERE batch_id = ? AND recruiter_id = ? AND released = FALSE AND amount = ?",
                    JdbcTimestamps.toTimestamp(clock.instant()), batchId, recruiterId, amount);
            if (updated != 1) {
                updated = jdbcTemplate.update(
                        "UPDATE capacity_reservations SET amount = amount - ? "
                                + "WHERE batch_id = ? AND recruiter_id = ? AND released = FALSE AND amount > ?",
                        amount, batchId, recruiterId, amount);
            }
            if (updated != 1) {
                return 0;
            }
            jdbcTemplate.update(DECREMENT_SQL, amount, JdbcTimestamps.toTimestamp(clock.instant()), recruiterId);
            return amount;
        });
        int result = released != null ? released : 0;
        LOG.info(() -> String.format("Released %d of batch %s for recruiter %s", result, batchId, recruiterId));
        return result;
    }

    @Override
    public int decrementLoad(String recruiterId, int amount) {
        Objects.requireNonNull(recruiterId, "recruiterId must not be null");
        if (amount < 1) {
            throw new IllegalArgumentException("amount must be at least 1");
        }
        Integer load = transactionTemplate.execute(status -> {
            List<String> locked = jdbcTemplate.queryForList(LOCK_SQL, String.class, recruiterId);
            if (locked.isEmpty()) {
                return 0;
            }
            jdbcTemplate.update(DECREMENT_SQL, amount, JdbcTimestamps.toTimestamp(clock.instant()), recruiterId);
            return currentLoad(recruiterId);
        });
        return load != null ? load : 0;
    }

    private int currentLoad(String recruiterId) {
        Integer load = jdbcTemplate.queryForObject(LOAD_SQL, Integer.class, recruiterId);
        return load != null ? load : 0;
    }
}

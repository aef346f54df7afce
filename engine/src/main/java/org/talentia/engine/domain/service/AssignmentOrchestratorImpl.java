package org.talentia.engine.domain.service;

import org.talentia.engine.domain.error.ConflictException;
import org.talentia.engine.domain.error.NotFoundException;
import org.talentia.engine.domain.error.PersistenceException;
import org.talentia.engine.domain.error.ValidationException;
import org.talentia.engine.domain.model.Assignment;
import org.talentia.engine.domain.model.AssignmentBatchResult;
import org.talentia.engine.domain.model.AssignmentFilter;
import org.talentia.engine.domain.model.AssignmentRequest;
import org.talentia.engine.domain.model.AssignmentStats;
import org.talentia.engine.domain.model.AssignmentStatus;
import org.talentia.engine.domain.model.AssignmentType;
import org.talentia.engine.domain.model.AssignmentView;
import org.talentia.engine.domain.model.AssignmentWriteResult;
import org.talentia.engine.domain.model.AuditEntry;
import org.talentia.engine.domain.model.BatchState;
import org.talentia.engine.domain.model.PageResult;
import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.PositionStatus;
import org.talentia.engine.domain.model.PriorityTier;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ReservationResult;
import org.talentia.engine.domain.model.ScoredRecruiter;
import org.talentia.engine.repository.AssignmentRepository;
import org.talentia.engine.repository.AuditLogRepository;
import org.talentia.engine.repository.PositionRepository;
import org.talentia.engine.repository.RecruiterRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Assignment pipeline: resolve, rank, reserve, persist, update, audit.
 *
 * Recruiter loads are only changed through the capacity coordinator. Once
 * capacity is reserved, any failure before the assignments are stored
 * releases the whole reservation batch.
 */
public final class AssignmentOrchestratorImpl implements AssignmentOrchestrator {

    private static final Logger LOG = Logger.getLogger(AssignmentOrchestratorImpl.class.getName());

    // Most urgent tier first, then the earliest SLA deadline
    private static final Comparator<Position> URGENCY = Comparator
            .comparingInt((Position p) -> p.getPriority().rank())
            .thenComparing(Position::effectiveSlaDeadline)
            .thenComparing(Position::getId);

    private final RecruiterRepository recruiterRepository;
    private final PositionRepository positionRepository;
    private final AssignmentRepository assignmentRepository;
    private final AuditLogRepository auditLogRepository;
    private final RecommendationRanker ranker;
    private final CapacityReservationCoordinator coordinator;
    private final Messages messages;
    private final Clock clock;

    private AssignmentOrchestratorImpl(Builder builder) {
        this.recruiterRepository = Objects.requireNonNull(builder.recruiterRepository, "recruiterRepository must not be null");
        this.positionRepository = Objects.requireNonNull(builder.positionRepository, "positionRepository must not be null");
        this.assignmentRepository = Objects.requireNonNull(builder.assignmentRepository, "assignmentRepository must not be null");
        this.auditLogRepository = Objects.requireNonNull(builder.auditLogRepository, "auditLogRepository must not be null");
        this.ranker = Objects.requireNonNull(builder.ranker, "ranker must not be null");
        this.coordinator = Objects.requireNonNull(builder.coordinator, "coordinator must not be null");
        this.messages = Objects.requireNonNull(builder.messages, "messages must not be null");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    @Override
    public AssignmentBatchResult assign(AssignmentRequest request) {
        String batchId = UUID.randomUUID().toString();
        transition(batchId, BatchState.RECEIVED);
        try {
            return run(batchId, request);
        } catch (RuntimeException e) {
            transition(batchId, BatchState.REJECTED);
            throw e;
        }
    }

    private AssignmentBatchResult run(String batchId, AssignmentRequest request) {
        validate(request);

        List<Recruiter> recruiters = recruiterRepository.findEligible();
        if (recruiters.isEmpty()) {
            throw new ConflictException(messages.get("error.no_recruiters"));
        }

        List<Position> positions = resolvePositions(request);
        positions.sort(URGENCY);
        transition(batchId, BatchState.POSITIONS_RESOLVED);

        Map<String, Recruiter> recruitersById = recruiters.stream()
                .collect(Collectors.toMap(Recruiter::getId, r -> r, (a, b) -> a, LinkedHashMap::new));
        List<Proposal> proposals = propose(positions, recruitersById);
        if (proposals.isEmpty()) {
            throw new ConflictException(messages.get("error.no_eligible"));
        }
        int unmatched = positions.size() - proposals.size();
        transition(batchId, BatchState.RECOMMENDATIONS_COMPUTED);

        Map<String, Integer> increments = new LinkedHashMap<>();
        for (Proposal proposal : proposals) {
            increments.merge(proposal.recruiter.getId(), 1, Integer::sum);
        }
        List<ReservationResult> reservations = coordinator.reserveBatch(batchId, increments);

        Set<String> failedRecruiters = new LinkedHashSet<>();
        for (ReservationResult reservation : reservations) {
            if (!reservation.isSuccess()) {
                failedRecruiters.add(reservation.getRecruiterId());
            }
        }
        List<Proposal> accepted = proposals.stream()
                .filter(p -> !failedRecruiters.contains(p.recruiter.getId()))
                .collect(Collectors.toList());

        if (accepted.isEmpty()) {
            coordinator.release(batchId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("failed_recruiter_ids", new ArrayList<>(failedRecruiters));
            throw new ConflictException(messages.get("error.no_capacity"), details);
        }
        transition(batchId, BatchState.CAPACITY_RESERVED);

        Instant now = clock.instant();
        List<Assignment> assignments = accepted.stream()
                .map(p -> toAssignment(p, batchId, now))
                .collect(Collectors.toList());
        AssignmentWriteResult written = persist(batchId, assignments, request.isForce());

        // Positions claimed by a concurrent batch since they were resolved
        Set<String> taken = new LinkedHashSet<>();
        for (Assignment skipped : written.getRejected()) {
            taken.add(skipped.getPositionId());
        }
        List<Proposal> stored = new ArrayList<>(accepted.size());
        List<Assignment> storedAssignments = new ArrayList<>(assignments.size());
        for (int i = 0; i < accepted.size(); i++) {
            if (!taken.contains(assignments.get(i).getPositionId())) {
                stored.add(accepted.get(i));
                storedAssignments.add(assignments.get(i));
            }
        }
        if (!taken.isEmpty()) {
            giveBack(batchId, written.getRejected());
        }
        if (stored.isEmpty()) {
            releaseQuietly(batchId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("position_ids", new ArrayList<>(taken));
            throw new ConflictException(messages.get("error.already_assigned"), details);
        }
        transition(batchId, BatchState.PERSISTED);
        int failed = unmatched + (proposals.size() - accepted.size()) + taken.size();

        List<String> warnings = new ArrayList<>();
        int shortfall = failed - taken.size();
        if (shortfall > 0) {
            Set<String> shortfallIds = failedRecruiters.isEmpty()
                    ? Collections.singleton("-") : failedRecruiters;
            warnings.add(messages.get("batch.warning.shortfall", shortfall, String.join(", ", shortfallIds)));
        }
        if (!taken.isEmpty()) {
            warnings.add(messages.get("batch.warning.taken", taken.size(), String.join(", ", taken)));
        }
        if (updatePositions(batchId, stored, now)) {
            transition(batchId, BatchState.STATUS_UPDATED);
        } else {
            warnings.add(messages.get("batch.warning.status"));
        }

        AssignmentStats stats = stats(stored, failed);
        audit(batchId, stored, failedRecruiters, stats, now);

        List<AssignmentView> views = new ArrayList<>(storedAssignments.size());
        for (int i = 0; i < storedAssignments.size(); i++) {
            Proposal proposal = stored.get(i);
            views.add(new AssignmentView(storedAssignments.get(i), proposal.recruiter.getName(),
                    proposal.position.getTitle(), proposal.position.getZone(), proposal.position.getPriority()));
        }

        BatchState finalState = failed > 0 ? BatchState.PARTIAL_FAILURE : BatchState.COMPLETED;
        transition(batchId, finalState);
        LOG.info(() -> String.format("Batch %s assigned %d position(s), %d failed", batchId, stored.size(), failed));

        return new AssignmentBatchResult(batchId, finalState, views, stats,
                message(request, stored, failed),
                warnings.isEmpty() ? null : String.join(" ", warnings));
    }

    @Override
    public PageResult<AssignmentView> listAssignments(AssignmentFilter filter) {
        return assignmentRepository.find(Objects.requireNonNull(filter, "filter must not be null"));
    }

    private void validate(AssignmentRequest request) {
        if (request == null) {
            throw new ValidationException(messages.get("error.validation.target"));
        }
        boolean hasSingle = request.getPositionId() != null;
        boolean hasBatch = request.getPositionIds() != null;
        if (hasSingle && hasBatch) {
            throw new ValidationException(messages.get("error.validation.both"));
        }
        if (!hasSingle && (!hasBatch || request.getPositionIds().isEmpty())) {
            throw new ValidationException(messages.get("error.validation.target"));
        }
        List<String> ids = hasSingle ? Collections.singletonList(request.getPositionId()) : request.getPositionIds();
        for (String id : ids) {
            if (id == null || id.trim().isEmpty()) {
                throw new ValidationException(messages.get("error.validation.blank"));
            }
        }
    }

    private List<Position> resolvePositions(AssignmentRequest request) {
        if (request.isSingle()) {
            Position position = positionRepository.findById(request.getPositionId())
                    .orElseThrow(() -> new NotFoundException(messages.get("error.position_not_found")));
            if (position.getStatus() != PositionStatus.OPEN && (!request.isForce() || position.getStatus().isClosed())) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("position_id", position.getId());
                details.put("status", position.getStatus().getValue());
                throw new ConflictException(messages.get("error.already_assigned"), details);
            }
            List<Position> single = new ArrayList<>();
            single.add(position);
            return single;
        }

        Set<String> unique = new LinkedHashSet<>(request.getPositionIds());
        List<Position> found = positionRepository.findByIds(unique, !request.isForce()).stream()
                .filter(p -> !p.getStatus().isClosed())
                .collect(Collectors.toCollection(ArrayList::new));
        if (found.isEmpty()) {
            throw new NotFoundException(messages.get("error.no_positions"));
        }
        return found;
    }

    /**
     * Pick the best recruiter per position against a batch-local copy of the
     * loads, so a batch never proposes more than a recruiter's visible headroom.
     */
    private List<Proposal> propose(List<Position> positions, Map<String, Recruiter> recruitersById) {
        Map<String, Recruiter> projected = new LinkedHashMap<>(recruitersById);
        List<Proposal> proposals = new ArrayList<>();
        for (Position position : positions) {
            Optional<ScoredRecruiter> best = ranker.best(position, projected.values());
            if (!best.isPresent()) {
                LOG.fine(() -> "No recruiter with headroom for position " + position.getId());
                continue;
            }
            Recruiter winner = best.get().getRecruiter();
            proposals.add(new Proposal(position, recruitersById.get(winner.getId()), best.get()));
            projected.put(winner.getId(), winner.withCurrentLoad(winner.getCurrentLoad() + 1));
        }
        return proposals;
    }

    private AssignmentWriteResult persist(String batchId, List<Assignment> assignments, boolean reassign) {
        AssignmentWriteResult written;
        try {
            written = assignmentRepository.insertAll(assignments, reassign);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e, () -> "Failed to persist assignments for batch " + batchId + ", releasing capacity");
            releaseQuietly(batchId);
            throw new PersistenceException(messages.get("error.persistence"), e);
        }

        // Reassigned positions give their previous recruiter a slot back
        for (Assignment previous : written.getSuperseded()) {
            try {
                int load = coordinator.decrementLoad(previous.getRecruiterId(), 1);
                LOG.info(() -> String.format("Superseded assignment %s, recruiter %s load now %d",
                        previous.getId(), previous.getRecruiterId(), load));
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, e, () -> "Failed to release capacity of superseded assignment " + previous.getId());
            }
        }
        return written;
    }

    private void giveBack(String batchId, List<Assignment> skipped) {
        Map<String, Integer> byRecruiter = new LinkedHashMap<>();
        for (Assignment assignment : skipped) {
            byRecruiter.merge(assignment.getRecruiterId(), 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : byRecruiter.entrySet()) {
            try {
                coordinator.release(batchId, entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, e, () -> "Failed to release reservation of " + entry.getKey()
                        + " in batch " + batchId);
            }
        }
    }

    private void releaseQuietly(String batchId) {
        try {
            coordinator.release(batchId);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e, () -> "Failed to release reservation batch " + batchId);
        }
    }

    private boolean updatePositions(String batchId, List<Proposal> accepted, Instant now) {
        Map<String, String> recruiterByPosition = new LinkedHashMap<>();
        for (Proposal proposal : accepted) {
            recruiterByPosition.put(proposal.position.getId(), proposal.recruiter.getId());
        }
        int updated;
        try {
            updated = positionRepository.markAssigned(recruiterByPosition, now);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Assignments of batch " + batchId + " saved but position status update failed");
            return false;
        }
        if (updated != recruiterByPosition.size()) {
            LOG.warning(() -> String.format("Batch %s updated %d of %d position(s)",
                    batchId, updated, recruiterByPosition.size()));
            return false;
        }
        return true;
    }

    private void audit(String batchId, List<Proposal> accepted, Set<String> failedRecruiters,
                       AssignmentStats stats, Instant now) {
        Map<String, Object> statsDetails = new LinkedHashMap<>();
        statsDetails.put("total_assigned", stats.getTotalAssigned());
        statsDetails.put("total_failed", stats.getTotalFailed());
        statsDetails.put("average_score", stats.getAverageScore());
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        stats.getByPriority().forEach((tier, count) -> byPriority.put(tier.name(), count));
        statsDetails.put("by_priority", byPriority);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("batch_id", batchId);
        details.put("assigned_at", now);
        details.put("assignments_count", accepted.size());
        details.put("failed_count", stats.getTotalFailed());
        details.put("position_ids", accepted.stream().map(p -> p.position.getId()).collect(Collectors.toList()));
        details.put("failed_recruiter_ids", new ArrayList<>(failedRecruiters));
        details.put("stats", statsDetails);

        try {
            auditLogRepository.record(new AuditEntry(UUID.randomUUID().toString(), AuditEntry.ACTOR_SYSTEM, null,
                    AuditEntry.ACTION_ASSIGN, AuditEntry.ENTITY_ASSIGNMENT, batchId, details, now));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Failed to write audit entry for batch " + batchId);
        }
    }

    private AssignmentStats stats(List<Proposal> accepted, int failed) {
        Map<PriorityTier, Integer> byPriority = new EnumMap<>(PriorityTier.class);
        double total = 0.0;
        for (Proposal proposal : accepted) {
            byPriority.merge(proposal.position.getPriority(), 1, Integer::sum);
            total += proposal.scored.getScore();
        }
        double average = accepted.isEmpty() ? 0.0 : Math.round(total / accepted.size() * 10000.0) / 10000.0;
        return new AssignmentStats(accepted.size(), failed, average, byPriority);
    }

    private String message(AssignmentRequest request, List<Proposal> accepted, int failed) {
        if (request.isSingle() && accepted.size() == 1) {
            return messages.get("batch.message.single", accepted.get(0).recruiter.getName());
        }
        if (failed == 0) {
            return messages.get("batch.message.all", accepted.size());
        }
        return messages.get("batch.message.partial", accepted.size(), failed);
    }

    private Assignment toAssignment(Proposal proposal, String batchId, Instant now) {
        return new Assignment.Builder()
                .id(UUID.randomUUID().toString())
                .positionId(proposal.position.getId())
                .recruiterId(proposal.recruiter.getId())
                .score(proposal.scored.getScore())
                .breakdown(proposal.scored.getFitScore().getBreakdown())
                .explanation(explain(proposal, now))
                .type(AssignmentType.AUTO)
                .status(AssignmentStatus.ASSIGNED)
                .currentStage(Assignment.INITIAL_STAGE)
                .assignedAt(now)
                .reservationBatchId(batchId)
                .build();
    }

    // Positions deep into their SLA window are flagged ahead of the fit explanation
    private String explain(Proposal proposal, Instant now) {
        String explanation = proposal.scored.getFitScore().getExplanation();
        double progress = proposal.position.slaProgress(now);
        if (progress > 1.0) {
            return messages.get("fit.sla.overdue") + " " + explanation;
        }
        if (progress > 0.5) {
            return messages.get("fit.sla.half") + " " + explanation;
        }
        return explanation;
    }

    private static void transition(String batchId, BatchState state) {
        LOG.info(() -> "Batch " + batchId + " -> " + state);
    }

    private static final class Proposal {
        private final Position position;
        private final Recruiter recruiter;
        private final ScoredRecruiter scored;

        private Proposal(Position position, Recruiter recruiter, ScoredRecruiter scored) {
            this.position = position;
            this.recruiter = recruiter;
            this.scored = scored;
        }
    }

    public static final class Builder {
        private RecruiterRepository recruiterRepository;
        private PositionRepository positionRepository;
        private AssignmentRepository assignmentRepository;
        private AuditLogRepository auditLogRepository;
        private RecommendationRanker ranker;
        private CapacityReservationCoordinator coordinator;
        private Messages messages;
        private Clock clock;

        public Builder recruiterRepository(RecruiterRepository recruiterRepository) {
            this.recruiterRepository = recruiterRepository;
            return this;
        }

        public Builder positionRepository(PositionRepository positionRepository) {
            this.positionRepository = positionRepository;
            return this;
        }

        public Builder assignmentRepository(AssignmentRepository assignmentRepository) {
            this.assignmentRepository = assignmentRepository;
            return this;
        }

        public Builder auditLogRepository(AuditLogRepository auditLogRepository) {
            this.auditLogRepository = auditLogRepository;
            return this;
        }

        public Builder ranker(RecommendationRanker ranker) {
            this.ranker = ranker;
            return this;
        }

        public Builder coordinator(CapacityReservationCoordinator coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        public Builder messages(Messages messages) {
            this.messages = messages;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AssignmentOrchestratorImpl build() {
            return new AssignmentOrchestratorImpl(this);
        }
    }
}

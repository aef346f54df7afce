package org.talentia.engine.domain.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.talentia.engine.api.JsonSupport;
import org.talentia.engine.domain.error.ConflictException;
import org.talentia.engine.domain.error.NotFoundException;
import org.talentia.engine.domain.error.PersistenceException;
import org.talentia.engine.domain.error.ValidationException;
import org.talentia.engine.domain.model.AssignmentBatchResult;
import org.talentia.engine.domain.model.AssignmentFilter;
import org.talentia.engine.domain.model.AssignmentRequest;
import org.talentia.engine.domain.model.AssignmentStatus;
import org.talentia.engine.domain.model.AssignmentView;
import org.talentia.engine.domain.model.AuditEntry;
import org.talentia.engine.domain.model.BatchState;
import org.talentia.engine.domain.model.PriorityTier;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.ScoringWeights;
import org.talentia.engine.domain.model.Zone;
import org.talentia.engine.repository.AssignmentRepository;
import org.talentia.engine.repository.PositionRepository;
import org.talentia.engine.repository.RecruiterRepository;
import org.talentia.engine.repository.jdbc.H2Fixture;
import org.talentia.engine.repository.jdbc.JdbcAssignmentRepository;
import org.talentia.engine.repository.jdbc.JdbcAuditLogRepository;
import org.talentia.engine.repository.jdbc.JdbcCapacityReservationCoordinator;
import org.talentia.engine.repository.jdbc.JdbcPositionRepository;
import org.talentia.engine.repository.jdbc.JdbcRecruiterRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;
import static org.talentia.engine.domain.model.SampleData.NOW;
import static org.talentia.engine.domain.model.SampleData.position;
import static org.talentia.engine.domain.model.SampleData.recruiter;

class AssignmentOrchestratorImplTest {

    private H2Fixture db;
    private Messages messages;
    private JdbcRecruiterRepository recruiters;
    private JdbcPositionRepository positions;
    private JdbcAssignmentRepository assignments;
    private JdbcAuditLogRepository auditLog;
    private JdbcCapacityReservationCoordinator coordinator;
    private RecommendationRanker ranker;
    private Clock clock;

    @BeforeEach
    void setUp() {
        db = H2Fixture.create();
        messages = new Messages(Locale.ENGLISH);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        recruiters = new JdbcRecruiterRepository(db.jdbc());
        positions = new JdbcPositionRepository(db.jdbc(), db.tx());
        assignments = new JdbcAssignmentRepository(db.jdbc(), db.tx(), JsonSupport.objectMapper());
        auditLog = new JdbcAuditLogRepository(db.jdbc(), JsonSupport.objectMapper());
        coordinator = new JdbcCapacityReservationCoordinator(db.jdbc(), db.tx(), clock);
        ranker = new RecommendationRankerImpl(new FitScorerImpl(ScoringWeights.defaults(), messages));

        db.insertRecruiter(recruiter("r-a", Zone.LIMA).name("Ana").capacity(2).build());
        db.insertRecruiter(recruiter("r-b", Zone.ICA).name("Bruno").capacity(2).build());
        db.insertPosition(position("p-1", Zone.LIMA, PriorityTier.P1).build());
        db.insertPosition(position("p-2", Zone.ICA, PriorityTier.P2).build());
        db.insertPosition(position("p-3", Zone.LIMA, PriorityTier.P3).build());
    }

    @AfterEach
    void tearDown() {
        assertThat(db.recruitersOverCapacity()).isEmpty();
        db.shutdown();
    }

    @Test
    @DisplayName("assigns every position of a batch and records one audit entry")
    void assignsWholeBatch() {
        AssignmentBatchResult result = orchestrator().assign(
                AssignmentRequest.batch(Arrays.asList("p-3", "p-2", "p-1"), false));

        assertThat(result.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(result.getMessage()).isEqualTo("3 positions assigned");
        assertThat(result.getWarning()).isEmpty();
        assertThat(result.getAssignments())
                .extracting(v -> v.getAssignment().getPositionId())
                .containsExactly("p-1", "p-2", "p-3");
        assertThat(result.getAssignments())
                .extracting(v -> v.getAssignment().getRecruiterId())
                .containsExactly("r-a", "r-b", "r-a");
        assertThat(result.getAssignments())
                .allSatisfy(v -> assertThat(v.getAssignment().getReservationBatchId()).isEqualTo(result.getBatchId()));
        assertThat(result.getStats().getTotalAssigned()).isEqualTo(3);
        assertThat(result.getStats().getTotalFailed()).isZero();
        assertThat(result.getStats().getByPriority())
                .containsEntry(PriorityTier.P1, 1).containsEntry(PriorityTier.P2, 1).containsEntry(PriorityTier.P3, 1);

        assertThat(db.loadOf("r-a")).isEqualTo(2);
        assertThat(db.loadOf("r-b")).isEqualTo(1);
        assertThat(db.statusOf("p-1")).isEqualTo("in_progress");
        assertThat(db.statusOf("p-3")).isEqualTo("in_progress");
        assertThat(db.countRows("assignments")).isEqualTo(3);

        assertThat(db.auditDetails(AuditEntry.ACTION_ASSIGN)).singleElement().satisfies(details ->
                assertThat(details).containsEntry("batch_id", result.getBatchId())
                        .containsEntry("assignments_count", 3)
                        .containsEntry("failed_count", 0)
                        .containsEntry("position_ids", Arrays.asList("p-1", "p-2", "p-3")));
    }

    @Test
    @DisplayName("names the recruiter when a single position is assigned")
    void singlePositionMessage() {
        AssignmentBatchResult result = orchestrator().assign(AssignmentRequest.single("p-1", false));

        assertThat(result.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(result.getMessage()).isEqualTo("Position assigned to Ana");
        assertThat(result.getAssignments()).singleElement().satisfies(v -> {
            assertThat(v.getRecruiterName()).isEqualTo("Ana");
            assertThat(v.getPositionTitle()).isEqualTo("Position p-1");
            assertThat(v.getAssignment().getAssignedAt()).isEqualTo(NOW);
            assertThat(v.getAssignment().getExplanation()).doesNotStartWith("[");
        });
    }

    @Test
    @DisplayName("flags the explanation of positions past half or all of their SLA window")
    void tagsExplanationBySlaProgress() {
        db.jdbc().update("UPDATE recruiters SET capacity = 5");
        db.insertPosition(position("p-late", Zone.LIMA, PriorityTier.P1).openedAt(NOW.minus(Duration.ofDays(4))).build());
        db.insertPosition(position("p-half", Zone.LIMA, PriorityTier.P1).openedAt(NOW.minus(Duration.ofDays(2))).build());

        AssignmentBatchResult result = orchestrator().assign(
                AssignmentRequest.batch(Arrays.asList("p-late", "p-half", "p-1"), false));

        assertThat(result.getAssignments()).extracting(v -> v.getAssignment().getExplanation())
                .satisfiesExactly(
                        late -> assertThat(late).startsWith("[URGENT - SLA overdue] "),
                        half -> assertThat(half).startsWith("[PRIORITY - SLA >50%] "),
                        fresh -> assertThat(fresh).doesNotStartWith("["));
    }

    @Test
    @DisplayName("gives the last free slot to the most urgent position")
    void lastSlotGoesToMostUrgent() {
        db.jdbc().update("UPDATE recruiters SET is_active = FALSE WHERE id = 'r-b'");
        db.jdbc().update("UPDATE recruiters SET current_load = 1 WHERE id = 'r-a'");

        AssignmentBatchResult result = orchestrator().assign(
                AssignmentRequest.batch(Arrays.asList("p-3", "p-1"), false));

        assertThat(result.getState()).isEqualTo(BatchState.PARTIAL_FAILURE);
        assertThat(result.getAssignments()).extracting(v -> v.getAssignment().getPositionId()).containsExactly("p-1");
        assertThat(result.getStats().getTotalFailed()).isEqualTo(1);
        assertThat(result.getWarning()).hasValueSatisfying(w -> assertThat(w).contains("1 position(s) left unassigned"));
        assertThat(db.loadOf("r-a")).isEqualTo(2);
        assertThat(db.statusOf("p-3")).isEqualTo("open");
    }

    @Test
    @DisplayName("keeps the successful part of a batch when a recruiter fills up concurrently")
    void partialFailureWhenReservationRejected() {
        // r-b filled up after the snapshot was read
        db.jdbc().update("UPDATE recruiters SET current_load = 2 WHERE id = 'r-b'");
        RecruiterRepository stale = staleSnapshot(
                recruiter("r-a", Zone.LIMA).name("Ana").capacity(2).build(),
                recruiter("r-b", Zone.ICA).name("Bruno").capacity(2).build());

        AssignmentBatchResult result = orchestrator(stale, positions, assignments)
                .assign(AssignmentRequest.batch(Arrays.asList("p-1", "p-2"), false));

        assertThat(result.getState()).isEqualTo(BatchState.PARTIAL_FAILURE);
        assertThat(result.getMessage())
                .isEqualTo("1 position(s) assigned. 1 not assigned due to recruiter capacity.");
        assertThat(result.getWarning()).hasValueSatisfying(w -> assertThat(w).contains("r-b"));
        assertThat(result.getAssignments()).extracting(v -> v.getAssignment().getRecruiterId()).containsExactly("r-a");
        assertThat(db.loadOf("r-a")).isEqualTo(1);
        assertThat(db.loadOf("r-b")).isEqualTo(2);
        assertThat(db.statusOf("p-2")).isEqualTo("open");
    }

    @Test
    @DisplayName("rejects the batch without side effects when no reservation succeeds")
    void capacityExhausted() {
        db.jdbc().update("UPDATE recruiters SET current_load = 2");
        RecruiterRepository stale = staleSnapshot(
                recruiter("r-a", Zone.LIMA).capacity(2).build(),
                recruiter("r-b", Zone.ICA).capacity(2).build());

        assertThatThrownBy(() -> orchestrator(stale, positions, assignments)
                .assign(AssignmentRequest.batch(Arrays.asList("p-1", "p-2"), false)))
                .isInstanceOf(ConflictException.class)
                .hasMessage(messages.get("error.no_capacity"))
                .satisfies(e -> assertThat(((ConflictException) e).getDetails())
                        .containsKey("failed_recruiter_ids"));

        assertThat(db.loadOf("r-a")).isEqualTo(2);
        assertThat(db.loadOf("r-b")).isEqualTo(2);
        assertThat(db.countRows("assignments")).isZero();
    }

    @Test
    void noEligibleRecruitersWhenEveryoneIsFull() {
        db.jdbc().update("UPDATE recruiters SET current_load = 2");

        assertThatThrownBy(() -> orchestrator().assign(AssignmentRequest.single("p-1", false)))
                .isInstanceOf(ConflictException.class)
                .hasMessage(messages.get("error.no_eligible"));
    }

    @Test
    @DisplayName("refuses to reassign without force and moves the slot with force")
    void reassignment() {
        db.jdbc().update("UPDATE recruiters SET capacity = 1 WHERE id = 'r-a'");
        orchestrator().assign(AssignmentRequest.single("p-1", false));
        assertThat(db.loadOf("r-a")).isEqualTo(1);

        assertThatThrownBy(() -> orchestrator().assign(AssignmentRequest.single("p-1", false)))
                .isInstanceOf(ConflictException.class)
                .satisfies(e -> assertThat(((ConflictException) e).getDetails())
                        .containsEntry("position_id", "p-1")
                        .containsEntry("status", "in_progress"));
        assertThat(db.loadOf("r-a")).isEqualTo(1);
        assertThat(db.loadOf("r-b")).isZero();
        assertThat(db.countRows("assignments")).isEqualTo(1);

        AssignmentBatchResult forced = orchestrator().assign(AssignmentRequest.single("p-1", true));

        assertThat(forced.getAssignments()).singleElement()
                .satisfies(v -> assertThat(v.getAssignment().getRecruiterId()).isEqualTo("r-b"));
        assertThat(db.loadOf("r-a")).isZero();
        assertThat(db.loadOf("r-b")).isEqualTo(1);
        assertThat(db.activeRecruitersOf("p-1")).containsExactly("r-b");
        assertThat(assignments.find(new AssignmentFilter("p-1", null, AssignmentStatus.SUPERSEDED, 1, 10)).getItems())
                .extracting(AssignmentView::getRecruiterName).containsExactly("Ana");
    }

    @Test
    @DisplayName("releases reserved capacity when assignments cannot be stored")
    void rollsBackReservationOnPersistenceFailure() {
        AssignmentRepository failing = mock(AssignmentRepository.class);
        when(failing.insertAll(anyList(), anyBoolean())).thenThrow(new IllegalStateException("disk full"));

        assertThatThrownBy(() -> orchestrator(recruiters, positions, failing)
                .assign(AssignmentRequest.batch(Arrays.asList("p-1", "p-2"), false)))
                .isInstanceOf(PersistenceException.class)
                .hasMessage(messages.get("error.persistence"))
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(db.loadOf("r-a")).isZero();
        assertThat(db.loadOf("r-b")).isZero();
        assertThat(db.statusOf("p-1")).isEqualTo("open");
        Integer unreleased = db.jdbc().queryForObject(
                "SELECT COUNT(*) FROM capacity_reservations WHERE released = FALSE", Integer.class);
        assertThat(unreleased).isZero();
    }

    @Test
    @DisplayName("reports a warning when position status cannot be updated")
    void warnsWhenStatusUpdateFails() {
        PositionRepository flaky = spy(positions);
        doThrow(new IllegalStateException("lock timeout")).when(flaky).markAssigned(anyMap(), any());

        AssignmentBatchResult result = orchestrator(recruiters, flaky, assignments)
                .assign(AssignmentRequest.single("p-2", false));

        assertThat(result.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(result.getWarning()).contains(messages.get("batch.warning.status"));
        assertThat(db.countRows("assignments")).isEqualTo(1);
        assertThat(db.loadOf("r-b")).isEqualTo(1);
        assertThat(db.statusOf("p-2")).isEqualTo("open");
    }

    @Test
    @DisplayName("warns when fewer positions than assigned were moved to in progress")
    void warnsWhenStatusUpdateMissesPositions() {
        PositionRepository partial = spy(positions);
        doReturn(1).when(partial).markAssigned(anyMap(), any());

        AssignmentBatchResult result = orchestrator(recruiters, partial, assignments)
                .assign(AssignmentRequest.batch(Arrays.asList("p-1", "p-2"), false));

        assertThat(result.getAssignments()).hasSize(2);
        assertThat(result.getWarning()).contains(messages.get("batch.warning.status"));
    }

    @Test
    @DisplayName("skips a recruiter whose capacity is zero instead of failing the request")
    void zeroCapacityRecruiterIsSkipped() {
        db.insertRecruiter(recruiter("r-0", Zone.LIMA).name("Cero").capacity(0).build());

        AssignmentBatchResult result = orchestrator().assign(AssignmentRequest.single("p-1", false));

        assertThat(result.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(result.getAssignments()).singleElement()
                .satisfies(v -> assertThat(v.getAssignment().getRecruiterId()).isEqualTo("r-a"));
        assertThat(db.loadOf("r-0")).isZero();
    }

    @Test
    @DisplayName("concurrent requests for one position leave exactly one active assignment")
    void concurrentRequestsForSamePosition() throws Exception {
        db.jdbc().update("UPDATE recruiters SET capacity = 100");
        db.insertRecruiter(recruiter("r-c", Zone.LIMA).name("Carla").capacity(100).build());
        AssignmentOrchestrator orchestrator = orchestrator();
        int rounds = 20;

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < rounds; round++) {
                String positionId = "race-" + round;
                db.insertPosition(position(positionId, Zone.LIMA, PriorityTier.P1).build());
                CountDownLatch start = new CountDownLatch(1);
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        orchestrator.assign(AssignmentRequest.single(positionId, false));
                        return true;
                    } catch (ConflictException e) {
                        return false;
                    }
                };
                Future<Boolean> first = pool.submit(attempt);
                Future<Boolean> second = pool.submit(attempt);
                start.countDown();

                int successes = (first.get(30, TimeUnit.SECONDS) ? 1 : 0) + (second.get(30, TimeUnit.SECONDS) ? 1 : 0);
                assertThat(successes).as("successful requests for %s", positionId).isEqualTo(1);

                List<String> holders = db.activeRecruitersOf(positionId);
                assertThat(holders).as("active assignments of %s", positionId).hasSize(1);
                String holder = db.jdbc().queryForObject(
                        "SELECT recruiter_id FROM positions WHERE id = ?", String.class, positionId);
                assertThat(holder).isEqualTo(holders.get(0));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(db.totalLoad()).isEqualTo(rounds);
        Integer unreleased = db.jdbc().queryForObject(
                "SELECT COALESCE(SUM(amount), 0) FROM capacity_reservations WHERE released = FALSE", Integer.class);
        assertThat(unreleased).isEqualTo(rounds);
    }

    @Test
    void validatesRequestShape() {
        AssignmentOrchestrator orchestrator = orchestrator();

        assertThatThrownBy(() -> orchestrator.assign(new AssignmentRequest(null, null, false)))
                .isInstanceOf(ValidationException.class)
                .hasMessage(messages.get("error.validation.target"));
        assertThatThrownBy(() -> orchestrator.assign(new AssignmentRequest("p-1", Collections.singletonList("p-2"), false)))
                .isInstanceOf(ValidationException.class)
                .hasMessage(messages.get("error.validation.both"));
        assertThatThrownBy(() -> orchestrator.assign(AssignmentRequest.batch(Arrays.asList("p-1", " "), false)))
                .isInstanceOf(ValidationException.class)
                .hasMessage(messages.get("error.validation.blank"));
        assertThatThrownBy(() -> orchestrator.assign(AssignmentRequest.batch(Collections.emptyList(), false)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownPositions() {
        assertThatThrownBy(() -> orchestrator().assign(AssignmentRequest.single("missing", false)))
                .isInstanceOf(NotFoundException.class)
                .hasMessage(messages.get("error.position_not_found"));
        assertThatThrownBy(() -> orchestrator().assign(AssignmentRequest.batch(Arrays.asList("x", "y"), false)))
                .isInstanceOf(NotFoundException.class)
                .hasMessage(messages.get("error.no_positions"));
    }

    @Test
    void noActiveRecruiters() {
        db.jdbc().update("UPDATE recruiters SET is_active = FALSE");

        assertThatThrownBy(() -> orchestrator().assign(AssignmentRequest.single("p-1", false)))
                .isInstanceOf(ConflictException.class)
                .hasMessage(messages.get("error.no_recruiters"));
        assertThat(db.countRows("capacity_reservations")).isZero();
    }

    @Test
    void listsAssignmentsNewestFirst() {
        orchestrator().assign(AssignmentRequest.single("p-1", false));
        orchestrator().assign(AssignmentRequest.single("p-2", false));

        assertThat(orchestrator().listAssignments(AssignmentFilter.all()).getTotal()).isEqualTo(2);
        assertThat(orchestrator().listAssignments(new AssignmentFilter(null, "r-b", null, 1, 10)).getItems())
                .extracting(v -> v.getAssignment().getPositionId()).containsExactly("p-2");
    }

    private AssignmentOrchestrator orchestrator() {
        return orchestrator(recruiters, positions, assignments);
    }

    private AssignmentOrchestrator orchestrator(RecruiterRepository recruiterRepository,
                                                PositionRepository positionRepository,
                                                AssignmentRepository assignmentRepository) {
        return new AssignmentOrchestratorImpl.Builder()
                .recruiterRepository(recruiterRepository)
                .positionRepository(positionRepository)
                .assignmentRepository(assignmentRepository)
                .auditLogRepository(auditLog)
                .ranker(ranker)
                .coordinator(coordinator)
                .messages(messages)
                .clock(clock)
                .build();
    }

    private static RecruiterRepository staleSnapshot(Recruiter... snapshot) {
        RecruiterRepository repository = mock(RecruiterRepository.class);
        when(repository.findEligible()).thenReturn(Arrays.asList(snapshot));
        return repository;
    }
}

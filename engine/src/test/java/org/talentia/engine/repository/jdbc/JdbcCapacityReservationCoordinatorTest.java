package org.talentia.engine.repository.jdbc;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.talentia.engine.domain.model.ReservationResult;
import org.talentia.engine.domain.model.Zone;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.talentia.engine.domain.model.SampleData.NOW;
import static org.talentia.engine.domain.model.SampleData.recruiter;

class JdbcCapacityReservationCoordinatorTest {

    private H2Fixture db;
    private JdbcCapacityReservationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        db = H2Fixture.create();
        coordinator = new JdbcCapacityReservationCoordinator(db.jdbc(), db.tx(), Clock.fixed(NOW, ZoneOffset.UTC));
        db.insertRecruiter(recruiter("r-a", Zone.LIMA).capacity(3).currentLoad(1).build());
        db.insertRecruiter(recruiter("r-b", Zone.LIMA).capacity(2).currentLoad(2).build());
        db.insertRecruiter(recruiter("r-off", Zone.LIMA).capacity(5).active(false).build());
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Nested
    @DisplayName("reserveBatch()")
    class ReserveBatch {

        @Test
        @DisplayName("applies increments that fit and records them under the batch")
        void acceptsWithinCapacity() {
            List<ReservationResult> results = coordinator.reserveBatch("batch-1", Collections.singletonMap("r-a", 2));

            assertThat(results).singleElement().satisfies(r -> {
                assertThat(r.isSuccess()).isTrue();
                assertThat(r.getNewLoad()).isEqualTo(3);
            });
            assertThat(db.loadOf("r-a")).isEqualTo(3);
            assertThat(db.countRows("capacity_reservations")).isEqualTo(1);
        }

        @Test
        @DisplayName("rejects recruiters that would exceed capacity and still accepts the rest")
        void rejectsIndividually() {
            Map<String, Integer> increments = new LinkedHashMap<>();
            increments.put("r-b", 1);
            increments.put("r-a", 1);

            List<ReservationResult> results = coordinator.reserveBatch("batch-1", increments);

            assertThat(results).extracting(ReservationResult::getRecruiterId).containsExactly("r-a", "r-b");
            assertThat(results).extracting(ReservationResult::isSuccess).containsExactly(true, false);
            assertThat(results.get(1).getNewLoad()).isEqualTo(2);
            assertThat(db.loadOf("r-a")).isEqualTo(2);
            assertThat(db.loadOf("r-b")).isEqualTo(2);
            assertThat(db.recruitersOverCapacity()).isEmpty();
        }

        @Test
        @DisplayName("reports unknown recruiters with load -1 and rejects inactive ones")
        void unknownAndInactive() {
            Map<String, Integer> increments = new LinkedHashMap<>();
            increments.put("ghost", 1);
            increments.put("r-off", 1);

            List<ReservationResult> results = coordinator.reserveBatch("batch-1", increments);

            assertThat(results).allSatisfy(r -> assertThat(r.isSuccess()).isFalse());
            assertThat(results.get(0).getNewLoad()).isEqualTo(-1);
            assertThat(db.loadOf("r-off")).isZero();
        }

        @Test
        @DisplayName("falls back to the configured default when a recruiter has no capacity")
        void defaultCapacity() {
            db.jdbc().update("UPDATE recruiters SET capacity = NULL, current_load = 0 WHERE id = 'r-a'");
            JdbcCapacityReservationCoordinator capped = new JdbcCapacityReservationCoordinator(
                    db.jdbc(), db.tx(), Clock.fixed(NOW, ZoneOffset.UTC), 2);

            assertThat(capped.reserveBatch("b1", Collections.singletonMap("r-a", 2)).get(0).isSuccess()).isTrue();
            assertThat(capped.reserveBatch("b2", Collections.singletonMap("r-a", 1)).get(0).isSuccess()).isFalse();
        }

        @Test
        @DisplayName("refuses increments below one")
        void invalidIncrement() {
            assertThatThrownBy(() -> coordinator.reserveBatch("batch-1", Collections.singletonMap("r-a", 0)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(db.loadOf("r-a")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("release() and decrementLoad()")
    class Release {

        @Test
        @DisplayName("gives back every reservation of the batch exactly once")
        void releaseIsIdempotent() {
            coordinator.reserveBatch("batch-1", Collections.singletonMap("r-a", 2));

            List<ReservationResult> first = coordinator.release("batch-1");
            List<ReservationResult> second = coordinator.release("batch-1");

            assertThat(first).singleElement().satisfies(r -> assertThat(r.getNewLoad()).isEqualTo(1));
            assertThat(second).isEmpty();
            assertThat(db.loadOf("r-a")).isEqualTo(1);
        }

        @Test
        @DisplayName("is a no-op for a batch that reserved nothing")
        void releaseUnknownBatch() {
            assertThat(coordinator.release("never-reserved")).isEmpty();
            assertThat(db.loadOf("r-a")).isEqualTo(1);
        }

        @Test
        @DisplayName("gives back part of one recruiter's reservation and leaves the rest for a batch release")
        void partialRelease() {
            coordinator.reserveBatch("batch-1", Collections.singletonMap("r-a", 2));

            assertThat(coordinator.release("batch-1", "r-a", 1)).isEqualTo(1);
            assertThat(db.loadOf("r-a")).isEqualTo(2);
            assertThat(coordinator.release("batch-1", "r-a", 5)).isZero();
            assertThat(db.loadOf("r-a")).isEqualTo(2);

            assertThat(coordinator.release("batch-1")).singleElement()
                    .satisfies(r -> assertThat(r.getIncrement()).isEqualTo(1));
            assertThat(db.loadOf("r-a")).isEqualTo(1);
        }

        @Test
        @DisplayName("marks a reservation released once all of it is given back")
        void partialReleaseOfWholeReservation() {
            coordinator.reserveBatch("batch-1", Collections.singletonMap("r-a", 1));

            assertThat(coordinator.release("batch-1", "r-a", 1)).isEqualTo(1);
            assertThat(coordinator.release("batch-1", "r-a", 1)).isZero();
            assertThat(coordinator.release("batch-1")).isEmpty();
            assertThat(db.loadOf("r-a")).isEqualTo(1);
        }

        @Test
        @DisplayName("clamps plain decrements at zero")
        void decrementClamps() {
            assertThat(coordinator.decrementLoad("r-a", 5)).isZero();
            assertThat(db.loadOf("r-a")).isZero();
            assertThat(coordinator.decrementLoad("ghost", 1)).isZero();
        }
    }

    @Test
    @DisplayName("lets only one of many concurrent batches take the last slot")
    void concurrentBatchesRaceForLastSlot() throws Exception {
        db.insertRecruiter(recruiter("r-last", Zone.LIMA).capacity(5).currentLoad(4).build());
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String batchId = "race-" + i;
                Callable<Boolean> task = () -> {
                    start.await();
                    return coordinator.reserveBatch(batchId, Collections.singletonMap("r-last", 1)).get(0).isSuccess();
                };
                outcomes.add(pool.submit(task));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }

            assertThat(winners).isEqualTo(1);
            assertThat(db.loadOf("r-last")).isEqualTo(5);
            assertThat(db.recruitersOverCapacity()).isEmpty();
        } finally {
            pool.shutdownNow();
        }
    }
}

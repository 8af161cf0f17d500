package com.mesaya.common.idempotency;

import com.mesaya.common.idempotency.backoff.BackoffPolicy;
import com.mesaya.common.idempotency.backoff.FixedBackoffPolicy;
import com.mesaya.common.idempotency.config.IdempotencyProperties;
import com.mesaya.common.idempotency.metrics.IdempotencyMetrics;
import com.mesaya.common.idempotency.support.InMemoryKeyValueStore;
import com.mesaya.common.idempotency.support.MutableClock;
import com.mesaya.common.idempotency.token.TimestampRandomTokenGenerator;
import com.mesaya.common.redis.StoreUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Protocol scenarios against an atomic in-memory store. Each coordinator instance stands in
 * for a separate worker process; they share nothing but the store.
 */
class IdempotencyCoordinatorScenarioTest {

    private static final int WORKERS = 16;

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private IdempotencyCoordinator workerA;
    private IdempotencyCoordinator workerB;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        store = new InMemoryKeyValueStore(clock);
        workerA = worker(new FixedBackoffPolicy(Duration.ofMillis(1)));
        workerB = worker(new FixedBackoffPolicy(Duration.ofMillis(1)));
        pool = Executors.newFixedThreadPool(WORKERS);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void confirmedKeyIsDuplicateForWholeCompletionTtl() {
        CheckResult first = workerA.checkAndLock("order-42");
        assertThat(first.isLockAcquired()).isTrue();
        String tokenA = first.token().orElseThrow();

        workerA.confirm("order-42", tokenA, "res-100");

        assertThat(workerB.checkAndLock("order-42")).isEqualTo(CheckResult.duplicate("res-100"));
        clock.advance(Duration.ofSeconds(86_399));
        assertThat(workerB.checkAndLock("order-42")).isEqualTo(CheckResult.duplicate("res-100"));

        clock.advance(Duration.ofSeconds(1));
        assertThat(workerB.checkAndLock("order-42").isLockAcquired()).isTrue();
    }

    @Test
    void rolledBackKeyIsImmediatelyAcquirableWithFreshToken() {
        CheckResult first = workerA.checkAndLock("order-43");
        String tokenB = first.token().orElseThrow();

        assertThat(workerA.rollback("order-43", tokenB)).isTrue();

        CheckResult again = workerB.checkAndLock("order-43");
        assertThat(again.status()).isEqualTo(CheckStatus.LOCK_ACQUIRED);
        assertThat(again.token()).isPresent().get().isNotEqualTo(tokenB);
        assertThat(workerB.isCompleted("order-43")).isFalse();
    }

    @Test
    void abandonedLockExpiresAfterLockTtl() {
        assertThat(workerA.checkAndLock("order-44").isLockAcquired()).isTrue();

        clock.advance(Duration.ofMillis(4_999));
        assertThat(workerB.checkAndLock("order-44").isContended()).isTrue();

        clock.advance(Duration.ofMillis(1));
        assertThat(workerB.checkAndLock("order-44").isLockAcquired()).isTrue();
    }

    @Test
    void staleTokenCannotReleaseNewerHoldersLock() {
        String tokenA = workerA.checkAndLock("order-45").token().orElseThrow();
        clock.advance(Duration.ofMillis(5_001));
        String tokenB = workerB.checkAndLock("order-45").token().orElseThrow();

        assertThat(workerA.rollback("order-45", tokenA)).isFalse();
        assertThat(store.getIfPresent("lock:order-45")).contains(tokenB);
        assertThat(workerA.checkAndLock("order-45").isContended()).isTrue();

        assertThat(workerB.rollback("order-45", tokenB)).isTrue();
        assertThat(store.getIfPresent("lock:order-45")).isEmpty();
    }

    @Test
    void lateConfirmFromExpiredHolderDoesNotOverwriteResult() {
        String tokenA = workerA.checkAndLock("order-46").token().orElseThrow();
        clock.advance(Duration.ofMillis(5_001));
        String tokenB = workerB.checkAndLock("order-46").token().orElseThrow();
        workerB.confirm("order-46", tokenB, "res-B");

        assertThatThrownBy(() -> workerA.confirm("order-46", tokenA, "res-A"))
                .isInstanceOf(CompletionConflictException.class);
        assertThat(workerA.findCompletion("order-46")).contains("res-B");
    }

    @Test
    void contendedCallerSeesCompletionConfirmedDuringWait() {
        String token = workerA.checkAndLock("order-47").token().orElseThrow();
        BackoffPolicy confirmWhileWaiting = () -> {
            workerA.confirm("order-47", token, "res-47");
            return Duration.ZERO;
        };
        IdempotencyCoordinator waiting = worker(confirmWhileWaiting);

        assertThat(waiting.checkAndLock("order-47")).isEqualTo(CheckResult.duplicate("res-47"));
    }

    @Test
    void failedConfirmKeepsKeyLockedUntilExpiry() {
        String token = workerA.checkAndLock("order-48").token().orElseThrow();

        store.setAvailable(false);
        assertThatThrownBy(() -> workerA.confirm("order-48", token, "res-48"))
                .isInstanceOf(IdempotencyConfirmationFailedException.class)
                .hasCauseInstanceOf(StoreUnavailableException.class);
        store.setAvailable(true);

        assertThat(workerB.checkAndLock("order-48").isContended()).isTrue();
        clock.advance(Duration.ofMillis(5_000));
        assertThat(workerB.checkAndLock("order-48").isLockAcquired()).isTrue();
    }

    @Test
    void exactlyOneConcurrentCallerAcquiresLock() throws Exception {
        for (int round = 0; round < 20; round++) {
            String key = "race-" + round;
            List<CheckResult> results = runConcurrently(() -> worker(new FixedBackoffPolicy(Duration.ofMillis(1))).checkAndLock(key));

            assertThat(results).filteredOn(CheckResult::isLockAcquired).hasSize(1);
            assertThat(results).allMatch(r -> r.isLockAcquired() || r.isContended() || r.isDuplicate());
        }
    }

    @Test
    void allConcurrentCallersSeeDuplicateAfterConfirm() throws Exception {
        String token = workerA.checkAndLock("order-49").token().orElseThrow();
        workerA.confirm("order-49", token, "res-49");

        List<CheckResult> results = runConcurrently(() -> workerB.checkAndLock("order-49"));

        assertThat(results).containsOnly(CheckResult.duplicate("res-49"));
    }

    private List<CheckResult> runConcurrently(Callable<CheckResult> call) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CheckResult>> futures = new ArrayList<>();
        for (int i = 0; i < WORKERS; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return call.call();
            }));
        }
        start.countDown();
        List<CheckResult> results = new ArrayList<>();
        for (Future<CheckResult> f : futures) {
            results.add(f.get(10, TimeUnit.SECONDS));
        }
        return results;
    }

    private IdempotencyCoordinator worker(BackoffPolicy backoffPolicy) {
        return new IdempotencyCoordinator(store, new IdempotencyProperties(),
                new TimestampRandomTokenGenerator(clock), backoffPolicy,
                new IdempotencyMetrics(new SimpleMeterRegistry()));
    }
}

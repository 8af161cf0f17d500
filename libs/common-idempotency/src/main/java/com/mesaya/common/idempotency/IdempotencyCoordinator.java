package com.mesaya.common.idempotency;

import com.mesaya.common.idempotency.backoff.BackoffPolicy;
import com.mesaya.common.idempotency.config.IdempotencyProperties;
import com.mesaya.common.idempotency.metrics.IdempotencyMetrics;
import com.mesaya.common.idempotency.token.LockTokenGenerator;
import com.mesaya.common.redis.KeyValueStore;
import com.mesaya.common.redis.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Check-lock-check protocol for at-most-once processing of an idempotency key across processes.
 * <p>
 * All exclusion goes through single atomic store operations (SET NX PX and a scripted
 * compare-and-delete). No in-process lock is taken, so the same instance may be shared by
 * any number of threads.
 * <p>
 * A caller that receives {@link CheckStatus#LOCK_ACQUIRED} must call {@link #confirm} or
 * {@link #rollback} exactly once, and must finish its side effect well inside the lock TTL.
 * Store failures are never retried here and never turned into "proceed".
 */
public class IdempotencyCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyCoordinator.class);

    private static final int COMPLETION_WRITE_ATTEMPTS = 2;

    private final KeyValueStore store;
    private final IdempotencyKeys keys;
    private final LockTokenGenerator tokenGenerator;
    private final BackoffPolicy backoffPolicy;
    private final IdempotencyMetrics metrics;
    private final Duration completionTtl;
    private final Duration lockTtl;

    public IdempotencyCoordinator(KeyValueStore store,
                                  IdempotencyProperties properties,
                                  LockTokenGenerator tokenGenerator,
                                  BackoffPolicy backoffPolicy,
                                  IdempotencyMetrics metrics) {
        this.store = store;
        this.keys = new IdempotencyKeys(properties.getNamespace());
        this.tokenGenerator = tokenGenerator;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
        this.completionTtl = properties.completionTtl();
        this.lockTtl = properties.lockTtl();
    }

    public CheckResult checkAndLock(String key) {
        requireText(key, "key");
        String completionKey = keys.completion(key);

        Optional<String> done = store.getIfPresent(completionKey);
        if (done.isPresent()) {
            log.debug("Idempotent duplicate (fast path) key={}", key);
            metrics.incDuplicate();
            return CheckResult.duplicate(done.get());
        }

        String lockKey = keys.lock(key);
        String token = tokenGenerator.newToken();
        if (!store.setIfAbsentWithExpiry(lockKey, token, lockTtl)) {
            return awaitContended(key, completionKey);
        }

        // a concurrent holder may have confirmed between the first read and the acquire
        Optional<String> doubleCheck;
        try {
            doubleCheck = store.getIfPresent(completionKey);
        } catch (StoreUnavailableException e) {
            // the caller never sees the token, so free the key now instead of after the TTL
            try {
                store.compareAndDelete(lockKey, token);
            } catch (StoreUnavailableException releaseEx) {
                e.addSuppressed(releaseEx);
            }
            throw e;
        }
        if (doubleCheck.isPresent()) {
            store.compareAndDelete(lockKey, token);
            log.debug("Idempotent duplicate (double check) key={}", key);
            metrics.incDuplicate();
            return CheckResult.duplicate(doubleCheck.get());
        }

        log.debug("Idempotent lock acquired key={} token={}", key, token);
        metrics.incAcquired();
        return CheckResult.lockAcquired(token);
    }

    /**
     * Records {@code resultId} as the completion of {@code key} and releases the caller's lock.
     *
     * @throws IdempotencyConfirmationFailedException if the completion record could not be written;
     *                                                the lock is left to expire
     * @throws CompletionConflictException            if the key already completed with another result
     */
    public void confirm(String key, String token, String resultId) {
        requireText(key, "key");
        requireText(token, "token");
        requireText(resultId, "resultId");

        String recorded;
        try {
            recorded = recordCompletion(key, resultId);
        } catch (StoreUnavailableException e) {
            metrics.incConfirmFailed();
            log.warn("Idempotent confirm failed, lock kept until expiry key={} token={}", key, token, e);
            throw new IdempotencyConfirmationFailedException("Idempotent confirm failed, key=" + key, e);
        }

        releaseAfterCompletion(key, token);
        if (!recorded.equals(resultId)) {
            metrics.incConfirmConflict();
            log.warn("Idempotent confirm conflict key={} existing={} rejected={}", key, recorded, resultId);
            throw new CompletionConflictException(key, recorded, resultId);
        }
        metrics.incConfirmed();
        log.debug("Idempotent confirmed key={} result={}", key, resultId);
    }

    /**
     * Releases the lock without recording completion, so the key can be retried at once.
     *
     * @return false if the lock was no longer held under {@code token}
     */
    public boolean rollback(String key, String token) {
        requireText(key, "key");
        requireText(token, "token");
        boolean released = store.compareAndDelete(keys.lock(key), token);
        if (released) {
            metrics.incRollbackReleased();
            log.debug("Idempotent rollback released key={} token={}", key, token);
        } else {
            metrics.incRollbackNoop();
            log.debug("Idempotent rollback no-op, lock not owned key={} token={}", key, token);
        }
        return released;
    }

    public Optional<String> findCompletion(String key) {
        requireText(key, "key");
        return store.getIfPresent(keys.completion(key));
    }

    public boolean isCompleted(String key) {
        return findCompletion(key).isPresent();
    }

    private CheckResult awaitContended(String key, String completionKey) {
        log.debug("Idempotent lock contended key={}", key);
        for (int attempt = 0; attempt < backoffPolicy.retries(); attempt++) {
            if (!pause(backoffPolicy.onContention())) {
                break;
            }
            Optional<String> done = store.getIfPresent(completionKey);
            if (done.isPresent()) {
                log.debug("Idempotent duplicate (after contention) key={}", key);
                metrics.incDuplicate();
                return CheckResult.duplicate(done.get());
            }
        }
        metrics.incContended();
        return CheckResult.contended();
    }

    /**
     * Writes the completion record once; returns whichever result id the store holds afterwards.
     */
    private String recordCompletion(String key, String resultId) {
        String completionKey = keys.completion(key);
        for (int attempt = 0; attempt < COMPLETION_WRITE_ATTEMPTS; attempt++) {
            if (store.setIfAbsentWithExpiry(completionKey, resultId, completionTtl)) {
                return resultId;
            }
            Optional<String> existing = store.getIfPresent(completionKey);
            if (existing.isPresent()) {
                return existing.get();
            }
            // existing record expired between the two calls
        }
        throw new StoreUnavailableException("Completion record for key=" + key + " could not be settled");
    }

    private void releaseAfterCompletion(String key, String token) {
        try {
            if (!store.compareAndDelete(keys.lock(key), token)) {
                log.debug("Idempotent lock already released or expired key={} token={}", key, token);
            }
        } catch (StoreUnavailableException e) {
            // completion is durable and supersedes the lock, which expires on its own
            log.warn("Idempotent lock release failed after confirm key={} token={}", key, token, e);
        }
    }

    private boolean pause(Duration wait) {
        if (wait.isZero() || wait.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Idempotent contention wait interrupted");
            return false;
        }
    }

    private static void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}

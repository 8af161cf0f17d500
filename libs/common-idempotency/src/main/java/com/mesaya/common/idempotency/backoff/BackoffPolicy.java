package com.mesaya.common.idempotency.backoff;

import java.time.Duration;

/**
 * Decides how long a contended {@code checkAndLock} waits before re-reading the completion record.
 */
public interface BackoffPolicy {

    Duration onContention();

    /**
     * Number of wait-then-recheck rounds after a failed lock attempt.
     */
    default int retries() {
        return 1;
    }
}

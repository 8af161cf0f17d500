package com.mesaya.common.idempotency.backoff;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class FixedBackoffPolicy implements BackoffPolicy {

    private final Duration wait;
    private final long jitterMs;

    public FixedBackoffPolicy(Duration wait) {
        this(wait, Duration.ZERO);
    }

    public FixedBackoffPolicy(Duration wait, Duration jitter) {
        if (wait == null || wait.isNegative()) {
            throw new IllegalArgumentException("wait must be >= 0, got " + wait);
        }
        if (jitter == null || jitter.isNegative()) {
            throw new IllegalArgumentException("jitter must be >= 0, got " + jitter);
        }
        this.wait = wait;
        this.jitterMs = jitter.toMillis();
    }

    @Override
    public Duration onContention() {
        if (jitterMs <= 0) {
            return wait;
        }
        return wait.plusMillis(ThreadLocalRandom.current().nextLong(jitterMs + 1));
    }
}

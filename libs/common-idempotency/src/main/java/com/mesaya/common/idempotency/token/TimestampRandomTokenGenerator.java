package com.mesaya.common.idempotency.token;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Produces {@code <epochMillis>-<base36 random>} tokens.
 * Only compared for equality within one lock lifetime, never used as a credential.
 */
public class TimestampRandomTokenGenerator implements LockTokenGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;

    public TimestampRandomTokenGenerator() {
        this(Clock.systemUTC());
    }

    public TimestampRandomTokenGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String newToken() {
        long suffix = RANDOM.nextLong() & Long.MAX_VALUE;
        return clock.millis() + "-" + Long.toString(suffix, 36);
    }
}

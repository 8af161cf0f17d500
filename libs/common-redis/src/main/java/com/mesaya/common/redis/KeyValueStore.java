package com.mesaya.common.redis;

import java.time.Duration;
import java.util.Optional;

/**
 * Atomic primitives over a shared key-value store.
 * <p>
 * Every operation is a single round-trip that the store executes atomically.
 * Implementations throw {@link StoreUnavailableException} on connectivity loss and never retry.
 */
public interface KeyValueStore {

    Optional<String> getIfPresent(String key);

    /**
     * Write {@code value} only if {@code key} does not exist yet.
     *
     * @return true if this call created the entry
     */
    boolean setIfAbsentWithExpiry(String key, String value, Duration ttl);

    void setWithExpiry(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Delete {@code key} only if its current value equals {@code expectedValue}.
     *
     * @return true if the entry was deleted, false if it was absent or held another value
     */
    boolean compareAndDelete(String key, String expectedValue);
}

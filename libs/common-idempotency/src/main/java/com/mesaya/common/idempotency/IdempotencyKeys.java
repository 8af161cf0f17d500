package com.mesaya.common.idempotency;

import org.springframework.util.StringUtils;

/**
 * Store key layout: {@code [namespace:]completion:<key>} and {@code [namespace:]lock:<key>}.
 */
public final class IdempotencyKeys {

    static final String COMPLETION_PREFIX = "completion:";
    static final String LOCK_PREFIX = "lock:";
    private static final int MAX_NAMESPACE_LENGTH = 200;

    private final String prefix;

    public IdempotencyKeys(String namespace) {
        this.prefix = StringUtils.hasText(namespace) ? sanitize(namespace) + ":" : "";
    }

    public String completion(String key) {
        return prefix + COMPLETION_PREFIX + key;
    }

    public String lock(String key) {
        return prefix + LOCK_PREFIX + key;
    }

    private static String sanitize(String raw) {
        String cleaned = raw.trim().replaceAll("\\s+", "_");
        if (cleaned.length() > MAX_NAMESPACE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_NAMESPACE_LENGTH);
        }
        return cleaned;
    }
}

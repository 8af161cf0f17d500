package com.mesaya.common.idempotency.token;

@FunctionalInterface
public interface LockTokenGenerator {
    String newToken();
}

package com.mesaya.common.idempotency;

public enum CheckStatus {
    /** A completion record exists; the operation already finished. */
    DUPLICATE,
    /** The caller owns the lock and must confirm or roll back. */
    LOCK_ACQUIRED,
    /** Another holder owns the lock and has not confirmed yet. */
    CONTENDED
}

package com.mesaya.common.idempotency;

public enum ContendedAction {
    THROW,
    /** Void methods only. */
    SKIP
}

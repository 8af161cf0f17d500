package com.mesaya.common.idempotency;

public enum DuplicateAction {
    /** Void methods only: return without invoking. */
    SKIP,
    /** String-returning methods only: return the recorded result id without invoking. */
    RETURN_RESULT_ID,
    THROW
}

package com.mesaya.common.idempotency;

/**
 * The completion record could not be written after the side effect succeeded.
 * The lock is left in place and expires on its own.
 */
public class IdempotencyConfirmationFailedException extends RuntimeException {
    public IdempotencyConfirmationFailedException(String message) {
        super(message);
    }

    public IdempotencyConfirmationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mesaya.common.idempotency;

public class IdempotencyCompletedException extends RuntimeException {

    private final String resultId;

    public IdempotencyCompletedException(String message, String resultId) {
        super(message);
        this.resultId = resultId;
    }

    public String getResultId() {
        return resultId;
    }
}

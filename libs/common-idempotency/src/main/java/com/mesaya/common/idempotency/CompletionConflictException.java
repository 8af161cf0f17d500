package com.mesaya.common.idempotency;

public class CompletionConflictException extends RuntimeException {

    private final String key;
    private final String existingResultId;
    private final String rejectedResultId;

    public CompletionConflictException(String key, String existingResultId, String rejectedResultId) {
        super("Idempotent key already completed with a different result, key=" + key
                + " existing=" + existingResultId + " rejected=" + rejectedResultId);
        this.key = key;
        this.existingResultId = existingResultId;
        this.rejectedResultId = rejectedResultId;
    }

    public String getKey() {
        return key;
    }

    public String getExistingResultId() {
        return existingResultId;
    }

    public String getRejectedResultId() {
        return rejectedResultId;
    }
}

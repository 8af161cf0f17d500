package com.mesaya.common.idempotency;

import java.util.Optional;

public record CheckResult(CheckStatus status, Optional<String> resultId, Optional<String> token) {

    public static CheckResult duplicate(String resultId) {
        return new CheckResult(CheckStatus.DUPLICATE, Optional.of(resultId), Optional.empty());
    }

    public static CheckResult lockAcquired(String token) {
        return new CheckResult(CheckStatus.LOCK_ACQUIRED, Optional.empty(), Optional.of(token));
    }

    public static CheckResult contended() {
        return new CheckResult(CheckStatus.CONTENDED, Optional.empty(), Optional.empty());
    }

    public boolean isDuplicate() {
        return status == CheckStatus.DUPLICATE;
    }

    public boolean isLockAcquired() {
        return status == CheckStatus.LOCK_ACQUIRED;
    }

    public boolean isContended() {
        return status == CheckStatus.CONTENDED;
    }
}

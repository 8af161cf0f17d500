package com.mesaya.common.idempotency.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class IdempotencyMetrics {

    private final Counter checkDuplicate;
    private final Counter checkAcquired;
    private final Counter checkContended;
    private final Counter confirmed;
    private final Counter confirmConflict;
    private final Counter confirmFailed;
    private final Counter rollbackReleased;
    private final Counter rollbackNoop;

    public IdempotencyMetrics(MeterRegistry registry) {
        this.checkDuplicate = counter(registry, "idempotency.check", "duplicate");
        this.checkAcquired = counter(registry, "idempotency.check", "acquired");
        this.checkContended = counter(registry, "idempotency.check", "contended");
        this.confirmed = counter(registry, "idempotency.confirm", "confirmed");
        this.confirmConflict = counter(registry, "idempotency.confirm", "conflict");
        this.confirmFailed = counter(registry, "idempotency.confirm", "failed");
        this.rollbackReleased = counter(registry, "idempotency.rollback", "released");
        this.rollbackNoop = counter(registry, "idempotency.rollback", "noop");
    }

    public void incDuplicate() { checkDuplicate.increment(); }
    public void incAcquired() { checkAcquired.increment(); }
    public void incContended() { checkContended.increment(); }
    public void incConfirmed() { confirmed.increment(); }
    public void incConfirmConflict() { confirmConflict.increment(); }
    public void incConfirmFailed() { confirmFailed.increment(); }
    public void incRollbackReleased() { rollbackReleased.increment(); }
    public void incRollbackNoop() { rollbackNoop.increment(); }

    private static Counter counter(MeterRegistry registry, String name, String outcome) {
        return Counter.builder(name).tag("outcome", outcome).register(registry);
    }
}

package com.mesaya.common.idempotency.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "idempotency")
public class IdempotencyProperties {

    @Min(1)
    private long completionTtlSeconds = 86_400L;

    @Min(1)
    private long lockTtlMilliseconds = 5_000L;

    @Min(0)
    private long contentionWaitMilliseconds = 100L;

    @Min(0)
    private long contentionJitterMilliseconds = 0L;

    private String namespace = "";

    public long getCompletionTtlSeconds() {
        return completionTtlSeconds;
    }

    public void setCompletionTtlSeconds(long completionTtlSeconds) {
        this.completionTtlSeconds = completionTtlSeconds;
    }

    public long getLockTtlMilliseconds() {
        return lockTtlMilliseconds;
    }

    public void setLockTtlMilliseconds(long lockTtlMilliseconds) {
        this.lockTtlMilliseconds = lockTtlMilliseconds;
    }

    public long getContentionWaitMilliseconds() {
        return contentionWaitMilliseconds;
    }

    public void setContentionWaitMilliseconds(long contentionWaitMilliseconds) {
        this.contentionWaitMilliseconds = contentionWaitMilliseconds;
    }

    public long getContentionJitterMilliseconds() {
        return contentionJitterMilliseconds;
    }

    public void setContentionJitterMilliseconds(long contentionJitterMilliseconds) {
        this.contentionJitterMilliseconds = contentionJitterMilliseconds;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Duration completionTtl() {
        return Duration.ofSeconds(completionTtlSeconds);
    }

    public Duration lockTtl() {
        return Duration.ofMillis(lockTtlMilliseconds);
    }
}

package com.mesaya.common.idempotency.autoconfigure;

import com.mesaya.common.idempotency.IdempotencyCoordinator;
import com.mesaya.common.idempotency.aop.IdempotentAspect;
import com.mesaya.common.idempotency.aop.SpelKeyResolver;
import com.mesaya.common.idempotency.backoff.BackoffPolicy;
import com.mesaya.common.idempotency.backoff.FixedBackoffPolicy;
import com.mesaya.common.idempotency.config.IdempotencyProperties;
import com.mesaya.common.idempotency.metrics.IdempotencyMetrics;
import com.mesaya.common.idempotency.token.LockTokenGenerator;
import com.mesaya.common.idempotency.token.TimestampRandomTokenGenerator;
import com.mesaya.common.redis.KeyValueStore;
import com.mesaya.common.redis.RedisConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@AutoConfiguration(after = RedisConfig.class)
@EnableConfigurationProperties(IdempotencyProperties.class)
@ConditionalOnBean(KeyValueStore.class)
public class IdempotencyAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LockTokenGenerator lockTokenGenerator() {
        return new TimestampRandomTokenGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy backoffPolicy(IdempotencyProperties properties) {
        return new FixedBackoffPolicy(
                Duration.ofMillis(properties.getContentionWaitMilliseconds()),
                Duration.ofMillis(properties.getContentionJitterMilliseconds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyMetrics idempotencyMetrics(ObjectProvider<MeterRegistry> registry) {
        return new IdempotencyMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyCoordinator idempotencyCoordinator(KeyValueStore store,
                                                         IdempotencyProperties properties,
                                                         LockTokenGenerator lockTokenGenerator,
                                                         BackoffPolicy backoffPolicy,
                                                         IdempotencyMetrics idempotencyMetrics) {
        return new IdempotencyCoordinator(store, properties, lockTokenGenerator, backoffPolicy, idempotencyMetrics);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Aspect.class)
    static class AspectConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public SpelKeyResolver spelKeyResolver() {
            return new SpelKeyResolver();
        }

        @Bean
        @ConditionalOnMissingBean
        public IdempotentAspect idempotentAspect(IdempotencyCoordinator coordinator, SpelKeyResolver keyResolver) {
            return new IdempotentAspect(coordinator, keyResolver);
        }
    }
}

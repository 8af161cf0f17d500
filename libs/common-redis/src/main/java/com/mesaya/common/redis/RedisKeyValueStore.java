package com.mesaya.common.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.function.Supplier;

public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> compareAndDeleteScript;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.compareAndDeleteScript = new DefaultRedisScript<>();
        this.compareAndDeleteScript.setLocation(new ClassPathResource("redis/compare_and_delete.lua"));
        this.compareAndDeleteScript.setResultType(Long.class);
    }

    @Override
    public Optional<String> getIfPresent(String key) {
        return Optional.ofNullable(call("GET", key, () -> redisTemplate.opsForValue().get(key)));
    }

    @Override
    public boolean setIfAbsentWithExpiry(String key, String value, Duration ttl) {
        Duration expiry = requireTtl(ttl);
        Boolean ok = call("SET NX", key, () -> redisTemplate.opsForValue().setIfAbsent(key, value, expiry));
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public void setWithExpiry(String key, String value, Duration ttl) {
        Duration expiry = requireTtl(ttl);
        call("SET", key, () -> {
            redisTemplate.opsForValue().set(key, value, expiry);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        call("DEL", key, () -> redisTemplate.delete(key));
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        Long res = call("CAD", key, () -> redisTemplate.execute(compareAndDeleteScript,
                Collections.singletonList(key), expectedValue));
        return Long.valueOf(1L).equals(res);
    }

    private <T> T call(String op, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.debug("Redis {} failed key={}", op, key, e);
            throw new StoreUnavailableException("Redis " + op + " failed, key=" + key, e);
        }
    }

    private Duration requireTtl(Duration ttl) {
        if (ttl == null || ttl.toMillis() < 1) {
            throw new IllegalArgumentException("ttl must be at least 1ms, got " + ttl);
        }
        return ttl;
    }
}

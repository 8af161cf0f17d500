package com.mesaya.common.idempotency.aop;

import com.mesaya.common.idempotency.CheckResult;
import com.mesaya.common.idempotency.ContendedAction;
import com.mesaya.common.idempotency.DuplicateAction;
import com.mesaya.common.idempotency.Idempotent;
import com.mesaya.common.idempotency.IdempotencyCompletedException;
import com.mesaya.common.idempotency.IdempotencyCoordinator;
import com.mesaya.common.idempotency.IdempotencyInProgressException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;

@Aspect
public class IdempotentAspect {

    private static final Logger log = LoggerFactory.getLogger(IdempotentAspect.class);

    private final IdempotencyCoordinator coordinator;
    private final SpelKeyResolver keyResolver;

    public IdempotentAspect(IdempotencyCoordinator coordinator, SpelKeyResolver keyResolver) {
        this.coordinator = coordinator;
        this.keyResolver = keyResolver;
    }

    @Around("@annotation(com.mesaya.common.idempotency.Idempotent)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        Idempotent anno = method.getAnnotation(Idempotent.class);
        validate(method, anno);

        String key = keyResolver.resolve(method, pjp.getTarget(), pjp.getArgs(), anno.key());
        CheckResult check = coordinator.checkAndLock(key);
        switch (check.status()) {
            case DUPLICATE:
                return onDuplicate(anno, key, check.resultId().orElseThrow());
            case CONTENDED:
                if (anno.onContended() == ContendedAction.SKIP) {
                    log.debug("Idempotent contended, skipping key={}", key);
                    return null;
                }
                throw new IdempotencyInProgressException("Idempotent key processing elsewhere key=" + key);
            default:
                break;
        }

        String token = check.token().orElseThrow();
        Object ret;
        try {
            ret = pjp.proceed();
        } catch (Throwable ex) {
            try {
                coordinator.rollback(key, token);
            } catch (RuntimeException rollbackEx) {
                ex.addSuppressed(rollbackEx);
            }
            throw ex;
        }

        // resolve or confirm failure: keep the lock so nobody re-runs the side effect before it expires
        String resultId = resolveResultId(pjp, method, anno, key, ret);
        coordinator.confirm(key, token, resultId);
        return ret;
    }

    private String resolveResultId(ProceedingJoinPoint pjp, Method method, Idempotent anno, String key, Object ret) {
        if (StringUtils.hasText(anno.result())) {
            return keyResolver.resolve(method, pjp.getTarget(), pjp.getArgs(), anno.result(), ret);
        }
        if (method.getReturnType().equals(Void.TYPE)) {
            return key;
        }
        return keyResolver.resolve(method, pjp.getTarget(), pjp.getArgs(), "#result", ret);
    }

    private Object onDuplicate(Idempotent anno, String key, String resultId) {
        if (anno.onDuplicate() == DuplicateAction.THROW) {
            throw new IdempotencyCompletedException("Idempotent key already done key=" + key, resultId);
        }
        if (anno.onDuplicate() == DuplicateAction.RETURN_RESULT_ID) {
            return resultId;
        }
        log.debug("Idempotent skip DONE key={}", key);
        return null;
    }

    private void validate(Method method, Idempotent anno) {
        boolean isVoid = method.getReturnType().equals(Void.TYPE);
        String methodName = method.getDeclaringClass().getName() + "#" + method.getName();
        if (anno.onDuplicate() == DuplicateAction.RETURN_RESULT_ID && !method.getReturnType().isAssignableFrom(String.class)) {
            throw new IllegalStateException("@Idempotent onDuplicate=RETURN_RESULT_ID requires a String return type, method=" + methodName);
        }
        if (anno.onDuplicate() == DuplicateAction.SKIP && !isVoid) {
            throw new IllegalStateException("@Idempotent onDuplicate=SKIP requires void method, method=" + methodName);
        }
        if (anno.onContended() == ContendedAction.SKIP && !isVoid) {
            throw new IllegalStateException("@Idempotent onContended=SKIP requires void method, method=" + methodName);
        }
        if (isVoid && anno.result().contains("#result")) {
            throw new IllegalStateException("@Idempotent void method cannot derive result from #result, method=" + methodName);
        }
    }
}

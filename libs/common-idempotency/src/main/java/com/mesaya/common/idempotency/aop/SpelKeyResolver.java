package com.mesaya.common.idempotency.aop;

import com.mesaya.common.idempotency.IdempotencyKeyResolveException;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.util.ConcurrentReferenceHashMap;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.Map;

public class SpelKeyResolver {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentReferenceHashMap<>();
    private final ParameterNameDiscoverer paramDiscoverer = new DefaultParameterNameDiscoverer();

    public String resolve(Method method, Object target, Object[] args, String expr) {
        return resolve(method, target, args, expr, null);
    }

    /**
     * @return the non-blank string value of {@code expr}
     * @throws IdempotencyKeyResolveException if the expression is empty, fails, or yields a blank value
     */
    public String resolve(Method method, Object target, Object[] args, String expr, Object result) {
        if (!StringUtils.hasText(expr)) {
            throw new IdempotencyKeyResolveException("Expression is empty, method=" + method.getName());
        }
        Object val;
        try {
            Expression expression = cache.computeIfAbsent(method.toGenericString() + "#" + expr,
                    k -> parser.parseExpression(expr));
            MethodBasedEvaluationContext context = new MethodBasedEvaluationContext(target, method, args, paramDiscoverer);
            context.setVariable("result", result);
            val = expression.getValue(context);
        } catch (Exception e) {
            throw new IdempotencyKeyResolveException("Failed to evaluate expression: " + expr, e);
        }
        if (val == null || !StringUtils.hasText(val.toString())) {
            throw new IdempotencyKeyResolveException("Expression resolved to a blank value: " + expr);
        }
        return val.toString();
    }
}

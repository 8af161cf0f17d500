package com.mesaya.common.idempotency;

import java.lang.annotation.*;

/**
 * Runs the annotated method at most once per idempotency key.
 * <p>
 * {@code key} and {@code result} are SpEL expressions over the method arguments
 * ({@code #name}, {@code #p0}, {@code #a0}); {@code result} may also use {@code #result}.
 * An empty {@code result} records the return value, or the key itself for void methods.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Idempotent {
    String key();
    String result() default "";
    DuplicateAction onDuplicate() default DuplicateAction.SKIP;
    ContendedAction onContended() default ContendedAction.THROW;
}

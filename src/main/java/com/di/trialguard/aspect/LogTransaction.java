package com.di.trialguard.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a governance operation for automatic transaction event logging.
 *
 * <p>{@link TransactionEventAspect} logs {@code <eventType>_STARTED} before the call,
 * {@code <eventType>_COMPLETED} after it returns and {@code <eventType>_FAILED} when it throws,
 * with the selected parameters, the duration and, on failure, the {@link ErrorCategory}.
 *
 * <pre>
 * {@code
 * @LogTransaction(eventType = "QUALITY_VALIDATION", transactionContext = "quality_validation",
 *                 parameterNames = {"domain", "source"})
 * public QualityReport validate(String domain, String source, Dataset dataset) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /** Event type prefix, e.g. {@code CONTRACT_VALIDATION}. */
    String eventType();

    String transactionContext() default "";

    /**
     * Names given, in order, to the leading method parameters included in the event context.
     * Empty includes every parameter; collections and maps are reduced to their size.
     */
    String[] parameterNames() default {};

    /** Whether to add the result type to the completed event. */
    boolean includeResult() default false;

    /** MDC key holding the transaction id; falls back to {@code requestId}. */
    String transactionIdKey() default "transactionId";
}

package com.di.trialguard.aspect;

import com.di.trialguard.util.TransactionEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Logs STARTED / COMPLETED / FAILED transaction events around methods annotated with {@link LogTransaction}.
 *
 * <p>The transaction id is read from MDC (the annotation's key, then {@code requestId}). Large arguments such
 * as datasets and collections are summarised instead of printed. Exceptions are categorised with
 * {@link ErrorCategory} and always rethrown.
 */
@Slf4j
@Aspect
@Component
public class TransactionEventAspect {

    private final String applicationId;
    private final TransactionEventLogger eventLogger;

    public TransactionEventAspect(TransactionEventLogger eventLogger,
                                  @Value("${spring.application.name:trialguard}") String applicationName) {
        this.eventLogger = eventLogger;
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[TX] TransactionEventAspect initialized with applicationId: {}", applicationId);
    }

    @Around("@annotation(com.di.trialguard.aspect.LogTransaction)")
    public Object logTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogTransaction annotation = method.getAnnotation(LogTransaction.class);

        String eventType = annotation.eventType();
        String transactionContext = annotation.transactionContext();
        long startTime = System.currentTimeMillis();

        String transactionId = MDC.get(annotation.transactionIdKey());
        if (transactionId == null) {
            transactionId = MDC.get("requestId");
        }
        Thread currentThread = Thread.currentThread();
        Map<String, Object> context = extractContext(joinPoint, method, annotation);

        eventLogger.logEvent(eventType + "_STARTED", context, transactionId, currentThread,
                transactionContext, applicationId);

        try {
            Object result = joinPoint.proceed();
            long durationMs = System.currentTimeMillis() - startTime;
            if (result != null && annotation.includeResult()) {
                context.put("resultType", result.getClass().getSimpleName());
            }
            context.put("durationMs", durationMs);
            eventLogger.logEvent(eventType + "_COMPLETED", context, transactionId, currentThread,
                    transactionContext, applicationId);
            return result;
        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ErrorCategory errorCategory = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", errorCategory.name());
            context.put("errorCategoryName", errorCategory.getName());
            context.put("durationMs", durationMs);

            Throwable rootCause = getRootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
            }
            eventLogger.logEvent(eventType + "_FAILED", context, transactionId, currentThread,
                    transactionContext, applicationId, e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(ProceedingJoinPoint joinPoint, Method method, LogTransaction annotation) {
        Map<String, Object> context = new HashMap<>();
        Object[] args = joinPoint.getArgs();
        String[] parameterNames = annotation.parameterNames();

        if (parameterNames.length > 0) {
            for (int i = 0; i < Math.min(args.length, parameterNames.length); i++) {
                if (parameterNames[i] != null && !parameterNames[i].isEmpty()) {
                    context.put(parameterNames[i], summarize(args[i]));
                }
            }
        } else {
            Parameter[] parameters = method.getParameters();
            for (int i = 0; i < parameters.length && i < args.length; i++) {
                context.put(parameters[i].getName(), summarize(args[i]));
            }
        }
        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());
        return context;
    }

    /**
     * Keeps event lines bounded: collections and maps are reduced to their size.
     */
    private static Object summarize(Object value) {
        if (value == null || value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof Enum<?>) {
            return value;
        }
        if (value instanceof Collection<?> collection) {
            return "size=" + collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return "entries=" + map.size();
        }
        return String.valueOf(value);
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }
}

package com.di.trialguard.aspect;

import com.di.trialguard.contract.MalformedContractException;
import com.di.trialguard.exception.UnknownDomainException;
import com.di.trialguard.lineage.LineageTrackerStateException;
import com.di.trialguard.quality.DuplicateRuleException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for transaction event logging and error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 * Governance-specific matchers come first because their exceptions extend the generic
 * {@link IllegalArgumentException} / {@link IllegalStateException} types.
 */
public enum ErrorCategory {

    DOMAIN_ERROR("Unknown domain", "No rule set or contract is registered for the requested domain"),
    CONTRACT_DEFINITION_ERROR("Malformed contract", "Data contract definition is invalid"),
    RULE_DEFINITION_ERROR("Rule definition error", "Rule set definition is invalid"),
    LINEAGE_STATE_ERROR("Lineage tracker state error", "Lineage tracker used after it was finalized"),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure"),
    STORAGE_ERROR("Storage error", "Reading or writing persisted governance artifacts failed"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof UnknownDomainException, DOMAIN_ERROR);
        MATCHERS.put(t -> t instanceof MalformedContractException, CONTRACT_DEFINITION_ERROR);
        MATCHERS.put(t -> t instanceof DuplicateRuleException, RULE_DEFINITION_ERROR);
        MATCHERS.put(t -> t instanceof LineageTrackerStateException, LINEAGE_STATE_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isStorageError, STORAGE_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException
                || (t instanceof java.io.UncheckedIOException
                        && t.getCause() instanceof com.fasterxml.jackson.core.JsonProcessingException);
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase(Locale.ROOT).contains("timeout"));
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || t instanceof java.nio.file.FileSystemException
                || (t instanceof java.io.IOException && messageContains(t, "no space"));
    }

    private static boolean isStorageError(Throwable t) {
        return t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.beans.factory.BeanDefinitionStoreException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) {
            return false;
        }
        String lower = msg.toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (lower.contains(k)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}

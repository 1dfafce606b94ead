package com.di.trialguard.exception;

import com.di.trialguard.aspect.ErrorCategory;
import com.di.trialguard.config.MdcRequestFilter;
import com.di.trialguard.contract.MalformedContractException;
import com.di.trialguard.util.TransactionEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps exceptions escaping the controllers to {@link ErrorResponse} bodies and logs each one as a
 * structured {@code [TX]} event categorized by {@link ErrorCategory}.
 *
 * <p>Data-quality findings never reach this class: failing rules and contract violations are part of
 * the normal 200 response.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private final TransactionEventLogger eventLogger;
    private final String applicationId;

    public GlobalExceptionHandler(TransactionEventLogger eventLogger,
                                  @Value("${spring.application.name:trialguard}") String applicationId) {
        this.eventLogger = eventLogger;
        this.applicationId = applicationId;
    }

    /** Unknown rule-set or contract domain. */
    @ExceptionHandler(UnknownDomainException.class)
    public ResponseEntity<ErrorResponse> handleUnknownDomain(UnknownDomainException e) {
        ErrorResponse body = handle("UNKNOWN_DOMAIN", e, HttpStatus.NOT_FOUND);
        body.addDetail("domain", e.getDomain());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(MalformedContractException.class)
    public ResponseEntity<ErrorResponse> handleMalformedContract(MalformedContractException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(handle("MALFORMED_CONTRACT", e, HttpStatus.UNPROCESSABLE_ENTITY));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ErrorResponse body = handle("INVALID_REQUEST", e, HttpStatus.BAD_REQUEST);
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.put(error.getField(), error.getDefaultMessage());
        }
        body.setMessage("Request body failed validation");
        body.addDetail("fieldErrors", fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(handle("INVALID_REQUEST", e, HttpStatus.BAD_REQUEST));
    }

    /**
     * Invalid arguments and state: negative depth, duplicate lineage event id, both promotion checks
     * switched off, finalized tracker.
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(handle("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST));
    }

    /** Lineage file store could not be read or written. */
    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(UncheckedIOException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(handle("STORAGE_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(handle("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private ErrorResponse handle(String eventType, Throwable exception, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        logError(eventType, category, exception, status);
        return buildErrorResponse(category, exception, status);
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception, HttpStatus status) {
        String transactionId = MDC.get(MdcRequestFilter.REQUEST_ID);
        if (transactionId == null) {
            transactionId = "global-handler-" + UUID.randomUUID().toString().substring(0, 8);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("errorMessage", messageOf(exception));
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("httpStatus", status.value());
        context.put("path", getRequestPath());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            context.put("rootCauseType", rootCause.getClass().getSimpleName());
            context.put("rootCauseMessage", rootCause.getMessage());
        }

        eventLogger.logEvent(eventType, context, transactionId, Thread.currentThread(),
                "global_exception_handler", applicationId, exception);

        if (status.is5xxServerError()) {
            log.error("GlobalExceptionHandler caught exception: {} [{}]",
                    exception.getClass().getSimpleName(), category.getName(), exception);
        } else {
            log.warn("Request rejected with {}: {} [{}]", status.value(), messageOf(exception), category.getName());
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(messageOf(exception));
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static String messageOf(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String getRequestPath() {
        String path = MDC.get(MdcRequestFilter.REQUEST_PATH);
        return path != null ? path : "/unknown";
    }
}

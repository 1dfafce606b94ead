package com.di.trialguard.aspect;

import com.di.trialguard.util.TransactionEventLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransactionEventAspect Tests")
class TransactionEventAspectTest {

    private record Captured(String eventType, Map<String, Object> context, String transactionId,
                            String transactionContext, Throwable exception) {
    }

    /** Records events instead of writing them. */
    private static class CapturingEventLogger extends TransactionEventLogger {
        final List<Captured> events = new ArrayList<>();

        @Override
        public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                             Thread thread, String transactionContext, String applicationId, Throwable exception) {
            events.add(new Captured(eventType, new HashMap<>(context), transactionId, transactionContext, exception));
        }
    }

    static class AuditedOperations {

        @LogTransaction(eventType = "LINEAGE_QUERY", transactionContext = "lineage_query",
                parameterNames = {"location", "depth"}, includeResult = true)
        public List<String> query(String location, Integer depth, List<String> seed) {
            return List.of(location);
        }

        @LogTransaction(eventType = "CONTRACT_VALIDATION")
        public void validate(String domain) {
            throw new IllegalArgumentException("Unknown contract domain: " + domain,
                    new IllegalStateException("root"));
        }
    }

    private CapturingEventLogger eventLogger;
    private AuditedOperations proxy;

    @BeforeEach
    void setUp() {
        eventLogger = new CapturingEventLogger();
        AspectJProxyFactory factory = new AspectJProxyFactory(new AuditedOperations());
        factory.setProxyTargetClass(true);
        factory.addAspect(new TransactionEventAspect(eventLogger, "trialguard"));
        proxy = factory.getProxy();
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should log STARTED and COMPLETED with the named parameters")
    void testCompleted() {
        MDC.put("requestId", "req-1234");

        assertEquals(List.of("s3://b/gold/dm"), proxy.query("s3://b/gold/dm", 2, List.of("a", "b")));

        assertEquals(2, eventLogger.events.size());
        Captured started = eventLogger.events.get(0);
        Captured completed = eventLogger.events.get(1);
        assertEquals("LINEAGE_QUERY_STARTED", started.eventType());
        assertEquals("LINEAGE_QUERY_COMPLETED", completed.eventType());
        assertEquals("req-1234", completed.transactionId());
        assertEquals("lineage_query", completed.transactionContext());
        assertEquals("s3://b/gold/dm", completed.context().get("location"));
        assertEquals(2, completed.context().get("depth"));
        assertFalse(completed.context().containsKey("seed"));
        assertEquals(List.of("x").getClass().getSimpleName(), completed.context().get("resultType"));
        assertTrue(completed.context().containsKey("durationMs"));
        assertNull(completed.exception());
    }

    @Test
    @DisplayName("Should prefer the transactionId MDC key over the request id")
    void testTransactionIdKey() {
        MDC.put("requestId", "req-1234");
        MDC.put("transactionId", "tx-42");

        proxy.query("loc", null, List.of());

        assertEquals("tx-42", eventLogger.events.get(0).transactionId());
    }

    @Test
    @DisplayName("Should log FAILED with the error category and rethrow")
    void testFailed() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> proxy.validate("XX"));

        Captured failed = eventLogger.events.get(1);
        assertEquals("CONTRACT_VALIDATION_FAILED", failed.eventType());
        assertSame(thrown, failed.exception());
        assertEquals("VALIDATION_ERROR", failed.context().get("errorCategory"));
        assertEquals("IllegalArgumentException", failed.context().get("errorType"));
        assertEquals("IllegalStateException", failed.context().get("rootCauseType"));
        assertEquals("validate", failed.context().get("method"));
        assertNull(failed.transactionId());
    }
}

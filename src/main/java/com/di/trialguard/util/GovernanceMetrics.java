package com.di.trialguard.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the governance operations: quality runs by status, contract evaluations by
 * action, lineage events by type, lineage query latency by direction and promotion decisions.
 */
@Slf4j
@Component
public class GovernanceMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter ruleErrorCounter;
    private final Counter breakingChangeCounter;

    public GovernanceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.ruleErrorCounter = Counter.builder("trialguard.quality.rule.errors")
                .description("Rules that raised while being evaluated and were recorded as failed")
                .register(meterRegistry);

        this.breakingChangeCounter = Counter.builder("trialguard.contract.breaking.changes")
                .description("Breaking schema changes detected against data contracts")
                .register(meterRegistry);
    }

    // ============================================================================
    // Quality
    // ============================================================================

    public void recordQualityValidation(String domain, String status, long ruleErrors) {
        Counter.builder("trialguard.quality.validations")
                .description("Quality validation runs")
                .tag("domain", domain)
                .tag("status", status)
                .register(meterRegistry)
                .increment();
        if (ruleErrors > 0) {
            ruleErrorCounter.increment(ruleErrors);
        }
        log.debug("Recorded quality validation: domain={}, status={}, ruleErrors={}", domain, status, ruleErrors);
    }

    // ============================================================================
    // Contracts
    // ============================================================================

    public void recordContractValidation(String domain, String action, long breakingChanges) {
        Counter.builder("trialguard.contract.validations")
                .description("Contract validation runs")
                .tag("domain", domain)
                .tag("action", action)
                .register(meterRegistry)
                .increment();
        if (breakingChanges > 0) {
            breakingChangeCounter.increment(breakingChanges);
        }
        log.debug("Recorded contract validation: domain={}, action={}, breaking={}", domain, action, breakingChanges);
    }

    // ============================================================================
    // Lineage
    // ============================================================================

    public void recordLineageEvent(String eventType) {
        Counter.builder("trialguard.lineage.events.recorded")
                .description("Lineage events stored")
                .tag("event_type", eventType)
                .register(meterRegistry)
                .increment();
    }

    public void recordLineageQuery(String direction, Duration duration) {
        Timer.builder("trialguard.lineage.query.duration")
                .description("Upstream/downstream lineage traversal time")
                .tag("direction", direction)
                .register(meterRegistry)
                .record(duration);
    }

    // ============================================================================
    // Promotion
    // ============================================================================

    public void recordPromotionDecision(String domain, String decision) {
        Counter.builder("trialguard.promotion.decisions")
                .description("Promotion gate decisions")
                .tag("domain", domain)
                .tag("decision", decision)
                .register(meterRegistry)
                .increment();
    }
}

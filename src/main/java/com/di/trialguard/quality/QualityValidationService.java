package com.di.trialguard.quality;

import com.di.trialguard.aspect.LogTransaction;
import com.di.trialguard.dataset.Dataset;
import com.di.trialguard.util.GovernanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

/**
 * Runs the pre-built rule set of a domain against a dataset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityValidationService {

    private final RuleSetRegistry ruleSetRegistry;
    private final QualityProperties properties;
    private final GovernanceMetrics metrics;
    private final Clock clock;

    public Set<String> getDomains() {
        return ruleSetRegistry.getDomains();
    }

    public RuleSet getRuleSet(String domain) {
        return ruleSetRegistry.getRuleSet(domain);
    }

    /**
     * @param idColumn column identifying failing records; {@code null} or blank uses the configured default
     * @throws com.di.trialguard.exception.UnknownDomainException if the domain has no rule set
     */
    @LogTransaction(eventType = "QUALITY_VALIDATION", transactionContext = "quality_validation",
            parameterNames = {"domain", "source", "dataset", "idColumn"})
    public QualityReport validate(String domain, String source, Dataset dataset, String idColumn,
                                  Map<String, String> metadata) {
        RuleSet ruleSet = ruleSetRegistry.getRuleSet(domain);
        String effectiveIdColumn = idColumn != null && !idColumn.isBlank() ? idColumn : properties.getDefaultIdColumn();
        ValidationEngine engine = new ValidationEngine(ruleSet, properties.getMaxFailedRecordIds(), clock);

        QualityReport report = engine.validate(dataset, effectiveIdColumn, source,
                metadata != null ? metadata : Map.of());

        long ruleErrors = report.results().stream()
                .filter(r -> r.details().containsKey("error"))
                .count();
        metrics.recordQualityValidation(ruleSet.getDomain(), report.status().getTag(), ruleErrors);
        return report;
    }
}

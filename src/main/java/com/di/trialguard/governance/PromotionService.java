package com.di.trialguard.governance;

import com.di.trialguard.aspect.LogTransaction;
import com.di.trialguard.contract.ContractValidationResult;
import com.di.trialguard.contract.ContractValidationService;
import com.di.trialguard.dataset.Dataset;
import com.di.trialguard.lineage.DataAsset;
import com.di.trialguard.lineage.LineageEvent;
import com.di.trialguard.lineage.LineageEventType;
import com.di.trialguard.lineage.LineageService;
import com.di.trialguard.lineage.LineageTracker;
import com.di.trialguard.quality.QualityReport;
import com.di.trialguard.quality.QualityValidationService;
import com.di.trialguard.util.GovernanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Promotion gate between pipeline layers. Runs the domain's quality rules and/or its data contract,
 * derives a {@link PromotionDecision} and records the step as a lineage event: a PROMOTION into the
 * target location, or a VALIDATION into the quarantine location when the data is withheld.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionService {

    private final QualityValidationService qualityValidationService;
    private final ContractValidationService contractValidationService;
    private final LineageService lineageService;
    private final GovernanceProperties properties;
    private final GovernanceMetrics metrics;
    private final Clock clock;

    @LogTransaction(eventType = "PROMOTION", transactionContext = "promotion_gate",
            parameterNames = {"request"})
    public PromotionResult promote(PromotionRequest request) {
        if (!request.qualityEnabled() && !request.contractEnabled()) {
            throw new IllegalArgumentException("At least one of run_quality and run_contract must be enabled");
        }
        Dataset dataset = request.dataset().toDataset();

        QualityReport report = request.qualityEnabled()
                ? qualityValidationService.validate(request.domain(), request.sourceLocation(), dataset,
                        request.idColumn(), request.metadata())
                : null;
        ContractValidationResult contractResult = request.contractEnabled()
                ? contractValidationService.validate(request.domain(), dataset)
                : null;

        String domain = report != null ? report.domain() : contractResult.contractDomain();
        PromotionDecision decision = PromotionDecision.derive(
                report != null ? report.status() : null,
                contractResult != null ? contractResult.action() : null);
        String outputLocation = decision.isPromoted()
                ? request.targetLocation()
                : properties.getQuarantinePrefix() + request.targetLocation();

        LineageEvent event = lineageService.record(
                buildEvent(request, domain, dataset, decision, outputLocation, report, contractResult));
        metrics.recordPromotionDecision(domain, decision.getTag());

        if (decision.isPromoted()) {
            log.info("[GOVERNANCE] {} {} -> {} ({} records, decision={})", domain,
                    request.sourceLocation(), outputLocation, dataset.size(), decision.getTag());
        } else {
            log.warn("[GOVERNANCE] {} {} quarantined at {} (quality={}, contract={})", domain,
                    request.sourceLocation(), outputLocation,
                    report != null ? report.status().getTag() : "skipped",
                    contractResult != null ? contractResult.action().getTag() : "skipped");
        }

        return PromotionResult.builder()
                .domain(domain)
                .decision(decision)
                .outputLocation(outputLocation)
                .qualityReport(report)
                .contractResult(contractResult)
                .lineageEvent(event)
                .build();
    }

    private LineageEvent buildEvent(PromotionRequest request, String domain, Dataset dataset,
                                    PromotionDecision decision, String outputLocation, QualityReport report,
                                    ContractValidationResult contractResult) {
        LineageEventType type = decision.isPromoted() ? LineageEventType.PROMOTION : LineageEventType.VALIDATION;
        LineageTracker tracker = new LineageTracker(properties.getTriggeredBy(), type, clock);

        long records = dataset.size();
        tracker.addInput(DataAsset.fromLocation(request.sourceLocation(), request.sourceLayer(), records));
        tracker.addOutput(DataAsset.fromLocation(outputLocation, request.targetLayer(), records).toBuilder()
                .schemaHash(contractResult != null ? contractResult.schemaHash() : null)
                .build());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("domain", domain);
        if (report != null) {
            parameters.put("quality_status", report.status().getTag());
        }
        if (contractResult != null) {
            parameters.put("contract", contractResult.contractName() + "@" + contractResult.contractVersion());
            parameters.put("contract_action", contractResult.action().getTag());
        }
        tracker.setTransformation("Promotion gate: " + decision.getTag(), parameters);

        long rejected = switch (decision) {
            case QUARANTINE -> records;
            case PROMOTE, PROMOTE_WITH_ALERT -> contractResult != null ? contractResult.failedRecords() : 0;
        };
        tracker.setValidationStatus(decision.getTag(), rejected);
        if (request.executionId() != null) {
            tracker.setExecutionId(request.executionId());
        }
        return tracker.buildEvent();
    }
}

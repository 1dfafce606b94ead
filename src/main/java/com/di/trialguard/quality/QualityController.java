package com.di.trialguard.quality;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for rule-based quality validation.
 */
@RestController
@RequestMapping("/api/quality")
@RequiredArgsConstructor
public class QualityController {

    private final QualityValidationService qualityValidationService;

    /**
     * Registered domains with their rules, sorted by domain.
     */
    @GetMapping(value = "/domains", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<RuleSetDescriptor>> domains() {
        List<RuleSetDescriptor> descriptors = qualityValidationService.getDomains().stream()
                .sorted()
                .map(qualityValidationService::getRuleSet)
                .map(RuleSetDescriptor::of)
                .toList();
        return ResponseEntity.ok(descriptors);
    }

    /**
     * Validates the dataset in the body against the domain's rule set. Always 200 with the report when the
     * domain exists, whatever the verdict; 404 for an unknown domain.
     */
    @PostMapping(value = "/{domain}/validate",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QualityReport> validate(@PathVariable String domain,
                                                  @Valid @RequestBody QualityValidationRequest request) {
        QualityReport report = qualityValidationService.validate(domain,
                request.source() != null ? request.source() : "api",
                request.dataset().toDataset(), request.idColumn(), request.metadata());
        return ResponseEntity.ok(report);
    }
}

package com.di.trialguard.contract;

import com.di.trialguard.dataset.DatasetPayload;
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
 * REST API for data contracts: listing, schema drift detection and full evaluation.
 */
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
public class ContractController {

    private final ContractValidationService contractValidationService;

    /** Every registered contract version. */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<DataContract>> contracts() {
        return ResponseEntity.ok(contractValidationService.getContracts());
    }

    /** Latest contract version of a domain. */
    @GetMapping(value = "/{domain}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DataContract> contract(@PathVariable String domain) {
        return ResponseEntity.ok(contractValidationService.getContract(domain));
    }

    @PostMapping(value = "/{domain}/validate",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ContractValidationResult> validate(@PathVariable String domain,
                                                             @RequestBody DatasetPayload dataset) {
        return ResponseEntity.ok(contractValidationService.validate(domain, dataset.toDataset()));
    }

    @PostMapping(value = "/{domain}/schema-changes",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<SchemaChange>> schemaChanges(@PathVariable String domain,
                                                            @RequestBody DatasetPayload dataset) {
        return ResponseEntity.ok(contractValidationService.detectSchemaChanges(domain, dataset.toDataset()));
    }
}

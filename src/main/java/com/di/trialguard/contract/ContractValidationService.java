package com.di.trialguard.contract;

import com.di.trialguard.aspect.LogTransaction;
import com.di.trialguard.dataset.Dataset;
import com.di.trialguard.util.GovernanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Evaluates datasets against the latest registered contract of a domain.
 */
@Slf4j
@Service
public class ContractValidationService {

    private final ContractRegistry contractRegistry;
    private final ContractEngine contractEngine;
    private final GovernanceMetrics metrics;

    public ContractValidationService(ContractRegistry contractRegistry, ContractProperties properties,
                                     GovernanceMetrics metrics, Clock clock) {
        this.contractRegistry = contractRegistry;
        this.contractEngine = new ContractEngine(properties.getQuarantineThreshold(), clock);
        this.metrics = metrics;
    }

    public List<DataContract> getContracts() {
        return contractRegistry.getAll();
    }

    public DataContract getContract(String domain) {
        return contractRegistry.getLatest(domain);
    }

    /**
     * @throws com.di.trialguard.exception.UnknownDomainException if no contract is registered for the domain
     */
    @LogTransaction(eventType = "CONTRACT_VALIDATION", transactionContext = "contract_validation",
            parameterNames = {"domain", "dataset"})
    public ContractValidationResult validate(String domain, Dataset dataset) {
        DataContract contract = contractRegistry.getLatest(domain);
        ContractValidationResult result = contractEngine.validateAgainstContract(dataset, contract);
        long breaking = result.schemaChanges().stream().filter(SchemaChange::breaking).count();
        metrics.recordContractValidation(contract.domain(), result.action().getTag(), breaking);
        return result;
    }

    public List<SchemaChange> detectSchemaChanges(String domain, Dataset dataset) {
        return contractEngine.detectSchemaChanges(dataset, contractRegistry.getLatest(domain));
    }
}

package com.di.trialguard.contract;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binding for contract loading and the quarantine policy.
 *
 * <pre>
 * trialguard:
 *   contracts:
 *     locations: classpath*:contracts/*.yml
 *     quarantine-threshold: 0.05
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "trialguard.contracts")
public class ContractProperties {

    /** Resource patterns of YAML contract definitions, loaded at start-up. */
    private List<String> locations = new ArrayList<>(List.of("classpath*:contracts/*.yml"));

    /** Failed-record ratio above which data is quarantined. */
    private double quarantineThreshold = ContractEngine.DEFAULT_QUARANTINE_THRESHOLD;
}

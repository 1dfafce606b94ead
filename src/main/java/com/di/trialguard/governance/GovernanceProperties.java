package com.di.trialguard.governance;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "trialguard.governance")
public class GovernanceProperties {

    /** Prepended to the target location when a dataset is quarantined. */
    private String quarantinePrefix = "quarantine/";

    /** {@code triggered_by} of the lineage events recorded by the promotion gate. */
    private String triggeredBy = "trialguard:promotion-gate";
}

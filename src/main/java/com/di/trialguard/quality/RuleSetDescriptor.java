package com.di.trialguard.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only view of a registered rule set for the API.
 */
public record RuleSetDescriptor(
        @JsonProperty("domain") String domain,
        @JsonProperty("description") String description,
        @JsonProperty("rules") List<RuleDescriptor> rules) {

    public static RuleSetDescriptor of(RuleSet ruleSet) {
        return new RuleSetDescriptor(ruleSet.getDomain(), ruleSet.getDescription(), ruleSet.getRules().stream()
                .map(r -> new RuleDescriptor(r.name(), r.description(), r.severity()))
                .toList());
    }

    public record RuleDescriptor(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("severity") Severity severity) {
    }
}

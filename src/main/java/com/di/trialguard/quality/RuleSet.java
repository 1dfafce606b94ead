package com.di.trialguard.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named, ordered and immutable list of rules for one logical domain.
 * Built once through {@link Builder}; rule names are unique within a set.
 */
public final class RuleSet {

    private final String domain;
    private final String description;
    private final List<Rule> rules;

    private RuleSet(String domain, String description, List<Rule> rules) {
        this.domain = domain;
        this.description = description;
        this.rules = rules;
    }

    public static Builder builder(String domain) {
        return new Builder(domain);
    }

    public String getDomain() {
        return domain;
    }

    public String getDescription() {
        return description;
    }

    /** Rules in registration order. */
    public List<Rule> getRules() {
        return rules;
    }

    public List<String> getRuleNames() {
        return rules.stream().map(Rule::name).toList();
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "RuleSet{domain='" + domain + "', rules=" + getRuleNames() + "}";
    }

    public static final class Builder {

        private final String domain;
        private String description = "";
        private final Map<String, Rule> rules = new LinkedHashMap<>();

        private Builder(String domain) {
            if (domain == null || domain.isBlank()) {
                throw new IllegalArgumentException("Rule set domain cannot be null or blank");
            }
            this.domain = domain.trim();
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        /** Registers an ERROR-severity rule. */
        public Builder addRule(String name, String description, RuleCheck check) {
            return addRule(name, description, check, Severity.ERROR);
        }

        /**
         * @throws DuplicateRuleException if {@code name} is already registered in this set
         */
        public Builder addRule(String name, String description, RuleCheck check, Severity severity) {
            return addRule(new Rule(name, description, severity, check));
        }

        public Builder addRule(Rule rule) {
            if (rules.containsKey(rule.name())) {
                throw new DuplicateRuleException(domain, rule.name());
            }
            rules.put(rule.name(), rule);
            return this;
        }

        public RuleSet build() {
            return new RuleSet(domain, description, Collections.unmodifiableList(new ArrayList<>(rules.values())));
        }
    }
}

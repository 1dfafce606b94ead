package com.di.trialguard.exception;

import java.util.Collection;
import java.util.TreeSet;

/**
 * Raised when a rule set or contract is requested for a domain key nothing is registered under.
 * This is a caller error, never a data-quality outcome.
 */
public class UnknownDomainException extends IllegalArgumentException {

    private final String domain;

    public UnknownDomainException(String kind, String domain, Collection<String> available) {
        super(String.format("Unknown %s domain: '%s'. Available domains: %s", kind, domain, new TreeSet<>(available)));
        this.domain = domain;
    }

    public String getDomain() {
        return domain;
    }
}

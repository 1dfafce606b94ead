package com.di.trialguard.quality;

import com.di.trialguard.exception.UnknownDomainException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of the pre-built rule sets, keyed by domain.
 *
 * <p>Discovers every {@link RuleSetProvider} bean at start-up, builds each rule set once and keeps the
 * result immutable so concurrent validations share it safely. Domain keys are trimmed and upper-cased
 * for lookup. Two providers claiming the same domain fail the application context.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleSetRegistry {

    private final List<RuleSetProvider> providers;

    private Map<String, RuleSet> ruleSetsByDomain = Map.of();

    @PostConstruct
    void initialize() {
        if (providers == null || providers.isEmpty()) {
            log.warn("[QUALITY] No RuleSetProvider beans found. Registry will be empty.");
            ruleSetsByDomain = Collections.emptyMap();
            return;
        }

        Map<String, List<RuleSetProvider>> grouped = providers.stream()
                .peek(RuleSetRegistry::validateDomain)
                .collect(Collectors.groupingBy(p -> normalizeDomain(p.domain())));
        validateNoDuplicates(grouped);

        ruleSetsByDomain = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().get(0).ruleSet()));

        ruleSetsByDomain.forEach((domain, ruleSet) ->
                log.info("[QUALITY] Registered rule set domain={} rules={}", domain, ruleSet.getRuleNames()));
    }

    /**
     * @throws UnknownDomainException if no rule set is registered for the domain
     */
    public RuleSet getRuleSet(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Domain cannot be null or blank");
        }
        RuleSet ruleSet = ruleSetsByDomain.get(normalizeDomain(domain));
        if (ruleSet == null) {
            throw new UnknownDomainException("rule set", domain, ruleSetsByDomain.keySet());
        }
        return ruleSet;
    }

    public boolean hasRuleSet(String domain) {
        return domain != null && !domain.isBlank() && ruleSetsByDomain.containsKey(normalizeDomain(domain));
    }

    public Set<String> getDomains() {
        return ruleSetsByDomain.keySet();
    }

    private static void validateDomain(RuleSetProvider provider) {
        String domain = provider.domain();
        if (domain == null || domain.isBlank()) {
            throw new IllegalStateException(String.format(
                    "RuleSetProvider %s returned blank domain(). Domain must be non-null and non-blank.",
                    provider.getClass().getName()));
        }
    }

    private static void validateNoDuplicates(Map<String, List<RuleSetProvider>> grouped) {
        String detail = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> [%s]", e.getKey(), e.getValue().stream()
                        .map(p -> p.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!detail.isEmpty()) {
            throw new IllegalStateException("Duplicate RuleSetProvider domain() values detected: " + detail);
        }
    }

    static String normalizeDomain(String domain) {
        return domain.trim().toUpperCase(Locale.ROOT);
    }
}

package com.di.trialguard.contract;

import com.di.trialguard.exception.UnknownDomainException;
import com.di.trialguard.util.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Versioned store of data contracts, keyed by {@code (name, version)}.
 *
 * <p>At start-up every YAML file matching {@link ContractProperties#getLocations()} is parsed and validated;
 * a malformed definition fails the application context. Lookup by domain returns the latest version of the
 * contract registered for that domain.
 */
@Slf4j
@Component
public class ContractRegistry {

    /** Numeric dot-separated comparison ({@code 1.10.0 > 1.9.0}); non-numeric segments compare as text. */
    static final Comparator<String> VERSION_ORDER = ContractRegistry::compareVersions;

    private static final ObjectMapper YAML_MAPPER = JsonSupport.newYamlMapper();

    private final ContractProperties properties;
    private final ResourcePatternResolver resolver;
    private final Map<String, DataContract> contractsByKey = new ConcurrentHashMap<>();

    @Autowired
    public ContractRegistry(ContractProperties properties) {
        this(properties, new PathMatchingResourcePatternResolver());
    }

    ContractRegistry(ContractProperties properties, ResourcePatternResolver resolver) {
        this.properties = properties;
        this.resolver = resolver;
    }

    @PostConstruct
    void initialize() {
        for (String location : properties.getLocations()) {
            Resource[] resources;
            try {
                resources = resolver.getResources(location);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot resolve contract location '" + location + "'", e);
            }
            for (Resource resource : resources) {
                register(read(resource));
            }
        }
        log.info("[CONTRACT] Loaded {} contract version(s) for domain(s) {}", contractsByKey.size(), getDomains());
    }

    /**
     * Parses one YAML contract definition.
     *
     * @throws MalformedContractException if the document cannot be read or fails validation
     */
    public static DataContract read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return parse(in, resource.getDescription());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read contract " + resource.getDescription(), e);
        }
    }

    static DataContract parse(InputStream in, String source) throws IOException {
        try {
            DataContract contract = YAML_MAPPER.readValue(in, DataContract.class);
            if (contract == null) {
                throw new MalformedContractException("Contract " + source + " is empty");
            }
            return contract;
        } catch (JsonProcessingException e) {
            for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof MalformedContractException malformed) {
                    throw new MalformedContractException(source + ": " + malformed.getMessage(), malformed);
                }
            }
            throw new MalformedContractException("Contract " + source + " is not a valid definition: "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws MalformedContractException if the same name and version is already registered
     */
    public void register(DataContract contract) {
        String key = key(contract.name(), contract.version());
        DataContract existing = contractsByKey.putIfAbsent(key, contract);
        if (existing != null) {
            throw new MalformedContractException(String.format(
                    "Contract '%s' version %s is registered twice", contract.name(), contract.version()));
        }
        log.info("[CONTRACT] Registered contract={} version={} domain={} columns={} schemaHash={}",
                contract.name(), contract.version(), contract.domain(), contract.columns().size(),
                contract.getSchemaHash());
    }

    /**
     * Latest version of the contract for a domain (case-insensitive).
     *
     * @throws UnknownDomainException if no contract is registered for the domain
     */
    public DataContract getLatest(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Domain cannot be null or blank");
        }
        String normalized = normalizeDomain(domain);
        return contractsByKey.values().stream()
                .filter(c -> normalizeDomain(c.domain()).equals(normalized))
                .max(Comparator.comparing(DataContract::version, VERSION_ORDER))
                .orElseThrow(() -> new UnknownDomainException("contract", domain, getDomains()));
    }

    public Optional<DataContract> find(String name, String version) {
        if (name == null || version == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(contractsByKey.get(key(name, version)));
    }

    /** All versions of every contract, ordered by name then version. */
    public List<DataContract> getAll() {
        List<DataContract> all = new ArrayList<>(contractsByKey.values());
        all.sort(Comparator.comparing(DataContract::name).thenComparing(DataContract::version, VERSION_ORDER));
        return all;
    }

    public Set<String> getDomains() {
        return contractsByKey.values().stream()
                .map(c -> normalizeDomain(c.domain()))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static String key(String name, String version) {
        return name + "@" + version;
    }

    private static String normalizeDomain(String domain) {
        return domain.trim().toUpperCase(Locale.ROOT);
    }

    static int compareVersions(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            String x = i < a.length ? a[i] : "0";
            String y = i < b.length ? b[i] : "0";
            int cmp;
            if (x.matches("\\d+") && y.matches("\\d+")) {
                cmp = Long.compare(Long.parseLong(x), Long.parseLong(y));
            } else {
                cmp = x.compareTo(y);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}

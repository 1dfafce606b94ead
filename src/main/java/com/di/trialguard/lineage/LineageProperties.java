package com.di.trialguard.lineage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Single binding for lineage storage, query bounds and OpenLineage mapping.
 *
 * <pre>
 * trialguard:
 *   lineage:
 *     store: memory            # memory | file
 *     file:
 *       directory: ./lineage
 *     default-depth: 10
 *     max-depth: 50
 *     index-cache:
 *       enabled: true
 *       expire-after-write-seconds: 300
 *       max-size: 16
 *     openlineage:
 *       producer: urn:com.di:trialguard
 *       namespace: trialguard
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "trialguard.lineage")
public class LineageProperties {

    private String store = "memory";

    private File file = new File();

    /** Traversal depth when a query names none. */
    private int defaultDepth = 10;

    /** Requested depths above this are capped. */
    private int maxDepth = 50;

    private IndexCache indexCache = new IndexCache();

    private OpenLineage openlineage = new OpenLineage();

    @Data
    public static class File {
        /** Root of the append-only JSON-lines log. */
        private String directory = "./lineage";
    }

    @Data
    public static class IndexCache {
        private boolean enabled = true;
        private long expireAfterWriteSeconds = 300;
        private long maxSize = 16;
    }

    @Data
    public static class OpenLineage {
        private String producer = "urn:com.di:trialguard";
        /** Namespace for jobs and datasets whose identifier carries none. */
        private String namespace = "trialguard";
    }
}

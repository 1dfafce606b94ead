package com.di.trialguard.quality;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * trialguard:
 *   quality:
 *     default-id-column: USUBJID
 *     max-failed-record-ids: 100
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "trialguard.quality")
public class QualityProperties {

    /** Column whose values identify failing records when the request names none. */
    private String defaultIdColumn = ValidationEngine.DEFAULT_ID_COLUMN;

    /** Upper bound on failed record ids kept per rule result. */
    private int maxFailedRecordIds = ValidationEngine.DEFAULT_MAX_FAILED_RECORD_IDS;
}

package com.di.trialguard.lineage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LineageEventType {

    /** Data arrived from an external source. */
    INGESTION("ingestion"),
    TRANSFORMATION("transformation"),
    VALIDATION("validation"),
    /** Data moved between layers. */
    PROMOTION("promotion"),
    /** Data sent to an external system. */
    EXPORT("export");

    private final String tag;

    LineageEventType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static LineageEventType fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (LineageEventType type : values()) {
                if (type.tag.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown lineage event type: '" + tag + "'");
    }
}

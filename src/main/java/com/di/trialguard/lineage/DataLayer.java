package com.di.trialguard.lineage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Storage tiers of the pipeline, from raw arrival to external delivery.
 */
public enum DataLayer {

    LANDING("landing"),
    BRONZE("bronze"),
    SILVER("silver"),
    GOLD("gold"),
    EXPORT("export");

    private final String tag;

    DataLayer(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static DataLayer fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (DataLayer layer : values()) {
                if (layer.tag.equals(normalized)) {
                    return layer;
                }
            }
        }
        throw new IllegalArgumentException("Unknown data layer: '" + tag + "'");
    }
}

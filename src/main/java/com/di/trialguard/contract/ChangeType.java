package com.di.trialguard.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChangeType {

    COLUMN_ADDED("column_added"),
    COLUMN_REMOVED("column_removed"),
    TYPE_CHANGED("type_changed"),
    // datasets carry no nullability metadata, so detection never emits this
    NULLABLE_CHANGED("nullable_changed");

    private final String tag;

    ChangeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static ChangeType fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (ChangeType type : values()) {
                if (type.tag.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown schema change type: '" + tag + "'");
    }
}

package com.minisessiondb.integrity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 校验警告类型。警告不影响 isValid
 */
public enum WarningType {
    ORPHANED_DATA("orphaned_data"),
    INCONSISTENT_TIMESTAMP("inconsistent_timestamp"),
    MISSING_METADATA("missing_metadata"),
    OUTDATED_SCHEMA("outdated_schema");

    private final String wireName;

    WarningType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static WarningType fromWireName(String wireName) {
        for (WarningType value : values()) {
            if (value.wireName.equals(wireName)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown warning type: " + wireName);
    }
}

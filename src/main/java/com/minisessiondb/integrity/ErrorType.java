package com.minisessiondb.integrity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 校验错误类型
 */
public enum ErrorType {
    CHECKSUM_MISMATCH("checksum_mismatch"),
    MISSING_REFERENCE("missing_reference"),
    DATA_CORRUPTION("data_corruption"),
    SCHEMA_VIOLATION("schema_violation");

    private final String wireName;

    ErrorType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ErrorType fromWireName(String wireName) {
        for (ErrorType value : values()) {
            if (value.wireName.equals(wireName)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error type: " + wireName);
    }
}

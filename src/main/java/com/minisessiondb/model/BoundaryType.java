package com.minisessiondb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BoundaryType {
    START("start"),
    END("end");

    private final String wireName;

    BoundaryType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static BoundaryType fromWireName(String wireName) {
        for (BoundaryType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown boundary type: " + wireName);
    }
}

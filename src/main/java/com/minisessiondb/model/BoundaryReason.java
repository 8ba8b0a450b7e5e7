package com.minisessiondb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 会话边界产生的原因
 */
public enum BoundaryReason {
    USER_INITIATED("user_initiated"),
    IDLE_TIMEOUT("idle_timeout"),
    NAVIGATION_GAP("navigation_gap"),
    DOMAIN_CHANGE("domain_change"),
    WINDOW_CLOSED("window_closed");

    private final String wireName;

    BoundaryReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static BoundaryReason fromWireName(String wireName) {
        for (BoundaryReason reason : values()) {
            if (reason.wireName.equals(wireName)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown boundary reason: " + wireName);
    }
}

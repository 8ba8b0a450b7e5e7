package com.minisessiondb.integrity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.minisessiondb.metadata.ContainerType;

/**
 * 校验报告中的实体类型,与存储容器一一对应
 */
public enum EntityType {
    SESSION("session", ContainerType.SESSIONS),
    TAB("tab", ContainerType.TABS),
    NAVIGATION_EVENT("navigation_event", ContainerType.NAVIGATION_EVENTS),
    BOUNDARY("boundary", ContainerType.SESSION_BOUNDARIES);

    private final String wireName;

    private final ContainerType containerType;

    EntityType(String wireName, ContainerType containerType) {
        this.wireName = wireName;
        this.containerType = containerType;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public ContainerType getContainerType() {
        return containerType;
    }

    @JsonCreator
    public static EntityType fromWireName(String wireName) {
        for (EntityType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + wireName);
    }
}

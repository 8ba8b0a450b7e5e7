package com.minisessiondb.metadata;

import com.minisessiondb.storage.record.DatabaseMetadata;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredSessionBoundary;
import com.minisessiondb.storage.record.StoredTab;

/**
 * ContainerType - 容器(记录种类)
 *
 * 每个容器对应一种持久化记录类,名称即落盘文件名和事务作用域的锁名。
 */
public enum ContainerType {
    SESSIONS("sessions", StoredSession.class),
    TABS("tabs", StoredTab.class),
    NAVIGATION_EVENTS("navigation_events", StoredNavigationEvent.class),
    SESSION_BOUNDARIES("session_boundaries", StoredSessionBoundary.class),
    METADATA("metadata", DatabaseMetadata.class);

    private final String containerName;

    private final Class<? extends StoredRecord> recordClass;

    ContainerType(String containerName, Class<? extends StoredRecord> recordClass) {
        this.containerName = containerName;
        this.recordClass = recordClass;
    }

    public String getContainerName() {
        return containerName;
    }

    public Class<? extends StoredRecord> getRecordClass() {
        return recordClass;
    }

    public static ContainerType fromName(String containerName) {
        for (ContainerType type : values()) {
            if (type.containerName.equals(containerName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown container: " + containerName);
    }
}

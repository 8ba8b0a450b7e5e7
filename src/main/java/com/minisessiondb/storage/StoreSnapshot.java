package com.minisessiondb.storage;

import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.storage.record.DatabaseMetadata;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredSessionBoundary;
import com.minisessiondb.storage.record.StoredTab;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * StoreSnapshot - 全部容器的一致快照
 *
 * 在一个只读事务内读出,用于备份、导出和迁移前的保护性拷贝。
 * 整体加载到内存。
 */
public class StoreSnapshot {

    private List<StoredSession> sessions = new ArrayList<>();

    private List<StoredTab> tabs = new ArrayList<>();

    private List<StoredNavigationEvent> navigationEvents = new ArrayList<>();

    private List<StoredSessionBoundary> boundaries = new ArrayList<>();

    private List<DatabaseMetadata> metadata = new ArrayList<>();

    public StoreSnapshot() {
    }

    /**
     * 在事务内读取全部已存在的容器
     */
    public static StoreSnapshot capture(Transaction tx, Set<String> existingContainers) {
        StoreSnapshot snapshot = new StoreSnapshot();
        if (existingContainers.contains(ContainerType.SESSIONS.getContainerName())) {
            snapshot.sessions = tx.getAll(ContainerType.SESSIONS, StoredSession.class);
        }
        if (existingContainers.contains(ContainerType.TABS.getContainerName())) {
            snapshot.tabs = tx.getAll(ContainerType.TABS, StoredTab.class);
        }
        if (existingContainers.contains(ContainerType.NAVIGATION_EVENTS.getContainerName())) {
            snapshot.navigationEvents = tx.getAll(ContainerType.NAVIGATION_EVENTS, StoredNavigationEvent.class);
        }
        if (existingContainers.contains(ContainerType.SESSION_BOUNDARIES.getContainerName())) {
            snapshot.boundaries = tx.getAll(ContainerType.SESSION_BOUNDARIES, StoredSessionBoundary.class);
        }
        if (existingContainers.contains(ContainerType.METADATA.getContainerName())) {
            snapshot.metadata = tx.getAll(ContainerType.METADATA, DatabaseMetadata.class);
        }
        return snapshot;
    }

    /**
     * 各容器的记录数(按容器名)
     */
    public Map<String, Integer> itemCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(ContainerType.SESSIONS.getContainerName(), sessions.size());
        counts.put(ContainerType.TABS.getContainerName(), tabs.size());
        counts.put(ContainerType.NAVIGATION_EVENTS.getContainerName(), navigationEvents.size());
        counts.put(ContainerType.SESSION_BOUNDARIES.getContainerName(), boundaries.size());
        counts.put(ContainerType.METADATA.getContainerName(), metadata.size());
        return counts;
    }

    public int totalItems() {
        return sessions.size() + tabs.size() + navigationEvents.size() + boundaries.size() + metadata.size();
    }

    public List<StoredSession> getSessions() {
        return sessions;
    }

    public void setSessions(List<StoredSession> sessions) {
        this.sessions = sessions;
    }

    public List<StoredTab> getTabs() {
        return tabs;
    }

    public void setTabs(List<StoredTab> tabs) {
        this.tabs = tabs;
    }

    public List<StoredNavigationEvent> getNavigationEvents() {
        return navigationEvents;
    }

    public void setNavigationEvents(List<StoredNavigationEvent> navigationEvents) {
        this.navigationEvents = navigationEvents;
    }

    public List<StoredSessionBoundary> getBoundaries() {
        return boundaries;
    }

    public void setBoundaries(List<StoredSessionBoundary> boundaries) {
        this.boundaries = boundaries;
    }

    public List<DatabaseMetadata> getMetadata() {
        return metadata;
    }

    public void setMetadata(List<DatabaseMetadata> metadata) {
        this.metadata = metadata;
    }
}

package com.minisessiondb.storage.engine;

/**
 * 存储统计
 *
 * sessions/tabs/navigationEvents 取自元数据计数器,boundaries 为实际记录数;
 * oldestRecord/newestRecord 为会话createdAt的最小/最大值,没有会话时为0。
 */
public class StorageStats {

    private final int sessions;

    private final int tabs;

    private final int navigationEvents;

    private final int boundaries;

    private final long storageSize;

    private final long oldestRecord;

    private final long newestRecord;

    private final boolean integrityStatus;

    public StorageStats(int sessions, int tabs, int navigationEvents, int boundaries, long storageSize,
                        long oldestRecord, long newestRecord, boolean integrityStatus) {
        this.sessions = sessions;
        this.tabs = tabs;
        this.navigationEvents = navigationEvents;
        this.boundaries = boundaries;
        this.storageSize = storageSize;
        this.oldestRecord = oldestRecord;
        this.newestRecord = newestRecord;
        this.integrityStatus = integrityStatus;
    }

    public int getSessions() {
        return sessions;
    }

    public int getTabs() {
        return tabs;
    }

    public int getNavigationEvents() {
        return navigationEvents;
    }

    public int getBoundaries() {
        return boundaries;
    }

    public long getStorageSize() {
        return storageSize;
    }

    public long getOldestRecord() {
        return oldestRecord;
    }

    public long getNewestRecord() {
        return newestRecord;
    }

    public boolean isIntegrityStatus() {
        return integrityStatus;
    }

    @Override
    public String toString() {
        return "StorageStats{" +
                "sessions=" + sessions +
                ", tabs=" + tabs +
                ", navigationEvents=" + navigationEvents +
                ", boundaries=" + boundaries +
                ", storageSize=" + storageSize +
                ", oldestRecord=" + oldestRecord +
                ", newestRecord=" + newestRecord +
                ", integrityStatus=" + integrityStatus +
                '}';
    }
}

package com.minisessiondb.storage.record;

import com.minisessiondb.metadata.ContainerType;

import java.util.Collections;

/**
 * DatabaseMetadata - 数据库级元数据(单行)
 *
 * 以schema版本号为主键,保存各容器的计数、估算存储大小、
 * 最近一次备份时间和最近一次完整性扫描结果。
 * 计数与对应的写操作在同一个事务内调整。
 */
public final class DatabaseMetadata implements StoredRecord {

    private Integer version;

    private long createdAt;

    private long lastModified;

    private Long lastBackup;

    private int totalSessions;

    private int totalTabs;

    private int totalNavigationEvents;

    private long storageSize;

    private IntegrityCheckResult integrityCheck = new IntegrityCheckResult();

    public DatabaseMetadata() {
    }

    public DatabaseMetadata(int version, long now) {
        this.version = version;
        this.createdAt = now;
        this.lastModified = now;
        this.integrityCheck = new IntegrityCheckResult(now, true, Collections.emptyList());
    }

    @Override
    public ContainerType containerType() {
        return ContainerType.METADATA;
    }

    @Override
    public Object primaryKey() {
        return version;
    }

    @Override
    public Object keyPathValue(String keyPath) {
        return "version".equals(keyPath) ? version : null;
    }

    @Override
    public DatabaseMetadata copy() {
        DatabaseMetadata copy = new DatabaseMetadata();
        copy.version = version;
        copy.createdAt = createdAt;
        copy.lastModified = lastModified;
        copy.lastBackup = lastBackup;
        copy.totalSessions = totalSessions;
        copy.totalTabs = totalTabs;
        copy.totalNavigationEvents = totalNavigationEvents;
        copy.storageSize = storageSize;
        copy.integrityCheck = integrityCheck == null ? null : new IntegrityCheckResult(integrityCheck);
        return copy;
    }

    public Integer getVersion() {
        return version;
    }

    public void setVersion(Integer version) {
        this.version = version;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getLastModified() {
        return lastModified;
    }

    public void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    public Long getLastBackup() {
        return lastBackup;
    }

    public void setLastBackup(Long lastBackup) {
        this.lastBackup = lastBackup;
    }

    public int getTotalSessions() {
        return totalSessions;
    }

    public void setTotalSessions(int totalSessions) {
        this.totalSessions = totalSessions;
    }

    public int getTotalTabs() {
        return totalTabs;
    }

    public void setTotalTabs(int totalTabs) {
        this.totalTabs = totalTabs;
    }

    public int getTotalNavigationEvents() {
        return totalNavigationEvents;
    }

    public void setTotalNavigationEvents(int totalNavigationEvents) {
        this.totalNavigationEvents = totalNavigationEvents;
    }

    public long getStorageSize() {
        return storageSize;
    }

    public void setStorageSize(long storageSize) {
        this.storageSize = storageSize;
    }

    public IntegrityCheckResult getIntegrityCheck() {
        return integrityCheck;
    }

    public void setIntegrityCheck(IntegrityCheckResult integrityCheck) {
        this.integrityCheck = integrityCheck;
    }

    @Override
    public String toString() {
        return "DatabaseMetadata{" +
                "version=" + version +
                ", totalSessions=" + totalSessions +
                ", totalTabs=" + totalTabs +
                ", totalNavigationEvents=" + totalNavigationEvents +
                ", storageSize=" + storageSize +
                '}';
    }
}

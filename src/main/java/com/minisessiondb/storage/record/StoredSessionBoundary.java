package com.minisessiondb.storage.record;

import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.model.BoundaryContext;
import com.minisessiondb.model.BoundaryReason;
import com.minisessiondb.model.BoundaryType;

public final class StoredSessionBoundary implements StoredRecord {

    private String id;

    private BoundaryType type;

    private BoundaryReason reason;

    private long timestamp;

    private String sessionId;

    private BoundaryContext context = new BoundaryContext();

    private int tabCount;

    private int windowCount;

    private int version;

    private String checksum;

    public StoredSessionBoundary() {
    }

    @Override
    public ContainerType containerType() {
        return ContainerType.SESSION_BOUNDARIES;
    }

    @Override
    public Object primaryKey() {
        return id;
    }

    @Override
    public Object keyPathValue(String keyPath) {
        switch (keyPath) {
            case "id":
                return id;
            case "sessionId":
                return sessionId;
            case "timestamp":
                return timestamp;
            case "reason":
                return reason == null ? null : reason.getWireName();
            default:
                return null;
        }
    }

    @Override
    public StoredSessionBoundary copy() {
        StoredSessionBoundary copy = new StoredSessionBoundary();
        copy.id = id;
        copy.type = type;
        copy.reason = reason;
        copy.timestamp = timestamp;
        copy.sessionId = sessionId;
        copy.context = context == null ? null : new BoundaryContext(context);
        copy.tabCount = tabCount;
        copy.windowCount = windowCount;
        copy.version = version;
        copy.checksum = checksum;
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public BoundaryType getType() {
        return type;
    }

    public void setType(BoundaryType type) {
        this.type = type;
    }

    public BoundaryReason getReason() {
        return reason;
    }

    public void setReason(BoundaryReason reason) {
        this.reason = reason;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public BoundaryContext getContext() {
        return context;
    }

    public void setContext(BoundaryContext context) {
        this.context = context;
    }

    public int getTabCount() {
        return tabCount;
    }

    public void setTabCount(int tabCount) {
        this.tabCount = tabCount;
    }

    public int getWindowCount() {
        return windowCount;
    }

    public void setWindowCount(int windowCount) {
        this.windowCount = windowCount;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    @Override
    public String toString() {
        return "StoredSessionBoundary{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", reason=" + reason +
                ", sessionId='" + sessionId + '\'' +
                '}';
    }
}

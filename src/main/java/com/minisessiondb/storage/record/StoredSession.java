package com.minisessiondb.storage.record;

import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.model.SessionMetadata;
import com.minisessiondb.model.Tab;

import java.util.ArrayList;
import java.util.List;

/**
 * StoredSession - 会话的持久化形式
 *
 * 在Session字段之外附加存储元数据:版本号、最后修改时间、估算大小、
 * 压缩标记和压缩负载、推导出的域名集合、计数和校验和。
 *
 * 压缩后tabs为空列表,标签页快照保存在compressedPayload中。
 */
public final class StoredSession implements StoredRecord {

    private String id;

    private String tag;

    private long createdAt;

    private long updatedAt;

    private List<Tab> tabs = new ArrayList<>();

    private List<Integer> windowIds = new ArrayList<>();

    private SessionMetadata metadata = new SessionMetadata();

    private int version;

    private long lastModified;

    private long size;

    private boolean compressed;

    private String compressedPayload;

    private List<String> domains = new ArrayList<>();

    private int totalTabCount;

    private int totalNavigationEvents;

    private String checksum;

    private boolean valid = true;

    public StoredSession() {
    }

    @Override
    public ContainerType containerType() {
        return ContainerType.SESSIONS;
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
            case "tag":
                return tag;
            case "createdAt":
                return createdAt;
            case "updatedAt":
                return updatedAt;
            case "domains":
                return domains;
            default:
                return null;
        }
    }

    @Override
    public StoredSession copy() {
        StoredSession copy = new StoredSession();
        copy.id = id;
        copy.tag = tag;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.tabs = null;
        if (tabs != null) {
            copy.tabs = new ArrayList<>();
            for (Tab tab : tabs) {
                copy.tabs.add(new Tab(tab));
            }
        }
        copy.windowIds = windowIds == null ? null : new ArrayList<>(windowIds);
        copy.metadata = metadata == null ? null : new SessionMetadata(metadata);
        copy.version = version;
        copy.lastModified = lastModified;
        copy.size = size;
        copy.compressed = compressed;
        copy.compressedPayload = compressedPayload;
        copy.domains = domains == null ? new ArrayList<>() : new ArrayList<>(domains);
        copy.totalTabCount = totalTabCount;
        copy.totalNavigationEvents = totalNavigationEvents;
        copy.checksum = checksum;
        copy.valid = valid;
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public List<Tab> getTabs() {
        return tabs;
    }

    public void setTabs(List<Tab> tabs) {
        this.tabs = tabs;
    }

    public List<Integer> getWindowIds() {
        return windowIds;
    }

    public void setWindowIds(List<Integer> windowIds) {
        this.windowIds = windowIds;
    }

    public SessionMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(SessionMetadata metadata) {
        this.metadata = metadata;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public long getLastModified() {
        return lastModified;
    }

    public void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public void setCompressed(boolean compressed) {
        this.compressed = compressed;
    }

    public String getCompressedPayload() {
        return compressedPayload;
    }

    public void setCompressedPayload(String compressedPayload) {
        this.compressedPayload = compressedPayload;
    }

    public List<String> getDomains() {
        return domains;
    }

    public void setDomains(List<String> domains) {
        this.domains = domains;
    }

    public int getTotalTabCount() {
        return totalTabCount;
    }

    public void setTotalTabCount(int totalTabCount) {
        this.totalTabCount = totalTabCount;
    }

    public int getTotalNavigationEvents() {
        return totalNavigationEvents;
    }

    public void setTotalNavigationEvents(int totalNavigationEvents) {
        this.totalNavigationEvents = totalNavigationEvents;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    @Override
    public String toString() {
        return "StoredSession{" +
                "id='" + id + '\'' +
                ", tag='" + tag + '\'' +
                ", version=" + version +
                ", compressed=" + compressed +
                ", totalTabCount=" + totalTabCount +
                ", checksum='" + checksum + '\'' +
                '}';
    }
}

package com.minisessiondb.storage.record;

import com.minisessiondb.metadata.ContainerType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 独立存储的标签页。sessionId只在完整性校验时检查,插入时不校验(乐观插入)。
 */
public final class StoredTab implements StoredRecord {

    private Integer id;

    private String sessionId;

    private String url;

    private String title;

    private String favicon;

    private int windowId;

    private long createdAt;

    private long lastAccessed;

    private long timeSpent;

    private int scrollPosition;

    private Map<String, String> formData;

    private String domain;

    private boolean active;

    private int interactionCount;

    private long focusTime;

    private int version;

    private long lastModified;

    private int navigationCount;

    private Long firstNavigationAt;

    private Long lastNavigationAt;

    private String checksum;

    public StoredTab() {
    }

    @Override
    public ContainerType containerType() {
        return ContainerType.TABS;
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
            case "windowId":
                return windowId;
            case "url":
                return url;
            case "domain":
                return domain;
            case "createdAt":
                return createdAt;
            default:
                return null;
        }
    }

    @Override
    public StoredTab copy() {
        StoredTab copy = new StoredTab();
        copy.id = id;
        copy.sessionId = sessionId;
        copy.url = url;
        copy.title = title;
        copy.favicon = favicon;
        copy.windowId = windowId;
        copy.createdAt = createdAt;
        copy.lastAccessed = lastAccessed;
        copy.timeSpent = timeSpent;
        copy.scrollPosition = scrollPosition;
        copy.formData = formData == null ? null : new LinkedHashMap<>(formData);
        copy.domain = domain;
        copy.active = active;
        copy.interactionCount = interactionCount;
        copy.focusTime = focusTime;
        copy.version = version;
        copy.lastModified = lastModified;
        copy.navigationCount = navigationCount;
        copy.firstNavigationAt = firstNavigationAt;
        copy.lastNavigationAt = lastNavigationAt;
        copy.checksum = checksum;
        return copy;
    }

    public Integer getId() {
        return id;
    }

    public void setId(Integer id) {
        this.id = id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getFavicon() {
        return favicon;
    }

    public void setFavicon(String favicon) {
        this.favicon = favicon;
    }

    public int getWindowId() {
        return windowId;
    }

    public void setWindowId(int windowId) {
        this.windowId = windowId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getLastAccessed() {
        return lastAccessed;
    }

    public void setLastAccessed(long lastAccessed) {
        this.lastAccessed = lastAccessed;
    }

    public long getTimeSpent() {
        return timeSpent;
    }

    public void setTimeSpent(long timeSpent) {
        this.timeSpent = timeSpent;
    }

    public int getScrollPosition() {
        return scrollPosition;
    }

    public void setScrollPosition(int scrollPosition) {
        this.scrollPosition = scrollPosition;
    }

    public Map<String, String> getFormData() {
        return formData;
    }

    public void setFormData(Map<String, String> formData) {
        this.formData = formData;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public int getInteractionCount() {
        return interactionCount;
    }

    public void setInteractionCount(int interactionCount) {
        this.interactionCount = interactionCount;
    }

    public long getFocusTime() {
        return focusTime;
    }

    public void setFocusTime(long focusTime) {
        this.focusTime = focusTime;
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

    public int getNavigationCount() {
        return navigationCount;
    }

    public void setNavigationCount(int navigationCount) {
        this.navigationCount = navigationCount;
    }

    public Long getFirstNavigationAt() {
        return firstNavigationAt;
    }

    public void setFirstNavigationAt(Long firstNavigationAt) {
        this.firstNavigationAt = firstNavigationAt;
    }

    public Long getLastNavigationAt() {
        return lastNavigationAt;
    }

    public void setLastNavigationAt(Long lastNavigationAt) {
        this.lastNavigationAt = lastNavigationAt;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    @Override
    public String toString() {
        return "StoredTab{" +
                "id=" + id +
                ", sessionId='" + sessionId + '\'' +
                ", url='" + url + '\'' +
                ", windowId=" + windowId +
                ", version=" + version +
                '}';
    }
}

package com.minisessiondb.storage.record;

import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.model.NavigationTransition;

/**
 * 独立存储的导航事件,主键为 [tabId, timestamp]
 */
public final class StoredNavigationEvent implements StoredRecord {

    private Integer tabId;

    private Long timestamp;

    private String url;

    private String referrer;

    private NavigationTransition transitionType;

    private String sessionId;

    private String domain;

    private int version;

    private String batchId;

    private String checksum;

    public StoredNavigationEvent() {
    }

    @Override
    public ContainerType containerType() {
        return ContainerType.NAVIGATION_EVENTS;
    }

    @Override
    public Object primaryKey() {
        if (tabId == null || timestamp == null) {
            return null;
        }
        return new NavigationEventKey(tabId, timestamp);
    }

    public NavigationEventKey key() {
        return (NavigationEventKey) primaryKey();
    }

    @Override
    public Object keyPathValue(String keyPath) {
        switch (keyPath) {
            case "tabId":
                return tabId;
            case "timestamp":
                return timestamp;
            case "sessionId":
                return sessionId;
            case "url":
                return url;
            case "domain":
                return domain;
            default:
                return null;
        }
    }

    @Override
    public StoredNavigationEvent copy() {
        StoredNavigationEvent copy = new StoredNavigationEvent();
        copy.tabId = tabId;
        copy.timestamp = timestamp;
        copy.url = url;
        copy.referrer = referrer;
        copy.transitionType = transitionType;
        copy.sessionId = sessionId;
        copy.domain = domain;
        copy.version = version;
        copy.batchId = batchId;
        copy.checksum = checksum;
        return copy;
    }

    public Integer getTabId() {
        return tabId;
    }

    public void setTabId(Integer tabId) {
        this.tabId = tabId;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getReferrer() {
        return referrer;
    }

    public void setReferrer(String referrer) {
        this.referrer = referrer;
    }

    public NavigationTransition getTransitionType() {
        return transitionType;
    }

    public void setTransitionType(NavigationTransition transitionType) {
        this.transitionType = transitionType;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getBatchId() {
        return batchId;
    }

    public void setBatchId(String batchId) {
        this.batchId = batchId;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    @Override
    public String toString() {
        return "StoredNavigationEvent{" +
                "tabId=" + tabId +
                ", timestamp=" + timestamp +
                ", url='" + url + '\'' +
                ", sessionId='" + sessionId + '\'' +
                '}';
    }
}

package com.minisessiondb.model;

import java.util.Objects;

/**
 * 一次导航。同一标签页内按时间戳唯一。
 */
public class NavigationEvent {

    private int tabId;

    private String url;

    private String referrer;

    private long timestamp;

    private NavigationTransition transitionType;

    public NavigationEvent() {
    }

    public NavigationEvent(int tabId, String url, long timestamp, NavigationTransition transitionType) {
        this.tabId = tabId;
        this.url = url;
        this.timestamp = timestamp;
        this.transitionType = transitionType;
    }

    public int getTabId() {
        return tabId;
    }

    public void setTabId(int tabId) {
        this.tabId = tabId;
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

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public NavigationTransition getTransitionType() {
        return transitionType;
    }

    public void setTransitionType(NavigationTransition transitionType) {
        this.transitionType = transitionType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NavigationEvent)) return false;
        NavigationEvent that = (NavigationEvent) o;
        return tabId == that.tabId
                && timestamp == that.timestamp
                && Objects.equals(url, that.url)
                && Objects.equals(referrer, that.referrer)
                && transitionType == that.transitionType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tabId, url, referrer, timestamp, transitionType);
    }

    @Override
    public String toString() {
        return "NavigationEvent{" +
                "tabId=" + tabId +
                ", url='" + url + '\'' +
                ", timestamp=" + timestamp +
                ", transitionType=" + transitionType +
                '}';
    }
}

package com.minisessiondb.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tab - 标签页快照
 *
 * 浏览器侧捕获的一个标签页。id由浏览器分配(正整数),
 * formData只对最近一小时内创建的标签页有保留价值。
 */
public class Tab {

    private int id;

    private String url;

    private String title;

    private String favicon;

    private int windowId;

    private long createdAt;

    private long lastAccessed;

    private long timeSpent;

    private int scrollPosition;

    private Map<String, String> formData;

    public Tab() {
    }

    public Tab(int id, String url, String title, int windowId, long createdAt) {
        this.id = id;
        this.url = url;
        this.title = title;
        this.windowId = windowId;
        this.createdAt = createdAt;
        this.lastAccessed = createdAt;
    }

    /**
     * 深拷贝
     */
    public Tab(Tab other) {
        this.id = other.id;
        this.url = other.url;
        this.title = other.title;
        this.favicon = other.favicon;
        this.windowId = other.windowId;
        this.createdAt = other.createdAt;
        this.lastAccessed = other.lastAccessed;
        this.timeSpent = other.timeSpent;
        this.scrollPosition = other.scrollPosition;
        this.formData = other.formData == null ? null : new LinkedHashMap<>(other.formData);
    }

    public int getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tab)) return false;
        Tab tab = (Tab) o;
        return id == tab.id
                && windowId == tab.windowId
                && createdAt == tab.createdAt
                && lastAccessed == tab.lastAccessed
                && timeSpent == tab.timeSpent
                && scrollPosition == tab.scrollPosition
                && Objects.equals(url, tab.url)
                && Objects.equals(title, tab.title)
                && Objects.equals(favicon, tab.favicon)
                && Objects.equals(formData, tab.formData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, url, title, favicon, windowId, createdAt, lastAccessed, timeSpent, scrollPosition, formData);
    }

    @Override
    public String toString() {
        return "Tab{" +
                "id=" + id +
                ", url='" + url + '\'' +
                ", title='" + title + '\'' +
                ", windowId=" + windowId +
                ", createdAt=" + createdAt +
                '}';
    }
}

package com.minisessiondb.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Session - 浏览会话
 *
 * 一次有明确用途的浏览过程,由若干标签页快照和所在窗口组成。
 * tag是用户可见的会话标签,也是最常用的查询条件。
 *
 * 使用模式:
 * <pre>
 * Session session = new Session("s1", "research", now);
 * session.getTabs().add(new Tab(1, "https://example.com", "Example", 1, now));
 * session.getWindowIds().add(1);
 * manager.createSession(session).join();
 * </pre>
 */
public class Session {

    private String id;

    private String tag;

    private long createdAt;

    private long updatedAt;

    private List<Tab> tabs = new ArrayList<>();

    private List<Integer> windowIds = new ArrayList<>();

    private SessionMetadata metadata = new SessionMetadata();

    public Session() {
    }

    public Session(String id, String tag, long createdAt) {
        this.id = id;
        this.tag = tag;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public Session(Session other) {
        this.id = other.id;
        this.tag = other.tag;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
        this.tabs = new ArrayList<>();
        if (other.tabs != null) {
            for (Tab tab : other.tabs) {
                this.tabs.add(new Tab(tab));
            }
        }
        this.windowIds = other.windowIds == null ? new ArrayList<>() : new ArrayList<>(other.windowIds);
        this.metadata = other.metadata == null ? new SessionMetadata() : new SessionMetadata(other.metadata);
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session)) return false;
        Session session = (Session) o;
        return createdAt == session.createdAt
                && updatedAt == session.updatedAt
                && Objects.equals(id, session.id)
                && Objects.equals(tag, session.tag)
                && Objects.equals(tabs, session.tabs)
                && Objects.equals(windowIds, session.windowIds)
                && Objects.equals(metadata, session.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tag, createdAt, updatedAt, tabs, windowIds, metadata);
    }

    @Override
    public String toString() {
        return "Session{" +
                "id='" + id + '\'' +
                ", tag='" + tag + '\'' +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                ", tabs=" + (tabs == null ? 0 : tabs.size()) +
                ", windowIds=" + windowIds +
                '}';
    }
}

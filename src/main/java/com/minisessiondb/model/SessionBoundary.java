package com.minisessiondb.model;

import java.util.Objects;

/**
 * SessionBoundary - 会话边界
 *
 * 标记一个会话的开始或结束,以及触发原因(空闲超时、域名切换等)。
 */
public class SessionBoundary {

    private String id;

    private BoundaryType type;

    private BoundaryReason reason;

    private long timestamp;

    private String sessionId;

    private BoundaryContext context = new BoundaryContext();

    public SessionBoundary() {
    }

    public SessionBoundary(String id, BoundaryType type, BoundaryReason reason, long timestamp, String sessionId) {
        this.id = id;
        this.type = type;
        this.reason = reason;
        this.timestamp = timestamp;
        this.sessionId = sessionId;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionBoundary)) return false;
        SessionBoundary that = (SessionBoundary) o;
        return timestamp == that.timestamp
                && Objects.equals(id, that.id)
                && type == that.type
                && reason == that.reason
                && Objects.equals(sessionId, that.sessionId)
                && Objects.equals(context, that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, reason, timestamp, sessionId, context);
    }

    @Override
    public String toString() {
        return "SessionBoundary{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", reason=" + reason +
                ", timestamp=" + timestamp +
                ", sessionId='" + sessionId + '\'' +
                '}';
    }
}

package com.minisessiondb.integrity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 校验错误
 *
 * entityId 对会话和边界是字符串ID,对标签页是数字ID,
 * 对导航事件是 "tabId_timestamp" 形式的字符串。
 */
public final class ValidationError {

    private final ErrorType type;

    private final Severity severity;

    private final EntityType entityType;

    private final Object entityId;

    private final String message;

    private final Map<String, Object> details;

    private final boolean canAutoCorrect;

    public ValidationError(ErrorType type, Severity severity, EntityType entityType, Object entityId,
                           String message, boolean canAutoCorrect) {
        this(type, severity, entityType, entityId, message, Collections.emptyMap(), canAutoCorrect);
    }

    public ValidationError(ErrorType type, Severity severity, EntityType entityType, Object entityId,
                           String message, Map<String, Object> details, boolean canAutoCorrect) {
        this.type = type;
        this.severity = severity;
        this.entityType = entityType;
        this.entityId = entityId;
        this.message = message;
        this.details = details == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.canAutoCorrect = canAutoCorrect;
    }

    public ErrorType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public Object getEntityId() {
        return entityId;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public boolean isCanAutoCorrect() {
        return canAutoCorrect;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError)) return false;
        ValidationError that = (ValidationError) o;
        return canAutoCorrect == that.canAutoCorrect
                && type == that.type
                && severity == that.severity
                && entityType == that.entityType
                && Objects.equals(entityId, that.entityId)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, entityType, entityId, message, canAutoCorrect);
    }

    @Override
    public String toString() {
        return "ValidationError{" +
                "type=" + type +
                ", severity=" + severity +
                ", entity=" + entityType + ":" + entityId +
                ", message='" + message + '\'' +
                ", canAutoCorrect=" + canAutoCorrect +
                '}';
    }
}

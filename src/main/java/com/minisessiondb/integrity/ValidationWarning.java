package com.minisessiondb.integrity;

import java.util.Objects;

public final class ValidationWarning {

    private final WarningType type;

    private final EntityType entityType;

    private final Object entityId;

    private final String message;

    public ValidationWarning(WarningType type, EntityType entityType, Object entityId, String message) {
        this.type = type;
        this.entityType = entityType;
        this.entityId = entityId;
        this.message = message;
    }

    public WarningType getType() {
        return type;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationWarning)) return false;
        ValidationWarning that = (ValidationWarning) o;
        return type == that.type
                && entityType == that.entityType
                && Objects.equals(entityId, that.entityId)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, entityType, entityId, message);
    }

    @Override
    public String toString() {
        return "ValidationWarning{" +
                "type=" + type +
                ", entity=" + entityType + ":" + entityId +
                ", message='" + message + '\'' +
                '}';
    }
}

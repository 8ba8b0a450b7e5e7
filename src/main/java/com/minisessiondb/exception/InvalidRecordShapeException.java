package com.minisessiondb.exception;

/**
 * 记录缺少容器声明的主键路径,写入被拒绝
 */
public class InvalidRecordShapeException extends StorageException {

    private final String containerName;

    public InvalidRecordShapeException(String containerName, String message) {
        super("Invalid " + containerName + " record: " + message);
        this.containerName = containerName;
    }

    public String getContainerName() {
        return containerName;
    }
}

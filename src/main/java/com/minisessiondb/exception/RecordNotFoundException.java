package com.minisessiondb.exception;

/**
 * 按主键更新或删除时记录不存在
 */
public class RecordNotFoundException extends StorageException {

    private final String containerName;

    private final Object key;

    public RecordNotFoundException(String containerName, Object key) {
        super("Record not found in " + containerName + ": " + key);
        this.containerName = containerName;
        this.key = key;
    }

    public String getContainerName() {
        return containerName;
    }

    public Object getKey() {
        return key;
    }
}

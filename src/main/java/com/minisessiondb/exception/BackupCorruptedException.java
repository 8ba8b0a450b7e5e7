package com.minisessiondb.exception;

/**
 * 备份负载的校验和与清单记录的不一致,拒绝恢复
 */
public class BackupCorruptedException extends StorageException {

    public BackupCorruptedException(String backupId, String expected, String actual) {
        super("Backup checksum mismatch: " + backupId + " (expected=" + expected + ", actual=" + actual + ")");
    }

    public BackupCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.minisessiondb.exception;

public class BackupNotFoundException extends StorageException {

    private final String backupId;

    public BackupNotFoundException(String backupId) {
        super("Backup not found: " + backupId);
        this.backupId = backupId;
    }

    public String getBackupId() {
        return backupId;
    }
}

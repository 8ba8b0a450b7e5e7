package com.minisessiondb.exception;

public class MigrationStepNotFoundException extends StorageException {

    private final int version;

    public MigrationStepNotFoundException(int version) {
        super("Migration step not found for version " + version);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}

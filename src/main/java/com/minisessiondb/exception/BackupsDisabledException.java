package com.minisessiondb.exception;

public class BackupsDisabledException extends StorageException {

    public BackupsDisabledException() {
        super("Backups are disabled");
    }
}

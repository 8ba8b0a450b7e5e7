package com.minisessiondb.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * 打开存储时迁移失败。打开流程因此中止,存储保持旧版本。
 */
public class MigrationFailedException extends StorageException {

    private final List<String> errors;

    public MigrationFailedException(int fromVersion, int toVersion, List<String> errors) {
        super("Migration from version " + fromVersion + " to " + toVersion + " failed: " + errors);
        this.errors = new ArrayList<>(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

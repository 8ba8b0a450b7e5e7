package com.minisessiondb.migration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次迁移的结果
 */
public class MigrationResult {

    private final int fromVersion;

    private final int toVersion;

    private boolean success;

    private int stepsExecuted;

    private final List<String> errors = new ArrayList<>();

    private final List<String> warnings = new ArrayList<>();

    private Duration executionTime = Duration.ZERO;

    /** 迁移前备份的ID,没有备份时为null */
    private String backupCreated;

    public MigrationResult(int fromVersion, int toVersion) {
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    public int getFromVersion() {
        return fromVersion;
    }

    public int getToVersion() {
        return toVersion;
    }

    public boolean isSuccess() {
        return success;
    }

    void setSuccess(boolean success) {
        this.success = success;
    }

    public int getStepsExecuted() {
        return stepsExecuted;
    }

    void incrementStepsExecuted() {
        stepsExecuted++;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    void addError(String error) {
        errors.add(error);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    void setExecutionTime(Duration executionTime) {
        this.executionTime = executionTime;
    }

    public String getBackupCreated() {
        return backupCreated;
    }

    void setBackupCreated(String backupCreated) {
        this.backupCreated = backupCreated;
    }

    @Override
    public String toString() {
        return "MigrationResult{" +
                "success=" + success +
                ", fromVersion=" + fromVersion +
                ", toVersion=" + toVersion +
                ", stepsExecuted=" + stepsExecuted +
                ", errors=" + errors +
                ", warnings=" + warnings +
                ", backupCreated='" + backupCreated + '\'' +
                '}';
    }
}

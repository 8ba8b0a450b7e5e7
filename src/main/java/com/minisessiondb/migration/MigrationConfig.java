package com.minisessiondb.migration;

/**
 * 迁移配置
 *
 * 默认值: 迁移前备份、迁移后校验、每步最多尝试3次、失败时回滚、INFO日志级别
 */
public final class MigrationConfig {

    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * 迁移过程日志的最低级别
     */
    public enum LogLevel {
        ERROR, WARN, INFO, DEBUG
    }

    private final boolean enableBackups;

    private final boolean validateAfterMigration;

    private final int maxRetries;

    private final boolean rollbackOnFailure;

    private final LogLevel logLevel;

    private MigrationConfig(Builder builder) {
        this.enableBackups = builder.enableBackups;
        this.validateAfterMigration = builder.validateAfterMigration;
        this.maxRetries = builder.maxRetries;
        this.rollbackOnFailure = builder.rollbackOnFailure;
        this.logLevel = builder.logLevel;
    }

    public static MigrationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnableBackups() {
        return enableBackups;
    }

    public boolean isValidateAfterMigration() {
        return validateAfterMigration;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isRollbackOnFailure() {
        return rollbackOnFailure;
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "enableBackups=" + enableBackups +
                ", validateAfterMigration=" + validateAfterMigration +
                ", maxRetries=" + maxRetries +
                ", rollbackOnFailure=" + rollbackOnFailure +
                ", logLevel=" + logLevel +
                '}';
    }

    public static final class Builder {
        private boolean enableBackups = true;
        private boolean validateAfterMigration = true;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private boolean rollbackOnFailure = true;
        private LogLevel logLevel = LogLevel.INFO;

        private Builder() {
        }

        public Builder enableBackups(boolean enableBackups) {
            this.enableBackups = enableBackups;
            return this;
        }

        public Builder validateAfterMigration(boolean validateAfterMigration) {
            this.validateAfterMigration = validateAfterMigration;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder rollbackOnFailure(boolean rollbackOnFailure) {
            this.rollbackOnFailure = rollbackOnFailure;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            if (logLevel == null) {
                throw new IllegalArgumentException("Log level cannot be null");
            }
            this.logLevel = logLevel;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}

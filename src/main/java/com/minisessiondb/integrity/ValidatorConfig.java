package com.minisessiondb.integrity;

import java.time.Duration;

/**
 * 完整性校验器配置
 *
 * 默认值: 全部检查开启,备份开启,备份间隔24小时,最多保留7个备份。
 */
public final class ValidatorConfig {

    public static final Duration DEFAULT_BACKUP_INTERVAL = Duration.ofHours(24);

    public static final int DEFAULT_MAX_BACKUPS = 7;

    private final boolean enableChecks;

    private final boolean enableBackups;

    private final Duration backupInterval;

    private final int maxBackups;

    private final boolean checksumValidation;

    private final boolean relationshipValidation;

    private final boolean dataConsistencyChecks;

    private ValidatorConfig(Builder builder) {
        this.enableChecks = builder.enableChecks;
        this.enableBackups = builder.enableBackups;
        this.backupInterval = builder.backupInterval;
        this.maxBackups = builder.maxBackups;
        this.checksumValidation = builder.checksumValidation;
        this.relationshipValidation = builder.relationshipValidation;
        this.dataConsistencyChecks = builder.dataConsistencyChecks;
    }

    public static ValidatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enableChecks(enableChecks)
                .enableBackups(enableBackups)
                .backupInterval(backupInterval)
                .maxBackups(maxBackups)
                .checksumValidation(checksumValidation)
                .relationshipValidation(relationshipValidation)
                .dataConsistencyChecks(dataConsistencyChecks);
    }

    /** 总开关,关闭时单条记录校验直接返回有效 */
    public boolean isEnableChecks() {
        return enableChecks;
    }

    public boolean isEnableBackups() {
        return enableBackups;
    }

    public Duration getBackupInterval() {
        return backupInterval;
    }

    public int getMaxBackups() {
        return maxBackups;
    }

    public boolean isChecksumValidation() {
        return checksumValidation;
    }

    public boolean isRelationshipValidation() {
        return relationshipValidation;
    }

    public boolean isDataConsistencyChecks() {
        return dataConsistencyChecks;
    }

    @Override
    public String toString() {
        return "ValidatorConfig{" +
                "enableChecks=" + enableChecks +
                ", enableBackups=" + enableBackups +
                ", backupInterval=" + backupInterval +
                ", maxBackups=" + maxBackups +
                ", checksumValidation=" + checksumValidation +
                ", relationshipValidation=" + relationshipValidation +
                ", dataConsistencyChecks=" + dataConsistencyChecks +
                '}';
    }

    public static final class Builder {
        private boolean enableChecks = true;
        private boolean enableBackups = true;
        private Duration backupInterval = DEFAULT_BACKUP_INTERVAL;
        private int maxBackups = DEFAULT_MAX_BACKUPS;
        private boolean checksumValidation = true;
        private boolean relationshipValidation = true;
        private boolean dataConsistencyChecks = true;

        private Builder() {
        }

        public Builder enableChecks(boolean enableChecks) {
            this.enableChecks = enableChecks;
            return this;
        }

        public Builder enableBackups(boolean enableBackups) {
            this.enableBackups = enableBackups;
            return this;
        }

        public Builder backupInterval(Duration backupInterval) {
            this.backupInterval = backupInterval;
            return this;
        }

        public Builder maxBackups(int maxBackups) {
            if (maxBackups < 1) {
                throw new IllegalArgumentException("maxBackups must be at least 1: " + maxBackups);
            }
            this.maxBackups = maxBackups;
            return this;
        }

        public Builder checksumValidation(boolean checksumValidation) {
            this.checksumValidation = checksumValidation;
            return this;
        }

        public Builder relationshipValidation(boolean relationshipValidation) {
            this.relationshipValidation = relationshipValidation;
            return this;
        }

        public Builder dataConsistencyChecks(boolean dataConsistencyChecks) {
            this.dataConsistencyChecks = dataConsistencyChecks;
            return this;
        }

        public ValidatorConfig build() {
            return new ValidatorConfig(this);
        }
    }
}

package com.minisessiondb.migration;

import com.minisessiondb.storage.UpgradeContext;

/**
 * MigrationStep - 把存储从 version-1 升到 version 的一步
 *
 * execute 必须可重入: 失败后会被重试,已创建的容器要先检查再创建。
 * rollback 与 validate 可选。
 */
public final class MigrationStep {

    /**
     * 在升级上下文中执行的动作
     */
    @FunctionalInterface
    public interface Action {
        void apply(UpgradeContext context) throws Exception;
    }

    /**
     * 结构校验,返回false表示本步的结果不完整
     */
    @FunctionalInterface
    public interface Check {
        boolean test(UpgradeContext context);
    }

    private final int version;

    private final String description;

    private final Action execute;

    private final Action rollback;

    private final Check validate;

    public MigrationStep(int version, String description, Action execute, Action rollback, Check validate) {
        if (version < 1) {
            throw new IllegalArgumentException("Migration step version must be positive: " + version);
        }
        if (execute == null) {
            throw new IllegalArgumentException("Migration step " + version + " has no execute action");
        }
        this.version = version;
        this.description = description;
        this.execute = execute;
        this.rollback = rollback;
        this.validate = validate;
    }

    public MigrationStep(int version, String description, Action execute) {
        this(version, description, execute, null, null);
    }

    public int getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public Action getExecute() {
        return execute;
    }

    public Action getRollback() {
        return rollback;
    }

    public Check getValidate() {
        return validate;
    }

    public boolean hasRollback() {
        return rollback != null;
    }

    @Override
    public String toString() {
        return "MigrationStep{" +
                "version=" + version +
                ", description='" + description + '\'' +
                '}';
    }
}

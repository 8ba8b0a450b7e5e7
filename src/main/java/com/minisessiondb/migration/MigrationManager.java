package com.minisessiondb.migration;

import com.minisessiondb.exception.MigrationFailedException;
import com.minisessiondb.exception.MigrationStepNotFoundException;
import com.minisessiondb.integrity.BackupManifest;
import com.minisessiondb.integrity.DataIntegrityValidator;
import com.minisessiondb.metadata.ContainerDefinition;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.metadata.IndexDefinition;
import com.minisessiondb.metadata.SchemaRegistry;
import com.minisessiondb.storage.RecordStore;
import com.minisessiondb.storage.SchemaEditor;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.Transaction;
import com.minisessiondb.storage.UpgradeContext;
import com.minisessiondb.storage.UpgradeHandler;
import com.minisessiondb.storage.record.DatabaseMetadata;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredTab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * MigrationManager - 版本迁移管理器
 *
 * 作为 {@link UpgradeHandler} 交给 {@link RecordStore#open},存储打开时
 * 持久化版本低于目标版本就会回调这里。
 *
 * 迁移流程:
 * 1. 旧版本 > 0 且开启备份时,先从升级事务中取快照做迁移前备份
 * 2. 按版本号升序执行 old+1..new 的每一步,每步最多尝试 maxRetries 次
 * 3. 某步最终失败: 先回滚该步,再按逆序回滚已完成的各步,然后停止
 * 4. 全部成功后做结构校验和引用检查
 * 5. 全部通过才写入新版本的数据库元数据
 *
 * 失败时 onUpgrade 抛出 {@link MigrationFailedException},存储随之恢复到升级前的状态,
 * 整次迁移要么全部生效要么全不生效。
 *
 * 使用模式:
 * <pre>
 * MigrationManager migrations = new MigrationManager(MigrationConfig.defaults(), validator, clock);
 * int oldVersion = store.open(SchemaRegistry.LATEST_VERSION, migrations);
 * </pre>
 */
public class MigrationManager implements UpgradeHandler {

    private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);

    private final MigrationConfig config;

    /** 用于迁移前备份,可以为null */
    private final DataIntegrityValidator validator;

    private final Clock clock;

    private final TreeMap<Integer, MigrationStep> migrations = new TreeMap<>();

    private volatile MigrationResult lastResult;

    public MigrationManager(MigrationConfig config, DataIntegrityValidator validator, Clock clock) {
        if (config == null || clock == null) {
            throw new IllegalArgumentException("Migration config and clock cannot be null");
        }
        this.config = config;
        this.validator = validator;
        this.clock = clock;
        registerStep(initialSchemaStep());
    }

    public MigrationConfig getConfig() {
        return config;
    }

    /**
     * 注册或替换某个版本的迁移步骤
     */
    public synchronized void registerStep(MigrationStep step) {
        if (step == null) {
            throw new IllegalArgumentException("Migration step cannot be null");
        }
        migrations.put(step.getVersion(), step);
    }

    /**
     * 已注册的迁移步骤,按版本升序
     */
    public synchronized List<MigrationStep> getAvailableMigrations() {
        return new ArrayList<>(migrations.values());
    }

    /**
     * 最近一次迁移的结果,从未迁移返回null
     */
    public MigrationResult getLastResult() {
        return lastResult;
    }

    // ==================== 升级回调 ====================

    @Override
    public void onUpgrade(UpgradeContext context, int oldVersion, int newVersion) {
        MigrationResult result = performMigration(context, oldVersion, newVersion);
        if (!result.isSuccess()) {
            throw new MigrationFailedException(oldVersion, newVersion, result.getErrors());
        }
    }

    /**
     * 执行 oldVersion → newVersion 的迁移
     *
     * 不抛异常,所有失败都记录在结果中。
     */
    public MigrationResult performMigration(UpgradeContext context, int oldVersion, int newVersion) {
        long start = System.nanoTime();
        log(MigrationConfig.LogLevel.INFO, "开始迁移: version " + oldVersion + " -> " + newVersion);
        MigrationResult result = new MigrationResult(oldVersion, newVersion);

        try {
            if (config.isEnableBackups() && oldVersion > 0 && validator != null
                    && validator.getConfig().isEnableBackups()) {
                result.setBackupCreated(createPreMigrationBackup(context, oldVersion));
            }

            List<MigrationStep> steps = getMigrationSteps(oldVersion, newVersion);
            List<MigrationStep> applied = new ArrayList<>();
            for (MigrationStep step : steps) {
                Exception failure = executeWithRetries(context, step);
                if (failure == null) {
                    applied.add(step);
                    result.incrementStepsExecuted();
                    log(MigrationConfig.LogLevel.INFO,
                            "迁移步骤 " + step.getVersion() + " 完成: " + step.getDescription());
                    continue;
                }
                String message = "Migration step " + step.getVersion() + " failed: " + failure.getMessage();
                result.addError(message);
                log(MigrationConfig.LogLevel.ERROR, message);
                if (config.isRollbackOnFailure()) {
                    rollback(context, step, applied, result);
                }
                break;
            }

            if (config.isValidateAfterMigration() && result.getErrors().isEmpty()) {
                validateMigration(context, newVersion, result);
            }

            if (result.getErrors().isEmpty()) {
                updateDatabaseMetadata(context.getTransaction(), oldVersion, newVersion);
                result.setSuccess(true);
                log(MigrationConfig.LogLevel.INFO, "迁移完成,共执行 " + result.getStepsExecuted() + " 步");
            }
        } catch (RuntimeException e) {
            String message = "Migration failed: " + e.getMessage();
            result.addError(message);
            log(MigrationConfig.LogLevel.ERROR, message);
        }

        result.setExecutionTime(Duration.ofNanos(System.nanoTime() - start));
        lastResult = result;
        return result;
    }

    // ==================== 版本信息 ====================

    /**
     * 不打开存储,比较持久化版本与最新版本
     */
    public VersionInfo getVersionInfo(RecordStore store) {
        try {
            int current = store.peekVersion();
            return new VersionInfo(current, SchemaRegistry.LATEST_VERSION,
                    SchemaRegistry.generateMigrationInstructions(current, SchemaRegistry.LATEST_VERSION));
        } catch (RuntimeException e) {
            logger.error("读取存储版本失败: {}", e.getMessage(), e);
            return new VersionInfo(0, SchemaRegistry.LATEST_VERSION, new ArrayList<>());
        }
    }

    public boolean isMigrationNeeded(RecordStore store) {
        return getVersionInfo(store).isMigrationRequired();
    }

    // ==================== 内部方法 ====================

    private synchronized List<MigrationStep> getMigrationSteps(int fromVersion, int toVersion) {
        List<MigrationStep> steps = new ArrayList<>();
        for (int version = fromVersion + 1; version <= toVersion; version++) {
            MigrationStep step = migrations.get(version);
            if (step == null) {
                throw new MigrationStepNotFoundException(version);
            }
            steps.add(step);
        }
        return steps;
    }

    /**
     * @return 最后一次失败的异常,成功返回null
     */
    private Exception executeWithRetries(UpgradeContext context, MigrationStep step) {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= config.getMaxRetries(); attempt++) {
            try {
                step.getExecute().apply(context);
                return null;
            } catch (Exception e) {
                lastFailure = e;
                log(MigrationConfig.LogLevel.WARN, "迁移步骤 " + step.getVersion() + " 第 " + attempt + "/"
                        + config.getMaxRetries() + " 次尝试失败: " + e.getMessage());
            }
        }
        return lastFailure;
    }

    /**
     * 先回滚失败的步骤,再逆序回滚已完成的步骤
     */
    private void rollback(UpgradeContext context, MigrationStep failed, List<MigrationStep> applied,
                          MigrationResult result) {
        List<MigrationStep> chain = new ArrayList<>();
        chain.add(failed);
        for (int i = applied.size() - 1; i >= 0; i--) {
            chain.add(applied.get(i));
        }
        for (MigrationStep step : chain) {
            if (!step.hasRollback()) {
                continue;
            }
            try {
                step.getRollback().apply(context);
                log(MigrationConfig.LogLevel.INFO, "已回滚迁移步骤 " + step.getVersion());
            } catch (Exception e) {
                String message = "Rollback failed for step " + step.getVersion() + ": " + e.getMessage();
                result.addError(message);
                log(MigrationConfig.LogLevel.ERROR, message);
            }
        }
    }

    private String createPreMigrationBackup(UpgradeContext context, int oldVersion) {
        StoreSnapshot snapshot = StoreSnapshot.capture(context.getTransaction(),
                context.getSchemaEditor().getContainerNames());
        BackupManifest manifest = validator.createBackup(snapshot, oldVersion,
                "Pre-migration backup of version " + oldVersion);
        log(MigrationConfig.LogLevel.INFO, "迁移前备份已创建: " + manifest.getId());
        return manifest.getId();
    }

    private void validateMigration(UpgradeContext context, int targetVersion, MigrationResult result) {
        try {
            for (MigrationStep step : getMigrationSteps(0, targetVersion)) {
                if (step.getValidate() != null && !step.getValidate().test(context)) {
                    result.addError("Version " + step.getVersion() + " schema validation failed");
                }
            }
            checkForOrphanedRecords(context, result);
        } catch (RuntimeException e) {
            result.addError("Migration validation failed: " + e.getMessage());
        }
    }

    private void checkForOrphanedRecords(UpgradeContext context, MigrationResult result) {
        SchemaEditor editor = context.getSchemaEditor();
        if (!editor.hasContainer(ContainerType.SESSIONS.getContainerName())
                || !editor.hasContainer(ContainerType.TABS.getContainerName())) {
            return;
        }
        Transaction tx = context.getTransaction();
        Set<String> sessionIds = new HashSet<>();
        for (StoredSession session : tx.getAll(ContainerType.SESSIONS, StoredSession.class)) {
            sessionIds.add(session.getId());
        }
        for (StoredTab tab : tx.getAll(ContainerType.TABS, StoredTab.class)) {
            if (!sessionIds.contains(tab.getSessionId())) {
                result.addWarning("Orphaned tab found: " + tab.getId()
                        + " references non-existent session " + tab.getSessionId());
            }
        }
    }

    /**
     * 写入新版本的元数据,沿用旧版本记录中的计数
     */
    private void updateDatabaseMetadata(Transaction tx, int oldVersion, int newVersion) {
        long now = clock.millis();
        DatabaseMetadata metadata = new DatabaseMetadata(newVersion, now);
        DatabaseMetadata previous = oldVersion > 0
                ? tx.get(ContainerType.METADATA, oldVersion, DatabaseMetadata.class) : null;
        if (previous != null) {
            metadata.setCreatedAt(previous.getCreatedAt());
            metadata.setLastBackup(previous.getLastBackup());
            metadata.setTotalSessions(previous.getTotalSessions());
            metadata.setTotalTabs(previous.getTotalTabs());
            metadata.setTotalNavigationEvents(previous.getTotalNavigationEvents());
            metadata.setStorageSize(previous.getStorageSize());
        }
        tx.put(metadata);
    }

    private void log(MigrationConfig.LogLevel level, String message) {
        if (level.ordinal() > config.getLogLevel().ordinal()) {
            return;
        }
        switch (level) {
            case ERROR:
                logger.error(message);
                break;
            case WARN:
                logger.warn(message);
                break;
            case INFO:
                logger.info(message);
                break;
            default:
                logger.debug(message);
                break;
        }
    }

    // ==================== 版本1: 初始结构 ====================

    private static MigrationStep initialSchemaStep() {
        return new MigrationStep(1,
                "Create initial database schema with sessions, tabs, navigation events, and boundaries",
                MigrationManager::createInitialSchema,
                MigrationManager::dropInitialSchema,
                MigrationManager::validateInitialSchema);
    }

    private static void createInitialSchema(UpgradeContext context) {
        SchemaEditor editor = context.getSchemaEditor();
        for (ContainerDefinition definition : SchemaRegistry.getContainerDefinitions()) {
            if (!editor.hasContainer(definition.getName())) {
                editor.createContainer(definition);
            }
        }
    }

    private static void dropInitialSchema(UpgradeContext context) {
        SchemaEditor editor = context.getSchemaEditor();
        for (ContainerDefinition definition : SchemaRegistry.getContainerDefinitions()) {
            editor.deleteContainer(definition.getName());
        }
    }

    private static boolean validateInitialSchema(UpgradeContext context) {
        SchemaEditor editor = context.getSchemaEditor();
        for (ContainerDefinition definition : SchemaRegistry.getContainerDefinitions()) {
            if (!editor.hasContainer(definition.getName())) {
                logger.error("缺少必需的容器: {}", definition.getName());
                return false;
            }
            Set<String> indexNames = editor.getIndexNames(definition.getName());
            for (IndexDefinition index : definition.getIndexes()) {
                if (!indexNames.contains(index.getName())) {
                    logger.error("缺少必需的索引: {}.{}", definition.getName(), index.getName());
                    return false;
                }
            }
        }
        return true;
    }
}

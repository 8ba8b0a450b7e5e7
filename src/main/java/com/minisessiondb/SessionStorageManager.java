package com.minisessiondb;

import com.minisessiondb.exchange.DataExportImport;
import com.minisessiondb.exchange.ExportFilter;
import com.minisessiondb.exchange.ExportOptions;
import com.minisessiondb.exchange.ExportResult;
import com.minisessiondb.exchange.ImportOptions;
import com.minisessiondb.exchange.ImportResult;
import com.minisessiondb.integrity.BackupManifest;
import com.minisessiondb.integrity.BackupStore;
import com.minisessiondb.integrity.DataIntegrityValidator;
import com.minisessiondb.integrity.EntityType;
import com.minisessiondb.integrity.ErrorType;
import com.minisessiondb.integrity.FileBackupStore;
import com.minisessiondb.integrity.InMemoryBackupStore;
import com.minisessiondb.integrity.ValidationError;
import com.minisessiondb.integrity.ValidationResult;
import com.minisessiondb.integrity.ValidatorConfig;
import com.minisessiondb.migration.MigrationConfig;
import com.minisessiondb.migration.MigrationManager;
import com.minisessiondb.migration.VersionInfo;
import com.minisessiondb.model.NavigationEvent;
import com.minisessiondb.model.Session;
import com.minisessiondb.model.SessionBoundary;
import com.minisessiondb.model.SessionPatch;
import com.minisessiondb.model.Tab;
import com.minisessiondb.model.TabPatch;
import com.minisessiondb.serializer.Crc32cChecksum;
import com.minisessiondb.serializer.SerializerConfig;
import com.minisessiondb.serializer.SessionDataSerializer;
import com.minisessiondb.storage.RecordStore;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.engine.MaintenanceTicker;
import com.minisessiondb.storage.engine.NavigationQuery;
import com.minisessiondb.storage.engine.SessionQuery;
import com.minisessiondb.storage.engine.SessionStorageEngine;
import com.minisessiondb.storage.engine.StorageConfig;
import com.minisessiondb.storage.engine.StorageStats;
import com.minisessiondb.storage.engine.TabQuery;
import com.minisessiondb.storage.record.NavigationEventKey;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredTab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * SessionStorageManager - 会话存储的统一入口
 *
 * 核心功能:
 * 1. 组装序列化器、存储引擎、完整性校验器、迁移管理器和导入导出
 * 2. 对外以领域对象(Session、Tab...)提供CRUD和查询
 * 3. 整库校验与自动修正、备份管理、导入导出
 * 4. 周期维护任务: 过期清理、完整性扫描、定期备份
 *
 * 设计原则:
 * - 显式构造,不是全局单例;调用方负责关闭
 * - 校验、修正和备份在单独的维护线程上执行,可以安全地等待存储引擎的future
 * - 维护任务由调用方驱动 {@link #maintenanceTicker()} 的 tick,不启动后台定时器
 *
 * 使用模式:
 * <pre>
 * try (SessionStorageManager manager = SessionStorageManager.create(StorageConfig.load())) {
 *     manager.initialize().join();
 *     manager.createSession(session).join();
 *     ValidationResult result = manager.validateIntegrity(true).join();
 * }
 * </pre>
 */
public class SessionStorageManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionStorageManager.class);

    public static final String TASK_STALE_CLEANUP = "stale-cleanup";

    public static final String TASK_INTEGRITY_SWEEP = "integrity-sweep";

    public static final String TASK_PERIODIC_BACKUP = "periodic-backup";

    static final Duration STALE_CLEANUP_INTERVAL = Duration.ofHours(1);

    static final Duration INTEGRITY_SWEEP_INTERVAL = Duration.ofHours(6);

    private static final String BACKUP_DIR_NAME = "backups";

    private final SessionDataSerializer serializer;

    private final SessionStorageEngine engine;

    private final DataIntegrityValidator validator;

    private final MigrationManager migrationManager;

    private final DataExportImport exchange;

    private final MaintenanceTicker ticker = new MaintenanceTicker();

    private final ExecutorService maintenanceExecutor;

    private final Clock clock;

    public SessionStorageManager(StorageConfig storageConfig, ValidatorConfig validatorConfig,
                                 MigrationConfig migrationConfig, RecordStore store, BackupStore backupStore,
                                 Clock clock) {
        this.clock = clock;
        this.serializer = new SessionDataSerializer(
                SerializerConfig.builder().enableCompression(storageConfig.isEnableCompression()).build(),
                new Crc32cChecksum(), clock);
        this.validator = new DataIntegrityValidator(validatorConfig, serializer, backupStore, clock);
        this.migrationManager = new MigrationManager(migrationConfig, validator, clock);
        this.engine = new SessionStorageEngine(storageConfig, store, serializer, migrationManager, clock);
        this.exchange = new DataExportImport(engine, validator, serializer.getChecksums(), clock);
        this.maintenanceExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sessiondb-maintenance");
            t.setDaemon(true);
            return t;
        });

        registerCorrectionHandlers();
        registerMaintenanceTasks(validatorConfig);
    }

    /**
     * 按配置创建: 配置了dataDir时数据和备份都落盘(备份在 dataDir/backups),否则全部在内存
     */
    public static SessionStorageManager create(StorageConfig config) {
        BackupStore backupStore = config.getDataDir() != null
                ? new FileBackupStore(config.getDataDir().resolve(BACKUP_DIR_NAME))
                : new InMemoryBackupStore();
        return new SessionStorageManager(config, ValidatorConfig.defaults(), MigrationConfig.defaults(),
                SessionStorageEngine.newRecordStore(config), backupStore, Clock.systemUTC());
    }

    public CompletableFuture<Void> initialize() {
        return engine.initialize();
    }

    public SessionStorageEngine getEngine() {
        return engine;
    }

    public DataIntegrityValidator getValidator() {
        return validator;
    }

    public MigrationManager getMigrationManager() {
        return migrationManager;
    }

    public MaintenanceTicker maintenanceTicker() {
        return ticker;
    }

    // ==================== 会话 ====================

    public CompletableFuture<Session> createSession(Session session) {
        return engine.createSession(session).thenApply(serializer::deserializeSession);
    }

    public CompletableFuture<Optional<Session>> getSession(String sessionId) {
        return engine.getSession(sessionId).thenApply(found -> found.map(serializer::deserializeSession));
    }

    public CompletableFuture<Session> updateSession(String sessionId, SessionPatch patch) {
        return engine.updateSession(sessionId, patch).thenApply(serializer::deserializeSession);
    }

    public CompletableFuture<Void> deleteSession(String sessionId) {
        return engine.deleteSession(sessionId);
    }

    public CompletableFuture<List<Session>> querySessions(SessionQuery query) {
        return engine.querySessions(query).thenApply(serializer::deserializeSessions);
    }

    // ==================== 标签页 ====================

    public CompletableFuture<Tab> createTab(Tab tab, String sessionId) {
        return engine.createTab(tab, sessionId).thenApply(serializer::deserializeTab);
    }

    public CompletableFuture<Optional<Tab>> getTab(int tabId) {
        return engine.getTab(tabId).thenApply(found -> found.map(serializer::deserializeTab));
    }

    public CompletableFuture<Tab> updateTab(int tabId, TabPatch patch) {
        return engine.updateTab(tabId, patch).thenApply(serializer::deserializeTab);
    }

    public CompletableFuture<Void> deleteTab(int tabId) {
        return engine.deleteTab(tabId);
    }

    public CompletableFuture<List<Tab>> queryTabs(TabQuery query) {
        return engine.queryTabs(query).thenApply(stored -> {
            List<Tab> tabs = new ArrayList<>(stored.size());
            for (StoredTab tab : stored) {
                tabs.add(serializer.deserializeTab(tab));
            }
            return tabs;
        });
    }

    // ==================== 导航事件 ====================

    public CompletableFuture<NavigationEvent> createNavigationEvent(NavigationEvent event, String sessionId) {
        return engine.createNavigationEvent(event, sessionId).thenApply(serializer::deserializeNavigationEvent);
    }

    public CompletableFuture<Optional<NavigationEvent>> getNavigationEvent(int tabId, long timestamp) {
        return engine.getNavigationEvent(tabId, timestamp)
                .thenApply(found -> found.map(serializer::deserializeNavigationEvent));
    }

    public CompletableFuture<Void> deleteNavigationEvent(int tabId, long timestamp) {
        return engine.deleteNavigationEvent(tabId, timestamp);
    }

    public CompletableFuture<List<NavigationEvent>> queryNavigationEvents(NavigationQuery query) {
        return engine.queryNavigationEvents(query).thenApply(stored -> {
            List<NavigationEvent> events = new ArrayList<>(stored.size());
            for (StoredNavigationEvent event : stored) {
                events.add(serializer.deserializeNavigationEvent(event));
            }
            return events;
        });
    }

    // ==================== 会话边界 ====================

    public CompletableFuture<SessionBoundary> createSessionBoundary(SessionBoundary boundary) {
        return engine.createSessionBoundary(boundary).thenApply(serializer::deserializeSessionBoundary);
    }

    public CompletableFuture<Optional<SessionBoundary>> getSessionBoundary(String boundaryId) {
        return engine.getSessionBoundary(boundaryId)
                .thenApply(found -> found.map(serializer::deserializeSessionBoundary));
    }

    public CompletableFuture<List<SessionBoundary>> getSessionBoundaries(String sessionId) {
        return engine.getSessionBoundaries(sessionId).thenApply(stored -> {
            List<SessionBoundary> boundaries = new ArrayList<>(stored.size());
            stored.forEach(b -> boundaries.add(serializer.deserializeSessionBoundary(b)));
            return boundaries;
        });
    }

    public CompletableFuture<Void> deleteSessionBoundary(String boundaryId) {
        return engine.deleteSessionBoundary(boundaryId);
    }

    // ==================== 完整性 ====================

    /**
     * 整库校验,autoCorrect为true时尝试修正可修正的错误
     *
     * 返回结果中的errors是修正后仍然存在的错误,correctedItems是修正成功的数量。
     */
    public CompletableFuture<ValidationResult> validateIntegrity(boolean autoCorrect) {
        return engine.initialize().thenApplyAsync(v -> doValidateIntegrity(autoCorrect), maintenanceExecutor);
    }

    ValidationResult doValidateIntegrity(boolean autoCorrect) {
        StoreSnapshot snapshot = engine.exportAll().join();
        ValidationResult result = validator.validateStore(snapshot);
        if (!autoCorrect || result.isValid()) {
            return result;
        }
        long start = System.nanoTime();
        List<ValidationError> remaining = validator.autoCorrectErrors(result.getErrors());
        ValidationResult corrected = result.afterCorrection(remaining, Duration.ofNanos(System.nanoTime() - start));
        logger.info("自动修正完成: 修正 {} 个, 剩余 {} 个错误",
                result.getErrors().size() - remaining.size(), remaining.size());
        return corrected;
    }

    private void registerCorrectionHandlers() {
        validator.registerCorrectionHandler(ErrorType.CHECKSUM_MISMATCH, error ->
                engine.repairChecksum(error.getEntityType().getContainerType(), storageKey(error)).join());

        validator.registerCorrectionHandler(ErrorType.MISSING_REFERENCE, error -> {
            if (error.getEntityType() != EntityType.NAVIGATION_EVENT) {
                throw new IllegalStateException("Only navigation event references can be repaired: " + error);
            }
            NavigationEventKey key = (NavigationEventKey) storageKey(error);
            StoredTab tab = engine.getTab(key.getTabId()).join()
                    .orElseThrow(() -> new IllegalStateException("Tab " + key.getTabId() + " no longer exists"));
            if (engine.getSession(tab.getSessionId()).join().isEmpty()) {
                throw new IllegalStateException("Tab " + tab.getId() + " belongs to missing session "
                        + tab.getSessionId());
            }
            engine.reassignNavigationEvent(key.getTabId(), key.getTimestamp(), tab.getSessionId()).join();
        });
    }

    /**
     * 把校验错误中的实体ID转成容器主键
     */
    static Object storageKey(ValidationError error) {
        Object id = error.getEntityId();
        switch (error.getEntityType()) {
            case TAB:
                return id instanceof Number ? ((Number) id).intValue() : Integer.valueOf(String.valueOf(id));
            case NAVIGATION_EVENT:
                return NavigationEventKey.parse(String.valueOf(id));
            default:
                return String.valueOf(id);
        }
    }

    // ==================== 备份 ====================

    public CompletableFuture<BackupManifest> createBackup() {
        return createBackup(DataIntegrityValidator.DEFAULT_BACKUP_DESCRIPTION);
    }

    /**
     * @throws com.minisessiondb.exception.BackupsDisabledException 备份被关闭(包装在CompletionException中)
     */
    public CompletableFuture<BackupManifest> createBackup(String description) {
        return engine.initialize().thenApplyAsync(v -> doCreateBackup(description), maintenanceExecutor);
    }

    BackupManifest doCreateBackup(String description) {
        StoreSnapshot snapshot = engine.exportAll().join();
        BackupManifest manifest = validator.createBackup(snapshot, engine.getStore().getVersion(), description);
        engine.recordBackup(manifest.getTimestamp()).join();
        return manifest;
    }

    public CompletableFuture<List<BackupManifest>> listBackups() {
        return CompletableFuture.supplyAsync(validator::listBackups, maintenanceExecutor);
    }

    /**
     * 读取并校验备份,不写入存储
     */
    public CompletableFuture<StoreSnapshot> restoreFromBackup(String backupId) {
        return CompletableFuture.supplyAsync(() -> validator.restoreFromBackup(backupId), maintenanceExecutor);
    }

    /**
     * 清空存储后写回备份中的全部记录
     *
     * @return 写入的记录数
     */
    public CompletableFuture<Integer> restoreBackupIntoStore(String backupId) {
        return restoreFromBackup(backupId).thenCompose(snapshot -> engine.clearAllData()
                .thenCompose(v -> engine.importRecords(snapshot, true))
                .thenApply(written -> {
                    logger.info("已从备份 {} 恢复 {} 条记录", backupId, written);
                    return written;
                }));
    }

    public CompletableFuture<Void> deleteBackup(String backupId) {
        return CompletableFuture.runAsync(() -> validator.deleteBackup(backupId), maintenanceExecutor);
    }

    // ==================== 导入导出 ====================

    public CompletableFuture<ExportResult> exportData(ExportOptions options, ExportFilter filter) {
        return exchange.exportData(options, filter);
    }

    public CompletableFuture<ImportResult> importData(String json, ImportOptions options) {
        return exchange.importData(json, options);
    }

    // ==================== 其他 ====================

    public VersionInfo getVersionInfo() {
        return migrationManager.getVersionInfo(engine.getStore());
    }

    public CompletableFuture<StorageStats> getStorageStats() {
        return engine.getStorageStats();
    }

    public CompletableFuture<Void> clearAllData() {
        return engine.clearAllData();
    }

    /**
     * 执行到期的维护任务
     *
     * 在调用方线程上同步执行,不要在维护线程上调用。
     *
     * @return 本次执行的任务名
     */
    public List<String> runMaintenanceTick() {
        return ticker.tick(clock.millis());
    }

    private void registerMaintenanceTasks(ValidatorConfig validatorConfig) {
        ticker.register(TASK_STALE_CLEANUP, STALE_CLEANUP_INTERVAL, now -> engine.cleanupOldData().join());
        ticker.register(TASK_INTEGRITY_SWEEP, INTEGRITY_SWEEP_INTERVAL, now -> {
            ValidationResult result = doValidateIntegrity(true);
            if (!result.isValid()) {
                logger.warn("完整性扫描后仍有 {} 个错误", result.getErrors().size());
            }
        });
        ticker.register(TASK_PERIODIC_BACKUP, validatorConfig.getBackupInterval(), now -> {
            if (validator.shouldCreateBackup(now)) {
                doCreateBackup(DataIntegrityValidator.DEFAULT_BACKUP_DESCRIPTION);
            }
        });
    }

    /**
     * 关闭存储引擎。之后可以再次initialize()
     */
    public CompletableFuture<Void> shutdown() {
        return engine.shutdown();
    }

    @Override
    public void close() {
        try {
            engine.close();
        } finally {
            maintenanceExecutor.shutdown();
        }
        logger.info("SessionStorageManager 已关闭");
    }
}

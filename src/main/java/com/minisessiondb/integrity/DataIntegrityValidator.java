package com.minisessiondb.integrity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.common.UrlUtils;
import com.minisessiondb.exception.BackupCorruptedException;
import com.minisessiondb.exception.BackupNotFoundException;
import com.minisessiondb.exception.BackupsDisabledException;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.model.Tab;
import com.minisessiondb.serializer.SessionDataSerializer;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredSessionBoundary;
import com.minisessiondb.storage.record.StoredTab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * DataIntegrityValidator - 数据完整性校验器
 *
 * 核心功能:
 * 1. 单条记录校验: 校验和、结构规则、会话内部一致性
 * 2. 关系校验: 孤立标签页、导航事件引用的会话/标签页是否存在、标签页计数漂移
 * 3. 备份: 创建、列出、恢复(校验负载校验和)、删除、按数量保留
 * 4. 自动修正: 按错误类型分派给注册的 {@link CorrectionHandler}
 *
 * 设计原则:
 * - 校验器只读数据,不直接访问存储;修正通过处理器回写
 * - 错误影响有效性,警告不影响
 * - 结构规则总是执行,校验和、一致性和关系检查各有开关
 *
 * 使用模式:
 * <pre>
 * DataIntegrityValidator validator = new DataIntegrityValidator(config, serializer, backupStore, clock);
 * validator.registerCorrectionHandler(ErrorType.CHECKSUM_MISMATCH, error -> engine.repair(...));
 * ValidationResult result = validator.validateStore(snapshot);
 * List&lt;ValidationError&gt; remaining = validator.autoCorrectErrors(result.getErrors());
 * </pre>
 */
public class DataIntegrityValidator {

    private static final Logger logger = LoggerFactory.getLogger(DataIntegrityValidator.class);

    public static final String DEFAULT_BACKUP_DESCRIPTION = "Automatic backup";

    private static final String BACKUP_ID_PREFIX = "backup_";

    private final ValidatorConfig config;

    private final SessionDataSerializer serializer;

    private final BackupStore backupStore;

    private final Clock clock;

    private final ObjectMapper mapper = ObjectMappers.standard();

    private final Map<ErrorType, CorrectionHandler> correctionHandlers = new EnumMap<>(ErrorType.class);

    /** 最近一次备份时间,首次使用时从备份清单中取最新值 */
    private Long lastBackupTime;

    public DataIntegrityValidator(ValidatorConfig config, SessionDataSerializer serializer,
                                  BackupStore backupStore, Clock clock) {
        if (config == null || serializer == null || backupStore == null || clock == null) {
            throw new IllegalArgumentException("Validator dependencies cannot be null");
        }
        this.config = config;
        this.serializer = serializer;
        this.backupStore = backupStore;
        this.clock = clock;
    }

    public ValidatorConfig getConfig() {
        return config;
    }

    public BackupStore getBackupStore() {
        return backupStore;
    }

    // ==================== 单条记录校验 ====================

    public ValidationResult validateSession(StoredSession session) {
        long start = System.nanoTime();
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (!config.isEnableChecks()) {
            return finish(errors, warnings, start);
        }

        if (config.isChecksumValidation()) {
            addChecksumError(session, EntityType.SESSION, session.getId(), errors);
        }

        String id = session.getId();
        if (isBlank(id)) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.SESSION, id,
                    "Session missing required field: id", false));
        }
        if (isBlank(session.getTag())) {
            errors.add(schemaError(Severity.HIGH, EntityType.SESSION, id,
                    "Session missing required field: tag", false));
        }
        if (session.getCreatedAt() <= 0) {
            errors.add(schemaError(Severity.HIGH, EntityType.SESSION, id,
                    "Session has invalid createdAt timestamp", true));
        }
        if (session.getUpdatedAt() <= 0) {
            warnings.add(new ValidationWarning(WarningType.MISSING_METADATA, EntityType.SESSION, id,
                    "Session has invalid updatedAt timestamp"));
        }
        if (session.getCreatedAt() > 0 && session.getUpdatedAt() > 0
                && session.getCreatedAt() > session.getUpdatedAt()) {
            warnings.add(new ValidationWarning(WarningType.INCONSISTENT_TIMESTAMP, EntityType.SESSION, id,
                    "Session createdAt is after updatedAt"));
        }
        if (session.getTabs() == null && !session.isCompressed()) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.SESSION, id,
                    "Session tabs field must be an array", false));
        }
        if (session.getWindowIds() == null) {
            errors.add(schemaError(Severity.MEDIUM, EntityType.SESSION, id,
                    "Session windowIds field must be an array", true));
        }

        if (config.isDataConsistencyChecks()) {
            checkSessionConsistency(session, warnings);
        }
        return finish(errors, warnings, start);
    }

    public ValidationResult validateTab(StoredTab tab) {
        long start = System.nanoTime();
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (!config.isEnableChecks()) {
            return finish(errors, warnings, start);
        }

        Integer id = tab.getId();
        if (config.isChecksumValidation()) {
            addChecksumError(tab, EntityType.TAB, id, errors);
        }
        if (id == null || id <= 0) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.TAB, id, "Tab has invalid id", false));
        }
        if (isBlank(tab.getUrl())) {
            errors.add(schemaError(Severity.HIGH, EntityType.TAB, id, "Tab missing required field: url", false));
        }
        if (isBlank(tab.getSessionId())) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.TAB, id,
                    "Tab missing required field: sessionId", false));
        }
        if (tab.getWindowId() <= 0) {
            errors.add(schemaError(Severity.HIGH, EntityType.TAB, id, "Tab has invalid windowId", false));
        }
        if (!isBlank(tab.getUrl()) && !UrlUtils.isValidUrl(tab.getUrl())) {
            warnings.add(new ValidationWarning(WarningType.MISSING_METADATA, EntityType.TAB, id,
                    "Tab has invalid URL format"));
        }
        if (tab.getCreatedAt() <= 0) {
            errors.add(schemaError(Severity.MEDIUM, EntityType.TAB, id,
                    "Tab has invalid createdAt timestamp", true));
        }
        if (tab.getCreatedAt() > 0 && tab.getLastAccessed() > 0 && tab.getCreatedAt() > tab.getLastAccessed()) {
            warnings.add(new ValidationWarning(WarningType.INCONSISTENT_TIMESTAMP, EntityType.TAB, id,
                    "Tab createdAt is after lastAccessed"));
        }
        return finish(errors, warnings, start);
    }

    public ValidationResult validateNavigationEvent(StoredNavigationEvent event) {
        long start = System.nanoTime();
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (!config.isEnableChecks()) {
            return finish(errors, warnings, start);
        }

        String id = eventId(event);
        if (config.isChecksumValidation()) {
            addChecksumError(event, EntityType.NAVIGATION_EVENT, id, errors);
        }
        if (event.getTabId() == null || event.getTabId() <= 0) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.NAVIGATION_EVENT, id,
                    "Navigation event has invalid tabId", false));
        }
        if (isBlank(event.getUrl())) {
            errors.add(schemaError(Severity.HIGH, EntityType.NAVIGATION_EVENT, id,
                    "Navigation event missing required field: url", false));
        }
        if (event.getTimestamp() == null || event.getTimestamp() <= 0) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.NAVIGATION_EVENT, id,
                    "Navigation event has invalid timestamp", false));
        }
        if (isBlank(event.getSessionId())) {
            errors.add(schemaError(Severity.HIGH, EntityType.NAVIGATION_EVENT, id,
                    "Navigation event missing required field: sessionId", true));
        }
        if (!isBlank(event.getUrl()) && !UrlUtils.isValidUrl(event.getUrl())) {
            warnings.add(new ValidationWarning(WarningType.MISSING_METADATA, EntityType.NAVIGATION_EVENT, id,
                    "Navigation event has invalid URL format"));
        }
        return finish(errors, warnings, start);
    }

    public ValidationResult validateSessionBoundary(StoredSessionBoundary boundary) {
        long start = System.nanoTime();
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (!config.isEnableChecks()) {
            return finish(errors, warnings, start);
        }

        String id = boundary.getId();
        if (config.isChecksumValidation()) {
            addChecksumError(boundary, EntityType.BOUNDARY, id, errors);
        }
        if (isBlank(id)) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.BOUNDARY, id,
                    "Session boundary missing required field: id", false));
        }
        if (isBlank(boundary.getSessionId())) {
            errors.add(schemaError(Severity.CRITICAL, EntityType.BOUNDARY, id,
                    "Session boundary missing required field: sessionId", false));
        }
        if (boundary.getType() == null) {
            errors.add(schemaError(Severity.HIGH, EntityType.BOUNDARY, id,
                    "Session boundary missing required field: type", false));
        }
        if (boundary.getReason() == null) {
            errors.add(schemaError(Severity.HIGH, EntityType.BOUNDARY, id,
                    "Session boundary missing required field: reason", false));
        }
        if (boundary.getTimestamp() <= 0) {
            errors.add(schemaError(Severity.HIGH, EntityType.BOUNDARY, id,
                    "Session boundary has invalid timestamp", false));
        }
        return finish(errors, warnings, start);
    }

    // ==================== 关系校验 ====================

    /**
     * 跨容器引用检查
     *
     * 标签页引用的会话不存在是不可自动修正的错误;
     * 导航事件引用的会话不存在可以修正(改挂到其标签页所属会话);
     * 导航事件引用的标签页不存在只是警告。
     */
    public ValidationResult validateRelationships(Collection<StoredSession> sessions,
                                                  Collection<StoredTab> tabs,
                                                  Collection<StoredNavigationEvent> events) {
        long start = System.nanoTime();
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (!config.isEnableChecks() || !config.isRelationshipValidation()) {
            return finish(errors, warnings, start);
        }

        Set<String> sessionIds = new HashSet<>();
        for (StoredSession session : sessions) {
            sessionIds.add(session.getId());
        }
        Set<Integer> tabIds = new HashSet<>();
        Map<String, Integer> tabsPerSession = new HashMap<>();
        for (StoredTab tab : tabs) {
            tabIds.add(tab.getId());
            tabsPerSession.merge(tab.getSessionId(), 1, Integer::sum);
        }

        for (StoredTab tab : tabs) {
            if (!sessionIds.contains(tab.getSessionId())) {
                errors.add(new ValidationError(ErrorType.MISSING_REFERENCE, Severity.HIGH, EntityType.TAB,
                        tab.getId(), "Tab " + tab.getId() + " references non-existent session " + tab.getSessionId(),
                        false));
            }
        }

        for (StoredNavigationEvent event : events) {
            String id = eventId(event);
            if (!sessionIds.contains(event.getSessionId())) {
                errors.add(new ValidationError(ErrorType.MISSING_REFERENCE, Severity.MEDIUM,
                        EntityType.NAVIGATION_EVENT, id,
                        "Navigation event references non-existent session " + event.getSessionId(), true));
            }
            if (!tabIds.contains(event.getTabId())) {
                warnings.add(new ValidationWarning(WarningType.ORPHANED_DATA, EntityType.NAVIGATION_EVENT, id,
                        "Navigation event references non-existent tab " + event.getTabId()));
            }
        }

        for (StoredSession session : sessions) {
            int actual = tabsPerSession.getOrDefault(session.getId(), 0);
            if (session.getTotalTabCount() != actual) {
                warnings.add(new ValidationWarning(WarningType.INCONSISTENT_TIMESTAMP, EntityType.SESSION,
                        session.getId(), "Session tab count mismatch: expected " + session.getTotalTabCount()
                        + ", actual " + actual));
            }
        }
        return finish(errors, warnings, start);
    }

    /**
     * 整库校验: 每条记录加关系检查
     */
    public ValidationResult validateStore(StoreSnapshot snapshot) {
        List<ValidationResult> results = new ArrayList<>();
        for (StoredSession session : snapshot.getSessions()) {
            results.add(validateSession(session));
        }
        for (StoredTab tab : snapshot.getTabs()) {
            results.add(validateTab(tab));
        }
        for (StoredNavigationEvent event : snapshot.getNavigationEvents()) {
            results.add(validateNavigationEvent(event));
        }
        for (StoredSessionBoundary boundary : snapshot.getBoundaries()) {
            results.add(validateSessionBoundary(boundary));
        }
        results.add(validateRelationships(snapshot.getSessions(), snapshot.getTabs(),
                snapshot.getNavigationEvents()));
        ValidationResult merged = ValidationResult.merge(results);
        logger.info("整库校验完成: {} 条记录, {} 个错误, {} 个警告",
                snapshot.totalItems() - snapshot.getMetadata().size(),
                merged.getErrors().size(), merged.getWarnings().size());
        return merged;
    }

    // ==================== 备份 ====================

    public BackupManifest createBackup(StoreSnapshot snapshot, int schemaVersion) {
        return createBackup(snapshot, schemaVersion, DEFAULT_BACKUP_DESCRIPTION);
    }

    /**
     * 保存快照并按 maxBackups 清理最旧的备份
     *
     * @throws BackupsDisabledException 备份被配置关闭
     */
    public synchronized BackupManifest createBackup(StoreSnapshot snapshot, int schemaVersion, String description) {
        if (!config.isEnableBackups()) {
            throw new BackupsDisabledException();
        }

        // 时间戳严格递增,同一毫秒内的多次备份也能按时间排序
        long timestamp = Math.max(clock.millis(), lastBackupTime() + 1);

        BackupManifest manifest = new BackupManifest();
        manifest.setId(BACKUP_ID_PREFIX + timestamp + "_" + randomSuffix());
        manifest.setTimestamp(timestamp);
        manifest.setVersion(schemaVersion);
        manifest.setDescription(description);
        manifest.setSize(jsonSize(snapshot));
        Map<String, Integer> counts = snapshot.itemCounts();
        manifest.setItemCounts(counts);
        manifest.setChecksum(serializer.getChecksums().of(snapshot));
        manifest.setChecksumAlgorithm(serializer.getChecksums().getAlgorithm().getName());
        manifest.setValid(true);

        backupStore.save(manifest, snapshot);
        lastBackupTime = timestamp;
        logger.info("已创建备份 {} ({} KB, {} 条记录)", manifest.getId(),
                String.format("%.2f", manifest.getSize() / 1024.0), snapshot.totalItems());

        cleanupOldBackups();
        return manifest;
    }

    /**
     * 全部备份,最新的在前
     */
    public List<BackupManifest> listBackups() {
        List<BackupManifest> manifests = backupStore.listManifests();
        manifests.sort(Comparator.comparingLong(BackupManifest::getTimestamp)
                .thenComparing(BackupManifest::getId)
                .reversed());
        return manifests;
    }

    /**
     * 读取备份快照并校验负载
     *
     * @throws BackupNotFoundException  备份不存在
     * @throws BackupCorruptedException 负载校验和与清单不一致
     */
    public StoreSnapshot restoreFromBackup(String backupId) {
        BackupManifest manifest = backupStore.loadManifest(backupId)
                .orElseThrow(() -> new BackupNotFoundException(backupId));
        StoreSnapshot snapshot = backupStore.loadData(backupId)
                .orElseThrow(() -> new BackupNotFoundException(backupId));

        String actual = serializer.getChecksums().of(snapshot);
        if (manifest.getChecksum() != null && !manifest.getChecksum().equals(actual)) {
            logger.error("备份 {} 校验失败: 期望 {}, 实际 {}", backupId, manifest.getChecksum(), actual);
            throw new BackupCorruptedException(backupId, manifest.getChecksum(), actual);
        }
        logger.info("已读取备份 {}: {}", backupId, snapshot.itemCounts());
        return snapshot;
    }

    /**
     * @throws BackupNotFoundException 备份不存在
     */
    public synchronized void deleteBackup(String backupId) {
        if (!backupStore.delete(backupId)) {
            throw new BackupNotFoundException(backupId);
        }
        logger.info("已删除备份 {}", backupId);
    }

    public boolean shouldCreateBackup(long now) {
        if (!config.isEnableBackups()) {
            return false;
        }
        return now - lastBackupTime() >= config.getBackupInterval().toMillis();
    }

    /**
     * @return 最近一次备份时间,从未备份返回0
     */
    public synchronized long lastBackupTime() {
        if (lastBackupTime == null) {
            long newest = 0;
            for (BackupManifest manifest : backupStore.listManifests()) {
                newest = Math.max(newest, manifest.getTimestamp());
            }
            lastBackupTime = newest;
        }
        return lastBackupTime;
    }

    private void cleanupOldBackups() {
        List<BackupManifest> backups = listBackups();
        if (backups.size() <= config.getMaxBackups()) {
            return;
        }
        List<BackupManifest> toDelete = backups.subList(config.getMaxBackups(), backups.size());
        for (BackupManifest backup : toDelete) {
            backupStore.delete(backup.getId());
        }
        logger.info("清理了 {} 个旧备份", toDelete.size());
    }

    // ==================== 自动修正 ====================

    public void registerCorrectionHandler(ErrorType type, CorrectionHandler handler) {
        if (type == null || handler == null) {
            throw new IllegalArgumentException("Error type and handler cannot be null");
        }
        synchronized (correctionHandlers) {
            correctionHandlers.put(type, handler);
        }
    }

    /**
     * 尝试修正错误
     *
     * @return 未能修正的错误: 不可自动修正的、没有处理器的、处理器失败的
     */
    public List<ValidationError> autoCorrectErrors(List<ValidationError> errors) {
        List<ValidationError> uncorrected = new ArrayList<>();
        for (ValidationError error : errors) {
            if (!error.isCanAutoCorrect()) {
                uncorrected.add(error);
                continue;
            }
            CorrectionHandler handler;
            synchronized (correctionHandlers) {
                handler = correctionHandlers.get(error.getType());
            }
            if (handler == null) {
                logger.debug("没有 {} 类型的修正处理器: {}", error.getType().getWireName(), error.getMessage());
                uncorrected.add(error);
                continue;
            }
            try {
                handler.correct(error);
                logger.info("已自动修正: {}", error.getMessage());
            } catch (Exception e) {
                logger.warn("自动修正失败: {} ({})", error.getMessage(), e.getMessage());
                uncorrected.add(error);
            }
        }
        return uncorrected;
    }

    // ==================== 内部方法 ====================

    private void checkSessionConsistency(StoredSession session, List<ValidationWarning> warnings) {
        List<Tab> tabs;
        try {
            tabs = serializer.sessionTabs(session);
        } catch (StorageException e) {
            // 负载损坏已由校验和检查报告
            return;
        }

        Set<String> actualDomains = new HashSet<>();
        for (Tab tab : tabs) {
            String domain = UrlUtils.extractDomain(tab.getUrl());
            if (domain != null) {
                actualDomains.add(domain);
            }
        }
        Set<String> storedDomains = session.getDomains() == null
                ? Collections.emptySet() : new HashSet<>(session.getDomains());
        if (actualDomains.size() != storedDomains.size()) {
            warnings.add(new ValidationWarning(WarningType.INCONSISTENT_TIMESTAMP, EntityType.SESSION,
                    session.getId(), "Session domains array does not match tab URLs"));
        }
        if (session.getTotalTabCount() != tabs.size()) {
            warnings.add(new ValidationWarning(WarningType.INCONSISTENT_TIMESTAMP, EntityType.SESSION,
                    session.getId(), "Session totalTabCount mismatch: expected " + session.getTotalTabCount()
                    + ", actual " + tabs.size()));
        }
    }

    private void addChecksumError(StoredRecord record, EntityType entityType, Object entityId,
                                  List<ValidationError> errors) {
        try {
            String expected = serializer.computeChecksum(record);
            String actual = SessionDataSerializer.storedChecksum(record);
            if (expected != null && !expected.equals(actual)) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("expected", expected);
                details.put("actual", actual);
                errors.add(new ValidationError(ErrorType.CHECKSUM_MISMATCH, Severity.HIGH, entityType, entityId,
                        "Checksum mismatch detected for " + entityType.getWireName(), details, true));
            }
        } catch (RuntimeException e) {
            errors.add(new ValidationError(ErrorType.DATA_CORRUPTION, Severity.CRITICAL, entityType, entityId,
                    "Failed to validate checksum for " + entityType.getWireName() + ": " + e.getMessage(), false));
        }
    }

    private static ValidationError schemaError(Severity severity, EntityType entityType, Object entityId,
                                               String message, boolean canAutoCorrect) {
        return new ValidationError(ErrorType.SCHEMA_VIOLATION, severity, entityType, entityId, message,
                canAutoCorrect);
    }

    private static ValidationResult finish(List<ValidationError> errors, List<ValidationWarning> warnings,
                                           long startNanos) {
        return new ValidationResult(errors, warnings, 0, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private static String eventId(StoredNavigationEvent event) {
        return event.getTabId() + "_" + event.getTimestamp();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private long jsonSize(StoreSnapshot snapshot) {
        try {
            return mapper.writeValueAsBytes(snapshot).length;
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize backup snapshot", e);
        }
    }

    private static String randomSuffix() {
        StringBuilder sb = new StringBuilder(6);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 6; i++) {
            sb.append(Character.forDigit(random.nextInt(36), 36));
        }
        return sb.toString();
    }
}

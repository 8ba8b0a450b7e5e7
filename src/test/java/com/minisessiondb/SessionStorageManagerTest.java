package com.minisessiondb;

import com.minisessiondb.exception.BackupNotFoundException;
import com.minisessiondb.exception.BackupsDisabledException;
import com.minisessiondb.exception.RecordNotFoundException;
import com.minisessiondb.integrity.BackupManifest;
import com.minisessiondb.integrity.EntityType;
import com.minisessiondb.integrity.ErrorType;
import com.minisessiondb.integrity.InMemoryBackupStore;
import com.minisessiondb.integrity.Severity;
import com.minisessiondb.integrity.ValidationError;
import com.minisessiondb.integrity.ValidationResult;
import com.minisessiondb.integrity.ValidatorConfig;
import com.minisessiondb.migration.MigrationConfig;
import com.minisessiondb.migration.VersionInfo;
import com.minisessiondb.model.NavigationEvent;
import com.minisessiondb.model.NavigationTransition;
import com.minisessiondb.model.Session;
import com.minisessiondb.model.SessionPatch;
import com.minisessiondb.model.Tab;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.engine.StorageConfig;
import com.minisessiondb.storage.impl.InMemoryRecordStore;
import com.minisessiondb.storage.record.NavigationEventKey;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredTab;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionStorageManager测试
 *
 * 通过统一入口走完整流程: CRUD、整库校验与自动修正、备份恢复、维护任务。
 */
@DisplayName("SessionStorageManager - 统一入口测试")
class SessionStorageManagerTest {

    private static final long NOW = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private Clock clock;

    private SessionStorageManager manager;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        manager = newManager(ValidatorConfig.defaults());
        manager.initialize().join();
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private SessionStorageManager newManager(ValidatorConfig validatorConfig) {
        return new SessionStorageManager(StorageConfig.builder().inMemory().build(), validatorConfig,
                MigrationConfig.defaults(), new InMemoryRecordStore(), new InMemoryBackupStore(), clock);
    }

    private static Session session(String id, String tag) {
        Session session = new Session(id, tag, NOW - 1000);
        session.getWindowIds().add(1);
        return session;
    }

    private static Throwable causeOf(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }

    // ==================== CRUD ====================

    @Test
    @DisplayName("会话CRUD返回领域对象")
    void testSessionCrud() {
        Session session = session("s1", "Work");
        session.getTabs().add(new Tab(1, "https://example.com", "Example", 1, NOW - 1000));

        Session created = manager.createSession(session).join();
        assertEquals("s1", created.getId());
        assertEquals(1, created.getTabs().size());

        SessionPatch patch = SessionPatch.builder().tag("Personal").build();
        assertEquals("Personal", manager.updateSession("s1", patch).join().getTag());
        assertEquals("Personal", manager.getSession("s1").join().orElseThrow().getTag());

        manager.deleteSession("s1").join();
        assertTrue(manager.getSession("s1").join().isEmpty());
        assertInstanceOf(RecordNotFoundException.class, causeOf(manager.deleteSession("s1")));
    }

    @Test
    @DisplayName("标签页和导航事件CRUD返回领域对象")
    void testTabAndEventCrud() {
        manager.createSession(session("s1", "Work")).join();
        Tab tab = manager.createTab(new Tab(1, "https://example.com/a", "A", 1, NOW - 500), "s1").join();
        assertEquals("https://example.com/a", tab.getUrl());

        NavigationEvent event = new NavigationEvent(1, "https://example.com/b", NOW - 100, NavigationTransition.LINK);
        assertEquals(event, manager.createNavigationEvent(event, "s1").join());
        assertEquals(event, manager.getNavigationEvent(1, NOW - 100).join().orElseThrow());

        manager.deleteTab(1).join();
        assertTrue(manager.getTab(1).join().isEmpty());
        assertTrue(manager.getNavigationEvent(1, NOW - 100).join().isEmpty());
    }

    // ==================== 完整性 ====================

    @Test
    @DisplayName("会话删除后原标签页成为孤立记录,关系检查报告不可修正的错误")
    void testRelationshipScenario() {
        manager.createSession(session("S1", "Work")).join();
        manager.createTab(new Tab(1, "https://example.com", "Example", 1, NOW - 500), "S1").join();
        manager.createNavigationEvent(new NavigationEvent(1, "https://example.com/next", NOW - 100,
                NavigationTransition.LINK), "S1").join();

        StoreSnapshot snapshot = manager.getEngine().exportAll().join();
        StoredSession s1 = snapshot.getSessions().get(0);
        StoredTab t1 = snapshot.getTabs().get(0);
        StoredNavigationEvent event = snapshot.getNavigationEvents().get(0);

        ValidationResult before = manager.getValidator().validateRelationships(List.of(s1), List.of(t1),
                List.of(event));
        assertTrue(before.isValid());
        assertEquals(0, before.getErrors().size());

        manager.deleteSession("S1").join();

        ValidationResult after = manager.getValidator().validateRelationships(Collections.emptyList(),
                List.of(t1), Collections.emptyList());
        assertEquals(1, after.getErrors().size());
        ValidationError error = after.getErrors().get(0);
        assertEquals("missing_reference", error.getType().getWireName());
        assertEquals("high", error.getSeverity().getWireName());
        assertFalse(error.isCanAutoCorrect());

        // 级联删除后存储本身是一致的
        assertTrue(manager.validateIntegrity(false).join().isValid());
    }

    @Test
    @DisplayName("自动修正: 篡改的校验和被修复")
    void testAutoCorrectChecksum() {
        manager.createSession(session("s1", "Work")).join();
        StoredSession stored = manager.getEngine().getSession("s1").join().orElseThrow();
        stored.setTag("Tampered");
        StoreSnapshot tampered = new StoreSnapshot();
        tampered.getSessions().add(stored);
        manager.getEngine().importRecords(tampered, true).join();

        ValidationResult detected = manager.validateIntegrity(false).join();
        assertFalse(detected.isValid());
        assertEquals(ErrorType.CHECKSUM_MISMATCH, detected.getErrors().get(0).getType());

        ValidationResult corrected = manager.validateIntegrity(true).join();
        assertTrue(corrected.isValid());
        assertEquals(1, corrected.getCorrectedItems());

        assertTrue(manager.validateIntegrity(false).join().isValid());
        assertEquals("Tampered", manager.getSession("s1").join().orElseThrow().getTag());
    }

    @Test
    @DisplayName("自动修正: 引用不存在会话的导航事件改挂到标签页所属会话")
    void testAutoCorrectDanglingEvent() {
        manager.createSession(session("s1", "Work")).join();
        manager.createTab(new Tab(1, "https://example.com", "Example", 1, NOW - 500), "s1").join();
        manager.createNavigationEvent(new NavigationEvent(1, "https://example.com/x", NOW - 100,
                NavigationTransition.TYPED), "gone").join();

        ValidationResult corrected = manager.validateIntegrity(true).join();

        assertTrue(corrected.isValid(), corrected.toString());
        assertEquals(1, corrected.getCorrectedItems());
        assertEquals("s1", manager.getEngine().getNavigationEvent(1, NOW - 100).join().orElseThrow().getSessionId());
    }

    @Test
    @DisplayName("孤立标签页无法自动修正,保留在错误列表中")
    void testOrphanedTabNotCorrected() {
        manager.createTab(new Tab(2, "https://example.com", "Ghost", 1, NOW - 500), "missing").join();

        ValidationResult result = manager.validateIntegrity(true).join();

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertEquals(ErrorType.MISSING_REFERENCE, result.getErrors().get(0).getType());
        assertEquals(Severity.HIGH, result.getErrors().get(0).getSeverity());
        assertEquals(0, result.getCorrectedItems());
    }

    @Test
    @DisplayName("校验错误的实体ID转换为容器主键")
    void testStorageKey() {
        assertEquals(5, SessionStorageManager.storageKey(new ValidationError(ErrorType.CHECKSUM_MISMATCH,
                Severity.HIGH, EntityType.TAB, 5, "m", true)));
        assertEquals(7, SessionStorageManager.storageKey(new ValidationError(ErrorType.CHECKSUM_MISMATCH,
                Severity.HIGH, EntityType.TAB, "7", "m", true)));
        assertEquals(new NavigationEventKey(3, 100L), SessionStorageManager.storageKey(new ValidationError(
                ErrorType.MISSING_REFERENCE, Severity.MEDIUM, EntityType.NAVIGATION_EVENT, "3_100", "m", true)));
        assertEquals("s1", SessionStorageManager.storageKey(new ValidationError(ErrorType.CHECKSUM_MISMATCH,
                Severity.HIGH, EntityType.SESSION, "s1", "m", true)));
    }

    // ==================== 备份 ====================

    @Test
    @DisplayName("备份后删除数据,从备份恢复到存储")
    void testBackupAndRestore() {
        manager.createSession(session("s1", "Work")).join();
        manager.createTab(new Tab(1, "https://example.com", "Example", 1, NOW - 500), "s1").join();

        BackupManifest manifest = manager.createBackup("before delete").join();
        assertEquals(NOW, manifest.getTimestamp());
        assertEquals(1, manifest.getVersion());
        assertEquals(NOW, manager.getEngine().getDatabaseMetadata().join().orElseThrow().getLastBackup());

        manager.deleteSession("s1").join();
        assertEquals(1, manager.listBackups().join().size());
        assertEquals(1, manager.restoreFromBackup(manifest.getId()).join().getSessions().size());

        assertEquals(2, manager.restoreBackupIntoStore(manifest.getId()).join());
        assertEquals("Work", manager.getSession("s1").join().orElseThrow().getTag());
        assertTrue(manager.getTab(1).join().isPresent());

        manager.deleteBackup(manifest.getId()).join();
        assertTrue(manager.listBackups().join().isEmpty());
        assertInstanceOf(BackupNotFoundException.class, causeOf(manager.deleteBackup(manifest.getId())));
        assertInstanceOf(BackupNotFoundException.class, causeOf(manager.restoreBackupIntoStore("backup_x")));
    }

    @Test
    @DisplayName("备份关闭时创建备份失败")
    void testBackupsDisabled() {
        SessionStorageManager disabled = newManager(ValidatorConfig.builder().enableBackups(false).build());
        try {
            assertInstanceOf(BackupsDisabledException.class, causeOf(disabled.createBackup()));
        } finally {
            disabled.close();
        }
    }

    // ==================== 维护与其他 ====================

    @Test
    @DisplayName("首次维护tick执行全部任务,定期备份被创建;同一时刻再次tick无任务到期")
    void testMaintenanceTick() {
        manager.createSession(session("s1", "Work")).join();

        List<String> ran = manager.runMaintenanceTick();

        assertEquals(List.of(SessionStorageManager.TASK_STALE_CLEANUP, SessionStorageManager.TASK_INTEGRITY_SWEEP,
                SessionStorageManager.TASK_PERIODIC_BACKUP), ran);
        assertEquals(1, manager.listBackups().join().size());
        assertTrue(manager.runMaintenanceTick().isEmpty());
        assertEquals(new ArrayList<>(ran), manager.maintenanceTicker().getTaskNames());
    }

    @Test
    @DisplayName("版本信息: 初始化后是最新版本")
    void testVersionInfo() {
        VersionInfo info = manager.getVersionInfo();

        assertEquals(1, info.getCurrent());
        assertTrue(info.isUpToDate());
        assertFalse(info.isMigrationRequired());
    }

    @Test
    @DisplayName("统计与清空")
    void testStatsAndClear() {
        manager.createSession(session("s1", "Work")).join();
        manager.createSession(session("s2", "Home")).join();

        assertEquals(2, manager.getStorageStats().join().getSessions());

        manager.clearAllData().join();
        assertEquals(0, manager.getStorageStats().join().getSessions());
    }

    @Test
    @DisplayName("配置了dataDir时数据和备份落盘,重启后仍在")
    void testFileBackedManager() {
        long now = System.currentTimeMillis();
        StorageConfig config = StorageConfig.builder().dataDir(tempDir).build();
        try (SessionStorageManager fileManager = SessionStorageManager.create(config)) {
            fileManager.initialize().join();
            Session session = new Session("s1", "Work", now);
            session.getWindowIds().add(1);
            fileManager.createSession(session).join();
            fileManager.createBackup().join();
            fileManager.shutdown().join();
        }

        assertTrue(Files.isDirectory(tempDir.resolve("backups")));

        try (SessionStorageManager reopened = SessionStorageManager.create(config)) {
            reopened.initialize().join();
            assertTrue(reopened.getSession("s1").join().isPresent());
            assertEquals(1, reopened.listBackups().join().size());
        }
    }
}

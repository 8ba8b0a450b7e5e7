package com.minisessiondb.storage.engine;

import com.minisessiondb.CommonConstant;
import com.minisessiondb.exception.InvalidRecordShapeException;
import com.minisessiondb.exception.RecordNotFoundException;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.migration.MigrationConfig;
import com.minisessiondb.migration.MigrationManager;
import com.minisessiondb.model.BoundaryReason;
import com.minisessiondb.model.BoundaryType;
import com.minisessiondb.model.NavigationEvent;
import com.minisessiondb.model.NavigationTransition;
import com.minisessiondb.model.Session;
import com.minisessiondb.model.SessionBoundary;
import com.minisessiondb.model.SessionPatch;
import com.minisessiondb.model.Tab;
import com.minisessiondb.model.TabPatch;
import com.minisessiondb.serializer.Crc32cChecksum;
import com.minisessiondb.serializer.SerializerConfig;
import com.minisessiondb.serializer.SessionDataSerializer;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.impl.InMemoryRecordStore;
import com.minisessiondb.storage.record.DatabaseMetadata;
import com.minisessiondb.storage.record.IntegrityCheckResult;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredSessionBoundary;
import com.minisessiondb.storage.record.StoredTab;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionStorageEngine测试
 *
 * 覆盖:
 * - 初始化: 幂等、元数据初始化、启动清理
 * - 会话/标签页/导航事件/边界的CRUD
 * - 级联删除和计数维护
 * - 索引选择、日期区间、分页
 * - 维护: 完整性扫描、统计
 */
@DisplayName("SessionStorageEngine - 存储引擎测试")
class SessionStorageEngineTest {

    private static final long NOW = 1_700_000_000_000L;

    private static final long HOUR = 3_600_000L;

    private Clock clock;

    private InMemoryRecordStore store;

    private SessionStorageEngine engine;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        store = new InMemoryRecordStore();
        engine = newEngine(StorageConfig.builder().inMemory().build());
        engine.initialize().join();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private SessionStorageEngine newEngine(StorageConfig config) {
        SessionDataSerializer serializer = new SessionDataSerializer(SerializerConfig.defaults(),
                new Crc32cChecksum(), clock);
        MigrationManager migrationManager = new MigrationManager(MigrationConfig.defaults(), null, clock);
        return new SessionStorageEngine(config, store, serializer, migrationManager, clock);
    }

    private static Session session(String id, String tag, long createdAt) {
        Session session = new Session(id, tag, createdAt);
        session.getWindowIds().add(1);
        return session;
    }

    private static Tab tab(int id, String url, long createdAt) {
        return new Tab(id, url, "Tab " + id, 1, createdAt);
    }

    private static Throwable causeOf(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }

    // ==================== 初始化 ====================

    @Test
    @DisplayName("初始化后应该创建五个容器和元数据记录")
    void testInitializeCreatesSchemaAndMetadata() {
        assertTrue(engine.isInitialized());
        assertEquals(1, store.getVersion());
        assertEquals(5, store.getContainerNames().size());

        Optional<DatabaseMetadata> metadata = engine.getDatabaseMetadata().join();
        assertTrue(metadata.isPresent());
        assertEquals(1, metadata.get().getVersion());
        assertEquals(0, metadata.get().getTotalSessions());
    }

    @Test
    @DisplayName("重复初始化是幂等的")
    void testInitializeIdempotent() {
        CompletableFuture<Void> first = engine.initialize();
        CompletableFuture<Void> second = engine.initialize();

        assertSame(first, second);
        second.join();
        assertEquals(1, store.getVersion());
    }

    @Test
    @DisplayName("关闭后再次初始化可以读到原有数据")
    void testShutdownAndReinitialize() {
        engine.createSession(session("s1", "Work", NOW)).join();

        engine.shutdown().join();
        assertFalse(engine.isInitialized());
        assertFalse(store.isOpen());

        assertTrue(engine.getSession("s1").join().isPresent());
        assertTrue(engine.isInitialized());
    }

    @Test
    @DisplayName("启动维护应该清理超过最大保留期的会话")
    void testStartupCleanupRemovesExpiredSessions() {
        engine.createSession(session("old", "Work", NOW - 400L * 24 * HOUR)).join();
        engine.createSession(session("fresh", "Work", NOW - HOUR)).join();
        engine.shutdown().join();

        engine.initialize().join();

        assertFalse(engine.getSession("old").join().isPresent());
        assertTrue(engine.getSession("fresh").join().isPresent());
    }

    // ==================== 会话 ====================

    @Test
    @DisplayName("创建会话应该写入派生字段并增加计数")
    void testCreateSession() {
        Session session = session("s1", "Work", NOW - HOUR);
        session.getTabs().add(tab(1, "https://example.com/a", NOW - HOUR));
        session.getTabs().add(tab(2, "https://docs.example.org/b", NOW - HOUR));

        StoredSession stored = engine.createSession(session).join();

        assertEquals("s1", stored.getId());
        assertEquals(1, stored.getVersion());
        assertEquals(2, stored.getTotalTabCount());
        assertEquals(List.of("example.com", "docs.example.org"), stored.getDomains());
        assertNotNull(stored.getChecksum());
        assertEquals(1, engine.getDatabaseMetadata().join().get().getTotalSessions());
    }

    @Test
    @DisplayName("主键缺失的会话应该被拒绝")
    void testCreateSessionWithoutIdRejected() {
        Throwable cause = causeOf(engine.createSession(session("", "Work", NOW)));

        assertInstanceOf(InvalidRecordShapeException.class, cause);
        assertEquals(0, engine.getDatabaseMetadata().join().get().getTotalSessions());
    }

    @Test
    @DisplayName("相同主键再次创建是覆盖,不重复计数")
    void testCreateSessionUpsert() {
        engine.createSession(session("s1", "Work", NOW)).join();
        engine.createSession(session("s1", "Personal", NOW)).join();

        assertEquals("Personal", engine.getSession("s1").join().get().getTag());
        assertEquals(1, engine.getDatabaseMetadata().join().get().getTotalSessions());
    }

    @Test
    @DisplayName("不存在的会话返回空")
    void testGetMissingSession() {
        assertFalse(engine.getSession("nope").join().isPresent());
    }

    @Test
    @DisplayName("更新会话应该合并补丁并递增version")
    void testUpdateSession() {
        engine.createSession(session("s1", "Work", NOW - HOUR)).join();

        StoredSession updated = engine.updateSession("s1",
                SessionPatch.builder().tag("Research").notes("reading list").build()).join();

        assertEquals("Research", updated.getTag());
        assertEquals("reading list", updated.getMetadata().getNotes());
        assertEquals(2, updated.getVersion());
        assertEquals(NOW, updated.getUpdatedAt());
        assertEquals(NOW - HOUR, updated.getCreatedAt());
    }

    @Test
    @DisplayName("更新不存在的会话应该抛出RecordNotFoundException")
    void testUpdateMissingSession() {
        Throwable cause = causeOf(engine.updateSession("missing", SessionPatch.builder().tag("x").build()));

        assertInstanceOf(RecordNotFoundException.class, cause);
    }

    @Test
    @DisplayName("删除会话应该级联删除标签页、导航事件和边界")
    void testDeleteSessionCascades() {
        engine.createSession(session("s1", "Work", NOW)).join();
        engine.createSession(session("s2", "Work", NOW)).join();
        engine.createTab(tab(1, "https://example.com", NOW), "s1").join();
        engine.createTab(tab(2, "https://example.com", NOW), "s1").join();
        engine.createTab(tab(3, "https://example.com", NOW), "s2").join();
        engine.createNavigationEvent(new NavigationEvent(1, "https://example.com", NOW,
                NavigationTransition.LINK), "s1").join();
        engine.createSessionBoundary(new SessionBoundary("b1", BoundaryType.START,
                BoundaryReason.USER_INITIATED, NOW, "s1")).join();

        engine.deleteSession("s1").join();

        assertFalse(engine.getSession("s1").join().isPresent());
        assertFalse(engine.getTab(1).join().isPresent());
        assertFalse(engine.getTab(2).join().isPresent());
        assertTrue(engine.getTab(3).join().isPresent());
        assertFalse(engine.getNavigationEvent(1, NOW).join().isPresent());
        assertFalse(engine.getSessionBoundary("b1").join().isPresent());

        DatabaseMetadata metadata = engine.getDatabaseMetadata().join().get();
        assertEquals(1, metadata.getTotalSessions());
        assertEquals(1, metadata.getTotalTabs());
        assertEquals(0, metadata.getTotalNavigationEvents());
    }

    @Test
    @DisplayName("删除不存在的会话应该抛出RecordNotFoundException")
    void testDeleteMissingSession() {
        assertInstanceOf(RecordNotFoundException.class, causeOf(engine.deleteSession("missing")));
    }

    // ==================== 标签页 ====================

    @Test
    @DisplayName("标签页写入不检查所属会话是否存在")
    void testCreateTabWithoutSession() {
        StoredTab stored = engine.createTab(tab(7, "https://example.com/page", NOW), "ghost").join();

        assertEquals(7, stored.getId());
        assertEquals("ghost", stored.getSessionId());
        assertEquals("example.com", stored.getDomain());
        assertTrue(engine.getTab(7).join().isPresent());
    }

    @Test
    @DisplayName("更新标签页保留统计字段并刷新lastAccessed")
    void testUpdateTab() {
        engine.createTab(tab(1, "https://example.com", NOW - HOUR), "s1").join();
        engine.createNavigationEvent(new NavigationEvent(1, "https://example.com/next", NOW - 10,
                NavigationTransition.LINK), "s1").join();

        StoredTab updated = engine.updateTab(1, TabPatch.builder().title("Renamed").build()).join();

        assertEquals("Renamed", updated.getTitle());
        assertEquals(NOW, updated.getLastAccessed());
        assertEquals(1, updated.getNavigationCount());
        assertEquals(2, updated.getVersion());
    }

    @Test
    @DisplayName("更新不存在的标签页应该抛出RecordNotFoundException")
    void testUpdateMissingTab() {
        assertInstanceOf(RecordNotFoundException.class,
                causeOf(engine.updateTab(99, TabPatch.builder().title("x").build())));
    }

    @Test
    @DisplayName("删除标签页应该同时删除它的导航事件")
    void testDeleteTabCascades() {
        engine.createTab(tab(1, "https://example.com", NOW), "s1").join();
        engine.createNavigationEvent(new NavigationEvent(1, "https://example.com", NOW - 5,
                NavigationTransition.TYPED), "s1").join();
        engine.createNavigationEvent(new NavigationEvent(1, "https://example.com/2", NOW - 4,
                NavigationTransition.LINK), "s1").join();

        engine.deleteTab(1).join();

        assertFalse(engine.getTab(1).join().isPresent());
        assertTrue(engine.queryNavigationEvents(NavigationQuery.all()).join().isEmpty());
        assertEquals(0, engine.getDatabaseMetadata().join().get().getTotalNavigationEvents());
    }

    @Test
    @DisplayName("按会话查询标签页")
    void testQueryTabsBySession() {
        engine.createTab(tab(1, "https://a.com", NOW - 3), "s1").join();
        engine.createTab(tab(2, "https://b.com", NOW - 2), "s1").join();
        engine.createTab(tab(3, "https://c.com", NOW - 1), "s2").join();

        List<StoredTab> tabs = engine.queryTabs(TabQuery.forSession("s1")).join();

        assertEquals(2, tabs.size());
        assertTrue(tabs.stream().allMatch(t -> "s1".equals(t.getSessionId())));
    }

    @Test
    @DisplayName("按域名子串过滤标签页")
    void testQueryTabsByDomain() {
        engine.createTab(tab(1, "https://news.example.com", NOW - 3), "s1").join();
        engine.createTab(tab(2, "https://other.org", NOW - 2), "s1").join();

        List<StoredTab> tabs = engine.queryTabs(TabQuery.builder().domains("example").build()).join();

        assertEquals(1, tabs.size());
        assertEquals(1, tabs.get(0).getId());
    }

    // ==================== 导航事件 ====================

    @Test
    @DisplayName("导航事件应该更新标签页摘要和会话事件计数")
    void testNavigationEventUpdatesSummaries() {
        engine.createSession(session("s1", "Work", NOW)).join();
        engine.createTab(tab(1, "https://example.com", NOW), "s1").join();

        engine.createNavigationEvent(new NavigationEvent(1, "https://example.com/a", NOW - 20,
                NavigationTransition.LINK), "s1").join();
        engine.createNavigationEvent(new NavigationEvent(1, "https://example.com/b", NOW - 10,
                NavigationTransition.LINK), "s1").join();

        StoredTab stored = engine.getTab(1).join().get();
        assertEquals(2, stored.getNavigationCount());
        assertEquals(NOW - 20, stored.getFirstNavigationAt());
        assertEquals(NOW - 10, stored.getLastNavigationAt());
        assertEquals(2, engine.getSession("s1").join().get().getTotalNavigationEvents());
    }

    @Test
    @DisplayName("导航事件按复合主键读取和删除")
    void testNavigationEventCompositeKey() {
        engine.createNavigationEvent(new NavigationEvent(4, "https://example.com", NOW - 1,
                NavigationTransition.RELOAD), "s1").join();

        Optional<StoredNavigationEvent> found = engine.getNavigationEvent(4, NOW - 1).join();
        assertTrue(found.isPresent());
        assertEquals("example.com", found.get().getDomain());
        assertFalse(engine.getNavigationEvent(4, NOW).join().isPresent());

        engine.deleteNavigationEvent(4, NOW - 1).join();
        assertFalse(engine.getNavigationEvent(4, NOW - 1).join().isPresent());
        assertInstanceOf(RecordNotFoundException.class, causeOf(engine.deleteNavigationEvent(4, NOW - 1)));
    }

    @Test
    @DisplayName("导航事件日期区间查询是闭区间并受limit约束")
    void testNavigationDateRangeInclusiveAndLimited() {
        for (int i = 0; i < 10; i++) {
            engine.createNavigationEvent(new NavigationEvent(1, "https://example.com/" + i, NOW - 100 + i * 10,
                    NavigationTransition.LINK), "s1").join();
        }

        List<StoredNavigationEvent> inRange = engine.queryNavigationEvents(NavigationQuery.builder()
                .dateRange(NOW - 80, NOW - 40)
                .build()).join();
        assertEquals(5, inRange.size());
        assertEquals(NOW - 40, inRange.get(0).getTimestamp());
        assertEquals(NOW - 80, inRange.get(4).getTimestamp());

        List<StoredNavigationEvent> limited = engine.queryNavigationEvents(NavigationQuery.builder()
                .dateRange(NOW - 80, NOW - 40)
                .options(QueryOptions.limit(2))
                .build()).join();
        assertEquals(2, limited.size());
    }

    // ==================== 会话边界 ====================

    @Test
    @DisplayName("会话边界按时间升序返回")
    void testSessionBoundariesOrdered() {
        engine.createSessionBoundary(new SessionBoundary("b2", BoundaryType.END,
                BoundaryReason.IDLE_TIMEOUT, NOW - 10, "s1")).join();
        engine.createSessionBoundary(new SessionBoundary("b1", BoundaryType.START,
                BoundaryReason.USER_INITIATED, NOW - 100, "s1")).join();
        engine.createSessionBoundary(new SessionBoundary("b3", BoundaryType.START,
                BoundaryReason.USER_INITIATED, NOW - 50, "s2")).join();

        List<StoredSessionBoundary> boundaries = engine.getSessionBoundaries("s1").join();

        assertEquals(2, boundaries.size());
        assertEquals("b1", boundaries.get(0).getId());
        assertEquals("b2", boundaries.get(1).getId());

        engine.deleteSessionBoundary("b1").join();
        assertEquals(1, engine.getSessionBoundaries("s1").join().size());
        assertInstanceOf(RecordNotFoundException.class, causeOf(engine.deleteSessionBoundary("b1")));
    }

    // ==================== 会话查询 ====================

    @Test
    @DisplayName("按标签查询会话")
    void testQuerySessionsByTag() {
        engine.createSession(session("s1", "Work", NOW - 3)).join();
        engine.createSession(session("s2", "Personal", NOW - 2)).join();
        engine.createSession(session("s3", "Work", NOW - 1)).join();

        List<StoredSession> work = engine.querySessions(SessionQuery.builder().tags("Work").build()).join();

        assertEquals(2, work.size());
        assertTrue(work.stream().allMatch(s -> "Work".equals(s.getTag())));
    }

    @Test
    @DisplayName("会话日期区间查询包含两端")
    void testQuerySessionsDateRangeInclusive() {
        for (int i = 1; i <= 5; i++) {
            engine.createSession(session("s" + i, "Work", NOW - i * HOUR)).join();
        }

        List<StoredSession> result = engine.querySessions(SessionQuery.builder()
                .dateRange(NOW - 4 * HOUR, NOW - 2 * HOUR)
                .build()).join();

        assertEquals(3, result.size());
        assertEquals("s2", result.get(0).getId());
        assertEquals("s4", result.get(2).getId());
    }

    @Test
    @DisplayName("分页: offset跳过匹配项,升序从最早的开始")
    void testQuerySessionsPaging() {
        for (int i = 1; i <= 5; i++) {
            engine.createSession(session("s" + i, "Work", NOW - (6 - i) * HOUR)).join();
        }

        List<StoredSession> page = engine.querySessions(SessionQuery.builder()
                .dateRange(0, NOW)
                .options(QueryOptions.page(2, 1).withOrder(QueryOptions.Order.ASC))
                .build()).join();

        assertEquals(2, page.size());
        assertEquals("s2", page.get(0).getId());
        assertEquals("s3", page.get(1).getId());
    }

    @Test
    @DisplayName("全文搜索匹配标签、用途和备注,不区分大小写")
    void testQuerySessionsSearchText() {
        Session withNotes = session("s1", "Misc", NOW - 2);
        withNotes.getMetadata().setNotes("Quarterly PLANNING notes");
        engine.createSession(withNotes).join();
        engine.createSession(session("s2", "Planning", NOW - 1)).join();
        engine.createSession(session("s3", "Shopping", NOW)).join();

        List<StoredSession> result = engine.querySessions(SessionQuery.builder()
                .searchText("planning").build()).join();

        assertEquals(2, result.size());
    }

    @Test
    @DisplayName("关闭索引时按主键扫描,结果一致")
    void testQueryWithIndexingDisabled() {
        engine.close();
        store = new InMemoryRecordStore();
        engine = newEngine(StorageConfig.builder().inMemory().indexingEnabled(false).build());

        engine.createSession(session("a", "Work", NOW - 2)).join();
        engine.createSession(session("b", "Personal", NOW - 1)).join();

        List<StoredSession> work = engine.querySessions(SessionQuery.builder().tags("Work").build()).join();
        assertEquals(1, work.size());
        assertEquals("a", work.get(0).getId());
    }

    @Test
    @DisplayName("不走索引的过滤条件最多扫描10000条记录,超出上限的匹配项不返回")
    void testScanCapReturnsEarly() {
        List<StoredTab> tabs = new ArrayList<>();
        // 最旧的一条匹配,按创建时间倒序扫描时排在第10002位
        tabs.add(storedTab(1, "rare.org", 99, NOW - 2 * HOUR));
        for (int i = 2; i <= CommonConstant.MAX_SCAN_RECORDS + 2; i++) {
            tabs.add(storedTab(i, "example.com", 1, NOW - HOUR + i));
        }
        StoreSnapshot snapshot = new StoreSnapshot();
        snapshot.setTabs(tabs);
        engine.importRecords(snapshot, true).join();

        List<StoredTab> byDomain = engine.queryTabs(TabQuery.builder().domains("rare.org").build()).join();
        assertTrue(byDomain.isEmpty());

        List<StoredTab> byWindow = engine.queryTabs(TabQuery.builder().windowIds(99).build()).join();
        assertEquals(1, byWindow.size());
        assertEquals(1, byWindow.get(0).getId());
    }

    private static StoredTab storedTab(int id, String domain, int windowId, long createdAt) {
        StoredTab tab = new StoredTab();
        tab.setId(id);
        tab.setSessionId("s1");
        tab.setUrl("https://" + domain + "/" + id);
        tab.setDomain(domain);
        tab.setWindowId(windowId);
        tab.setCreatedAt(createdAt);
        return tab;
    }

    // ==================== 修复与全量操作 ====================

    @Test
    @DisplayName("修复校验和后记录重新通过校验")
    void testRepairChecksum() {
        engine.createTab(tab(1, "https://example.com", NOW), "s1").join();
        StoredTab tampered = engine.getTab(1).join().get();
        tampered.setChecksum("deadbeef");
        StoreSnapshot snapshot = new StoreSnapshot();
        snapshot.getTabs().add(tampered);
        engine.importRecords(snapshot, true).join();
        assertFalse(engine.getSerializer().verifyChecksum(engine.getTab(1).join().get()));

        String repaired = engine.repairChecksum(ContainerType.TABS, 1).join();

        StoredTab fixed = engine.getTab(1).join().get();
        assertEquals(repaired, fixed.getChecksum());
        assertTrue(engine.getSerializer().verifyChecksum(fixed));
    }

    @Test
    @DisplayName("导入不覆盖时保留已有记录,完成后按实际记录数刷新计数")
    void testImportRecordsWithoutOverwrite() {
        engine.createSession(session("s1", "Work", NOW)).join();
        StoreSnapshot snapshot = engine.exportAll().join();
        snapshot.getSessions().get(0).setTag("Changed");
        StoredSession extra = engine.getSerializer().serializeSession(session("s2", "Work", NOW));
        snapshot.getSessions().add(extra);

        int written = engine.importRecords(snapshot, false).join();

        assertEquals(1, written);
        assertEquals("Work", engine.getSession("s1").join().get().getTag());
        assertEquals(2, engine.getDatabaseMetadata().join().get().getTotalSessions());
    }

    @Test
    @DisplayName("清空数据后只剩元数据")
    void testClearAllData() {
        engine.createSession(session("s1", "Work", NOW)).join();
        engine.createTab(tab(1, "https://example.com", NOW), "s1").join();

        engine.clearAllData().join();

        StoreSnapshot snapshot = engine.exportAll().join();
        assertEquals(0, snapshot.getSessions().size());
        assertEquals(0, snapshot.getTabs().size());
        assertEquals(1, snapshot.getMetadata().size());
    }

    // ==================== 维护 ====================

    @Test
    @DisplayName("完整性扫描报告孤儿标签页并写入元数据")
    void testIntegrityCheckFindsOrphanedTabs() {
        engine.createSession(session("s1", "Work", NOW)).join();
        engine.createTab(tab(1, "https://example.com", NOW), "s1").join();
        engine.createTab(tab(2, "https://example.com", NOW), "ghost").join();

        IntegrityCheckResult result = engine.runIntegrityCheck().join();

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).contains("Orphaned tab: 2"));
        assertFalse(engine.getStorageStats().join().isIntegrityStatus());
    }

    @Test
    @DisplayName("统计信息包含计数、边界数和最早/最新记录时间")
    void testStorageStats() {
        engine.createSession(session("s1", "Work", NOW - 2 * HOUR)).join();
        engine.createSession(session("s2", "Work", NOW - HOUR)).join();
        engine.createTab(tab(1, "https://example.com", NOW), "s1").join();
        engine.createSessionBoundary(new SessionBoundary("b1", BoundaryType.START,
                BoundaryReason.USER_INITIATED, NOW, "s1")).join();
        engine.runMaintenance().join();

        StorageStats stats = engine.getStorageStats().join();

        assertEquals(2, stats.getSessions());
        assertEquals(1, stats.getTabs());
        assertEquals(1, stats.getBoundaries());
        assertEquals(NOW - 2 * HOUR, stats.getOldestRecord());
        assertEquals(NOW - HOUR, stats.getNewestRecord());
        assertTrue(stats.getStorageSize() > 0);
        assertTrue(stats.isIntegrityStatus());
    }

    @Test
    @DisplayName("cleanupOldData按maxSessionAge删除")
    void testCleanupOldData() {
        engine.close();
        store = new InMemoryRecordStore();
        engine = newEngine(StorageConfig.builder().inMemory().maxSessionAge(Duration.ofDays(1)).build());

        engine.createSession(session("old", "Work", NOW - 2 * 24 * HOUR)).join();
        engine.createSession(session("new", "Work", NOW - HOUR)).join();

        assertEquals(1, engine.cleanupOldData().join());
        assertFalse(engine.getSession("old").join().isPresent());
        assertTrue(engine.getSession("new").join().isPresent());
    }
}

package com.minisessiondb.exchange;

import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.integrity.DataIntegrityValidator;
import com.minisessiondb.integrity.InMemoryBackupStore;
import com.minisessiondb.integrity.ValidatorConfig;
import com.minisessiondb.migration.MigrationConfig;
import com.minisessiondb.migration.MigrationManager;
import com.minisessiondb.model.BoundaryReason;
import com.minisessiondb.model.BoundaryType;
import com.minisessiondb.model.NavigationEvent;
import com.minisessiondb.model.NavigationTransition;
import com.minisessiondb.model.Session;
import com.minisessiondb.model.SessionBoundary;
import com.minisessiondb.model.Tab;
import com.minisessiondb.serializer.Crc32cChecksum;
import com.minisessiondb.serializer.SerializerConfig;
import com.minisessiondb.serializer.SessionDataSerializer;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.engine.SessionStorageEngine;
import com.minisessiondb.storage.engine.StorageConfig;
import com.minisessiondb.storage.impl.InMemoryRecordStore;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredTab;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DataExportImport测试
 *
 * 引擎中预置两个会话:
 * - s1 (Work): 标签页1 example.com,一个导航事件,一个边界
 * - s2 (Home): 标签页2 other.org
 */
@DisplayName("DataExportImport - 导出导入测试")
class DataExportImportTest {

    private static final long NOW = 1_700_000_000_000L;

    private Clock clock;

    private SessionDataSerializer serializer;

    private SessionStorageEngine engine;

    private DataExportImport exchange;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        serializer = new SessionDataSerializer(SerializerConfig.defaults(), new Crc32cChecksum(), clock);
        engine = new SessionStorageEngine(StorageConfig.builder().inMemory().build(), new InMemoryRecordStore(),
                serializer, new MigrationManager(MigrationConfig.defaults(), null, clock), clock);
        engine.initialize().join();
        DataIntegrityValidator validator = new DataIntegrityValidator(ValidatorConfig.defaults(), serializer,
                new InMemoryBackupStore(), clock);
        exchange = new DataExportImport(engine, validator, serializer.getChecksums(), clock);

        engine.createSession(session("s1", "Work", NOW - 1000)).join();
        engine.createSession(session("s2", "Home", NOW - 500)).join();
        engine.createTab(new Tab(1, "https://example.com/a", "A", 1, NOW - 900), "s1").join();
        engine.createTab(new Tab(2, "https://other.org/b", "B", 1, NOW - 400), "s2").join();
        engine.createNavigationEvent(new NavigationEvent(1, "https://example.com/c", NOW - 800,
                NavigationTransition.LINK), "s1").join();
        engine.createSessionBoundary(new SessionBoundary("b1", BoundaryType.START, BoundaryReason.USER_INITIATED,
                NOW - 1000, "s1")).join();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static Session session(String id, String tag, long createdAt) {
        Session session = new Session(id, tag, createdAt);
        session.getWindowIds().add(1);
        return session;
    }

    private static StoredSession storedSession(String id, String tag, long createdAt, String... domains) {
        StoredSession session = new StoredSession();
        session.setId(id);
        session.setTag(tag);
        session.setCreatedAt(createdAt);
        session.setDomains(List.of(domains));
        return session;
    }

    private static StoredTab storedTab(int id, String sessionId, String domain, long createdAt) {
        StoredTab tab = new StoredTab();
        tab.setId(id);
        tab.setSessionId(sessionId);
        tab.setDomain(domain);
        tab.setCreatedAt(createdAt);
        return tab;
    }

    private static StoredNavigationEvent storedEvent(int tabId, String sessionId, String domain, long timestamp) {
        StoredNavigationEvent event = new StoredNavigationEvent();
        event.setTabId(tabId);
        event.setSessionId(sessionId);
        event.setDomain(domain);
        event.setTimestamp(timestamp);
        return event;
    }

    // ==================== 导出 ====================

    @Test
    @DisplayName("默认导出包含全部记录,计数不含元数据")
    void testExportAll() {
        ExportResult result = exchange.exportData(ExportOptions.defaults(), ExportFilter.none()).join();

        assertEquals(2, result.getItemCounts().get("sessions"));
        assertEquals(2, result.getItemCounts().get("tabs"));
        assertEquals(1, result.getItemCounts().get("navigation_events"));
        assertEquals(1, result.getItemCounts().get("session_boundaries"));
        assertFalse(result.getItemCounts().containsKey("metadata"));
        assertEquals("json", result.getFormat());
        assertEquals(result.getData().getBytes(StandardCharsets.UTF_8).length, result.getSize());

        ExportMetadata metadata = result.getMetadata();
        assertEquals("1.0.0", metadata.getVersion());
        assertEquals(NOW, metadata.getExportedAt());
        assertNotNull(metadata.getChecksum());
        assertEquals("crc32c", metadata.getChecksumAlgorithm());
    }

    @Test
    @DisplayName("关闭历史导出时不包含导航事件")
    void testExportWithoutHistory() {
        ExportResult result = exchange.exportData(ExportOptions.builder().includeHistory(false).prettyPrint(false)
                .build(), ExportFilter.none()).join();

        assertEquals(0, result.getItemCounts().get("navigation_events"));
        assertEquals(2, result.getItemCounts().get("sessions"));
        assertFalse(result.getData().contains("\n"));
    }

    @Test
    @DisplayName("按标签过滤时只保留该会话及其标签页、事件和边界")
    void testExportFilteredByTag() {
        ExportResult result = exchange.exportData(ExportOptions.defaults(),
                ExportFilter.builder().tags("Work").build()).join();

        assertEquals(1, result.getItemCounts().get("sessions"));
        assertEquals(1, result.getItemCounts().get("tabs"));
        assertEquals(1, result.getItemCounts().get("navigation_events"));
        assertEquals(1, result.getItemCounts().get("session_boundaries"));
    }

    @Test
    @DisplayName("按会话ID过滤")
    void testFilterBySessionIds() {
        StoreSnapshot source = new StoreSnapshot();
        source.setSessions(new ArrayList<>(List.of(storedSession("s1", "Work", 100), storedSession("s2", "Home", 200))));
        source.setTabs(new ArrayList<>(List.of(storedTab(1, "s1", "a.com", 100), storedTab(2, "s2", "b.com", 200))));
        source.setNavigationEvents(new ArrayList<>(List.of(storedEvent(1, "s1", "a.com", 150))));

        StoreSnapshot filtered = DataExportImport.applyFilter(source,
                ExportFilter.builder().sessionIds("s2").build());

        assertEquals(1, filtered.getSessions().size());
        assertEquals("s2", filtered.getSessions().get(0).getId());
        assertEquals(1, filtered.getTabs().size());
        assertTrue(filtered.getNavigationEvents().isEmpty());
    }

    @Test
    @DisplayName("按日期区间和域名过滤,区间两端包含")
    void testFilterByDateRangeAndDomain() {
        StoreSnapshot source = new StoreSnapshot();
        source.setSessions(new ArrayList<>(List.of(
                storedSession("s1", "Work", 100, "a.com"),
                storedSession("s2", "Work", 200, "b.com"),
                storedSession("s3", "Work", 300, "a.com", "b.com"))));
        source.setTabs(new ArrayList<>(List.of(storedTab(1, "s1", "a.com", 100), storedTab(3, "s3", "b.com", 300))));

        StoreSnapshot byDate = DataExportImport.applyFilter(source,
                ExportFilter.builder().dateRange(200, 300).build());
        assertEquals(2, byDate.getSessions().size());
        assertEquals(1, byDate.getTabs().size());

        StoreSnapshot byDomain = DataExportImport.applyFilter(source,
                ExportFilter.builder().domains("a.com").build());
        assertEquals(2, byDomain.getSessions().size());
        assertEquals(1, byDomain.getTabs().size());
        assertEquals(1, byDomain.getTabs().get(0).getId());

        assertEquals(3, source.getSessions().size());
    }

    // ==================== 解析 ====================

    @Test
    @DisplayName("解析导出文件得到相同记录,篡改后校验和不一致")
    void testParseAndChecksum() {
        String json = exchange.exportData(ExportOptions.defaults(), ExportFilter.none()).join().getData();

        StoreSnapshot parsed = exchange.parse(json);
        assertEquals(2, parsed.getSessions().size());
        assertEquals(1, parsed.getBoundaries().size());

        String tampered = json.replace("\"Work\"", "\"Play\"");
        StorageException e = assertThrows(StorageException.class, () -> exchange.parse(tampered));
        assertTrue(e.getMessage().startsWith("Export checksum mismatch"));
    }

    @Test
    @DisplayName("格式错误的JSON或缺少data对象时导入失败,不写入任何记录")
    void testImportInvalidJson() {
        ImportResult broken = exchange.importData("{oops", ImportOptions.skipExisting()).join();
        assertFalse(broken.isSuccess());
        assertTrue(broken.getErrors().get(0).startsWith("Import failed: Failed to parse JSON"));
        assertEquals(0, broken.getTotalProcessed());

        ImportResult noData = exchange.importData("{\"metadata\":{}}", ImportOptions.skipExisting()).join();
        assertEquals(List.of("Import failed: Invalid JSON structure: missing data object"), noData.getErrors());
    }

    @Test
    @DisplayName("篡改过的导出文件整体拒绝导入")
    void testImportTamperedRejected() {
        String json = exchange.exportData(ExportOptions.defaults(), ExportFilter.none()).join().getData();
        engine.clearAllData().join();

        ImportResult result = exchange.importData(json.replace("\"Work\"", "\"Play\""),
                ImportOptions.skipExisting()).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().get(0).startsWith("Import failed: Export checksum mismatch"));
        assertTrue(engine.getSession("s1").join().isEmpty());
    }

    // ==================== 导入 ====================

    @Test
    @DisplayName("导入到空库后记录全部恢复")
    void testImportIntoEmptyStore() {
        String json = exchange.exportData(ExportOptions.defaults(), ExportFilter.none()).join().getData();
        engine.clearAllData().join();

        ImportResult result = exchange.importData(json, ImportOptions.skipExisting()).join();

        assertTrue(result.isSuccess(), result.getErrors().toString());
        assertEquals(2, result.getImported().get("sessions"));
        assertEquals(2, result.getImported().get("tabs"));
        assertEquals(1, result.getImported().get("navigation_events"));
        assertEquals(1, result.getImported().get("session_boundaries"));
        assertEquals(6, result.getTotalProcessed());
        assertEquals("Work", engine.getSession("s1").join().orElseThrow().getTag());
        assertEquals(2, engine.getDatabaseMetadata().join().orElseThrow().getTotalSessions());
    }

    @Test
    @DisplayName("跳过已存在的主键,覆盖模式下全部写入")
    void testSkipAndOverwrite() {
        String json = exchange.exportData(ExportOptions.defaults(), ExportFilter.none()).join().getData();

        ImportResult skipped = exchange.importData(json, ImportOptions.skipExisting()).join();
        assertEquals(0, skipped.getTotalProcessed());
        assertEquals(2, skipped.getSkipped().get("sessions"));
        assertEquals(1, skipped.getSkipped().get("navigation_events"));

        ImportResult overwritten = exchange.importData(json, ImportOptions.overwrite()).join();
        assertEquals(6, overwritten.getTotalProcessed());
        assertEquals(0, overwritten.getSkipped().get("sessions"));
    }

    @Test
    @DisplayName("校验失败的记录被跳过并报告错误,其余记录照常导入")
    void testInvalidRecordsSkipped() throws Exception {
        engine.clearAllData().join();
        StoreSnapshot data = new StoreSnapshot();
        data.getSessions().add(serializer.serializeSession(session("good", "Work", NOW - 100)));
        data.getSessions().add(serializer.serializeSession(session("bad", "", NOW - 100)));
        String json = ObjectMappers.standard().writeValueAsString(new ExportDocument(null, data));

        ImportResult result = exchange.importData(json, ImportOptions.skipExisting()).join();

        assertFalse(result.isSuccess());
        assertEquals(List.of("Session bad: Session missing required field: tag"), result.getErrors());
        assertEquals(1, result.getImported().get("sessions"));
        assertTrue(engine.getSession("good").join().isPresent());
        assertTrue(engine.getSession("bad").join().isEmpty());
    }
}

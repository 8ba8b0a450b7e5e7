package com.minisessiondb.serializer;

import com.minisessiondb.exception.StorageException;
import com.minisessiondb.model.BoundaryContext;
import com.minisessiondb.model.BoundaryReason;
import com.minisessiondb.model.BoundaryType;
import com.minisessiondb.model.NavigationEvent;
import com.minisessiondb.model.NavigationTransition;
import com.minisessiondb.model.Session;
import com.minisessiondb.model.SessionBoundary;
import com.minisessiondb.model.SessionMetadata;
import com.minisessiondb.model.Tab;
import com.minisessiondb.storage.record.DatabaseMetadata;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredSessionBoundary;
import com.minisessiondb.storage.record.StoredTab;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionDataSerializer测试
 *
 * 测试序列化器的核心行为:
 * - 校验和只覆盖语义字段
 * - 超过阈值的会话被压缩,解压后内容不变
 * - 过长地址/标题截断、过期表单数据剥离
 * - 批量反序列化跳过损坏记录
 */
@DisplayName("SessionDataSerializer - 序列化与校验和测试")
class SessionDataSerializerTest {

    private static final long NOW = 1_700_000_000_000L;

    private static final long HOUR = 3_600_000L;

    private SessionDataSerializer serializer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        serializer = new SessionDataSerializer(SerializerConfig.defaults(), new Crc32cChecksum(), clock);
    }

    private static Session sessionWithTabs(String id, int tabCount) {
        Session session = new Session(id, "Research", NOW - 10);
        for (int i = 1; i <= tabCount; i++) {
            session.getTabs().add(new Tab(i, "https://docs.example.com/articles/" + i + "?ref=session",
                    "Article number " + i, 1, NOW - 10));
        }
        session.getWindowIds().add(1);
        return session;
    }

    @Test
    @DisplayName("同一会话两次序列化得到相同的校验和")
    void testChecksumDeterministic() {
        Session session = sessionWithTabs("s1", 3);

        String first = serializer.serializeSession(session).getChecksum();
        String second = serializer.serializeSession(new Session(session)).getChecksum();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("updatedAt和存储字段不影响校验和")
    void testChecksumIgnoresNonSemanticFields() {
        Session session = sessionWithTabs("s1", 2);
        StoredSession stored = serializer.serializeSession(session);

        session.setUpdatedAt(NOW + 5000);
        assertEquals(stored.getChecksum(), serializer.serializeSession(session).getChecksum());

        stored.setVersion(9);
        stored.setLastModified(NOW + 1);
        stored.setTotalNavigationEvents(42);
        assertTrue(serializer.verifyChecksum(stored));
    }

    @Test
    @DisplayName("语义字段变化会改变校验和")
    void testChecksumDetectsSemanticChange() {
        StoredSession stored = serializer.serializeSession(sessionWithTabs("s1", 2));

        stored.setTag("Tampered");

        assertFalse(serializer.verifyChecksum(stored));
        assertNotEquals(stored.getChecksum(), serializer.computeChecksum(stored));
    }

    @Test
    @DisplayName("小会话不压缩,大会话压缩后可以无损还原")
    void testCompressionRoundTrip() {
        StoredSession small = serializer.serializeSession(sessionWithTabs("small", 1));
        assertFalse(small.isCompressed());
        assertEquals(1, small.getTabs().size());

        Session large = sessionWithTabs("large", 40);
        StoredSession stored = serializer.serializeSession(large);

        assertTrue(stored.isCompressed());
        assertNotNull(stored.getCompressedPayload());
        assertTrue(stored.getTabs().isEmpty());
        assertEquals(40, stored.getTotalTabCount());

        Session restored = serializer.deserializeSession(stored);
        assertEquals(large.getTabs(), restored.getTabs());
        assertTrue(serializer.verifyChecksum(stored));
    }

    @Test
    @DisplayName("按容器类型分派校验和: 元数据记录没有校验和,会话和标签页有")
    void testChecksumDispatchCoversAllRecordTypes() {
        DatabaseMetadata metadata = new DatabaseMetadata(1, NOW);
        assertNull(SessionDataSerializer.storedChecksum(metadata));
        assertNull(serializer.computeChecksum(metadata));
        assertTrue(serializer.verifyChecksum(metadata));

        StoredSession session = serializer.serializeSession(sessionWithTabs("s1", 1));
        StoredTab tab = serializer.serializeTab(new Tab(1, "https://example.com", "Example", 1, NOW), "s1");
        for (StoredRecord record : List.<StoredRecord>of(session, tab)) {
            assertNotNull(serializer.computeChecksum(record));
            assertEquals(SessionDataSerializer.storedChecksum(record), serializer.computeChecksum(record));
        }
    }

    @Test
    @DisplayName("备注很长但标签页很少时,压缩收益按标签页负载判断,不压缩")
    void testCompressionGainMeasuredOnTabs() {
        Session session = new Session("notes", "Work", NOW - 10);
        SessionMetadata metadata = new SessionMetadata();
        metadata.setNotes("n".repeat(1000));
        session.setMetadata(metadata);
        session.getTabs().add(new Tab(1, "https://a.io/x", "x", 1, NOW - 10));

        StoredSession stored = serializer.serializeSession(session);

        assertFalse(stored.isCompressed());
        assertNull(stored.getCompressedPayload());
        assertEquals(1, stored.getTabs().size());
        assertTrue(stored.getSize() > 1000);
    }

    @Test
    @DisplayName("压缩后size包含会话其余字段和压缩负载")
    void testCompressedSizeCoversWholeRecord() {
        StoredSession stored = serializer.serializeSession(sessionWithTabs("large", 40));

        assertTrue(stored.isCompressed());
        long payloadSize = stored.getCompressedPayload().getBytes(StandardCharsets.UTF_8).length;
        assertTrue(stored.getSize() > payloadSize);
    }

    @Test
    @DisplayName("关闭压缩时大会话按原样存储")
    void testCompressionDisabled() {
        SessionDataSerializer plain = new SessionDataSerializer(
                SerializerConfig.builder().enableCompression(false).build(), new Crc32cChecksum(),
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));

        StoredSession stored = plain.serializeSession(sessionWithTabs("large", 40));

        assertFalse(stored.isCompressed());
        assertEquals(40, stored.getTabs().size());
    }

    @Test
    @DisplayName("压缩负载损坏时反序列化抛出StorageException")
    void testCorruptPayload() {
        StoredSession stored = serializer.serializeSession(sessionWithTabs("large", 40));
        stored.setCompressedPayload("not-base64-!!");

        assertThrows(StorageException.class, () -> serializer.deserializeSession(stored));
    }

    @Test
    @DisplayName("批量反序列化跳过损坏的会话")
    void testDeserializeSessionsSkipsCorrupt() {
        StoredSession good = serializer.serializeSession(sessionWithTabs("good", 2));
        StoredSession bad = serializer.serializeSession(sessionWithTabs("bad", 40));
        bad.setCompressedPayload(null);

        List<Session> sessions = serializer.deserializeSessions(Arrays.asList(good, bad));

        assertEquals(1, sessions.size());
        assertEquals("good", sessions.get(0).getId());
    }

    @Test
    @DisplayName("过长地址保留origin并截断路径,过长标题截断")
    void testUrlAndTitleTruncation() {
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < 600; i++) {
            path.append('a');
        }
        Session session = new Session("s1", "Work", NOW);
        StringBuilder title = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            title.append('t');
        }
        session.getTabs().add(new Tab(1, "https://example.com/" + path, title.toString(), 1, NOW));

        Tab stored = serializer.deserializeSession(serializer.serializeSession(session)).getTabs().get(0);

        assertTrue(stored.getUrl().startsWith("https://example.com/aaa"));
        assertTrue(stored.getUrl().endsWith("..."));
        assertEquals("https://example.com".length() + SessionDataSerializer.MAX_PATH_LENGTH + 3,
                stored.getUrl().length());
        assertEquals(SessionDataSerializer.MAX_TITLE_LENGTH + 3, stored.getTitle().length());
    }

    @Test
    @DisplayName("一小时前创建的标签页表单数据被剥离")
    void testStaleFormDataStripped() {
        Session session = new Session("s1", "Work", NOW - 2 * HOUR);
        Tab old = new Tab(1, "https://example.com/form", "Old form", 1, NOW - 2 * HOUR);
        old.setFormData(Map.of("q", "old"));
        Tab recent = new Tab(2, "https://example.com/form", "Recent form", 1, NOW - 60_000);
        recent.setFormData(Map.of("q", "recent"));
        session.getTabs().add(old);
        session.getTabs().add(recent);

        Session restored = serializer.deserializeSession(serializer.serializeSession(session));

        assertNull(restored.getTabs().get(0).getFormData());
        assertEquals("recent", restored.getTabs().get(1).getFormData().get("q"));
    }

    @Test
    @DisplayName("标签页序列化派生域名,无法解析时为unknown")
    void testTabDomain() {
        StoredTab tab = serializer.serializeTab(new Tab(1, "https://news.example.com/a", "News", 1, NOW), "s1");
        StoredTab broken = serializer.serializeTab(new Tab(2, "not a url", "Broken", 1, NOW), "s1");

        assertEquals("news.example.com", tab.getDomain());
        assertEquals("unknown", broken.getDomain());
        assertEquals("s1", tab.getSessionId());
        assertTrue(serializer.verifyChecksum(tab));
    }

    @Test
    @DisplayName("导航事件和会话边界的序列化往返")
    void testEventAndBoundaryRoundTrip() {
        NavigationEvent event = new NavigationEvent(3, "https://example.com/x", NOW, NavigationTransition.FORM_SUBMIT);
        event.setReferrer("https://example.com/");
        StoredNavigationEvent storedEvent = serializer.serializeNavigationEvent(event, "s1");

        assertEquals(event, serializer.deserializeNavigationEvent(storedEvent));
        assertEquals("s1", storedEvent.getSessionId());

        SessionBoundary boundary = new SessionBoundary("b1", BoundaryType.END, BoundaryReason.DOMAIN_CHANGE, NOW, "s1");
        BoundaryContext context = new BoundaryContext();
        context.setDomainFrom("a.com");
        context.setDomainTo("b.com");
        context.setTabsInvolved(Arrays.asList(1, 2, 3));
        context.setWindowsInvolved(List.of(1));
        boundary.setContext(context);

        StoredSessionBoundary storedBoundary = serializer.serializeSessionBoundary(boundary);

        assertEquals(3, storedBoundary.getTabCount());
        assertEquals(1, storedBoundary.getWindowCount());
        assertEquals(boundary, serializer.deserializeSessionBoundary(storedBoundary));
    }

    @Test
    @DisplayName("压缩统计")
    void testCompressionStats() {
        List<StoredSession> stored = serializer.serializeSessions(Arrays.asList(
                sessionWithTabs("a", 1), sessionWithTabs("b", 40)));

        CompressionStats stats = serializer.getCompressionStats(stored);

        assertEquals(2, stats.getTotalSessions());
        assertEquals(1, stats.getCompressedSessions());
        assertEquals(0.5, stats.getCompressionRate(), 0.0001);
    }

    @Test
    @DisplayName("三种校验和算法对相同输入稳定,对不同输入不同")
    void testChecksumAlgorithms() {
        byte[] a = "{\"id\":\"s1\"}".getBytes();
        byte[] b = "{\"id\":\"s2\"}".getBytes();
        for (ChecksumAlgorithm algorithm : Arrays.asList(new Crc32cChecksum(), new Sha256Checksum(),
                new RollingHashChecksum())) {
            assertEquals(algorithm.compute(a), algorithm.compute(a.clone()), algorithm.getName());
            assertNotEquals(algorithm.compute(a), algorithm.compute(b), algorithm.getName());
        }
    }
}

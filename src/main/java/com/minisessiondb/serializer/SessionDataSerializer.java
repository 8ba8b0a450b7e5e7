package com.minisessiondb.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.CommonConstant;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.common.UrlUtils;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.model.BoundaryContext;
import com.minisessiondb.model.NavigationEvent;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * SessionDataSerializer - 领域记录与持久化记录之间的转换
 *
 * 核心功能:
 * 1. 序列化: 附加存储元数据(version、lastModified、size、compressed),推导域名和计数,计算校验和
 * 2. 优化: 会话内的标签页快照截断过长的地址和标题,丢弃过期的表单数据,截断过长的备注
 * 3. 压缩: 会话较大且压缩收益不低于10%时,标签页快照用 {@link PayloadCodec} 压缩
 * 4. 反序列化: 解压、重算校验和,不一致时记录警告但仍返回数据
 *
 * 优化规则(只作用于会话内嵌的标签页快照,独立存储的Tab和NavigationEvent不截断):
 * - 地址超过500字符: 保留 scheme://host + 前200个路径字符 + "...";无法解析时取前500字符 + "..."
 * - 标题超过200字符: 前200字符 + "..."
 * - formData: 只保留一小时内创建的标签页的
 * - 备注超过1000字符: 前1000字符 + "..."
 *
 * 校验和在优化之后、压缩之前计算,所以解压后的数据可以直接重算比对。
 *
 * 使用模式:
 * <pre>
 * SessionDataSerializer serializer = new SessionDataSerializer(
 *     SerializerConfig.defaults(), new Crc32cChecksum(), Clock.systemUTC());
 *
 * StoredSession stored = serializer.serializeSession(session);
 * Session restored = serializer.deserializeSession(stored);
 * </pre>
 */
public class SessionDataSerializer {

    private static final Logger logger = LoggerFactory.getLogger(SessionDataSerializer.class);

    static final int MAX_URL_LENGTH = 500;

    static final int MAX_PATH_LENGTH = 200;

    static final int MAX_TITLE_LENGTH = 200;

    static final int MAX_NOTES_LENGTH = 1000;

    private static final String ELLIPSIS = "...";

    /** 压缩后至少要小于原大小的90%才采用 */
    private static final double MIN_COMPRESSION_GAIN = 0.9;

    private final SerializerConfig config;

    private final RecordChecksums checksums;

    private final PayloadCodec codec;

    private final Clock clock;

    private final ObjectMapper mapper;

    public SessionDataSerializer() {
        this(SerializerConfig.defaults(), new Crc32cChecksum(), Clock.systemUTC());
    }

    public SessionDataSerializer(SerializerConfig config, ChecksumAlgorithm algorithm, Clock clock) {
        this.config = config;
        this.checksums = new RecordChecksums(algorithm);
        this.codec = new PayloadCodec();
        this.clock = clock;
        this.mapper = ObjectMappers.standard();
    }

    public SerializerConfig getConfig() {
        return config;
    }

    public RecordChecksums getChecksums() {
        return checksums;
    }

    // ==================== 会话 ====================

    /**
     * 序列化会话
     *
     * @param session 领域会话(不会被修改)
     * @return 持久化会话,version为1
     */
    public StoredSession serializeSession(Session session) {
        long now = clock.millis();
        Session optimized = config.isEnableOptimization() ? optimizeSession(session, now) : new Session(session);
        List<Tab> tabs = optimized.getTabs() == null ? new ArrayList<>() : optimized.getTabs();

        StoredSession stored = new StoredSession();
        stored.setId(optimized.getId());
        stored.setTag(optimized.getTag());
        stored.setCreatedAt(optimized.getCreatedAt());
        stored.setUpdatedAt(optimized.getUpdatedAt());
        stored.setWindowIds(optimized.getWindowIds());
        stored.setMetadata(optimized.getMetadata());
        stored.setVersion(1);
        stored.setLastModified(now);
        stored.setDomains(extractDomains(tabs));
        stored.setTotalTabCount(tabs.size());
        stored.setTotalNavigationEvents(0);
        stored.setChecksum(checksums.ofSession(optimized));
        stored.setValid(true);

        long originalSize = jsonSize(optimized);
        stored.setTabs(tabs);
        stored.setSize(originalSize);
        stored.setCompressed(false);

        if (config.isEnableCompression() && originalSize > config.getCompressionThreshold()) {
            try {
                // 收益按标签页负载本身衡量,size记录替换负载后的实际大小
                long rawTabsSize = jsonSize(tabs);
                String payload = codec.encode(tabs);
                long payloadSize = payload.getBytes(StandardCharsets.UTF_8).length;
                if (payloadSize < rawTabsSize * MIN_COMPRESSION_GAIN) {
                    long storedSize = originalSize - rawTabsSize + payloadSize;
                    stored.setCompressed(true);
                    stored.setCompressedPayload(payload);
                    stored.setTabs(new ArrayList<>());
                    stored.setSize(storedSize);
                    logger.debug("会话 {} 已压缩: {} -> {} 字节", stored.getId(), originalSize, storedSize);
                }
            } catch (StorageException e) {
                logger.warn("会话 {} 压缩失败,按未压缩存储: {}", stored.getId(), e.getMessage());
            }
        }

        return stored;
    }

    /**
     * 反序列化会话
     *
     * 校验和不一致时只记录警告(数据仍然返回,由完整性校验器决定如何处理)。
     *
     * @throws StorageException 压缩负载损坏
     */
    public Session deserializeSession(StoredSession stored) {
        Session session = toSession(stored, sessionTabs(stored));
        if (config.isPreserveMetadata()) {
            String current = checksums.ofSession(session);
            if (!current.equals(stored.getChecksum())) {
                logger.warn("会话校验和不一致: id={}, stored={}, actual={}", stored.getId(), stored.getChecksum(), current);
            }
        }
        return session;
    }

    /**
     * 取出会话内的标签页快照(必要时解压)
     */
    public List<Tab> sessionTabs(StoredSession stored) {
        if (stored.isCompressed()) {
            if (stored.getCompressedPayload() == null) {
                throw new StorageException("Session data corruption detected: missing payload for " + stored.getId());
            }
            return codec.decode(stored.getCompressedPayload());
        }
        List<Tab> tabs = new ArrayList<>();
        if (stored.getTabs() != null) {
            for (Tab tab : stored.getTabs()) {
                tabs.add(new Tab(tab));
            }
        }
        return tabs;
    }

    private Session toSession(StoredSession stored, List<Tab> tabs) {
        Session session = new Session();
        session.setId(stored.getId());
        session.setTag(stored.getTag());
        session.setCreatedAt(stored.getCreatedAt());
        session.setUpdatedAt(stored.getUpdatedAt());
        session.setTabs(tabs);
        session.setWindowIds(stored.getWindowIds() == null ? null : new ArrayList<>(stored.getWindowIds()));
        session.setMetadata(stored.getMetadata() == null ? null : new SessionMetadata(stored.getMetadata()));
        return session;
    }

    // ==================== 标签页 ====================

    public StoredTab serializeTab(Tab tab, String sessionId) {
        StoredTab stored = new StoredTab();
        stored.setId(tab.getId());
        stored.setSessionId(sessionId);
        stored.setUrl(tab.getUrl());
        stored.setTitle(tab.getTitle());
        stored.setFavicon(tab.getFavicon());
        stored.setWindowId(tab.getWindowId());
        stored.setCreatedAt(tab.getCreatedAt());
        stored.setLastAccessed(tab.getLastAccessed());
        stored.setTimeSpent(tab.getTimeSpent());
        stored.setScrollPosition(tab.getScrollPosition());
        stored.setFormData(tab.getFormData() == null ? null : new LinkedHashMap<>(tab.getFormData()));
        stored.setDomain(UrlUtils.extractDomainOrUnknown(tab.getUrl()));
        stored.setActive(false);
        stored.setInteractionCount(0);
        stored.setFocusTime(0);
        stored.setVersion(1);
        stored.setLastModified(clock.millis());
        stored.setNavigationCount(0);
        stored.setChecksum(checksums.ofTab(tab));
        return stored;
    }

    public Tab deserializeTab(StoredTab stored) {
        Tab tab = toTab(stored);
        if (config.isPreserveMetadata()) {
            String current = checksums.ofTab(tab);
            if (!current.equals(stored.getChecksum())) {
                logger.warn("标签页校验和不一致: id={}", stored.getId());
            }
        }
        return tab;
    }

    private Tab toTab(StoredTab stored) {
        Tab tab = new Tab();
        tab.setId(stored.getId() == null ? 0 : stored.getId());
        tab.setUrl(stored.getUrl());
        tab.setTitle(stored.getTitle());
        tab.setFavicon(stored.getFavicon());
        tab.setWindowId(stored.getWindowId());
        tab.setCreatedAt(stored.getCreatedAt());
        tab.setLastAccessed(stored.getLastAccessed());
        tab.setTimeSpent(stored.getTimeSpent());
        tab.setScrollPosition(stored.getScrollPosition());
        tab.setFormData(stored.getFormData() == null ? null : new LinkedHashMap<>(stored.getFormData()));
        return tab;
    }

    // ==================== 导航事件 ====================

    public StoredNavigationEvent serializeNavigationEvent(NavigationEvent event, String sessionId) {
        StoredNavigationEvent stored = new StoredNavigationEvent();
        stored.setTabId(event.getTabId());
        stored.setTimestamp(event.getTimestamp());
        stored.setUrl(event.getUrl());
        stored.setReferrer(event.getReferrer());
        stored.setTransitionType(event.getTransitionType());
        stored.setSessionId(sessionId);
        stored.setDomain(UrlUtils.extractDomainOrUnknown(event.getUrl()));
        stored.setVersion(1);
        stored.setChecksum(checksums.ofNavigationEvent(event));
        return stored;
    }

    public NavigationEvent deserializeNavigationEvent(StoredNavigationEvent stored) {
        NavigationEvent event = toNavigationEvent(stored);
        if (config.isPreserveMetadata()) {
            String current = checksums.ofNavigationEvent(event);
            if (!current.equals(stored.getChecksum())) {
                logger.warn("导航事件校验和不一致: key={}", stored.primaryKey());
            }
        }
        return event;
    }

    private NavigationEvent toNavigationEvent(StoredNavigationEvent stored) {
        NavigationEvent event = new NavigationEvent();
        event.setTabId(stored.getTabId() == null ? 0 : stored.getTabId());
        event.setTimestamp(stored.getTimestamp() == null ? 0L : stored.getTimestamp());
        event.setUrl(stored.getUrl());
        event.setReferrer(stored.getReferrer());
        event.setTransitionType(stored.getTransitionType());
        return event;
    }

    // ==================== 会话边界 ====================

    public StoredSessionBoundary serializeSessionBoundary(SessionBoundary boundary) {
        BoundaryContext context = boundary.getContext() == null ? new BoundaryContext() : boundary.getContext();

        StoredSessionBoundary stored = new StoredSessionBoundary();
        stored.setId(boundary.getId());
        stored.setType(boundary.getType());
        stored.setReason(boundary.getReason());
        stored.setTimestamp(boundary.getTimestamp());
        stored.setSessionId(boundary.getSessionId());
        stored.setContext(new BoundaryContext(context));
        stored.setTabCount(context.getTabsInvolved() == null ? 0 : context.getTabsInvolved().size());
        stored.setWindowCount(context.getWindowsInvolved() == null ? 0 : context.getWindowsInvolved().size());
        stored.setVersion(1);
        // 缺省上下文按空上下文计算,与读取时的还原结果一致
        stored.setChecksum(checksums.ofBoundary(toBoundary(stored)));
        return stored;
    }

    public SessionBoundary deserializeSessionBoundary(StoredSessionBoundary stored) {
        SessionBoundary boundary = toBoundary(stored);
        if (config.isPreserveMetadata()) {
            String current = checksums.ofBoundary(boundary);
            if (!current.equals(stored.getChecksum())) {
                logger.warn("会话边界校验和不一致: id={}", stored.getId());
            }
        }
        return boundary;
    }

    private SessionBoundary toBoundary(StoredSessionBoundary stored) {
        SessionBoundary boundary = new SessionBoundary();
        boundary.setId(stored.getId());
        boundary.setType(stored.getType());
        boundary.setReason(stored.getReason());
        boundary.setTimestamp(stored.getTimestamp());
        boundary.setSessionId(stored.getSessionId());
        boundary.setContext(stored.getContext() == null ? null : new BoundaryContext(stored.getContext()));
        return boundary;
    }

    // ==================== 校验和 ====================

    /**
     * 按语义字段重算校验和
     *
     * @return 数据库元数据没有校验和,返回null
     */
    public String computeChecksum(StoredRecord record) {
        switch (record.containerType()) {
            case SESSIONS: {
                StoredSession session = (StoredSession) record;
                return checksums.ofSession(toSession(session, sessionTabs(session)));
            }
            case TABS:
                return checksums.ofTab(toTab((StoredTab) record));
            case NAVIGATION_EVENTS:
                return checksums.ofNavigationEvent(toNavigationEvent((StoredNavigationEvent) record));
            case SESSION_BOUNDARIES:
                return checksums.ofBoundary(toBoundary((StoredSessionBoundary) record));
            case METADATA:
                return null;
            default:
                throw new IllegalArgumentException("Unknown container: " + record.containerType());
        }
    }

    /**
     * 存储的校验和是否与重算结果一致
     */
    public boolean verifyChecksum(StoredRecord record) {
        String expected = storedChecksum(record);
        String actual = computeChecksum(record);
        return actual == null || actual.equals(expected);
    }

    /**
     * 读取记录上保存的校验和
     */
    public static String storedChecksum(StoredRecord record) {
        if (record instanceof StoredSession s) {
            return s.getChecksum();
        } else if (record instanceof StoredTab t) {
            return t.getChecksum();
        } else if (record instanceof StoredNavigationEvent e) {
            return e.getChecksum();
        } else if (record instanceof StoredSessionBoundary b) {
            return b.getChecksum();
        } else if (record instanceof DatabaseMetadata) {
            return null;
        }
        throw new IllegalArgumentException("Unknown record type: " + record.getClass());
    }

    /**
     * 把记录上的校验和改写为重算结果(自动修复使用)
     */
    public void refreshChecksum(StoredRecord record) {
        String checksum = computeChecksum(record);
        if (record instanceof StoredSession s) {
            s.setChecksum(checksum);
        } else if (record instanceof StoredTab t) {
            t.setChecksum(checksum);
        } else if (record instanceof StoredNavigationEvent e) {
            e.setChecksum(checksum);
        } else if (record instanceof StoredSessionBoundary b) {
            b.setChecksum(checksum);
        }
    }

    // ==================== 批量 ====================

    public List<StoredSession> serializeSessions(List<Session> sessions) {
        List<StoredSession> result = new ArrayList<>(sessions.size());
        for (Session session : sessions) {
            result.add(serializeSession(session));
        }
        return result;
    }

    /**
     * 批量反序列化,单条失败时跳过并记录错误
     */
    public List<Session> deserializeSessions(List<StoredSession> storedSessions) {
        List<Session> result = new ArrayList<>(storedSessions.size());
        for (StoredSession stored : storedSessions) {
            try {
                result.add(deserializeSession(stored));
            } catch (StorageException e) {
                logger.error("会话反序列化失败,已跳过: id={}, {}", stored.getId(), e.getMessage());
            }
        }
        return result;
    }

    public CompressionStats getCompressionStats(List<StoredSession> storedSessions) {
        int compressed = 0;
        long totalSize = 0;
        for (StoredSession stored : storedSessions) {
            if (stored.isCompressed()) {
                compressed++;
            }
            totalSize += stored.getSize();
        }
        return new CompressionStats(storedSessions.size(), compressed, totalSize);
    }

    // ==================== 优化 ====================

    private Session optimizeSession(Session session, long now) {
        Session optimized = new Session(session);
        if (optimized.getTabs() != null) {
            for (Tab tab : optimized.getTabs()) {
                tab.setUrl(truncateUrl(tab.getUrl()));
                tab.setTitle(truncate(tab.getTitle(), MAX_TITLE_LENGTH));
                if (!shouldPreserveFormData(tab, now)) {
                    tab.setFormData(null);
                }
            }
        }
        SessionMetadata metadata = optimized.getMetadata();
        if (metadata != null) {
            metadata.setNotes(truncate(metadata.getNotes(), MAX_NOTES_LENGTH));
        }
        return optimized;
    }

    static String truncateUrl(String url) {
        if (url == null || url.length() <= MAX_URL_LENGTH) {
            return url;
        }
        String[] parts = UrlUtils.splitOriginAndPath(url);
        if (parts == null) {
            return url.substring(0, MAX_URL_LENGTH) + ELLIPSIS;
        }
        String path = parts[1].length() > MAX_PATH_LENGTH
                ? parts[1].substring(0, MAX_PATH_LENGTH) + ELLIPSIS
                : parts[1];
        return parts[0] + path;
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + ELLIPSIS;
    }

    private static boolean shouldPreserveFormData(Tab tab, long now) {
        return tab.getCreatedAt() > now - CommonConstant.ONE_HOUR_MILLIS;
    }

    private static List<String> extractDomains(List<Tab> tabs) {
        Set<String> domains = new LinkedHashSet<>();
        for (Tab tab : tabs) {
            String domain = UrlUtils.extractDomain(tab.getUrl());
            if (domain != null) {
                domains.add(domain);
            }
        }
        return new ArrayList<>(domains);
    }

    private long jsonSize(Object value) {
        try {
            return mapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to measure record size", e);
        }
    }
}

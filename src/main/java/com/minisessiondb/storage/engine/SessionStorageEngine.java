package com.minisessiondb.storage.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.CommonConstant;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.exception.InvalidRecordShapeException;
import com.minisessiondb.exception.RecordNotFoundException;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.metadata.SchemaRegistry;
import com.minisessiondb.model.NavigationEvent;
import com.minisessiondb.model.Session;
import com.minisessiondb.model.SessionBoundary;
import com.minisessiondb.model.SessionMetadata;
import com.minisessiondb.model.SessionPatch;
import com.minisessiondb.model.Tab;
import com.minisessiondb.model.TabPatch;
import com.minisessiondb.serializer.SessionDataSerializer;
import com.minisessiondb.storage.CursorDirection;
import com.minisessiondb.storage.KeyRange;
import com.minisessiondb.storage.RecordCursor;
import com.minisessiondb.storage.RecordStore;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.Transaction;
import com.minisessiondb.storage.TransactionMode;
import com.minisessiondb.storage.TransactionWork;
import com.minisessiondb.storage.UpgradeHandler;
import com.minisessiondb.storage.impl.FileRecordStore;
import com.minisessiondb.storage.impl.InMemoryRecordStore;
import com.minisessiondb.storage.record.DatabaseMetadata;
import com.minisessiondb.storage.record.IntegrityCheckResult;
import com.minisessiondb.storage.record.NavigationEventKey;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredSessionBoundary;
import com.minisessiondb.storage.record.StoredTab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * SessionStorageEngine - 会话存储引擎
 *
 * 在 {@link RecordStore} 之上提供会话、标签页、导航事件、会话边界的增删改查和查询。
 *
 * 核心功能:
 * 1. 初始化: 打开存储(必要时通过升级回调建表建索引),初始化元数据,执行启动维护
 * 2. CRUD: 写入前校验主键形状,序列化后在事务内写入,同一事务内调整元数据计数
 * 3. 查询: 按优先级选择索引,游标扫描 + 条件过滤 + offset/limit,扫描上限10000条
 * 4. 维护: 清理过期会话、刷新计数和存储大小估算、孤儿标签页扫描
 *
 * 索引选择优先级:
 * <pre>
 * 1. 有日期区间      → 创建时间/时间戳索引 (by_created_at / by_timestamp)
 * 2. 单值过滤条件    → 对应字段索引 (by_tag / by_session_id / by_window_id / by_tab_id)
 * 3. 其他            → 最近更新索引 (by_updated_at / by_created_at / by_timestamp)
 * </pre>
 * 默认倒序扫描(最新的在前);indexingEnabled=false 时一律按主键扫描。
 *
 * 设计原则:
 * - 所有公开操作返回CompletableFuture,在引擎的工作线程上执行
 * - initialize()幂等,并发调用共享同一个进行中的初始化
 * - 引擎不校验外键(乐观写入),引用关系由完整性校验器负责
 * - 删除会话在一个覆盖五个容器的事务内级联完成,要么全部生效要么全部回滚
 * - 启动维护失败只记录日志,只有打开存储失败是致命的
 *
 * 使用模式:
 * <pre>
 * SessionStorageEngine engine = new SessionStorageEngine(config, store, serializer, migrationManager, clock);
 * engine.initialize().join();
 *
 * StoredSession stored = engine.createSession(session).join();
 * List&lt;StoredSession&gt; work = engine.querySessions(
 *     SessionQuery.builder().tags("Work").build()).join();
 * </pre>
 */
public class SessionStorageEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionStorageEngine.class);

    /** 过期清理每轮最多删除的会话数 */
    static final int CLEANUP_BATCH_LIMIT = 1000;

    private static final Set<ContainerType> ALL_CONTAINERS = EnumSet.allOf(ContainerType.class);

    private final StorageConfig config;

    private final RecordStore store;

    private final SessionDataSerializer serializer;

    private final UpgradeHandler upgradeHandler;

    private final Clock clock;

    private final ExecutorService executor;

    private final boolean ownsExecutor;

    private final ObjectMapper sizeMapper;

    /** 进行中或已完成的初始化 */
    private final AtomicReference<CompletableFuture<Void>> initFuture = new AtomicReference<>();

    public SessionStorageEngine(StorageConfig config, RecordStore store, SessionDataSerializer serializer,
                                UpgradeHandler upgradeHandler, Clock clock) {
        this(config, store, serializer, upgradeHandler, clock, newWorkerPool(), true);
    }

    public SessionStorageEngine(StorageConfig config, RecordStore store, SessionDataSerializer serializer,
                                UpgradeHandler upgradeHandler, Clock clock, ExecutorService executor) {
        this(config, store, serializer, upgradeHandler, clock, executor, false);
    }

    private SessionStorageEngine(StorageConfig config, RecordStore store, SessionDataSerializer serializer,
                                 UpgradeHandler upgradeHandler, Clock clock, ExecutorService executor,
                                 boolean ownsExecutor) {
        this.config = config;
        this.store = store;
        this.serializer = serializer;
        this.upgradeHandler = upgradeHandler;
        this.clock = clock;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.sizeMapper = ObjectMappers.standard();
    }

    /**
     * 按配置创建底层存储: 配置了dataDir用文件存储,否则用内存存储
     */
    public static RecordStore newRecordStore(StorageConfig config) {
        if (config.getDataDir() != null) {
            return new FileRecordStore(config.getDataDir());
        }
        return new InMemoryRecordStore();
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "sessiondb-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public StorageConfig getConfig() {
        return config;
    }

    public RecordStore getStore() {
        return store;
    }

    public SessionDataSerializer getSerializer() {
        return serializer;
    }

    // ==================== 生命周期 ====================

    /**
     * 初始化引擎
     *
     * 并发调用共享同一个future;初始化失败后引用被清除,下次调用会重新尝试。
     */
    public CompletableFuture<Void> initialize() {
        CompletableFuture<Void> existing = initFuture.get();
        if (existing != null) {
            return existing;
        }
        CompletableFuture<Void> attempt = new CompletableFuture<>();
        if (!initFuture.compareAndSet(null, attempt)) {
            return initFuture.get();
        }
        try {
            executor.execute(() -> {
                try {
                    performInitialization();
                    attempt.complete(null);
                } catch (RuntimeException e) {
                    logger.error("存储引擎初始化失败: {}", e.getMessage(), e);
                    initFuture.compareAndSet(attempt, null);
                    attempt.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            initFuture.compareAndSet(attempt, null);
            attempt.completeExceptionally(new IllegalStateException("Storage engine is closed", e));
        }
        return attempt;
    }

    public boolean isInitialized() {
        CompletableFuture<Void> future = initFuture.get();
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    private void performInitialization() {
        if (!store.isOpen()) {
            int oldVersion = store.open(SchemaRegistry.LATEST_VERSION, upgradeHandler);
            logger.info("打开数据库 {}: version {} -> {}", SchemaRegistry.DATABASE_NAME, oldVersion, store.getVersion());
        }
        initializeMetadata();
        performMaintenance();
        logger.info("SessionStorageEngine 初始化完成: {}", config);
    }

    private void initializeMetadata() {
        long now = clock.millis();
        store.inTransaction(EnumSet.of(ContainerType.METADATA), TransactionMode.READ_WRITE, tx -> {
            if (tx.get(ContainerType.METADATA, metadataKey(), DatabaseMetadata.class) == null) {
                tx.put(new DatabaseMetadata(metadataKey(), now));
                logger.info("初始化数据库元数据: version={}", metadataKey());
            }
            return null;
        });
    }

    /**
     * 关闭存储。之后可以再次initialize()
     */
    public CompletableFuture<Void> shutdown() {
        return CompletableFuture.runAsync(this::doShutdown, executor);
    }

    private void doShutdown() {
        store.close();
        initFuture.set(null);
        logger.info("SessionStorageEngine 已关闭");
    }

    /**
     * 关闭存储并释放引擎自己创建的线程池
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            doShutdown();
            executor.shutdown();
        } else {
            shutdown().join();
        }
    }

    // ==================== 会话 ====================

    public CompletableFuture<StoredSession> createSession(Session session) {
        return submit(() -> doCreateSession(session));
    }

    public CompletableFuture<Optional<StoredSession>> getSession(String sessionId) {
        return submit(() -> Optional.ofNullable(read(ContainerType.SESSIONS,
                tx -> tx.get(ContainerType.SESSIONS, sessionId, StoredSession.class))));
    }

    /**
     * 部分更新会话: 反序列化 → 合并补丁 → 重新序列化,version加1,updatedAt重置为当前时间
     *
     * @throws RecordNotFoundException 会话不存在(包装在CompletionException中)
     */
    public CompletableFuture<StoredSession> updateSession(String sessionId, SessionPatch patch) {
        return submit(() -> doUpdateSession(sessionId, patch));
    }

    /**
     * 删除会话,并级联删除其标签页、导航事件和会话边界
     *
     * @throws RecordNotFoundException 会话不存在
     */
    public CompletableFuture<Void> deleteSession(String sessionId) {
        return submit(() -> {
            doDeleteSession(sessionId);
            return null;
        });
    }

    public CompletableFuture<List<StoredSession>> querySessions(SessionQuery query) {
        return submit(() -> doQuerySessions(query));
    }

    StoredSession doCreateSession(Session session) {
        StoredSession stored = serializer.serializeSession(session);
        checkShape(stored);
        long now = clock.millis();
        return write(EnumSet.of(ContainerType.SESSIONS, ContainerType.METADATA), tx -> {
            boolean existed = tx.get(ContainerType.SESSIONS, stored.getId(), StoredSession.class) != null;
            tx.put(stored);
            if (!existed) {
                adjustCounters(tx, now, 1, 0, 0);
            }
            logger.debug("创建会话: id={}, tag={}, tabs={}", stored.getId(), stored.getTag(), stored.getTotalTabCount());
            return stored;
        });
    }

    private StoredSession doUpdateSession(String sessionId, SessionPatch patch) {
        long now = clock.millis();
        return write(EnumSet.of(ContainerType.SESSIONS), tx -> {
            StoredSession existing = tx.get(ContainerType.SESSIONS, sessionId, StoredSession.class);
            if (existing == null) {
                throw new RecordNotFoundException(ContainerType.SESSIONS.getContainerName(), sessionId);
            }

            Session session = serializer.deserializeSession(existing);
            patch.applyTo(session);
            session.setUpdatedAt(now);

            StoredSession updated = serializer.serializeSession(session);
            updated.setVersion(existing.getVersion() + 1);
            updated.setLastModified(now);
            updated.setTotalNavigationEvents(existing.getTotalNavigationEvents());
            tx.put(updated);

            logger.debug("更新会话: id={}, version={}", sessionId, updated.getVersion());
            return updated;
        });
    }

    void doDeleteSession(String sessionId) {
        long now = clock.millis();
        write(ALL_CONTAINERS, tx -> {
            if (tx.delete(ContainerType.SESSIONS, sessionId) == null) {
                throw new RecordNotFoundException(ContainerType.SESSIONS.getContainerName(), sessionId);
            }
            int tabs = deleteByIndex(tx, ContainerType.TABS, SchemaRegistry.TAB_BY_SESSION_ID, sessionId);
            int events = deleteByIndex(tx, ContainerType.NAVIGATION_EVENTS, SchemaRegistry.NAV_BY_SESSION_ID, sessionId);
            int boundaries = deleteByIndex(tx, ContainerType.SESSION_BOUNDARIES,
                    SchemaRegistry.BOUNDARY_BY_SESSION_ID, sessionId);
            adjustCounters(tx, now, -1, -tabs, -events);

            logger.debug("删除会话 {}: 级联删除 {} 个标签页, {} 个导航事件, {} 个边界",
                    sessionId, tabs, events, boundaries);
            return null;
        });
    }

    List<StoredSession> doQuerySessions(SessionQuery query) {
        IndexPlan plan;
        if (query.getDateRange() != null) {
            plan = new IndexPlan(SchemaRegistry.SESSION_BY_CREATED_AT, rangeOf(query.getDateRange()));
        } else if (query.getTags().size() == 1) {
            plan = new IndexPlan(SchemaRegistry.SESSION_BY_TAG, KeyRange.only(query.getTags().get(0)));
        } else {
            plan = new IndexPlan(SchemaRegistry.SESSION_BY_UPDATED_AT, KeyRange.all());
        }
        return read(ContainerType.SESSIONS, tx -> scan(tx, ContainerType.SESSIONS, plan, query.getOptions(),
                StoredSession.class, session -> matchesSessionQuery(session, query)));
    }

    // ==================== 标签页 ====================

    /**
     * 写入标签页。不检查sessionId指向的会话是否存在
     */
    public CompletableFuture<StoredTab> createTab(Tab tab, String sessionId) {
        return submit(() -> doCreateTab(tab, sessionId));
    }

    public CompletableFuture<Optional<StoredTab>> getTab(int tabId) {
        return submit(() -> Optional.ofNullable(read(ContainerType.TABS,
                tx -> tx.get(ContainerType.TABS, tabId, StoredTab.class))));
    }

    /**
     * 部分更新标签页,lastAccessed重置为当前时间
     *
     * @throws RecordNotFoundException 标签页不存在
     */
    public CompletableFuture<StoredTab> updateTab(int tabId, TabPatch patch) {
        return submit(() -> doUpdateTab(tabId, patch));
    }

    /**
     * 删除标签页及其导航事件
     *
     * @throws RecordNotFoundException 标签页不存在
     */
    public CompletableFuture<Void> deleteTab(int tabId) {
        return submit(() -> {
            doDeleteTab(tabId);
            return null;
        });
    }

    public CompletableFuture<List<StoredTab>> queryTabs(TabQuery query) {
        return submit(() -> doQueryTabs(query));
    }

    StoredTab doCreateTab(Tab tab, String sessionId) {
        StoredTab stored = serializer.serializeTab(tab, sessionId);
        checkShape(stored);
        long now = clock.millis();
        return write(EnumSet.of(ContainerType.TABS, ContainerType.METADATA), tx -> {
            boolean existed = tx.get(ContainerType.TABS, stored.getId(), StoredTab.class) != null;
            tx.put(stored);
            if (!existed) {
                adjustCounters(tx, now, 0, 1, 0);
            }
            logger.debug("创建标签页: id={}, session={}, domain={}", stored.getId(), sessionId, stored.getDomain());
            return stored;
        });
    }

    private StoredTab doUpdateTab(int tabId, TabPatch patch) {
        long now = clock.millis();
        return write(EnumSet.of(ContainerType.TABS), tx -> {
            StoredTab existing = tx.get(ContainerType.TABS, tabId, StoredTab.class);
            if (existing == null) {
                throw new RecordNotFoundException(ContainerType.TABS.getContainerName(), tabId);
            }

            Tab tab = serializer.deserializeTab(existing);
            patch.applyTo(tab);
            tab.setLastAccessed(now);

            StoredTab updated = serializer.serializeTab(tab, existing.getSessionId());
            updated.setActive(existing.isActive());
            updated.setInteractionCount(existing.getInteractionCount());
            updated.setFocusTime(existing.getFocusTime());
            updated.setNavigationCount(existing.getNavigationCount());
            updated.setFirstNavigationAt(existing.getFirstNavigationAt());
            updated.setLastNavigationAt(existing.getLastNavigationAt());
            updated.setVersion(existing.getVersion() + 1);
            updated.setLastModified(now);
            tx.put(updated);
            return updated;
        });
    }

    private void doDeleteTab(int tabId) {
        long now = clock.millis();
        write(EnumSet.of(ContainerType.TABS, ContainerType.NAVIGATION_EVENTS, ContainerType.METADATA), tx -> {
            if (tx.delete(ContainerType.TABS, tabId) == null) {
                throw new RecordNotFoundException(ContainerType.TABS.getContainerName(), tabId);
            }
            int events = deleteByIndex(tx, ContainerType.NAVIGATION_EVENTS, SchemaRegistry.NAV_BY_TAB_ID, tabId);
            adjustCounters(tx, now, 0, -1, -events);
            logger.debug("删除标签页 {}: 级联删除 {} 个导航事件", tabId, events);
            return null;
        });
    }

    List<StoredTab> doQueryTabs(TabQuery query) {
        IndexPlan plan;
        if (query.getDateRange() != null) {
            plan = new IndexPlan(SchemaRegistry.TAB_BY_CREATED_AT, rangeOf(query.getDateRange()));
        } else if (query.getSessionIds().size() == 1) {
            plan = new IndexPlan(SchemaRegistry.TAB_BY_SESSION_ID, KeyRange.only(query.getSessionIds().get(0)));
        } else if (query.getWindowIds().size() == 1) {
            plan = new IndexPlan(SchemaRegistry.TAB_BY_WINDOW_ID, KeyRange.only(query.getWindowIds().get(0)));
        } else {
            plan = new IndexPlan(SchemaRegistry.TAB_BY_CREATED_AT, KeyRange.all());
        }
        return read(ContainerType.TABS, tx -> scan(tx, ContainerType.TABS, plan, query.getOptions(),
                StoredTab.class, tab -> matchesTabQuery(tab, query)));
    }

    // ==================== 导航事件 ====================

    /**
     * 写入导航事件,并更新所属标签页的导航摘要和所属会话的事件计数(两者存在时)
     */
    public CompletableFuture<StoredNavigationEvent> createNavigationEvent(NavigationEvent event, String sessionId) {
        return submit(() -> doCreateNavigationEvent(event, sessionId));
    }

    public CompletableFuture<Optional<StoredNavigationEvent>> getNavigationEvent(int tabId, long timestamp) {
        NavigationEventKey key = new NavigationEventKey(tabId, timestamp);
        return submit(() -> Optional.ofNullable(read(ContainerType.NAVIGATION_EVENTS,
                tx -> tx.get(ContainerType.NAVIGATION_EVENTS, key, StoredNavigationEvent.class))));
    }

    /**
     * @throws RecordNotFoundException 事件不存在
     */
    public CompletableFuture<Void> deleteNavigationEvent(int tabId, long timestamp) {
        NavigationEventKey key = new NavigationEventKey(tabId, timestamp);
        long now = clock.millis();
        return submit(() -> write(EnumSet.of(ContainerType.NAVIGATION_EVENTS, ContainerType.METADATA), tx -> {
            if (tx.delete(ContainerType.NAVIGATION_EVENTS, key) == null) {
                throw new RecordNotFoundException(ContainerType.NAVIGATION_EVENTS.getContainerName(), key);
            }
            adjustCounters(tx, now, 0, 0, -1);
            return null;
        }));
    }

    public CompletableFuture<List<StoredNavigationEvent>> queryNavigationEvents(NavigationQuery query) {
        return submit(() -> doQueryNavigationEvents(query));
    }

    StoredNavigationEvent doCreateNavigationEvent(NavigationEvent event, String sessionId) {
        StoredNavigationEvent stored = serializer.serializeNavigationEvent(event, sessionId);
        checkShape(stored);
        long now = clock.millis();
        Set<ContainerType> scope = EnumSet.of(ContainerType.NAVIGATION_EVENTS, ContainerType.TABS,
                ContainerType.SESSIONS, ContainerType.METADATA);
        return write(scope, tx -> {
            boolean existed = tx.get(ContainerType.NAVIGATION_EVENTS, stored.key(), StoredNavigationEvent.class) != null;
            tx.put(stored);
            if (!existed) {
                adjustCounters(tx, now, 0, 0, 1);
                recordNavigationSummary(tx, stored, now);
            }
            return stored;
        });
    }

    private void recordNavigationSummary(Transaction tx, StoredNavigationEvent event, long now) {
        StoredTab tab = tx.get(ContainerType.TABS, event.getTabId(), StoredTab.class);
        if (tab != null) {
            long timestamp = event.getTimestamp();
            tab.setNavigationCount(tab.getNavigationCount() + 1);
            if (tab.getFirstNavigationAt() == null || timestamp < tab.getFirstNavigationAt()) {
                tab.setFirstNavigationAt(timestamp);
            }
            if (tab.getLastNavigationAt() == null || timestamp > tab.getLastNavigationAt()) {
                tab.setLastNavigationAt(timestamp);
            }
            tab.setLastModified(now);
            tx.put(tab);
        }
        if (event.getSessionId() != null) {
            StoredSession session = tx.get(ContainerType.SESSIONS, event.getSessionId(), StoredSession.class);
            if (session != null) {
                session.setTotalNavigationEvents(session.getTotalNavigationEvents() + 1);
                session.setLastModified(now);
                tx.put(session);
            }
        }
    }

    List<StoredNavigationEvent> doQueryNavigationEvents(NavigationQuery query) {
        IndexPlan plan;
        if (query.getDateRange() != null) {
            plan = new IndexPlan(SchemaRegistry.NAV_BY_TIMESTAMP, rangeOf(query.getDateRange()));
        } else if (query.getSessionIds().size() == 1) {
            plan = new IndexPlan(SchemaRegistry.NAV_BY_SESSION_ID, KeyRange.only(query.getSessionIds().get(0)));
        } else if (query.getTabIds().size() == 1) {
            plan = new IndexPlan(SchemaRegistry.NAV_BY_TAB_ID, KeyRange.only(query.getTabIds().get(0)));
        } else {
            plan = new IndexPlan(SchemaRegistry.NAV_BY_TIMESTAMP, KeyRange.all());
        }
        return read(ContainerType.NAVIGATION_EVENTS, tx -> scan(tx, ContainerType.NAVIGATION_EVENTS, plan,
                query.getOptions(), StoredNavigationEvent.class, event -> matchesNavigationQuery(event, query)));
    }

    // ==================== 会话边界 ====================

    public CompletableFuture<StoredSessionBoundary> createSessionBoundary(SessionBoundary boundary) {
        return submit(() -> {
            StoredSessionBoundary stored = serializer.serializeSessionBoundary(boundary);
            checkShape(stored);
            return write(EnumSet.of(ContainerType.SESSION_BOUNDARIES), tx -> {
                tx.put(stored);
                return stored;
            });
        });
    }

    public CompletableFuture<Optional<StoredSessionBoundary>> getSessionBoundary(String boundaryId) {
        return submit(() -> Optional.ofNullable(read(ContainerType.SESSION_BOUNDARIES,
                tx -> tx.get(ContainerType.SESSION_BOUNDARIES, boundaryId, StoredSessionBoundary.class))));
    }

    /**
     * 会话的全部边界,按时间升序
     */
    public CompletableFuture<List<StoredSessionBoundary>> getSessionBoundaries(String sessionId) {
        return submit(() -> read(ContainerType.SESSION_BOUNDARIES, tx -> {
            List<StoredSessionBoundary> boundaries = new ArrayList<>();
            RecordCursor<StoredSessionBoundary> cursor = tx.openCursor(ContainerType.SESSION_BOUNDARIES,
                    SchemaRegistry.BOUNDARY_BY_SESSION_ID, KeyRange.only(sessionId), CursorDirection.NEXT,
                    StoredSessionBoundary.class);
            while (cursor.hasNext()) {
                boundaries.add(cursor.next());
            }
            boundaries.sort(Comparator.comparingLong(StoredSessionBoundary::getTimestamp));
            return boundaries;
        }));
    }

    /**
     * @throws RecordNotFoundException 边界不存在
     */
    public CompletableFuture<Void> deleteSessionBoundary(String boundaryId) {
        return submit(() -> write(EnumSet.of(ContainerType.SESSION_BOUNDARIES), tx -> {
            if (tx.delete(ContainerType.SESSION_BOUNDARIES, boundaryId) == null) {
                throw new RecordNotFoundException(ContainerType.SESSION_BOUNDARIES.getContainerName(), boundaryId);
            }
            return null;
        }));
    }

    // ==================== 修复 ====================

    /**
     * 把记录上的校验和改写为按当前内容重算的值
     *
     * @return 新校验和
     * @throws RecordNotFoundException 记录不存在
     */
    public CompletableFuture<String> repairChecksum(ContainerType type, Object key) {
        return submit(() -> doRepairChecksum(type, key));
    }

    String doRepairChecksum(ContainerType type, Object key) {
        if (type == ContainerType.METADATA) {
            throw new IllegalArgumentException("Metadata records carry no checksum");
        }
        return write(EnumSet.of(type), tx -> {
            StoredRecord record = tx.get(type, key, type.getRecordClass());
            if (record == null) {
                throw new RecordNotFoundException(type.getContainerName(), key);
            }
            serializer.refreshChecksum(record);
            tx.put(record);
            String checksum = SessionDataSerializer.storedChecksum(record);
            logger.info("已修复校验和: {}[{}] -> {}", type.getContainerName(), key, checksum);
            return checksum;
        });
    }

    /**
     * 把导航事件改挂到另一个会话
     *
     * @throws RecordNotFoundException 事件不存在
     */
    public CompletableFuture<StoredNavigationEvent> reassignNavigationEvent(int tabId, long timestamp,
                                                                            String sessionId) {
        return submit(() -> doReassignNavigationEvent(new NavigationEventKey(tabId, timestamp), sessionId));
    }

    StoredNavigationEvent doReassignNavigationEvent(NavigationEventKey key, String sessionId) {
        return write(EnumSet.of(ContainerType.NAVIGATION_EVENTS), tx -> {
            StoredNavigationEvent event = tx.get(ContainerType.NAVIGATION_EVENTS, key, StoredNavigationEvent.class);
            if (event == null) {
                throw new RecordNotFoundException(ContainerType.NAVIGATION_EVENTS.getContainerName(), key);
            }
            String previous = event.getSessionId();
            event.setSessionId(sessionId);
            event.setVersion(event.getVersion() + 1);
            tx.put(event);
            logger.info("导航事件 {} 从会话 {} 改挂到 {}", key, previous, sessionId);
            return event;
        });
    }

    // ==================== 全量操作 ====================

    /**
     * 读取全部容器的一致快照
     */
    public CompletableFuture<StoreSnapshot> exportAll() {
        return submit(this::doExportAll);
    }

    StoreSnapshot doExportAll() {
        return store.inTransaction(ALL_CONTAINERS, TransactionMode.READ_ONLY,
                tx -> StoreSnapshot.capture(tx, store.getContainerNames()));
    }

    /**
     * 重新写入快照中的记录(不含元数据),每batchSize条一个事务,完成后按实际记录数刷新计数
     *
     * @param snapshot 记录来源(备份恢复或导入)
     * @param overwrite 主键已存在时是否覆盖
     * @return 实际写入的记录数
     */
    public CompletableFuture<Integer> importRecords(StoreSnapshot snapshot, boolean overwrite) {
        return submit(() -> doImportRecords(snapshot, overwrite));
    }

    int doImportRecords(StoreSnapshot snapshot, boolean overwrite) {
        List<StoredRecord> records = new ArrayList<>(snapshot.totalItems());
        records.addAll(snapshot.getSessions());
        records.addAll(snapshot.getTabs());
        records.addAll(snapshot.getNavigationEvents());
        records.addAll(snapshot.getBoundaries());

        int written = 0;
        int skipped = 0;
        int batchSize = config.getBatchSize();
        for (int start = 0; start < records.size(); start += batchSize) {
            List<StoredRecord> batch = records.subList(start, Math.min(records.size(), start + batchSize));
            List<StoredRecord> accepted = new ArrayList<>(batch.size());
            for (StoredRecord record : batch) {
                String missing = SchemaRegistry.findMissingKeyPath(record);
                if (missing != null) {
                    logger.warn("跳过缺少主键字段 {} 的 {} 记录", missing, record.containerType().getContainerName());
                    skipped++;
                } else {
                    accepted.add(record);
                }
            }
            written += write(ALL_CONTAINERS, tx -> {
                int count = 0;
                for (StoredRecord record : accepted) {
                    if (!overwrite && tx.get(record.containerType(), record.primaryKey(), StoredRecord.class) != null) {
                        continue;
                    }
                    tx.put(record);
                    count++;
                }
                return count;
            });
        }

        refreshCounters(clock.millis());
        logger.info("导入完成: 写入 {} 条, 跳过 {} 条(主键缺失), 共 {} 条", written, skipped, records.size());
        return written;
    }

    /**
     * 清空全部容器并重新初始化元数据
     */
    public CompletableFuture<Void> clearAllData() {
        long now = clock.millis();
        return submit(() -> write(ALL_CONTAINERS, tx -> {
            for (ContainerType type : ALL_CONTAINERS) {
                tx.clear(type);
            }
            tx.put(new DatabaseMetadata(metadataKey(), now));
            logger.info("已清空全部数据");
            return null;
        }));
    }

    /**
     * 存储统计。boundaries为实际记录数,oldest/newest取自会话创建时间索引
     */
    public CompletableFuture<StorageStats> getStorageStats() {
        return submit(() -> store.inTransaction(
                EnumSet.of(ContainerType.SESSIONS, ContainerType.SESSION_BOUNDARIES, ContainerType.METADATA),
                TransactionMode.READ_ONLY, tx -> {
                    DatabaseMetadata metadata = tx.get(ContainerType.METADATA, metadataKey(), DatabaseMetadata.class);
                    int boundaries = tx.count(ContainerType.SESSION_BOUNDARIES);
                    long oldest = firstCreatedAt(tx, CursorDirection.NEXT);
                    long newest = firstCreatedAt(tx, CursorDirection.PREV);
                    if (metadata == null) {
                        return new StorageStats(0, 0, 0, boundaries, 0, oldest, newest, false);
                    }
                    return new StorageStats(metadata.getTotalSessions(), metadata.getTotalTabs(),
                            metadata.getTotalNavigationEvents(), boundaries, metadata.getStorageSize(),
                            oldest, newest, metadata.getIntegrityCheck() != null && metadata.getIntegrityCheck().isValid());
                }));
    }

    private long firstCreatedAt(Transaction tx, CursorDirection direction) {
        RecordCursor<StoredSession> cursor = tx.openCursor(ContainerType.SESSIONS,
                SchemaRegistry.SESSION_BY_CREATED_AT, KeyRange.all(), direction, StoredSession.class);
        return cursor.hasNext() ? cursor.next().getCreatedAt() : 0L;
    }

    // ==================== 维护 ====================

    /**
     * 执行一轮完整维护: 过期清理 → 刷新统计 → 完整性扫描(若启用)
     */
    public CompletableFuture<Void> runMaintenance() {
        return submit(() -> {
            performMaintenance();
            return null;
        });
    }

    public CompletableFuture<Integer> cleanupOldData() {
        return submit(() -> doCleanupOldData(clock.millis()));
    }

    public CompletableFuture<IntegrityCheckResult> runIntegrityCheck() {
        return submit(() -> doRunIntegrityCheck(clock.millis()));
    }

    private void performMaintenance() {
        long now = clock.millis();
        try {
            doCleanupOldData(now);
        } catch (RuntimeException e) {
            logger.warn("过期会话清理失败: {}", e.getMessage(), e);
        }
        try {
            refreshCounters(now);
        } catch (RuntimeException e) {
            logger.warn("存储统计刷新失败: {}", e.getMessage(), e);
        }
        if (config.isEnableIntegrityChecks()) {
            try {
                doRunIntegrityCheck(now);
            } catch (RuntimeException e) {
                logger.warn("完整性扫描失败: {}", e.getMessage(), e);
            }
        }
    }

    int doCleanupOldData(long now) {
        long cutoff = now - config.getMaxSessionAge().toMillis();
        if (cutoff < 0) {
            return 0;
        }
        SessionQuery query = SessionQuery.builder()
                .dateRange(0, cutoff)
                .options(QueryOptions.limit(CLEANUP_BATCH_LIMIT))
                .build();
        List<StoredSession> expired = doQuerySessions(query);
        int deleted = 0;
        for (StoredSession session : expired) {
            try {
                doDeleteSession(session.getId());
                deleted++;
            } catch (RecordNotFoundException e) {
                logger.debug("会话 {} 已被并发删除", session.getId());
            }
        }
        if (deleted > 0) {
            logger.info("清理了 {} 个过期会话(createdAt <= {})", deleted, cutoff);
        }
        return deleted;
    }

    /**
     * 按实际记录数重算计数,并估算存储大小(各记录JSON字节数之和)
     */
    void refreshCounters(long now) {
        write(ALL_CONTAINERS, tx -> {
            DatabaseMetadata metadata = tx.get(ContainerType.METADATA, metadataKey(), DatabaseMetadata.class);
            if (metadata == null) {
                metadata = new DatabaseMetadata(metadataKey(), now);
            }
            long size = 0;
            for (ContainerType type : ALL_CONTAINERS) {
                if (type == ContainerType.METADATA) {
                    continue;
                }
                for (StoredRecord record : tx.getAll(type, StoredRecord.class)) {
                    size += estimateSize(record);
                }
            }
            metadata.setTotalSessions(tx.count(ContainerType.SESSIONS));
            metadata.setTotalTabs(tx.count(ContainerType.TABS));
            metadata.setTotalNavigationEvents(tx.count(ContainerType.NAVIGATION_EVENTS));
            metadata.setStorageSize(size);
            metadata.setLastModified(now);
            tx.put(metadata);

            if (size > config.getMaxStorageSize()) {
                logger.warn("存储大小 {} 字节超过上限 {} 字节", size, config.getMaxStorageSize());
            }
            return null;
        });
    }

    IntegrityCheckResult doRunIntegrityCheck(long now) {
        Set<ContainerType> scope = EnumSet.of(ContainerType.SESSIONS, ContainerType.TABS, ContainerType.METADATA);
        IntegrityCheckResult result = write(scope, tx -> {
            List<String> errors = new ArrayList<>();
            RecordCursor<StoredTab> cursor = tx.openCursor(ContainerType.TABS, null, KeyRange.all(),
                    CursorDirection.NEXT, StoredTab.class);
            while (cursor.hasNext() && cursor.getVisitedCount() < CommonConstant.MAX_SCAN_RECORDS) {
                StoredTab tab = cursor.next();
                if (tab.getSessionId() == null
                        || tx.get(ContainerType.SESSIONS, tab.getSessionId(), StoredSession.class) == null) {
                    errors.add("Orphaned tab: " + tab.getId() + " references non-existent session: " + tab.getSessionId());
                }
            }

            IntegrityCheckResult check = new IntegrityCheckResult(now, errors.isEmpty(), errors);
            DatabaseMetadata metadata = tx.get(ContainerType.METADATA, metadataKey(), DatabaseMetadata.class);
            if (metadata != null) {
                metadata.setIntegrityCheck(check);
                metadata.setLastModified(now);
                tx.put(metadata);
            }
            return check;
        });
        if (!result.isValid()) {
            logger.warn("完整性扫描发现 {} 个问题: {}", result.getErrors().size(), result.getErrors());
        }
        return result;
    }

    /**
     * 记录最近一次备份时间
     */
    public CompletableFuture<Void> recordBackup(long timestamp) {
        return submit(() -> write(EnumSet.of(ContainerType.METADATA), tx -> {
            DatabaseMetadata metadata = tx.get(ContainerType.METADATA, metadataKey(), DatabaseMetadata.class);
            if (metadata != null) {
                metadata.setLastBackup(timestamp);
                metadata.setLastModified(clock.millis());
                tx.put(metadata);
            }
            return null;
        }));
    }

    public CompletableFuture<Optional<DatabaseMetadata>> getDatabaseMetadata() {
        return submit(() -> Optional.ofNullable(read(ContainerType.METADATA,
                tx -> tx.get(ContainerType.METADATA, metadataKey(), DatabaseMetadata.class))));
    }

    // ==================== 查询匹配 ====================

    static boolean matchesSessionQuery(StoredSession session, SessionQuery query) {
        if (!query.getTags().isEmpty() && !query.getTags().contains(session.getTag())) {
            return false;
        }
        if (query.getDateRange() != null && !query.getDateRange().contains(session.getCreatedAt())) {
            return false;
        }
        if (!query.getDomains().isEmpty() && !anyContains(session.getDomains(), query.getDomains())) {
            return false;
        }
        String searchText = query.getSearchText();
        if (searchText != null && !searchText.isEmpty()) {
            String needle = searchText.toLowerCase(Locale.ROOT);
            SessionMetadata metadata = session.getMetadata();
            boolean matches = containsIgnoreCase(session.getTag(), needle)
                    || (metadata != null && (containsIgnoreCase(metadata.getPurpose(), needle)
                    || containsIgnoreCase(metadata.getNotes(), needle)));
            if (!matches) {
                return false;
            }
        }
        return true;
    }

    static boolean matchesTabQuery(StoredTab tab, TabQuery query) {
        if (!query.getSessionIds().isEmpty() && !query.getSessionIds().contains(tab.getSessionId())) {
            return false;
        }
        if (!query.getWindowIds().isEmpty() && !query.getWindowIds().contains(tab.getWindowId())) {
            return false;
        }
        if (!query.getDomains().isEmpty() && !containsAny(tab.getDomain(), query.getDomains())) {
            return false;
        }
        return query.getDateRange() == null || query.getDateRange().contains(tab.getCreatedAt());
    }

    static boolean matchesNavigationQuery(StoredNavigationEvent event, NavigationQuery query) {
        if (!query.getSessionIds().isEmpty() && !query.getSessionIds().contains(event.getSessionId())) {
            return false;
        }
        if (!query.getTabIds().isEmpty() && !query.getTabIds().contains(event.getTabId())) {
            return false;
        }
        if (!query.getDomains().isEmpty() && !containsAny(event.getDomain(), query.getDomains())) {
            return false;
        }
        return query.getDateRange() == null
                || (event.getTimestamp() != null && query.getDateRange().contains(event.getTimestamp()));
    }

    private static boolean anyContains(List<String> values, List<String> needles) {
        if (values == null) {
            return false;
        }
        for (String value : values) {
            if (containsAny(value, needles)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String value, List<String> needles) {
        if (value == null) {
            return false;
        }
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(String value, String lowerNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }

    // ==================== 内部工具 ====================

    /**
     * 游标扫描: 跳过前offset个匹配项,收集到limit个为止,最多访问MAX_SCAN_RECORDS条记录
     */
    private <T extends StoredRecord> List<T> scan(Transaction tx, ContainerType type, IndexPlan plan,
                                                  QueryOptions options, Class<T> recordClass, Predicate<T> matcher) {
        String indexName = config.isIndexingEnabled() ? plan.indexName : null;
        KeyRange range = config.isIndexingEnabled() ? plan.range : KeyRange.all();
        RecordCursor<T> cursor = tx.openCursor(type, indexName, range, options.direction(), recordClass);

        List<T> results = new ArrayList<>();
        int skipped = 0;
        while (results.size() < options.getLimit() && cursor.hasNext()) {
            T record = cursor.next();
            if (matcher.test(record)) {
                if (skipped >= options.getOffset()) {
                    results.add(record);
                } else {
                    skipped++;
                }
            }
            if (cursor.getVisitedCount() >= CommonConstant.MAX_SCAN_RECORDS) {
                logger.warn("查询 {} 扫描记录数达到上限 {},提前返回 {} 条结果",
                        type.getContainerName(), CommonConstant.MAX_SCAN_RECORDS, results.size());
                break;
            }
        }
        return results;
    }

    private static int deleteByIndex(Transaction tx, ContainerType type, String indexName, Object key) {
        RecordCursor<StoredRecord> cursor = tx.openCursor(type, indexName, KeyRange.only(key),
                CursorDirection.NEXT, StoredRecord.class);
        int deleted = 0;
        while (cursor.hasNext()) {
            cursor.next();
            cursor.remove();
            deleted++;
        }
        return deleted;
    }

    private void adjustCounters(Transaction tx, long now, int sessions, int tabs, int events) {
        DatabaseMetadata metadata = tx.get(ContainerType.METADATA, metadataKey(), DatabaseMetadata.class);
        if (metadata == null) {
            return;
        }
        metadata.setTotalSessions(Math.max(0, metadata.getTotalSessions() + sessions));
        metadata.setTotalTabs(Math.max(0, metadata.getTotalTabs() + tabs));
        metadata.setTotalNavigationEvents(Math.max(0, metadata.getTotalNavigationEvents() + events));
        metadata.setLastModified(now);
        tx.put(metadata);
    }

    private static void checkShape(StoredRecord record) {
        if (!SchemaRegistry.hasRequiredKeys(record)) {
            throw new InvalidRecordShapeException(record.containerType().getContainerName(),
                    "missing key path '" + SchemaRegistry.findMissingKeyPath(record) + "'");
        }
    }

    private static KeyRange rangeOf(DateRange range) {
        return KeyRange.bound(range.getStart(), range.getEnd());
    }

    private int metadataKey() {
        return store.getVersion();
    }

    private long estimateSize(StoredRecord record) {
        if (record instanceof StoredSession session) {
            return session.getSize();
        }
        try {
            return sizeMapper.writeValueAsBytes(record).length;
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to estimate record size", e);
        }
    }

    private <T> T read(ContainerType type, TransactionWork<T> work) {
        return store.inTransaction(EnumSet.of(type), TransactionMode.READ_ONLY, work);
    }

    private <T> T write(Collection<ContainerType> scope, TransactionWork<T> work) {
        return store.inTransaction(scope, TransactionMode.READ_WRITE, work);
    }

    /**
     * 确保已初始化,再在工作线程上执行
     */
    private <T> CompletableFuture<T> submit(Supplier<T> work) {
        return initialize().thenApplyAsync(ignored -> work.get(), executor);
    }

    private static final class IndexPlan {
        private final String indexName;
        private final KeyRange range;

        private IndexPlan(String indexName, KeyRange range) {
            this.indexName = indexName;
            this.range = range;
        }
    }
}

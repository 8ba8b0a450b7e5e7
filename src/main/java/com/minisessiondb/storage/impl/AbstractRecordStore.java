package com.minisessiondb.storage.impl;

import com.minisessiondb.exception.StorageException;
import com.minisessiondb.metadata.ContainerDefinition;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.metadata.IndexDefinition;
import com.minisessiondb.storage.RecordStore;
import com.minisessiondb.storage.SchemaEditor;
import com.minisessiondb.storage.TransactionMode;
import com.minisessiondb.storage.TransactionWork;
import com.minisessiondb.storage.UpgradeContext;
import com.minisessiondb.storage.UpgradeHandler;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.table.Container;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * AbstractRecordStore - 记录存储的公共实现
 *
 * 负责容器管理、事务加锁、撤销日志和版本升级;子类只决定数据落在哪里。
 *
 * 核心流程:
 * 1. open: loadState() 读取持久化状态 → 版本比较 → 必要时回调升级 → persistAll()
 * 2. inTransaction: 按容器名排序加锁 → 执行工作单元 → onCommit(脏容器) → 解锁
 * 3. 工作单元抛出异常或onCommit失败: 按撤销日志逆序恢复内存状态
 *
 * 升级失败的恢复:
 * 升级前对全部容器做深拷贝,失败时整体换回,版本号不变。
 * 因此一次失败的迁移不会留下半套结构。
 *
 * 子类钩子:
 * - loadState(): 打开时加载容器和版本(内存实现为空操作)
 * - onCommit(dirty): 提交读写事务时持久化被修改的容器
 * - persistAll(): 升级完成后持久化结构和全部数据
 */
public abstract class AbstractRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(AbstractRecordStore.class);

    /** 容器名 → 容器 */
    protected final Map<String, Container> containers;

    /** 容器名 → 读写锁 */
    private final Map<String, ReentrantReadWriteLock> locks;

    /** 当前schema版本(全新存储为0) */
    protected volatile int version;

    private volatile boolean opened;

    /** 是否处于升级回调中(只有此时允许结构变更) */
    private volatile boolean upgrading;

    private final Object lifecycleMonitor = new Object();

    protected AbstractRecordStore() {
        this.containers = new ConcurrentHashMap<>();
        this.locks = new ConcurrentHashMap<>();
        this.version = 0;
        this.opened = false;
        this.upgrading = false;
    }

    @Override
    public int open(int targetVersion, UpgradeHandler upgradeHandler) {
        if (targetVersion < 1) {
            throw new IllegalArgumentException("Target version must be positive: " + targetVersion);
        }
        synchronized (lifecycleMonitor) {
            if (opened) {
                throw new IllegalStateException("Store is already open");
            }

            loadState();
            int oldVersion = version;

            if (targetVersion < oldVersion) {
                throw new StorageException("Cannot open store at version " + targetVersion
                        + ": persisted version is " + oldVersion);
            }

            if (targetVersion > oldVersion) {
                runUpgrade(oldVersion, targetVersion, upgradeHandler);
            }

            opened = true;
            logger.info("存储已打开: version={}, containers={}", version, containers.keySet());
            return oldVersion;
        }
    }

    private void runUpgrade(int oldVersion, int newVersion, UpgradeHandler upgradeHandler) {
        logger.info("升级存储结构: {} -> {}", oldVersion, newVersion);

        Map<String, Container> before = copyContainers();
        StoreTransaction transaction = new StoreTransaction(this, null, TransactionMode.READ_WRITE);
        UpgradeContext context = new UpgradeContext(new Editor(), transaction, oldVersion, newVersion);

        upgrading = true;
        try {
            if (upgradeHandler != null) {
                upgradeHandler.onUpgrade(context, oldVersion, newVersion);
            }
            transaction.finish();
            version = newVersion;
            persistAll();
        } catch (RuntimeException e) {
            transaction.finish();
            containers.clear();
            containers.putAll(before);
            version = oldVersion;
            logger.error("存储升级失败,已恢复到版本 {}: {}", oldVersion, e.getMessage());
            throw e;
        } finally {
            upgrading = false;
        }
    }

    @Override
    public <T> T inTransaction(Collection<ContainerType> scope, TransactionMode mode, TransactionWork<T> work) {
        checkOpen();
        if (scope == null || scope.isEmpty()) {
            throw new IllegalArgumentException("Transaction scope cannot be empty");
        }

        // 按容器名排序,所有事务以相同顺序加锁
        TreeSet<String> names = new TreeSet<>();
        for (ContainerType type : scope) {
            names.add(type.getContainerName());
        }
        for (String name : names) {
            if (!containers.containsKey(name)) {
                throw new StorageException("Container not found: " + name);
            }
        }

        List<Lock> acquired = new ArrayList<>(names.size());
        try {
            for (String name : names) {
                ReentrantReadWriteLock rw = locks.computeIfAbsent(name, n -> new ReentrantReadWriteLock());
                Lock lock = mode == TransactionMode.READ_ONLY ? rw.readLock() : rw.writeLock();
                lock.lock();
                acquired.add(lock);
            }

            StoreTransaction transaction = new StoreTransaction(this, names, mode);
            try {
                T result = work.execute(transaction);
                if (!transaction.getDirtyContainers().isEmpty()) {
                    onCommit(transaction.getDirtyContainers());
                }
                transaction.finish();
                return result;
            } catch (RuntimeException e) {
                transaction.rollback();
                throw e;
            }
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    @Override
    public int getVersion() {
        return version;
    }

    @Override
    public boolean isOpen() {
        return opened;
    }

    @Override
    public Set<String> getContainerNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(containers.keySet()));
    }

    @Override
    public void close() {
        synchronized (lifecycleMonitor) {
            if (!opened) {
                return;
            }
            opened = false;
            onClose();
            logger.info("存储已关闭");
        }
    }

    /**
     * 获取容器定义(含升级时追加的索引)
     */
    public ContainerDefinition getContainerDefinition(String containerName) {
        Container container = containers.get(containerName);
        return container == null ? null : container.getDefinition();
    }

    Container getContainer(String containerName) {
        return containers.get(containerName);
    }

    protected void checkOpen() {
        if (!opened) {
            throw new IllegalStateException("Store is not open");
        }
    }

    /**
     * 深拷贝全部容器(升级失败时用于整体恢复)
     */
    private Map<String, Container> copyContainers() {
        Map<String, Container> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Container> entry : containers.entrySet()) {
            Container original = entry.getValue();
            Container duplicate = new Container(original.getDefinition());
            for (StoredRecord record : original.values()) {
                duplicate.put(record.copy());
            }
            copy.put(entry.getKey(), duplicate);
        }
        return copy;
    }

    protected abstract void loadState();

    protected abstract void onCommit(Set<String> dirtyContainers);

    protected abstract void persistAll();

    protected void onClose() {
    }

    /**
     * 升级期间的结构编辑器
     */
    private final class Editor implements SchemaEditor {

        @Override
        public boolean hasContainer(String containerName) {
            return containers.containsKey(containerName);
        }

        @Override
        public Set<String> getContainerNames() {
            return new LinkedHashSet<>(containers.keySet());
        }

        @Override
        public Set<String> getIndexNames(String containerName) {
            return requireContainer(containerName).getIndexNames();
        }

        @Override
        public void createContainer(ContainerDefinition definition) {
            checkUpgrading();
            if (containers.containsKey(definition.getName())) {
                throw new IllegalStateException("Container already exists: " + definition.getName());
            }
            containers.put(definition.getName(), new Container(definition));
            locks.computeIfAbsent(definition.getName(), n -> new ReentrantReadWriteLock());
            logger.debug("创建容器: {}, 索引: {}", definition.getName(), definition.getIndexes().size());
        }

        @Override
        public void createIndex(String containerName, IndexDefinition index) {
            checkUpgrading();
            requireContainer(containerName).createIndex(index);
            logger.debug("创建索引: {}.{}", containerName, index.getName());
        }

        @Override
        public void deleteContainer(String containerName) {
            checkUpgrading();
            if (containers.remove(containerName) != null) {
                logger.debug("删除容器: {}", containerName);
            }
        }

        private Container requireContainer(String containerName) {
            Container container = containers.get(containerName);
            if (container == null) {
                throw new StorageException("Container not found: " + containerName);
            }
            return container;
        }

        private void checkUpgrading() {
            if (!upgrading) {
                throw new IllegalStateException("Schema changes are only allowed during an upgrade");
            }
        }
    }
}

package com.minisessiondb.storage;

import com.minisessiondb.metadata.ContainerType;

import java.util.Collection;
import java.util.Set;

/**
 * RecordStore - 底层事务性记录存储接口
 *
 * 提供按容器组织的记录存储、有序二级索引、多容器事务和带版本号的结构升级。
 * 对应浏览器中IndexedDB的角色。
 *
 * 实现:
 * - InMemoryRecordStore: 纯内存,进程内关闭后重新打开数据仍在
 * - FileRecordStore: 每个容器一个JSON文件,提交时原子替换
 *
 * 使用模式:
 * <pre>
 * RecordStore store = new FileRecordStore(Path.of("data/sessions"));
 * int oldVersion = store.open(SchemaRegistry.LATEST_VERSION, migrationManager);
 *
 * StoredSession session = store.inTransaction(
 *     EnumSet.of(ContainerType.SESSIONS), TransactionMode.READ_ONLY,
 *     tx -> tx.get(ContainerType.SESSIONS, "s1", StoredSession.class));
 *
 * store.close();
 * </pre>
 *
 * 并发:
 * - 每个容器一把读写锁,事务按容器名排序加锁,避免死锁
 * - 锁不跨事务持有,两个操作之间的并发写按"后写者胜"处理
 */
public interface RecordStore extends AutoCloseable {

    /**
     * 打开存储,必要时执行升级
     *
     * @param targetVersion 目标schema版本
     * @param upgradeHandler 升级回调
     * @return 打开前的持久化版本(全新存储为0)
     * @throws com.minisessiondb.exception.StorageException 升级失败或目标版本低于持久化版本
     */
    int open(int targetVersion, UpgradeHandler upgradeHandler);

    /**
     * 不打开存储,读取持久化版本
     */
    int peekVersion();

    int getVersion();

    boolean isOpen();

    Set<String> getContainerNames();

    <T> T inTransaction(Collection<ContainerType> scope, TransactionMode mode, TransactionWork<T> work);

    @Override
    void close();
}

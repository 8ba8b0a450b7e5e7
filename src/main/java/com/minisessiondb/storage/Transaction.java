package com.minisessiondb.storage;

import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.storage.record.StoredRecord;

import java.util.List;

/**
 * Transaction - 作用于若干容器的事务
 *
 * 由 {@link RecordStore#inTransaction} 创建,工作单元返回后提交,抛出异常则回滚。
 * 访问作用域之外的容器会抛出IllegalStateException。
 *
 * 读写语义:
 * - get/getAll/openCursor 返回记录副本,修改副本不影响存储
 * - put 为插入或整体替换(upsert),存储的是入参的副本
 * - delete 返回被删除的记录,不存在时返回null
 */
public interface Transaction {

    TransactionMode getMode();

    <T extends StoredRecord> T get(ContainerType type, Object key, Class<T> recordClass);

    void put(StoredRecord record);

    StoredRecord delete(ContainerType type, Object key);

    <T extends StoredRecord> List<T> getAll(ContainerType type, Class<T> recordClass);

    /**
     * 打开游标
     *
     * @param type 容器
     * @param indexName 索引名,为null时按主键遍历
     * @param range 键区间
     * @param direction 方向
     * @param recordClass 记录类型
     * @return 游标
     */
    <T extends StoredRecord> RecordCursor<T> openCursor(ContainerType type, String indexName, KeyRange range,
                                                       CursorDirection direction, Class<T> recordClass);

    int count(ContainerType type);

    void clear(ContainerType type);
}

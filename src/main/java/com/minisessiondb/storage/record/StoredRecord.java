package com.minisessiondb.storage.record;

import com.minisessiondb.metadata.ContainerType;

/**
 * StoredRecord - 持久化记录的和类型
 *
 * 每个容器对应一个final实现类,实现类限定为permits列表中的五个。
 * 存储层、校验器和迁移代码通过 {@link #containerType()} 分派,
 * 分派处靠default分支或instanceof链末尾的IllegalArgumentException兜底,编译器不检查遗漏;新增容器时需逐一补齐这些分支。
 *
 * 约定:
 * - primaryKey() 返回容器主键路径上的值(复合主键返回 {@link NavigationEventKey})
 * - keyPathValue() 返回单字段键路径上的值,缺失时返回null,索引据此跳过该记录
 * - copy() 返回深拷贝,存储层只保存和返回副本
 */
public sealed interface StoredRecord
        permits StoredSession, StoredTab, StoredNavigationEvent, StoredSessionBoundary, DatabaseMetadata {

    ContainerType containerType();

    Object primaryKey();

    Object keyPathValue(String keyPath);

    StoredRecord copy();
}

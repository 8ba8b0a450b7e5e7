package com.minisessiondb.storage.table;

import com.minisessiondb.exception.InvalidRecordShapeException;
import com.minisessiondb.metadata.ContainerDefinition;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.metadata.IndexDefinition;
import com.minisessiondb.storage.CursorDirection;
import com.minisessiondb.storage.KeyRange;
import com.minisessiondb.storage.index.Index;
import com.minisessiondb.storage.index.KeyComparator;
import com.minisessiondb.storage.index.SecondaryIndex;
import com.minisessiondb.storage.record.StoredRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Container - 容器(记录集合)
 *
 * 一个容器保存一种记录,按主键有序存放,并维护若干二级索引。
 * 对应IndexedDB的object store,也可以理解为一张只有聚簇索引加二级索引的表。
 *
 * 核心功能:
 * 1. 主键存取: get / put(upsert) / delete
 * 2. 索引维护: put和delete时同步更新所有二级索引
 * 3. 区间扫描: 按主键或按索引,支持正序和倒序
 *
 * 设计原则:
 * - 先更新索引再更新主存储,唯一索引冲突时主存储不受影响
 * - 容器本身不加锁,由存储按事务作用域加锁
 * - 存入和取出的都是调用方负责复制的对象
 */
public class Container {

    private final ContainerType type;

    private ContainerDefinition definition;

    /** 主键 → 记录 */
    private final TreeMap<Object, StoredRecord> records;

    /** 索引名 → 二级索引 */
    private final Map<String, Index> indexes;

    public Container(ContainerDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Container definition cannot be null");
        }
        this.type = ContainerType.fromName(definition.getName());
        this.definition = definition;
        this.records = new TreeMap<>(KeyComparator.INSTANCE);
        this.indexes = new LinkedHashMap<>();
        for (IndexDefinition indexDefinition : definition.getIndexes()) {
            indexes.put(indexDefinition.getName(), new SecondaryIndex(indexDefinition));
        }
    }

    public String getName() {
        return definition.getName();
    }

    public ContainerType getType() {
        return type;
    }

    public ContainerDefinition getDefinition() {
        return definition;
    }

    public StoredRecord get(Object key) {
        if (key == null) {
            return null;
        }
        return records.get(key);
    }

    /**
     * 插入或替换记录
     *
     * @return 被替换的旧记录,新插入时为null
     */
    public StoredRecord put(StoredRecord record) {
        if (record.containerType() != type) {
            throw new IllegalArgumentException("Record of " + record.containerType().getContainerName()
                    + " cannot be stored in " + getName());
        }
        Object key = record.primaryKey();
        if (key == null) {
            throw new InvalidRecordShapeException(getName(), "missing key path " + definition.getKeyPath());
        }

        StoredRecord previous = records.get(key);
        if (previous != null) {
            removeFromIndexes(previous);
        }
        try {
            for (Index index : indexes.values()) {
                index.insert(record);
            }
        } catch (RuntimeException e) {
            // 唯一索引冲突,恢复旧状态
            removeFromIndexes(record);
            if (previous != null) {
                for (Index index : indexes.values()) {
                    index.insert(previous);
                }
            }
            throw e;
        }
        records.put(key, record);
        return previous;
    }

    /**
     * 删除记录
     *
     * @return 被删除的记录,不存在时返回null
     */
    public StoredRecord delete(Object key) {
        if (key == null) {
            return null;
        }
        StoredRecord removed = records.remove(key);
        if (removed != null) {
            removeFromIndexes(removed);
        }
        return removed;
    }

    public void clear() {
        records.clear();
        for (Index index : indexes.values()) {
            index.clear();
        }
    }

    public int size() {
        return records.size();
    }

    public Collection<StoredRecord> values() {
        return records.values();
    }

    /**
     * 按区间返回主键
     *
     * @param indexName 索引名,null表示按主键
     */
    public List<Object> keys(String indexName, KeyRange range, CursorDirection direction) {
        if (indexName == null) {
            NavigableMap<Object, StoredRecord> slice = range.apply(records);
            if (direction == CursorDirection.PREV) {
                slice = slice.descendingMap();
            }
            return new ArrayList<>(slice.keySet());
        }
        Index index = indexes.get(indexName);
        if (index == null) {
            throw new IllegalArgumentException("Index not found: " + getName() + "." + indexName);
        }
        return index.search(range, direction);
    }

    public boolean hasIndex(String indexName) {
        return indexes.containsKey(indexName);
    }

    public Set<String> getIndexNames() {
        return new LinkedHashSet<>(indexes.keySet());
    }

    /**
     * 新增索引并用现有记录填充
     *
     * @throws IllegalStateException 索引已存在
     */
    public void createIndex(IndexDefinition indexDefinition) {
        if (indexes.containsKey(indexDefinition.getName())) {
            throw new IllegalStateException("Index already exists: " + getName() + "." + indexDefinition.getName());
        }
        SecondaryIndex index = new SecondaryIndex(indexDefinition);
        for (StoredRecord record : records.values()) {
            index.insert(record);
        }
        indexes.put(indexDefinition.getName(), index);
        definition = definition.withIndex(indexDefinition);
    }

    private void removeFromIndexes(StoredRecord record) {
        for (Index index : indexes.values()) {
            index.remove(record);
        }
    }

    @Override
    public String toString() {
        return "Container{" +
                "name='" + getName() + '\'' +
                ", records=" + records.size() +
                ", indexes=" + indexes.keySet() +
                '}';
    }
}

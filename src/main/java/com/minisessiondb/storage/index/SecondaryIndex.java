package com.minisessiondb.storage.index;

import com.minisessiondb.exception.StorageException;
import com.minisessiondb.metadata.IndexDefinition;
import com.minisessiondb.storage.CursorDirection;
import com.minisessiondb.storage.KeyRange;
import com.minisessiondb.storage.record.StoredRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * SecondaryIndex - 有序二级索引
 *
 * 结构: 索引值 → 主键有序集合(TreeMap&lt;Object, TreeSet&lt;Object&gt;&gt;)。
 * 非唯一索引允许一个值对应多个主键;多值索引把列表中的每个元素分别索引。
 *
 * 查询流程:
 * 1. 在索引中按区间定位索引值
 * 2. 展开得到主键列表(方向为PREV时索引值和主键都倒序)
 * 3. 由容器按主键回表取记录
 *
 * 线程安全由容器锁保证,本类不加锁。
 */
public class SecondaryIndex implements Index {

    private final IndexDefinition definition;

    /** 索引值 → 主键集合 */
    private final TreeMap<Object, TreeSet<Object>> entries;

    private int size;

    public SecondaryIndex(IndexDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Index definition cannot be null");
        }
        this.definition = definition;
        this.entries = new TreeMap<>(KeyComparator.INSTANCE);
        this.size = 0;
    }

    @Override
    public IndexDefinition getDefinition() {
        return definition;
    }

    @Override
    public void insert(StoredRecord record) {
        Object primaryKey = record.primaryKey();
        Set<Object> values = extractValues(record);

        if (definition.isUnique()) {
            for (Object value : values) {
                TreeSet<Object> existing = entries.get(value);
                if (existing != null && !existing.isEmpty() && !existing.contains(primaryKey)) {
                    throw new StorageException("Unique index " + definition.getName()
                            + " already contains value: " + value);
                }
            }
        }

        for (Object value : values) {
            TreeSet<Object> keys = entries.computeIfAbsent(value, v -> new TreeSet<>(KeyComparator.INSTANCE));
            if (keys.add(primaryKey)) {
                size++;
            }
        }
    }

    @Override
    public void remove(StoredRecord record) {
        Object primaryKey = record.primaryKey();
        for (Object value : extractValues(record)) {
            TreeSet<Object> keys = entries.get(value);
            if (keys == null) {
                continue;
            }
            if (keys.remove(primaryKey)) {
                size--;
            }
            if (keys.isEmpty()) {
                entries.remove(value);
            }
        }
    }

    @Override
    public List<Object> search(KeyRange range, CursorDirection direction) {
        NavigableMap<Object, TreeSet<Object>> slice = range.apply(entries);
        if (direction == CursorDirection.PREV) {
            slice = slice.descendingMap();
        }

        List<Object> result = new ArrayList<>();
        for (Map.Entry<Object, TreeSet<Object>> entry : slice.entrySet()) {
            NavigableSet<Object> keys = direction == CursorDirection.PREV
                    ? entry.getValue().descendingSet()
                    : entry.getValue();
            result.addAll(keys);
        }
        return result;
    }

    @Override
    public void clear() {
        entries.clear();
        size = 0;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * 提取记录在本索引上的值集合
     *
     * 多值索引展开列表并去重;单值索引的列表值整体忽略(与IndexedDB一致,数组不是合法的单值键)。
     */
    private Set<Object> extractValues(StoredRecord record) {
        Set<Object> values = new LinkedHashSet<>();
        Object raw = record.keyPathValue(definition.getKeyPath());
        if (raw == null) {
            return values;
        }
        if (raw instanceof Collection<?> collection) {
            if (definition.isMultiEntry()) {
                for (Object element : collection) {
                    if (element != null) {
                        values.add(element);
                    }
                }
            }
            return values;
        }
        values.add(raw);
        return values;
    }

    @Override
    public String toString() {
        return "SecondaryIndex{" +
                "name='" + definition.getName() + '\'' +
                ", keyPath='" + definition.getKeyPath() + '\'' +
                ", entries=" + size +
                '}';
    }
}

package com.minisessiondb.storage.impl;

import com.minisessiondb.exception.StorageException;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.storage.CursorDirection;
import com.minisessiondb.storage.KeyRange;
import com.minisessiondb.storage.RecordCursor;
import com.minisessiondb.storage.Transaction;
import com.minisessiondb.storage.TransactionMode;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.table.Container;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * StoreTransaction - 带撤销日志的事务
 *
 * 每次写入前记录主键和旧值,回滚时逆序恢复。
 * scope为null表示升级事务,可以访问升级过程中新建的容器。
 */
final class StoreTransaction implements Transaction {

    private final AbstractRecordStore store;

    private final Set<String> scope;

    private final TransactionMode mode;

    private final Deque<UndoEntry> undoLog;

    private final Set<String> dirtyContainers;

    private boolean finished;

    StoreTransaction(AbstractRecordStore store, Set<String> scope, TransactionMode mode) {
        this.store = store;
        this.scope = scope;
        this.mode = mode;
        this.undoLog = new ArrayDeque<>();
        this.dirtyContainers = new LinkedHashSet<>();
        this.finished = false;
    }

    @Override
    public TransactionMode getMode() {
        return mode;
    }

    @Override
    public <T extends StoredRecord> T get(ContainerType type, Object key, Class<T> recordClass) {
        StoredRecord record = container(type).get(key);
        return record == null ? null : recordClass.cast(record.copy());
    }

    @Override
    public void put(StoredRecord record) {
        checkWritable();
        Container container = container(record.containerType());
        StoredRecord copy = record.copy();
        StoredRecord previous = container.put(copy);
        undoLog.push(new UndoEntry(container, copy.primaryKey(), previous));
        dirtyContainers.add(container.getName());
    }

    @Override
    public StoredRecord delete(ContainerType type, Object key) {
        checkWritable();
        Container container = container(type);
        StoredRecord removed = container.delete(key);
        if (removed == null) {
            return null;
        }
        undoLog.push(new UndoEntry(container, key, removed));
        dirtyContainers.add(container.getName());
        return removed.copy();
    }

    @Override
    public <T extends StoredRecord> List<T> getAll(ContainerType type, Class<T> recordClass) {
        Container container = container(type);
        List<T> result = new ArrayList<>(container.size());
        for (StoredRecord record : container.values()) {
            result.add(recordClass.cast(record.copy()));
        }
        return result;
    }

    @Override
    public <T extends StoredRecord> RecordCursor<T> openCursor(ContainerType type, String indexName, KeyRange range,
                                                              CursorDirection direction, Class<T> recordClass) {
        Container container = container(type);
        List<Object> keys = container.keys(indexName, range == null ? KeyRange.all() : range,
                direction == null ? CursorDirection.NEXT : direction);
        return new SnapshotCursor<>(type, keys, recordClass);
    }

    @Override
    public int count(ContainerType type) {
        return container(type).size();
    }

    @Override
    public void clear(ContainerType type) {
        checkWritable();
        Container container = container(type);
        for (StoredRecord record : new ArrayList<>(container.values())) {
            undoLog.push(new UndoEntry(container, record.primaryKey(), record));
        }
        container.clear();
        dirtyContainers.add(container.getName());
    }

    Set<String> getDirtyContainers() {
        return dirtyContainers;
    }

    /**
     * 逆序撤销全部写入
     */
    void rollback() {
        while (!undoLog.isEmpty()) {
            UndoEntry entry = undoLog.pop();
            if (entry.previous == null) {
                entry.container.delete(entry.key);
            } else {
                entry.container.put(entry.previous);
            }
        }
        dirtyContainers.clear();
        finished = true;
    }

    void finish() {
        undoLog.clear();
        finished = true;
    }

    private Container container(ContainerType type) {
        if (finished) {
            throw new IllegalStateException("Transaction has already finished");
        }
        String name = type.getContainerName();
        if (scope != null && !scope.contains(name)) {
            throw new IllegalStateException("Container " + name + " is not in transaction scope " + scope);
        }
        Container container = store.getContainer(name);
        if (container == null) {
            throw new StorageException("Container not found: " + name);
        }
        return container;
    }

    private void checkWritable() {
        if (mode != TransactionMode.READ_WRITE) {
            throw new IllegalStateException("Transaction is read-only");
        }
    }

    private static final class UndoEntry {
        final Container container;
        final Object key;
        final StoredRecord previous;

        UndoEntry(Container container, Object key, StoredRecord previous) {
            this.container = container;
            this.key = key;
            this.previous = previous;
        }
    }

    /**
     * 基于主键快照的游标
     */
    private final class SnapshotCursor<T extends StoredRecord> implements RecordCursor<T> {

        private final ContainerType type;

        private final List<Object> keys;

        private final Class<T> recordClass;

        private int position;

        private T lookahead;

        private Object lookaheadKey;

        private Object currentKey;

        private int visitedCount;

        SnapshotCursor(ContainerType type, List<Object> keys, Class<T> recordClass) {
            this.type = type;
            this.keys = keys;
            this.recordClass = recordClass;
            this.position = 0;
        }

        @Override
        public boolean hasNext() {
            while (lookahead == null && position < keys.size()) {
                Object key = keys.get(position++);
                T record = get(type, key, recordClass);
                if (record != null) {
                    lookahead = record;
                    lookaheadKey = key;
                }
            }
            return lookahead != null;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T record = lookahead;
            currentKey = lookaheadKey;
            lookahead = null;
            lookaheadKey = null;
            visitedCount++;
            return record;
        }

        @Override
        public void remove() {
            if (currentKey == null) {
                throw new IllegalStateException("Cursor is not positioned on a record");
            }
            delete(type, currentKey);
            currentKey = null;
        }

        @Override
        public int getVisitedCount() {
            return visitedCount;
        }
    }
}

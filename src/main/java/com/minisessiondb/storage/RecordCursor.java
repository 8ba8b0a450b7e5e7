package com.minisessiondb.storage;

import com.minisessiondb.storage.record.StoredRecord;

import java.util.Iterator;

/**
 * RecordCursor - 记录游标
 *
 * 打开时对区间内的主键做快照,next()时按主键读取当前值,
 * 期间被删除的记录会被跳过。remove()删除游标当前所在的记录(需要读写事务)。
 */
public interface RecordCursor<T extends StoredRecord> extends Iterator<T> {

    /**
     * 已经访问过的记录数(含被调用方过滤掉的)
     */
    int getVisitedCount();
}

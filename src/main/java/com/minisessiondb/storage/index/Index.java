package com.minisessiondb.storage.index;

import com.minisessiondb.metadata.IndexDefinition;
import com.minisessiondb.storage.CursorDirection;
import com.minisessiondb.storage.KeyRange;
import com.minisessiondb.storage.record.StoredRecord;

import java.util.List;

/**
 * Index - 二级索引接口
 *
 * 索引把键路径上的值映射到主键集合,查询时先在索引中定位主键,再回到容器取记录。
 * 键路径上的值为null的记录不进入索引。
 */
public interface Index {

    IndexDefinition getDefinition();

    default String getIndexName() {
        return getDefinition().getName();
    }

    /**
     * 为记录建立索引项
     *
     * @throws com.minisessiondb.exception.StorageException 唯一索引冲突
     */
    void insert(StoredRecord record);

    void remove(StoredRecord record);

    /**
     * 按索引值区间返回主键,同一索引值下的主键也遵循游标方向
     */
    List<Object> search(KeyRange range, CursorDirection direction);

    void clear();

    /**
     * 索引项个数(多值索引中一条记录可能贡献多项)
     */
    int size();
}

package com.minisessiondb.integrity;

import com.minisessiondb.storage.StoreSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * BackupStore - 备份的存放位置
 *
 * 实现:
 * - InMemoryBackupStore: 进程内
 * - FileBackupStore: 目录下每个备份一个数据文件加一个清单文件
 */
public interface BackupStore {

    void save(BackupManifest manifest, StoreSnapshot data);

    Optional<BackupManifest> loadManifest(String backupId);

    /**
     * @throws com.minisessiondb.exception.BackupCorruptedException 数据存在但无法读取
     */
    Optional<StoreSnapshot> loadData(String backupId);

    /**
     * 全部清单,顺序不保证
     */
    List<BackupManifest> listManifests();

    /**
     * @return 备份存在并被删除时返回true
     */
    boolean delete(String backupId);
}

package com.minisessiondb.integrity;

import com.minisessiondb.exception.BackupCorruptedException;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.record.StoredSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FileBackupStore测试
 *
 * 每个备份对应两个文件: 数据和清单。
 */
@DisplayName("FileBackupStore - 文件备份存储测试")
class FileBackupStoreTest {

    @TempDir
    Path tempDir;

    private static BackupManifest manifest(String id, long timestamp) {
        BackupManifest manifest = new BackupManifest();
        manifest.setId(id);
        manifest.setTimestamp(timestamp);
        manifest.setVersion(1);
        manifest.setDescription("test");
        manifest.setItemCounts(Map.of("sessions", 1));
        manifest.setValid(true);
        return manifest;
    }

    private static StoreSnapshot snapshot(String sessionId) {
        StoredSession session = new StoredSession();
        session.setId(sessionId);
        session.setTag("Work");
        session.setCreatedAt(100);
        session.setUpdatedAt(100);
        StoreSnapshot snapshot = new StoreSnapshot();
        snapshot.setSessions(new ArrayList<>(List.of(session)));
        return snapshot;
    }

    @Test
    @DisplayName("保存后生成数据和清单文件,可以重新读取")
    void testSaveAndLoad() {
        Path backupDir = tempDir.resolve("backups");
        FileBackupStore store = new FileBackupStore(backupDir);

        store.save(manifest("backup_1", 1), snapshot("s1"));

        assertTrue(Files.exists(backupDir.resolve("backup_1.data.json")));
        assertTrue(Files.exists(backupDir.resolve("backup_1.manifest.json")));
        assertEquals("test", store.loadManifest("backup_1").orElseThrow().getDescription());
        assertEquals("s1", store.loadData("backup_1").orElseThrow().getSessions().get(0).getId());
    }

    @Test
    @DisplayName("新实例能列出目录中已有的备份")
    void testListAfterReopen() {
        FileBackupStore store = new FileBackupStore(tempDir);
        store.save(manifest("backup_1", 1), snapshot("s1"));
        store.save(manifest("backup_2", 2), snapshot("s2"));

        List<BackupManifest> manifests = new FileBackupStore(tempDir).listManifests();

        assertEquals(2, manifests.size());
    }

    @Test
    @DisplayName("不存在的备份返回空,目录不存在时列表为空")
    void testMissingBackup() {
        FileBackupStore store = new FileBackupStore(tempDir.resolve("absent"));

        assertTrue(store.loadManifest("backup_x").isEmpty());
        assertTrue(store.loadData("backup_x").isEmpty());
        assertTrue(store.listManifests().isEmpty());
        assertFalse(store.delete("backup_x"));
    }

    @Test
    @DisplayName("删除备份同时移除两个文件")
    void testDelete() {
        FileBackupStore store = new FileBackupStore(tempDir);
        store.save(manifest("backup_1", 1), snapshot("s1"));

        assertTrue(store.delete("backup_1"));

        assertFalse(Files.exists(tempDir.resolve("backup_1.data.json")));
        assertFalse(Files.exists(tempDir.resolve("backup_1.manifest.json")));
    }

    @Test
    @DisplayName("数据文件缺失或无法解析时抛出BackupCorruptedException")
    void testCorruptedDataFile() throws Exception {
        FileBackupStore store = new FileBackupStore(tempDir);
        store.save(manifest("backup_1", 1), snapshot("s1"));
        store.save(manifest("backup_2", 2), snapshot("s2"));

        Files.delete(tempDir.resolve("backup_1.data.json"));
        Files.write(tempDir.resolve("backup_2.data.json"), "{not json".getBytes(StandardCharsets.UTF_8));

        assertThrows(BackupCorruptedException.class, () -> store.loadData("backup_1"));
        assertThrows(BackupCorruptedException.class, () -> store.loadData("backup_2"));
    }

    @Test
    @DisplayName("无法读取的清单在列表中被跳过")
    void testUnreadableManifestSkipped() throws Exception {
        FileBackupStore store = new FileBackupStore(tempDir);
        store.save(manifest("backup_1", 1), snapshot("s1"));
        Files.write(tempDir.resolve("broken.manifest.json"), "[]".getBytes(StandardCharsets.UTF_8));

        List<BackupManifest> manifests = store.listManifests();

        assertEquals(1, manifests.size());
        assertEquals("backup_1", manifests.get(0).getId());
    }
}

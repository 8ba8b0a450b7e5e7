package com.minisessiondb.integrity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.exception.BackupCorruptedException;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.storage.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * FileBackupStore - 目录备份存储
 *
 * 文件布局:
 * <pre>
 * backups/
 *   backup_1700000000000_k3j9x2.data.json      StoreSnapshot
 *   backup_1700000000000_k3j9x2.manifest.json  BackupManifest
 * </pre>
 *
 * 先写数据再写清单,两者都经 .tmp 原子替换;只有清单存在的备份才会被列出。
 */
public class FileBackupStore implements BackupStore {

    private static final Logger logger = LoggerFactory.getLogger(FileBackupStore.class);

    private static final String DATA_SUFFIX = ".data.json";

    private static final String MANIFEST_SUFFIX = ".manifest.json";

    private static final String TMP_SUFFIX = ".tmp";

    private final Path backupDir;

    private final ObjectMapper mapper;

    public FileBackupStore(Path backupDir) {
        if (backupDir == null) {
            throw new IllegalArgumentException("Backup directory cannot be null");
        }
        this.backupDir = backupDir;
        this.mapper = ObjectMappers.standard();
    }

    public Path getBackupDir() {
        return backupDir;
    }

    @Override
    public void save(BackupManifest manifest, StoreSnapshot data) {
        writeAtomically(dataPath(manifest.getId()), data);
        writeAtomically(manifestPath(manifest.getId()), manifest);
        logger.debug("备份已写入 {}", backupDir.resolve(manifest.getId()));
    }

    @Override
    public Optional<BackupManifest> loadManifest(String backupId) {
        Path path = manifestPath(backupId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), BackupManifest.class));
        } catch (IOException e) {
            throw new StorageException("Failed to read backup manifest: " + path, e);
        }
    }

    @Override
    public Optional<StoreSnapshot> loadData(String backupId) {
        Path path = dataPath(backupId);
        if (!Files.exists(manifestPath(backupId))) {
            return Optional.empty();
        }
        if (!Files.exists(path)) {
            throw new BackupCorruptedException("Backup data file missing: " + path, null);
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), StoreSnapshot.class));
        } catch (IOException e) {
            throw new BackupCorruptedException("Backup data unreadable: " + backupId, e);
        }
    }

    @Override
    public List<BackupManifest> listManifests() {
        List<BackupManifest> manifests = new ArrayList<>();
        if (!Files.isDirectory(backupDir)) {
            return manifests;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir, "*" + MANIFEST_SUFFIX)) {
            for (Path path : stream) {
                try {
                    manifests.add(mapper.readValue(path.toFile(), BackupManifest.class));
                } catch (IOException e) {
                    logger.warn("跳过无法读取的备份清单 {}: {}", path.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list backups in " + backupDir, e);
        }
        return manifests;
    }

    @Override
    public boolean delete(String backupId) {
        try {
            boolean existed = Files.deleteIfExists(manifestPath(backupId));
            Files.deleteIfExists(dataPath(backupId));
            return existed;
        } catch (IOException e) {
            throw new StorageException("Failed to delete backup " + backupId, e);
        }
    }

    private Path dataPath(String backupId) {
        return backupDir.resolve(backupId + DATA_SUFFIX);
    }

    private Path manifestPath(String backupId) {
        return backupDir.resolve(backupId + MANIFEST_SUFFIX);
    }

    private void writeAtomically(Path target, Object value) {
        Path tempPath = Path.of(target + TMP_SUFFIX);
        try {
            Files.createDirectories(backupDir);
            Files.write(tempPath, mapper.writeValueAsBytes(value));
            Files.move(tempPath, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target.getFileName(), e);
        }
    }
}

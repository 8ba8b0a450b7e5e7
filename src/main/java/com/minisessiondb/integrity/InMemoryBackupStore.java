package com.minisessiondb.integrity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.exception.BackupCorruptedException;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.storage.StoreSnapshot;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存备份存储
 *
 * 数据以JSON字节保存,读取时重新解析,调用方拿到的永远是独立副本。
 */
public class InMemoryBackupStore implements BackupStore {

    private final Map<String, BackupManifest> manifests = new ConcurrentHashMap<>();

    private final Map<String, byte[]> payloads = new ConcurrentHashMap<>();

    private final ObjectMapper mapper = ObjectMappers.standard();

    @Override
    public void save(BackupManifest manifest, StoreSnapshot data) {
        try {
            payloads.put(manifest.getId(), mapper.writeValueAsBytes(data));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize backup " + manifest.getId(), e);
        }
        manifests.put(manifest.getId(), new BackupManifest(manifest));
    }

    @Override
    public Optional<BackupManifest> loadManifest(String backupId) {
        BackupManifest manifest = manifests.get(backupId);
        return manifest == null ? Optional.empty() : Optional.of(new BackupManifest(manifest));
    }

    @Override
    public Optional<StoreSnapshot> loadData(String backupId) {
        byte[] payload = payloads.get(backupId);
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(payload, StoreSnapshot.class));
        } catch (IOException e) {
            throw new BackupCorruptedException("Backup data unreadable: " + backupId, e);
        }
    }

    @Override
    public List<BackupManifest> listManifests() {
        List<BackupManifest> result = new ArrayList<>();
        for (BackupManifest manifest : manifests.values()) {
            result.add(new BackupManifest(manifest));
        }
        return result;
    }

    @Override
    public boolean delete(String backupId) {
        payloads.remove(backupId);
        return manifests.remove(backupId) != null;
    }
}

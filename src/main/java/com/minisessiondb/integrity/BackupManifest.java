package com.minisessiondb.integrity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * BackupManifest - 备份清单
 *
 * 与备份数据分开保存,列出备份时只读清单。
 * checksum 为备份数据规范化JSON的校验和,恢复时重算比对。
 */
public class BackupManifest {

    private String id;

    private long timestamp;

    /** 备份时的schema版本 */
    private int version;

    private String description;

    /** 备份数据的JSON字节数 */
    private long size;

    private Map<String, Integer> itemCounts = new LinkedHashMap<>();

    private String checksum;

    private String checksumAlgorithm;

    private boolean valid = true;

    public BackupManifest() {
    }

    public BackupManifest(BackupManifest other) {
        this.id = other.id;
        this.timestamp = other.timestamp;
        this.version = other.version;
        this.description = other.description;
        this.size = other.size;
        this.itemCounts = other.itemCounts == null ? new LinkedHashMap<>() : new LinkedHashMap<>(other.itemCounts);
        this.checksum = other.checksum;
        this.checksumAlgorithm = other.checksumAlgorithm;
        this.valid = other.valid;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public Map<String, Integer> getItemCounts() {
        return itemCounts;
    }

    public void setItemCounts(Map<String, Integer> itemCounts) {
        this.itemCounts = itemCounts;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public String getChecksumAlgorithm() {
        return checksumAlgorithm;
    }

    public void setChecksumAlgorithm(String checksumAlgorithm) {
        this.checksumAlgorithm = checksumAlgorithm;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    @Override
    public String toString() {
        return "BackupManifest{" +
                "id='" + id + '\'' +
                ", timestamp=" + timestamp +
                ", version=" + version +
                ", size=" + size +
                ", itemCounts=" + itemCounts +
                ", valid=" + valid +
                '}';
    }
}

package com.minisessiondb.exchange;

/**
 * 导出文件头: 格式版本、导出时间、数据部分的校验和
 */
public class ExportMetadata {

    private String version;

    private long exportedAt;

    private String format = "json";

    private String checksum;

    private String checksumAlgorithm;

    public ExportMetadata() {
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public long getExportedAt() {
        return exportedAt;
    }

    public void setExportedAt(long exportedAt) {
        this.exportedAt = exportedAt;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
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

    @Override
    public String toString() {
        return "ExportMetadata{" +
                "version='" + version + '\'' +
                ", exportedAt=" + exportedAt +
                ", checksum='" + checksum + '\'' +
                '}';
    }
}

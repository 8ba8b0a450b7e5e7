package com.minisessiondb.serializer;

/**
 * 一批会话的压缩统计
 */
public class CompressionStats {

    private final int totalSessions;

    private final int compressedSessions;

    private final long totalSize;

    private final double compressionRate;

    public CompressionStats(int totalSessions, int compressedSessions, long totalSize) {
        this.totalSessions = totalSessions;
        this.compressedSessions = compressedSessions;
        this.totalSize = totalSize;
        this.compressionRate = totalSessions == 0 ? 0.0 : (double) compressedSessions / totalSessions;
    }

    public int getTotalSessions() {
        return totalSessions;
    }

    public int getCompressedSessions() {
        return compressedSessions;
    }

    public long getTotalSize() {
        return totalSize;
    }

    /** 被压缩的会话占比(0~1) */
    public double getCompressionRate() {
        return compressionRate;
    }

    @Override
    public String toString() {
        return "CompressionStats{" +
                "totalSessions=" + totalSessions +
                ", compressedSessions=" + compressedSessions +
                ", totalSize=" + totalSize +
                ", compressionRate=" + compressionRate +
                '}';
    }
}

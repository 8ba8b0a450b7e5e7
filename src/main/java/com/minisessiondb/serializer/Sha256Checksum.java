package com.minisessiondb.serializer;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256校验和,用于需要发现有意篡改的场景(例如对外导出的备份)
 */
public class Sha256Checksum implements ChecksumAlgorithm {

    @Override
    public String getName() {
        return "sha256";
    }

    @Override
    public String compute(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(data);
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // 每个JRE都必须提供SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

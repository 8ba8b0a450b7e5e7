package com.minisessiondb.serializer;

import java.util.zip.CRC32C;

/**
 * CRC32C校验和(默认算法)
 *
 * 速度快,能发现随机损坏,但不能防篡改。输出8位十六进制。
 */
public class Crc32cChecksum implements ChecksumAlgorithm {

    @Override
    public String getName() {
        return "crc32c";
    }

    @Override
    public String compute(byte[] data) {
        CRC32C crc = new CRC32C();
        crc.update(data, 0, data.length);
        return String.format("%08x", crc.getValue());
    }
}

package com.minisessiondb.serializer;

/**
 * ChecksumAlgorithm - 校验和算法
 *
 * 输入是规范化JSON的UTF-8字节,输出是可以直接比较的字符串。
 * 同一输入必须总是得到同一输出。
 */
public interface ChecksumAlgorithm {

    /**
     * 算法名(写入备份清单和日志)
     */
    String getName();

    String compute(byte[] data);
}

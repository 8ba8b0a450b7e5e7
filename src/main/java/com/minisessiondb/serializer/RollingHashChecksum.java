package com.minisessiondb.serializer;

import java.nio.charset.StandardCharsets;

/**
 * 32位滚动哈希: h = h * 31 + c,结果取绝对值后以36进制输出。
 *
 * 只为读取旧数据保留。32位空间碰撞概率高,不要用于新数据。
 */
public class RollingHashChecksum implements ChecksumAlgorithm {

    @Override
    public String getName() {
        return "rolling32";
    }

    @Override
    public String compute(byte[] data) {
        String text = new String(data, StandardCharsets.UTF_8);
        int hash = 0;
        for (int i = 0; i < text.length(); i++) {
            hash = ((hash << 5) - hash) + text.charAt(i);
        }
        return Long.toString(Math.abs((long) hash), 36);
    }
}

package com.minisessiondb.exchange;

import java.util.Collections;
import java.util.Map;

public final class ExportResult {

    private final String data;

    private final long size;

    private final Map<String, Integer> itemCounts;

    private final ExportMetadata metadata;

    public ExportResult(String data, long size, Map<String, Integer> itemCounts, ExportMetadata metadata) {
        this.data = data;
        this.size = size;
        this.itemCounts = Collections.unmodifiableMap(itemCounts);
        this.metadata = metadata;
    }

    public String getFormat() {
        return metadata.getFormat();
    }

    /**
     * 导出的JSON文本
     */
    public String getData() {
        return data;
    }

    /**
     * UTF-8字节数
     */
    public long getSize() {
        return size;
    }

    public Map<String, Integer> getItemCounts() {
        return itemCounts;
    }

    public ExportMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ExportResult{" +
                "size=" + size +
                ", itemCounts=" + itemCounts +
                ", metadata=" + metadata +
                '}';
    }
}

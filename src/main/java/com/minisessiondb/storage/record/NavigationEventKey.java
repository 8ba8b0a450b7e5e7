package com.minisessiondb.storage.record;

import java.util.Objects;

/**
 * 导航事件的复合主键 [tabId, timestamp],先按tabId再按timestamp排序
 */
public final class NavigationEventKey implements Comparable<NavigationEventKey> {

    private final int tabId;

    private final long timestamp;

    public NavigationEventKey(int tabId, long timestamp) {
        this.tabId = tabId;
        this.timestamp = timestamp;
    }

    /**
     * 解析 toString() 的输出
     *
     * @throws IllegalArgumentException 格式不合法
     */
    public static NavigationEventKey parse(String text) {
        int separator = text == null ? -1 : text.indexOf('_');
        if (separator <= 0 || separator == text.length() - 1) {
            throw new IllegalArgumentException("Invalid navigation event key: " + text);
        }
        try {
            return new NavigationEventKey(Integer.parseInt(text.substring(0, separator)),
                    Long.parseLong(text.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid navigation event key: " + text, e);
        }
    }

    public int getTabId() {
        return tabId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public int compareTo(NavigationEventKey other) {
        int cmp = Integer.compare(tabId, other.tabId);
        if (cmp != 0) {
            return cmp;
        }
        return Long.compare(timestamp, other.timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NavigationEventKey)) return false;
        NavigationEventKey that = (NavigationEventKey) o;
        return tabId == that.tabId && timestamp == that.timestamp;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tabId, timestamp);
    }

    /**
     * 形如 "42_1700000000000",同时作为校验报告中的实体ID
     */
    @Override
    public String toString() {
        return tabId + "_" + timestamp;
    }
}

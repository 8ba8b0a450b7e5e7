package com.minisessiondb.storage;

import com.minisessiondb.storage.index.KeyComparator;

import java.util.NavigableMap;

/**
 * KeyRange - 键区间
 *
 * 对应IndexedDB的IDBKeyRange:only / bound / lowerBound / upperBound。
 * 边界默认闭区间。lower或upper为null表示该侧无界。
 *
 * <pre>
 * KeyRange.only("research");          // tag == "research"
 * KeyRange.bound(start, end);          // start <= createdAt <= end
 * KeyRange.all();                      // 全部
 * </pre>
 */
public final class KeyRange {

    private static final KeyRange ALL = new KeyRange(null, null, false, false);

    private final Object lower;

    private final Object upper;

    private final boolean lowerOpen;

    private final boolean upperOpen;

    private KeyRange(Object lower, Object upper, boolean lowerOpen, boolean upperOpen) {
        this.lower = lower;
        this.upper = upper;
        this.lowerOpen = lowerOpen;
        this.upperOpen = upperOpen;
    }

    public static KeyRange all() {
        return ALL;
    }

    public static KeyRange only(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Key range value cannot be null");
        }
        return new KeyRange(value, value, false, false);
    }

    public static KeyRange bound(Object lower, Object upper) {
        return bound(lower, upper, false, false);
    }

    public static KeyRange bound(Object lower, Object upper, boolean lowerOpen, boolean upperOpen) {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException("Key range bounds cannot be null");
        }
        if (KeyComparator.INSTANCE.compare(lower, upper) > 0) {
            throw new IllegalArgumentException("Lower bound is greater than upper bound: " + lower + " > " + upper);
        }
        return new KeyRange(lower, upper, lowerOpen, upperOpen);
    }

    public static KeyRange lowerBound(Object lower) {
        return new KeyRange(lower, null, false, false);
    }

    public static KeyRange upperBound(Object upper) {
        return new KeyRange(null, upper, false, false);
    }

    /**
     * 截取有序Map中落在区间内的部分(视图,不复制)
     */
    public <V> NavigableMap<Object, V> apply(NavigableMap<Object, V> map) {
        if (lower != null && upper != null) {
            return map.subMap(lower, !lowerOpen, upper, !upperOpen);
        }
        if (lower != null) {
            return map.tailMap(lower, !lowerOpen);
        }
        if (upper != null) {
            return map.headMap(upper, !upperOpen);
        }
        return map;
    }

    public boolean includes(Object key) {
        if (key == null) {
            return false;
        }
        if (lower != null) {
            int cmp = KeyComparator.INSTANCE.compare(key, lower);
            if (cmp < 0 || (cmp == 0 && lowerOpen)) {
                return false;
            }
        }
        if (upper != null) {
            int cmp = KeyComparator.INSTANCE.compare(key, upper);
            if (cmp > 0 || (cmp == 0 && upperOpen)) {
                return false;
            }
        }
        return true;
    }

    public Object getLower() {
        return lower;
    }

    public Object getUpper() {
        return upper;
    }

    @Override
    public String toString() {
        return (lowerOpen ? "(" : "[") + lower + ", " + upper + (upperOpen ? ")" : "]");
    }
}

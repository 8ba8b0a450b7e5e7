package com.minisessiondb.storage.index;

import com.minisessiondb.storage.record.NavigationEventKey;

import java.util.Comparator;

/**
 * KeyComparator - 键比较器
 *
 * 主键和索引值共用的全序:
 * 数值 < 字符串 < 复合键 < 其他类型。
 * 数值之间按数值大小比较(Integer与Long可以混用),字符串按字典序。
 */
public final class KeyComparator implements Comparator<Object> {

    public static final KeyComparator INSTANCE = new KeyComparator();

    private KeyComparator() {
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int compare(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            if (isIntegral(na) && isIntegral(nb)) {
                return Long.compare(na.longValue(), nb.longValue());
            }
            return Double.compare(na.doubleValue(), nb.doubleValue());
        }
        if (a instanceof String sa && b instanceof String sb) {
            return sa.compareTo(sb);
        }
        if (a instanceof NavigationEventKey ka && b instanceof NavigationEventKey kb) {
            return ka.compareTo(kb);
        }
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable) {
            return ((Comparable) a).compareTo(b);
        }
        return a.getClass().getName().compareTo(b.getClass().getName());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static int rank(Object key) {
        if (key instanceof Number) {
            return 0;
        }
        if (key instanceof String) {
            return 1;
        }
        if (key instanceof NavigationEventKey) {
            return 2;
        }
        return 3;
    }
}

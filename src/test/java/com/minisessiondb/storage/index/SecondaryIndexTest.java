package com.minisessiondb.storage.index;

import com.minisessiondb.metadata.IndexDefinition;
import com.minisessiondb.storage.CursorDirection;
import com.minisessiondb.storage.KeyRange;
import com.minisessiondb.storage.record.NavigationEventKey;
import com.minisessiondb.storage.record.StoredSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SecondaryIndex与KeyComparator测试
 */
@DisplayName("SecondaryIndex - 二级索引测试")
class SecondaryIndexTest {

    private static StoredSession session(String id, String tag, long createdAt, String... domains) {
        StoredSession session = new StoredSession();
        session.setId(id);
        session.setTag(tag);
        session.setCreatedAt(createdAt);
        session.setDomains(Arrays.asList(domains));
        return session;
    }

    @Test
    @DisplayName("非唯一索引: 同一个值对应多个主键,按主键有序")
    void testNonUniqueIndex() {
        SecondaryIndex index = new SecondaryIndex(IndexDefinition.of("by_tag", "tag"));
        index.insert(session("s2", "Work", 1));
        index.insert(session("s1", "Work", 2));
        index.insert(session("s3", "Home", 3));

        assertEquals(List.of("s1", "s2"), index.search(KeyRange.only("Work"), CursorDirection.NEXT));
        assertEquals(List.of("s2", "s1"), index.search(KeyRange.only("Work"), CursorDirection.PREV));
        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("区间查询包含两端")
    void testBoundRangeInclusive() {
        SecondaryIndex index = new SecondaryIndex(IndexDefinition.of("by_created_at", "createdAt"));
        for (int i = 1; i <= 5; i++) {
            index.insert(session("s" + i, "Work", i * 10L));
        }

        assertEquals(List.of("s2", "s3", "s4"), index.search(KeyRange.bound(20L, 40L), CursorDirection.NEXT));
        assertEquals(List.of("s3"), index.search(KeyRange.bound(20L, 40L, true, true), CursorDirection.NEXT));
        assertEquals(List.of("s5", "s4"), index.search(KeyRange.lowerBound(40L), CursorDirection.PREV));
    }

    @Test
    @DisplayName("多值索引把列表中的每个元素分别索引,删除时全部移除")
    void testMultiEntryIndex() {
        SecondaryIndex index = new SecondaryIndex(IndexDefinition.multiEntry("by_domain", "domains"));
        StoredSession session = session("s1", "Work", 1, "a.com", "b.com", "a.com");
        index.insert(session);
        index.insert(session("s2", "Work", 2, "b.com"));

        assertEquals(List.of("s1"), index.search(KeyRange.only("a.com"), CursorDirection.NEXT));
        assertEquals(List.of("s1", "s2"), index.search(KeyRange.only("b.com"), CursorDirection.NEXT));
        assertEquals(3, index.size());

        index.remove(session);
        assertTrue(index.search(KeyRange.only("a.com"), CursorDirection.NEXT).isEmpty());
        assertEquals(1, index.size());
    }

    @Test
    @DisplayName("单值索引忽略列表值和缺失值")
    void testSingleValueIndexSkipsListsAndNulls() {
        SecondaryIndex index = new SecondaryIndex(IndexDefinition.of("by_domain_single", "domains"));
        index.insert(session("s1", "Work", 1, "a.com"));
        index.insert(session("s2", null, 2));

        assertEquals(0, index.size());
    }

    @Test
    @DisplayName("键比较: Integer与Long按数值比较,数值排在字符串和复合键之前")
    void testKeyComparatorOrdering() {
        KeyComparator comparator = KeyComparator.INSTANCE;

        assertEquals(0, comparator.compare(5, 5L));
        assertTrue(comparator.compare(4, 5L) < 0);
        assertTrue(comparator.compare(99L, "a") < 0);
        assertTrue(comparator.compare("z", new NavigationEventKey(1, 1L)) < 0);
        assertTrue(comparator.compare(new NavigationEventKey(1, 5L), new NavigationEventKey(1, 6L)) < 0);
        assertTrue(comparator.compare(new NavigationEventKey(1, 9L), new NavigationEventKey(2, 1L)) < 0);
    }

    @Test
    @DisplayName("下界大于上界的区间被拒绝")
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> KeyRange.bound(10L, 5L));
        assertThrows(IllegalArgumentException.class, () -> KeyRange.only(null));
    }
}

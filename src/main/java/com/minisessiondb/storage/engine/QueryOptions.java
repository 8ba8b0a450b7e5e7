package com.minisessiondb.storage.engine;

import com.minisessiondb.CommonConstant;
import com.minisessiondb.storage.CursorDirection;

/**
 * 分页与排序选项。默认 limit=100, offset=0, 倒序(最新的在前)。
 */
public final class QueryOptions {

    public enum Order {
        ASC,
        DESC
    }

    private final int limit;

    private final int offset;

    private final Order order;

    public QueryOptions(int limit, int offset, Order order) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        this.limit = limit;
        this.offset = offset;
        this.order = order == null ? Order.DESC : order;
    }

    public static QueryOptions defaults() {
        return new QueryOptions(CommonConstant.DEFAULT_QUERY_LIMIT, 0, Order.DESC);
    }

    public static QueryOptions limit(int limit) {
        return new QueryOptions(limit, 0, Order.DESC);
    }

    public static QueryOptions page(int limit, int offset) {
        return new QueryOptions(limit, offset, Order.DESC);
    }

    public QueryOptions withOrder(Order order) {
        return new QueryOptions(limit, offset, order);
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public Order getOrder() {
        return order;
    }

    CursorDirection direction() {
        return order == Order.ASC ? CursorDirection.NEXT : CursorDirection.PREV;
    }

    @Override
    public String toString() {
        return "QueryOptions{limit=" + limit + ", offset=" + offset + ", order=" + order + '}';
    }
}

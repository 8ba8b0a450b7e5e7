package com.minisessiondb.storage.engine;

/**
 * 闭区间 [start, end](毫秒时间戳)
 */
public final class DateRange {

    private final long start;

    private final long end;

    public DateRange(long start, long end) {
        if (start > end) {
            throw new IllegalArgumentException("Date range start is after end: " + start + " > " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange of(long start, long end) {
        return new DateRange(start, end);
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public boolean contains(long timestamp) {
        return timestamp >= start && timestamp <= end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}

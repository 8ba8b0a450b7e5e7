package com.minisessiondb.storage;

/**
 * 游标方向。NEXT按键升序,PREV按键降序(最新的记录先出)。
 */
public enum CursorDirection {
    NEXT,
    PREV
}

package com.minisessiondb.storage.impl;

import java.util.Set;

/**
 * InMemoryRecordStore - 内存记录存储
 *
 * 数据只存在于进程内存中。close()之后再次open()数据仍然保留,
 * 用来模拟"重启"和版本升级;进程退出即丢失。
 *
 * 适用场景: 单元测试、临时会话、不需要持久化的嵌入式使用。
 */
public class InMemoryRecordStore extends AbstractRecordStore {

    public InMemoryRecordStore() {
        super();
    }

    @Override
    public int peekVersion() {
        return version;
    }

    @Override
    protected void loadState() {
        // 状态常驻内存
    }

    @Override
    protected void onCommit(Set<String> dirtyContainers) {
        // 无需落盘
    }

    @Override
    protected void persistAll() {
        // 无需落盘
    }
}

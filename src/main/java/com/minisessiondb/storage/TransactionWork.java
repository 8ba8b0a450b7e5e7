package com.minisessiondb.storage;

/**
 * 在一个事务内执行的工作单元。抛出异常即回滚。
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(Transaction transaction);
}

package com.minisessiondb.exception;

/**
 * StorageException - 存储层运行时异常的基类
 *
 * 所有操作性错误(记录不存在、形状非法、备份缺失、迁移失败)都继承它,
 * 调用方可以按需捕获具体子类,也可以统一捕获基类。
 * 异步操作以它(被CompletionException包装)结束future。
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

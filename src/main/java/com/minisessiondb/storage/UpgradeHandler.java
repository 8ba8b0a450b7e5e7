package com.minisessiondb.storage;

/**
 * 打开存储时若持久化版本低于目标版本,由存储回调此接口完成升级。
 * 抛出异常表示升级失败,存储恢复到升级前的状态并拒绝打开。
 */
@FunctionalInterface
public interface UpgradeHandler {

    void onUpgrade(UpgradeContext context, int oldVersion, int newVersion);
}

package com.minisessiondb;

/**
 * CommonConstant - 全局常量
 */
public final class CommonConstant {

    private CommonConstant() {
    }

    /** 数据库名(对应文件存储的根目录名) */
    public static final String DATABASE_NAME = "SessionStorageDB";

    /** 数据目录前缀(相对工作目录) */
    public static final String DATA_PREFIX = "/data";

    /** 单次游标扫描的记录上限 */
    public static final int MAX_SCAN_RECORDS = 10000;

    /** 默认查询条数 */
    public static final int DEFAULT_QUERY_LIMIT = 100;

    /** 导出格式版本 */
    public static final String EXPORT_FORMAT_VERSION = "1.0.0";

    public static final long ONE_HOUR_MILLIS = 60L * 60 * 1000;

    public static final long ONE_DAY_MILLIS = 24 * ONE_HOUR_MILLIS;
}

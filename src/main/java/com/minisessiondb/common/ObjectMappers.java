package com.minisessiondb.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * ObjectMappers - 共享的Jackson配置
 *
 * standard(): 落盘、备份、导出使用,容忍未知字段(旧版本文件可以被新版本读取)
 * canonical(): 校验和输入使用,属性和Map键按字母排序并省略null,
 * 同一语义内容在任何机器上都得到同一字节序列
 */
public final class ObjectMappers {

    private static final ObjectMapper STANDARD = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private ObjectMappers() {
    }

    public static ObjectMapper standard() {
        return STANDARD;
    }

    public static ObjectMapper canonical() {
        return CANONICAL;
    }
}

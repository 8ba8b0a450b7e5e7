package com.minisessiondb.metadata;

import com.minisessiondb.CommonConstant;
import com.minisessiondb.storage.record.StoredRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SchemaRegistry - Schema注册表
 *
 * 声明数据库的五个容器、各自的主键路径和二级索引,是"当前最新schema"的唯一来源。
 * 迁移步骤、存储引擎的形状校验和结构校验都从这里读取定义。
 *
 * 容器与索引:
 * - sessions: 主键id;by_tag, by_created_at, by_updated_at, by_domain(多值)
 * - tabs: 主键id;by_session_id, by_window_id, by_url, by_domain, by_created_at
 * - navigation_events: 主键[tabId, timestamp];by_tab_id, by_session_id, by_timestamp, by_url, by_domain
 * - session_boundaries: 主键id;by_session_id, by_timestamp, by_reason
 * - metadata: 主键version;无索引
 *
 * 设计原则:
 * - 定义不可变,启动时一次性构建
 * - 形状校验只检查主键路径是否存在,字段语义由完整性校验器负责
 */
public final class SchemaRegistry {

    /** 最新schema版本 */
    public static final int LATEST_VERSION = 1;

    public static final String DATABASE_NAME = CommonConstant.DATABASE_NAME;

    // sessions 索引
    public static final String SESSION_BY_TAG = "by_tag";
    public static final String SESSION_BY_CREATED_AT = "by_created_at";
    public static final String SESSION_BY_UPDATED_AT = "by_updated_at";
    public static final String SESSION_BY_DOMAIN = "by_domain";

    // tabs 索引
    public static final String TAB_BY_SESSION_ID = "by_session_id";
    public static final String TAB_BY_WINDOW_ID = "by_window_id";
    public static final String TAB_BY_URL = "by_url";
    public static final String TAB_BY_DOMAIN = "by_domain";
    public static final String TAB_BY_CREATED_AT = "by_created_at";

    // navigation_events 索引
    public static final String NAV_BY_TAB_ID = "by_tab_id";
    public static final String NAV_BY_SESSION_ID = "by_session_id";
    public static final String NAV_BY_TIMESTAMP = "by_timestamp";
    public static final String NAV_BY_URL = "by_url";
    public static final String NAV_BY_DOMAIN = "by_domain";

    // session_boundaries 索引
    public static final String BOUNDARY_BY_SESSION_ID = "by_session_id";
    public static final String BOUNDARY_BY_TIMESTAMP = "by_timestamp";
    public static final String BOUNDARY_BY_REASON = "by_reason";

    private static final Map<ContainerType, ContainerDefinition> DEFINITIONS = buildDefinitions();

    private SchemaRegistry() {
    }

    private static Map<ContainerType, ContainerDefinition> buildDefinitions() {
        Map<ContainerType, ContainerDefinition> definitions = new LinkedHashMap<>();

        definitions.put(ContainerType.SESSIONS, new ContainerDefinition(
                ContainerType.SESSIONS.getContainerName(),
                Collections.singletonList("id"),
                Arrays.asList(
                        IndexDefinition.of(SESSION_BY_TAG, "tag"),
                        IndexDefinition.of(SESSION_BY_CREATED_AT, "createdAt"),
                        IndexDefinition.of(SESSION_BY_UPDATED_AT, "updatedAt"),
                        IndexDefinition.multiEntry(SESSION_BY_DOMAIN, "domains")
                )));

        definitions.put(ContainerType.TABS, new ContainerDefinition(
                ContainerType.TABS.getContainerName(),
                Collections.singletonList("id"),
                Arrays.asList(
                        IndexDefinition.of(TAB_BY_SESSION_ID, "sessionId"),
                        IndexDefinition.of(TAB_BY_WINDOW_ID, "windowId"),
                        IndexDefinition.of(TAB_BY_URL, "url"),
                        IndexDefinition.of(TAB_BY_DOMAIN, "domain"),
                        IndexDefinition.of(TAB_BY_CREATED_AT, "createdAt")
                )));

        definitions.put(ContainerType.NAVIGATION_EVENTS, new ContainerDefinition(
                ContainerType.NAVIGATION_EVENTS.getContainerName(),
                Arrays.asList("tabId", "timestamp"),
                Arrays.asList(
                        IndexDefinition.of(NAV_BY_TAB_ID, "tabId"),
                        IndexDefinition.of(NAV_BY_SESSION_ID, "sessionId"),
                        IndexDefinition.of(NAV_BY_TIMESTAMP, "timestamp"),
                        IndexDefinition.of(NAV_BY_URL, "url"),
                        IndexDefinition.of(NAV_BY_DOMAIN, "domain")
                )));

        definitions.put(ContainerType.SESSION_BOUNDARIES, new ContainerDefinition(
                ContainerType.SESSION_BOUNDARIES.getContainerName(),
                Collections.singletonList("id"),
                Arrays.asList(
                        IndexDefinition.of(BOUNDARY_BY_SESSION_ID, "sessionId"),
                        IndexDefinition.of(BOUNDARY_BY_TIMESTAMP, "timestamp"),
                        IndexDefinition.of(BOUNDARY_BY_REASON, "reason")
                )));

        definitions.put(ContainerType.METADATA, new ContainerDefinition(
                ContainerType.METADATA.getContainerName(),
                Collections.singletonList("version"),
                Collections.emptyList()));

        return Collections.unmodifiableMap(definitions);
    }

    /**
     * 获取全部容器定义(按声明顺序)
     */
    public static List<ContainerDefinition> getContainerDefinitions() {
        return new ArrayList<>(DEFINITIONS.values());
    }

    public static ContainerDefinition getContainerDefinition(ContainerType type) {
        return DEFINITIONS.get(type);
    }

    /**
     * 按名称获取容器定义
     *
     * @throws IllegalArgumentException 容器不存在
     */
    public static ContainerDefinition getContainerDefinition(String containerName) {
        return DEFINITIONS.get(ContainerType.fromName(containerName));
    }

    /**
     * 检查记录是否带齐容器主键路径上的所有字段
     *
     * 复合主键逐段检查。字符串主键为空串同样视为缺失。
     *
     * @param record 待写入记录
     * @return 齐全返回true
     */
    public static boolean hasRequiredKeys(StoredRecord record) {
        return findMissingKeyPath(record) == null;
    }

    /**
     * 返回第一个缺失的主键字段名,齐全时返回null
     */
    public static String findMissingKeyPath(StoredRecord record) {
        if (record == null) {
            return "<record>";
        }
        ContainerDefinition definition = DEFINITIONS.get(record.containerType());
        for (String part : definition.getKeyPath()) {
            Object value = record.keyPathValue(part);
            if (value == null) {
                return part;
            }
            if (value instanceof String s && s.isEmpty()) {
                return part;
            }
        }
        return null;
    }

    /**
     * 生成版本升级说明(仅用于文档和日志,不参与执行)
     *
     * @param fromVersion 当前版本
     * @param toVersion 目标版本
     * @return 说明列表
     */
    public static List<String> generateMigrationInstructions(int fromVersion, int toVersion) {
        List<String> instructions = new ArrayList<>();
        if (fromVersion >= toVersion) {
            return instructions;
        }
        for (int version = fromVersion + 1; version <= toVersion; version++) {
            switch (version) {
                case 1:
                    instructions.add("Create initial schema with sessions, tabs, navigation_events, session_boundaries, and metadata stores");
                    instructions.add("Add all required indexes for efficient querying");
                    break;
                default:
                    instructions.add("Apply schema changes for version " + version);
                    break;
            }
        }
        return instructions;
    }
}

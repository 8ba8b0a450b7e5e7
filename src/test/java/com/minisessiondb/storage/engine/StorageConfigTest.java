package com.minisessiondb.storage.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StorageConfig测试
 *
 * 配置优先级: Builder > 系统属性 > 环境变量 > minisessiondb.properties > 默认值
 */
@DisplayName("StorageConfig - 配置加载测试")
class StorageConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("minisessiondb.batchSize");
        System.clearProperty("minisessiondb.maxSessionAgeDays");
        System.clearProperty("minisessiondb.dataDir");
        System.clearProperty("minisessiondb.maxStorageSizeMb");
    }

    @Test
    @DisplayName("默认值来自配置文件")
    void testDefaults() {
        StorageConfig config = StorageConfig.builder().inMemory().build();

        assertTrue(config.isEnableCompression());
        assertTrue(config.isEnableIntegrityChecks());
        assertEquals(Duration.ofDays(365), config.getMaxSessionAge());
        assertEquals(100L * 1024 * 1024, config.getMaxStorageSize());
        assertEquals(50, config.getBatchSize());
        assertTrue(config.isIndexingEnabled());
        assertNull(config.getDataDir());
    }

    @Test
    @DisplayName("系统属性覆盖配置文件,Builder覆盖系统属性")
    void testPrecedence() {
        System.setProperty("minisessiondb.batchSize", "20");
        System.setProperty("minisessiondb.maxSessionAgeDays", "7");

        StorageConfig fromProperty = StorageConfig.builder().inMemory().build();
        assertEquals(20, fromProperty.getBatchSize());
        assertEquals(Duration.ofDays(7), fromProperty.getMaxSessionAge());

        StorageConfig fromBuilder = StorageConfig.builder().inMemory().batchSize(5).build();
        assertEquals(5, fromBuilder.getBatchSize());
    }

    @Test
    @DisplayName("非整数配置值回退到默认值")
    void testInvalidIntegerFallsBack() {
        System.setProperty("minisessiondb.batchSize", "lots");

        assertEquals(50, StorageConfig.builder().inMemory().build().getBatchSize());
    }

    @Test
    @DisplayName("外部配置的batchSize为0或负数、大小和年龄为负数时回退到默认值")
    void testOutOfRangeValuesFallBack() {
        System.setProperty("minisessiondb.batchSize", "0");
        System.setProperty("minisessiondb.maxSessionAgeDays", "-1");
        System.setProperty("minisessiondb.maxStorageSizeMb", "-5");

        StorageConfig config = StorageConfig.builder().inMemory().build();

        assertEquals(50, config.getBatchSize());
        assertEquals(Duration.ofDays(365), config.getMaxSessionAge());
        assertEquals(100L * 1024 * 1024, config.getMaxStorageSize());

        System.setProperty("minisessiondb.batchSize", "-3");
        assertEquals(50, StorageConfig.builder().inMemory().build().getBatchSize());
    }

    @Test
    @DisplayName("dataDir来自系统属性,inMemory()忽略它")
    void testDataDir() {
        System.setProperty("minisessiondb.dataDir", "target/sessions");

        assertEquals(Path.of("target/sessions"), StorageConfig.builder().build().getDataDir());
        assertNull(StorageConfig.builder().inMemory().build().getDataDir());
    }

    @Test
    @DisplayName("Builder拒绝非法的batchSize、存储大小和会话年龄")
    void testInvalidBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> StorageConfig.builder().batchSize(0));
        assertThrows(IllegalArgumentException.class, () -> StorageConfig.builder().maxStorageSize(-1));
        assertThrows(IllegalArgumentException.class,
                () -> StorageConfig.builder().maxSessionAge(Duration.ofDays(-1)));
    }

    @Test
    @DisplayName("属性名转环境变量名")
    void testEnvName() {
        assertEquals("MINISESSIONDB_BATCH_SIZE", StorageConfig.Builder.toEnvName("minisessiondb.batchSize"));
        assertEquals("MINISESSIONDB_DATA_DIR", StorageConfig.Builder.toEnvName("minisessiondb.dataDir"));
    }
}

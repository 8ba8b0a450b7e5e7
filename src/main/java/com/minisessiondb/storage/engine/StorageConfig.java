package com.minisessiondb.storage.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * StorageConfig - 存储引擎配置
 *
 * 取值优先级(高到低):
 * 1. Builder上显式设置的值
 * 2. 系统属性(-Dminisessiondb.batchSize=100)
 * 3. 环境变量(MINISESSIONDB_BATCH_SIZE)
 * 4. 配置文件 minisessiondb.properties(类路径优先,其次工作目录)
 * 5. 默认值
 *
 * 配置项:
 * <pre>
 * 属性                               默认值
 * minisessiondb.enableCompression     true
 * minisessiondb.enableIntegrityChecks true
 * minisessiondb.maxSessionAgeDays     365
 * minisessiondb.maxStorageSizeMb      100
 * minisessiondb.batchSize             50
 * minisessiondb.indexingEnabled       true
 * minisessiondb.dataDir               (空: 使用内存存储)
 * </pre>
 *
 * 使用模式:
 * <pre>
 * StorageConfig config = StorageConfig.builder()
 *     .dataDir(Path.of("data/sessions"))
 *     .maxSessionAge(Duration.ofDays(30))
 *     .build();
 * </pre>
 */
public final class StorageConfig {

    private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

    private static final String PROPERTIES_FILE = "minisessiondb.properties";

    private static final String PROP_ENABLE_COMPRESSION = "minisessiondb.enableCompression";
    private static final String PROP_ENABLE_INTEGRITY_CHECKS = "minisessiondb.enableIntegrityChecks";
    private static final String PROP_MAX_SESSION_AGE_DAYS = "minisessiondb.maxSessionAgeDays";
    private static final String PROP_MAX_STORAGE_SIZE_MB = "minisessiondb.maxStorageSizeMb";
    private static final String PROP_BATCH_SIZE = "minisessiondb.batchSize";
    private static final String PROP_INDEXING_ENABLED = "minisessiondb.indexingEnabled";
    private static final String PROP_DATA_DIR = "minisessiondb.dataDir";

    private static final boolean DEFAULT_ENABLE_COMPRESSION = true;
    private static final boolean DEFAULT_ENABLE_INTEGRITY_CHECKS = true;
    private static final int DEFAULT_MAX_SESSION_AGE_DAYS = 365;
    private static final int DEFAULT_MAX_STORAGE_SIZE_MB = 100;
    private static final int DEFAULT_BATCH_SIZE = 50;
    private static final boolean DEFAULT_INDEXING_ENABLED = true;

    private final boolean enableCompression;

    private final boolean enableIntegrityChecks;

    private final Duration maxSessionAge;

    private final long maxStorageSize;

    private final int batchSize;

    private final boolean indexingEnabled;

    private final Path dataDir;

    private StorageConfig(Builder builder) {
        this.enableCompression = builder.enableCompression;
        this.enableIntegrityChecks = builder.enableIntegrityChecks;
        this.maxSessionAge = builder.maxSessionAge;
        this.maxStorageSize = builder.maxStorageSize;
        this.batchSize = builder.batchSize;
        this.indexingEnabled = builder.indexingEnabled;
        this.dataDir = builder.dataDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从全部来源加载配置
     */
    public static StorageConfig load() {
        return builder().build();
    }

    public boolean isEnableCompression() {
        return enableCompression;
    }

    public boolean isEnableIntegrityChecks() {
        return enableIntegrityChecks;
    }

    /** 超过该年龄(按createdAt)的会话在维护时清理 */
    public Duration getMaxSessionAge() {
        return maxSessionAge;
    }

    /** 存储大小告警阈值(字节) */
    public long getMaxStorageSize() {
        return maxStorageSize;
    }

    /** 批量导入时每个事务写入的记录数 */
    public int getBatchSize() {
        return batchSize;
    }

    /** 关闭时查询不走二级索引,按主键全量扫描 */
    public boolean isIndexingEnabled() {
        return indexingEnabled;
    }

    /** 数据目录,为null时使用内存存储 */
    public Path getDataDir() {
        return dataDir;
    }

    @Override
    public String toString() {
        return "StorageConfig{" +
                "enableCompression=" + enableCompression +
                ", enableIntegrityChecks=" + enableIntegrityChecks +
                ", maxSessionAge=" + maxSessionAge +
                ", maxStorageSize=" + maxStorageSize +
                ", batchSize=" + batchSize +
                ", indexingEnabled=" + indexingEnabled +
                ", dataDir=" + dataDir +
                '}';
    }

    public static final class Builder {
        private Boolean enableCompression;
        private Boolean enableIntegrityChecks;
        private Duration maxSessionAge;
        private Long maxStorageSize;
        private Integer batchSize;
        private Boolean indexingEnabled;
        private Path dataDir;
        private boolean inMemory;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder enableCompression(boolean enableCompression) {
            this.enableCompression = enableCompression;
            return this;
        }

        public Builder enableIntegrityChecks(boolean enableIntegrityChecks) {
            this.enableIntegrityChecks = enableIntegrityChecks;
            return this;
        }

        public Builder maxSessionAge(Duration maxSessionAge) {
            if (maxSessionAge == null || maxSessionAge.isNegative()) {
                throw new IllegalArgumentException("Max session age must be non-negative: " + maxSessionAge);
            }
            this.maxSessionAge = maxSessionAge;
            return this;
        }

        public Builder maxStorageSize(long maxStorageSize) {
            if (maxStorageSize < 0) {
                throw new IllegalArgumentException("Max storage size must be non-negative: " + maxStorageSize);
            }
            this.maxStorageSize = maxStorageSize;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder indexingEnabled(boolean indexingEnabled) {
            this.indexingEnabled = indexingEnabled;
            return this;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            this.inMemory = false;
            return this;
        }

        /**
         * 强制使用内存存储(忽略外部配置的dataDir)
         */
        public Builder inMemory() {
            this.dataDir = null;
            this.inMemory = true;
            return this;
        }

        public StorageConfig build() {
            if (enableCompression == null) {
                enableCompression = resolveBoolean(PROP_ENABLE_COMPRESSION, DEFAULT_ENABLE_COMPRESSION);
            }
            if (enableIntegrityChecks == null) {
                enableIntegrityChecks = resolveBoolean(PROP_ENABLE_INTEGRITY_CHECKS, DEFAULT_ENABLE_INTEGRITY_CHECKS);
            }
            if (maxSessionAge == null) {
                maxSessionAge = Duration.ofDays(resolveInt(PROP_MAX_SESSION_AGE_DAYS, DEFAULT_MAX_SESSION_AGE_DAYS, 0));
            }
            if (maxStorageSize == null) {
                maxStorageSize = (long) resolveInt(PROP_MAX_STORAGE_SIZE_MB, DEFAULT_MAX_STORAGE_SIZE_MB, 0) * 1024 * 1024;
            }
            if (batchSize == null) {
                batchSize = resolveInt(PROP_BATCH_SIZE, DEFAULT_BATCH_SIZE, 1);
            }
            if (indexingEnabled == null) {
                indexingEnabled = resolveBoolean(PROP_INDEXING_ENABLED, DEFAULT_INDEXING_ENABLED);
            }
            if (dataDir == null && !inMemory) {
                String value = resolve(PROP_DATA_DIR);
                if (value != null) {
                    dataDir = Path.of(value);
                }
            }
            return new StorageConfig(this);
        }

        private String resolve(String property) {
            // 1. 系统属性
            String value = System.getProperty(property);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. 环境变量
            value = System.getenv(toEnvName(property));
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. 配置文件
            value = fileProperties.getProperty(property);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        }

        private boolean resolveBoolean(String property, boolean defaultValue) {
            String value = resolve(property);
            return value == null ? defaultValue : Boolean.parseBoolean(value);
        }

        /**
         * 读取整数配置项,不是整数或小于下限时使用默认值
         */
        private int resolveInt(String property, int defaultValue, int min) {
            String value = resolve(property);
            if (value == null) {
                return defaultValue;
            }
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                logger.warn("配置项 {} 不是整数: '{}',使用默认值 {}", property, value, defaultValue);
                return defaultValue;
            }
            if (parsed < min) {
                logger.warn("配置项 {} 不能小于 {}: {},使用默认值 {}", property, min, parsed, defaultValue);
                return defaultValue;
            }
            return parsed;
        }

        /**
         * minisessiondb.batchSize → MINISESSIONDB_BATCH_SIZE
         */
        static String toEnvName(String property) {
            StringBuilder sb = new StringBuilder();
            for (char c : property.toCharArray()) {
                if (c == '.') {
                    sb.append('_');
                } else if (Character.isUpperCase(c)) {
                    sb.append('_').append(c);
                } else {
                    sb.append(Character.toUpperCase(c));
                }
            }
            return sb.toString();
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // 类路径优先
            try (InputStream is = StorageConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                logger.warn("读取类路径配置文件失败: {}", e.getMessage());
            }

            // 其次工作目录
            Path path = Path.of(PROPERTIES_FILE);
            if (Files.exists(path)) {
                try (InputStream is = Files.newInputStream(path)) {
                    props.load(is);
                } catch (IOException e) {
                    logger.warn("读取配置文件 {} 失败: {}", path, e.getMessage());
                }
            }
            return props;
        }
    }
}

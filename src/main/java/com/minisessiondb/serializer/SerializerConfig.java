package com.minisessiondb.serializer;

/**
 * 序列化器配置
 *
 * <pre>
 * SerializerConfig config = SerializerConfig.builder()
 *     .compressionThreshold(2048)
 *     .build();
 * </pre>
 */
public final class SerializerConfig {

    public static final int DEFAULT_COMPRESSION_THRESHOLD = 1024;

    private final boolean enableCompression;

    private final int compressionThreshold;

    private final boolean enableOptimization;

    private final boolean preserveMetadata;

    private SerializerConfig(Builder builder) {
        this.enableCompression = builder.enableCompression;
        this.compressionThreshold = builder.compressionThreshold;
        this.enableOptimization = builder.enableOptimization;
        this.preserveMetadata = builder.preserveMetadata;
    }

    public static SerializerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 是否压缩较大的会话 */
    public boolean isEnableCompression() {
        return enableCompression;
    }

    /** 超过该字节数才尝试压缩 */
    public int getCompressionThreshold() {
        return compressionThreshold;
    }

    /** 是否截断过长的地址、标题、备注 */
    public boolean isEnableOptimization() {
        return enableOptimization;
    }

    /** 反序列化时是否校验校验和 */
    public boolean isPreserveMetadata() {
        return preserveMetadata;
    }

    @Override
    public String toString() {
        return "SerializerConfig{" +
                "enableCompression=" + enableCompression +
                ", compressionThreshold=" + compressionThreshold +
                ", enableOptimization=" + enableOptimization +
                ", preserveMetadata=" + preserveMetadata +
                '}';
    }

    public static final class Builder {
        private boolean enableCompression = true;
        private int compressionThreshold = DEFAULT_COMPRESSION_THRESHOLD;
        private boolean enableOptimization = true;
        private boolean preserveMetadata = true;

        private Builder() {
        }

        public Builder enableCompression(boolean enableCompression) {
            this.enableCompression = enableCompression;
            return this;
        }

        public Builder compressionThreshold(int compressionThreshold) {
            if (compressionThreshold < 0) {
                throw new IllegalArgumentException("Compression threshold cannot be negative");
            }
            this.compressionThreshold = compressionThreshold;
            return this;
        }

        public Builder enableOptimization(boolean enableOptimization) {
            this.enableOptimization = enableOptimization;
            return this;
        }

        public Builder preserveMetadata(boolean preserveMetadata) {
            this.preserveMetadata = preserveMetadata;
            return this;
        }

        public SerializerConfig build() {
            return new SerializerConfig(this);
        }
    }
}

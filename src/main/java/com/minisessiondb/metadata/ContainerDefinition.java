package com.minisessiondb.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ContainerDefinition - 容器声明
 *
 * 主键路径可以是单字段(["id"])或复合(["tabId", "timestamp"]),
 * 复合主键的每一段都必须在记录上存在。
 */
public final class ContainerDefinition {

    private final String name;

    private final List<String> keyPath;

    private final List<IndexDefinition> indexes;

    @JsonCreator
    public ContainerDefinition(@JsonProperty("name") String name,
                               @JsonProperty("keyPath") List<String> keyPath,
                               @JsonProperty("indexes") List<IndexDefinition> indexes) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Container name cannot be null or empty");
        }
        if (keyPath == null || keyPath.isEmpty()) {
            throw new IllegalArgumentException("Container must have a key path");
        }
        this.name = name;
        this.keyPath = Collections.unmodifiableList(new ArrayList<>(keyPath));
        this.indexes = Collections.unmodifiableList(indexes == null ? new ArrayList<>() : new ArrayList<>(indexes));
    }

    public String getName() {
        return name;
    }

    public List<String> getKeyPath() {
        return keyPath;
    }

    public List<IndexDefinition> getIndexes() {
        return indexes;
    }

    public boolean isCompositeKey() {
        return keyPath.size() > 1;
    }

    public IndexDefinition getIndex(String indexName) {
        for (IndexDefinition index : indexes) {
            if (index.getName().equals(indexName)) {
                return index;
            }
        }
        return null;
    }

    /**
     * 返回追加了一个索引的新定义
     */
    public ContainerDefinition withIndex(IndexDefinition index) {
        List<IndexDefinition> merged = new ArrayList<>(indexes);
        merged.add(index);
        return new ContainerDefinition(name, keyPath, merged);
    }

    @Override
    public String toString() {
        return "ContainerDefinition{" +
                "name='" + name + '\'' +
                ", keyPath=" + keyPath +
                ", indexes=" + indexes.size() +
                '}';
    }
}

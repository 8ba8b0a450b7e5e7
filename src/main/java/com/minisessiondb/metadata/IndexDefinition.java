package com.minisessiondb.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * IndexDefinition - 二级索引声明
 *
 * multiEntry为true时,键路径上的值是列表,列表中每个元素各自成为一个索引项
 * (会话的domains就是这样被索引的)。
 */
public final class IndexDefinition {

    private final String name;

    private final String keyPath;

    private final boolean unique;

    private final boolean multiEntry;

    @JsonCreator
    public IndexDefinition(@JsonProperty("name") String name,
                           @JsonProperty("keyPath") String keyPath,
                           @JsonProperty("unique") boolean unique,
                           @JsonProperty("multiEntry") boolean multiEntry) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Index name cannot be null or empty");
        }
        if (keyPath == null || keyPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Index key path cannot be null or empty");
        }
        this.name = name;
        this.keyPath = keyPath;
        this.unique = unique;
        this.multiEntry = multiEntry;
    }

    public static IndexDefinition of(String name, String keyPath) {
        return new IndexDefinition(name, keyPath, false, false);
    }

    public static IndexDefinition multiEntry(String name, String keyPath) {
        return new IndexDefinition(name, keyPath, false, true);
    }

    public String getName() {
        return name;
    }

    public String getKeyPath() {
        return keyPath;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isMultiEntry() {
        return multiEntry;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexDefinition)) return false;
        IndexDefinition that = (IndexDefinition) o;
        return unique == that.unique
                && multiEntry == that.multiEntry
                && name.equals(that.name)
                && keyPath.equals(that.keyPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keyPath, unique, multiEntry);
    }

    @Override
    public String toString() {
        return "IndexDefinition{" +
                "name='" + name + '\'' +
                ", keyPath='" + keyPath + '\'' +
                ", unique=" + unique +
                ", multiEntry=" + multiEntry +
                '}';
    }
}

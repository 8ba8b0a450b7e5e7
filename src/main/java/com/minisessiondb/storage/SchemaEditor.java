package com.minisessiondb.storage;

import com.minisessiondb.metadata.ContainerDefinition;
import com.minisessiondb.metadata.IndexDefinition;

import java.util.Set;

/**
 * 结构变更接口,只在升级回调期间可用
 */
public interface SchemaEditor {

    boolean hasContainer(String containerName);

    Set<String> getContainerNames();

    Set<String> getIndexNames(String containerName);

    /**
     * 创建容器及其声明的全部索引
     *
     * @throws IllegalStateException 容器已存在
     */
    void createContainer(ContainerDefinition definition);

    /**
     * 在已有容器上追加索引,并用现有记录填充
     */
    void createIndex(String containerName, IndexDefinition index);

    void deleteContainer(String containerName);
}

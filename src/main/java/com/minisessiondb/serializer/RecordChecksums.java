package com.minisessiondb.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.model.NavigationEvent;
import com.minisessiondb.model.Session;
import com.minisessiondb.model.SessionBoundary;
import com.minisessiondb.model.Tab;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RecordChecksums - 记录校验和
 *
 * 语义字段的唯一定义处。校验和只覆盖语义字段,存储附加字段
 * (version、lastModified、size、派生计数)变化不会改变校验和。
 *
 * 各类记录的语义字段:
 * - Session: id, tag, createdAt, tabs, windowIds, metadata(不含updatedAt)
 * - Tab: id, url, title, favicon, windowId, createdAt, lastAccessed, timeSpent, scrollPosition, formData
 * - NavigationEvent: tabId, url, referrer, timestamp, transitionType
 * - SessionBoundary: id, type, reason, timestamp, sessionId, context
 *
 * 输入先转成规范化JSON(属性排序、省略null),再交给可替换的算法。
 */
public class RecordChecksums {

    private final ChecksumAlgorithm algorithm;

    private final ObjectMapper canonicalMapper;

    public RecordChecksums(ChecksumAlgorithm algorithm) {
        if (algorithm == null) {
            throw new IllegalArgumentException("Checksum algorithm cannot be null");
        }
        this.algorithm = algorithm;
        this.canonicalMapper = ObjectMappers.canonical();
    }

    public ChecksumAlgorithm getAlgorithm() {
        return algorithm;
    }

    public String ofSession(Session session) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", session.getId());
        fields.put("tag", session.getTag());
        fields.put("createdAt", session.getCreatedAt());
        fields.put("tabs", session.getTabs());
        fields.put("windowIds", session.getWindowIds());
        fields.put("metadata", session.getMetadata());
        return of(fields);
    }

    public String ofTab(Tab tab) {
        return of(tab);
    }

    public String ofNavigationEvent(NavigationEvent event) {
        return of(event);
    }

    public String ofBoundary(SessionBoundary boundary) {
        return of(boundary);
    }

    /**
     * 对任意可序列化对象计算校验和(备份、导出负载)
     */
    public String of(Object value) {
        try {
            return algorithm.compute(canonicalMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to canonicalize value for checksum", e);
        }
    }
}

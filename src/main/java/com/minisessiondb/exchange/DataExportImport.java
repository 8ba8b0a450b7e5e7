package com.minisessiondb.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.CommonConstant;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.integrity.DataIntegrityValidator;
import com.minisessiondb.integrity.ValidationError;
import com.minisessiondb.integrity.ValidationResult;
import com.minisessiondb.integrity.ValidationWarning;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.serializer.RecordChecksums;
import com.minisessiondb.storage.StoreSnapshot;
import com.minisessiondb.storage.engine.DateRange;
import com.minisessiondb.storage.engine.SessionStorageEngine;
import com.minisessiondb.storage.record.StoredNavigationEvent;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.record.StoredSession;
import com.minisessiondb.storage.record.StoredSessionBoundary;
import com.minisessiondb.storage.record.StoredTab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * DataExportImport - JSON导出与导入
 *
 * 导出: 读取全库快照 → 按过滤条件裁剪 → 按开关取舍各类记录 → 计算数据部分校验和 → 输出JSON
 * 导入: 解析JSON → 核对文件校验和 → 逐条校验 → 按策略跳过或覆盖已有主键 → 交给存储引擎批量写入
 *
 * 导出文件格式:
 * <pre>
 * {
 *   "metadata": {"version": "1.0.0", "exportedAt": ..., "format": "json", "checksum": "..."},
 *   "data": {"sessions": [...], "tabs": [...], "navigationEvents": [...], "boundaries": [...]}
 * }
 * </pre>
 */
public class DataExportImport {

    private static final Logger logger = LoggerFactory.getLogger(DataExportImport.class);

    private final SessionStorageEngine engine;

    private final DataIntegrityValidator validator;

    private final RecordChecksums checksums;

    private final Clock clock;

    private final ObjectMapper mapper = ObjectMappers.standard();

    public DataExportImport(SessionStorageEngine engine, DataIntegrityValidator validator,
                            RecordChecksums checksums, Clock clock) {
        this.engine = engine;
        this.validator = validator;
        this.checksums = checksums;
        this.clock = clock;
    }

    // ==================== 导出 ====================

    public CompletableFuture<ExportResult> exportData(ExportOptions options, ExportFilter filter) {
        return engine.exportAll().thenApply(snapshot -> export(snapshot, options, filter));
    }

    /**
     * 把快照渲染为导出文件
     */
    public ExportResult export(StoreSnapshot snapshot, ExportOptions options, ExportFilter filter) {
        long start = System.nanoTime();
        StoreSnapshot filtered = applyFilter(snapshot, filter);

        StoreSnapshot data = new StoreSnapshot();
        if (options.isIncludeSessions()) {
            data.setSessions(filtered.getSessions());
        }
        if (options.isIncludeTabs()) {
            data.setTabs(filtered.getTabs());
        }
        if (options.isIncludeHistory()) {
            data.setNavigationEvents(filtered.getNavigationEvents());
        }
        if (options.isIncludeBoundaries()) {
            data.setBoundaries(filtered.getBoundaries());
        }

        ExportMetadata metadata = new ExportMetadata();
        metadata.setVersion(CommonConstant.EXPORT_FORMAT_VERSION);
        metadata.setExportedAt(clock.millis());
        metadata.setChecksum(checksums.of(data));
        metadata.setChecksumAlgorithm(checksums.getAlgorithm().getName());

        String json;
        try {
            ExportDocument document = new ExportDocument(metadata, data);
            json = options.isPrettyPrint()
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                    : mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to render export", e);
        }

        Map<String, Integer> counts = data.itemCounts();
        counts.remove(ContainerType.METADATA.getContainerName());
        long size = json.getBytes(StandardCharsets.UTF_8).length;
        logger.info("导出完成,耗时 {} ms, 大小 {} 字节, 记录 {}",
                Duration.ofNanos(System.nanoTime() - start).toMillis(), size, counts);
        return new ExportResult(json, size, counts, metadata);
    }

    // ==================== 导入 ====================

    public CompletableFuture<ImportResult> importData(String json, ImportOptions options) {
        long start = System.nanoTime();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        StoreSnapshot data;
        try {
            data = parse(json);
        } catch (StorageException e) {
            errors.add("Import failed: " + e.getMessage());
            return CompletableFuture.completedFuture(
                    new ImportResult(emptyCounts(), emptyCounts(), errors, warnings, elapsed(start)));
        }

        StoreSnapshot accepted = options.isValidateData() ? validateRecords(data, errors, warnings) : data;

        return engine.exportAll().thenCompose(existing -> {
            Map<String, Integer> imported = emptyCounts();
            Map<String, Integer> skipped = emptyCounts();
            StoreSnapshot toWrite = selectForWrite(accepted, existing, options.isOverwriteExisting(),
                    imported, skipped);
            return engine.importRecords(toWrite, true).thenApply(written -> {
                ImportResult result = new ImportResult(imported, skipped, errors, warnings, elapsed(start));
                logger.info("导入完成: 写入 {} 条, {}", written, result);
                return result;
            });
        });
    }

    /**
     * 解析导出文件并核对数据部分校验和
     *
     * @throws StorageException 格式不合法或校验和不一致
     */
    public StoreSnapshot parse(String json) {
        ExportDocument document;
        try {
            document = mapper.readValue(json, ExportDocument.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.getData() == null) {
            throw new StorageException("Invalid JSON structure: missing data object");
        }
        StoreSnapshot data = document.getData();
        data.setMetadata(new ArrayList<>());

        ExportMetadata metadata = document.getMetadata();
        if (metadata != null && metadata.getChecksum() != null) {
            String actual = checksums.of(data);
            if (!metadata.getChecksum().equals(actual)) {
                throw new StorageException("Export checksum mismatch: expected " + metadata.getChecksum()
                        + ", actual " + actual);
            }
        }
        return data;
    }

    // ==================== 内部方法 ====================

    static StoreSnapshot applyFilter(StoreSnapshot source, ExportFilter filter) {
        List<StoredSession> sessions = new ArrayList<>(source.getSessions());
        List<StoredTab> tabs = new ArrayList<>(source.getTabs());
        List<StoredNavigationEvent> events = new ArrayList<>(source.getNavigationEvents());
        List<StoredSessionBoundary> boundaries = new ArrayList<>(source.getBoundaries());

        if (filter != null) {
            if (!filter.getSessionIds().isEmpty()) {
                Set<String> ids = new HashSet<>(filter.getSessionIds());
                sessions.removeIf(s -> !ids.contains(s.getId()));
                retainSessions(ids, tabs, events, boundaries);
            }
            DateRange range = filter.getDateRange();
            if (range != null) {
                sessions.removeIf(s -> !range.contains(s.getCreatedAt()));
                tabs.removeIf(t -> !range.contains(t.getCreatedAt()));
                events.removeIf(e -> e.getTimestamp() == null || !range.contains(e.getTimestamp()));
                boundaries.removeIf(b -> !range.contains(b.getTimestamp()));
            }
            if (!filter.getTags().isEmpty()) {
                Set<String> tags = new HashSet<>(filter.getTags());
                sessions.removeIf(s -> !tags.contains(s.getTag()));
                Set<String> ids = new HashSet<>();
                for (StoredSession session : sessions) {
                    ids.add(session.getId());
                }
                retainSessions(ids, tabs, events, boundaries);
            }
            if (!filter.getDomains().isEmpty()) {
                Set<String> domains = new HashSet<>(filter.getDomains());
                sessions.removeIf(s -> s.getDomains() == null || s.getDomains().stream().noneMatch(domains::contains));
                tabs.removeIf(t -> !domains.contains(t.getDomain()));
                events.removeIf(e -> !domains.contains(e.getDomain()));
            }
        }

        StoreSnapshot filtered = new StoreSnapshot();
        filtered.setSessions(sessions);
        filtered.setTabs(tabs);
        filtered.setNavigationEvents(events);
        filtered.setBoundaries(boundaries);
        return filtered;
    }

    private static void retainSessions(Set<String> sessionIds, List<StoredTab> tabs,
                                       List<StoredNavigationEvent> events, List<StoredSessionBoundary> boundaries) {
        tabs.removeIf(t -> !sessionIds.contains(t.getSessionId()));
        events.removeIf(e -> !sessionIds.contains(e.getSessionId()));
        boundaries.removeIf(b -> !sessionIds.contains(b.getSessionId()));
    }

    /**
     * 逐条校验,返回通过校验的记录
     */
    private StoreSnapshot validateRecords(StoreSnapshot data, List<String> errors, List<String> warnings) {
        StoreSnapshot accepted = new StoreSnapshot();
        for (StoredSession session : data.getSessions()) {
            if (collect("Session " + session.getId(), validator.validateSession(session), errors, warnings)) {
                accepted.getSessions().add(session);
            }
        }
        for (StoredTab tab : data.getTabs()) {
            if (collect("Tab " + tab.getId(), validator.validateTab(tab), errors, warnings)) {
                accepted.getTabs().add(tab);
            }
        }
        for (StoredNavigationEvent event : data.getNavigationEvents()) {
            String label = "Navigation event " + event.getTabId() + "_" + event.getTimestamp();
            if (collect(label, validator.validateNavigationEvent(event), errors, warnings)) {
                accepted.getNavigationEvents().add(event);
            }
        }
        for (StoredSessionBoundary boundary : data.getBoundaries()) {
            if (collect("Boundary " + boundary.getId(), validator.validateSessionBoundary(boundary), errors, warnings)) {
                accepted.getBoundaries().add(boundary);
            }
        }
        return accepted;
    }

    private static boolean collect(String label, ValidationResult result, List<String> errors, List<String> warnings) {
        for (ValidationError error : result.getErrors()) {
            errors.add(label + ": " + error.getMessage());
        }
        for (ValidationWarning warning : result.getWarnings()) {
            warnings.add(label + ": " + warning.getMessage());
        }
        return result.isValid();
    }

    private static StoreSnapshot selectForWrite(StoreSnapshot incoming, StoreSnapshot existing, boolean overwrite,
                                                Map<String, Integer> imported, Map<String, Integer> skipped) {
        Map<ContainerType, Set<Object>> existingKeys = new EnumMap<>(ContainerType.class);
        addKeys(existingKeys, existing.getSessions());
        addKeys(existingKeys, existing.getTabs());
        addKeys(existingKeys, existing.getNavigationEvents());
        addKeys(existingKeys, existing.getBoundaries());

        StoreSnapshot toWrite = new StoreSnapshot();
        toWrite.setSessions(select(incoming.getSessions(), existingKeys, overwrite, imported, skipped));
        toWrite.setTabs(select(incoming.getTabs(), existingKeys, overwrite, imported, skipped));
        toWrite.setNavigationEvents(select(incoming.getNavigationEvents(), existingKeys, overwrite, imported, skipped));
        toWrite.setBoundaries(select(incoming.getBoundaries(), existingKeys, overwrite, imported, skipped));
        return toWrite;
    }

    private static void addKeys(Map<ContainerType, Set<Object>> keys, List<? extends StoredRecord> records) {
        for (StoredRecord record : records) {
            keys.computeIfAbsent(record.containerType(), t -> new HashSet<>()).add(record.primaryKey());
        }
    }

    private static <T extends StoredRecord> List<T> select(List<T> records, Map<ContainerType, Set<Object>> existingKeys,
                                                           boolean overwrite, Map<String, Integer> imported,
                                                           Map<String, Integer> skipped) {
        List<T> selected = new ArrayList<>();
        for (T record : records) {
            String container = record.containerType().getContainerName();
            Set<Object> keys = existingKeys.get(record.containerType());
            if (!overwrite && keys != null && keys.contains(record.primaryKey())) {
                skipped.merge(container, 1, Integer::sum);
            } else {
                selected.add(record);
                imported.merge(container, 1, Integer::sum);
            }
        }
        return selected;
    }

    private static Map<String, Integer> emptyCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(ContainerType.SESSIONS.getContainerName(), 0);
        counts.put(ContainerType.TABS.getContainerName(), 0);
        counts.put(ContainerType.NAVIGATION_EVENTS.getContainerName(), 0);
        counts.put(ContainerType.SESSION_BOUNDARIES.getContainerName(), 0);
        return counts;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}

package com.minisessiondb.exchange;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 导入结果。计数按容器名分组,没有错误即成功。
 */
public final class ImportResult {

    private final Map<String, Integer> imported;

    private final Map<String, Integer> skipped;

    private final List<String> errors;

    private final List<String> warnings;

    private final Duration processingTime;

    public ImportResult(Map<String, Integer> imported, Map<String, Integer> skipped,
                        List<String> errors, List<String> warnings, Duration processingTime) {
        this.imported = Collections.unmodifiableMap(imported);
        this.skipped = Collections.unmodifiableMap(skipped);
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
        this.processingTime = processingTime;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public Map<String, Integer> getImported() {
        return imported;
    }

    public Map<String, Integer> getSkipped() {
        return skipped;
    }

    public int getTotalProcessed() {
        int total = 0;
        for (int count : imported.values()) {
            total += count;
        }
        return total;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Duration getProcessingTime() {
        return processingTime;
    }

    @Override
    public String toString() {
        return "ImportResult{" +
                "success=" + isSuccess() +
                ", imported=" + imported +
                ", skipped=" + skipped +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                '}';
    }
}

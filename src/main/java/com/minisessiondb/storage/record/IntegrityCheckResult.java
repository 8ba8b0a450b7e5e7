package com.minisessiondb.storage.record;

import java.util.ArrayList;
import java.util.List;

/**
 * 最近一次后台完整性扫描的结论,记录在数据库元数据中
 */
public class IntegrityCheckResult {

    private long lastCheck;

    private boolean valid = true;

    private List<String> errors = new ArrayList<>();

    public IntegrityCheckResult() {
    }

    public IntegrityCheckResult(long lastCheck, boolean valid, List<String> errors) {
        this.lastCheck = lastCheck;
        this.valid = valid;
        this.errors = new ArrayList<>(errors);
    }

    public IntegrityCheckResult(IntegrityCheckResult other) {
        this(other.lastCheck, other.valid, other.errors == null ? new ArrayList<>() : other.errors);
    }

    public long getLastCheck() {
        return lastCheck;
    }

    public void setLastCheck(long lastCheck) {
        this.lastCheck = lastCheck;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }
}

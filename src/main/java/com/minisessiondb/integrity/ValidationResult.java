package com.minisessiondb.integrity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结果。没有错误即有效,警告不影响有效性。
 */
public final class ValidationResult {

    private final List<ValidationError> errors;

    private final List<ValidationWarning> warnings;

    private final int correctedItems;

    private final Duration validationTime;

    public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings,
                            int correctedItems, Duration validationTime) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.correctedItems = correctedItems;
        this.validationTime = validationTime;
    }

    public static ValidationResult empty() {
        return new ValidationResult(Collections.emptyList(), Collections.emptyList(), 0, Duration.ZERO);
    }

    /**
     * 合并多个结果,耗时与修正数累加
     */
    public static ValidationResult merge(List<ValidationResult> results) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        int corrected = 0;
        Duration time = Duration.ZERO;
        for (ValidationResult result : results) {
            errors.addAll(result.errors);
            warnings.addAll(result.warnings);
            corrected += result.correctedItems;
            time = time.plus(result.validationTime);
        }
        return new ValidationResult(errors, warnings, corrected, time);
    }

    /**
     * 用自动修正后剩余的错误替换错误列表
     */
    public ValidationResult afterCorrection(List<ValidationError> remaining, Duration extraTime) {
        int corrected = correctedItems + (errors.size() - remaining.size());
        return new ValidationResult(remaining, warnings, corrected, validationTime.plus(extraTime));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<ValidationWarning> getWarnings() {
        return warnings;
    }

    public int getCorrectedItems() {
        return correctedItems;
    }

    public Duration getValidationTime() {
        return validationTime;
    }

    @Override
    public String toString() {
        return "ValidationResult{" +
                "valid=" + isValid() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                ", correctedItems=" + correctedItems +
                ", validationTime=" + validationTime +
                '}';
    }
}

package com.metocean.report.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 处理步骤参数校验结果
 */
public class ValidationResult {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult failure(String error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /**
     * 合并另一个校验结果，消息前加上来源前缀
     */
    public ValidationResult merge(String prefix, ValidationResult other) {
        for (String error : other.errors) {
            errors.add(prefix + ": " + error);
        }
        for (String warning : other.warnings) {
            warnings.add(prefix + ": " + warning);
        }
        return this;
    }

    public boolean isValid() { return errors.isEmpty(); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
}

package com.cspsmith.core.model;

import java.util.List;

/**
 * 검증 결과. valid=false 는 구조적으로 빈 입력일 때만.
 * warnings 는 검사 순서대로 누적된다.
 */
public record ValidationResult(boolean valid, List<ValidationWarning> warnings) {

    public ValidationResult {
        warnings = (warnings == null ? List.of() : List.copyOf(warnings));
    }

    public boolean hasWarnings() { return !warnings.isEmpty(); }

    public long errorCount() {
        return warnings.stream().filter(ValidationWarning::isError).count();
    }
}

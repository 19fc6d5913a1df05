package com.cspsmith.core.model;

import java.util.Objects;

/** 검증 경고/오류 1건: 메시지 + 권장 수정안 */
public record ValidationWarning(Severity severity, String message, String fix) {

    public ValidationWarning {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        fix = (fix == null ? "" : fix);
    }

    public static ValidationWarning warning(String message, String fix) {
        return new ValidationWarning(Severity.WARNING, message, fix);
    }

    public static ValidationWarning error(String message, String fix) {
        return new ValidationWarning(Severity.ERROR, message, fix);
    }

    public boolean isError() { return severity == Severity.ERROR; }
}

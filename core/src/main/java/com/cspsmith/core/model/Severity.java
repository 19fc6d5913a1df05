package com.cspsmith.core.model;

import java.util.Locale;

/** 검증 결과 심각도 */
public enum Severity {
    WARNING,
    ERROR;

    public String label() { return name().toLowerCase(Locale.ROOT); }
}

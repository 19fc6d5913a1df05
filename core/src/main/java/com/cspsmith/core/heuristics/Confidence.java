package com.cspsmith.core.heuristics;

import java.util.Locale;

/** 추론 신뢰도. 규칙마다 고정값 */
public enum Confidence {
    HIGH, MEDIUM, LOW;

    public String label() { return name().toLowerCase(Locale.ROOT); }
}

package com.cspsmith.core.model;

import java.util.Locale;
import java.util.Objects;

/** 디렉티브 단위 add/remove 1건. 목록 순서대로 적용된다. */
public record CspModification(Action action, String directive, String value) {

    public enum Action {
        ADD, REMOVE;

        public static Action parse(String s) {
            if (s != null) {
                String v = s.trim().toUpperCase(Locale.ROOT);
                for (Action a : values()) if (a.name().equals(v)) return a;
            }
            throw new IllegalArgumentException("Unknown modification action: " + s);
        }
    }

    public CspModification {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(directive, "directive");
        Objects.requireNonNull(value, "value");
        if (directive.isBlank()) throw new IllegalArgumentException("directive must not be blank");
    }

    public static CspModification add(String directive, String value) {
        return new CspModification(Action.ADD, directive, value);
    }

    public static CspModification remove(String directive, String value) {
        return new CspModification(Action.REMOVE, directive, value);
    }
}

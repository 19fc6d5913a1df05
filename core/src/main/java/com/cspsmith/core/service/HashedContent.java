package com.cspsmith.core.service;

import java.util.Objects;

/** 계산된 해시 1건 + 출처 (verbose/리포트용) */
public record HashedContent(String hash, Kind kind, String sourceFile, String content) {

    public enum Kind {
        SCRIPT("script", "Inline Scripts"),
        STYLE_TAG("style-tag", "Style Tags"),
        STYLE_ATTR("style-attr", "Style Attributes"),
        EVENT_HANDLER("event-handler", "Event Handlers");

        private final String key;
        private final String title;

        Kind(String key, String title) {
            this.key = key;
            this.title = title;
        }

        public String key() { return key; }
        public String title() { return title; }
    }

    public HashedContent {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(kind, "kind");
        sourceFile = (sourceFile == null ? "" : sourceFile);
        content = (content == null ? "" : content);
    }

    /** 공백을 한 칸으로 접고 maxLen 초과 시 "..." */
    public String snippet(int maxLen) {
        String s = content.trim().replaceAll("\\s+", " ");
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}

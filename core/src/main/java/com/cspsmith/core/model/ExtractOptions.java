package com.cspsmith.core.model;

/** 인라인 콘텐츠 수집 스위치 (기본 전부 on). YAML `include:` 섹션과 매핑 */
public final class ExtractOptions {
    private boolean scripts = true;
    private boolean styles = true;
    private boolean inlineStyles = true;
    private boolean eventHandlers = true;

    public static ExtractOptions all() { return new ExtractOptions(); }

    public boolean isScripts() { return scripts; }
    public boolean isStyles() { return styles; }
    public boolean isInlineStyles() { return inlineStyles; }
    public boolean isEventHandlers() { return eventHandlers; }

    public ExtractOptions setScripts(boolean v) { this.scripts = v; return this; }
    public ExtractOptions setStyles(boolean v) { this.styles = v; return this; }
    public ExtractOptions setInlineStyles(boolean v) { this.inlineStyles = v; return this; }
    public ExtractOptions setEventHandlers(boolean v) { this.eventHandlers = v; return this; }

    @Override
    public String toString() {
        return "ExtractOptions{scripts=" + scripts + ", styles=" + styles
                + ", inlineStyles=" + inlineStyles + ", eventHandlers=" + eventHandlers + '}';
    }
}

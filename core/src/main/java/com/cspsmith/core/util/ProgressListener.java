package com.cspsmith.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase "extract" | "heuristics" | "merge" | "validate"
     * @param done  처리한 파일 수 (파일 단위가 아니면 -1)
     * @param total 전체 파일 수 (모르면 -1)
     * @param item  현재 대상 (파일 경로 등, 없으면 "")
     */
    void onProgress(String phase, int done, int total, String item);

    ProgressListener NONE = (phase, d, t, item) -> {};
}

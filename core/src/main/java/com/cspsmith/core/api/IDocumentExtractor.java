// IDocumentExtractor.java
package com.cspsmith.core.api;

import com.cspsmith.core.model.DocumentContent;

import java.io.IOException;
import java.nio.file.Path;

/** 문서 추출 최소 계약: HTML 한 번 파싱으로 인라인 콘텐츠 + 외부 리소스를 돌려준다. */
public interface IDocumentExtractor {
    DocumentContent extract(Path file) throws IOException;
    DocumentContent extract(String html);
}

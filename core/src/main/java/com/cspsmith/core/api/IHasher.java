// IHasher.java
package com.cspsmith.core.api;

/** 해셔 최소 계약: 콘텐츠 문자열을 CSP 해시 토큰('algo-base64')으로. */
public interface IHasher {
    String hash(String content);
}

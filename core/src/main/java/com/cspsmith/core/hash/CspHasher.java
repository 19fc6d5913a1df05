package com.cspsmith.core.hash;

import com.cspsmith.core.api.IHasher;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;

/**
 * 인라인 콘텐츠 → "'sha256-...'" 토큰.
 * 콘텐츠 UTF-8 바이트 그대로 해시 (공백/개행 정규화 없음), 표준 Base64.
 */
public final class CspHasher implements IHasher {

    private final HashAlgorithm algorithm;

    public CspHasher() {
        this(HashAlgorithm.SHA256);
    }

    public CspHasher(HashAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    }

    public HashAlgorithm algorithm() { return algorithm; }

    @Override
    public String hash(String content) {
        byte[] bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
        String b64 = Base64.getEncoder().encodeToString(digest(bytes));
        return "'" + algorithm.token() + "-" + b64 + "'";
    }

    private byte[] digest(byte[] bytes) {
        try {
            return MessageDigest.getInstance(algorithm.jcaName()).digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            // SHA-2 는 모든 JRE 필수 알고리즘
            throw new IllegalStateException("Digest not available: " + algorithm.jcaName(), e);
        }
    }
}

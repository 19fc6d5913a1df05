package com.cspsmith.core.hash;

import java.util.Locale;

/** CSP 가 허용하는 해시 알고리즘 */
public enum HashAlgorithm {
    SHA256("sha256", "SHA-256"),
    SHA384("sha384", "SHA-384"),
    SHA512("sha512", "SHA-512");

    private final String token;
    private final String jcaName;

    HashAlgorithm(String token, String jcaName) {
        this.token = token;
        this.jcaName = jcaName;
    }

    /** CSP 토큰 접두어 ("sha256") */
    public String token() { return token; }

    /** MessageDigest 알고리즘 이름 */
    public String jcaName() { return jcaName; }

    /** "sha256" / "SHA-256" / "SHA256" 모두 허용 */
    public static HashAlgorithm fromName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT).replace("-", "");
            for (HashAlgorithm a : values()) {
                if (a.token.equals(n)) return a;
            }
        }
        throw new IllegalArgumentException(
                "invalid hash algorithm '" + name + "'. Must be sha256, sha384, or sha512");
    }
}

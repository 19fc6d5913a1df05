package com.cspsmith.core.resource;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** URL → origin("scheme://host[:port]") 추출 유틸. 실패는 항상 "" */
public final class DomainExtractor {
    // 호스트 문자 + 선택적 숫자 포트
    private static final Pattern REGISTRY_AUTHORITY = Pattern.compile("([A-Za-z0-9._-]+)(?::(\\d{1,5}))?");

    private DomainExtractor() {}

    /**
     * 규칙(우선순위 순):
     * - "data:" 로 시작 → ""
     * - http://, https://, // 로 시작하지 않음(상대경로) → ""
     * - "//host/..." 는 "https://host/..." 로 취급
     * - 파싱 실패 또는 host 없음 → ""
     * - 그 외 scheme://host[:port] (path/query/fragment 제거, host 소문자)
     */
    public static String extract(String rawUrl) {
        if (rawUrl == null) return "";
        if (rawUrl.startsWith("data:")) return "";
        if (!rawUrl.startsWith("http://") && !rawUrl.startsWith("https://") && !rawUrl.startsWith("//")) {
            return "";
        }

        String url = rawUrl.startsWith("//") ? "https:" + rawUrl : rawUrl;
        String scheme = url.substring(0, url.indexOf(':')).toLowerCase(Locale.ROOT);

        URI u = parseLenient(url);
        if (u == null) return "";

        String host = u.getHost();
        int port = u.getPort();
        if (host == null) {
            // registry 기반 authority(예: 밑줄 포함 호스트) → userinfo 를 떼고 host[:port] 형태일 때만 사용
            String authority = u.getRawAuthority();
            if (authority == null) return "";
            int at = authority.lastIndexOf('@');
            Matcher m = REGISTRY_AUTHORITY.matcher(at >= 0 ? authority.substring(at + 1) : authority);
            if (!m.matches()) return "";
            host = m.group(1);
            port = (m.group(2) != null) ? Integer.parseInt(m.group(2)) : -1;
        }
        if (host.isEmpty()) return "";

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        if (port >= 0) sb.append(':').append(port);
        return sb.toString();
    }

    /** 전체 URL 파싱이 안되면(공백 등) scheme+authority 부분만 다시 시도 */
    private static URI parseLenient(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            int start = url.indexOf("://") + 3;
            int end = start;
            while (end < url.length() && "/?#".indexOf(url.charAt(end)) < 0) end++;
            try {
                return new URI(url.substring(0, end));
            } catch (URISyntaxException again) {
                return null;
            }
        }
    }
}

package com.cspsmith.core.extract;

import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ResourceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSS 텍스트에서 외부 참조 수집.
 * - @import → stylesheet
 * - url(...) → 폰트 확장자/@font-face 안이면 font, 아니면 image
 * - data: URL 은 카탈로그에 넣지 않고 data: 사용 플래그만 기록
 */
public final class CssUrlScanner {
    private CssUrlScanner() {}

    private static final Pattern IMPORT = Pattern.compile(
            "@import\\s+(?:url\\(\\s*)?(['\"]?)([^'\"()\\s;]+)\\1\\s*\\)?[^;]*;?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern URL_FN = Pattern.compile(
            "url\\(\\s*(['\"]?)(.*?)\\1\\s*\\)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern FONT_FACE = Pattern.compile(
            "@font-face\\s*\\{[^}]*}",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> FONT_EXTENSIONS = List.of(".woff2", ".woff", ".ttf", ".otf", ".eot");

    private static final List<String> FONT_MIME_PREFIXES = List.of(
            "data:font/", "data:application/font", "data:application/x-font", "data:application/vnd.ms-fontobject");

    /** css 를 훑어 into 에 추가 */
    public static void scan(String css, ResourceCatalog into) {
        if (css == null || css.isBlank()) return;

        // 1) @import 먼저 처리하고 본문에서 지운다 (url() 중복 집계 방지)
        StringBuilder rest = new StringBuilder();
        Matcher im = IMPORT.matcher(css);
        int last = 0;
        while (im.find()) {
            String ref = im.group(2).trim();
            if (ref.startsWith("data:")) {
                into.markDataUri(ResourceType.STYLESHEET);
            } else if (!ref.isEmpty()) {
                into.add(ResourceType.STYLESHEET, ref);
            }
            rest.append(css, last, im.start());
            last = im.end();
        }
        rest.append(css.substring(last));
        String body = rest.toString();

        // 2) @font-face 블록 범위
        List<int[]> fontFaces = new ArrayList<>();
        Matcher ff = FONT_FACE.matcher(body);
        while (ff.find()) fontFaces.add(new int[]{ff.start(), ff.end()});

        // 3) url(...)
        Matcher m = URL_FN.matcher(body);
        while (m.find()) {
            String ref = m.group(2).trim();
            if (ref.isEmpty() || ref.startsWith("#")) continue; // SVG 내부 참조

            boolean inFontFace = within(fontFaces, m.start());
            String lower = ref.toLowerCase(Locale.ROOT);

            if (lower.startsWith("data:")) {
                into.markDataUri(inFontFace || isFontMime(lower) ? ResourceType.FONT : ResourceType.IMAGE);
                continue;
            }
            ResourceType type = (inFontFace || hasFontExtension(lower)) ? ResourceType.FONT : ResourceType.IMAGE;
            into.add(type, ref);
        }
    }

    static boolean hasFontExtension(String lowerUrl) {
        String path = lowerUrl;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) path = path.substring(0, cut);
        for (String ext : FONT_EXTENSIONS) {
            if (path.endsWith(ext)) return true;
        }
        return false;
    }

    static boolean isFontMime(String lowerDataUrl) {
        for (String p : FONT_MIME_PREFIXES) {
            if (lowerDataUrl.startsWith(p)) return true;
        }
        return false;
    }

    private static boolean within(List<int[]> ranges, int pos) {
        for (int[] r : ranges) {
            if (pos >= r[0] && pos < r[1]) return true;
        }
        return false;
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}

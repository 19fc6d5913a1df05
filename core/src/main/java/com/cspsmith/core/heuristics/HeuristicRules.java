package com.cspsmith.core.heuristics;

import com.cspsmith.core.model.ResourceType;

import java.util.List;

import static com.cspsmith.core.heuristics.HeuristicRule.Entry.contains;
import static com.cspsmith.core.heuristics.HeuristicRule.Entry.regex;

/**
 * 기본 추론 규칙 중앙 테이블.
 * - 평가 순서 = 목록 순서 (stylesheet → script → image → 전체 분류)
 * - 확장은 항목 추가로만 (기존 순서 변경 금지)
 * - 그룹이 같은 규칙은 같은 대상에 대해 한 번만 발화
 */
public final class HeuristicRules {
    private HeuristicRules() {}

    // ===== stylesheet =====

    static final HeuristicRule FONT_KEYWORD = HeuristicRule.named("font-keyword")
            .on(ResourceType.STYLESHEET)
            .matchUrl(contains("font"))
            .infer(InferredType.FONT, Confidence.HIGH, "font-inference",
                    "Stylesheet name contains 'font' keyword")
            .build();

    static final HeuristicRule GOOGLE_FONTS = HeuristicRule.named("google-fonts")
            .on(ResourceType.STYLESHEET)
            .matchDomain(contains("fonts.googleapis.com", "https://fonts.gstatic.com"))
            .infer(InferredType.FONT, Confidence.HIGH, "font-host",
                    "Google Fonts CSS always loads from fonts.gstatic.com")
            .build();

    static final HeuristicRule ICON_FONT = HeuristicRule.named("icon-font")
            .on(ResourceType.STYLESHEET)
            .matchUrl(contains("fontawesome"), contains("font-awesome"), contains("material-icons"),
                    contains("icomoon"), contains("glyphicons"))
            .infer(InferredType.FONT, Confidence.HIGH, "font-host",
                    "Icon font library detected (%s)")
            .build();

    static final HeuristicRule CSS_FRAMEWORK = HeuristicRule.named("css-framework")
            .on(ResourceType.STYLESHEET)
            .matchUrl(contains("bootstrap"), contains("foundation"), contains("bulma"), contains("tailwind"))
            .infer(InferredType.FONT, Confidence.MEDIUM, "fonts",
                    "CSS framework may include custom fonts (%s)")
            .build();

    static final HeuristicRule STYLE_CDN = HeuristicRule.named("style-cdn")
            .on(ResourceType.STYLESHEET)
            .matchDomain(contains("cdn.jsdelivr.net"), contains("unpkg.com"), contains("cdnjs.cloudflare.com"))
            .infer(InferredType.CONNECT, Confidence.MEDIUM, "connect",
                    "CDN may dynamically load additional resources")
            .build();

    // ===== script =====

    static final HeuristicRule ANALYTICS = HeuristicRule.named("analytics")
            .on(ResourceType.SCRIPT)
            .matchUrl(contains("google-analytics.com", "google-analytics.com"),
                    contains("googletagmanager.com", "google-analytics.com"),
                    contains("analytics.js"),
                    contains("gtag/js", "google-analytics.com"),
                    contains("ga.js", "google-analytics.com"),
                    contains("analytics"))
            .infer(InferredType.CONNECT, Confidence.HIGH, "connect",
                    "Analytics/tracking script needs to send data")
            .build();

    static final HeuristicRule JS_FRAMEWORK = HeuristicRule.named("js-framework")
            .on(ResourceType.SCRIPT)
            .matchUrl(contains("react"), contains("vue"), contains("angular"), contains("chunk"), contains("bundle"))
            .infer(InferredType.SCRIPT, Confidence.HIGH, "script-chunks",
                    "JavaScript framework may lazy-load additional chunks")
            .build();

    static final HeuristicRule PAYMENT = HeuristicRule.named("payment")
            .on(ResourceType.SCRIPT)
            .matchDomain(contains("stripe.com", "stripe.com"),
                    contains("paypal.com", "paypal.com"),
                    contains("square.com", "square.com"),
                    contains("braintree.com", "braintreegateway.com"))
            .infer(InferredType.CONNECT, Confidence.HIGH, "connect",
                    "Payment processor needs API connection")
            .infer(InferredType.FRAME, Confidence.HIGH, "frame",
                    "Payment processor may use iframes")
            .build();

    static final HeuristicRule SOCIAL_WIDGET = HeuristicRule.named("social-widget")
            .on(ResourceType.SCRIPT)
            .matchDomain(contains("facebook", "connect.facebook.net", "facebook.com"),
                    contains("twitter", "platform.twitter.com", "twitter.com"),
                    contains("linkedin", "platform.linkedin.com", "linkedin.com"),
                    contains("instagram", "instagram.com"),
                    contains("youtube", "youtube.com"))
            .infer(InferredType.CONNECT, Confidence.HIGH, "social",
                    "Social media widget needs API access")
            .build();

    static final HeuristicRule POLYFILL = HeuristicRule.named("polyfill")
            .on(ResourceType.SCRIPT)
            .matchUrl(contains("polyfill"))
            .infer(InferredType.SCRIPT, Confidence.MEDIUM, "polyfill",
                    "Polyfill service may serve different files based on user agent")
            .build();

    // ===== image =====

    static final HeuristicRule IMAGE_CDN = HeuristicRule.named("image-cdn")
            .on(ResourceType.IMAGE)
            .matchDomain(contains("cloudinary"), contains("imgix"), contains("cloudflare"),
                    contains("fastly"), contains("akamai"), contains("cloudfront"))
            .infer(InferredType.IMAGE, Confidence.HIGH, "img",
                    "CDN domain likely serves multiple images")
            .build();

    static final HeuristicRule RESPONSIVE_IMAGE = HeuristicRule.named("responsive-image")
            .on(ResourceType.IMAGE)
            .matchUrl(regex("[-_@](xs|sm|md|lg|xl|[0-9]+x|2x|3x|retina)|@[0-9]x"))
            .infer(InferredType.IMAGE, Confidence.HIGH, "responsive",
                    "Responsive image pattern detected, likely has multiple variants")
            .build();

    static final HeuristicRule USER_CONTENT = HeuristicRule.named("user-content")
            .on(ResourceType.IMAGE)
            .matchUrl(contains("/avatar"), contains("/profile"), contains("/user"), contains("/photo"))
            .infer(InferredType.IMAGE, Confidence.MEDIUM, "ugc",
                    "User-generated content pattern detected")
            .build();

    // ===== 전체 분류 =====

    static final HeuristicRule API_ENDPOINT = HeuristicRule.named("api-endpoint")
            .onAnyType()
            .matchUrl(contains("api."), contains("/api/"), contains("graphql"), contains("rest"))
            .infer(InferredType.CONNECT, Confidence.HIGH, "api",
                    "API endpoint detected")
            .build();

    /** 기본 테이블 (순서 의미 있음) */
    public static final List<HeuristicRule> DEFAULT = List.of(
            FONT_KEYWORD, GOOGLE_FONTS, ICON_FONT, CSS_FRAMEWORK, STYLE_CDN,
            ANALYTICS, JS_FRAMEWORK, PAYMENT, SOCIAL_WIDGET, POLYFILL,
            IMAGE_CDN, RESPONSIVE_IMAGE, USER_CONTENT,
            API_ENDPOINT);
}

package com.cspsmith.core.extract;

import com.cspsmith.core.api.IDocumentExtractor;
import com.cspsmith.core.model.DocumentContent;
import com.cspsmith.core.model.ExtractOptions;
import com.cspsmith.core.model.InlineContent;
import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ResourceType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * JSoup 기반 문서 추출기.
 *  - 인라인: script 본문(src 없는 것), style 본문, on* 핸들러, style 속성 (문서 순서, 원문 그대로)
 *  - 외부: script/link/img/source/input/video/iframe/frame 참조 + style 안의 url()/@import
 * 외부 리소스 수집은 옵션과 무관하게 항상 수행한다(사용 여부는 호출자 결정).
 */
public final class JsoupDocumentExtractor implements IDocumentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupDocumentExtractor.class);

    /** 인라인 이벤트 핸들러 속성 (소문자 비교) */
    static final Set<String> EVENT_HANDLERS = new HashSet<>(Arrays.asList(
            "onclick", "ondblclick", "onmousedown", "onmouseup", "onmouseover",
            "onmousemove", "onmouseout", "onmouseenter", "onmouseleave",
            "onload", "onunload", "onbeforeunload",
            "onchange", "onsubmit", "onreset", "oninput", "oninvalid",
            "onfocus", "onblur", "onfocusin", "onfocusout",
            "onkeydown", "onkeyup", "onkeypress",
            "onerror", "onabort",
            "onscroll", "onresize",
            "oncontextmenu",
            "ondrag", "ondragstart", "ondragend", "ondragenter", "ondragleave", "ondragover", "ondrop",
            "onwheel",
            "ontouchstart", "ontouchmove", "ontouchend", "ontouchcancel",
            "onplay", "onpause", "onended", "onvolumechange",
            "oncanplay", "oncanplaythrough", "ondurationchange", "onloadeddata", "onloadedmetadata",
            "onprogress", "onseeked", "onseeking", "onstalled", "onsuspend", "ontimeupdate", "onwaiting",
            "onanimationstart", "onanimationend", "onanimationiteration",
            "ontransitionend"));

    private final ExtractOptions options;

    public JsoupDocumentExtractor() {
        this(ExtractOptions.all());
    }

    public JsoupDocumentExtractor(ExtractOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public DocumentContent extract(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("failed to open file: " + file);
        }
        Document doc = Jsoup.parse(file.toFile(), StandardCharsets.UTF_8.name());
        return extract(doc, file.toString());
    }

    @Override
    public DocumentContent extract(String html) {
        return extract(Jsoup.parse(html == null ? "" : html), "");
    }

    private DocumentContent extract(Document doc, String source) {
        InlineContent inline = extractInline(doc);
        ResourceCatalog resources = extractResources(doc);
        LOG.debug("Extracted {}: scripts={}, handlers={}, styleTags={}, styleAttrs={}, resources={}",
                source.isEmpty() ? "<string>" : source,
                inline.scripts().size(), inline.eventHandlers().size(),
                inline.styleTags().size(), inline.styleAttributes().size(), resources.size());
        return new DocumentContent(source, inline, resources);
    }

    // ---------- 인라인 ----------
    private InlineContent extractInline(Document doc) {
        List<String> scripts = new ArrayList<>();
        List<String> handlers = new ArrayList<>();
        List<String> styleTags = new ArrayList<>();
        List<String> styleAttrs = new ArrayList<>();

        for (Element el : doc.getAllElements()) {
            String tag = el.normalName();
            if (tag.equals("script") && !el.hasAttr("src") && options.isScripts()) {
                scripts.add(el.data());
            } else if (tag.equals("style") && options.isStyles()) {
                styleTags.add(el.data());
            }

            for (Attribute a : el.attributes()) {
                String key = a.getKey().toLowerCase(Locale.ROOT);
                if (EVENT_HANDLERS.contains(key)) {
                    if (options.isEventHandlers()) handlers.add(a.getValue());
                    continue;
                }
                if (key.equals("style") && options.isInlineStyles()) {
                    styleAttrs.add(a.getValue());
                }
            }
        }
        return new InlineContent(scripts, handlers, styleTags, styleAttrs);
    }

    // ---------- 외부 리소스 ----------
    private ResourceCatalog extractResources(Document doc) {
        ResourceCatalog c = new ResourceCatalog();

        for (Element el : doc.select("script[src]")) {
            addUrl(c, ResourceType.SCRIPT, el.attr("src"));
        }

        for (Element el : doc.select("link[href]")) {
            ResourceType type = classifyLink(el);
            if (type != null) addUrl(c, type, el.attr("href"));
        }

        for (Element el : doc.select("img[src], input[type=image][src]")) {
            addUrl(c, ResourceType.IMAGE, el.attr("src"));
        }
        for (Element el : doc.select("img[srcset], source[srcset]")) {
            addSrcset(c, el.attr("srcset"));
        }
        for (Element el : doc.select("video[poster]")) {
            addUrl(c, ResourceType.IMAGE, el.attr("poster"));
        }

        for (Element el : doc.select("iframe[src], frame[src]")) {
            addUrl(c, ResourceType.FRAME, el.attr("src"));
        }

        // style 태그 / style 속성 안의 CSS
        for (Element el : doc.select("style")) {
            CssUrlScanner.scan(el.data(), c);
        }
        for (Element el : doc.select("[style]")) {
            CssUrlScanner.scan(el.attr("style"), c);
        }
        return c;
    }

    /** link rel/as → 분류. 관심 없는 rel 이면 null */
    static ResourceType classifyLink(Element link) {
        Set<String> rels = new HashSet<>(Arrays.asList(
                link.attr("rel").toLowerCase(Locale.ROOT).trim().split("\\s+")));

        if (rels.contains("stylesheet")) return ResourceType.STYLESHEET;
        if (rels.contains("icon") || rels.contains("apple-touch-icon")) return ResourceType.IMAGE;
        if (rels.contains("modulepreload")) return ResourceType.SCRIPT;
        if (rels.contains("preload")) {
            switch (link.attr("as").toLowerCase(Locale.ROOT).trim()) {
                case "font": return ResourceType.FONT;
                case "script": return ResourceType.SCRIPT;
                case "style": return ResourceType.STYLESHEET;
                case "image": return ResourceType.IMAGE;
                default: return ResourceType.OTHER;
            }
        }
        if (rels.contains("preconnect") || rels.contains("dns-prefetch")) return ResourceType.OTHER;
        return null;
    }

    private static void addSrcset(ResourceCatalog c, String srcset) {
        String s = srcset.trim();
        if (s.isEmpty()) return;
        if (s.regionMatches(true, 0, "data:", 0, 5)) {
            c.markDataUri(ResourceType.IMAGE);
            return;
        }
        for (String candidate : s.split(",")) {
            String url = candidate.trim().split("\\s+")[0];
            addUrl(c, ResourceType.IMAGE, url);
        }
    }

    private static void addUrl(ResourceCatalog c, ResourceType type, String raw) {
        if (raw == null) return;
        String url = raw.trim();
        if (url.isEmpty()) return;
        if (url.regionMatches(true, 0, "data:", 0, 5)) {
            c.markDataUri(type);
            return;
        }
        c.add(type, url);
    }
}

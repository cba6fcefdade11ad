package com.aceflow.research.service.extract;

import com.aceflow.research.dto.DocumentLink;
import com.aceflow.research.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTML 문서 파서 (Jsoup).
 *
 * 스크립트, 스타일, 네비게이션 등 노이즈를 제거한 후 main, article, body 순으로 본문 루트를 찾고
 * 헤딩, 문단, 목록, 코드 블록, admonition(callout) 블록을 문서 순서대로 추출합니다.
 */
@Component
@Order(1)
@Slf4j
public class HtmlDocumentParser implements DocumentParser {

    private static final String NOISE_SELECTOR =
            "script, style, noscript, svg, nav, footer, header, form, iframe, button";

    // matched anywhere in a class name
    private static final List<String> STRONG_KINDS = List.of("warning", "caution", "danger");

    // matched as a whole class name or hyphen-separated part ("note" must not match "footnote")
    private static final List<String> WEAK_KINDS = List.of("important", "note", "tip", "info");

    @Override
    public boolean supports(String contentType, String content) {
        if (contentType != null) {
            String ct = contentType.toLowerCase(Locale.ROOT);
            if (ct.contains("html")) {
                return true;
            }
            if (ct.contains("markdown")) {
                return false;
            }
        }
        String head = content.stripLeading();
        head = head.substring(0, Math.min(head.length(), 512)).toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html") || head.contains("<body");
    }

    @Override
    public ParsedDocument parse(String url, String content) {
        Document doc = Jsoup.parse(content, url);
        doc.select(NOISE_SELECTOR).remove();

        Element root = doc.selectFirst("main");
        if (root == null) {
            root = doc.selectFirst("article");
        }
        if (root == null) {
            root = doc.body();
        }

        List<DocumentBlock> blocks = new ArrayList<>();
        NodeTraversor.filter(new BlockCollector(blocks), root);

        List<DocumentLink> links = collectLinks(root);
        log.debug("Parsed HTML {}: blocks={}, links={}", url, blocks.size(), links.size());
        return new ParsedDocument(doc.title(), blocks, links);
    }

    private static List<DocumentLink> collectLinks(Element root) {
        Map<String, DocumentLink> links = new LinkedHashMap<>();
        for (Element anchor : root.select("a[href]")) {
            String href = UrlUtils.stripFragment(anchor.attr("abs:href"));
            if (UrlUtils.isHttpUrl(href)) {
                links.putIfAbsent(UrlUtils.normalize(href), new DocumentLink(href, anchor.text().trim()));
            }
        }
        return new ArrayList<>(links.values());
    }

    /**
     * Admonition kind of the element, or null when it is not a callout box.
     */
    static String admonitionKind(Element el) {
        boolean callout = "alert".equalsIgnoreCase(el.attr("role"));
        String kind = null;
        for (String cls : el.classNames()) {
            String c = cls.toLowerCase(Locale.ROOT);
            if (c.contains("admonition") || c.contains("callout")) {
                callout = true;
            }
            for (String candidate : STRONG_KINDS) {
                if (c.contains(candidate)) {
                    callout = true;
                    kind = kind == null ? candidate : kind;
                }
            }
            for (String candidate : WEAK_KINDS) {
                if (c.equals(candidate) || c.endsWith("-" + candidate) || c.startsWith(candidate + "-")) {
                    callout = true;
                    kind = kind == null ? candidate : kind;
                }
            }
        }
        if (!callout) {
            return null;
        }
        if (kind == null) {
            String type = el.attr("data-type").toLowerCase(Locale.ROOT);
            kind = type.isBlank() ? "note" : type;
        }
        return kind;
    }

    private static String languageOf(Element pre) {
        Element code = pre.selectFirst("code");
        for (Element candidate : code != null ? List.of(code, pre) : List.of(pre)) {
            for (String cls : candidate.classNames()) {
                if (cls.startsWith("language-")) {
                    return cls.substring("language-".length()).toLowerCase(Locale.ROOT);
                }
                if (cls.startsWith("lang-")) {
                    return cls.substring("lang-".length()).toLowerCase(Locale.ROOT);
                }
            }
            String dataLang = candidate.attr("data-language");
            if (!dataLang.isBlank()) {
                return dataLang.toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }

    private static final class BlockCollector implements NodeFilter {

        private final List<DocumentBlock> blocks;

        private BlockCollector(List<DocumentBlock> blocks) {
            this.blocks = blocks;
        }

        @Override
        public FilterResult head(Node node, int depth) {
            if (!(node instanceof Element el)) {
                return FilterResult.CONTINUE;
            }
            String kind = depth > 0 ? admonitionKind(el) : null;
            if (kind != null) {
                String text = el.text().trim();
                if (!text.isEmpty()) {
                    blocks.add(DocumentBlock.admonition(kind, text));
                }
                return FilterResult.SKIP_ENTIRELY;
            }

            switch (el.normalName()) {
                case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                    addIfText(DocumentBlock.heading(el.normalName().charAt(1) - '0', el.text().trim()));
                    return FilterResult.SKIP_ENTIRELY;
                }
                case "pre" -> {
                    String code = el.wholeText();
                    if (!code.isBlank()) {
                        blocks.add(DocumentBlock.code(stripTrailingNewlines(code), languageOf(el)));
                    }
                    return FilterResult.SKIP_ENTIRELY;
                }
                case "p" -> {
                    addIfText(DocumentBlock.paragraph(el.text().trim()));
                    return FilterResult.SKIP_ENTIRELY;
                }
                case "li" -> {
                    if (el.selectFirst("pre, p, ul, ol") == null) {
                        addIfText(DocumentBlock.listItem(el.text().trim()));
                        return FilterResult.SKIP_ENTIRELY;
                    }
                    addIfText(DocumentBlock.listItem(el.ownText().trim()));
                    return FilterResult.CONTINUE;
                }
                case "dt", "dd", "td" -> {
                    addIfText(DocumentBlock.paragraph(el.text().trim()));
                    return FilterResult.SKIP_ENTIRELY;
                }
                default -> {
                    return FilterResult.CONTINUE;
                }
            }
        }

        @Override
        public FilterResult tail(Node node, int depth) {
            return FilterResult.CONTINUE;
        }

        private void addIfText(DocumentBlock block) {
            if (block.text() != null && !block.text().isBlank()) {
                blocks.add(block);
            }
        }

        private static String stripTrailingNewlines(String code) {
            int end = code.length();
            while (end > 0 && (code.charAt(end - 1) == '\n' || code.charAt(end - 1) == '\r')) {
                end--;
            }
            return code.substring(0, end);
        }
    }
}

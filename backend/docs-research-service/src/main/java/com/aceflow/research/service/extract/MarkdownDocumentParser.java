package com.aceflow.research.service.extract;

import com.aceflow.research.dto.DocumentLink;
import com.aceflow.research.util.UrlUtils;
import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.ListBlock;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown 문서 파서 (flexmark).
 *
 * GitHub 스타일 alert ({@code > [!WARNING]})와 container 문법({@code :::warning ... :::})을
 * admonition 블록으로 변환합니다.
 */
@Component
@Order(2)
@Slf4j
public class MarkdownDocumentParser implements DocumentParser {

    private static final Pattern GITHUB_ALERT = Pattern.compile("^\\s*\\[!(\\w+)]\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTAINER_OPEN = Pattern.compile("^:::\\s*(\\w+)\\s*");
    private static final Pattern INLINE_LINK = Pattern.compile("!?\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern QUOTE_MARKER = Pattern.compile("(?m)^\\s*>\\s?");
    private static final Pattern EMPHASIS = Pattern.compile("(\\*\\*|__|`)");

    private final Parser parser = Parser.builder().build();

    @Override
    public boolean supports(String contentType, String content) {
        // everything that is not HTML is read as markdown / plain text
        return true;
    }

    @Override
    public ParsedDocument parse(String url, String content) {
        Node root = parser.parse(content);
        BlockWalker walker = new BlockWalker();
        walker.walkChildren(root);
        walker.flushContainer();

        List<DocumentLink> links = collectLinks(url, root);
        String title = walker.blocks.stream()
                .filter(b -> b.type() == BlockType.HEADING && b.level() == 1)
                .map(DocumentBlock::text)
                .findFirst()
                .orElse("");
        log.debug("Parsed markdown {}: blocks={}, links={}", url, walker.blocks.size(), links.size());
        return new ParsedDocument(title, walker.blocks, links);
    }

    private static List<DocumentLink> collectLinks(String baseUrl, Node root) {
        Map<String, DocumentLink> links = new LinkedHashMap<>();
        for (Node node : root.getDescendants()) {
            String href;
            String text;
            if (node instanceof Link link) {
                href = link.getUrl().toString();
                text = link.getText().toString();
            } else if (node instanceof AutoLink autoLink) {
                href = autoLink.getUrl().toString();
                text = href;
            } else {
                continue;
            }
            String absolute = resolve(baseUrl, href);
            if (absolute != null && UrlUtils.isHttpUrl(absolute)) {
                links.putIfAbsent(UrlUtils.normalize(absolute), new DocumentLink(absolute, plain(text)));
            }
        }
        return new ArrayList<>(links.values());
    }

    private static String resolve(String baseUrl, String href) {
        try {
            return UrlUtils.stripFragment(URI.create(baseUrl).resolve(href.trim()).toString());
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unresolvable link '{}' in {}", href, baseUrl);
            return null;
        }
    }

    static String plain(String markdown) {
        String text = INLINE_LINK.matcher(markdown).replaceAll("$1");
        text = EMPHASIS.matcher(text).replaceAll("");
        return text.replaceAll("\\s+", " ").trim();
    }

    private static final class BlockWalker {

        private final List<DocumentBlock> blocks = new ArrayList<>();

        // open ":::kind" container spanning several paragraphs
        private String containerKind;
        private StringBuilder containerText;

        void walkChildren(Node parent) {
            for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
                visit(node);
            }
        }

        private void visit(Node node) {
            if (node instanceof Paragraph) {
                paragraph(plainBlock(node));
                return;
            }
            flushContainer();

            if (node instanceof Heading heading) {
                add(DocumentBlock.heading(heading.getLevel(), plain(heading.getText().toString())));
            } else if (node instanceof FencedCodeBlock fenced) {
                String info = fenced.getInfo().toString().trim();
                String language = info.isEmpty() ? null : info.split("\\s+")[0].toLowerCase(Locale.ROOT);
                add(DocumentBlock.code(trimTrailingNewlines(fenced.getContentChars().toString()), language));
            } else if (node instanceof IndentedCodeBlock indented) {
                add(DocumentBlock.code(trimTrailingNewlines(indented.getContentChars().toString()), null));
            } else if (node instanceof BlockQuote quote) {
                blockQuote(quote);
            } else if (node instanceof ListBlock) {
                walkChildren(node);
            } else if (node instanceof ListItem item) {
                listItem(item);
            }
        }

        private void paragraph(String text) {
            if (containerKind != null) {
                if (text.endsWith(":::")) {
                    containerText.append(' ').append(text, 0, text.length() - 3);
                    flushContainer();
                } else {
                    containerText.append(' ').append(text);
                }
                return;
            }
            Matcher open = CONTAINER_OPEN.matcher(text);
            if (open.find()) {
                containerKind = open.group(1).toLowerCase(Locale.ROOT);
                containerText = new StringBuilder();
                String rest = text.substring(open.end());
                if (rest.endsWith(":::")) {
                    containerText.append(rest, 0, rest.length() - 3);
                    flushContainer();
                } else {
                    containerText.append(rest);
                }
                return;
            }
            add(DocumentBlock.paragraph(text));
        }

        void flushContainer() {
            if (containerKind == null) {
                return;
            }
            String text = containerText.toString().trim();
            if (!text.isEmpty()) {
                add(DocumentBlock.admonition(containerKind, text));
            }
            containerKind = null;
            containerText = null;
        }

        private void blockQuote(BlockQuote quote) {
            StringBuilder text = new StringBuilder();
            for (Node child = quote.getFirstChild(); child != null; child = child.getNext()) {
                text.append(plainBlock(child)).append(' ');
            }
            Matcher alert = GITHUB_ALERT.matcher(text);
            if (alert.find()) {
                add(DocumentBlock.admonition(alert.group(1).toLowerCase(Locale.ROOT),
                        text.substring(alert.end()).trim()));
                return;
            }
            walkChildren(quote);
            flushContainer();
        }

        private void listItem(ListItem item) {
            Node first = item.getFirstChild();
            if (first instanceof Paragraph) {
                add(DocumentBlock.listItem(plainBlock(first)));
                first = first.getNext();
            }
            for (Node child = first; child != null; child = child.getNext()) {
                visit(child);
            }
            flushContainer();
        }

        private void add(DocumentBlock block) {
            if (block.text() != null && !block.text().isBlank()) {
                blocks.add(block);
            }
        }

        private static String plainBlock(Node node) {
            return plain(QUOTE_MARKER.matcher(node.getChars()).replaceAll(""));
        }

        private static String trimTrailingNewlines(String code) {
            return code.replaceAll("[\\r\\n]+$", "");
        }
    }
}

package com.aceflow.research.service.extract;

import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.Gotcha;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds warnings and pitfalls in prose.
 *
 * Three sources, in document order:
 * - prose sentences containing a lexicon entry (one gotcha per sentence)
 * - admonition blocks (note / warning / caution ...), whole block text
 * - the paragraph following an indicator heading such as "Troubleshooting" or "Common mistakes"
 */
@Component
public class GotchaDetector {

    public static final String ADMONITION = "admonition";

    private static final List<String> LEXICON = List.of(
            "note:", "important:", "warning:", "caution:", "danger:",
            "make sure", "avoid", "common mistake", "troubleshooting", "be careful",
            "deprecated", "pitfall", "known issue");

    private static final List<Pattern> LEXICON_PATTERNS = LEXICON.stream()
            .map(GotchaDetector::toPattern)
            .toList();

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+(?=[A-Z0-9\"'(\\[])");

    private static final Pattern INDICATOR_HEADING = Pattern.compile(
            "(?i)\\b(troubleshooting|common (mistakes|pitfalls|issues|errors)|gotchas?|pitfalls|known (issues|limitations)|caveats?|limitations)\\b");

    public List<Gotcha> detect(List<DocumentBlock> blocks, FetchTarget target) {
        List<Gotcha> gotchas = new ArrayList<>();
        boolean underIndicatorHeading = false;
        String indicatorHeading = null;

        for (int i = 0; i < blocks.size(); i++) {
            DocumentBlock block = blocks.get(i);
            switch (block.type()) {
                case HEADING -> {
                    Matcher m = INDICATOR_HEADING.matcher(block.text());
                    underIndicatorHeading = m.find();
                    indicatorHeading = underIndicatorHeading ? m.group(1).toLowerCase(Locale.ROOT) : null;
                }
                case ADMONITION -> gotchas.add(gotcha(target, block.text(), nextProse(blocks, i),
                        ADMONITION + ":" + block.kind()));
                case PARAGRAPH, LIST_ITEM -> {
                    List<Gotcha> fromSentences = detectInSentences(block.text(), nextProse(blocks, i), target);
                    if (!fromSentences.isEmpty()) {
                        gotchas.addAll(fromSentences);
                    } else if (underIndicatorHeading) {
                        gotchas.add(gotcha(target, block.text(), nextProse(blocks, i), "heading:" + indicatorHeading));
                    }
                    underIndicatorHeading = false;
                }
                default -> {
                    // code blocks carry no gotchas
                }
            }
        }
        return gotchas;
    }

    List<Gotcha> detectInSentences(String text, String context, FetchTarget target) {
        List<Gotcha> found = new ArrayList<>();
        for (String sentence : SENTENCE_BOUNDARY.split(text.trim())) {
            matchIndicator(sentence).ifPresent(indicator ->
                    found.add(gotcha(target, sentence.trim(), context, indicator)));
        }
        return found;
    }

    public static Optional<String> matchIndicator(String sentence) {
        for (int i = 0; i < LEXICON_PATTERNS.size(); i++) {
            if (LEXICON_PATTERNS.get(i).matcher(sentence).find()) {
                return Optional.of(LEXICON.get(i));
            }
        }
        return Optional.empty();
    }

    private static String nextProse(List<DocumentBlock> blocks, int index) {
        for (int i = index + 1; i < blocks.size(); i++) {
            DocumentBlock next = blocks.get(i);
            if (next.type() == BlockType.HEADING) {
                return null;
            }
            if (next.isProse()) {
                return next.text();
            }
        }
        return null;
    }

    private static Gotcha gotcha(FetchTarget target, String warning, String context, String indicator) {
        return new Gotcha(target.url(), target.category(), target.topic(), warning, context, indicator);
    }

    private static Pattern toPattern(String entry) {
        // word boundary on the left, and on the right unless the entry ends with ':'
        String quoted = Pattern.quote(entry);
        String suffix = entry.endsWith(":") ? "" : "\\b";
        return Pattern.compile("(?i)(?<![\\w])" + quoted + suffix);
    }
}

package com.aceflow.research.service.writer;

import com.aceflow.research.dto.CategoryCoverage;
import com.aceflow.research.dto.CoverageReport;
import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.dto.ResearchBundle;
import com.aceflow.research.entity.FetchStatus;

import java.util.List;
import java.util.Locale;

/**
 * Human readable renderings of a bundle. Output depends only on bundle content (no run id, no clock).
 */
final class MarkdownRenderer {

    private MarkdownRenderer() {
    }

    static String summary(ResearchBundle bundle, String downstreamNote) {
        CoverageReport coverage = bundle.coverage();
        StringBuilder md = new StringBuilder();
        md.append("# Research Bundle: ").append(bundle.request().pattern().getCode());
        if (!bundle.request().domain().isEmpty()) {
            md.append(" / ").append(bundle.request().domain());
        }
        md.append("\n\n");

        md.append("- Status: **").append(bundle.status().getCode()).append("**");
        if (bundle.incompleteReason() != null) {
            md.append(" (").append(bundle.incompleteReason().getDescription()).append(")");
        }
        md.append('\n');
        md.append("- Overall score: ").append(format(bundle.overallScore()))
                .append(" (threshold ").append(format(coverage.threshold()))
                .append(", critical floor ").append(format(coverage.criticalFloor())).append(")\n");
        md.append("- Supplemental passes: ").append(bundle.passes()).append('\n');
        md.append("- Fetch: ");
        for (FetchStatus status : FetchStatus.values()) {
            md.append(status.getCode()).append('=').append(bundle.countByStatus(status)).append(' ');
        }
        md.setLength(md.length() - 1);
        md.append("\n\n");

        md.append("## Categories\n\n");
        md.append("| Category | Priority | Score | Patterns | Gotchas |\n");
        md.append("|---|---|---|---|---|\n");
        for (CategoryCoverage c : coverage.categories()) {
            md.append("| ").append(c.category().getCode())
                    .append(" | ").append(c.priority().getCode())
                    .append(" | ").append(format(c.score()))
                    .append(" | ").append(bundle.patternsOf(c.category()).size())
                    .append(" | ").append(bundle.gotchasOf(c.category()).size())
                    .append(" |\n");
        }

        List<String> missing = coverage.missingAreas();
        if (!missing.isEmpty()) {
            md.append("\n## Missing areas\n\n");
            missing.forEach(area -> md.append("- ").append(area).append('\n'));
        }

        md.append("\n## Score history\n\n");
        List<Double> history = bundle.scoreHistory();
        for (int i = 0; i < history.size(); i++) {
            md.append("- ").append(i == 0 ? "initial" : "pass " + i).append(": ")
                    .append(format(history.get(i))).append('\n');
        }

        md.append("\n> ").append(downstreamNote).append('\n');
        return md.toString();
    }

    static String category(CategoryCoverage coverage, List<ExtractedPattern> patterns, List<Gotcha> gotchas) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(coverage.category().getLabel())
                .append(" (").append(coverage.category().getCode()).append(")\n\n");
        md.append("- Priority: ").append(coverage.priority().getCode()).append('\n');
        md.append("- Score: ").append(format(coverage.score())).append('\n');
        if (!coverage.missingSignals().isEmpty()) {
            md.append("- Missing: ").append(String.join(", ",
                    coverage.missingSignals().stream().map(Object::toString).toList())).append('\n');
        }

        md.append("\n## Patterns\n");
        if (patterns.isEmpty()) {
            md.append("\n_None extracted._\n");
        }
        for (ExtractedPattern p : patterns) {
            md.append("\n### ").append(p.topic());
            if (p.example()) {
                md.append(" (example)");
            }
            md.append("\n\n");
            if (p.description() != null && !p.description().isBlank()) {
                md.append(p.description()).append("\n\n");
            }
            md.append("Source: ").append(p.sourceUrl()).append("\n\n");
            String fence = p.codeText().contains("```") ? "````" : "```";
            md.append(fence).append(p.language() == null ? "" : p.language()).append('\n')
                    .append(p.codeText()).append('\n')
                    .append(fence).append('\n');
        }

        md.append("\n## Gotchas\n");
        if (gotchas.isEmpty()) {
            md.append("\n_None extracted._\n");
        } else {
            md.append('\n');
        }
        for (Gotcha g : gotchas) {
            md.append("- **").append(g.topic()).append("** ").append(g.warningText())
                    .append(" (").append(g.sourceUrl()).append(")\n");
            if (g.nearbyContext() != null && !g.nearbyContext().isBlank()) {
                md.append("  - Context: ").append(g.nearbyContext()).append('\n');
            }
        }
        return md.toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}

package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.config.RiskRule;
import io.devguard.extract.FileContribution.RiskScan;
import io.devguard.extract.ModuleNames;
import io.devguard.model.RiskMarker;
import io.devguard.model.SourceDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Scans raw source text for production-readiness markers.
 * <p>
 * Runs during extraction, while the text is still at hand, so that snapshots never
 * need to keep source text. Stateless and safe to share between workers.
 */
public class RiskScanner {

    private static final int EXCERPT_LIMIT = 80;
    private static final int VISIBLE_SECRET_PREFIX = 4;

    private final AnalysisConfig.ProductionRisk settings;

    public RiskScanner(AnalysisConfig.ProductionRisk settings) {
        this.settings = settings;
    }

    public RiskScan scan(SourceDocument document) {
        String path = document.path();
        List<RiskRule> rules = settings.rules().stream()
                .filter(rule -> rule.appliesTo(path))
                .toList();
        String content = document.content() == null ? "" : document.content();

        List<RiskMarker> markers = new ArrayList<>();
        for (RiskRule rule : rules) {
            if (rule.wholeFile()) {
                markers.add(new RiskMarker(rule.id(), path, 0, ModuleNames.fileName(path)));
            }
        }
        int todoCount = 0;
        int lineNumber = 0;
        for (String line : content.split("\\R", -1)) {
            lineNumber++;
            if (settings.todoPattern().matcher(line).find()) {
                todoCount++;
            }
            for (RiskRule rule : rules) {
                if (rule.wholeFile()) {
                    continue;
                }
                Matcher matcher = rule.pattern().matcher(line);
                if (matcher.find()) {
                    markers.add(new RiskMarker(rule.id(), path, lineNumber, excerpt(matcher.group(), rule.maskMatch())));
                }
            }
        }
        return new RiskScan(path, document.lineCount(), todoCount, markers);
    }

    static String excerpt(String match, boolean mask) {
        String text = match.strip();
        if (mask) {
            int visible = Math.min(VISIBLE_SECRET_PREFIX, text.length() / 2);
            return text.substring(0, visible) + "****";
        }
        return text.length() > EXCERPT_LIMIT ? text.substring(0, EXCERPT_LIMIT) + "..." : text;
    }
}

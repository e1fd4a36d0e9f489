package io.devguard.config;

import io.devguard.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A production-readiness rule: a regular expression applied to each source line, or,
 * without a pattern, the presence of a file whose path matches one of the globs.
 *
 * @param id          stable rule id used in findings
 * @param pattern     compiled line pattern, null for a whole-file rule
 * @param severity    severity of findings produced by this rule
 * @param description what the match means
 * @param files       globs restricting the rule to matching paths, empty for every file
 * @param maskMatch   whether the matched text is masked in evidence (secrets)
 */
public record RiskRule(
        String id,
        Pattern pattern,
        Severity severity,
        String description,
        List<GlobPattern> files,
        boolean maskMatch
) {

    public RiskRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("risk rule id cannot be null or blank");
        }
        files = files == null ? List.of() : List.copyOf(files);
        if (pattern == null && files.isEmpty()) {
            throw new IllegalArgumentException("risk rule '" + id + "' needs a pattern or a files glob");
        }
        if (severity == null) {
            severity = Severity.MEDIUM;
        }
    }

    /**
     * Returns true if the rule applies to the given normalized path.
     */
    public boolean appliesTo(String path) {
        return files.isEmpty() || files.stream().anyMatch(glob -> glob.matches(path));
    }

    /**
     * Returns true if a matching path is itself the finding, whatever the file holds.
     */
    public boolean wholeFile() {
        return pattern == null;
    }

    static RiskRule fromMap(Map<String, Object> map) {
        Object id = map.get("id");
        Object regex = map.get("pattern");
        List<GlobPattern> files = globs(map.get("files"));
        if (id == null || (regex == null && files.isEmpty())) {
            throw new IllegalArgumentException("productionRisk.rules entries need 'id' and 'pattern' or 'files'");
        }
        Object severity = map.get("severity");
        Object description = map.get("description");
        return new RiskRule(
                id.toString(),
                regex != null ? AnalysisConfig.compile("productionRisk.rules[" + id + "]", regex.toString()) : null,
                severity != null ? Severity.parse(severity.toString()) : Severity.MEDIUM,
                description != null ? description.toString() : id.toString(),
                files,
                Boolean.TRUE.equals(map.get("secret")));
    }

    private static List<GlobPattern> globs(Object value) {
        List<GlobPattern> globs = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    globs.add(GlobPattern.compile(item.toString().trim()));
                }
            }
        } else if (value != null && !value.toString().isBlank()) {
            globs.add(GlobPattern.compile(value.toString().trim()));
        }
        return globs;
    }
}

package io.devguard.config;

import io.devguard.model.NodeKind;
import io.devguard.model.Severity;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tunable analysis settings loaded from YAML.
 * <p>
 * The bundled {@code devguard-defaults.yaml} carries every default. A user file is
 * deep-merged over it: nested maps merge key by key, scalars and lists replace.
 */
public class AnalysisConfig {

    private static final String DEFAULT_CONFIG = "/devguard-defaults.yaml";

    private final Extraction extraction;
    private final Resolution resolution;
    private final Binding binding;
    private final GodObject godObject;
    private final Orphans orphans;
    private final ProductionRisk productionRisk;
    private final Impact impact;
    private final Detectors detectors;

    /**
     * Settings for the per-file extraction phase.
     *
     * @param parallelism          worker threads, 0 means available processors
     * @param excludedPathSegments directory names skipped by the source tree loader
     */
    public record Extraction(int parallelism, Set<String> excludedPathSegments) {
        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }

    /**
     * @param ambiguousConfidence confidence of an edge whose target was chosen by path proximity
     */
    public record Resolution(double ambiguousConfidence) {}

    /**
     * Scores for heuristic frontend-call to backend-route binding.
     *
     * @param exactConfidence          normalized paths and verbs are equal
     * @param parameterizedConfidence  equal once parameter segments are treated as wildcards
     * @param prefixStrippedConfidence equal only after dropping a client-side prefix such as /api
     * @param strippablePrefixes       client-side prefixes that a backend router may not declare
     */
    public record Binding(
            double exactConfidence,
            double parameterizedConfidence,
            double prefixStrippedConfidence,
            List<String> strippablePrefixes
    ) {}

    /**
     * @param meanMultiplier threshold is this multiple of the mean degree
     * @param minimumDegree  threshold never drops below this degree
     * @param mediumRatio    degree/threshold ratio from which severity is MEDIUM
     * @param highRatio      degree/threshold ratio from which severity is HIGH
     */
    public record GodObject(double meanMultiplier, int minimumDegree, double mediumRatio, double highRatio) {
        public double thresholdFor(double meanDegree) {
            return Math.max(meanMultiplier * meanDegree, minimumDegree);
        }
    }

    /**
     * @param entryPointKinds    node kinds never reported as orphans
     * @param entryPointPatterns glob patterns over qualified names, or over paths with a {@code path:} prefix
     */
    public record Orphans(Set<NodeKind> entryPointKinds, List<String> entryPointPatterns) {}

    /**
     * @param rules                 text rules applied line by line
     * @param todoPattern           marker counted towards TODO density
     * @param todoDensityThreshold  markers per line above which a file is flagged
     * @param todoMinimumCount      files with fewer markers are never flagged
     * @param todoSeverity          severity of TODO density findings
     */
    public record ProductionRisk(
            List<RiskRule> rules,
            Pattern todoPattern,
            double todoDensityThreshold,
            int todoMinimumCount,
            Severity todoSeverity
    ) {}

    /**
     * @param maxDepth maximum traversal distance, 0 for unlimited
     */
    public record Impact(int maxDepth) {}

    /**
     * @param disabled ids of detectors left out of every analysis
     */
    public record Detectors(Set<String> disabled) {}

    private AnalysisConfig(Map<String, Object> config) {
        this.extraction = parseExtraction(section(config, "extraction"));
        this.resolution = new Resolution(
                confidence(section(config, "resolution"), "resolution", "ambiguousConfidence", 0.8));
        this.binding = parseBinding(section(config, "binding"));
        this.godObject = parseGodObject(section(config, "godObject"));
        this.orphans = parseOrphans(section(config, "orphans"));
        this.productionRisk = parseProductionRisk(section(config, "productionRisk"));
        this.impact = new Impact(intValue(section(config, "impact"), "impact", "maxDepth", 0));
        this.detectors = new Detectors(Set.copyOf(stringList(section(config, "detectors"), "disabled")));
    }

    /**
     * Loads the bundled defaults from the classpath.
     */
    public static AnalysisConfig loadDefault() {
        return new AnalysisConfig(defaultMap());
    }

    /**
     * Loads a user configuration file merged over the bundled defaults.
     */
    public static AnalysisConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return loadMerged(is);
        }
    }

    /**
     * Loads a user configuration stream merged over the bundled defaults.
     */
    public static AnalysisConfig loadMerged(InputStream is) {
        Map<String, Object> merged = deepMerge(defaultMap(), readYaml(is));
        return new AnalysisConfig(merged);
    }

    private static Map<String, Object> defaultMap() {
        try (InputStream is = AnalysisConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return readYaml(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readYaml(InputStream is) {
        Object data = new Yaml().load(is);
        if (data == null) {
            return new LinkedHashMap<>();
        }
        if (!(data instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Configuration root must be a mapping");
        }
        return (Map<String, Object>) data;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> result = new LinkedHashMap<>(base);
        override.forEach((key, value) -> {
            Object existing = result.get(key);
            if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> valueMap) {
                result.put(key, deepMerge((Map<String, Object>) existingMap, (Map<String, Object>) valueMap));
            } else {
                result.put(key, value);
            }
        });
        return result;
    }

    // Section parsers

    private static Extraction parseExtraction(Map<String, Object> section) {
        int parallelism = intValue(section, "extraction", "parallelism", 0);
        if (parallelism < 0) {
            throw new IllegalArgumentException("extraction.parallelism must be >= 0");
        }
        return new Extraction(parallelism,
                Collections.unmodifiableSet(new LinkedHashSet<>(stringList(section, "excludedPathSegments"))));
    }

    private static Binding parseBinding(Map<String, Object> section) {
        return new Binding(
                confidence(section, "binding", "exactConfidence", 0.9),
                confidence(section, "binding", "parameterizedConfidence", 0.8),
                confidence(section, "binding", "prefixStrippedConfidence", 0.6),
                stringList(section, "strippablePrefixes"));
    }

    private static GodObject parseGodObject(Map<String, Object> section) {
        GodObject godObject = new GodObject(
                doubleValue(section, "godObject", "meanMultiplier", 3.0),
                intValue(section, "godObject", "minimumDegree", 10),
                doubleValue(section, "godObject", "mediumRatio", 1.5),
                doubleValue(section, "godObject", "highRatio", 2.0));
        if (godObject.meanMultiplier() <= 0 || godObject.minimumDegree() < 0) {
            throw new IllegalArgumentException("godObject.meanMultiplier must be > 0 and minimumDegree >= 0");
        }
        if (godObject.highRatio() < godObject.mediumRatio()) {
            throw new IllegalArgumentException("godObject.highRatio must be >= godObject.mediumRatio");
        }
        return godObject;
    }

    private static Orphans parseOrphans(Map<String, Object> section) {
        Set<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
        for (String kind : stringList(section, "entryPointKinds")) {
            kinds.add(NodeKind.parse(kind));
        }
        return new Orphans(Collections.unmodifiableSet(kinds), stringList(section, "entryPointPatterns"));
    }

    @SuppressWarnings("unchecked")
    private static ProductionRisk parseProductionRisk(Map<String, Object> section) {
        List<RiskRule> rules = new ArrayList<>();
        Object rawRules = section.get("rules");
        if (rawRules instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw new IllegalArgumentException("productionRisk.rules entries must be mappings");
                }
                rules.add(RiskRule.fromMap((Map<String, Object>) map));
            }
        }
        String todoRegex = stringValue(section, "todoPattern", "(#|//)\\s*(TODO|FIXME|HACK)\\b");
        return new ProductionRisk(
                List.copyOf(rules),
                compile("productionRisk.todoPattern", todoRegex),
                doubleValue(section, "productionRisk", "todoDensityThreshold", 0.02),
                intValue(section, "productionRisk", "todoMinimumCount", 3),
                Severity.parse(stringValue(section, "todoSeverity", "low")));
    }

    // Value helpers

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("Configuration section '" + key + "' must be a mapping");
    }

    private static List<String> stringList(Map<String, Object> section, String key) {
        Object value = section.get(key);
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
            return List.copyOf(result);
        }
        return List.of();
    }

    private static String stringValue(Map<String, Object> section, String key, String fallback) {
        Object value = section.get(key);
        return value != null ? value.toString() : fallback;
    }

    private static int intValue(Map<String, Object> section, String name, String key, int fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException(name + "." + key + " must be a number: " + value);
    }

    private static double doubleValue(Map<String, Object> section, String name, String key, double fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException(name + "." + key + " must be a number: " + value);
    }

    private static double confidence(Map<String, Object> section, String name, String key, double fallback) {
        double value = doubleValue(section, name, key, fallback);
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + "." + key + " must be within [0,1]: " + value);
        }
        return value;
    }

    static Pattern compile(String key, String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern for " + key + ": " + e.getMessage(), e);
        }
    }

    public Extraction extraction() {
        return extraction;
    }

    public Resolution resolution() {
        return resolution;
    }

    public Binding binding() {
        return binding;
    }

    public GodObject godObject() {
        return godObject;
    }

    public Orphans orphans() {
        return orphans;
    }

    public ProductionRisk productionRisk() {
        return productionRisk;
    }

    public Impact impact() {
        return impact;
    }

    public Detectors detectors() {
        return detectors;
    }
}

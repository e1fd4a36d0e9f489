package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.config.GlobPattern;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.FindingKind;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.Language;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects nodes nothing depends on: zero inbound edges of any kind.
 * <p>
 * Entry points are exempt. A node is an entry point when its kind is listed in
 * {@code orphans.entryPointKinds}, or when its qualified name matches one of the
 * {@code orphans.entryPointPatterns} globs. Patterns prefixed with {@code path:}
 * match the declaring file path instead. Manifest files cannot be imported and are
 * never reported.
 */
public class OrphanDetector implements Detector {

    private static final String PATH_PREFIX = "path:";

    @Override
    public String id() {
        return "orphan";
    }

    @Override
    public String description() {
        return "Detects unreferenced files, functions and schemas";
    }

    @Override
    public FindingKind kind() {
        return FindingKind.ORPHAN;
    }

    @Override
    public List<IntegrityFinding> detect(DependencyGraph graph, AnalysisConfig config,
                                         CancellationToken cancellation) {
        EntryPoints entryPoints = EntryPoints.from(config.orphans());
        List<IntegrityFinding> findings = new ArrayList<>();

        for (Node node : graph.nodes()) {
            cancellation.throwIfCancelled();
            if (node.language() == Language.MANIFEST
                    || !graph.incoming(node.id()).isEmpty() || entryPoints.matches(node)) {
                continue;
            }
            boolean fileLevel = node.kind() == NodeKind.FILE || node.kind() == NodeKind.MODULE;
            findings.add(IntegrityFinding.builder()
                    .kind(FindingKind.ORPHAN)
                    .severity(fileLevel ? Severity.LOW : Severity.MEDIUM)
                    .nodeId(node.id())
                    .description(node.kind().displayName() + " " + node.qualifiedName()
                            + " is never imported, called or referenced")
                    .detectorId(id())
                    .location(node.location())
                    .build());
        }
        return findings;
    }

    private record EntryPoints(AnalysisConfig.Orphans settings, List<GlobPattern> names, List<GlobPattern> paths) {

        static EntryPoints from(AnalysisConfig.Orphans settings) {
            List<GlobPattern> names = new ArrayList<>();
            List<GlobPattern> paths = new ArrayList<>();
            for (String pattern : settings.entryPointPatterns()) {
                if (pattern.startsWith(PATH_PREFIX)) {
                    paths.add(GlobPattern.compile(pattern.substring(PATH_PREFIX.length())));
                } else {
                    names.add(GlobPattern.compile(pattern));
                }
            }
            return new EntryPoints(settings, names, paths);
        }

        boolean matches(Node node) {
            if (settings.entryPointKinds().contains(node.kind())) {
                return true;
            }
            for (GlobPattern name : names) {
                if (name.matches(node.qualifiedName()) || name.matches(node.name())) {
                    return true;
                }
            }
            for (GlobPattern path : paths) {
                if (path.matches(node.path())) {
                    return true;
                }
            }
            return false;
        }
    }
}

package io.devguard.graph;

import io.devguard.config.AnalysisConfig;
import io.devguard.extract.HttpCall;
import io.devguard.extract.HttpRoute;
import io.devguard.model.Edge;
import io.devguard.model.EdgeKind;
import io.devguard.model.Node;
import io.devguard.model.UnresolvedReference;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Binds frontend HTTP call sites to backend Endpoint nodes by URL pattern and verb.
 * <p>
 * Both sides are normalized to path segments: scheme, host, query and fragment are
 * dropped, and parameter segments ({@code {id}}, {@code :id}, {@code <int:id>},
 * template placeholders, numbers) become wildcards. A call is bound to every route
 * sharing its best score; a call matching no route becomes an unresolved reference.
 */
public class EndpointBinder {

    private static final String PARAM = "{}";
    private static final Pattern SCHEME_AND_HOST = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://[^/]*");
    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final double EPSILON = 1e-9;

    private enum Match { EXACT, PARAMETERIZED, NONE }

    /**
     * An Endpoint node together with the route it declares.
     */
    public record RouteTarget(Node endpoint, HttpRoute route) {}

    public record Result(List<Edge> edges, List<UnresolvedReference> unresolved) {}

    private final AnalysisConfig.Binding config;
    private final List<List<String>> strippablePrefixes;

    public EndpointBinder(AnalysisConfig.Binding config) {
        this.config = config;
        this.strippablePrefixes = config.strippablePrefixes().stream()
                .map(EndpointBinder::segments)
                .filter(segments -> !segments.isEmpty())
                .sorted(Comparator.comparingInt((List<String> s) -> s.size()).reversed())
                .toList();
    }

    public Result bind(List<RouteTarget> routes, List<HttpCall> calls) {
        List<RouteTarget> ordered = routes.stream()
                .sorted(Comparator.comparing(r -> r.endpoint().id()))
                .toList();
        List<Edge> edges = new ArrayList<>();
        List<UnresolvedReference> unresolved = new ArrayList<>();

        for (HttpCall call : calls) {
            double best = 0.0;
            List<RouteTarget> matches = new ArrayList<>();
            for (RouteTarget target : ordered) {
                double score = score(target.route(), call);
                if (score <= 0.0) {
                    continue;
                }
                if (score > best + EPSILON) {
                    best = score;
                    matches.clear();
                    matches.add(target);
                } else if (Math.abs(score - best) <= EPSILON) {
                    matches.add(target);
                }
            }
            if (matches.isEmpty()) {
                unresolved.add(new UnresolvedReference(call.sourceId(), call.display(), EdgeKind.BINDS_ENDPOINT,
                        call.provenance()));
                continue;
            }
            for (RouteTarget target : matches) {
                edges.add(new Edge(call.sourceId(), target.endpoint().id(), EdgeKind.BINDS_ENDPOINT, best,
                        call.provenance()));
            }
        }
        return new Result(edges, unresolved);
    }

    /**
     * Scores how well a call matches a route: 0 for no match, otherwise one of the
     * configured binding confidences.
     */
    public double score(HttpRoute route, HttpCall call) {
        if (!route.verb().equalsIgnoreCase(call.verb())) {
            return 0.0;
        }
        List<String> routeSegments = segments(route.path());
        List<String> callSegments = segments(call.url());
        Match match = match(routeSegments, callSegments);
        if (match == Match.EXACT) {
            return config.exactConfidence();
        }
        if (match == Match.PARAMETERIZED) {
            return config.parameterizedConfidence();
        }
        for (List<String> prefix : strippablePrefixes) {
            if (callSegments.size() > prefix.size() && callSegments.subList(0, prefix.size()).equals(prefix)) {
                List<String> stripped = callSegments.subList(prefix.size(), callSegments.size());
                if (match(routeSegments, stripped) != Match.NONE) {
                    return config.prefixStrippedConfidence();
                }
            }
        }
        return 0.0;
    }

    private static Match match(List<String> route, List<String> call) {
        if (route.size() != call.size()) {
            return Match.NONE;
        }
        boolean parameterized = false;
        for (int i = 0; i < route.size(); i++) {
            String r = route.get(i);
            String c = call.get(i);
            if (r.equals(c)) {
                continue;
            }
            if (r.equals(PARAM)) {
                parameterized = true;
                continue;
            }
            return Match.NONE;
        }
        return parameterized ? Match.PARAMETERIZED : Match.EXACT;
    }

    /**
     * Normalizes a route template or call URL into path segments with parameters as {@code {}}.
     */
    static List<String> segments(String url) {
        String path = SCHEME_AND_HOST.matcher(url.trim()).replaceFirst("");
        if (path.startsWith("{param}/")) {
            path = path.substring("{param}".length());
        }
        int query = indexOfAny(path, '?', '#');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            segments.add(isParameter(segment) ? PARAM : segment);
        }
        return segments;
    }

    private static boolean isParameter(String segment) {
        return (segment.startsWith("{") && segment.endsWith("}"))
                || (segment.startsWith("<") && segment.endsWith(">"))
                || segment.startsWith(":")
                || segment.contains("{param}")
                || NUMERIC.matcher(segment).matches();
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}

package io.devguard.extract;

import io.devguard.model.Language;
import io.devguard.model.RiskMarker;

import java.util.List;

/**
 * Everything one successfully parsed file contributes to the graph.
 *
 * @param path         normalized path
 * @param language     language tag
 * @param declarations declared nodes, the File node first
 * @param references   unresolved references
 * @param httpCalls    frontend calls awaiting endpoint binding
 * @param riskScan     production-readiness scan of the raw text
 */
public record FileContribution(
        String path,
        Language language,
        List<Declaration> declarations,
        List<SymbolReference> references,
        List<HttpCall> httpCalls,
        RiskScan riskScan
) {

    public FileContribution {
        declarations = List.copyOf(declarations);
        references = List.copyOf(references);
        httpCalls = httpCalls == null ? List.of() : List.copyOf(httpCalls);
        if (riskScan == null) {
            riskScan = RiskScan.empty(path, 0);
        }
    }

    public FileContribution withRiskScan(RiskScan scan) {
        return new FileContribution(path, language, declarations, references, httpCalls, scan);
    }

    /**
     * Raw-text scan results for one file.
     *
     * @param path      normalized path
     * @param lineCount number of physical lines
     * @param todoCount lines carrying a TODO/FIXME/HACK marker
     * @param markers   rule matches
     */
    public record RiskScan(String path, int lineCount, int todoCount, List<RiskMarker> markers) {

        public RiskScan {
            markers = markers == null ? List.of() : List.copyOf(markers);
        }

        public static RiskScan empty(String path, int lineCount) {
            return new RiskScan(path, lineCount, 0, List.of());
        }
    }
}

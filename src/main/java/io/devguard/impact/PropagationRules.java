package io.devguard.impact;

import io.devguard.model.ChangeKind;
import io.devguard.model.Edge;
import io.devguard.model.EdgeKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which dependency edges carry the effect of a change back to their source.
 * <ul>
 *   <li>Rename: Calls, ReferencesSchema and BindsEndpoint always; Imports and
 *       Implements only when they name the renamed node itself</li>
 *   <li>Remove: every edge kind</li>
 *   <li>SignatureChange: Calls and BindsEndpoint</li>
 * </ul>
 */
final class PropagationRules {

    private static final Set<EdgeKind> RENAME_ALWAYS =
            EnumSet.of(EdgeKind.CALLS, EdgeKind.REFERENCES_SCHEMA, EdgeKind.BINDS_ENDPOINT);
    private static final Set<EdgeKind> RENAME_DIRECT_ONLY = EnumSet.of(EdgeKind.IMPORTS, EdgeKind.IMPLEMENTS);
    private static final Set<EdgeKind> SIGNATURE_CHANGE = EnumSet.of(EdgeKind.CALLS, EdgeKind.BINDS_ENDPOINT);

    private PropagationRules() {
    }

    /**
     * @param change   kind of the simulated change
     * @param edge     an edge pointing at an affected node
     * @param targetId the node the change was applied to
     */
    static boolean propagates(ChangeKind change, Edge edge, String targetId) {
        return switch (change) {
            case REMOVE -> true;
            case SIGNATURE_CHANGE -> SIGNATURE_CHANGE.contains(edge.kind());
            case RENAME -> RENAME_ALWAYS.contains(edge.kind())
                    || (RENAME_DIRECT_ONLY.contains(edge.kind()) && edge.targetId().equals(targetId));
        };
    }
}

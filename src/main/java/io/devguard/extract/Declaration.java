package io.devguard.extract;

import io.devguard.model.Node;

import java.util.Set;

/**
 * A node declared by a file, together with extra names it can be resolved by.
 *
 * @param node    the declared node
 * @param aliases additional qualified names (module name of a file, "mod.default" for default exports)
 * @param route   route metadata for Endpoint nodes, null otherwise
 */
public record Declaration(Node node, Set<String> aliases, HttpRoute route) {

    public Declaration {
        aliases = aliases == null ? Set.of() : Set.copyOf(aliases);
    }
}

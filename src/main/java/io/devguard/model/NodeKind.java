package io.devguard.model;

/**
 * Kinds of nodes in the dependency graph.
 */
public enum NodeKind {
    FILE("File"),
    MODULE("Module"),
    FUNCTION("Function"),
    CLASS("Class"),
    ENDPOINT("Endpoint"),
    SCHEMA("Schema"),
    COMPONENT("Component");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Parses either the display name ("Endpoint") or the constant name ("ENDPOINT").
     */
    public static NodeKind parse(String value) {
        for (NodeKind kind : values()) {
            if (kind.displayName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + value);
    }
}

package io.devguard.model;

/**
 * Typed relationships between graph nodes.
 */
public enum EdgeKind {
    /** A file or module imports another file, module or symbol. */
    IMPORTS("Imports"),

    /** A function, component or endpoint invokes (or renders) another symbol. */
    CALLS("Calls"),

    /** A class extends or implements another class or interface. */
    IMPLEMENTS("Implements"),

    /** A frontend call site is bound to a backend endpoint by URL and verb. */
    BINDS_ENDPOINT("BindsEndpoint"),

    /** A symbol names a schema in its fields, parameters or return type. */
    REFERENCES_SCHEMA("ReferencesSchema");

    private final String displayName;

    EdgeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}

package io.devguard.model;

public enum FindingKind {
    CYCLE("Cycle"),
    GOD_OBJECT("GodObject"),
    ORPHAN("Orphan"),
    PRODUCTION_RISK("ProductionRisk");

    private final String displayName;

    FindingKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}

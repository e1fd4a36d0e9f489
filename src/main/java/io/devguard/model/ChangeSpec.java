package io.devguard.model;

/**
 * A proposed change to one graph node.
 */
public record ChangeSpec(String targetId, ChangeKind kind) {

    public ChangeSpec {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    public static ChangeSpec rename(String targetId) {
        return new ChangeSpec(targetId, ChangeKind.RENAME);
    }

    public static ChangeSpec remove(String targetId) {
        return new ChangeSpec(targetId, ChangeKind.REMOVE);
    }

    public static ChangeSpec signatureChange(String targetId) {
        return new ChangeSpec(targetId, ChangeKind.SIGNATURE_CHANGE);
    }
}

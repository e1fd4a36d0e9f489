package io.devguard.model;

/**
 * One parameter (functions) or field (schemas, classes) of a signature summary.
 *
 * @param name     parameter or field name
 * @param typeHint declared type as written in source, or null when absent
 */
public record SignatureParam(String name, String typeHint) {

    public SignatureParam {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (typeHint != null && typeHint.isBlank()) {
            typeHint = null;
        }
    }

    public static SignatureParam of(String name) {
        return new SignatureParam(name, null);
    }
}

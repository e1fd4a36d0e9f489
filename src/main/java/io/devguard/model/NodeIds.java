package io.devguard.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Deterministic node identifiers.
 * <p>
 * An id depends only on the normalized file path and the symbol's qualified name,
 * so rebuilding from identical documents always yields identical ids.
 */
public final class NodeIds {

    private static final int ID_HEX_LENGTH = 24;

    private NodeIds() {
    }

    public static String nodeId(String path, String qualifiedName) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((path + '\0' + qualifiedName).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, ID_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Normalizes a document path: forward slashes, no leading "./" or "/", no empty
     * or "." segments. Returns null if the path escapes its root via "..".
     */
    public static String normalizePath(String raw) {
        if (raw == null) {
            return null;
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : raw.trim().replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return String.join("/", segments);
    }
}

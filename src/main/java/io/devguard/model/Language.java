package io.devguard.model;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Source language tag carried by every ingested document.
 * <p>
 * {@link #MANIFEST} covers non-source files that matter for production readiness
 * (dependency lists, Dockerfiles, environment files, private keys). They are
 * recognized by file name rather than extension and contribute only a File node.
 */
public enum Language {
    PYTHON("python", Set.of("py")),
    JAVASCRIPT("javascript", Set.of("js", "jsx", "mjs", "cjs")),
    TYPESCRIPT("typescript", Set.of("ts", "tsx")),
    MANIFEST("manifest", Set.of()),
    UNKNOWN("unknown", Set.of());

    private static final Pattern MANIFEST_NAMES = Pattern.compile(
            "requirements[\\w.-]*\\.txt|Dockerfile(\\.[\\w.-]+)?|\\.env(\\.[\\w.-]+)?"
                    + "|id_rsa|id_dsa|id_ecdsa|id_ed25519|master\\.key|\\.DS_Store");

    private final String tag;
    private final Set<String> extensions;

    Language(String tag, Set<String> extensions) {
        this.tag = tag;
        this.extensions = extensions;
    }

    public String tag() {
        return tag;
    }

    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Returns true if the file extension of the given path belongs to this language.
     */
    public boolean accepts(String path) {
        if (this == MANIFEST) {
            return isManifest(path);
        }
        return extensions.contains(extensionOf(path));
    }

    /**
     * Infers the language from a file extension. Unrecognized extensions map to UNKNOWN.
     */
    public static Language fromPath(String path) {
        String ext = extensionOf(path);
        for (Language language : values()) {
            if (language.extensions.contains(ext)) {
                return language;
            }
        }
        return isManifest(path) ? MANIFEST : UNKNOWN;
    }

    static boolean isManifest(String path) {
        if (path == null) {
            return false;
        }
        return MANIFEST_NAMES.matcher(path.substring(path.lastIndexOf('/') + 1)).matches();
    }

    static String extensionOf(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

package io.devguard.extract;

import io.devguard.model.NodeIds;

import java.util.Set;

/**
 * Maps file paths to dotted module names used for qualified names and import resolution.
 * <p>
 * {@code app/services/user.py} is module {@code app.services.user};
 * {@code app/services/__init__.py} and {@code src/components/index.ts} name their package
 * ({@code app.services}, {@code src.components}).
 */
public final class ModuleNames {

    private static final Set<String> PACKAGE_FILE_STEMS = Set.of("__init__", "index");
    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "py", "js", "jsx", "mjs", "cjs", "ts", "tsx");

    private ModuleNames() {
    }

    public static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Removes a known source extension, leaving other dots alone.
     */
    public static String stripExtension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot > slash + 1 && SOURCE_EXTENSIONS.contains(path.substring(dot + 1))) {
            return path.substring(0, dot);
        }
        return path;
    }

    public static boolean isPackageFile(String path) {
        return PACKAGE_FILE_STEMS.contains(fileName(stripExtension(path)));
    }

    /**
     * Dotted name of the file itself, package marker included ({@code app.services.__init__}).
     */
    public static String fileModuleName(String path) {
        return dotted(stripExtension(path));
    }

    /**
     * Module name symbols of this file are qualified with.
     */
    public static String moduleName(String path) {
        if (isPackageFile(path)) {
            String parent = parentDirectory(path);
            if (!parent.isEmpty()) {
                return dotted(parent);
            }
        }
        return fileModuleName(path);
    }

    /**
     * Package containing the module, used as the base for relative imports. Empty at the root.
     */
    public static String packageOf(String path) {
        return dotted(parentDirectory(path));
    }

    /**
     * Resolves a Python relative import such as {@code from ..models import User}.
     *
     * @param level  number of leading dots
     * @param module module text after the dots, possibly empty
     * @return dotted absolute module name, or null if the import climbs above the root
     */
    public static String resolvePythonRelative(String fromPath, int level, String module) {
        String base = packageOf(fromPath);
        for (int i = 1; i < level; i++) {
            if (base.isEmpty()) {
                return null;
            }
            int dot = base.lastIndexOf('.');
            base = dot >= 0 ? base.substring(0, dot) : "";
        }
        if (module == null || module.isEmpty()) {
            return base.isEmpty() ? null : base;
        }
        return base.isEmpty() ? module : base + "." + module;
    }

    /**
     * Resolves an ECMAScript module specifier to a dotted module name.
     * Relative specifiers are resolved against the importing file; {@code @/} and
     * {@code ~/} aliases are treated as root-relative; bare packages are dotted as-is.
     *
     * @return dotted module name, or null if a relative specifier escapes the root
     */
    public static String resolveEcmaScriptSpecifier(String fromPath, String specifier) {
        if (specifier.startsWith("./") || specifier.startsWith("../") || specifier.equals(".")
                || specifier.equals("..")) {
            String parent = parentDirectory(fromPath);
            String joined = parent.isEmpty() ? specifier : parent + "/" + specifier;
            String normalized = NodeIds.normalizePath(joined);
            if (normalized == null || normalized.isEmpty()) {
                return null;
            }
            return moduleName(normalized);
        }
        if (specifier.startsWith("@/") || specifier.startsWith("~/")) {
            return moduleName(specifier.substring(2));
        }
        return dotted(specifier);
    }

    static String parentDirectory(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(0, slash) : "";
    }

    static String dotted(String path) {
        return path.replace('/', '.');
    }
}

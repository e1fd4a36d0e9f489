package io.devguard.extract;

import io.devguard.model.EdgeKind;
import io.devguard.model.Language;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.Provenance;
import io.devguard.model.SignatureParam;
import io.devguard.model.SourceDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates the declarations and references of one file while an adapter walks it.
 * Declarations are keyed by qualified name; the first declaration of a name wins.
 */
final class ContributionCollector {

    private final String path;
    private final Language language;
    private final String moduleName;
    private final Node fileNode;
    private final Map<String, Declaration> declarations = new LinkedHashMap<>();
    private final Set<SymbolReference> references = new LinkedHashSet<>();
    private final List<HttpCall> httpCalls = new ArrayList<>();

    ContributionCollector(SourceDocument document) {
        this.path = document.path();
        this.language = document.language();
        this.moduleName = ModuleNames.moduleName(path);
        this.fileNode = Node.builder()
                .kind(NodeKind.FILE)
                .language(language)
                .path(path)
                .qualifiedName(path)
                .name(ModuleNames.fileName(path))
                .build();

        String fileModule = ModuleNames.fileModuleName(path);
        declarations.put(path, new Declaration(fileNode, Set.of(fileModule), null));
        if (!fileModule.equals(moduleName)) {
            declare(NodeKind.MODULE, moduleName, lastSegment(moduleName), 1, List.of());
        }
    }

    String path() {
        return path;
    }

    String moduleName() {
        return moduleName;
    }

    Node fileNode() {
        return fileNode;
    }

    /**
     * Qualifies a top-level name with this file's module name.
     */
    String qualify(String name) {
        return moduleName + "." + name;
    }

    Node declare(NodeKind kind, String qualifiedName, String name, int line, List<SignatureParam> signature) {
        return declare(kind, qualifiedName, name, line, signature, Set.of(), null);
    }

    Node declare(NodeKind kind, String qualifiedName, String name, int line, List<SignatureParam> signature,
                 Set<String> aliases, HttpRoute route) {
        Declaration existing = declarations.get(qualifiedName);
        if (existing != null) {
            return existing.node();
        }
        Node node = Node.builder()
                .kind(kind)
                .language(language)
                .path(path)
                .qualifiedName(qualifiedName)
                .name(name)
                .line(line)
                .signature(signature)
                .build();
        declarations.put(qualifiedName, new Declaration(node, aliases, route));
        return node;
    }

    /**
     * Adds an alias to an already declared node, e.g. "mod.default" for a default export.
     */
    void alias(String qualifiedName, String alias) {
        Declaration existing = declarations.get(qualifiedName);
        if (existing == null) {
            return;
        }
        Set<String> aliases = new LinkedHashSet<>(existing.aliases());
        aliases.add(alias);
        declarations.put(qualifiedName, new Declaration(existing.node(), aliases, existing.route()));
    }

    boolean isDeclared(String qualifiedName) {
        return declarations.containsKey(qualifiedName);
    }

    Node node(String qualifiedName) {
        Declaration declaration = declarations.get(qualifiedName);
        return declaration != null ? declaration.node() : null;
    }

    /**
     * Replaces the signature of a declared node once its body has been read.
     */
    void resign(String qualifiedName, List<SignatureParam> signature) {
        Declaration existing = declarations.get(qualifiedName);
        if (existing == null || signature.isEmpty()) {
            return;
        }
        Node old = existing.node();
        Node node = new Node(old.id(), old.kind(), old.language(), old.path(), old.qualifiedName(),
                old.name(), old.line(), signature);
        declarations.put(qualifiedName, new Declaration(node, existing.aliases(), existing.route()));
    }

    void reference(String sourceId, List<String> candidates, EdgeKind kind, int line) {
        if (candidates.isEmpty()) {
            return;
        }
        references.add(new SymbolReference(sourceId, candidates, kind, Provenance.line(path, line)));
    }

    void httpCall(String sourceId, String verb, String url, int line) {
        httpCalls.add(new HttpCall(sourceId, verb, url, Provenance.line(path, line)));
    }

    FileContribution finish() {
        return new FileContribution(path, language, List.copyOf(declarations.values()),
                List.copyOf(references), httpCalls, null);
    }

    static String lastSegment(String dotted) {
        int dot = dotted.lastIndexOf('.');
        return dot >= 0 ? dotted.substring(dot + 1) : dotted;
    }
}

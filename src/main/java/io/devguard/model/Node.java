package io.devguard.model;

import java.util.List;

/**
 * A declared symbol in the dependency graph.
 *
 * @param id            stable hash of normalized path and qualified name
 * @param kind          what the node represents
 * @param language      language of the originating file
 * @param path          normalized path of the originating file
 * @param qualifiedName name unique within the file, e.g. {@code app.models.User.save}
 * @param name          short display name
 * @param line          declaration line, 0 for file-level nodes
 * @param signature     ordered parameters or fields, empty when not applicable
 */
public record Node(
        String id,
        NodeKind kind,
        Language language,
        String path,
        String qualifiedName,
        String name,
        int line,
        List<SignatureParam> signature
) {

    public Node {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (qualifiedName == null || qualifiedName.isBlank()) {
            throw new IllegalArgumentException("qualifiedName cannot be null or blank");
        }
        if (language == null) {
            language = Language.UNKNOWN;
        }
        if (name == null || name.isBlank()) {
            name = qualifiedName;
        }
        signature = signature == null ? List.of() : List.copyOf(signature);
    }

    public String location() {
        return line > 0 ? path + ":" + line : path;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NodeKind kind;
        private Language language = Language.UNKNOWN;
        private String path;
        private String qualifiedName;
        private String name;
        private int line;
        private List<SignatureParam> signature = List.of();

        public Builder kind(NodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder language(Language language) {
            this.language = language;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder qualifiedName(String qualifiedName) {
            this.qualifiedName = qualifiedName;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder signature(List<SignatureParam> signature) {
            this.signature = signature;
            return this;
        }

        /**
         * Builds the node, deriving its id from path and qualified name.
         */
        public Node build() {
            return new Node(NodeIds.nodeId(path, qualifiedName), kind, language, path,
                    qualifiedName, name, line, signature);
        }
    }
}

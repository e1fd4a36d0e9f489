package io.devguard.extract;

import io.devguard.model.Language;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.SourceDocument;

import java.util.List;
import java.util.Set;

/**
 * Declares a bare File node for dependency lists, Dockerfiles, environment files and
 * key material, so that production-risk rules can report against them.
 * <p>
 * Manifests declare no symbols and carry no module alias: nothing can import them.
 */
public class ManifestExtractor implements SymbolExtractor {

    @Override
    public Set<Language> languages() {
        return Set.of(Language.MANIFEST);
    }

    @Override
    public boolean requiresContent() {
        return false;
    }

    @Override
    public FileContribution extract(SourceDocument document) {
        String path = document.path();
        Node file = Node.builder()
                .kind(NodeKind.FILE)
                .language(Language.MANIFEST)
                .path(path)
                .qualifiedName(path)
                .name(ModuleNames.fileName(path))
                .build();
        return new FileContribution(path, Language.MANIFEST,
                List.of(new Declaration(file, Set.of(), null)), List.of(), List.of(), null);
    }
}

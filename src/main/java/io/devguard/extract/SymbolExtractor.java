package io.devguard.extract;

import io.devguard.model.Language;
import io.devguard.model.SourceDocument;

import java.util.Set;

/**
 * Language adapter turning one source document into a {@link FileContribution}.
 * <p>
 * Implementations must be stateless: the engine calls {@link #extract} concurrently
 * from several worker threads.
 */
public interface SymbolExtractor {

    /**
     * Languages this adapter handles.
     */
    Set<Language> languages();

    /**
     * Whether blank documents are rejected before {@link #extract} is called.
     */
    default boolean requiresContent() {
        return true;
    }

    /**
     * Extracts declarations and unresolved references from the document.
     *
     * @param document document with a normalized path, and non-blank content unless
     *                 {@link #requiresContent()} is false
     * @throws ParseException if the document is not syntactically valid
     */
    FileContribution extract(SourceDocument document) throws ParseException;
}

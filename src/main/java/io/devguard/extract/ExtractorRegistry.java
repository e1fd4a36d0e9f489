package io.devguard.extract;

import io.devguard.model.Language;
import io.devguard.model.SourceDocument;
import io.devguard.model.UnparsedFile;
import io.devguard.model.UnparsedFile.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects the language adapter for a document and turns adapter failures into
 * {@link UnparsedFile} records. Extraction never throws for a single bad file.
 */
public class ExtractorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtractorRegistry.class);

    private final Map<Language, SymbolExtractor> extractors;

    public ExtractorRegistry(Collection<SymbolExtractor> extractors) {
        Map<Language, SymbolExtractor> byLanguage = new EnumMap<>(Language.class);
        for (SymbolExtractor extractor : extractors) {
            for (Language language : extractor.languages()) {
                SymbolExtractor previous = byLanguage.putIfAbsent(language, extractor);
                if (previous != null) {
                    throw new IllegalArgumentException("Two extractors registered for " + language.tag());
                }
            }
        }
        this.extractors = byLanguage;
    }

    /**
     * Creates a registry with the Python, JavaScript/TypeScript and manifest adapters.
     */
    public static ExtractorRegistry createDefault() {
        return new ExtractorRegistry(List.of(
                new PythonSymbolExtractor(), new EcmaScriptSymbolExtractor(), new ManifestExtractor()));
    }

    public static ExtractorRegistry of(SymbolExtractor... extractors) {
        return new ExtractorRegistry(List.of(extractors));
    }

    public Optional<SymbolExtractor> extractorFor(Language language) {
        return Optional.ofNullable(extractors.get(language));
    }

    /**
     * Extracts one document. The document path must already be normalized.
     */
    public ExtractionOutcome extract(SourceDocument document) {
        Language language = document.language() == null ? Language.UNKNOWN : document.language();
        String path = document.path();

        SymbolExtractor extractor = extractors.get(language);
        if (extractor == null) {
            return unparsed(path, language, Reason.UNSUPPORTED_LANGUAGE,
                    "No extractor for language '" + language.tag() + "'");
        }
        if (!language.accepts(path)) {
            return unparsed(path, language, Reason.UNSUPPORTED_EXTENSION,
                    "Extension does not match language '" + language.tag() + "'");
        }
        if (extractor.requiresContent() && (document.content() == null || document.content().isBlank())) {
            return unparsed(path, language, Reason.EMPTY_FILE, "File has no content");
        }

        try {
            FileContribution contribution = extractor.extract(document);
            log.debug("Extracted {}: {} declarations, {} references", path,
                    contribution.declarations().size(), contribution.references().size());
            return ExtractionOutcome.parsed(contribution);
        } catch (ParseException e) {
            return unparsed(path, language, Reason.SYNTAX_ERROR, e.getMessage());
        }
    }

    private static ExtractionOutcome unparsed(String path, Language language, Reason reason, String detail) {
        log.debug("Skipping {}: {} ({})", path, reason, detail);
        return ExtractionOutcome.failed(new UnparsedFile(path, language, reason, detail));
    }
}

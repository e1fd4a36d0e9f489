package io.devguard.model;

/**
 * A normalized document handed to the core by the ingestion collaborator.
 *
 * @param path     repository-relative path
 * @param language language tag
 * @param content  full source text
 */
public record SourceDocument(String path, Language language, String content) {

    public static SourceDocument of(String path, String content) {
        return new SourceDocument(path, Language.fromPath(path), content);
    }

    public int lineCount() {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        return (int) content.lines().count();
    }
}

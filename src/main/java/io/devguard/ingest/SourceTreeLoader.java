package io.devguard.ingest;

import io.devguard.model.Language;
import io.devguard.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Walks a source directory and turns every supported file into a {@link SourceDocument}.
 * <p>
 * Paths are relative to the root, with forward slashes. Directories whose name is in
 * the excluded set (vendored packages, virtual environments, build output) are not
 * entered, and neither are hidden directories. Documents are returned sorted by path.
 */
public class SourceTreeLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceTreeLoader.class);

    private final Set<String> excludedSegments;

    public SourceTreeLoader(Set<String> excludedSegments) {
        this.excludedSegments = excludedSegments != null ? Set.copyOf(excludedSegments) : Set.of();
    }

    /**
     * Loads all supported source files and manifests under a directory, or a single supported file.
     * Content is decoded as UTF-8, malformed bytes become replacement characters.
     *
     * @throws IOException if the root cannot be read
     */
    public List<SourceDocument> load(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new NoSuchFileException(root.toString());
        }
        if (Files.isRegularFile(root)) {
            Path parent = root.toAbsolutePath().getParent();
            SourceDocument document = read(parent, root.toAbsolutePath());
            return document != null ? List.of(document) : List.of();
        }

        Path base = root.toAbsolutePath().normalize();
        List<SourceDocument> documents = new ArrayList<>();
        Files.walkFileTree(base, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(base)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (excludedSegments.contains(name) || (name.startsWith(".") && name.length() > 1)) {
                    log.debug("Skipping directory {}", base.relativize(dir));
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (attrs.isRegularFile()) {
                    SourceDocument document = read(base, file);
                    if (document != null) {
                        documents.add(document);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        documents.sort(Comparator.comparing(SourceDocument::path));
        log.info("Loaded {} source files from {}", documents.size(), base);
        return documents;
    }

    private static SourceDocument read(Path base, Path file) throws IOException {
        String relative = base.relativize(file).toString().replace('\\', '/');
        Language language = Language.fromPath(relative);
        if (language == Language.UNKNOWN) {
            return null;
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return new SourceDocument(relative, language, content);
    }
}

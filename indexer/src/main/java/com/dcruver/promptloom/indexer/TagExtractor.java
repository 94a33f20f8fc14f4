package com.dcruver.promptloom.indexer;

import com.dcruver.promptloom.domain.TagOccurrence;
import com.dcruver.promptloom.io.LibraryFileSystem;
import com.dcruver.promptloom.io.LibraryPaths;
import com.dcruver.promptloom.nlp.TagTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Computes the weighted tag counts of one library file.
 *
 * The file name (without extension) feeds the file-name bucket, the folders between the library
 * root and the file feed the path bucket, and the text feeds the content bucket.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TagExtractor {

    private final TagTokenizer tokenizer;
    private final LibraryFileSystem fileSystem;

    public Map<String, TagOccurrence> extract(Path libraryRoot, Path file, Set<String> stopWords) {
        List<String> segments = LibraryPaths.relativeSegments(libraryRoot, file);

        String fileNameSegment = segments.isEmpty()
            ? LibraryPaths.stripExtension(String.valueOf(file.getFileName()))
            : LibraryPaths.stripExtension(segments.get(segments.size() - 1));
        List<String> pathSegments = segments.size() <= 1
            ? List.of()
            : segments.subList(0, segments.size() - 1);

        Map<String, TagOccurrence> counts = new LinkedHashMap<>();
        merge(counts, tokenizer.tokenize(List.of(fileNameSegment), stopWords),
            (occurrence, value) -> occurrence.setFileNameCount(occurrence.getFileNameCount() + value));
        merge(counts, tokenizer.tokenize(pathSegments, stopWords),
            (occurrence, value) -> occurrence.setPathCount(occurrence.getPathCount() + value));
        merge(counts, tokenizeContents(file, stopWords),
            (occurrence, value) -> occurrence.setContentCount(occurrence.getContentCount() + value));
        return counts;
    }

    private Map<String, Integer> tokenizeContents(Path file, Set<String> stopWords) {
        try {
            String contents = fileSystem.readAllText(file);
            return tokenizer.tokenize(List.of(contents), stopWords);
        } catch (IOException | SecurityException | UnsupportedOperationException e) {
            log.warn("Could not read {} for tagging, indexing its name and folders only: {}", file, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private static void merge(Map<String, TagOccurrence> counts, Map<String, Integer> tokens,
                              BiConsumer<TagOccurrence, Integer> add) {
        tokens.forEach((token, value) -> add.accept(counts.computeIfAbsent(token, key -> new TagOccurrence()), value));
    }
}

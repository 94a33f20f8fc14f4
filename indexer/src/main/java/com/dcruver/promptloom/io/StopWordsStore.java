package com.dcruver.promptloom.io;

import com.dcruver.promptloom.config.TagIndexProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads the stop-word list used by the tag tokenizer.
 *
 * The list is persisted as {@code Config/stop-words.json} under the application data root and is
 * created from the built-in English defaults on first access. Once loaded, the set is kept in memory
 * and treated as read-only until {@link #invalidate()} is called.
 */
@Component
@Slf4j
public class StopWordsStore {

    static final int CURRENT_VERSION = 1;

    static final List<String> DEFAULT_STOP_WORDS = List.of(
        "a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l", "m",
        "n", "o", "p", "q", "r", "s", "t", "u", "v", "w", "x", "y", "z",
        "an", "the",
        "me", "my", "mine", "myself", "we", "us", "our", "ours", "ourselves",
        "you", "your", "yours", "yourself", "yourselves",
        "he", "him", "his", "himself", "she", "her", "hers", "herself",
        "it", "its", "itself", "they", "them", "their", "theirs", "themselves",
        "what", "which", "who", "whom", "whose", "this", "that", "these", "those",
        "about", "above", "across", "after", "against", "along", "amid", "among", "around", "as", "at",
        "before", "behind", "below", "beneath", "beside", "between", "beyond", "but", "by",
        "concerning", "down", "during", "except", "for", "from", "in", "inside", "into", "like",
        "near", "of", "off", "on", "onto", "out", "outside", "over", "past", "regarding", "round",
        "since", "through", "throughout", "to", "toward", "towards", "under", "underneath", "until",
        "up", "upon", "with", "within", "without",
        "and", "or", "nor", "yet", "so", "although", "because", "unless", "while", "whereas", "whether",
        "am", "is", "are", "was", "were", "be", "been", "being", "have", "has", "had", "having",
        "do", "does", "did", "doing", "will", "would", "shall", "should", "can", "could",
        "may", "might", "must", "ought",
        "very", "too", "just", "also", "now", "then", "here", "there", "when", "where", "why", "how",
        "not", "no", "yes", "all", "any", "both", "each", "few", "more", "most", "other", "some",
        "such", "only", "own", "same", "than"
    );

    private final LibraryFileSystem fileSystem;
    private final Path stopWordsPath;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private volatile Set<String> cached;

    public StopWordsStore(LibraryFileSystem fileSystem, TagIndexProperties properties) {
        this.fileSystem = fileSystem;
        this.stopWordsPath = properties.getStopWordsPath();
    }

    public Path getStopWordsPath() {
        return stopWordsPath;
    }

    /**
     * Load the stop words, writing the default document first if none exists.
     *
     * @return lower-cased, trimmed, non-blank stop words
     * @throws StopWordsException if the document cannot be written or parsed
     */
    public Set<String> loadOrCreate() {
        Set<String> words = cached;
        if (words != null) {
            return words;
        }

        synchronized (this) {
            if (cached == null) {
                cached = load();
            }
            return cached;
        }
    }

    /**
     * Drop the in-memory copy so the next {@link #loadOrCreate()} re-reads the file.
     */
    public void invalidate() {
        cached = null;
    }

    private Set<String> load() {
        try {
            if (stopWordsPath.getParent() != null) {
                fileSystem.createDirectories(stopWordsPath.getParent());
            }

            if (!fileSystem.fileExists(stopWordsPath)) {
                StopWordsDocument defaults = new StopWordsDocument(CURRENT_VERSION, new ArrayList<>(DEFAULT_STOP_WORDS));
                fileSystem.writeAllText(stopWordsPath,
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(defaults));
                log.info("Created default stop-words file at {}", stopWordsPath);
            }

            StopWordsDocument document = objectMapper.readValue(
                fileSystem.readAllText(stopWordsPath), StopWordsDocument.class);
            if (document == null) {
                throw new StopWordsException("stop-words.json could not be parsed: " + stopWordsPath);
            }

            Set<String> words = new HashSet<>();
            if (document.getStopWords() != null) {
                for (String word : document.getStopWords()) {
                    if (word == null) {
                        continue;
                    }
                    String normalized = word.trim().toLowerCase(Locale.ROOT);
                    if (!normalized.isEmpty()) {
                        words.add(normalized);
                    }
                }
            }

            log.debug("Loaded {} stop words (version {})", words.size(), document.getVersion());
            return Collections.unmodifiableSet(words);
        } catch (IOException e) {
            throw new StopWordsException("Failed to load stop words from " + stopWordsPath, e);
        }
    }

    /**
     * On-disk shape of stop-words.json.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StopWordsDocument {
        private int version = CURRENT_VERSION;
        private List<String> stopWords;
    }
}

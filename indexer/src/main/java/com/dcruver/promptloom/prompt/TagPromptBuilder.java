package com.dcruver.promptloom.prompt;

import com.dcruver.promptloom.io.LibraryFileSystem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * Builds a prompt from the files a tag search selected: one random entry per file, one line each.
 *
 * Entries are the trimmed, non-blank lines of a file that do not start with {@code #}.
 * Files that cannot be read or have no entries are skipped and reported in the result messages.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TagPromptBuilder {

    static final String NO_SELECTION = "Select files to build a prompt.";
    static final String EMPTY_PROMPT = "Prompt is empty. Select files with usable entries.";

    private final LibraryFileSystem fileSystem;
    private final RandomSource randomSource;

    /**
     * @param filePaths files in the order their entries should appear
     * @param seed      fixed seed for repeatable picks, or {@code null}
     */
    public TagPromptResult generate(Collection<String> filePaths, Integer seed) {
        List<String> messages = new ArrayList<>();
        if (filePaths == null || filePaths.isEmpty()) {
            messages.add(NO_SELECTION);
            return new TagPromptResult("", List.copyOf(messages));
        }

        Random random = randomSource.create(seed);
        List<String> parts = new ArrayList<>();

        for (String path : filePaths) {
            if (path == null || path.isBlank()) {
                continue;
            }

            List<String> entries;
            try {
                entries = readEntries(Path.of(path));
            } catch (IOException | SecurityException e) {
                log.warn("Could not read prompt file {}: {}", path, e.getMessage());
                messages.add(String.format("Could not read file '%s': %s", path, e.getMessage()));
                continue;
            }

            if (entries.isEmpty()) {
                messages.add(String.format("File '%s' has no entries.", path));
                continue;
            }

            String pick = normalize(entries.get(random.nextInt(entries.size())));
            if (!pick.isEmpty()) {
                parts.add(pick);
            }
        }

        String prompt = String.join("\n", parts);
        if (prompt.isBlank()) {
            messages.add(EMPTY_PROMPT);
        }
        return new TagPromptResult(prompt, List.copyOf(messages));
    }

    /**
     * Usable lines of a prompt file. A missing file has none.
     */
    List<String> readEntries(Path file) throws IOException {
        if (!fileSystem.fileExists(file)) {
            return List.of();
        }
        List<String> entries = new ArrayList<>();
        for (String line : fileSystem.readAllText(file).split("\\R")) {
            String entry = line.trim();
            if (!entry.isEmpty() && !entry.startsWith("#")) {
                entries.add(entry);
            }
        }
        return entries;
    }

    /**
     * Collapse every run of whitespace to one space.
     */
    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ");
    }
}

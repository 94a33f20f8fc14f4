package com.dcruver.promptloom.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for the tag index: where it lives, what it scans, and how it tokenizes.
 * Bound from {@code promptloom.tags.*}.
 */
@ConfigurationProperties(prefix = "promptloom.tags")
@Data
public class TagIndexProperties {

    /**
     * Application data root. Holds DBs/Tags.db and Config/stop-words.json.
     */
    private Path appDataRoot = Path.of(System.getProperty("user.home"), ".promptloom");

    /**
     * Prompt library scanned for *.txt files. Defaults to {@code <appDataRoot>/Library}.
     */
    private Path libraryDir;

    /**
     * Reduce tokens to their singular base form.
     */
    private boolean lemmatize = true;

    /**
     * Interval of progress heartbeats during long indexing phases.
     */
    private Duration heartbeatInterval = Duration.ofSeconds(2);

    private int suggestionLimit = 12;
    private int relatedLimit = 20;

    public Path getLibraryDir() {
        return libraryDir != null ? libraryDir : appDataRoot.resolve("Library");
    }

    public Path getDatabasePath() {
        return appDataRoot.resolve("DBs").resolve("Tags.db");
    }

    public Path getStopWordsPath() {
        return appDataRoot.resolve("Config").resolve("stop-words.json");
    }
}

package com.dcruver.promptloom.app;

import com.dcruver.promptloom.domain.CancellationSignal;
import com.dcruver.promptloom.domain.IndexStatus;
import com.dcruver.promptloom.domain.SyncResult;
import com.dcruver.promptloom.indexer.TagIndexer;
import com.dcruver.promptloom.prompt.TagPromptBuilder;
import com.dcruver.promptloom.prompt.TagPromptResult;
import com.dcruver.promptloom.reporting.IndexSummaryFormatter;
import com.dcruver.promptloom.search.FileSearchResult;
import com.dcruver.promptloom.search.RelatedTag;
import com.dcruver.promptloom.search.TagSearchService;
import com.dcruver.promptloom.store.TagIndexStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Spring Shell commands for the tag index.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class TagIndexShellCommands {

    private final TagIndexer indexer;
    private final TagSearchService searchService;
    private final TagIndexStore store;
    private final TagPromptBuilder promptBuilder;

    @Value("${promptloom.tags.suggestion-limit:12}")
    private int suggestionLimit;

    @Value("${promptloom.tags.related-limit:20}")
    private int relatedLimit;

    @ShellMethod(key = {"index-sync", "sync"}, value = "Scan the prompt library and update the tag index")
    public String sync() {
        log.info("Running tag index sync...");

        try {
            SyncResult result = indexer.sync(new CancellationSignal(), progress -> log.info("{}", progress));
            return IndexSummaryFormatter.format(result);
        } catch (CancellationException e) {
            return "Index sync cancelled.";
        } catch (Exception e) {
            log.error("Index sync failed", e);
            return "Index sync failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tag-search", value = "List files tagged with all of the given tags")
    public String search(@ShellOption(help = "Tags separated by commas or spaces") String tags) {
        List<FileSearchResult> results = searchService.searchFiles(splitTags(tags));
        if (results.isEmpty()) {
            return "No files match " + String.join(" + ", splitTags(tags)) + ".";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%d file(s):\n", results.size()));
        for (FileSearchResult result : results) {
            sb.append(String.format("%4d%%  %s", result.getRelevancePercent(), result.getDisplayName()));
            if (!result.getRelativeFolderPath().isEmpty()) {
                sb.append("  [").append(result.getRelativeFolderPath()).append("]");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    @ShellMethod(key = "tag-suggest", value = "Suggest tags starting with the given text")
    public String suggest(@ShellOption(help = "Text typed so far") String query,
                          @ShellOption(defaultValue = "0", help = "Maximum suggestions") int limit) {
        List<String> suggestions = searchService.suggestTags(query, limit > 0 ? limit : suggestionLimit);
        if (suggestions.isEmpty()) {
            return "No suggestions.";
        }

        Map<String, Integer> counts = searchService.countTagReferencesAllFiles(suggestions);
        StringBuilder sb = new StringBuilder();
        for (String suggestion : suggestions) {
            sb.append(String.format("%s (%d)\n", suggestion, counts.getOrDefault(suggestion, 0)));
        }
        return sb.toString();
    }

    @ShellMethod(key = "tag-related", value = "Show tags that co-occur with the given tags")
    public String related(@ShellOption(help = "Selected tags separated by commas or spaces") String tags,
                          @ShellOption(defaultValue = "0", help = "Maximum related tags") int limit) {
        List<String> selected = splitTags(tags);
        List<String> paths = searchService.searchFiles(selected).stream()
            .map(FileSearchResult::getPath)
            .toList();

        List<RelatedTag> related = searchService.getRelatedTags(selected, paths, limit > 0 ? limit : relatedLimit);
        if (related.isEmpty()) {
            return "No related tags.";
        }

        StringBuilder sb = new StringBuilder();
        for (RelatedTag tag : related) {
            sb.append(String.format("%4d%%  %s\n", tag.getRelevancePercent(), tag.getName()));
        }
        return sb.toString();
    }

    @ShellMethod(key = "tag-prompt", value = "Build a prompt from one random entry of each file matching the tags")
    public String prompt(@ShellOption(help = "Tags separated by commas or spaces") String tags,
                         @ShellOption(defaultValue = ShellOption.NULL, help = "Seed for repeatable picks") Integer seed) {
        List<String> paths = searchService.searchFiles(splitTags(tags)).stream()
            .map(FileSearchResult::getPath)
            .toList();

        TagPromptResult result = promptBuilder.generate(paths, seed);
        StringBuilder sb = new StringBuilder();
        if (!result.isEmpty()) {
            sb.append(result.getPrompt()).append("\n");
        }
        for (String message : result.getMessages()) {
            sb.append("! ").append(message).append("\n");
        }
        return sb.toString();
    }

    @ShellMethod(key = "tag-colors", value = "Show the chip colors of the given tags")
    public String colors(@ShellOption(help = "Tags separated by commas or spaces") String tags) {
        Map<String, String> colors = searchService.getTagColors(splitTags(tags));
        if (colors.isEmpty()) {
            return "No colors stored for those tags.";
        }

        StringBuilder sb = new StringBuilder();
        colors.forEach((tag, color) -> sb.append(color).append("  ").append(tag).append("\n"));
        return sb.toString();
    }

    @ShellMethod(key = {"index-status", "status"}, value = "Show tag index statistics")
    public String status() {
        try {
            IndexStatus status = store.readStatus();

            StringBuilder sb = new StringBuilder();
            sb.append("Tag Index Status:\n");
            sb.append(String.format("- Database: %s\n", store.getDatabasePath()));
            sb.append(String.format("- Library: %s\n", status.getLibraryRoot()));
            sb.append(String.format("- Schema version: %d, index version: %d\n",
                status.getSchemaVersion(), status.getIndexVersion()));
            sb.append(String.format("- Last sync: %s\n",
                status.getLastScanMillis() > 0 ? Instant.ofEpochMilli(status.getLastScanMillis()) : "never"));
            sb.append(String.format("- Files: %d\n", status.getFileCount()));
            sb.append(String.format("- Tags: %d\n", status.getTagCount()));
            sb.append(String.format("- Folder colors: %d\n", status.getFolderColorCount()));
            sb.append(String.format("- Tag colors: %d\n", status.getTagColorCount()));
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to read index status", e);
            return "Failed to read index status: " + e.getMessage();
        }
    }

    static List<String> splitTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        return Arrays.stream(tags.split("[,\\s]+"))
            .filter(tag -> !tag.isBlank())
            .toList();
    }
}

package com.dcruver.promptloom.app;

import com.dcruver.promptloom.TagIndexFixture;
import com.dcruver.promptloom.prompt.SystemRandomSource;
import com.dcruver.promptloom.prompt.TagPromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the shell command output.
 */
class TagIndexShellCommandsTest {

    @TempDir
    Path tempDir;

    private TagIndexFixture fixture;
    private TagIndexShellCommands commands;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new TagIndexFixture(tempDir);
        fixture.writeFile("Body/Head and Shoulders/Old Brunette.txt", "old old seed");
        fixture.writeFile("Body/Arms.txt", "strong");
        commands = new TagIndexShellCommands(fixture.indexer, fixture.search, fixture.store,
            new TagPromptBuilder(fixture.fileSystem, new SystemRandomSource()));
    }

    @Test
    void testSyncThenSearch() {
        String summary = commands.sync();
        assertTrue(summary.startsWith("Index ready: 2 files"), summary);

        String results = commands.search("body, head");
        assertTrue(results.startsWith("1 file(s):"), results);
        assertTrue(results.contains("(2) Old Brunette"), results);
        assertTrue(results.contains("[Body/Head and Shoulders]"), results);

        assertEquals("No files match body + missing.", commands.search("body missing"));
    }

    @Test
    void testSuggestRelatedAndColors() {
        commands.sync();

        assertEquals("seed (1)\n", commands.suggest("se", 5));
        assertTrue(commands.related("body", 5).contains("old"));
        assertTrue(commands.colors("body").contains("#"));
        assertEquals("No colors stored for those tags.", commands.colors("missing"));
    }

    @Test
    void testPromptFromMatchingFiles() {
        commands.sync();

        assertEquals("strong\n", commands.prompt("arms", 11));
        assertEquals("! Select files to build a prompt.\n", commands.prompt("missing", null));
    }

    @Test
    void testStatus() {
        commands.sync();

        String status = commands.status();
        assertTrue(status.contains("- Files: 2"), status);
        assertTrue(status.contains("- Folder colors: 2"), status);
    }

    @Test
    void testSplitTags() {
        assertEquals(List.of("body", "head", "old"), TagIndexShellCommands.splitTags(" body, head  old,"));
        assertTrue(TagIndexShellCommands.splitTags("  ").isEmpty());
    }
}

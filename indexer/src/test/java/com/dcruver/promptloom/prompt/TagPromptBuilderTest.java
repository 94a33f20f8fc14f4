package com.dcruver.promptloom.prompt;

import com.dcruver.promptloom.io.LocalFileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for building a prompt from selected library files.
 */
class TagPromptBuilderTest {

    @TempDir
    Path tempDir;

    private TagPromptBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TagPromptBuilder(new LocalFileSystem(), new SystemRandomSource());
    }

    @Test
    void testFixedSeedPicksSameEntries() throws Exception {
        List<String> hair = List.of("long  red hair", "short hair", "braided hair", "bald");
        List<String> shoes = List.of("leather boots", "sandals", "sneakers");
        Path hairFile = write("Hair.txt", "# hair styles\n" + String.join("\n", hair) + "\n\n");
        Path shoeFile = write("Shoes.txt", String.join("\r\n", shoes));

        TagPromptResult first = builder.generate(List.of(hairFile.toString(), shoeFile.toString()), 7);
        TagPromptResult second = builder.generate(List.of(hairFile.toString(), shoeFile.toString()), 7);

        Random expected = new Random(7);
        String hairPick = TagPromptBuilder.normalize(hair.get(expected.nextInt(hair.size())));
        String shoePick = shoes.get(expected.nextInt(shoes.size()));

        assertEquals(hairPick + "\n" + shoePick, first.getPrompt());
        assertEquals(first.getPrompt(), second.getPrompt());
        assertTrue(first.getMessages().isEmpty());
    }

    @Test
    void testEmptySelection() {
        TagPromptResult result = builder.generate(List.of(), 1);

        assertTrue(result.isEmpty());
        assertEquals(List.of(TagPromptBuilder.NO_SELECTION), result.getMessages());
    }

    @Test
    void testUnreadableAndEmptyFilesAreReported() throws Exception {
        TagPromptBuilder failing = new TagPromptBuilder(new LocalFileSystem() {
            @Override
            public String readAllText(Path path) throws IOException {
                if (path.getFileName().toString().startsWith("Locked")) {
                    throw new IOException("sharing violation");
                }
                return super.readAllText(path);
            }
        }, new SystemRandomSource());
        Path locked = write("Locked.txt", "secret");
        Path comments = write("Comments.txt", "# only a comment\n   \n");
        Path open = write("Open.txt", "  wide\tangle  ");

        TagPromptResult result = failing.generate(
            List.of(locked.toString(), comments.toString(), open.toString()), 3);

        assertEquals("wide angle", result.getPrompt());
        assertEquals(2, result.getMessages().size());
        assertEquals("Could not read file '" + locked + "': sharing violation", result.getMessages().get(0));
        assertEquals("File '" + comments + "' has no entries.", result.getMessages().get(1));
    }

    @Test
    void testNothingUsableGivesEmptyPromptMessage() {
        Path missing = tempDir.resolve("Missing.txt");

        TagPromptResult result = builder.generate(List.of(missing.toString()), null);

        assertTrue(result.isEmpty());
        assertEquals(List.of("File '" + missing + "' has no entries.", TagPromptBuilder.EMPTY_PROMPT),
            result.getMessages());
    }

    @Test
    void testNormalizeCollapsesWhitespace() {
        assertEquals("red dress with lace", TagPromptBuilder.normalize(" red\r\ndress   with\tlace "));
        assertEquals("", TagPromptBuilder.normalize("   "));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}

package com.dcruver.promptloom.search;

import com.dcruver.promptloom.TagIndexFixture;
import com.dcruver.promptloom.domain.CancellationSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tag queries over a small indexed library.
 */
class TagSearchServiceTest {

    @TempDir
    Path tempDir;

    private TagIndexFixture fixture;
    private TagSearchService search;
    private String one;
    private String two;
    private String head;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new TagIndexFixture(tempDir);
        one = fixture.writeFile("Body/Head/One.txt", "").toString();
        two = fixture.writeFile("Body/Two.txt", "").toString();
        head = fixture.writeFile("Head.txt", "red red blue green").toString();
        fixture.indexer.sync();
        search = fixture.search;
    }

    @Test
    void testSearchRequiresEveryTag() {
        List<FileSearchResult> results = search.searchFiles(List.of("body", "head"));

        assertEquals(1, results.size());
        assertEquals(one, results.get(0).getPath());
        assertTrue(search.searchFiles(List.of("body", "missing")).isEmpty());
    }

    @Test
    void testSearchNormalizesAndDeduplicatesTags() {
        List<FileSearchResult> results = search.searchFiles(List.of("  BODY ", "body", "Body!"));

        assertEquals(2, results.size());
    }

    @Test
    void testRelevanceWeightsFileNameOverFolder() {
        List<FileSearchResult> results = search.searchFiles(List.of("head"));

        assertEquals(2, results.size());
        FileSearchResult best = results.get(0);
        FileSearchResult second = results.get(1);

        assertEquals(head, best.getPath());
        assertEquals(0.6, best.getRelevanceScore(), 1e-9);
        assertEquals(100, best.getRelevancePercent());
        assertEquals("", best.getRelativeFolderPath());
        assertEquals("(1) Head", best.getDisplayName());

        assertEquals(one, second.getPath());
        assertEquals(0.3, second.getRelevanceScore(), 1e-9);
        assertEquals(50, second.getRelevancePercent());
        assertEquals("Body/Head", second.getRelativeFolderPath());
    }

    @Test
    void testEqualScoresOrderByFileName() {
        List<FileSearchResult> results = search.searchFiles(List.of("body"));

        assertEquals(List.of("One", "Two"), results.stream().map(FileSearchResult::getFileName).toList());
    }

    @Test
    void testSuggestsByPrefix() {
        assertTrue(search.suggestTags("hea", 5).contains("head"));
        assertEquals(List.of("body"), search.suggestTags("Bo", 5));
        assertEquals(List.of("blue"), search.suggestTags("bl", 1));
        assertTrue(search.suggestTags("b", 5).isEmpty(), "single letters are stop words");
        assertTrue(search.suggestTags("zzz", 5).isEmpty());
        assertTrue(search.suggestTags("hea", 0).isEmpty());
        assertTrue(search.suggestTags("   ", 5).isEmpty());
        assertTrue(search.suggestTags("the", 5).isEmpty(), "stop words give no prefix");
    }

    @Test
    void testCountsReferences() {
        Map<String, Integer> all = search.countTagReferencesAllFiles(List.of("body", "head", "missing"));
        assertEquals(2, all.get("body"));
        assertEquals(2, all.get("HEAD"));
        assertFalse(all.containsKey("missing"));

        Map<String, Integer> scoped = search.countTagReferences(List.of("body", "head"), List.of(one));
        assertEquals(Map.of("body", 1, "head", 1), Map.copyOf(scoped));
    }

    @Test
    void testRelatedTagsExcludeSelectionAndScaleToTop() {
        List<RelatedTag> related = search.getRelatedTags(List.of("body"), List.of(one, two), 10);

        assertEquals(List.of(
            new RelatedTag("one", 100),
            new RelatedTag("two", 100),
            new RelatedTag("head", 50)), related);

        assertEquals(2, search.getRelatedTags(List.of("body"), List.of(one, two), 2).size());
    }

    @Test
    void testTopTagsByContent() {
        Map<String, List<String>> top = search.getTopTagsByContent(List.of(head, one), 2);

        assertEquals(List.of("red", "blue"), top.get(head));
        assertFalse(top.containsKey(one), "file without content tags");
    }

    @Test
    void testColorLookups() {
        Map<String, String> folders = search.getCategoryColors(List.of("Body", "body/head", "Nope"));
        assertEquals(2, folders.size());
        assertTrue(folders.get("BODY").startsWith("#"));

        Map<String, String> tags = search.getTagColors(List.of("body", "HEAD", "head", "missing"));
        assertEquals(2, tags.size());
        assertTrue(tags.containsKey("head"));
    }

    @Test
    void testNormalizeTag() {
        assertEquals("heads", search.normalizeTag("  Heads "));
        assertEquals("old", search.normalizeTag("Old Brunette"));
        assertEquals("the", search.normalizeTag("The"));
        assertEquals("", search.normalizeTag("   "));
        assertEquals("", search.normalizeTag(null));
    }

    @Test
    void testEmptyInputsGiveEmptyResults() {
        assertTrue(search.searchFiles(List.of()).isEmpty());
        assertTrue(search.searchFiles(List.of("  ")).isEmpty());
        assertTrue(search.countTagReferences(List.of("body"), List.of()).isEmpty());
        assertTrue(search.countTagReferencesAllFiles(List.of()).isEmpty());
        assertTrue(search.getRelatedTags(List.of(), List.of(one), 5).isEmpty());
        assertTrue(search.getRelatedTags(List.of("body"), List.of(one), 0).isEmpty());
        assertTrue(search.getCategoryColors(List.of()).isEmpty());
        assertTrue(search.getTagColors(List.of()).isEmpty());
        assertTrue(search.getTopTagsByContent(List.of(), 3).isEmpty());
    }

    @Test
    void testCancelledQueryFails() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThrows(CancellationException.class, () -> search.searchFiles(List.of("body"), signal));
        assertThrows(CancellationException.class, () -> search.suggestTags("hea", 5, signal));
    }

    @Test
    void testPercentIsClamped() {
        assertEquals(0, TagSearchService.toPercent(1, 0));
        assertEquals(33, TagSearchService.toPercent(1, 3));
        assertEquals(67, TagSearchService.toPercent(2, 3));
        assertEquals(100, TagSearchService.toPercent(5, 3));
    }
}

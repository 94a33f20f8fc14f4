package com.dcruver.promptloom.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LibraryPathsTest {

    private final Path root = Path.of("/library").toAbsolutePath();

    @Test
    void testRelativeSegments() {
        Path file = root.resolve("Body/Head and Shoulders/Old Brunette.txt");

        assertEquals(List.of("Body", "Head and Shoulders", "Old Brunette.txt"),
            LibraryPaths.relativeSegments(root, file));
    }

    @Test
    void testFileOutsideRootUsesFileNameOnly() {
        Path file = Path.of("/elsewhere/notes/Loose.txt").toAbsolutePath();

        assertEquals(List.of("Loose.txt"), LibraryPaths.relativeSegments(root, file));
        assertEquals("", LibraryPaths.relativeFolder(root, file));
    }

    @Test
    void testRelativeFolder() {
        assertEquals("Body/Head and Shoulders",
            LibraryPaths.relativeFolder(root, root.resolve("Body/Head and Shoulders/Old Brunette.txt")));
        assertEquals("", LibraryPaths.relativeFolder(root, root.resolve("Top.txt")));
    }

    @Test
    void testFolderPrefixes() {
        assertEquals(List.of("Body", "Body/Head and Shoulders"),
            LibraryPaths.folderPrefixes(root, root.resolve("Body/Head and Shoulders/Old Brunette.txt")));
        assertTrue(LibraryPaths.folderPrefixes(root, root.resolve("Top.txt")).isEmpty());
    }

    @Test
    void testStripExtension() {
        assertEquals("Old Brunette", LibraryPaths.stripExtension("Old Brunette.txt"));
        assertEquals("archive.tar", LibraryPaths.stripExtension("archive.tar.gz"));
        assertEquals("README", LibraryPaths.stripExtension("README"));
    }
}

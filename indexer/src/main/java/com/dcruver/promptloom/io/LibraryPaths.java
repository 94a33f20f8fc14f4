package com.dcruver.promptloom.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for paths relative to the library root.
 */
public final class LibraryPaths {

    private LibraryPaths() {
    }

    /**
     * Segments of {@code file} relative to {@code libraryRoot}, or just the file name when the file
     * lies outside the root.
     */
    public static List<String> relativeSegments(Path libraryRoot, Path file) {
        Path absoluteFile = file.toAbsolutePath().normalize();
        Path absoluteRoot = libraryRoot.toAbsolutePath().normalize();

        List<String> segments = new ArrayList<>();
        if (absoluteFile.startsWith(absoluteRoot) && !absoluteFile.equals(absoluteRoot)) {
            for (Path part : absoluteRoot.relativize(absoluteFile)) {
                String name = part.toString();
                if (!name.isEmpty()) {
                    segments.add(name);
                }
            }
        } else if (absoluteFile.getFileName() != null) {
            segments.add(absoluteFile.getFileName().toString());
        }
        return segments;
    }

    /**
     * Folder of {@code file} relative to the root, '/'-separated; empty for files directly in the root.
     */
    public static String relativeFolder(Path libraryRoot, Path file) {
        List<String> segments = relativeSegments(libraryRoot, file);
        if (segments.size() <= 1) {
            return "";
        }
        return String.join("/", segments.subList(0, segments.size() - 1));
    }

    /**
     * Every folder prefix of the file's relative folder: "Body", then "Body/Head".
     */
    public static List<String> folderPrefixes(Path libraryRoot, Path file) {
        List<String> segments = relativeSegments(libraryRoot, file);
        List<String> prefixes = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < segments.size() - 1; i++) {
            if (current.length() > 0) {
                current.append('/');
            }
            current.append(segments.get(i));
            prefixes.add(current.toString());
        }
        return prefixes;
    }

    /**
     * File name without its last extension: "Old Brunette.txt" becomes "Old Brunette".
     */
    public static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(0, dot) : fileName;
    }
}

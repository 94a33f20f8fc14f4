package com.dcruver.promptloom.io;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * {@link LibraryFileSystem} backed by {@code java.nio}.
 */
@Component
@Slf4j
public class LocalFileSystem implements LibraryFileSystem {

    @Override
    public boolean fileExists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public boolean directoryExists(Path path) {
        return Files.isDirectory(path);
    }

    @Override
    public void createDirectories(Path path) throws IOException {
        Files.createDirectories(path);
    }

    @Override
    public List<Path> enumerateFiles(Path root, String glob, boolean recursive) throws IOException {
        List<Path> matches = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return matches;
        }

        PathMatcher matcher = FileSystems.getDefault()
            .getPathMatcher("glob:" + glob.toLowerCase(Locale.ROOT));

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!recursive && !dir.equals(root)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    Path name = Path.of(file.getFileName().toString().toLowerCase(Locale.ROOT));
                    if (matcher.matches(name)) {
                        matches.add(file);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Failed to visit {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        matches.sort(null);
        return matches;
    }

    @Override
    public String readAllText(Path path) throws IOException {
        // Lenient decode: malformed bytes become U+FFFD instead of failing the read
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Override
    public void writeAllText(Path path, String contents) throws IOException {
        Files.writeString(path, contents, StandardCharsets.UTF_8);
    }

    @Override
    public long lastWriteStamp(Path path) throws IOException {
        return Files.getLastModifiedTime(path).to(TimeUnit.MICROSECONDS);
    }
}

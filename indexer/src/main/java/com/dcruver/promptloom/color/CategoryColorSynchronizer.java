package com.dcruver.promptloom.color;

import com.dcruver.promptloom.io.LibraryPaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assigns each library folder a color for path chips.
 * A folder keeps its color for as long as it exists; colors of vanished folders are dropped.
 */
@Component
@Slf4j
public class CategoryColorSynchronizer {

    /**
     * @param files every file currently in the library
     * @return number of stored folder colors afterwards
     */
    public int sync(JdbcTemplate jdbc, Path libraryRoot, Collection<Path> files) {
        Set<String> folders = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (Path file : files) {
            folders.addAll(LibraryPaths.folderPrefixes(libraryRoot, file));
        }

        Map<String, String> stored = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        jdbc.query("SELECT Category, ColorHex FROM CategoryColors",
            rs -> { stored.put(rs.getString("Category"), rs.getString("ColorHex")); });

        List<Object[]> deletions = new ArrayList<>();
        Set<String> usedColors = new HashSet<>();
        stored.forEach((folder, color) -> {
            if (folders.contains(folder)) {
                usedColors.add(color.toUpperCase(Locale.ROOT));
            } else {
                deletions.add(new Object[]{folder});
            }
        });

        List<Object[]> inserts = new ArrayList<>();
        for (String folder : folders) {
            if (stored.containsKey(folder)) {
                continue;
            }
            String color = ColorPalette.categoryColor(folder, usedColors);
            usedColors.add(color);
            inserts.add(new Object[]{folder, color});
        }

        if (!deletions.isEmpty()) {
            jdbc.batchUpdate("DELETE FROM CategoryColors WHERE Category = ?", deletions);
        }
        if (!inserts.isEmpty()) {
            jdbc.batchUpdate("INSERT INTO CategoryColors (Category, ColorHex) VALUES (?, ?)", inserts);
        }

        log.debug("Folder colors: {} folders, {} added, {} pruned", folders.size(), inserts.size(), deletions.size());
        return folders.size();
    }
}

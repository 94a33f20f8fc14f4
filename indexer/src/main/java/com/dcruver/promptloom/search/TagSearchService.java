package com.dcruver.promptloom.search;

import com.dcruver.promptloom.config.TagIndexProperties;
import com.dcruver.promptloom.domain.CancellationSignal;
import com.dcruver.promptloom.io.LibraryPaths;
import com.dcruver.promptloom.io.StopWordsStore;
import com.dcruver.promptloom.nlp.TagTokenizer;
import com.dcruver.promptloom.store.TagIndexStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only queries over the committed tag index: AND-tag file search, prefix suggestions,
 * related tags, reference counts and color lookups.
 *
 * Every query accepts a {@link CancellationSignal} that is checked around each database round trip.
 * Empty inputs give empty results without touching the database.
 */
@Service
@Slf4j
public class TagSearchService {

    static final double FILE_NAME_WEIGHT = 0.6;
    static final double PATH_WEIGHT = 0.3;
    static final double CONTENT_WEIGHT = 0.1;

    private static final String WEIGHTED_SCORE =
        "(SUM(ft.FileNameCount) * :fileNameWeight) + (SUM(ft.PathCount) * :pathWeight) "
            + "+ (SUM(ft.ContentCount) * :contentWeight)";

    private final TagIndexStore store;
    private final StopWordsStore stopWordsStore;
    private final TagTokenizer tokenizer;
    private final TagIndexProperties properties;
    private final NamedParameterJdbcTemplate jdbc;

    public TagSearchService(TagIndexStore store, StopWordsStore stopWordsStore,
                            TagTokenizer tokenizer, TagIndexProperties properties) {
        this.store = store;
        this.stopWordsStore = stopWordsStore;
        this.tokenizer = tokenizer;
        this.properties = properties;
        this.jdbc = new NamedParameterJdbcTemplate(store.getJdbcTemplate());
    }

    public List<String> suggestTags(String query, int limit) {
        return suggestTags(query, limit, CancellationSignal.none());
    }

    /**
     * Tags whose name starts with every token of {@code query}, alphabetically.
     */
    public List<String> suggestTags(String query, int limit, CancellationSignal cancellation) {
        if (limit <= 0 || query == null || query.isBlank()) {
            return List.of();
        }

        Set<String> tokens = tokenizer.tokenize(List.of(query), stopWordsStore.loadOrCreate()).keySet();
        if (tokens.isEmpty()) {
            return List.of();
        }
        // Tokens are letters and digits only, so quoting cannot break the FTS syntax
        String match = tokens.stream()
            .map(token -> "\"" + token + "\"*")
            .collect(Collectors.joining(" AND "));

        prepare(cancellation);
        List<String> suggestions = jdbc.queryForList(
            "SELECT Name FROM TagFts WHERE TagFts MATCH :match ORDER BY Name LIMIT :limit",
            new MapSqlParameterSource("match", match).addValue("limit", limit),
            String.class);
        cancellation.throwIfCancelled();
        return suggestions;
    }

    public List<FileSearchResult> searchFiles(Collection<String> tags) {
        return searchFiles(tags, CancellationSignal.none());
    }

    /**
     * Files tagged with all of {@code tags}, best match first.
     */
    public List<FileSearchResult> searchFiles(Collection<String> tags, CancellationSignal cancellation) {
        List<String> normalized = normalizeTags(tags);
        if (normalized.isEmpty()) {
            return List.of();
        }

        prepare(cancellation);
        MapSqlParameterSource params = weights()
            .addValue("tags", normalized)
            .addValue("tagCount", normalized.size());
        List<FileSearchResult> matches = jdbc.query(
            "SELECT f.Path, f.FileName, SUM(ft.OccurrenceCount) AS MatchCount, " + WEIGHTED_SCORE + " AS Score "
                + "FROM Files f "
                + "JOIN FileTags ft ON ft.FileId = f.Id "
                + "JOIN Tags t ON t.Id = ft.TagId "
                + "WHERE t.Name IN (:tags) "
                + "GROUP BY f.Id "
                + "HAVING COUNT(DISTINCT t.Name) = :tagCount "
                + "ORDER BY Score DESC, f.FileName COLLATE NOCASE",
            params,
            (rs, rowNum) -> FileSearchResult.builder()
                .path(rs.getString("Path"))
                .fileName(rs.getString("FileName"))
                .matchCount(rs.getInt("MatchCount"))
                .relevanceScore(rs.getDouble("Score"))
                .build());
        cancellation.throwIfCancelled();

        double maxScore = matches.stream().mapToDouble(FileSearchResult::getRelevanceScore).max().orElse(0);
        Path libraryRoot = properties.getLibraryDir();
        List<FileSearchResult> results = new ArrayList<>(matches.size());
        for (FileSearchResult match : matches) {
            results.add(match.toBuilder()
                .relevancePercent(toPercent(match.getRelevanceScore(), maxScore))
                .relativeFolderPath(LibraryPaths.relativeFolder(libraryRoot, Path.of(match.getPath())))
                .build());
        }
        log.debug("Tag search {} matched {} files", normalized, results.size());
        return results;
    }

    public Map<String, Integer> countTagReferences(Collection<String> tags, Collection<String> filePaths) {
        return countTagReferences(tags, filePaths, CancellationSignal.none());
    }

    /**
     * Number of files among {@code filePaths} referencing each tag. Tags with no references are absent.
     */
    public Map<String, Integer> countTagReferences(Collection<String> tags, Collection<String> filePaths,
                                                   CancellationSignal cancellation) {
        List<String> normalized = normalizeTags(tags);
        if (normalized.isEmpty() || isEmpty(filePaths)) {
            return caseInsensitiveMap();
        }

        prepare(cancellation);
        Map<String, Integer> counts = caseInsensitiveMap();
        jdbc.query(
            "SELECT t.Name, COUNT(DISTINCT ft.FileId) AS FileCount "
                + "FROM FileTags ft "
                + "JOIN Tags t ON t.Id = ft.TagId "
                + "JOIN Files f ON f.Id = ft.FileId "
                + "WHERE t.Name IN (:tags) AND f.Path IN (:paths) "
                + "GROUP BY t.Name",
            new MapSqlParameterSource("tags", normalized).addValue("paths", List.copyOf(filePaths)),
            rs -> { counts.put(rs.getString("Name"), rs.getInt("FileCount")); });
        cancellation.throwIfCancelled();
        return counts;
    }

    public Map<String, Integer> countTagReferencesAllFiles(Collection<String> tags) {
        return countTagReferencesAllFiles(tags, CancellationSignal.none());
    }

    /**
     * Number of indexed files referencing each tag.
     */
    public Map<String, Integer> countTagReferencesAllFiles(Collection<String> tags, CancellationSignal cancellation) {
        List<String> normalized = normalizeTags(tags);
        if (normalized.isEmpty()) {
            return caseInsensitiveMap();
        }

        prepare(cancellation);
        Map<String, Integer> counts = caseInsensitiveMap();
        jdbc.query(
            "SELECT t.Name, COUNT(DISTINCT ft.FileId) AS FileCount "
                + "FROM FileTags ft "
                + "JOIN Tags t ON t.Id = ft.TagId "
                + "WHERE t.Name IN (:tags) "
                + "GROUP BY t.Name",
            new MapSqlParameterSource("tags", normalized),
            rs -> { counts.put(rs.getString("Name"), rs.getInt("FileCount")); });
        cancellation.throwIfCancelled();
        return counts;
    }

    public List<RelatedTag> getRelatedTags(Collection<String> selectedTags, Collection<String> filePaths, int limit) {
        return getRelatedTags(selectedTags, filePaths, limit, CancellationSignal.none());
    }

    /**
     * Other tags found in {@code filePaths}, ranked by weighted occurrence.
     * Empty when nothing scores above zero.
     */
    public List<RelatedTag> getRelatedTags(Collection<String> selectedTags, Collection<String> filePaths, int limit,
                                           CancellationSignal cancellation) {
        if (limit <= 0 || isEmpty(filePaths)) {
            return List.of();
        }
        List<String> normalized = normalizeTags(selectedTags);
        if (normalized.isEmpty()) {
            return List.of();
        }

        prepare(cancellation);
        MapSqlParameterSource params = weights()
            .addValue("tags", normalized)
            .addValue("paths", List.copyOf(filePaths))
            .addValue("limit", limit);
        List<ScoredTag> scored = jdbc.query(
            "SELECT t.Name, " + WEIGHTED_SCORE + " AS Score "
                + "FROM FileTags ft "
                + "JOIN Tags t ON t.Id = ft.TagId "
                + "JOIN Files f ON f.Id = ft.FileId "
                + "WHERE t.Name NOT IN (:tags) AND f.Path IN (:paths) "
                + "GROUP BY t.Name "
                + "ORDER BY Score DESC, t.Name COLLATE NOCASE "
                + "LIMIT :limit",
            params,
            (rs, rowNum) -> new ScoredTag(rs.getString("Name"), rs.getDouble("Score")));
        cancellation.throwIfCancelled();

        double maxScore = scored.stream().mapToDouble(ScoredTag::score).max().orElse(0);
        if (maxScore <= 0) {
            return List.of();
        }
        return scored.stream()
            .map(tag -> new RelatedTag(tag.name(), toPercent(tag.score(), maxScore)))
            .toList();
    }

    public Map<String, String> getCategoryColors(Collection<String> folderPaths) {
        return getCategoryColors(folderPaths, CancellationSignal.none());
    }

    /**
     * Stored colors for the given '/'-separated library folders.
     */
    public Map<String, String> getCategoryColors(Collection<String> folderPaths, CancellationSignal cancellation) {
        if (isEmpty(folderPaths)) {
            return caseInsensitiveMap();
        }

        prepare(cancellation);
        Map<String, String> colors = caseInsensitiveMap();
        jdbc.query("SELECT Category, ColorHex FROM CategoryColors WHERE Category IN (:folders)",
            new MapSqlParameterSource("folders", List.copyOf(folderPaths)),
            rs -> { colors.put(rs.getString("Category"), rs.getString("ColorHex")); });
        cancellation.throwIfCancelled();
        return colors;
    }

    public Map<String, String> getTagColors(Collection<String> tags) {
        return getTagColors(tags, CancellationSignal.none());
    }

    /**
     * Stored chip colors for the given tag names. Names are matched as given, ignoring case.
     */
    public Map<String, String> getTagColors(Collection<String> tags, CancellationSignal cancellation) {
        if (isEmpty(tags)) {
            return caseInsensitiveMap();
        }
        Set<String> distinct = new LinkedHashSet<>();
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String tag : tags) {
            if (tag != null && seen.add(tag)) {
                distinct.add(tag);
            }
        }
        if (distinct.isEmpty()) {
            return caseInsensitiveMap();
        }

        prepare(cancellation);
        Map<String, String> colors = caseInsensitiveMap();
        jdbc.query("SELECT Tag, ColorHex FROM TagColors WHERE Tag IN (:tags)",
            new MapSqlParameterSource("tags", List.copyOf(distinct)),
            rs -> { colors.put(rs.getString("Tag"), rs.getString("ColorHex")); });
        cancellation.throwIfCancelled();
        return colors;
    }

    public Map<String, List<String>> getTopTagsByContent(Collection<String> filePaths, int limit) {
        return getTopTagsByContent(filePaths, limit, CancellationSignal.none());
    }

    /**
     * For each file, up to {@code limit} tags with the most content occurrences.
     * Files without content tags are absent.
     */
    public Map<String, List<String>> getTopTagsByContent(Collection<String> filePaths, int limit,
                                                         CancellationSignal cancellation) {
        if (limit <= 0 || isEmpty(filePaths)) {
            return caseInsensitiveMap();
        }

        prepare(cancellation);
        Map<String, List<String>> topTags = caseInsensitiveMap();
        jdbc.query(
            "SELECT f.Path, t.Name, SUM(ft.ContentCount) AS Score "
                + "FROM FileTags ft "
                + "JOIN Tags t ON t.Id = ft.TagId "
                + "JOIN Files f ON f.Id = ft.FileId "
                + "WHERE f.Path IN (:paths) "
                + "GROUP BY f.Path, t.Name "
                + "HAVING Score > 0 "
                + "ORDER BY f.Path, Score DESC, t.Name COLLATE NOCASE",
            new MapSqlParameterSource("paths", List.copyOf(filePaths)),
            rs -> {
                List<String> list = topTags.computeIfAbsent(rs.getString("Path"), key -> new ArrayList<>(limit));
                if (list.size() < limit) {
                    list.add(rs.getString("Name"));
                }
            });
        cancellation.throwIfCancelled();

        Map<String, List<String>> result = caseInsensitiveMap();
        topTags.forEach((path, list) -> result.put(path, Collections.unmodifiableList(list)));
        return result;
    }

    /**
     * Canonical form of a user-entered tag: the first token the indexer would produce from it.
     * Returns the trimmed, lower-cased input when it yields no token, and "" for blank input.
     */
    public String normalizeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        Map<String, Integer> tokens = tokenizer.tokenize(List.of(trimmed), stopWordsStore.loadOrCreate());
        return tokens.isEmpty() ? trimmed : tokens.keySet().iterator().next();
    }

    private List<String> normalizeTags(Collection<String> tags) {
        if (isEmpty(tags)) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            String value = normalizeTag(tag);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return List.copyOf(normalized);
    }

    private void prepare(CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        store.ensureInitialized();
        cancellation.throwIfCancelled();
    }

    private static MapSqlParameterSource weights() {
        return new MapSqlParameterSource()
            .addValue("fileNameWeight", FILE_NAME_WEIGHT)
            .addValue("pathWeight", PATH_WEIGHT)
            .addValue("contentWeight", CONTENT_WEIGHT);
    }

    static int toPercent(double score, double maxScore) {
        if (maxScore <= 0) {
            return 0;
        }
        long percent = Math.round(score / maxScore * 100);
        return (int) Math.max(0, Math.min(100, percent));
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }

    private static <V> Map<String, V> caseInsensitiveMap() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    private record ScoredTag(String name, double score) {
    }
}

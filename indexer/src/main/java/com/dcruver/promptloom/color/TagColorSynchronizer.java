package com.dcruver.promptloom.color;

import com.dcruver.promptloom.config.TagIndexProperties;
import com.dcruver.promptloom.domain.CancellationSignal;
import com.dcruver.promptloom.domain.IndexProgress;
import com.dcruver.promptloom.reporting.ProgressHeartbeat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Keeps one stable color per tag, grouped by co-occurrence cluster.
 *
 * Runs inside the sync transaction, after tags have been rewritten. Clusters are recomputed from
 * scratch only on the first run or when the tag count moved by more than
 * {@code max(25, 5% of the count at the last clustering)}; otherwise stored assignments are kept and
 * only new tags are placed, so colors do not shuffle on small edits.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TagColorSynchronizer {

    static final String STAGE_LOADING = "Loading tag co-occurrence";
    static final String STAGE_CLUSTERING = "Clustering tag colors";

    static final int MIN_CO_OCCURRENCE = 2;
    static final int MIN_RECLUSTER_DELTA = 25;
    static final double RECLUSTER_FRACTION = 0.05;

    private static final String CO_OCCURRENCE_SQL = """
        SELECT a.TagId AS TagA, b.TagId AS TagB, COUNT(DISTINCT a.FileId) AS Weight
        FROM FileTags a
        JOIN FileTags b ON b.FileId = a.FileId AND b.TagId > a.TagId
        WHERE (a.FileNameCount + a.PathCount) > 0
          AND (b.FileNameCount + b.PathCount) > 0
        GROUP BY a.TagId, b.TagId
        HAVING COUNT(DISTINCT a.FileId) >= ?""";

    private final TagIndexProperties properties;
    private final Clock clock;

    /**
     * Bring TagColors in line with the current Tags table.
     *
     * @return number of stored tag colors afterwards
     */
    public int sync(JdbcTemplate jdbc, CancellationSignal cancellation, Consumer<IndexProgress> progress) {
        List<TagRow> tags = jdbc.query("SELECT Id, Name FROM Tags ORDER BY Id",
            (rs, rowNum) -> new TagRow(rs.getLong("Id"), rs.getString("Name")));
        ColorState state = jdbc.queryForObject(
            "SELECT LastTagCount, LastTagHash FROM TagColorState WHERE Id = 1",
            (rs, rowNum) -> new ColorState(rs.getInt("LastTagCount"), rs.getString("LastTagHash")));
        Map<String, StoredColor> stored = loadStoredColors(jdbc);

        String tagHash = hashTagSet(tags);
        boolean everyTagColored = stored.size() == tags.size()
            && tags.stream().allMatch(tag -> stored.containsKey(tag.name()));
        if (tagHash.equals(state.lastTagHash()) && everyTagColored) {
            log.debug("Tag set unchanged ({} tags); keeping stored colors", tags.size());
            return stored.size();
        }

        cancellation.throwIfCancelled();

        CoOccurrenceGraph graph;
        try (ProgressHeartbeat ignored = ProgressHeartbeat.start(
                progress, STAGE_LOADING, properties.getHeartbeatInterval(), clock)) {
            progress.accept(new IndexProgress(STAGE_LOADING, 0, 0));
            graph = loadGraph(jdbc, cancellation);
        }

        cancellation.throwIfCancelled();
        progress.accept(new IndexProgress(STAGE_CLUSTERING, 0, tags.size()));

        boolean recluster = shouldRecluster(state.lastTagCount(), tags.size());
        Map<Long, Long> clusters = recluster
            ? LabelPropagation.run(tags.stream().map(TagRow::id).toList(), graph).labels()
            : extendClusters(tags, stored, graph);

        List<Object[]> upserts = planColors(tags, stored, clusters, recluster);

        Set<String> current = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        tags.forEach(tag -> current.add(tag.name()));
        List<Object[]> deletions = new ArrayList<>();
        for (String name : stored.keySet()) {
            if (!current.contains(name)) {
                deletions.add(new Object[]{name});
            }
        }

        cancellation.throwIfCancelled();

        if (!deletions.isEmpty()) {
            jdbc.batchUpdate("DELETE FROM TagColors WHERE Tag = ?", deletions);
        }
        if (!upserts.isEmpty()) {
            jdbc.batchUpdate(
                "INSERT INTO TagColors (Tag, ColorHex, ClusterId) VALUES (?, ?, ?) "
                    + "ON CONFLICT(Tag) DO UPDATE SET ColorHex = excluded.ColorHex, ClusterId = excluded.ClusterId",
                upserts);
        }

        if (recluster) {
            jdbc.update("UPDATE TagColorState SET LastTagCount = ?, LastTagHash = ? WHERE Id = 1", tags.size(), tagHash);
        } else {
            jdbc.update("UPDATE TagColorState SET LastTagHash = ? WHERE Id = 1", tagHash);
        }

        log.info("Tag colors: {} tags, {} clusters, {} edges, recluster={}, written={}, deleted={}",
            tags.size(), new TreeSet<>(clusters.values()).size(), graph.getEdgeCount(),
            recluster, upserts.size(), deletions.size());

        Integer total = jdbc.queryForObject("SELECT COUNT(*) FROM TagColors", Integer.class);
        return total != null ? total : 0;
    }

    static boolean shouldRecluster(int lastTagCount, int tagCount) {
        if (lastTagCount == 0) {
            return true;
        }
        double threshold = Math.max(MIN_RECLUSTER_DELTA, lastTagCount * RECLUSTER_FRACTION);
        return Math.abs(tagCount - lastTagCount) > threshold;
    }

    CoOccurrenceGraph loadGraph(JdbcTemplate jdbc, CancellationSignal cancellation) {
        CoOccurrenceGraph graph = new CoOccurrenceGraph();
        int[] rows = {0};
        jdbc.query(CO_OCCURRENCE_SQL, rs -> {
            if (++rows[0] % 10_000 == 0) {
                cancellation.throwIfCancelled();
            }
            graph.addEdge(rs.getLong("TagA"), rs.getLong("TagB"), rs.getInt("Weight"));
        }, MIN_CO_OCCURRENCE);
        return graph;
    }

    /**
     * Keep stored clusters and attach each new tag to the stored cluster its neighbours favour.
     */
    private Map<Long, Long> extendClusters(List<TagRow> tags, Map<String, StoredColor> stored, CoOccurrenceGraph graph) {
        Map<Long, Long> clusters = new HashMap<>();
        long nextCluster = 0;
        for (TagRow tag : tags) {
            nextCluster = Math.max(nextCluster, tag.id() + 1);
            StoredColor color = stored.get(tag.name());
            if (color != null) {
                clusters.put(tag.id(), color.clusterId());
                nextCluster = Math.max(nextCluster, color.clusterId() + 1);
            }
        }

        for (TagRow tag : tags) {
            if (clusters.containsKey(tag.id())) {
                continue;
            }

            Map<Long, Long> scores = new HashMap<>();
            graph.neighbors(tag.id()).forEach((neighbor, weight) -> {
                Long cluster = clusters.get(neighbor);
                if (cluster != null) {
                    scores.merge(cluster, (long) weight, Long::sum);
                }
            });

            clusters.put(tag.id(), scores.isEmpty() ? nextCluster++ : LabelPropagation.strongest(scores));
        }
        return clusters;
    }

    private List<Object[]> planColors(List<TagRow> tags, Map<String, StoredColor> stored,
                                      Map<Long, Long> clusters, boolean recluster) {
        List<Long> ordered = new ArrayList<>(new TreeSet<>(clusters.values()));
        Map<Long, Integer> clusterIndex = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            clusterIndex.put(ordered.get(i), i);
        }
        int clusterCount = ordered.size();

        // Hue already shown for each stored cluster, so late joiners match their cluster
        Map<Long, Double> storedHues = new HashMap<>();
        if (!recluster) {
            stored.values().forEach(color ->
                storedHues.putIfAbsent(color.clusterId(), ColorPalette.hueOf(color.colorHex())));
        }

        List<Object[]> upserts = new ArrayList<>();
        for (TagRow tag : tags) {
            StoredColor existing = stored.get(tag.name());
            if (!recluster && existing != null) {
                continue;
            }

            long cluster = clusters.get(tag.id());
            Double hue = storedHues.get(cluster);
            String color = hue != null
                ? ColorPalette.colorForHue(tag.name(), hue)
                : ColorPalette.tagColor(tag.name(), clusterIndex.get(cluster), clusterCount);

            if (existing != null && existing.colorHex().equalsIgnoreCase(color) && existing.clusterId() == cluster) {
                continue;
            }
            upserts.add(new Object[]{tag.name(), color, cluster});
        }
        return upserts;
    }

    private Map<String, StoredColor> loadStoredColors(JdbcTemplate jdbc) {
        Map<String, StoredColor> stored = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        jdbc.query("SELECT Tag, ColorHex, ClusterId FROM TagColors", rs -> {
            stored.put(rs.getString("Tag"), new StoredColor(rs.getString("ColorHex"), rs.getLong("ClusterId")));
        });
        return stored;
    }

    /**
     * SHA-256 over the sorted, lower-cased tag names.
     */
    static String hashTagSet(List<TagRow> tags) {
        TreeSet<String> names = new TreeSet<>();
        tags.forEach(tag -> names.add(tag.name().toLowerCase(Locale.ROOT)));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(Integer.toString(names.size()).getBytes(StandardCharsets.UTF_8));
            for (String name : names) {
                digest.update((byte) '\n');
                digest.update(name.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    record TagRow(long id, String name) {
    }

    private record ColorState(int lastTagCount, String lastTagHash) {
    }

    private record StoredColor(String colorHex, long clusterId) {
    }
}

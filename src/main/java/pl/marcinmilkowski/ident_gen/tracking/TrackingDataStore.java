package pl.marcinmilkowski.ident_gen.tracking;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;

/**
 * Saves and loads word tracking data as JSON, so analytics accumulate across runs.
 *
 * File structure:
 * {
 *   "session_id": "20250101_120000",
 *   "timestamp": "2025-01-01T12:00:00Z",
 *   "total_words": 2,
 *   "word_stats": {
 *     "employment": {
 *       "frequency": 3, "contexts": [...], "sources": [...],
 *       "max_length_impact": 6, "avg_length_impact": 6.0,
 *       "priority_score": 180.0, "total_potential_savings": 18.0
 *     }
 *   }
 * }
 */
public final class TrackingDataStore {

    private static final Logger logger = LoggerFactory.getLogger(TrackingDataStore.class);

    public static final int MAX_SAVED_CONTEXTS = 10;

    private TrackingDataStore() {
    }

    public static void save(WordTracker tracker, Path output) throws IOException {
        save(tracker, output, Clock.systemUTC());
    }

    public static void save(WordTracker tracker, Path output, Clock clock) throws IOException {
        JSONObject stats = new JSONObject();
        for (WordStats s : tracker.getAllStats()) {
            JSONObject obj = new JSONObject();
            obj.put("frequency", s.getFrequency());
            obj.put("contexts", new JSONArray(limit(new TreeSet<>(s.getContexts()), MAX_SAVED_CONTEXTS)));
            obj.put("sources", new JSONArray(new TreeSet<>(s.getSources())));
            obj.put("max_length_impact", s.getMaxLengthImpact());
            obj.put("avg_length_impact", s.getAvgLengthImpact());
            obj.put("priority_score", s.getPriorityScore());
            obj.put("total_potential_savings", s.getTotalPotentialSavings());
            stats.put(s.getWord(), obj);
        }

        JSONObject root = new JSONObject();
        root.put("session_id", tracker.getSessionId());
        root.put("timestamp", clock.instant().toString());
        root.put("total_words", tracker.size());
        root.put("word_stats", stats);

        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, JSON.toJSONString(root, JSONWriter.Feature.PrettyFormat), StandardCharsets.UTF_8);
        logger.info("Tracking data saved to: {} ({} words)", output, tracker.size());
    }

    /**
     * Load saved statistics into the tracker. A missing file is logged and ignored.
     *
     * @return number of words loaded
     */
    public static int load(WordTracker tracker, Path input) throws IOException {
        if (!Files.exists(input)) {
            logger.warn("Tracking file not found: {}", input);
            return 0;
        }
        JSONObject root;
        try {
            root = JSON.parseObject(Files.readString(input, StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            throw new IOException("Malformed tracking file: " + input, e);
        }
        if (root == null) {
            return 0;
        }

        String sessionId = root.getString("session_id");
        if (sessionId != null) {
            tracker.setSessionId(sessionId);
        }

        JSONObject stats = root.getJSONObject("word_stats");
        if (stats == null) {
            return 0;
        }
        for (String word : stats.keySet()) {
            JSONObject obj = stats.getJSONObject(word);
            tracker.restore(new WordStats(
                word,
                obj.getIntValue("frequency"),
                toSet(obj.getJSONArray("contexts")),
                toSet(obj.getJSONArray("sources")),
                obj.getIntValue("max_length_impact"),
                obj.getDoubleValue("avg_length_impact")
            ));
        }
        logger.info("Loaded {} word stats from: {}", stats.size(), input);
        return stats.size();
    }

    private static Set<String> toSet(JSONArray array) {
        Set<String> set = new LinkedHashSet<>();
        if (array != null) {
            for (int i = 0; i < array.size(); i++) {
                set.add(array.getString(i));
            }
        }
        return set;
    }

    private static List<String> limit(Collection<String> values, int max) {
        List<String> out = new ArrayList<>(Math.min(values.size(), max));
        for (String v : values) {
            if (out.size() >= max) break;
            out.add(v);
        }
        return out;
    }
}

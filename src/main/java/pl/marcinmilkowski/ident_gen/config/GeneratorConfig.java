package pl.marcinmilkowski.ident_gen.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of an identifier generation run.
 *
 * Loadable from JSON; every key is optional and falls back to {@link #defaults()}:
 * {
 *   "include_inflections": true,
 *   "include_derivations": true,
 *   "truncation_markers": [" - ", " including ", ", including ", " (", " ["],
 *   "max_substitutions": 10,
 *   "max_variants_per_word": 50,
 *   "sentinel_name": "UNKNOWN",
 *   "cache_capacity": 8,
 *   "abbreviations_path": "abbreviations.json",
 *   "lexicon_path": "words.txt"
 * }
 */
public record GeneratorConfig(
    boolean includeInflections,
    boolean includeDerivations,
    List<String> truncationMarkers,
    int maxSubstitutions,
    int maxVariantsPerWord,
    String sentinelName,
    int cacheCapacity,
    Path abbreviationsPath,    // null = bundled default
    Path lexiconPath           // null = bundled default
) {
    private static final Logger logger = LoggerFactory.getLogger(GeneratorConfig.class);

    public static final List<String> DEFAULT_TRUNCATION_MARKERS =
        List.of(" - ", " including ", ", including ", " (", " [");

    public GeneratorConfig {
        truncationMarkers = List.copyOf(truncationMarkers);
        if (maxSubstitutions < 0) {
            throw new IllegalArgumentException("max_substitutions must be >= 0, got " + maxSubstitutions);
        }
        if (maxVariantsPerWord < 0) {
            throw new IllegalArgumentException("max_variants_per_word must be >= 0, got " + maxVariantsPerWord);
        }
        if (cacheCapacity < 0) {
            throw new IllegalArgumentException("cache_capacity must be >= 0, got " + cacheCapacity);
        }
        if (sentinelName == null || !sentinelName.matches("^[A-Z_][A-Z0-9_]*$")) {
            throw new IllegalArgumentException("sentinel_name must be an uppercase identifier, got " + sentinelName);
        }
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(true, true, DEFAULT_TRUNCATION_MARKERS, 10, 50, "UNKNOWN", 8, null, null);
    }

    /**
     * Load settings from a JSON file. Relative paths inside the file resolve against its directory.
     */
    public static GeneratorConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Generator config file not found: " + configPath);
        }
        JSONObject root;
        try {
            root = JSON.parseObject(Files.readString(configPath, StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed generator config: " + configPath, e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty generator config: " + configPath);
        }

        GeneratorConfig d = defaults();
        Path baseDir = configPath.toAbsolutePath().getParent();

        List<String> markers = d.truncationMarkers();
        if (root.containsKey("truncation_markers")) {
            JSONArray array = root.getJSONArray("truncation_markers");
            markers = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                markers.add(array.getString(i));
            }
        }

        GeneratorConfig config = new GeneratorConfig(
            root.getBooleanValue("include_inflections", d.includeInflections()),
            root.getBooleanValue("include_derivations", d.includeDerivations()),
            markers,
            root.getIntValue("max_substitutions", d.maxSubstitutions()),
            root.getIntValue("max_variants_per_word", d.maxVariantsPerWord()),
            root.containsKey("sentinel_name") ? root.getString("sentinel_name") : d.sentinelName(),
            root.getIntValue("cache_capacity", d.cacheCapacity()),
            resolve(baseDir, root.getString("abbreviations_path")),
            resolve(baseDir, root.getString("lexicon_path"))
        );
        logger.info("Loaded generator config from {}", configPath);
        return config;
    }

    private static Path resolve(Path baseDir, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Path p = Path.of(value);
        return p.isAbsolute() || baseDir == null ? p : baseDir.resolve(p);
    }

    public GeneratorConfig withAbbreviationsPath(Path path) {
        return new GeneratorConfig(includeInflections, includeDerivations, truncationMarkers, maxSubstitutions,
            maxVariantsPerWord, sentinelName, cacheCapacity, path, lexiconPath);
    }

    public GeneratorConfig withMorphology(boolean inflections, boolean derivations) {
        return new GeneratorConfig(inflections, derivations, truncationMarkers, maxSubstitutions,
            maxVariantsPerWord, sentinelName, cacheCapacity, abbreviationsPath, lexiconPath);
    }
}

package pl.marcinmilkowski.ident_gen.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and saves abbreviation rules as JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "abbreviations": {
 *     "pop": ["population"],
 *     "emp": ["employment", "employee"],
 *     ...
 *   }
 * }
 *
 * Key order is preserved; it is the first-seen order of the lookup table.
 */
public final class AbbreviationConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(AbbreviationConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "abbreviations/default.json";
    public static final String FORMAT_VERSION = "1.0";

    private AbbreviationConfigLoader() {
    }

    /**
     * Load abbreviation rules from a file.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the content is invalid
     */
    public static AbbreviationMap load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Abbreviation file not found: " + path);
        }
        AbbreviationMap map = parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        logger.info("Loaded {} abbreviation rules from {}", map.size(), path);
        return map;
    }

    /**
     * Load abbreviation rules from a classpath resource.
     */
    public static AbbreviationMap loadResource(String resource) throws IOException {
        try (InputStream in = AbbreviationConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Abbreviation resource not found: " + resource);
            }
            AbbreviationMap map = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + resource);
            logger.debug("Loaded {} abbreviation rules from classpath:{}", map.size(), resource);
            return map;
        }
    }

    /**
     * Parse the JSON content. {@code origin} is used in error messages only.
     */
    public static AbbreviationMap parse(String content, String origin) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed abbreviation JSON in " + origin, e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty abbreviation config: " + origin);
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in abbreviation config: " + origin);
        }

        if (!(root.get("abbreviations") instanceof JSONObject)) {
            throw new IllegalArgumentException("Missing 'abbreviations' object in " + origin);
        }

        JSONObject abbreviations = root.getJSONObject("abbreviations");

        List<AbbreviationRule> rules = new ArrayList<>();
        for (String abbrev : abbreviations.keySet()) {
            if (!(abbreviations.get(abbrev) instanceof JSONArray)) {
                throw new IllegalArgumentException("Abbreviation '" + abbrev + "' must map to an array of terms in " + origin);
            }
            JSONArray terms = abbreviations.getJSONArray(abbrev);
            List<String> fullTerms = new ArrayList<>(terms.size());
            for (int i = 0; i < terms.size(); i++) {
                Object term = terms.get(i);
                if (!(term instanceof String)) {
                    throw new IllegalArgumentException("Non-string term at index " + i + " for '" + abbrev + "' in " + origin);
                }
                fullTerms.add((String) term);
            }
            rules.add(new AbbreviationRule(abbrev, fullTerms));
        }
        return new AbbreviationMap(rules);
    }

    /**
     * Serialize rules to the JSON format read by {@link #parse}.
     */
    public static String toJson(AbbreviationMap map) {
        JSONObject abbreviations = new JSONObject();
        for (AbbreviationRule rule : map.getRules()) {
            abbreviations.put(rule.abbreviation(), new JSONArray(rule.fullTerms()));
        }
        JSONObject root = new JSONObject();
        root.put("version", FORMAT_VERSION);
        root.put("abbreviations", abbreviations);
        return JSON.toJSONString(root, JSONWriter.Feature.PrettyFormat);
    }

    /**
     * Write rules to a file, keeping a ".bak" copy of an existing file.
     */
    public static void write(AbbreviationMap map, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        if (Files.exists(path)) {
            Path backup = path.resolveSibling(path.getFileName() + ".bak");
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Created backup: {}", backup);
        }
        Files.writeString(path, toJson(map), StandardCharsets.UTF_8);
        logger.info("Wrote {} abbreviation rules to {}", map.size(), path);
    }
}

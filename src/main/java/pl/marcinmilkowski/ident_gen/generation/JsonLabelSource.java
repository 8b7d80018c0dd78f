package pl.marcinmilkowski.ident_gen.generation;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads label records from a JSON file.
 *
 * Expected JSON structure:
 * [
 *   {"value": 1, "label_en": "Population, 2021", "label_fr": "Population, 2021", "metadata": "..."},
 *   ...
 * ]
 * Only "value" is required.
 */
public class JsonLabelSource implements LabelSource {

    private static final Logger logger = LoggerFactory.getLogger(JsonLabelSource.class);

    private final Path file;
    private final String name;

    public JsonLabelSource(Path file) {
        this(file, stripExtension(file.getFileName().toString()));
    }

    public JsonLabelSource(Path file, String name) {
        this.file = file;
        this.name = name;
    }

    @Override
    public List<LabelRecord> fetch() throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Label file not found: " + file);
        }
        List<LabelRecord> records = parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
        logger.info("Read {} label records from {}", records.size(), file);
        return records;
    }

    /**
     * Parse a JSON array of label objects.
     *
     * @throws IllegalArgumentException if the structure is invalid
     */
    public static List<LabelRecord> parse(String content, String origin) {
        Object root;
        try {
            root = JSON.parse(content);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed label JSON in " + origin + ": " + e.getMessage(), e);
        }
        if (!(root instanceof JSONArray)) {
            throw new IllegalArgumentException("Label file " + origin + " must contain a JSON array");
        }

        JSONArray array = (JSONArray) root;
        List<LabelRecord> records = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object item = array.get(i);
            if (!(item instanceof JSONObject)) {
                throw new IllegalArgumentException("Label #" + i + " in " + origin + " is not an object");
            }
            JSONObject obj = (JSONObject) item;
            if (!obj.containsKey("value")) {
                throw new IllegalArgumentException("Label #" + i + " in " + origin + " has no value");
            }
            Long value = integralValue(obj.get("value"));
            if (value == null) {
                throw new IllegalArgumentException("Label #" + i + " in " + origin + " has a non-numeric value: "
                    + obj.get("value"));
            }
            records.add(new LabelRecord(value,
                obj.getString("label_en"),
                obj.getString("label_fr"),
                obj.getString("metadata")));
        }
        return records;
    }

    /**
     * @return the value as a long, or null unless it is a whole number within range
     */
    private static Long integralValue(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger) {
            BigInteger big = (BigInteger) raw;
            return big.bitLength() < 64 ? big.longValue() : null;
        }
        if (raw instanceof BigDecimal) {
            try {
                return ((BigDecimal) raw).longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            return d == Math.rint(d) && Math.abs(d) < 0x1p63 ? (long) d : null;
        }
        return null;
    }

    @Override
    public String getName() {
        return name;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

package pl.marcinmilkowski.ident_gen.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.naming.DuplicateNameResolver;
import pl.marcinmilkowski.ident_gen.naming.DuplicateValueException;
import pl.marcinmilkowski.ident_gen.naming.EnumEntry;
import pl.marcinmilkowski.ident_gen.naming.IdentifierCleaner;
import pl.marcinmilkowski.ident_gen.substitution.SubstitutionEngine;
import pl.marcinmilkowski.ident_gen.tracking.WordTracker;

import java.util.*;

/**
 * Turns one batch of label records into identifier entries.
 *
 * Per record: substitute the primary label (reporting unabbreviated words to the
 * tracker), clean it into a name, build the comment from both labels and the
 * metadata. The batch is then passed through duplicate resolution.
 *
 * The same records always produce the same entries, in input order.
 */
public class EnumGenerator {

    private static final Logger logger = LoggerFactory.getLogger(EnumGenerator.class);

    public static final String DEFAULT_FALLBACK_PREFIX = "CODE";

    private final SubstitutionEngine engine;
    private final DuplicateNameResolver resolver;
    private final WordTracker tracker;
    private final String fallbackPrefix;

    /**
     * @param tracker receives unabbreviated words; may be null to disable tracking
     */
    public EnumGenerator(SubstitutionEngine engine, DuplicateNameResolver resolver, WordTracker tracker) {
        this(engine, resolver, tracker, DEFAULT_FALLBACK_PREFIX);
    }

    /**
     * @param fallbackPrefix name prefix for records without a primary label ({@code PREFIX_value})
     */
    public EnumGenerator(SubstitutionEngine engine, DuplicateNameResolver resolver, WordTracker tracker,
                         String fallbackPrefix) {
        this.engine = engine;
        this.resolver = resolver;
        this.tracker = tracker;
        this.fallbackPrefix = fallbackPrefix;
    }

    /**
     * Generate entries for a batch.
     *
     * @param records Label records, values unique
     * @param sourceTag Where the records came from, recorded by the tracker
     * @throws DuplicateValueException if two records share a value
     */
    public List<EnumEntry> generate(List<LabelRecord> records, String sourceTag) {
        checkUniqueValues(records);
        String sentinel = engine.getConfig().sentinelName();

        List<EnumEntry> entries = new ArrayList<>(records.size());
        List<String> labels = new ArrayList<>(records.size());
        for (LabelRecord record : records) {
            String name;
            String label;
            if (record.hasPrimaryLabel()) {
                label = record.primaryLabel();
                String substituted = engine.substitute(label);
                if (tracker != null) {
                    tracker.track(label, substituted, sourceTag);
                }
                name = IdentifierCleaner.prepareName(substituted, null, false, sentinel);
            } else {
                label = fallbackPrefix + "_" + record.value();
                name = IdentifierCleaner.prepareName(label, null, false, sentinel);
                logger.debug("No label for value {}, using {}", record.value(), name);
            }
            entries.add(new EnumEntry(name, record.value(), comment(record)));
            labels.add(label);
        }

        List<EnumEntry> resolved = resolver.resolve(entries, labels);
        logger.info("Generated {} entries for {}", resolved.size(), sourceTag);
        return resolved;
    }

    /**
     * {@code primary // secondary | metadata}, omitting missing parts.
     */
    static String comment(LabelRecord record) {
        StringBuilder sb = new StringBuilder();
        if (record.primaryLabel() != null) {
            sb.append(record.primaryLabel().strip());
        }
        if (record.secondaryLabel() != null && !record.secondaryLabel().isBlank()) {
            sb.append(sb.length() > 0 ? " // " : "").append(record.secondaryLabel().strip());
        }
        if (record.metadata() != null && !record.metadata().isBlank()) {
            sb.append(sb.length() > 0 ? " | " : "").append(record.metadata().strip());
        }
        return sb.toString();
    }

    private static void checkUniqueValues(List<LabelRecord> records) {
        Set<Long> seen = new HashSet<>();
        Set<Long> duplicates = new LinkedHashSet<>();
        for (LabelRecord record : records) {
            if (!seen.add(record.value())) {
                duplicates.add(record.value());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DuplicateValueException(new ArrayList<>(duplicates));
        }
    }
}

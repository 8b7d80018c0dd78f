package pl.marcinmilkowski.ident_gen.substitution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Run-scoped cache of built lookup tables, keyed by the configuration that produced them.
 *
 * Bounded: once {@code capacity} tables are held, further tables are built but not
 * cached. Nothing is ever evicted. The check-then-insert sequence runs under a lock
 * so concurrent engines with the same configuration build the table once.
 */
public class LookupTableCache {

    private static final Logger logger = LoggerFactory.getLogger(LookupTableCache.class);

    public static final int DEFAULT_CAPACITY = 8;

    private final int capacity;
    private final Map<Key, List<SubstitutionPattern>> tables = new HashMap<>();
    private int hits;
    private int misses;

    public LookupTableCache() {
        this(DEFAULT_CAPACITY);
    }

    public LookupTableCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Configuration a lookup table depends on.
     */
    public record Key(
        AbbreviationMap abbreviations,
        boolean includeInflections,
        boolean includeDerivations,
        int maxVariantsPerWord,
        String providerName
    ) {
    }

    /**
     * Return the cached table for the key, building it with {@code builder} on a miss.
     */
    public synchronized List<SubstitutionPattern> getOrBuild(Key key, Supplier<List<SubstitutionPattern>> builder) {
        List<SubstitutionPattern> table = tables.get(key);
        if (table != null) {
            hits++;
            logger.debug("Lookup table cache hit ({} patterns)", table.size());
            return table;
        }
        misses++;
        table = List.copyOf(builder.get());
        if (tables.size() < capacity) {
            tables.put(key, table);
        } else {
            logger.debug("Lookup table cache full ({}), table not cached", capacity);
        }
        return table;
    }

    public synchronized int size() {
        return tables.size();
    }

    public synchronized int getHits() {
        return hits;
    }

    public synchronized int getMisses() {
        return misses;
    }

    public int getCapacity() {
        return capacity;
    }
}

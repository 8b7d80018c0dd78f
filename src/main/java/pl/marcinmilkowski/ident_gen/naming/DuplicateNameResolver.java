package pl.marcinmilkowski.ident_gen.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.substitution.SubstitutionEngine;

import java.util.*;

/**
 * Eliminates name collisions in a batch of generated entries.
 *
 * Passes:
 * 1. colliding entries are renamed from their original label with truncation disabled
 *    (a cut-off qualifier clause often is what tells two labels apart);
 * 2. entries still sharing a name are sorted by value and get a positional suffix
 *    _1, _2, ... (zero-padded to width 2 above 10 members, width 3 above 100);
 * 3. any collision left is fatal ({@link DuplicateNameException}).
 *
 * Duplicate values are rejected before any renaming ({@link DuplicateValueException}).
 * Input lists are never modified; a new list is returned.
 */
public class DuplicateNameResolver {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateNameResolver.class);

    private final SubstitutionEngine engine;
    private final String sentinelName;

    /**
     * @param engine the engine that produced the names, so recomputed names stay consistent
     */
    public DuplicateNameResolver(SubstitutionEngine engine, String sentinelName) {
        this.engine = engine;
        this.sentinelName = sentinelName;
    }

    /**
     * Resolve collisions.
     *
     * @param entries Generated entries
     * @param originalLabels Label each entry was generated from, same order and size
     * @return Entries with pairwise distinct names, in input order
     */
    public List<EnumEntry> resolve(List<EnumEntry> entries, List<String> originalLabels) {
        if (entries.size() != originalLabels.size()) {
            throw new IllegalArgumentException("Entries length " + entries.size()
                + " does not match original labels length " + originalLabels.size());
        }
        EntryBatch.checkUniqueValues(entries);

        List<EnumEntry> resolved = new ArrayList<>(entries);
        Map<String, List<Integer>> duplicates = EntryBatch.duplicateNames(resolved);
        if (duplicates.isEmpty()) {
            return resolved;
        }

        logger.info("Resolving {} duplicate names ({} entries)...", duplicates.size(), countMembers(duplicates));
        recoverFromTruncation(resolved, originalLabels, duplicates);

        duplicates = EntryBatch.duplicateNames(resolved);
        if (!duplicates.isEmpty()) {
            logger.info("Adding suffixes to {} names still shared by {} entries", duplicates.size(), countMembers(duplicates));
            assignSuffixes(resolved, duplicates);
        }

        Map<String, List<Long>> remaining = EntryBatch.describeCollisions(resolved);
        if (!remaining.isEmpty()) {
            throw new DuplicateNameException("Duplicate enum names remain after resolution", remaining);
        }
        return resolved;
    }

    private void recoverFromTruncation(List<EnumEntry> entries, List<String> labels,
                                       Map<String, List<Integer>> duplicates) {
        for (List<Integer> indices : duplicates.values()) {
            for (int index : indices) {
                String name = IdentifierCleaner.prepareName(labels.get(index), engine, false, sentinelName);
                EnumEntry entry = entries.get(index);
                if (!name.equals(entry.name())) {
                    logger.debug("Untruncated rename {} -> {} (value {})", entry.name(), name, entry.value());
                    entries.set(index, entry.withName(name));
                }
            }
        }
    }

    private static void assignSuffixes(List<EnumEntry> entries, Map<String, List<Integer>> duplicates) {
        for (List<Integer> indices : duplicates.values()) {
            List<Integer> group = new ArrayList<>(indices);
            group.sort(Comparator.comparingLong(i -> entries.get(i).value()));
            int size = group.size();
            String format = size > 100 ? "%03d" : size > 10 ? "%02d" : "%d";
            for (int position = 1; position <= size; position++) {
                int index = group.get(position - 1);
                EnumEntry entry = entries.get(index);
                entries.set(index, entry.withName(entry.name() + "_" + String.format(format, position)));
            }
        }
    }

    private static int countMembers(Map<String, List<Integer>> duplicates) {
        int count = 0;
        for (List<Integer> indices : duplicates.values()) {
            count += indices.size();
        }
        return count;
    }
}

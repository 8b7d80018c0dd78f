package pl.marcinmilkowski.ident_gen.naming;

import java.util.*;

/**
 * Batch-level checks over generated entries: name and value uniqueness, name case.
 */
public final class EntryBatch {

    private EntryBatch() {
    }

    /**
     * Names used by more than one entry, mapped to the indices of all their members.
     * Iteration follows the first occurrence of each name.
     */
    public static Map<String, List<Integer>> duplicateNames(List<EnumEntry> entries) {
        Map<String, List<Integer>> byName = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            byName.computeIfAbsent(entries.get(i).name(), k -> new ArrayList<>()).add(i);
        }
        byName.values().removeIf(indices -> indices.size() < 2);
        return byName;
    }

    /**
     * Values used by more than one entry, mapped to the indices of all their members.
     */
    public static Map<Long, List<Integer>> duplicateValues(List<EnumEntry> entries) {
        Map<Long, List<Integer>> byValue = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            byValue.computeIfAbsent(entries.get(i).value(), k -> new ArrayList<>()).add(i);
        }
        byValue.values().removeIf(indices -> indices.size() < 2);
        return byValue;
    }

    /**
     * Colliding names with the values of their members, for error reports.
     */
    public static Map<String, List<Long>> describeCollisions(List<EnumEntry> entries) {
        Map<String, List<Long>> collisions = new LinkedHashMap<>();
        duplicateNames(entries).forEach((name, indices) -> {
            List<Long> values = new ArrayList<>(indices.size());
            for (int index : indices) {
                values.add(entries.get(index).value());
            }
            collisions.put(name, values);
        });
        return collisions;
    }

    /**
     * Throw if the batch has duplicate values.
     *
     * @throws DuplicateValueException listing each duplicated value once
     */
    public static void checkUniqueValues(List<EnumEntry> entries) {
        Map<Long, List<Integer>> duplicates = duplicateValues(entries);
        if (!duplicates.isEmpty()) {
            throw new DuplicateValueException(new ArrayList<>(duplicates.keySet()));
        }
    }

    /**
     * Validate a finished batch: unique names, unique values, and optionally uppercase names.
     */
    public static void validate(List<EnumEntry> entries, boolean checkCase) {
        Map<String, List<Long>> collisions = describeCollisions(entries);
        if (!collisions.isEmpty()) {
            throw new DuplicateNameException("Duplicate enum names found", collisions);
        }
        checkUniqueValues(entries);
        if (checkCase) {
            List<String> invalid = new ArrayList<>();
            for (EnumEntry entry : entries) {
                if (!EnumEntry.isUpperCase(entry.name())) {
                    invalid.add(entry.name());
                }
            }
            if (!invalid.isEmpty()) {
                throw new InvalidNameException("Enum names must be uppercase: " + invalid);
            }
        }
    }
}

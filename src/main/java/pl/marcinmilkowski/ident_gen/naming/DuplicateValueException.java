package pl.marcinmilkowski.ident_gen.naming;

import java.util.List;

/**
 * Exception thrown when two records of a batch share a value. Fatal for the batch.
 */
public class DuplicateValueException extends NamingException {

    private final List<Long> duplicateValues;

    public DuplicateValueException(List<Long> duplicateValues) {
        super("Duplicate values found: " + duplicateValues);
        this.duplicateValues = List.copyOf(duplicateValues);
    }

    public DuplicateValueException(String message, List<Long> duplicateValues) {
        super(message);
        this.duplicateValues = List.copyOf(duplicateValues);
    }

    public List<Long> getDuplicateValues() {
        return duplicateValues;
    }
}

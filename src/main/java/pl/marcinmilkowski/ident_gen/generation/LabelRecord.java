package pl.marcinmilkowski.ident_gen.generation;

/**
 * One upstream record: a numeric value and its human-readable labels.
 *
 * @param value identifier value, unique within a batch
 * @param primaryLabel label the identifier name is derived from; may be null
 * @param secondaryLabel second-language label, comment only; may be null
 * @param metadata free text appended to the comment; may be null
 */
public record LabelRecord(long value, String primaryLabel, String secondaryLabel, String metadata) {

    public LabelRecord(long value, String primaryLabel) {
        this(value, primaryLabel, null, null);
    }

    public boolean hasPrimaryLabel() {
        return primaryLabel != null && !primaryLabel.isBlank();
    }
}

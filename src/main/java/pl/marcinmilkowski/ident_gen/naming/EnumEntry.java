package pl.marcinmilkowski.ident_gen.naming;

import java.util.regex.Pattern;

/**
 * One generated identifier: a name, its numeric value and an optional single-line comment.
 *
 * Immutable; duplicate resolution replaces entries through {@link #withName(String)}.
 * Uniqueness across a batch is checked by {@link EntryBatch}, not here.
 */
public record EnumEntry(String name, long value, String comment) {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    public EnumEntry {
        validateName(name, false);
        if (comment != null) {
            comment = WHITESPACE_RUNS.matcher(comment.strip()).replaceAll(" ");
            if (comment.isEmpty()) {
                comment = null;
            }
        }
    }

    public EnumEntry(String name, long value) {
        this(name, value, null);
    }

    /**
     * Check the identifier grammar, and optionally that the name is fully uppercase.
     *
     * @throws InvalidNameException if the name is invalid
     */
    public static void validateName(String name, boolean checkCase) {
        if (name == null || name.isEmpty()) {
            throw new InvalidNameException("Enum name cannot be empty");
        }
        if (Character.isDigit(name.charAt(0))) {
            throw new InvalidNameException("Enum name cannot start with a digit: " + name);
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new InvalidNameException("Enum name contains invalid characters: " + name);
        }
        if (checkCase && !isUpperCase(name)) {
            throw new InvalidNameException("Enum name must be uppercase: " + name);
        }
    }

    // names without letters (_2021) count as uppercase
    static boolean isUpperCase(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (Character.isLowerCase(name.charAt(i))) return false;
        }
        return true;
    }

    public EnumEntry withName(String newName) {
        return new EnumEntry(newName, value, comment);
    }

    /**
     * Renders the generated source line: {@code NAME = value  # comment}.
     */
    @Override
    public String toString() {
        return name + " = " + value + (comment != null ? "  # " + comment : "");
    }
}

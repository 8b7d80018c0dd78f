package pl.marcinmilkowski.ident_gen.config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A short token and the full terms or phrases it may replace.
 */
public record AbbreviationRule(String abbreviation, List<String> fullTerms) {

    private static final Pattern ABBREVIATION = Pattern.compile("^[a-z_][a-z0-9_]*$");

    public AbbreviationRule {
        if (abbreviation == null || !ABBREVIATION.matcher(abbreviation).matches()) {
            throw new IllegalArgumentException("Invalid abbreviation '" + abbreviation
                + "': must be a lowercase identifier token");
        }
        if (fullTerms == null || fullTerms.isEmpty()) {
            throw new IllegalArgumentException("Abbreviation '" + abbreviation + "' has no full terms");
        }
        for (String term : fullTerms) {
            if (term == null || term.isBlank()) {
                throw new IllegalArgumentException("Abbreviation '" + abbreviation + "' has a blank full term");
            }
        }
        fullTerms = List.copyOf(fullTerms);
    }

    public static AbbreviationRule of(String abbreviation, String... fullTerms) {
        return new AbbreviationRule(abbreviation, List.of(fullTerms));
    }

    /**
     * True if the term is a single word (no whitespace), i.e. eligible for variant expansion.
     */
    public static boolean isSingleWord(String term) {
        return term.trim().split("\\s+").length == 1;
    }
}

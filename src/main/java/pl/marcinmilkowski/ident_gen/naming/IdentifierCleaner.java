package pl.marcinmilkowski.ident_gen.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.substitution.SubstitutionEngine;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes arbitrary text into an identifier token.
 *
 * Steps, in order:
 * 1. separators (whitespace, - = / . ~ , : ; &amp; + |) become '_'
 * 2. quote characters are removed
 * 3. superscript and subscript digits become plain digits
 * 4. NFD decomposition, combining marks dropped (é -> e)
 * 5. anything outside [A-Za-z0-9_] is removed
 * 6. runs of '_' collapse, leading/trailing '_' are stripped
 * 7. a leading digit gets a '_' prefix
 * 8. optional uppercasing
 *
 * The result of a successful clean is a fixed point: clean(clean(s)) == clean(s).
 */
public final class IdentifierCleaner {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierCleaner.class);

    private static final String SEPARATORS = "-=/.~,:;&+|";
    private static final String QUOTES = "'\"`‘’‚‛“”„´";
    private static final String SUPER_SUB_DIGITS =
        "⁰¹²³⁴⁵⁶⁷⁸⁹"
        + "₀₁₂₃₄₅₆₇₈₉";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]+");
    private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_+");

    private IdentifierCleaner() {
    }

    /**
     * Clean to an uppercase identifier.
     */
    public static String clean(String s) {
        return clean(s, true);
    }

    /**
     * Clean text into an identifier token.
     *
     * @throws InvalidNameException if the input is null, empty, or cleans to nothing
     */
    public static String clean(String s, boolean uppercase) {
        if (s == null || s.isEmpty()) {
            throw new InvalidNameException("Cannot clean empty string");
        }

        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c) || SEPARATORS.indexOf(c) >= 0) {
                sb.append('_');
            } else if (QUOTES.indexOf(c) >= 0) {
                continue;
            } else {
                int digit = SUPER_SUB_DIGITS.indexOf(c);
                sb.append(digit >= 0 ? (char) ('0' + digit % 10) : c);
            }
        }

        String result = Normalizer.normalize(sb, Normalizer.Form.NFD);
        result = COMBINING_MARKS.matcher(result).replaceAll("");
        result = INVALID_CHARS.matcher(result).replaceAll("");
        result = UNDERSCORE_RUNS.matcher(result).replaceAll("_");
        result = stripUnderscores(result);

        if (result.isEmpty()) {
            throw new InvalidNameException("String cleans to an empty identifier: '" + s + "'");
        }
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return uppercase ? result.toUpperCase(Locale.ROOT) : result;
    }

    /**
     * Substitute, then clean. Falls back to {@code sentinel} when cleaning leaves nothing.
     *
     * @param engine may be null to skip substitution
     */
    public static String prepareName(String text, SubstitutionEngine engine, boolean truncate, String sentinel) {
        String substituted = engine != null ? engine.substitute(text, truncate) : text;
        try {
            return clean(substituted);
        } catch (InvalidNameException e) {
            logger.warn("Using '{}' for label '{}': {}", sentinel, text, e.getMessage());
            return sentinel;
        }
    }

    private static String stripUnderscores(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        return s.substring(start, end);
    }
}

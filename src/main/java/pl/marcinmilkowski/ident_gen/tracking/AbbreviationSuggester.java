package pl.marcinmilkowski.ident_gen.tracking;

import java.util.Locale;

/**
 * Heuristic abbreviation for a word that has no rule yet.
 *
 * Suggestions are a starting point for a human reviewer, not a final choice.
 */
public final class AbbreviationSuggester {

    private static final String VOWELS = "aeiou";

    private AbbreviationSuggester() {
    }

    public static String suggest(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        if (w.length() <= 4) {
            return prefix(w, 3);
        }
        if (w.length() <= 6) {
            return prefix(w, 4);
        }
        if (w.endsWith("tion") || w.endsWith("ment")) {
            return prefix(w, 4);
        }
        if (w.endsWith("ing")) {
            return prefix(w.substring(0, w.length() - 3), 4);
        }
        if (w.endsWith("ness")) {
            return prefix(w.substring(0, w.length() - 4), 4);
        }

        // first letter plus up to three consonants, padded with the last letter
        StringBuilder sb = new StringBuilder().append(w.charAt(0));
        for (int i = 1; i < w.length() && sb.length() < 4; i++) {
            char c = w.charAt(i);
            if (Character.isLetter(c) && VOWELS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        while (sb.length() < 4) {
            sb.append(w.charAt(w.length() - 1));
        }
        return sb.toString();
    }

    private static String prefix(String s, int length) {
        return s.length() <= length ? s : s.substring(0, length);
    }
}

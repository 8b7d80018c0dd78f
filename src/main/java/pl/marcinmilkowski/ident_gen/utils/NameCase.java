package pl.marcinmilkowski.ident_gen.utils;

import java.util.Locale;

/**
 * Case conversions between class names, module file names and display titles.
 */
public final class NameCase {

    private NameCase() {
    }

    /**
     * frequency_codes -> FrequencyCodes. Separators are '_', '-' and whitespace.
     */
    public static String snakeToCamel(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean upper = true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '_' || c == '-' || Character.isWhitespace(c)) {
                upper = true;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * FrequencyCodes -> frequency_codes; acronyms stay together (WDSCode -> wds_code).
     */
    public static String camelToSnake(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                char prev = s.charAt(i - 1);
                boolean nextLower = i + 1 < s.length() && Character.isLowerCase(s.charAt(i + 1));
                if (Character.isLowerCase(prev) || Character.isDigit(prev)
                    || (Character.isUpperCase(prev) && nextLower)) {
                    sb.append('_');
                }
            }
            sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * FrequencyCodes -> Frequency Codes
     */
    public static String camelToTitle(String s) {
        String[] words = camelToSnake(s).split("_");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}

package pl.marcinmilkowski.ident_gen.morph;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Rule-based generator of regular English inflections.
 *
 * Produces noun plurals and verb forms (third person, past, present participle)
 * from a base form. Irregular forms come from a small lookup table. Forms are not
 * checked against a dictionary; a generated non-word simply never matches a label.
 */
public final class EnglishInflector {

    private static final Map<String, List<String>> IRREGULAR = new HashMap<>();

    static {
        IRREGULAR.put("child", List.of("children"));
        IRREGULAR.put("person", List.of("people", "persons"));
        IRREGULAR.put("man", List.of("men"));
        IRREGULAR.put("woman", List.of("women"));
        IRREGULAR.put("foot", List.of("feet"));
        IRREGULAR.put("tooth", List.of("teeth"));
        IRREGULAR.put("mouse", List.of("mice"));
        IRREGULAR.put("datum", List.of("data"));
        IRREGULAR.put("medium", List.of("media", "mediums"));
        IRREGULAR.put("criterion", List.of("criteria"));
        IRREGULAR.put("analysis", List.of("analyses"));
        IRREGULAR.put("index", List.of("indices", "indexes"));
        IRREGULAR.put("be", List.of("is", "are", "was", "were", "been", "being"));
        IRREGULAR.put("have", List.of("has", "had", "having"));
        IRREGULAR.put("do", List.of("does", "did", "done", "doing"));
        IRREGULAR.put("go", List.of("goes", "went", "gone", "going"));
        IRREGULAR.put("build", List.of("builds", "built", "building"));
        IRREGULAR.put("buy", List.of("buys", "bought", "buying"));
        IRREGULAR.put("sell", List.of("sells", "sold", "selling"));
        IRREGULAR.put("make", List.of("makes", "made", "making"));
        IRREGULAR.put("pay", List.of("pays", "paid", "paying"));
        IRREGULAR.put("spend", List.of("spends", "spent", "spending"));
        IRREGULAR.put("hold", List.of("holds", "held", "holding"));
        IRREGULAR.put("grow", List.of("grows", "grew", "grown", "growing"));
        IRREGULAR.put("lead", List.of("leads", "led", "leading"));
        IRREGULAR.put("leave", List.of("leaves", "left", "leaving"));
    }

    private static final Pattern SIBILANT_ENDING = Pattern.compile(".*(s|x|z|ch|sh)$");
    private static final Pattern CONSONANT_Y = Pattern.compile(".*[^aeiou]y$");
    // Short stressed stems whose final consonant doubles: plan -> planned, ship -> shipping
    private static final Pattern DOUBLING = Pattern.compile("^[^aeiou]*[aeiou][bdgklmnprt]$");
    private static final Pattern SILENT_E = Pattern.compile(".*[^aeioy]e$");

    private EnglishInflector() {
    }

    /**
     * Generate inflected forms of a lowercase base form, the base form included.
     */
    public static Set<String> inflect(String base) {
        String word = base.toLowerCase(Locale.ROOT);
        Set<String> forms = new LinkedHashSet<>();
        forms.add(word);

        List<String> irregular = IRREGULAR.get(word);
        if (irregular != null) {
            forms.addAll(irregular);
        }

        String sForm = sForm(word);
        forms.add(sForm);
        forms.add(pastForm(word));
        forms.add(ingForm(word));
        return forms;
    }

    /**
     * Plural noun / third person singular verb.
     */
    static String sForm(String word) {
        if (CONSONANT_Y.matcher(word).matches()) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (SIBILANT_ENDING.matcher(word).matches()) {
            return word + "es";
        }
        return word + "s";
    }

    static String pastForm(String word) {
        if (word.endsWith("e")) {
            return word + "d";
        }
        if (CONSONANT_Y.matcher(word).matches()) {
            return word.substring(0, word.length() - 1) + "ied";
        }
        if (DOUBLING.matcher(word).matches()) {
            return word + word.charAt(word.length() - 1) + "ed";
        }
        return word + "ed";
    }

    static String ingForm(String word) {
        if (word.endsWith("ie")) {
            return word.substring(0, word.length() - 2) + "ying";
        }
        if (SILENT_E.matcher(word).matches() && word.length() > 2) {
            return word.substring(0, word.length() - 1) + "ing";
        }
        if (DOUBLING.matcher(word).matches()) {
            return word + word.charAt(word.length() - 1) + "ing";
        }
        return word + "ing";
    }
}

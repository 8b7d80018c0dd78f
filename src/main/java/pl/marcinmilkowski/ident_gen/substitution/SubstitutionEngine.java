package pl.marcinmilkowski.ident_gen.substitution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;
import pl.marcinmilkowski.ident_gen.config.AbbreviationRule;
import pl.marcinmilkowski.ident_gen.config.GeneratorConfig;
import pl.marcinmilkowski.ident_gen.morph.MorphologyProvider;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites free-form labels by replacing known terms with their abbreviations.
 *
 * The lookup table maps every full term (and, for single words, its morphological
 * variants) to an abbreviation. It is deduplicated by term, first seen wins, and
 * sorted by descending term length so that "population density" is tried before
 * "population".
 *
 * Substitution is case-insensitive on word boundaries and preserves the case shape
 * of the replaced span (POPULATION -> POP, Population -> Pop, population -> pop).
 * At most {@code maxSubstitutions} matches are replaced per call.
 *
 * Instances are not thread-safe (per-instance regex and variant caches).
 */
public class SubstitutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(SubstitutionEngine.class);

    private static final int REGEX_FLAGS =
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final AbbreviationMap abbreviations;
    private final GeneratorConfig config;
    private final VariantGenerator variantGenerator;
    private final List<SubstitutionPattern> lookup;
    private final Map<String, Pattern> regexCache = new HashMap<>();

    public SubstitutionEngine(AbbreviationMap abbreviations, MorphologyProvider provider, GeneratorConfig config) {
        this(abbreviations, provider, config, new LookupTableCache(0));
    }

    public SubstitutionEngine(AbbreviationMap abbreviations, MorphologyProvider provider,
                              GeneratorConfig config, LookupTableCache cache) {
        this.abbreviations = abbreviations;
        this.config = config;
        this.variantGenerator = new VariantGenerator(provider, config.maxVariantsPerWord());

        LookupTableCache.Key key = new LookupTableCache.Key(
            abbreviations,
            config.includeInflections(),
            config.includeDerivations(),
            config.maxVariantsPerWord(),
            provider.getName()
        );
        this.lookup = cache.getOrBuild(key, () -> buildLookup(
            abbreviations, variantGenerator, config.includeInflections(), config.includeDerivations()));
        logger.debug("Substitution engine ready: {} rules, {} patterns", abbreviations.size(), lookup.size());
    }

    /**
     * Build the term -> abbreviation lookup table.
     */
    static List<SubstitutionPattern> buildLookup(AbbreviationMap abbreviations, VariantGenerator variants,
                                                 boolean includeInflections, boolean includeDerivations) {
        Map<String, String> byTerm = new LinkedHashMap<>();
        boolean expand = includeInflections || includeDerivations;

        for (AbbreviationRule rule : abbreviations.getRules()) {
            for (String fullTerm : rule.fullTerms()) {
                String term = fullTerm.trim().toLowerCase(Locale.ROOT);
                byTerm.putIfAbsent(term, rule.abbreviation());
                if (!expand || !AbbreviationRule.isSingleWord(term)) {
                    continue;
                }
                for (String variant : variants.variants(term, includeInflections, includeDerivations)) {
                    if (!variant.equals(term)) {
                        byTerm.putIfAbsent(variant, rule.abbreviation());
                    }
                }
            }
        }

        List<SubstitutionPattern> table = new ArrayList<>(byTerm.size());
        byTerm.forEach((term, abbrev) -> table.add(new SubstitutionPattern(term, abbrev)));
        // stable: equal lengths keep insertion order
        table.sort(Comparator.comparingInt((SubstitutionPattern p) -> p.term().length()).reversed());

        logger.info("Built {} substitution patterns from {} abbreviation rules", table.size(), abbreviations.size());
        return table;
    }

    /**
     * Truncate, then substitute.
     */
    public String substitute(String text) {
        return substitute(text, true);
    }

    /**
     * Apply substitutions to the text, optionally truncating it first.
     *
     * @param text Input label
     * @param truncate Cut the label at the first truncation marker before substituting
     * @return Rewritten text; null and empty input are returned unchanged
     */
    public String substitute(String text, boolean truncate) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = truncate ? truncate(text) : text;
        int substitutions = 0;

        for (SubstitutionPattern pattern : lookup) {
            if (substitutions >= config.maxSubstitutions()) {
                break;
            }
            if (!containsIgnoreCase(result, pattern.term())) {
                continue;
            }

            Matcher matcher = regexFor(pattern.term()).matcher(result);
            List<int[]> spans = new ArrayList<>();
            while (matcher.find()) {
                spans.add(new int[] {matcher.start(), matcher.end()});
            }
            if (spans.isEmpty()) {
                continue;
            }

            // right to left keeps earlier offsets valid
            StringBuilder sb = new StringBuilder(result);
            for (int i = spans.size() - 1; i >= 0; i--) {
                int start = spans.get(i)[0];
                int end = spans.get(i)[1];
                sb.replace(start, end, matchCase(pattern.abbreviation(), result.substring(start, end)));
            }
            result = sb.toString();
            substitutions += spans.size();
        }
        return result;
    }

    /**
     * Cut the text at the first configured marker present in it (case-insensitive), trimming trailing whitespace.
     * Markers are tried in list order, so an earlier marker wins even if a later one occurs before it in the text.
     */
    public String truncate(String text) {
        return truncate(text, config.truncationMarkers());
    }

    public static String truncate(String text, List<String> markers) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            int pos = lower.indexOf(marker.toLowerCase(Locale.ROOT));
            if (pos != -1) {
                return text.substring(0, pos).stripTrailing();
            }
        }
        return text;
    }

    private Pattern regexFor(String term) {
        return regexCache.computeIfAbsent(term, t -> Pattern.compile("\\b" + Pattern.quote(t) + "\\b", REGEX_FLAGS));
    }

    private static boolean containsIgnoreCase(String text, String term) {
        int max = text.length() - term.length();
        for (int i = 0; i <= max; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Give the abbreviation the case shape of the span it replaces.
     */
    static String matchCase(String abbreviation, String matched) {
        if (isUpperCase(matched)) {
            return abbreviation.toUpperCase(Locale.ROOT);
        }
        if (!matched.isEmpty() && Character.isUpperCase(matched.charAt(0))) {
            String lower = abbreviation.toLowerCase(Locale.ROOT);
            return lower.isEmpty() ? lower : Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
        }
        return abbreviation.toLowerCase(Locale.ROOT);
    }

    /**
     * At least one cased character and no lowercase ones.
     */
    private static boolean isUpperCase(String s) {
        boolean cased = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    public List<SubstitutionPattern> getLookup() {
        return lookup;
    }

    public AbbreviationMap getAbbreviations() {
        return abbreviations;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    public VariantGenerator getVariantGenerator() {
        return variantGenerator;
    }
}

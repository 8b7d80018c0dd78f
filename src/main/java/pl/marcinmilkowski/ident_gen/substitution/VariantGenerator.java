package pl.marcinmilkowski.ident_gen.substitution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.config.AbbreviationRule;
import pl.marcinmilkowski.ident_gen.morph.MorphologyLookupException;
import pl.marcinmilkowski.ident_gen.morph.MorphologyProvider;

import java.util.*;

/**
 * Expands a word into its morphological variants through a {@link MorphologyProvider}.
 *
 * Provider failures are logged at debug level and treated as "no variants".
 * Results are cached per instance; instances are not thread-safe.
 */
public class VariantGenerator {

    private static final Logger logger = LoggerFactory.getLogger(VariantGenerator.class);

    private final MorphologyProvider provider;
    private final int maxVariantsPerWord;

    private final Map<String, List<String>> inflectionCache = new HashMap<>();
    private final Map<String, List<String>> derivationCache = new HashMap<>();
    private final Map<String, Set<String>> variantCache = new HashMap<>();

    public VariantGenerator(MorphologyProvider provider, int maxVariantsPerWord) {
        this.provider = provider;
        this.maxVariantsPerWord = maxVariantsPerWord;
    }

    /**
     * Variants of a word, lowercase, the word itself first.
     *
     * Derivational forms come first, then inflections of the word and of each
     * derivational form. At most {@code maxVariantsPerWord} variants besides the
     * word itself are returned.
     */
    public Set<String> variants(String word, boolean includeInflections, boolean includeDerivations) {
        String lower = word.toLowerCase(Locale.ROOT);
        String cacheKey = lower + '|' + includeInflections + '|' + includeDerivations;
        Set<String> cached = variantCache.get(cacheKey);
        if (cached != null) {
            return cached;
        }

        Set<String> variants = new LinkedHashSet<>();
        variants.add(lower);

        if (includeDerivations) {
            addCapped(variants, derivations(lower));
        }
        if (includeInflections) {
            for (String base : new ArrayList<>(variants)) {
                if (!AbbreviationRule.isSingleWord(base)) continue;
                addCapped(variants, inflections(base));
            }
        }

        Set<String> result = Collections.unmodifiableSet(variants);
        variantCache.put(cacheKey, result);
        return result;
    }

    private void addCapped(Set<String> variants, List<String> candidates) {
        for (String candidate : candidates) {
            if (variants.size() > maxVariantsPerWord) {
                return;
            }
            variants.add(candidate);
        }
    }

    /**
     * Inflected forms, lowercase and sorted so that table order does not depend on set iteration.
     */
    List<String> inflections(String word) {
        return inflectionCache.computeIfAbsent(word, w -> {
            try {
                return normalize(provider.getInflections(w));
            } catch (MorphologyLookupException | RuntimeException e) {
                logger.debug("No inflections for '{}': {}", w, e.getMessage());
                return List.of();
            }
        });
    }

    List<String> derivations(String word) {
        return derivationCache.computeIfAbsent(word, w -> {
            try {
                return normalize(provider.getDerivationalForms(w));
            } catch (MorphologyLookupException | RuntimeException e) {
                logger.debug("No derivational forms for '{}': {}", w, e.getMessage());
                return List.of();
            }
        });
    }

    private static List<String> normalize(Set<String> forms) {
        if (forms == null || forms.isEmpty()) {
            return List.of();
        }
        SortedSet<String> sorted = new TreeSet<>();
        for (String form : forms) {
            if (form == null) continue;
            // multi-word lemmas come joined with underscores (make_up)
            String normalized = form.replace('_', ' ').trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                sorted.add(normalized);
            }
        }
        return List.copyOf(sorted);
    }

    public MorphologyProvider getProvider() {
        return provider;
    }
}

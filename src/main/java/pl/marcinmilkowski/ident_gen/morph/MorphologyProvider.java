package pl.marcinmilkowski.ident_gen.morph;

import java.util.Set;

/**
 * Interface for morphology sources that expand a word into related word forms.
 *
 * Implementations may throw {@link MorphologyLookupException} or return an empty
 * set for unknown words. Callers treat both as "no variants".
 */
public interface MorphologyProvider {

    /**
     * Provider that knows no words.
     */
    MorphologyProvider NONE = new MorphologyProvider() {
        @Override
        public Set<String> getInflections(String word) {
            return Set.of();
        }

        @Override
        public Set<String> getDerivationalForms(String word) {
            return Set.of();
        }

        @Override
        public String getName() {
            return "none";
        }
    };

    /**
     * Get inflected forms of a word (plural, tense, participles).
     *
     * @param word The input word
     * @return Inflected forms, possibly including the word itself
     */
    Set<String> getInflections(String word) throws MorphologyLookupException;

    /**
     * Get derivationally related forms of a word (e.g. manage -> management).
     *
     * @param word The input word
     * @return Related forms; multi-word forms may be joined with underscores
     */
    Set<String> getDerivationalForms(String word) throws MorphologyLookupException;

    /**
     * Get the name of this provider. Part of the lookup table cache key.
     */
    String getName();
}

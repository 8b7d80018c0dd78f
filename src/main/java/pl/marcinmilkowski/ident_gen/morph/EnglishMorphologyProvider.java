package pl.marcinmilkowski.ident_gen.morph;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * English morphology from suffix rules and a stem-grouped lexicon.
 *
 * Inflections come from {@link EnglishInflector}; derivational forms are the
 * lexicon words sharing the word's Snowball stem.
 */
public class EnglishMorphologyProvider implements MorphologyProvider {

    private static final Pattern WORD = Pattern.compile("[A-Za-z][A-Za-z'-]*");

    private final StemLexicon lexicon;

    public EnglishMorphologyProvider(StemLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public Set<String> getInflections(String word) throws MorphologyLookupException {
        checkWord(word);
        return EnglishInflector.inflect(word);
    }

    @Override
    public Set<String> getDerivationalForms(String word) throws MorphologyLookupException {
        checkWord(word);
        return lexicon.relatedForms(word);
    }

    private static void checkWord(String word) throws MorphologyLookupException {
        if (word == null || !WORD.matcher(word).matches()) {
            throw new MorphologyLookupException("Malformed word: '" + word + "'");
        }
    }

    @Override
    public String getName() {
        return "english-rules+lexicon(" + lexicon.size() + ")";
    }
}

package pl.marcinmilkowski.ident_gen.tracking;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AbbreviationSuggesterTest {

    @Test
    void testShortWords() {
        assertEquals("wag", AbbreviationSuggester.suggest("wage"));
        assertEquals("inco", AbbreviationSuggester.suggest("Income"));
    }

    @Test
    void testSuffixes() {
        assertEquals("empl", AbbreviationSuggester.suggest("employment"));
        assertEquals("rece", AbbreviationSuggester.suggest("reception"));
        assertEquals("proc", AbbreviationSuggester.suggest("processing"));
        assertEquals("happ", AbbreviationSuggester.suggest("happiness"));
    }

    @Test
    void testConsonantSkeleton() {
        assertEquals("hshl", AbbreviationSuggester.suggest("household"));
        assertEquals("aqrm", AbbreviationSuggester.suggest("aquarium"));
    }

    @Test
    void testPaddedWithLastLetter() {
        assertEquals("oaaa", AbbreviationSuggester.suggest("ooaeaua"));
    }
}

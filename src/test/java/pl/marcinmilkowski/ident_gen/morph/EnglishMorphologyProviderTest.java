package pl.marcinmilkowski.ident_gen.morph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnglishMorphologyProviderTest {

    private EnglishMorphologyProvider provider;

    @BeforeEach
    void setUp() {
        provider = new EnglishMorphologyProvider(new StemLexicon(List.of("manage", "management", "manager")));
    }

    @Test
    void testInflections() throws MorphologyLookupException {
        assertTrue(provider.getInflections("manager").contains("managers"));
    }

    @Test
    void testDerivationalForms() throws MorphologyLookupException {
        assertTrue(provider.getDerivationalForms("manage").contains("management"));
        assertTrue(provider.getDerivationalForms("manage").contains("manager"));
    }

    @Test
    void testMalformedWordRejected() {
        assertThrows(MorphologyLookupException.class, () -> provider.getInflections("pop_2021"));
        assertThrows(MorphologyLookupException.class, () -> provider.getDerivationalForms(""));
        assertThrows(MorphologyLookupException.class, () -> provider.getDerivationalForms(null));
    }

    @Test
    void testNameIncludesLexiconSize() {
        assertEquals("english-rules+lexicon(3)", provider.getName());
    }

    @Test
    void testNoneProvider() throws MorphologyLookupException {
        assertTrue(MorphologyProvider.NONE.getInflections("manage").isEmpty());
        assertTrue(MorphologyProvider.NONE.getDerivationalForms("manage").isEmpty());
    }
}

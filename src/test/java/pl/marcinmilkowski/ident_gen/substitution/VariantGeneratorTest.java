package pl.marcinmilkowski.ident_gen.substitution;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VariantGeneratorTest {

    @Test
    void testWordFirstThenDerivationsThenInflections() {
        StubMorphologyProvider provider = new StubMorphologyProvider()
            .derivation("manage", "management")
            .inflection("manage", "manages")
            .inflection("management", "managements");
        Set<String> variants = new VariantGenerator(provider, 50).variants("Manage", true, true);
        assertArrayEquals(new String[] {"manage", "management", "manages", "managements"}, variants.toArray());
    }

    @Test
    void testVariantCap() {
        StubMorphologyProvider provider = new StubMorphologyProvider()
            .inflection("tax", "taxa", "taxb", "taxc", "taxd", "taxe");
        Set<String> variants = new VariantGenerator(provider, 3).variants("tax", true, true);
        assertEquals(4, variants.size());
        assertTrue(variants.contains("tax"));
    }

    @Test
    void testFlags() {
        StubMorphologyProvider provider = new StubMorphologyProvider()
            .derivation("manage", "management")
            .inflection("manage", "manages");
        VariantGenerator generator = new VariantGenerator(provider, 50);
        assertEquals(Set.of("manage", "manages"), generator.variants("manage", true, false));
        assertEquals(Set.of("manage", "management"), generator.variants("manage", false, true));
        assertEquals(Set.of("manage"), generator.variants("manage", false, false));
    }

    @Test
    void testMultiWordFormsUseSpaces() {
        StubMorphologyProvider provider = new StubMorphologyProvider().derivation("makeup", "make_up");
        assertTrue(new VariantGenerator(provider, 50).variants("makeup", false, true).contains("make up"));
    }

    @Test
    void testFailureMeansNoVariants() {
        VariantGenerator generator = new VariantGenerator(new StubMorphologyProvider(), 50);
        assertEquals(Set.of(StubMorphologyProvider.FAILING_WORD),
            generator.variants(StubMorphologyProvider.FAILING_WORD, true, true));
    }

    @Test
    void testResultsCached() {
        StubMorphologyProvider provider = new StubMorphologyProvider().inflection("tax", "taxes");
        VariantGenerator generator = new VariantGenerator(provider, 50);
        generator.variants("tax", true, true);
        int lookups = provider.getLookups();
        generator.variants("tax", true, true);
        generator.inflections("tax");
        assertEquals(lookups, provider.getLookups());
    }
}

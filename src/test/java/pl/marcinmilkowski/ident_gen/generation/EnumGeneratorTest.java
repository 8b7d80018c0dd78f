package pl.marcinmilkowski.ident_gen.generation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;
import pl.marcinmilkowski.ident_gen.config.AbbreviationRule;
import pl.marcinmilkowski.ident_gen.config.GeneratorConfig;
import pl.marcinmilkowski.ident_gen.morph.MorphologyProvider;
import pl.marcinmilkowski.ident_gen.naming.DuplicateNameResolver;
import pl.marcinmilkowski.ident_gen.naming.DuplicateValueException;
import pl.marcinmilkowski.ident_gen.naming.EnumEntry;
import pl.marcinmilkowski.ident_gen.substitution.SubstitutionEngine;
import pl.marcinmilkowski.ident_gen.tracking.WordTracker;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnumGeneratorTest {

    private SubstitutionEngine engine;
    private DuplicateNameResolver resolver;
    private WordTracker tracker;
    private EnumGenerator generator;

    @BeforeEach
    void setUp() {
        engine = new SubstitutionEngine(
            new AbbreviationMap(List.of(
                AbbreviationRule.of("pop", "population"),
                AbbreviationRule.of("ind", "industry"))),
            MorphologyProvider.NONE, GeneratorConfig.defaults());
        resolver = new DuplicateNameResolver(engine, "UNKNOWN");
        tracker = new WordTracker();
        generator = new EnumGenerator(engine, resolver, tracker);
    }

    @Test
    void testGenerate() {
        List<EnumEntry> entries = generator.generate(List.of(
            new LabelRecord(1, "Population", "Population", "Census"),
            new LabelRecord(2, null, "Inconnu", null),
            new LabelRecord(3, "Industry - total", "Industrie - total", null)), "CodeSet:test");

        assertEquals(3, entries.size());
        assertEquals(new EnumEntry("POP", 1, "Population // Population | Census"), entries.get(0));
        assertEquals(new EnumEntry("CODE_2", 2, "Inconnu"), entries.get(1));
        assertEquals(new EnumEntry("IND", 3, "Industry - total // Industrie - total"), entries.get(2));
    }

    @Test
    void testDeterministic() {
        List<LabelRecord> records = List.of(
            new LabelRecord(10, "Population"),
            new LabelRecord(11, "Population"),
            new LabelRecord(12, "Population - 2016 boundary"));
        List<EnumEntry> first = generator.generate(records, "s");
        List<EnumEntry> second = new EnumGenerator(engine, resolver, null).generate(records, "s");
        assertEquals(first, second);
        assertEquals(List.of("POP_1", "POP_2", "POP_2016_BOUNDARY"),
            first.stream().map(EnumEntry::name).toList());
    }

    @Test
    void testUnabbreviatedWordsTracked() {
        generator.generate(List.of(new LabelRecord(1, "Population of households")), "ProductID");
        assertEquals(1, tracker.getStats("households").orElseThrow().getFrequency());
        assertTrue(tracker.getStats("households").orElseThrow().getSources().contains("ProductID"));
        assertTrue(tracker.getStats("population").isEmpty());
    }

    @Test
    void testFallbackPrefix() {
        EnumGenerator products = new EnumGenerator(engine, resolver, null, "PRODUCT");
        List<EnumEntry> entries = products.generate(List.of(new LabelRecord(98100001, "  ")), "ProductID");
        assertEquals("PRODUCT_98100001", entries.get(0).name());
        assertNull(entries.get(0).comment());
    }

    @Test
    void testSentinelForUnusableLabel() {
        List<EnumEntry> entries = generator.generate(List.of(new LabelRecord(1, "???")), "s");
        assertEquals("UNKNOWN", entries.get(0).name());
    }

    @Test
    void testDuplicateValues() {
        DuplicateValueException e = assertThrows(DuplicateValueException.class, () -> generator.generate(List.of(
            new LabelRecord(1, "Population"),
            new LabelRecord(1, "Industry")), "s"));
        assertEquals(List.of(1L), e.getDuplicateValues());
    }
}

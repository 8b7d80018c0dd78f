package pl.marcinmilkowski.ident_gen.naming;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;
import pl.marcinmilkowski.ident_gen.config.AbbreviationRule;
import pl.marcinmilkowski.ident_gen.config.GeneratorConfig;
import pl.marcinmilkowski.ident_gen.morph.MorphologyProvider;
import pl.marcinmilkowski.ident_gen.substitution.SubstitutionEngine;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateNameResolverTest {

    private SubstitutionEngine engine;
    private DuplicateNameResolver resolver;

    @BeforeEach
    void setUp() {
        engine = new SubstitutionEngine(
            new AbbreviationMap(List.of(AbbreviationRule.of("pop", "population"))),
            MorphologyProvider.NONE, GeneratorConfig.defaults());
        resolver = new DuplicateNameResolver(engine, "UNKNOWN");
    }

    private List<EnumEntry> entriesFor(List<String> labels, List<Long> values) {
        List<EnumEntry> entries = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            entries.add(new EnumEntry(IdentifierCleaner.prepareName(labels.get(i), engine, true, "UNKNOWN"),
                values.get(i), labels.get(i)));
        }
        return entries;
    }

    @Test
    void testNoDuplicates() {
        List<String> labels = List.of("Population", "Households");
        List<EnumEntry> entries = entriesFor(labels, List.of(1L, 2L));
        assertEquals(entries, resolver.resolve(entries, labels));
    }

    @Test
    @DisplayName("Names cut short by truncation are recomputed from the full label")
    void testRecoverFromTruncation() {
        List<String> labels = List.of("Population - 2021 boundary", "Population - 2016 boundary");
        List<EnumEntry> entries = entriesFor(labels, List.of(200L, 100L));
        assertEquals("POP", entries.get(0).name());

        List<EnumEntry> resolved = resolver.resolve(entries, labels);
        assertEquals("POP_2021_BOUNDARY", resolved.get(0).name());
        assertEquals("POP_2016_BOUNDARY", resolved.get(1).name());
    }

    @Test
    @DisplayName("Suffixes follow value order, output keeps input order")
    void testSuffixByValue() {
        List<String> labels = List.of("Population", "Population");
        List<EnumEntry> resolved = resolver.resolve(entriesFor(labels, List.of(200L, 100L)), labels);
        assertEquals("POP_2", resolved.get(0).name());
        assertEquals(200, resolved.get(0).value());
        assertEquals("POP_1", resolved.get(1).name());
        assertEquals(100, resolved.get(1).value());
    }

    @Test
    void testSuffixPadding() {
        List<String> labels = new ArrayList<>();
        List<Long> values = new ArrayList<>();
        for (int i = 1; i <= 11; i++) {
            labels.add("Population");
            values.add((long) i);
        }
        List<EnumEntry> resolved = resolver.resolve(entriesFor(labels, values), labels);
        assertEquals("POP_01", resolved.get(0).name());
        assertEquals("POP_11", resolved.get(10).name());
    }

    @Test
    void testSuffixPaddingAboveHundred() {
        List<String> labels = new ArrayList<>();
        List<Long> values = new ArrayList<>();
        for (int i = 1; i <= 101; i++) {
            labels.add("Population");
            values.add((long) i);
        }
        List<EnumEntry> resolved = resolver.resolve(entriesFor(labels, values), labels);
        assertEquals("POP_001", resolved.get(0).name());
        assertEquals("POP_101", resolved.get(100).name());
    }

    @Test
    void testSentinelCollisions() {
        List<String> labels = List.of("???", "!!!");
        List<EnumEntry> entries = entriesFor(labels, List.of(5L, 6L));
        assertEquals("UNKNOWN", entries.get(0).name());

        List<EnumEntry> resolved = resolver.resolve(entries, labels);
        assertEquals("UNKNOWN_1", resolved.get(0).name());
        assertEquals("UNKNOWN_2", resolved.get(1).name());
    }

    @Test
    void testDuplicateValuesRejected() {
        List<String> labels = List.of("Population", "Households");
        List<EnumEntry> entries = entriesFor(labels, List.of(1L, 1L));
        DuplicateValueException e = assertThrows(DuplicateValueException.class,
            () -> resolver.resolve(entries, labels));
        assertEquals(List.of(1L), e.getDuplicateValues());
    }

    @Test
    void testUnresolvableCollision() {
        List<String> labels = List.of("Population", "Population", "Population 1");
        List<EnumEntry> entries = entriesFor(labels, List.of(1L, 2L, 3L));
        assertEquals("POP_1", entries.get(2).name());

        DuplicateNameException e = assertThrows(DuplicateNameException.class,
            () -> resolver.resolve(entries, labels));
        assertEquals(List.of(1L, 3L), e.getCollisions().get("POP_1"));
    }

    @Test
    void testSizeMismatch() {
        List<EnumEntry> entries = entriesFor(List.of("Population"), List.of(1L));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(entries, List.of()));
    }

    @Test
    void testInputNotModified() {
        List<String> labels = List.of("Population", "Population");
        List<EnumEntry> entries = entriesFor(labels, List.of(1L, 2L));
        List<EnumEntry> copy = List.copyOf(entries);
        resolver.resolve(entries, labels);
        assertEquals(copy, entries);
    }
}

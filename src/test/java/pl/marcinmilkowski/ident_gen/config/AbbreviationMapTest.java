package pl.marcinmilkowski.ident_gen.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AbbreviationMapTest {

    @Test
    void testRuleValidation() {
        assertThrows(IllegalArgumentException.class, () -> AbbreviationRule.of("Pop", "population"));
        assertThrows(IllegalArgumentException.class, () -> AbbreviationRule.of("2pop", "population"));
        assertThrows(IllegalArgumentException.class, () -> AbbreviationRule.of("pop"));
        assertThrows(IllegalArgumentException.class, () -> AbbreviationRule.of("pop", "  "));
        assertEquals("pop_dens", AbbreviationRule.of("pop_dens", "population density").abbreviation());
    }

    @Test
    void testSingleWord() {
        assertTrue(AbbreviationRule.isSingleWord("population"));
        assertTrue(AbbreviationRule.isSingleWord(" population "));
        assertFalse(AbbreviationRule.isSingleWord("population density"));
    }

    @Test
    void testOrderPreserved() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("pop", List.of("population"));
        raw.put("emp", List.of("employment", "employee"));
        raw.put("ind", List.of("industry"));
        AbbreviationMap map = AbbreviationMap.of(raw);

        assertEquals(3, map.size());
        assertEquals("pop", map.getRules().get(0).abbreviation());
        assertEquals("ind", map.getRules().get(2).abbreviation());
    }

    @Test
    void testDuplicateAbbreviationRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AbbreviationMap(List.of(
            AbbreviationRule.of("pop", "population"),
            AbbreviationRule.of("pop", "popular"))));
    }

    @Test
    void testFindAbbreviationFor() {
        AbbreviationMap map = new AbbreviationMap(List.of(AbbreviationRule.of("emp", "employment", "employee")));
        assertEquals("emp", map.findAbbreviationFor("Employee").orElseThrow());
        assertTrue(map.findAbbreviationFor("employer").isEmpty());
    }

    @Test
    void testWithTermReturnsNewMap() {
        AbbreviationMap map = new AbbreviationMap(List.of(AbbreviationRule.of("emp", "employment")));
        AbbreviationMap extended = map.withTerm("emp", "employee").withTerm("pop", "population");

        assertEquals(List.of("employment"), map.getRule("emp").orElseThrow().fullTerms());
        assertEquals(List.of("employment", "employee"), extended.getRule("emp").orElseThrow().fullTerms());
        assertEquals(List.of("population"), extended.getRule("pop").orElseThrow().fullTerms());
    }

    @Test
    void testEquality() {
        AbbreviationMap a = new AbbreviationMap(List.of(AbbreviationRule.of("pop", "population")));
        AbbreviationMap b = AbbreviationMap.of(Map.of("pop", List.of("population")));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testDefaults() throws IOException {
        AbbreviationMap defaults = AbbreviationMap.defaults();
        assertTrue(defaults.size() > 50);
        assertEquals("pop", defaults.findAbbreviationFor("population").orElseThrow());
        assertEquals("pop_dens", defaults.findAbbreviationFor("population density").orElseThrow());
    }
}

package pl.marcinmilkowski.ident_gen.config;

import java.io.IOException;
import java.util.*;

/**
 * Ordered, immutable set of abbreviation rules.
 *
 * Rule order matters: it is the first-seen order when the lookup table is
 * deduplicated by term.
 */
public final class AbbreviationMap {

    private final List<AbbreviationRule> rules;
    private final Map<String, AbbreviationRule> rulesByAbbreviation;

    public AbbreviationMap(List<AbbreviationRule> rules) {
        Map<String, AbbreviationRule> byAbbreviation = new LinkedHashMap<>();
        for (AbbreviationRule rule : rules) {
            if (byAbbreviation.containsKey(rule.abbreviation())) {
                throw new IllegalArgumentException("Duplicate abbreviation: " + rule.abbreviation());
            }
            byAbbreviation.put(rule.abbreviation(), rule);
        }
        this.rules = List.copyOf(rules);
        this.rulesByAbbreviation = Collections.unmodifiableMap(byAbbreviation);
    }

    /**
     * Build a map from abbreviation -> terms pairs, keeping iteration order.
     */
    public static AbbreviationMap of(Map<String, List<String>> abbreviations) {
        List<AbbreviationRule> rules = new ArrayList<>();
        abbreviations.forEach((abbrev, terms) -> rules.add(new AbbreviationRule(abbrev, terms)));
        return new AbbreviationMap(rules);
    }

    /**
     * The bundled default abbreviations.
     */
    public static AbbreviationMap defaults() throws IOException {
        return AbbreviationConfigLoader.loadResource(AbbreviationConfigLoader.DEFAULT_RESOURCE);
    }

    public List<AbbreviationRule> getRules() {
        return rules;
    }

    public Optional<AbbreviationRule> getRule(String abbreviation) {
        return Optional.ofNullable(rulesByAbbreviation.get(abbreviation));
    }

    /**
     * Abbreviation whose rule lists the term (case-insensitive), if any.
     */
    public Optional<String> findAbbreviationFor(String term) {
        for (AbbreviationRule rule : rules) {
            for (String fullTerm : rule.fullTerms()) {
                if (fullTerm.equalsIgnoreCase(term)) {
                    return Optional.of(rule.abbreviation());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Return a new map with the term appended to the rule, creating the rule if absent.
     */
    public AbbreviationMap withTerm(String abbreviation, String term) {
        List<AbbreviationRule> updated = new ArrayList<>(rules.size() + 1);
        boolean found = false;
        for (AbbreviationRule rule : rules) {
            if (rule.abbreviation().equals(abbreviation)) {
                found = true;
                if (rule.fullTerms().contains(term)) {
                    updated.add(rule);
                } else {
                    List<String> terms = new ArrayList<>(rule.fullTerms());
                    terms.add(term);
                    updated.add(new AbbreviationRule(abbreviation, terms));
                }
            } else {
                updated.add(rule);
            }
        }
        if (!found) {
            updated.add(new AbbreviationRule(abbreviation, List.of(term)));
        }
        return new AbbreviationMap(updated);
    }

    public int size() {
        return rules.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbbreviationMap)) return false;
        return rules.equals(((AbbreviationMap) o).rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "AbbreviationMap[" + rules.size() + " rules]";
    }
}

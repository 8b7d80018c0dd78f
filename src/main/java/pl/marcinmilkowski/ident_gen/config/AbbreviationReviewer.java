package pl.marcinmilkowski.ident_gen.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.substitution.VariantGenerator;

import java.util.*;

/**
 * Quality checks over a set of abbreviation rules.
 *
 * Errors:
 * - a term listed under two abbreviations (the lookup table silently keeps the first)
 * - a term listed twice in one rule
 * - an abbreviation that is not shorter than one of its single-word terms
 *
 * Consolidation opportunities: a rule whose single-word terms are all
 * morphological variants of one of them, so listing that one term is enough.
 */
public class AbbreviationReviewer {

    private static final Logger logger = LoggerFactory.getLogger(AbbreviationReviewer.class);

    public enum Status {
        OK(0), ERRORS(1), CONSOLIDATION_AVAILABLE(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int getExitCode() {
            return exitCode;
        }
    }

    /**
     * Terms of a rule that are already covered by the variants of {@code baseTerm}.
     */
    public record Consolidation(String abbreviation, String baseTerm, List<String> redundantTerms) {
        public Consolidation {
            redundantTerms = List.copyOf(redundantTerms);
        }
    }

    public record ReviewResult(List<String> errors, List<Consolidation> consolidations) {
        public ReviewResult {
            errors = List.copyOf(errors);
            consolidations = List.copyOf(consolidations);
        }

        public Status status() {
            if (!errors.isEmpty()) return Status.ERRORS;
            if (!consolidations.isEmpty()) return Status.CONSOLIDATION_AVAILABLE;
            return Status.OK;
        }
    }

    private final VariantGenerator variants;

    public AbbreviationReviewer(VariantGenerator variants) {
        this.variants = variants;
    }

    public ReviewResult review(AbbreviationMap map) {
        List<String> errors = new ArrayList<>();
        List<Consolidation> consolidations = new ArrayList<>();
        Map<String, String> owners = new HashMap<>();

        for (AbbreviationRule rule : map.getRules()) {
            String abbrev = rule.abbreviation();
            Set<String> seenInRule = new HashSet<>();
            for (String fullTerm : rule.fullTerms()) {
                String term = fullTerm.trim().toLowerCase(Locale.ROOT);
                if (!seenInRule.add(term)) {
                    errors.add("'" + abbrev + "' lists '" + term + "' more than once");
                    continue;
                }
                String owner = owners.putIfAbsent(term, abbrev);
                if (owner != null) {
                    errors.add("'" + term + "' is claimed by both '" + owner + "' and '" + abbrev + "'");
                }
                if (AbbreviationRule.isSingleWord(term) && abbrev.length() >= term.length()) {
                    errors.add("'" + abbrev + "' is not shorter than '" + term + "'");
                }
            }
            findConsolidation(rule).ifPresent(consolidations::add);
        }

        ReviewResult result = new ReviewResult(errors, consolidations);
        logger.info("Reviewed {} rules: {} errors, {} consolidation opportunities",
            map.size(), errors.size(), consolidations.size());
        return result;
    }

    Optional<Consolidation> findConsolidation(AbbreviationRule rule) {
        List<String> singleWords = new ArrayList<>();
        for (String term : rule.fullTerms()) {
            String lower = term.trim().toLowerCase(Locale.ROOT);
            if (AbbreviationRule.isSingleWord(lower) && !singleWords.contains(lower)) {
                singleWords.add(lower);
            }
        }
        if (singleWords.size() < 2) {
            return Optional.empty();
        }
        for (String base : singleWords) {
            Set<String> covered = variants.variants(base, true, true);
            List<String> others = new ArrayList<>(singleWords);
            others.remove(base);
            if (covered.containsAll(others)) {
                return Optional.of(new Consolidation(rule.abbreviation(), base, others));
            }
        }
        return Optional.empty();
    }
}

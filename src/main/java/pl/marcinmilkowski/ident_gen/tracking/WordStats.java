package pl.marcinmilkowski.ident_gen.tracking;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Running statistics for a word that escaped abbreviation.
 *
 * Mutated as occurrences are observed; never reset within a session.
 */
public class WordStats {

    private final String word;
    private int frequency;
    private final Set<String> contexts = new LinkedHashSet<>();
    private final Set<String> sources = new LinkedHashSet<>();
    private int maxLengthImpact;        // most characters one occurrence would save
    private double avgLengthImpact;     // average characters saved per occurrence

    public WordStats(String word) {
        this.word = word;
    }

    /**
     * Restore previously saved statistics.
     */
    public WordStats(String word, int frequency, Set<String> contexts, Set<String> sources,
                     int maxLengthImpact, double avgLengthImpact) {
        this.word = word;
        this.frequency = frequency;
        this.contexts.addAll(contexts);
        this.sources.addAll(sources);
        this.maxLengthImpact = maxLengthImpact;
        this.avgLengthImpact = avgLengthImpact;
    }

    public void addOccurrence(String context, String source, int potentialSavings) {
        frequency++;
        contexts.add(context);
        sources.add(source);
        maxLengthImpact = Math.max(maxLengthImpact, potentialSavings);
        avgLengthImpact = (avgLengthImpact * (frequency - 1) + potentialSavings) / frequency;
    }

    /**
     * frequency x average impact x word length.
     */
    public double getPriorityScore() {
        return frequency * avgLengthImpact * word.length();
    }

    /**
     * Characters saved over all occurrences, assuming an abbreviation of about four characters.
     */
    public double getTotalPotentialSavings() {
        int abbreviationLength = Math.min(4, word.length() / 2);
        int perOccurrence = Math.max(0, word.length() - abbreviationLength);
        return (double) frequency * perOccurrence;
    }

    public String getWord() { return word; }
    public int getFrequency() { return frequency; }
    public Set<String> getContexts() { return Collections.unmodifiableSet(contexts); }
    public Set<String> getSources() { return Collections.unmodifiableSet(sources); }
    public int getMaxLengthImpact() { return maxLengthImpact; }
    public double getAvgLengthImpact() { return avgLengthImpact; }

    @Override
    public String toString() {
        return String.format("%s freq=%d avg=%.1f max=%d score=%.0f",
            word, frequency, avgLengthImpact, maxLengthImpact, getPriorityScore());
    }
}

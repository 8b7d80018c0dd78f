package pl.marcinmilkowski.ident_gen.tracking;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks words that survive substitution unabbreviated, to recommend new abbreviation rules.
 *
 * Pure bookkeeping: tracking never changes generated identifiers.
 */
public class WordTracker {

    public static final int MIN_WORD_LENGTH = 4;
    public static final int MAX_TRACKED_WORDS = 10_000;
    public static final int ASSUMED_ABBREVIATION_LENGTH = 4;
    public static final int CONTEXT_LENGTH = 100;

    private static final Pattern WORD = Pattern.compile("[A-Za-z]{3,}");

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "are", "not", "but", "had", "has", "was",
        "his", "her", "you", "all", "can", "may", "get", "got", "put",
        "use", "new", "old", "see", "way", "who", "boy", "did", "its",
        "let", "say", "she", "too", "any", "day", "man", "now", "our",
        "out", "two", "how", "end", "why", "own", "run", "off", "try"
    );

    private static final DateTimeFormatter SESSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Map<String, WordStats> wordStats = new LinkedHashMap<>();
    private String sessionId;

    public WordTracker() {
        this(Clock.systemUTC());
    }

    public WordTracker(Clock clock) {
        this.sessionId = SESSION_FORMAT.format(clock.instant().atOffset(ZoneOffset.UTC));
    }

    /**
     * Record one substitution.
     *
     * @param originalText Label before substitution
     * @param substitutedText Label after substitution
     * @param source Where the label came from (e.g. "ProductID", "CodeSet:frequency")
     * @return Words of the original that remain in the substituted text, in order of appearance
     */
    public Set<String> track(String originalText, String substitutedText, String source) {
        Set<String> unabbreviated = new LinkedHashSet<>();
        if (originalText == null || originalText.isEmpty()) {
            return unabbreviated;
        }
        List<String> substitutedWords = extractWords(substitutedText != null ? substitutedText : "");
        String context = originalText.length() > CONTEXT_LENGTH
            ? originalText.substring(0, CONTEXT_LENGTH) : originalText;

        Set<String> seen = new HashSet<>();
        for (String word : extractWords(originalText)) {
            String lower = word.toLowerCase(Locale.ROOT);
            // one occurrence per word and label
            if (word.length() < MIN_WORD_LENGTH || !seen.add(lower)) {
                continue;
            }
            if (wordStats.size() >= MAX_TRACKED_WORDS && !wordStats.containsKey(lower)) {
                continue;
            }
            int potentialSavings = word.length() - ASSUMED_ABBREVIATION_LENGTH;
            if (potentialSavings <= 0 || !survives(lower, substitutedWords)) {
                continue;
            }
            unabbreviated.add(word);
            wordStats.computeIfAbsent(lower, WordStats::new).addOccurrence(context, source, potentialSavings);
        }
        return unabbreviated;
    }

    private static boolean survives(String lowerWord, List<String> substitutedWords) {
        for (String candidate : substitutedWords) {
            if (candidate.toLowerCase(Locale.ROOT).contains(lowerWord)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Alphabetic runs of three or more letters, stop words removed.
     */
    static List<String> extractWords(String text) {
        List<String> words = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            String word = m.group();
            if (!STOP_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Words worth a new abbreviation rule, highest priority score first.
     */
    public List<WordStats> getAbbreviationCandidates(int minFrequency, int minLength, int maxResults) {
        List<WordStats> candidates = new ArrayList<>();
        for (WordStats stats : wordStats.values()) {
            if (stats.getFrequency() >= minFrequency && stats.getWord().length() >= minLength) {
                candidates.add(stats);
            }
        }
        candidates.sort(Comparator.comparingDouble(WordStats::getPriorityScore).reversed()
            .thenComparing(WordStats::getWord));
        return candidates.size() > maxResults ? new ArrayList<>(candidates.subList(0, maxResults)) : candidates;
    }

    public List<WordStats> getAbbreviationCandidates() {
        return getAbbreviationCandidates(3, 6, 50);
    }

    /**
     * Merge loaded statistics, replacing any tracked word of the same name.
     */
    void restore(WordStats stats) {
        wordStats.put(stats.getWord(), stats);
    }

    public Optional<WordStats> getStats(String word) {
        return Optional.ofNullable(wordStats.get(word.toLowerCase(Locale.ROOT)));
    }

    public Collection<WordStats> getAllStats() {
        return Collections.unmodifiableCollection(wordStats.values());
    }

    public int size() {
        return wordStats.size();
    }

    public String getSessionId() {
        return sessionId;
    }

    void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }
}

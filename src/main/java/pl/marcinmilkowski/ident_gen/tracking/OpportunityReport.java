package pl.marcinmilkowski.ident_gen.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Ranked report of words that would benefit most from a new abbreviation rule.
 *
 * Sections: summary, top candidates table, impact per label source,
 * suggested abbreviations with projected savings, and optionally usage contexts.
 */
public class OpportunityReport {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityReport.class);

    public static final int TOP_ROWS = 25;
    public static final int TOP_SUGGESTIONS = 10;
    public static final int TOP_CONTEXTS = 5;
    public static final int CONTEXTS_PER_WORD = 3;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    public enum Format { MARKDOWN, PLAIN }

    private final WordTracker tracker;
    private final AbbreviationMap existing;
    private final Clock clock;
    private final int minFrequency;
    private final int minLength;

    public OpportunityReport(WordTracker tracker, AbbreviationMap existing) {
        this(tracker, existing, Clock.systemUTC(), 2, 6);
    }

    /**
     * @param existing current rules, used for conflict notes; may be null
     */
    public OpportunityReport(WordTracker tracker, AbbreviationMap existing, Clock clock,
                             int minFrequency, int minLength) {
        this.tracker = tracker;
        this.existing = existing;
        this.clock = clock;
        this.minFrequency = minFrequency;
        this.minLength = minLength;
    }

    public String render(Format format, boolean includeContexts) {
        boolean md = format == Format.MARKDOWN;
        List<WordStats> candidates = tracker.getAbbreviationCandidates(minFrequency, minLength, TOP_ROWS);
        StringBuilder out = new StringBuilder();

        heading(out, md, 1, "Abbreviation Opportunity Report");
        out.append("Generated: ").append(TIMESTAMP.format(clock.instant().atOffset(ZoneOffset.UTC))).append('\n');
        out.append("Session: ").append(tracker.getSessionId()).append('\n');
        out.append('\n');

        heading(out, md, 2, "Summary");
        double totalSavings = 0;
        for (WordStats s : candidates) {
            totalSavings += s.getTotalPotentialSavings();
        }
        bullet(out, md, "Words tracked: " + tracker.size());
        bullet(out, md, "Candidates (frequency >= " + minFrequency + ", length >= " + minLength + "): "
            + candidates.size());
        bullet(out, md, String.format(Locale.ROOT, "Potential savings: %.0f characters", totalSavings));
        out.append('\n');

        if (candidates.isEmpty()) {
            out.append("No abbreviation candidates found.\n");
            return out.toString();
        }

        heading(out, md, 2, "Top Candidates");
        appendTable(out, md, candidates);
        out.append('\n');

        heading(out, md, 2, "Impact by Source");
        for (Map.Entry<String, int[]> e : sourceImpact(candidates).entrySet()) {
            bullet(out, md, e.getKey() + ": " + e.getValue()[0] + " words, " + e.getValue()[1] + " occurrences");
        }
        out.append('\n');

        heading(out, md, 2, "Suggested Abbreviations");
        for (WordStats s : candidates.subList(0, Math.min(TOP_SUGGESTIONS, candidates.size()))) {
            String suggestion = AbbreviationSuggester.suggest(s.getWord());
            int saved = Math.max(0, s.getWord().length() - suggestion.length()) * s.getFrequency();
            StringBuilder line = new StringBuilder()
                .append(md ? "`" + suggestion + "`" : suggestion)
                .append(" -> ").append(s.getWord())
                .append(" (saves ").append(saved).append(" characters)");
            for (String note : conflicts(s.getWord(), suggestion)) {
                line.append("; ").append(note);
            }
            bullet(out, md, line.toString());
        }

        if (includeContexts) {
            out.append('\n');
            heading(out, md, 2, "Usage Contexts");
            for (WordStats s : candidates.subList(0, Math.min(TOP_CONTEXTS, candidates.size()))) {
                out.append(md ? "**" + s.getWord() + "**" : s.getWord() + ":").append('\n');
                int shown = 0;
                for (String context : s.getContexts()) {
                    if (shown++ >= CONTEXTS_PER_WORD) break;
                    bullet(out, md, context);
                }
                out.append('\n');
            }
        }
        return out.toString();
    }

    public void write(Path output, Format format, boolean includeContexts) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, render(format, includeContexts), StandardCharsets.UTF_8);
        logger.info("Report written to {}", output);
    }

    /**
     * Notes about rules that already cover the word or already use the suggested key.
     */
    List<String> conflicts(String word, String suggestion) {
        List<String> notes = new ArrayList<>();
        if (existing == null) {
            return notes;
        }
        existing.findAbbreviationFor(word)
            .ifPresent(a -> notes.add("already abbreviated as '" + a + "'"));
        existing.getRule(suggestion)
            .ifPresent(r -> notes.add("'" + suggestion + "' already used for " + r.fullTerms()));
        return notes;
    }

    /**
     * Per source: number of candidate words seen there, and their total frequency.
     */
    static Map<String, int[]> sourceImpact(List<WordStats> candidates) {
        Map<String, int[]> impact = new TreeMap<>();
        for (WordStats s : candidates) {
            for (String source : s.getSources()) {
                int[] counts = impact.computeIfAbsent(source, k -> new int[2]);
                counts[0]++;
                counts[1] += s.getFrequency();
            }
        }
        return impact;
    }

    private static void appendTable(StringBuilder out, boolean md, List<WordStats> rows) {
        if (md) {
            out.append("| Rank | Word | Frequency | Avg Impact | Priority | Sources |\n");
            out.append("|-----:|------|----------:|-----------:|---------:|--------:|\n");
        } else {
            out.append(String.format(Locale.ROOT, "%-5s %-24s %9s %10s %10s %7s\n",
                "Rank", "Word", "Frequency", "AvgImpact", "Priority", "Sources"));
        }
        int rank = 1;
        for (WordStats s : rows) {
            String fmt = md ? "| %d | %s | %d | %.1f | %.0f | %d |\n" : "%-5d %-24s %9d %10.1f %10.0f %7d\n";
            out.append(String.format(Locale.ROOT, fmt, rank++, s.getWord(), s.getFrequency(),
                s.getAvgLengthImpact(), s.getPriorityScore(), s.getSources().size()));
        }
    }

    private static void heading(StringBuilder out, boolean md, int level, String title) {
        if (md) {
            out.append("#".repeat(level)).append(' ').append(title).append("\n\n");
        } else {
            out.append(title).append('\n')
                .append((level == 1 ? "=" : "-").repeat(title.length())).append("\n\n");
        }
    }

    private static void bullet(StringBuilder out, boolean md, String text) {
        out.append(md ? "- " : "  * ").append(text).append('\n');
    }
}

package quest.gekko.pulse.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Article;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Heuristic importance of a cluster: freshness, corroboration across sources, arousal, source tier
 * and event keywords. Scores are only meaningful relative to each other.
 */
@Component
public class ImportanceScorer {
    private static final Pattern CASUALTIES = Pattern.compile("\\b(\\d+)\\s+(dead|killed|injured)\\b");
    private static final Pattern LEGAL = Pattern.compile("\\b(ban|verdict|ruling|fine|sanction|tariff|indictment)\\b");

    private final Set<String> tier1Sources;
    private final List<String> boostKeywords;
    private final List<String> penaltyKeywords;

    public ImportanceScorer(PulseProperties.Scoring scoring) {
        this.tier1Sources = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        this.tier1Sources.addAll(scoring.tier1Sources());
        this.boostKeywords = lower(scoring.boostKeywords());
        this.penaltyKeywords = lower(scoring.penaltyKeywords());
    }

    public ScoredCandidate score(CandidateCluster cluster, Instant now) {
        Article a = cluster.representative();
        double hours = hoursSince(a, now);
        double recency = 1.0 / Math.pow(Math.max(0.5, hours), 0.45);
        double corroboration = Math.log10(1 + cluster.sourceCount()) * 0.7;
        double arousal = a.getArousal() != null ? a.getArousal() : 0.5;

        double raw = recency * 1.1 + corroboration + arousal * 0.25;
        boolean tier1 = a.getSourceId() != null && tier1Sources.contains(a.getSourceId());
        if (tier1) raw *= 1.25;

        double event = eventBoost(text(a));
        raw += event;

        List<String> why = new ArrayList<>(4);
        if (corroboration >= 0.3) why.add("Multi-source");
        if (tier1) why.add("Tier-1 source");
        if (event > 0.2) why.add("High-impact keywords");
        if (hours < 3) why.add("Very fresh");
        return new ScoredCandidate(cluster, raw, why);
    }

    double eventBoost(String text) {
        double boost = 0;
        for (String k : boostKeywords) {
            if (text.contains(k)) boost += 0.25;
        }
        for (String k : penaltyKeywords) {
            if (text.contains(k)) boost -= 0.35;
        }
        if (CASUALTIES.matcher(text).find()) boost += 0.25;
        if (LEGAL.matcher(text).find()) boost += 0.2;
        return boost;
    }

    static double hoursSince(Article a, Instant now) {
        Instant published = a.getPublishedAt() != null ? a.getPublishedAt() : a.getCreatedAt();
        if (published == null) return 0;
        return Math.max(0, Duration.between(published, now).toMillis() / 3_600_000.0);
    }

    private static String text(Article a) {
        StringBuilder sb = new StringBuilder();
        if (a.getTitle() != null) sb.append(a.getTitle()).append(' ');
        if (a.getSummary() != null) sb.append(a.getSummary()).append(' ');
        if (a.getTags() != null) sb.append(String.join(" ", a.getTags()));
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static List<String> lower(List<String> words) {
        return words == null ? List.of() : words.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList();
    }
}

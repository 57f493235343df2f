package quest.gekko.pulse.service.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coarse topic buckets used for diversity caps, and topic extraction for items that arrive untagged.
 */
public final class TopicBuckets {
    public static final String MISC = "misc";
    public static final int MAX_TOPICS = 8;

    static final List<String> PREFERRED = List.of(
            "politics", "finance", "ai", "tech", "science", "space", "sports",
            "health", "climate", "entertainment", "disaster", "world");

    private static final Map<Pattern, String> TOKEN_TOPICS = new LinkedHashMap<>();
    private static final Pattern RAW_TOKEN = Pattern.compile("\\b[a-z0-9+#]{4,}\\b");

    static {
        topic("ai", "ai", "artificial intelligence", "machine learning", "llm");
        topic("space", "nasa", "spacex", "rocket", "orbit", "mars");
        topic("sports", "nfl", "nba", "mlb", "goal", "match");
        topic("politics", "election", "senate", "congress", "minister", "president");
        topic("finance", "gdp", "inflation", "interest rate", "fed", "earnings");
        topic("climate", "climate", "emissions", "heat wave", "renewable", "solar");
        topic("health", "health", "medicine", "vaccine");
        topic("gadgets", "review", "hands-on");
        topic("chips", "chip", "semiconductor");
        topic("entertainment", "movie", "tv", "box office");
        topic("disaster", "earthquake", "hurricane", "wildfire");
    }

    private static void topic(String topic, String... tokens) {
        for (String t : tokens) {
            TOKEN_TOPICS.put(Pattern.compile("\\b" + Pattern.quote(t) + "\\b"), topic);
        }
    }

    private TopicBuckets() {}

    public static String bucketOf(List<String> topics) {
        if (topics == null || topics.isEmpty()) return MISC;
        for (String p : PREFERRED) {
            for (String t : topics) {
                if (t != null && t.equalsIgnoreCase(p)) return p;
            }
        }
        String first = topics.get(0);
        return first == null || first.isBlank() ? MISC : first.trim().toLowerCase(Locale.ROOT);
    }

    public static List<String> extractTopics(String title, String summary) {
        String text = ((title == null ? "" : title) + " " + (summary == null ? "" : summary)).toLowerCase(Locale.ROOT);
        Set<String> topics = new LinkedHashSet<>();
        for (Map.Entry<Pattern, String> e : TOKEN_TOPICS.entrySet()) {
            if (e.getKey().matcher(text).find()) topics.add(e.getValue());
        }
        if (topics.isEmpty()) {
            Matcher m = RAW_TOKEN.matcher(text);
            while (m.find() && topics.size() < 6) topics.add(m.group());
        }
        return new ArrayList<>(topics);
    }

    /** Trimmed, non-empty, case-insensitively distinct, at most {@link #MAX_TOPICS}. */
    public static List<String> normalize(List<String> topics) {
        List<String> out = new ArrayList<>();
        if (topics == null) return out;
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String t : topics) {
            if (t == null) continue;
            String s = t.trim();
            if (s.isEmpty() || !seen.add(s)) continue;
            out.add(s);
            if (out.size() >= MAX_TOPICS) break;
        }
        return out;
    }

    /** Topics from the item's tags, or extracted from its text when it has none. */
    public static List<String> resolve(List<String> tags, String title, String summary) {
        List<String> base = tags == null ? List.of() : tags.stream().limit(6).toList();
        List<String> normalized = normalize(base);
        return normalized.isEmpty() ? normalize(extractTopics(title, summary)) : normalized;
    }
}

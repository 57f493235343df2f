package quest.gekko.pulse.service.learning;

import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.util.TextTokens;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns an article into the (type, key) features that feedback learns on and personal scoring
 * looks up. Both sides go through this class so their keys always agree.
 */
public final class FeatureExtractor {
    public static final String SOURCE = "source";
    public static final String INTEREST = "interest";
    public static final String TAG = "tag";
    public static final String TOKEN = "tok";
    public static final String GENRE = "genre";
    public static final String EVENT = "event";
    public static final String FORMAT = "format";

    /** Feature types that contribute to personal scoring. */
    public static final Set<String> SCORING_TYPES = Set.of(SOURCE, INTEREST, TAG, TOKEN);

    private static final int MAX_TOKEN_LENGTH = 24;

    private FeatureExtractor() {}

    public record Feature(String type, String key) {}

    /** Source, interests, tags and title tokens. */
    public static List<Feature> core(String sourceId, List<String> interestIds, List<String> tags, String title) {
        Set<Feature> out = new LinkedHashSet<>();
        add(out, SOURCE, sourceId);
        if (interestIds != null) interestIds.forEach(i -> add(out, INTEREST, i));
        if (tags != null) tags.forEach(t -> add(out, TAG, t));
        for (String tok : TextTokens.tokens(title)) {
            if (tok.length() <= MAX_TOKEN_LENGTH) add(out, TOKEN, tok);
        }
        return new ArrayList<>(out);
    }

    /** Core features plus the genre, event-stage and format labels. */
    public static List<Feature> forLearning(Article a, List<String> interestIds) {
        Set<Feature> out = new LinkedHashSet<>(core(a.getSourceId(), interestIds, a.getTags(), a.getTitle()));
        add(out, GENRE, a.getGenre());
        add(out, EVENT, a.getEventStage());
        add(out, FORMAT, a.getFormat());
        return new ArrayList<>(out);
    }

    public static String norm(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static void add(Set<Feature> out, String type, String key) {
        String k = norm(key);
        if (!k.isEmpty()) out.add(new Feature(type, k));
    }
}

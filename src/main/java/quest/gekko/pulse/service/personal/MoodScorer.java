package quest.gekko.pulse.service.personal;

import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.util.TextTokens;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Mood fit of an item in [0, 1], centered on 0.5.
 */
public final class MoodScorer {
    static final Pattern EXPLAINER = Pattern.compile("\\b(what is|why|how|explainer|q&a|faq|guide|analysis|deep dive)\\b");
    static final Pattern LIVE_BREAKING = Pattern.compile("\\b(live|breaking|wins|win|beats|defeats|launch|announces)\\b");

    private MoodScorer() {}

    /**
     * @param profile null when the user has no mood set, which scores a neutral 0.5
     * @param hours   age of the item in hours
     */
    public static double score(MoodProfile profile, RankedItem item, double blend, double hours) {
        if (profile == null) return 0.5;

        String text = text(item);
        boolean explainer = EXPLAINER.matcher(text).find();
        boolean live = LIVE_BREAKING.matcher(text).find();

        double affinity = 0;
        boolean match = (profile.explainerMatches() && explainer) || (profile.liveMatches() && live);
        for (String k : profile.keywords()) {
            if (match) break;
            match = text.contains(k);
        }
        if (match) affinity += profile.matchAffinity();
        if (profile.quietBonus() != 0 && !live) affinity += profile.quietBonus();
        if (profile.recencyBand() != null) affinity += profile.recencyBand().bonus(hours);

        double recency = 1.0 / Math.pow(Math.max(0.25, hours), 0.35);
        double arousal = item.getArousal() != null ? item.getArousal() : 0.5;
        double comfort = 1 - blend;
        double targetArousal = 0.75 - 0.5 * comfort;

        double s = 0.5
                + 0.4 * Math.tanh(affinity)
                + Math.min(0.18, recency * (0.12 + 0.18 * blend))
                + 0.06 * (1 - Math.abs(arousal - targetArousal));
        return TextTokens.clamp(s, 0, 1);
    }

    private static String text(RankedItem i) {
        StringBuilder sb = new StringBuilder();
        if (i.getTitle() != null) sb.append(i.getTitle());
        sb.append(' ');
        if (i.getSummary() != null) sb.append(i.getSummary());
        sb.append(' ');
        if (i.getTopics() != null) sb.append(String.join(" ", i.getTopics()));
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}

package quest.gekko.pulse.service.personal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.service.learning.FeatureExtractor;
import quest.gekko.pulse.service.store.AffinityProfile;
import quest.gekko.pulse.util.TextTokens;
import quest.gekko.pulse.util.VectorMath;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Re-scores a pool of snapshot items for one user (mood, interests, learned affinities and semantic
 * similarity to their mood centroids) and samples a diverse personal list from it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PersonalizationOverlay {
    static final double SIMILAR_VIBE = 0.52;

    private final PulseProperties.Personal personal;

    public List<RankedItem> personalize(PersonalizationRequest req, RandomGenerator rng) {
        Map<String, RankedItem> distinct = new LinkedHashMap<>();
        for (RankedItem it : req.pool()) {
            if (it.getArticleId() != null) distinct.putIfAbsent(it.getArticleId(), it);
        }
        Set<String> globalIds = req.excludeIds() == null ? Set.of() : req.excludeIds();
        long available = distinct.keySet().stream().filter(id -> !globalIds.contains(id)).count();
        Set<String> exclude = globalIds;
        if (available < Math.max(3, req.target() / 2)) {
            log.debug("Early-day pool ({} left after excluding {}), dropping Global exclusion", available, globalIds.size());
            exclude = Set.of();
        }
        List<RankedItem> candidates = new ArrayList<>();
        for (RankedItem it : distinct.values()) {
            if (!exclude.contains(it.getArticleId())) candidates.add(it);
        }
        if (candidates.isEmpty()) return List.of();

        double blend = TextTokens.clamp(req.blend(), 0, 1);
        MoodProfile profile = MoodProfiles.of(req.mood());
        Set<String> interests = new HashSet<>();
        if (req.interests() != null) {
            for (String s : req.interests()) {
                String k = FeatureExtractor.norm(s);
                if (!k.isEmpty()) interests.add(k);
            }
        }

        double[] blended = new double[candidates.size()];
        double min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
        for (int i = 0; i < candidates.size(); i++) {
            RankedItem it = candidates.get(i);
            double recency = 1.0 / Math.pow(hours(it, req.now()), 0.45);
            blended[i] = 0.7 * it.strength() + 0.3 * recency;
            min = Math.min(min, blended[i]);
            max = Math.max(max, blended[i]);
        }
        double span = Math.max(1e-6, max - min);

        double wMood = 1.25 + (blend - 0.5) * 0.6;
        double wInterest = 1.05 + (0.5 - blend) * 0.3;
        double ageDamp = 0.92 - blend * 0.06;
        double minDelta = personal.clampedMinDeltaFromGlobal();

        List<WeightedSampler.Weighted> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            RankedItem it = candidates.get(i);
            double base = (blended[i] - min) / span;
            double h = hours(it, req.now());
            double overlap = overlap(it.getTopics(), interests);
            double mood = MoodScorer.score(profile, it, blend, h);

            double p = base * (1.0 + wInterest * overlap + wMood * (mood - 0.5));
            if (h > 6) p *= ageDamp;
            if (mood < 0.48) p *= 1.0 - Math.min(blend <= 0.5 ? 0.08 : 0.05, 0.48 - mood);
            if (it.strength() >= 0.85 && mood < 0.62) p *= 1.0 - minDelta;

            Article article = req.articles() == null ? null : req.articles().get(it.getArticleId());
            double userCos = Double.NaN;
            if (req.mood() != null) {
                p += learnedAffinity(it, article, req.profile());
                double[] e = article == null ? new double[0] : VectorMath.normalize(VectorMath.toDoubles(article.getEmbedding()));
                userCos = VectorMath.cosine(e, req.userCentroid());
                double globalCos = VectorMath.cosine(e, req.globalCentroid());
                p += 0.22 * positive(userCos) + 0.18 * positive(globalCos);
            }

            p *= jitter(it.getArticleId());
            scored.add(new WeightedSampler.Weighted(it, Math.max(0.0001, p),
                    mergeReasons(it.getReasons(), overlap, req.mood(), mood, userCos)));
        }

        List<WeightedSampler.Weighted> selected = WeightedSampler.sample(scored, req.target(),
                personal.clampedPerSourceCap(), personal.clampedPerBucketCap(), personal.clampedMinDistinctBuckets(), rng);
        if (selected.isEmpty()) return List.of();

        double sMin = Double.MAX_VALUE, sMax = -Double.MAX_VALUE;
        for (WeightedSampler.Weighted w : selected) {
            sMin = Math.min(sMin, w.score());
            sMax = Math.max(sMax, w.score());
        }
        double sSpan = Math.max(1e-6, sMax - sMin);

        List<RankedItem> out = new ArrayList<>(selected.size());
        for (WeightedSampler.Weighted w : selected) {
            out.add(w.item().toBuilder()
                    .reasons(w.reasons())
                    .summary(applyTone(w.item().getSummary(), profile))
                    .scorePersonal((w.score() - sMin) / sSpan)
                    .build());
        }
        return out;
    }

    static double learnedAffinity(RankedItem it, Article article, AffinityProfile profile) {
        if (profile == null || profile.isEmpty()) return 0;
        List<String> interestIds = article == null ? List.of() : article.getInterestMatches();
        List<String> tags = article != null && article.getTags() != null && !article.getTags().isEmpty()
                ? article.getTags() : it.getTopics();
        double sum = 0;
        for (FeatureExtractor.Feature f : FeatureExtractor.core(it.getSourceId(), interestIds, tags, it.getTitle())) {
            if (FeatureExtractor.SCORING_TYPES.contains(f.type())) sum += profile.lookup(f.type(), f.key());
        }
        return 0.5 * Math.tanh(TextTokens.clamp(sum, -6, 6) / 4.0);
    }

    static double overlap(List<String> topics, Set<String> interests) {
        if (topics == null || topics.isEmpty()) return 0;
        int hits = 0;
        for (String t : topics) {
            if (interests.contains(FeatureExtractor.norm(t))) hits++;
        }
        return hits / (double) topics.size();
    }

    static double jitter(String articleId) {
        int bucket = Math.abs(articleId.hashCode() % 100);
        return 0.995 + 0.01 * bucket / 100.0;
    }

    static List<String> mergeReasons(List<String> upstream, double overlap, Mood mood, double moodScore, double userCos) {
        Set<String> r = new LinkedHashSet<>();
        if (upstream != null) r.addAll(upstream);
        if (overlap > 0.15) r.add("Matches your topics");
        if (mood != null && moodScore > 0.55) r.add("Tuned for " + mood.displayName());
        if (!Double.isNaN(userCos) && userCos > SIMILAR_VIBE) r.add("Matches your vibe history");
        return r.stream().limit(4).toList();
    }

    static String applyTone(String summary, MoodProfile profile) {
        if (summary == null || summary.isBlank() || profile == null) return summary == null ? "" : summary;
        return profile.tone() + " " + summary;
    }

    private static double hours(RankedItem it, Instant now) {
        if (it.getPublishedAt() == null) return 0.25;
        double h = Duration.between(it.getPublishedAt(), now).toMillis() / 3_600_000.0;
        return Math.max(0.25, h);
    }

    private static double positive(double cos) {
        return Double.isNaN(cos) ? 0 : Math.max(0, cos);
    }
}

package quest.gekko.pulse.service.learning;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.domain.CentroidScope;
import quest.gekko.pulse.domain.FeatureAffinity;
import quest.gekko.pulse.domain.FeedbackAction;
import quest.gekko.pulse.domain.FeedbackEvent;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.MoodCentroid;
import quest.gekko.pulse.exception.PulseException;
import quest.gekko.pulse.service.store.AffinityStore;
import quest.gekko.pulse.service.store.ArticleStore;
import quest.gekko.pulse.util.TextTokens;
import quest.gekko.pulse.util.VectorMath;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Online learner behind the feedback buttons. Each event nudges the user's per-mood feature
 * affinities and moves the mood centroids toward (or away from) the article's embedding.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackLearningService {
    static final double AFFINITY_ALPHA = 0.35;
    static final double USER_ALPHA_TOWARD = 0.12;
    static final double USER_ALPHA_AWAY = 0.08;
    static final double GLOBAL_ALPHA = 0.03;

    private final ArticleStore articleStore;
    private final AffinityStore affinityStore;
    private final InterestMatcher interestMatcher;
    private final Clock clock;

    @Async("feedbackExecutor")
    public CompletableFuture<Boolean> recordFeedbackAsync(String userId, String articleId, String mood, FeedbackAction action) {
        try {
            return CompletableFuture.completedFuture(recordFeedback(userId, articleId, mood, action));
        } catch (PulseException e) {
            log.warn("Feedback from {} on {} was not recorded: {}", userId, articleId, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Applies one feedback event. Returns false when the article is unknown, which is a no-op.
     */
    public boolean recordFeedback(String userId, String articleId, String mood, FeedbackAction action) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        if (action == null) throw new IllegalArgumentException("action is required");
        if (articleId == null || articleId.isBlank()) return false;

        Optional<Article> found = articleStore.getById(articleId);
        if (found.isEmpty()) {
            log.debug("Feedback for unknown article {} ignored", articleId);
            return false;
        }
        Article article = found.get();
        Mood m = Mood.normalize(mood);
        Instant now = clock.instant();

        FeedbackEvent event = new FeedbackEvent();
        event.setId(UUID.randomUUID().toString());
        event.setUserId(userId);
        event.setArticleId(articleId);
        event.setMood(m.key());
        event.setAction(action);
        event.setCreatedAt(now);
        affinityStore.appendFeedback(event);

        List<FeatureExtractor.Feature> features = FeatureExtractor.forLearning(article, interestsOf(article));
        for (FeatureExtractor.Feature f : features) {
            updateAffinity(userId, m, f, action.signal(), now);
        }

        double[] sample = VectorMath.normalize(VectorMath.toDoubles(article.getEmbedding()));
        if (VectorMath.norm(sample) > 0) {
            boolean positive = action.isPositive();
            updateCentroid(MoodCentroid.userScopeId(userId, m), CentroidScope.USER, userId, m, sample,
                    positive ? USER_ALPHA_TOWARD : USER_ALPHA_AWAY, positive, now);
            if (positive) {
                updateCentroid(MoodCentroid.globalScopeId(m), CentroidScope.GLOBAL, null, m, sample, GLOBAL_ALPHA, true, now);
            }
        }
        log.debug("Recorded {} from {} on {} ({} features)", action, userId, articleId, features.size());
        return true;
    }

    static double ema(double current, double signal) {
        double target = TextTokens.clamp(signal, -1, 1);
        return TextTokens.clamp((1 - AFFINITY_ALPHA) * current + AFFINITY_ALPHA * target, -1, 1);
    }

    private void updateAffinity(String userId, Mood mood, FeatureExtractor.Feature f, double signal, Instant now) {
        String id = FeatureAffinity.idFor(userId, mood.key(), f.type(), f.key());
        FeatureAffinity a = affinityStore.findAffinity(id).orElseGet(() -> {
            FeatureAffinity fresh = new FeatureAffinity();
            fresh.setId(id);
            fresh.setUserId(userId);
            fresh.setMood(mood.key());
            fresh.setFeatureType(f.type());
            fresh.setFeatureKey(f.key());
            return fresh;
        });
        a.setScore(ema(a.getScore(), signal));
        a.setObservations(a.getObservations() + 1);
        a.setUpdatedAt(now);
        affinityStore.saveAffinity(a);
    }

    private void updateCentroid(String id, CentroidScope scope, String userId, Mood mood, double[] sample,
                                double alpha, boolean toward, Instant now) {
        MoodCentroid c = affinityStore.findCentroid(id).orElseGet(() -> {
            MoodCentroid fresh = new MoodCentroid();
            fresh.setId(id);
            fresh.setScope(scope);
            fresh.setUserId(userId);
            fresh.setMood(mood.key());
            return fresh;
        });
        c.setVector(VectorMath.shift(c.getVector(), sample, alpha, toward));
        c.setObservations(c.getObservations() + 1);
        c.setUpdatedAt(now);
        affinityStore.saveCentroid(c);
    }

    private List<String> interestsOf(Article article) {
        if (article.getInterestMatches() != null && !article.getInterestMatches().isEmpty()) {
            return article.getInterestMatches();
        }
        try {
            return interestMatcher.match(article.getTitle(), article.getSummary());
        } catch (RuntimeException e) {
            log.warn("Interest matching failed for {}: {}", article.getId(), e.getMessage());
            return List.of();
        }
    }
}

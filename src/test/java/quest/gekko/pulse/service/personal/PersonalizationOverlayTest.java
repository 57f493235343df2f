package quest.gekko.pulse.service.personal;

import org.junit.jupiter.api.Test;
import quest.gekko.pulse.Fixtures;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.domain.FeatureAffinity;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.service.learning.FeatureExtractor;
import quest.gekko.pulse.service.store.AffinityProfile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PersonalizationOverlayTest {
    private static final Instant NOW = Instant.parse("2026-10-17T14:20:00Z");
    private static final List<String> TOPICS = List.of("politics", "finance", "tech", "sports", "health", "climate");

    private final PersonalizationOverlay overlay = new PersonalizationOverlay(Fixtures.personal());

    private static List<RankedItem> pool(int n) {
        List<RankedItem> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Fixtures.item("i" + i, "src" + (i % 5), 1.0 - i * 0.03, List.of(TOPICS.get(i % TOPICS.size())),
                    NOW.minusSeconds(1800L + i * 900L)));
        }
        return out;
    }

    private static PersonalizationRequest.PersonalizationRequestBuilder request(List<RankedItem> pool) {
        return PersonalizationRequest.builder()
                .pool(pool)
                .excludeIds(Set.of())
                .interests(List.of())
                .mood(Mood.CALM)
                .blend(0.3)
                .target(6)
                .profile(AffinityProfile.empty())
                .articles(Map.of())
                .now(NOW);
    }

    @Test
    void excludedItemsAreKeptOutAndTheListIsWellFormed() {
        List<RankedItem> pool = pool(20);
        Set<String> excluded = Set.of("i0", "i1", "i2", "i3");

        List<RankedItem> personal = overlay.personalize(request(pool).excludeIds(excluded).build(), new Random(5));

        assertThat(personal).hasSize(6);
        assertThat(personal).extracting(RankedItem::getArticleId)
                .doesNotHaveDuplicates()
                .doesNotContainAnyElementsOf(excluded);
        Map<String, Long> bySource = personal.stream()
                .collect(Collectors.groupingBy(RankedItem::getSourceId, Collectors.counting()));
        assertThat(bySource.values()).allSatisfy(n -> assertThat(n).isLessThanOrEqualTo(2L));
        assertThat(personal).allSatisfy(it -> {
            assertThat(it.getScorePersonal()).isBetween(0.0, 1.0);
            assertThat(it.getReasons()).hasSizeLessThanOrEqualTo(4);
            assertThat(it.getSummary()).startsWith("🌿 ");
        });
    }

    @Test
    void earlyDayPoolDropsTheGlobalExclusion() {
        List<RankedItem> pool = pool(5);
        Set<String> everything = Set.of("i0", "i1", "i2", "i3", "i4");

        List<RankedItem> personal = overlay.personalize(request(pool).excludeIds(everything).target(4).build(), new Random(5));

        assertThat(personal).hasSize(4);
    }

    @Test
    void duplicatePoolEntriesCountOnce() {
        List<RankedItem> pool = new ArrayList<>(pool(4));
        pool.addAll(pool(4));

        List<RankedItem> personal = overlay.personalize(request(pool).target(6).build(), new Random(5));

        assertThat(personal).extracting(RankedItem::getArticleId).containsExactlyInAnyOrder("i0", "i1", "i2", "i3");
    }

    @Test
    void withoutMoodSummariesAreLeftAlone() {
        List<RankedItem> personal = overlay.personalize(request(pool(10)).mood(null).build(), new Random(5));

        assertThat(personal).allSatisfy(it -> assertThat(it.getSummary()).startsWith("Summary of "));
    }

    @Test
    void learnedSourceAffinityLiftsMatchingItems() {
        FeatureAffinity liked = new FeatureAffinity();
        liked.setFeatureType(FeatureExtractor.SOURCE);
        liked.setFeatureKey("src1");
        liked.setScore(0.9);
        AffinityProfile profile = AffinityProfile.of(List.of(liked));
        RankedItem fromLiked = Fixtures.item("x", "SRC1", 0.5, List.of("tech"), NOW);
        RankedItem other = Fixtures.item("y", "src2", 0.5, List.of("tech"), NOW);

        assertThat(PersonalizationOverlay.learnedAffinity(fromLiked, null, profile)).isGreaterThan(0.0);
        assertThat(PersonalizationOverlay.learnedAffinity(other, null, profile)).isEqualTo(0.0);
        assertThat(PersonalizationOverlay.learnedAffinity(fromLiked, null, AffinityProfile.empty())).isEqualTo(0.0);
    }

    @Test
    void learnedAffinityPrefersArticleTagsAndInterests() {
        FeatureAffinity interest = new FeatureAffinity();
        interest.setFeatureType(FeatureExtractor.INTEREST);
        interest.setFeatureKey("int-space");
        interest.setScore(-0.8);
        Article a = Fixtures.article("x", "src9", "Orbital launch", NOW);
        a.setInterestMatches(new ArrayList<>(List.of("INT-SPACE")));

        double lift = PersonalizationOverlay.learnedAffinity(Fixtures.item("x", "src9", 0.5, List.of(), NOW), a,
                AffinityProfile.of(List.of(interest)));

        assertThat(lift).isLessThan(0.0).isGreaterThanOrEqualTo(-0.5);
    }

    @Test
    void reasonsAreMergedAndCapped() {
        List<String> reasons = PersonalizationOverlay.mergeReasons(List.of("Multi-source", "Tier-1 source", "Very fresh"),
                0.5, Mood.FOCUSED, 0.7, 0.9);

        assertThat(reasons).containsExactly("Multi-source", "Tier-1 source", "Very fresh", "Matches your topics");
        assertThat(PersonalizationOverlay.mergeReasons(List.of(), 0, Mood.SAD, 0.6, Double.NaN))
                .containsExactly("Tuned for Sad");
    }

    @Test
    void interestOverlapIsAShareOfTopics() {
        assertThat(PersonalizationOverlay.overlap(List.of("AI", "chips", "space", "tech"), Set.of("ai", "space"))).isEqualTo(0.5);
        assertThat(PersonalizationOverlay.overlap(List.of(), Set.of("ai"))).isEqualTo(0.0);
    }

    @Test
    void jitterStaysWithinOnePercent() {
        for (String id : List.of("a", "b", "article-123", "zzz", "")) {
            assertThat(PersonalizationOverlay.jitter(id)).isBetween(0.995, 1.005);
        }
    }
}

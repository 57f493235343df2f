package quest.gekko.pulse.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.pulse.Fixtures;
import quest.gekko.pulse.domain.Article;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImportanceScorerTest {
    private static final Instant NOW = Instant.parse("2026-10-17T14:00:00Z");

    private final ImportanceScorer scorer = new ImportanceScorer(Fixtures.scoring());

    @Test
    void plainFreshStoryScoresRecencyAndArousal() {
        Article a = Fixtures.article("a1", "Local Gazette", "Town council meets", NOW.minusSeconds(3600));

        ScoredCandidate s = scorer.score(new CandidateCluster("k", a, 1), NOW);

        double expected = 1.1 + Math.log10(2) * 0.7 + 0.5 * 0.25;
        assertThat(s.raw()).isCloseTo(expected, within(1e-9));
        assertThat(s.reasons()).containsExactly("Very fresh");
    }

    @Test
    void tierOneSourceIsBoostedCaseInsensitively() {
        Article plain = Fixtures.article("a1", "Local Gazette", "Town council meets", NOW.minusSeconds(3600));
        Article tier1 = Fixtures.article("a2", "reuters", "Town council meets", NOW.minusSeconds(3600));

        double base = scorer.score(new CandidateCluster("k1", plain, 1), NOW).raw();
        ScoredCandidate boosted = scorer.score(new CandidateCluster("k2", tier1, 1), NOW);

        assertThat(boosted.raw()).isCloseTo(base * 1.25, within(1e-9));
        assertThat(boosted.reasons()).contains("Tier-1 source");
    }

    @Test
    void eventKeywordsAndPatternsAddUpAndPromotionsArePenalized() {
        assertThat(scorer.eventBoost("ceasefire holds as 12 killed in border clash")).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.eventBoost("court verdict on tariff")).isCloseTo(0.25 + 0.25 + 0.2, within(1e-9));
        assertThat(scorer.eventBoost("best laptop deal: 30% off in our buying guide")).isCloseTo(-1.05, within(1e-9));
    }

    @Test
    void corroboratedHighImpactStoryCarriesReasons() {
        Article a = Fixtures.article("a1", "AP News", "Earthquake: 40 dead after tremor", NOW.minusSeconds(8 * 3600));

        ScoredCandidate s = scorer.score(new CandidateCluster("k", a, 3), NOW);

        assertThat(s.reasons()).containsExactly("Multi-source", "Tier-1 source", "High-impact keywords");
    }
}

package quest.gekko.pulse.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.pulse.Fixtures;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.service.store.InMemoryArticleStore;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidatePoolBuilderTest {
    private static final Instant NOW = Instant.parse("2026-10-17T14:20:00Z");
    private static final Instant MIDNIGHT = Instant.parse("2026-10-17T00:00:00Z");

    @Test
    void duplicatesCollapseToLatestPublishedRepresentative() {
        Article older = Fixtures.article("a1", "Reuters", "Ceasefire agreed", NOW.minusSeconds(7200));
        older.setUrl("https://www.wire.example/ceasefire/?utm_source=rss");
        Article newer = Fixtures.article("a2", "AP News", "Ceasefire agreed in region", NOW.minusSeconds(3600));
        newer.setUrl("https://wire.example/ceasefire#live");
        Article other = Fixtures.article("a3", "BBC News", "Markets rally", NOW.minusSeconds(600));

        List<CandidateCluster> clusters = CandidatePoolBuilder.cluster(List.of(older, newer, other));

        assertThat(clusters).hasSize(2);
        CandidateCluster ceasefire = clusters.get(0);
        assertThat(ceasefire.clusterKey()).isEqualTo("https://wire.example/ceasefire");
        assertThat(ceasefire.representative().getId()).isEqualTo("a2");
        assertThat(ceasefire.sourceCount()).isEqualTo(2);
        assertThat(clusters.get(1).sourceCount()).isEqualTo(1);
    }

    @Test
    void publishTieIsBrokenByLatestIngestion() {
        Instant published = NOW.minusSeconds(1800);
        Article first = Fixtures.article("a1", "Reuters", "Same story", published);
        first.setUrl("https://wire.example/same");
        first.setCreatedAt(published.plusSeconds(60));
        Article second = Fixtures.article("a2", "Reuters", "Same story", published);
        second.setUrl("https://wire.example/same/");
        second.setCreatedAt(published.plusSeconds(120));

        List<CandidateCluster> clusters = CandidatePoolBuilder.cluster(List.of(first, second));

        assertThat(clusters).singleElement()
                .satisfies(c -> {
                    assertThat(c.representative().getId()).isEqualTo("a2");
                    assertThat(c.sourceCount()).isEqualTo(1);
                });
    }

    @Test
    void articleWithoutUrlClustersByItsId() {
        Article a = Fixtures.article("Raw-Id", "Reuters", "No link", NOW);
        a.setUrl(null);

        assertThat(CandidatePoolBuilder.clusterKey(a)).isEqualTo("raw-id");
    }

    @Test
    void sparseWindowIsWidenedByIngestionTime() {
        Article published = Fixtures.article("p1", "Reuters", "Published today", NOW.minusSeconds(3600));
        Article ingestedOnly = Fixtures.article("c1", "AP News", "Old story ingested today", Instant.parse("2026-10-15T09:00:00Z"));
        ingestedOnly.setCreatedAt(NOW.minusSeconds(1200));
        InMemoryArticleStore store = new InMemoryArticleStore().add(published, ingestedOnly);

        List<CandidateCluster> clusters = new CandidatePoolBuilder(store).build(MIDNIGHT, NOW);

        assertThat(clusters).extracting(c -> c.representative().getId()).containsExactlyInAnyOrder("p1", "c1");
    }

    @Test
    void emptyWindowYieldsNoClusters() {
        assertThat(new CandidatePoolBuilder(new InMemoryArticleStore()).build(MIDNIGHT, NOW)).isEmpty();
    }
}

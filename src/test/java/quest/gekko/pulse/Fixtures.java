package quest.gekko.pulse;

import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.domain.Trend;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    private Fixtures() {}

    public static PulseProperties.General general() {
        return new PulseProperties.General("UTC", 12);
    }

    public static PulseProperties.Snapshot snapshot() {
        return new PulseProperties.Snapshot(60, 3, 12);
    }

    public static PulseProperties.Read read() {
        return new PulseProperties.Read(5, 8);
    }

    public static PulseProperties.Reranker reranker() {
        return new PulseProperties.Reranker(true, 80, null, 12);
    }

    public static PulseProperties.Personal personal() {
        return new PulseProperties.Personal(0.3, 2, 12, 4, 0.12, null);
    }

    public static PulseProperties.Scoring scoring() {
        return new PulseProperties.Scoring(
                List.of("Reuters", "AP News", "BBC News"),
                List.of("ceasefire", "election", "verdict", "tariff", "earthquake", "inflation"),
                List.of("deal", "% off", "discount", "review", "buying guide", "roundup"));
    }

    public static Article article(String id, String source, String title, Instant publishedAt) {
        Article a = new Article();
        a.setId(id);
        a.setUrl("https://" + source.toLowerCase().replace(' ', '-') + ".example/" + id);
        a.setSourceId(source);
        a.setTitle(title);
        a.setPublishedAt(publishedAt);
        a.setCreatedAt(publishedAt);
        a.setTags(new ArrayList<>());
        return a;
    }

    public static RankedItem item(String id, String source, double heat, List<String> topics, Instant publishedAt) {
        return RankedItem.builder()
                .articleId(id)
                .clusterId(id)
                .scoreGlobal(heat)
                .heat(heat)
                .trend(Trend.STEADY)
                .title("Story " + id)
                .sourceId(source)
                .topics(topics)
                .publishedAt(publishedAt)
                .summary("Summary of " + id)
                .build();
    }
}

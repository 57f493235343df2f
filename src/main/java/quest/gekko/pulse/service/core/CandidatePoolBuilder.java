package quest.gekko.pulse.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.service.store.ArticleStore;
import quest.gekko.pulse.util.UrlCanonicalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class CandidatePoolBuilder {
    static final int FETCH_LIMIT = 400;
    static final int WIDEN_BELOW = 10;

    /** Latest publish time first, then latest ingestion time. */
    static final Comparator<Article> REPRESENTATIVE_ORDER = Comparator
            .comparing(Article::getPublishedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Article::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Article::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ArticleStore articleStore;

    public List<CandidateCluster> build(Instant start, Instant end) {
        List<Article> articles = new ArrayList<>(articleStore.queryByPublishedWindow(start, end, FETCH_LIMIT));
        if (articles.size() < WIDEN_BELOW) {
            Set<String> seen = new TreeSet<>();
            articles.forEach(a -> seen.add(a.getId()));
            int before = articles.size();
            for (Article a : articleStore.queryByCreatedWindow(start, end, FETCH_LIMIT)) {
                if (seen.add(a.getId())) articles.add(a);
            }
            log.debug("Widened candidate window by ingestion time: {} -> {}", before, articles.size());
        }
        return cluster(articles);
    }

    static List<CandidateCluster> cluster(List<Article> articles) {
        Map<String, List<Article>> groups = new LinkedHashMap<>();
        for (Article a : articles) {
            groups.computeIfAbsent(clusterKey(a), k -> new ArrayList<>()).add(a);
        }
        List<CandidateCluster> out = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Article>> e : groups.entrySet()) {
            List<Article> members = e.getValue();
            Article rep = members.stream().sorted(REPRESENTATIVE_ORDER).findFirst().orElseThrow();
            Set<String> sources = new TreeSet<>();
            for (Article m : members) {
                sources.add(m.getSourceId() == null ? "src" : m.getSourceId().toLowerCase(Locale.ROOT));
            }
            out.add(new CandidateCluster(e.getKey(), rep, sources.size()));
        }
        return out;
    }

    static String clusterKey(Article a) {
        String url = a.getUrl() == null || a.getUrl().isBlank() ? a.getId() : a.getUrl();
        return UrlCanonicalizer.canonicalize(url);
    }
}

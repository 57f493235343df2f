package quest.gekko.pulse.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.domain.Trend;
import quest.gekko.pulse.service.integration.reranker.ImportanceReranker;
import quest.gekko.pulse.service.integration.reranker.RerankChoice;
import quest.gekko.pulse.service.integration.reranker.RerankInput;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Turns heuristically scored candidates into ranked items, deferring to the reranking oracle when
 * one is configured and falling back to the heuristic order whenever it is not usable.
 */
@Slf4j
@Service
public class RerankerAdapter {
    static final int MIN_WINDOW_FOR_ORACLE = 10;
    static final double MIN_ORACLE_SCORE = 0.0001;

    private final Optional<ImportanceReranker> reranker;
    private final PulseProperties.Reranker settings;
    private final PulseProperties.Snapshot snapshot;

    public RerankerAdapter(Optional<ImportanceReranker> reranker, PulseProperties.Reranker settings, PulseProperties.Snapshot snapshot) {
        this.reranker = reranker;
        this.settings = settings;
        this.snapshot = snapshot;
    }

    /**
     * @param scored         every candidate of the cycle, any order
     * @param take           number of items the surface shows
     * @param heuristicsOnly skip the oracle even when configured
     */
    public List<RankedItem> rank(List<ScoredCandidate> scored, int take, boolean heuristicsOnly) {
        List<ScoredCandidate> window = scored.stream()
                .sorted(Comparator.comparingDouble(ScoredCandidate::raw).reversed())
                .limit(settings.clampedMaxCandidates())
                .toList();
        if (window.isEmpty()) return List.of();

        boolean useOracle = !heuristicsOnly && settings.enabled() && reranker.isPresent()
                && window.size() >= MIN_WINDOW_FOR_ORACLE;
        if (useOracle) {
            int topK = settings.resolveTopK(take);
            try {
                List<RerankChoice> choices = reranker.get().rerank(inputs(window), topK);
                List<RankedItem> merged = merge(window, choices, topK);
                if (!merged.isEmpty()) return merged;
                log.info("Reranker returned nothing usable, using heuristic order");
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Reranker failed, using heuristic order: {}", e.getMessage());
            }
        }
        int count = Math.max(snapshot.clampedStoreCount(), Math.max(take * 2, 12));
        return heuristicOnly(window, count);
    }

    static List<RankedItem> merge(List<ScoredCandidate> window, List<RerankChoice> choices, int topK) {
        if (choices == null || choices.isEmpty()) return List.of();
        Map<String, ScoredCandidate> byId = new HashMap<>();
        for (ScoredCandidate c : window) byId.putIfAbsent(c.article().getId(), c);

        List<Scored> picked = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (RerankChoice ch : choices) {
            ScoredCandidate c = byId.get(ch.id());
            if (c == null || !used.add(ch.id())) continue;
            picked.add(new Scored(c, Math.max(MIN_ORACLE_SCORE, ch.score()), merge(c.reasons(), ch.reasons())));
            if (picked.size() >= topK) break;
        }
        if (picked.isEmpty()) return List.of();

        int wanted = Math.min(topK, window.size());
        for (ScoredCandidate c : window) {
            if (picked.size() >= wanted) break;
            if (used.add(c.article().getId())) picked.add(new Scored(c, c.raw(), c.reasons()));
        }
        return normalize(picked);
    }

    static List<RankedItem> heuristicOnly(List<ScoredCandidate> window, int count) {
        List<Scored> picked = window.stream()
                .limit(count)
                .map(c -> new Scored(c, c.raw(), c.reasons()))
                .toList();
        return normalize(picked);
    }

    private static List<RankedItem> normalize(List<Scored> picked) {
        double min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
        for (Scored s : picked) {
            min = Math.min(min, s.score());
            max = Math.max(max, s.score());
        }
        double span = Math.max(1e-6, max - min);
        List<RankedItem> out = new ArrayList<>(picked.size());
        for (Scored s : picked) {
            Article a = s.candidate().article();
            out.add(RankedItem.builder()
                    .articleId(a.getId())
                    .clusterId(s.candidate().cluster().clusterKey())
                    .scoreGlobal(s.score())
                    .heat(Math.max(0, Math.min(1, (s.score() - min) / span)))
                    .trend(Trend.STEADY)
                    .reasons(s.reasons())
                    .topics(a.getTags() == null ? List.of() : a.getTags().stream().limit(6).toList())
                    .title(a.getTitle() == null ? "" : a.getTitle())
                    .sourceId(a.getSourceId())
                    .publishedAt(a.getPublishedAt() != null ? a.getPublishedAt() : a.getCreatedAt())
                    .summary(a.getSummary())
                    .imageUrl(a.getImageUrl())
                    .arousal(a.getArousal())
                    .build());
        }
        return out;
    }

    private static List<String> merge(List<String> heuristic, List<String> oracle) {
        Set<String> r = new LinkedHashSet<>(heuristic);
        if (oracle != null) r.addAll(oracle);
        return r.stream().limit(4).toList();
    }

    private static List<RerankInput> inputs(List<ScoredCandidate> window) {
        return window.stream().map(c -> {
            Article a = c.article();
            return new RerankInput(a.getId(), a.getTitle(), a.getSourceId(),
                    a.getPublishedAt() != null ? a.getPublishedAt() : a.getCreatedAt(), a.getSummary(),
                    a.getTags() == null ? List.of() : a.getTags());
        }).toList();
    }

    private record Scored(ScoredCandidate candidate, double score, List<String> reasons) {}
}

package quest.gekko.pulse.service.core;

import quest.gekko.pulse.domain.Article;

import java.util.List;

public record ScoredCandidate(CandidateCluster cluster, double raw, List<String> reasons) {

    public Article article() {
        return cluster.representative();
    }
}

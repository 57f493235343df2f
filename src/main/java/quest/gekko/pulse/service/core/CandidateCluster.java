package quest.gekko.pulse.service.core;

import quest.gekko.pulse.domain.Article;

/**
 * Near-duplicate articles collapsed under one canonical url. {@code sourceCount} is the number of
 * distinct sources that ran the story.
 */
public record CandidateCluster(String clusterKey, Article representative, int sourceCount) {
}

package quest.gekko.pulse.service.personal;

import lombok.Builder;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.service.store.AffinityProfile;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the overlay needs for one user, already loaded.
 *
 * @param mood     null when the user has no mood set
 * @param articles full articles for the pool, by id, for embeddings and interest matches; may be partial
 */
@Builder
public record PersonalizationRequest(List<RankedItem> pool,
                                     Set<String> excludeIds,
                                     List<String> interests,
                                     Mood mood,
                                     double blend,
                                     int target,
                                     AffinityProfile profile,
                                     double[] userCentroid,
                                     double[] globalCentroid,
                                     Map<String, Article> articles,
                                     Instant now) {
}

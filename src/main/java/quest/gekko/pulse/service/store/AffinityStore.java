package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.FeatureAffinity;
import quest.gekko.pulse.domain.FeedbackEvent;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.MoodCentroid;

import java.util.Optional;

/**
 * State of the online learner: feature affinities, mood centroids and the feedback log.
 */
public interface AffinityStore {

    Optional<FeatureAffinity> findAffinity(String id);

    void saveAffinity(FeatureAffinity affinity);

    AffinityProfile profile(String userId, Mood mood);

    Optional<MoodCentroid> findCentroid(String id);

    void saveCentroid(MoodCentroid centroid);

    void appendFeedback(FeedbackEvent event);
}

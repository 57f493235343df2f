package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.FeatureAffinity;
import quest.gekko.pulse.domain.FeedbackEvent;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.MoodCentroid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryAffinityStore implements AffinityStore {
    private final Map<String, FeatureAffinity> affinities = new LinkedHashMap<>();
    private final Map<String, MoodCentroid> centroids = new LinkedHashMap<>();
    private final List<FeedbackEvent> feedback = new ArrayList<>();

    @Override
    public Optional<FeatureAffinity> findAffinity(String id) {
        return Optional.ofNullable(affinities.get(id));
    }

    @Override
    public void saveAffinity(FeatureAffinity affinity) {
        affinities.put(affinity.getId(), affinity);
    }

    @Override
    public AffinityProfile profile(String userId, Mood mood) {
        return AffinityProfile.of(affinities.values().stream()
                .filter(a -> a.getUserId().equals(userId) && a.getMood().equals(mood.key()))
                .toList());
    }

    @Override
    public Optional<MoodCentroid> findCentroid(String id) {
        return Optional.ofNullable(centroids.get(id));
    }

    @Override
    public void saveCentroid(MoodCentroid centroid) {
        centroids.put(centroid.getId(), centroid);
    }

    @Override
    public void appendFeedback(FeedbackEvent event) {
        feedback.add(event);
    }

    public Map<String, FeatureAffinity> affinities() {
        return affinities;
    }

    public List<FeedbackEvent> feedback() {
        return feedback;
    }
}

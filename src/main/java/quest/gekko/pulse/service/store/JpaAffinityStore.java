package quest.gekko.pulse.service.store;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pulse.domain.FeatureAffinity;
import quest.gekko.pulse.domain.FeedbackEvent;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.MoodCentroid;
import quest.gekko.pulse.exception.StoreUnavailableException;
import quest.gekko.pulse.repository.FeatureAffinityRepository;
import quest.gekko.pulse.repository.FeedbackEventRepository;
import quest.gekko.pulse.repository.MoodCentroidRepository;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaAffinityStore implements AffinityStore {
    private final FeatureAffinityRepository affinityRepository;
    private final MoodCentroidRepository centroidRepository;
    private final FeedbackEventRepository feedbackRepository;

    @Override
    public Optional<FeatureAffinity> findAffinity(String id) {
        try {
            return affinityRepository.findById(id);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Affinity read failed", e);
        }
    }

    @Override
    @Transactional
    public void saveAffinity(FeatureAffinity affinity) {
        try {
            affinityRepository.save(affinity);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Affinity write failed for " + affinity.getId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public AffinityProfile profile(String userId, Mood mood) {
        try {
            return AffinityProfile.of(affinityRepository.findByUserIdAndMood(userId, mood.key()));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Affinity profile read failed for " + userId, e);
        }
    }

    @Override
    public Optional<MoodCentroid> findCentroid(String id) {
        try {
            return centroidRepository.findById(id);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Centroid read failed for " + id, e);
        }
    }

    @Override
    @Transactional
    public void saveCentroid(MoodCentroid centroid) {
        try {
            centroidRepository.save(centroid);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Centroid write failed for " + centroid.getId(), e);
        }
    }

    @Override
    @Transactional
    public void appendFeedback(FeedbackEvent event) {
        try {
            feedbackRepository.save(event);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Feedback append failed", e);
        }
    }
}

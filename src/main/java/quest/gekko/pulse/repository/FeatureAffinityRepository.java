package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.FeatureAffinity;

import java.util.List;

public interface FeatureAffinityRepository extends JpaRepository<FeatureAffinity, String> {
    List<FeatureAffinity> findByUserIdAndMood(final String userId, final String mood);
}

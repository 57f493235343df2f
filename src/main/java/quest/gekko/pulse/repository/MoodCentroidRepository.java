package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.MoodCentroid;

public interface MoodCentroidRepository extends JpaRepository<MoodCentroid, String> {
}

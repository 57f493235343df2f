package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.FeedbackEvent;

public interface FeedbackEventRepository extends JpaRepository<FeedbackEvent, String> {
}

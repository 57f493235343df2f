package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.UserMood;

public interface UserMoodRepository extends JpaRepository<UserMood, String> {
}

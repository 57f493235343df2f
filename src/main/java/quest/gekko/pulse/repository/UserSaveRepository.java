package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.UserSave;

import java.util.Collection;
import java.util.List;

public interface UserSaveRepository extends JpaRepository<UserSave, Long> {
    List<UserSave> findByUserIdAndArticleIdIn(final String userId, final Collection<String> articleIds);
}

package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.Interest;

import java.util.List;

public interface InterestRepository extends JpaRepository<Interest, String> {
    List<Interest> findAllByOrderBySortOrderAsc();
}

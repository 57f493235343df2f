package quest.gekko.pulse.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.PulseSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PulseSnapshotRepository extends JpaRepository<PulseSnapshot, Long> {
    Optional<PulseSnapshot> findBySnapshotDateAndSnapshotHour(final LocalDate date, final int hour);
    boolean existsBySnapshotDateAndSnapshotHour(final LocalDate date, final int hour);
    List<PulseSnapshot> findBySnapshotDateOrderBySnapshotHourAsc(final LocalDate date);
}

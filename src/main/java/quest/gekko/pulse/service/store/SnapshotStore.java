package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.HourSnapshot;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Keyed by (date, hour). A write replaces the whole hour.
 */
public interface SnapshotStore {

    Optional<HourSnapshot> get(LocalDate date, int hour);

    void set(HourSnapshot snapshot);

    boolean exists(LocalDate date, int hour);

    /** Every stored hour of the day, ascending. */
    List<HourSummary> listHours(LocalDate date);

    record HourSummary(int hour, int count, Instant updatedAt) {}
}

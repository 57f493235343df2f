package quest.gekko.pulse.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record HourSnapshot(LocalDate date, int hour, Instant updatedAt, List<RankedItem> items) {

    public HourSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static HourSnapshot empty(LocalDate date, int hour, Instant updatedAt) {
        return new HourSnapshot(date, hour, updatedAt, List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}

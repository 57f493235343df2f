package quest.gekko.pulse.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The Pulse page for today: Global, Personal (empty for anonymous readers) and the hour timeline.
 */
public record PulseTodayDTO(
        LocalDate date,
        int currentHour,
        Instant updatedAt,
        List<PulseItemDTO> global,
        List<PulseItemDTO> personal,
        List<TimelineHourDTO> timeline
) {
}

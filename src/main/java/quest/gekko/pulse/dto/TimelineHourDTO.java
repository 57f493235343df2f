package quest.gekko.pulse.dto;

import java.time.Instant;

public record TimelineHourDTO(int hour, int count, Instant updatedAt) {
}

package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One row per (date, hour). The ranked items live in a single JSON document so a write replaces
 * the whole hour.
 */
@Entity
@Table(name = "pulse_snapshot", uniqueConstraints = @UniqueConstraint(columnNames = {"snapshotDate", "snapshotHour"}))
@Getter @Setter
public class PulseSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    LocalDate snapshotDate;

    int snapshotHour;

    Instant updatedAt;

    int itemCount;

    @Column(columnDefinition = "text")
    String itemsJson;
}

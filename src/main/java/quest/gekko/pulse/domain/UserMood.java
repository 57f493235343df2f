package quest.gekko.pulse.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "user_mood")
@Getter @Setter
public class UserMood {
    @Id
    String userId;

    String mood;
    double blend; // 0 = comfort, 1 = challenge
    Instant setAt;
}

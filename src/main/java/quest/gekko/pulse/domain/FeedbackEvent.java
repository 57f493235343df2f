package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "feedback_event", indexes = @Index(name = "idx_feedback_user", columnList = "userId, createdAt"))
@Getter @Setter
public class FeedbackEvent {
    @Id
    String id;

    String userId;
    String articleId;
    String mood;

    @Enumerated(EnumType.STRING)
    FeedbackAction action;

    Instant createdAt;
}

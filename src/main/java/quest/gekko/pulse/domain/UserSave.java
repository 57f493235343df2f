package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "user_save", uniqueConstraints = @UniqueConstraint(columnNames = {"userId", "articleId"}))
@Getter @Setter
public class UserSave {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    String userId;
    String articleId;
    Instant savedAt;
}

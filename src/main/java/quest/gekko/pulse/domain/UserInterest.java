package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "user_interest", indexes = @Index(name = "idx_user_interest_user", columnList = "userId"))
@Getter @Setter
public class UserInterest {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    String userId;
    String name;
    boolean custom;
}

package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Learned preference of one user, in one mood, for one feature. Score stays within [-1, 1].
 */
@Entity
@Table(name = "feature_affinity", indexes = @Index(name = "idx_affinity_user_mood", columnList = "userId, mood"))
@Getter @Setter
public class FeatureAffinity {
    @Id
    @Column(length = 768)
    String id; // user|mood|type|key

    String userId;
    String mood;
    String featureType;

    @Column(length = 512)
    String featureKey;

    double score;
    int observations;
    Instant updatedAt;

    public static String idFor(String userId, String mood, String type, String key) {
        return userId + "|" + mood + "|" + type + "|" + key;
    }
}

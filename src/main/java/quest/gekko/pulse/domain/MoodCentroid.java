package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Running unit-norm centroid of article embeddings for a (user, mood) or, with {@link CentroidScope#GLOBAL}, for a mood.
 */
@Entity
@Table(name = "mood_centroid")
@Getter @Setter
public class MoodCentroid {
    @Id
    String id;

    @Enumerated(EnumType.STRING)
    CentroidScope scope;

    String userId; // null for GLOBAL
    String mood;

    @Convert(converter = DoubleArrayConverter.class)
    @Column(columnDefinition = "text")
    double[] vector;

    long observations;
    Instant updatedAt;

    public static String userScopeId(String userId, Mood mood) {
        return "user:" + userId + ":" + mood.key();
    }

    public static String globalScopeId(Mood mood) {
        return "global:" + mood.key();
    }
}

package quest.gekko.pulse.domain;

import java.util.Locale;
import java.util.Optional;

public enum Mood {
    CALM("Calm"),
    FOCUSED("Focused"),
    CURIOUS("Curious"),
    HYPED("Hyped"),
    MEH("Meh"),
    STRESSED("Stressed"),
    SAD("Sad");

    private final String displayName;

    Mood(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Lowercase key used in affinity and centroid ids. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Mood> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String k = raw.trim().toUpperCase(Locale.ROOT);
        for (Mood m : values()) {
            if (m.name().equals(k)) return Optional.of(m);
        }
        return Optional.empty();
    }

    /** Unknown or blank moods normalize to {@link #CALM}. */
    public static Mood normalize(String raw) {
        return parse(raw).orElse(CALM);
    }
}

package quest.gekko.pulse.service.personal;

import org.springframework.stereotype.Component;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.service.personal.MoodProfile.RecencyBand;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table of mood profiles. Adding a mood means adding a row here.
 */
@Component
public class MoodProfiles {
    static final int DEFAULT_LOOKBACK = 6;

    private static final Map<Mood, MoodProfile> TABLE = new EnumMap<>(Mood.class);

    static {
        put(new MoodProfile(Mood.CALM, List.of("wholesome", "nature", "uplift", "guide"),
                false, false, 0.6, 0.15, null, 6, "🌿"));
        put(new MoodProfile(Mood.FOCUSED, List.of("analysis", "policy", "report"),
                true, false, 0.7, 0, new RecencyBand(2, Double.MAX_VALUE, 0.1, -0.05), 8, "📊"));
        put(new MoodProfile(Mood.CURIOUS, List.of("science", "research", "discovery", "space"),
                true, false, 0.7, 0, null, 6, "🔍"));
        put(new MoodProfile(Mood.HYPED, List.of("live", "sports", "launch", "win"),
                false, true, 0.7, 0, new RecencyBand(0, 3, 0.25, 0), 3, "🔥"));
        put(new MoodProfile(Mood.MEH, List.of("roundup", "recap", "list", "visual", "summary"),
                false, false, 0.65, 0, null, 4, "☕"));
        put(new MoodProfile(Mood.STRESSED, List.of("solutions", "how to", "how-to"),
                true, false, 0.7, 0, new RecencyBand(1.5, Double.MAX_VALUE, 0.05, 0), 5, "🧩"));
        put(new MoodProfile(Mood.SAD, List.of("human", "good news", "wholesome", "community", "uplift"),
                false, false, 0.75, 0, null, 6, "💙"));
    }

    private static void put(MoodProfile p) {
        TABLE.put(p.mood(), p);
    }

    private final PulseProperties.Personal personal;

    public MoodProfiles(PulseProperties.Personal personal) {
        this.personal = personal;
    }

    public static MoodProfile of(Mood mood) {
        return mood == null ? null : TABLE.get(mood);
    }

    /**
     * Snapshot hours to pool for personalization. Comfort (low blend) looks further back.
     */
    public int lookbackHours(Mood mood, double blend) {
        int base = DEFAULT_LOOKBACK;
        MoodProfile p = of(mood);
        if (p != null) {
            Integer override = personal.lookbackOverride(mood);
            base = override != null ? override : p.lookbackHours();
        }
        base = Math.max(2, Math.min(12, base));
        int adjusted = base + (int) Math.round((0.5 - blend) * 2);
        return Math.max(3, Math.min(8, adjusted));
    }
}

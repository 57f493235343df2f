package quest.gekko.pulse.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import quest.gekko.pulse.domain.Mood;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the ranking engine. Out of range values are clamped by the accessors,
 * never rejected.
 */
@Configuration
@EnableConfigurationProperties({
        PulseProperties.General.class,
        PulseProperties.Snapshot.class,
        PulseProperties.Read.class,
        PulseProperties.Reranker.class,
        PulseProperties.Personal.class,
        PulseProperties.Scoring.class,
        PulseProperties.Lookup.class,
        PulseProperties.Interests.class,
        PulseProperties.OpenAi.class
})
public class PulseProperties {

    @ConfigurationProperties("pulse")
    public record General(@DefaultValue("America/New_York") String timezone,
                          @DefaultValue("12") int take) {
        public ZoneId zone() {
            return ZoneId.of(timezone);
        }

        public int clampedTake() {
            return clamp(take, 6, 20);
        }
    }

    @ConfigurationProperties("pulse.snapshot")
    public record Snapshot(@DefaultValue("60") int storeCount,
                           @DefaultValue("3") int perSourceCap,
                           @DefaultValue("12") int perBucketCap) {
        public int clampedStoreCount() {
            return clamp(storeCount, 20, 120);
        }

        public int clampedPerSourceCap() {
            return clamp(perSourceCap, 1, 5);
        }

        public int clampedPerBucketCap() {
            return clamp(perBucketCap, 4, 24);
        }
    }

    @ConfigurationProperties("pulse.read")
    public record Read(@DefaultValue("5") int warmupMinutes,
                       @DefaultValue("8") int onDemandAfterMinutes) {
        public int clampedWarmupMinutes() {
            return clamp(warmupMinutes, 0, 20);
        }

        public int clampedOnDemandAfterMinutes() {
            return clamp(onDemandAfterMinutes, 0, 59);
        }
    }

    @ConfigurationProperties("pulse.reranker")
    public record Reranker(@DefaultValue("true") boolean enabled,
                           @DefaultValue("80") int maxCandidates,
                           Integer topK,
                           @DefaultValue("12") int timeoutSeconds) {
        public int clampedMaxCandidates() {
            return clamp(maxCandidates, 20, 200);
        }

        public int resolveTopK(int take) {
            int requested = topK != null ? topK : take;
            return clamp(requested, 6, Math.max(6, take));
        }

        public int effectiveTimeoutSeconds() {
            return Math.max(4, timeoutSeconds);
        }
    }

    @ConfigurationProperties("pulse.personal")
    public record Personal(@DefaultValue("0.3") double defaultBlend,
                           @DefaultValue("2") int perSourceCap,
                           @DefaultValue("12") int perBucketCap,
                           @DefaultValue("4") int minDistinctBuckets,
                           @DefaultValue("0.12") double minDeltaFromGlobal,
                           Map<String, Integer> lookbackHours) {
        public int clampedPerSourceCap() {
            return clamp(perSourceCap, 1, 4);
        }

        public int clampedPerBucketCap() {
            return clamp(perBucketCap, 4, 24);
        }

        public int clampedMinDistinctBuckets() {
            return clamp(minDistinctBuckets, 2, 8);
        }

        public double clampedMinDeltaFromGlobal() {
            return Math.max(0, Math.min(0.5, minDeltaFromGlobal));
        }

        /** Configured lookback override for a mood, keyed by lowercase mood name. */
        public Integer lookbackOverride(Mood mood) {
            return lookbackHours == null ? null : lookbackHours.get(mood.key());
        }
    }

    @ConfigurationProperties("pulse.scoring")
    public record Scoring(
            @DefaultValue({"NYT > Top Stories", "AP News", "Reuters", "The Wall Street Journal", "Financial Times",
                    "Bloomberg", "BBC News", "The Washington Post", "The Associated Press", "NPR"})
            List<String> tier1Sources,
            @DefaultValue({"ceasefire", "election", "verdict", "lawsuit", "indictment", "sanction", "tariff",
                    "acquisition", "merger", "bankruptcy", "recall", "breach", "strike", "earthquake", "hurricane",
                    "wildfire", "explosion", "shooting", "casualties", "evacuation", "gdp", "inflation",
                    "jobs report", "interest rate", "earnings"})
            List<String> boostKeywords,
            @DefaultValue({"deal", "% off", "discount", "sale", "coupon", "promo", "hands-on", "review",
                    "best price", "buying guide", "how to", "tips", "roundup"})
            List<String> penaltyKeywords) {
    }

    @ConfigurationProperties("pulse.lookup")
    public record Lookup(@DefaultValue("10") int chunkSize,
                         @DefaultValue("4") int threads) {
    }

    @ConfigurationProperties("pulse.interests")
    public record Interests(@DefaultValue("2000") long cacheSize,
                            @DefaultValue("0.23") double threshold,
                            @DefaultValue("10") int maxMatches) {
    }

    @ConfigurationProperties("openai")
    public record OpenAi(@DefaultValue("https://api.openai.com") String baseUrl,
                         String apiKey,
                         @DefaultValue("gpt-4o-mini") String chatModel,
                         @DefaultValue("text-embedding-3-small") String embeddingModel) {
        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}

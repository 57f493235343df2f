package quest.gekko.pulse.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class RankedItem {
    String articleId;
    String clusterId;

    double scoreGlobal;
    double heat;
    Trend trend;

    @Builder.Default List<String> reasons = List.of();
    @Builder.Default List<String> topics = List.of();

    String title;
    String sourceId;
    Instant publishedAt;
    String summary;
    String imageUrl;
    Double arousal;

    // only set on personalized results
    Double scorePersonal;

    public double strength() {
        return Math.max(scoreGlobal, heat);
    }
}

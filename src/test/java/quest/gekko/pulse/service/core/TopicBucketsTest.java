package quest.gekko.pulse.service.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TopicBucketsTest {

    @Test
    void tokensMapToTopicsOnWordBoundaries() {
        assertThat(TopicBuckets.extractTopics("Fed holds interest rate as inflation cools", null)).containsExactly("finance");
        assertThat(TopicBuckets.extractTopics("Rocket reaches orbit", "NASA confirms")).containsExactly("space");
        assertThat(TopicBuckets.extractTopics("Email outage hits users", null))
                .containsExactly("email", "outage", "hits", "users");
    }

    @Test
    void preferredBucketWinsOverTagOrder() {
        assertThat(TopicBuckets.bucketOf(List.of("Chips", "AI"))).isEqualTo("ai");
        assertThat(TopicBuckets.bucketOf(List.of(" Chips "))).isEqualTo("chips");
        assertThat(TopicBuckets.bucketOf(List.of())).isEqualTo(TopicBuckets.MISC);
        assertThat(TopicBuckets.bucketOf(null)).isEqualTo(TopicBuckets.MISC);
    }

    @Test
    void normalizeTrimsDeduplicatesAndCaps() {
        List<String> raw = Arrays.asList(" AI ", "ai", "", null, "one", "two", "three", "four", "five", "six", "seven", "eight");

        assertThat(TopicBuckets.normalize(raw)).containsExactly("AI", "one", "two", "three", "four", "five", "six", "seven");
    }

    @Test
    void tagsTakePrecedenceOverExtraction() {
        assertThat(TopicBuckets.resolve(List.of("Markets"), "Election night", null)).containsExactly("Markets");
        assertThat(TopicBuckets.resolve(List.of(" "), "Election night", null)).containsExactly("politics");
    }
}

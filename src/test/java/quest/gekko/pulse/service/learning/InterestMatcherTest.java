package quest.gekko.pulse.service.learning;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Interest;
import quest.gekko.pulse.repository.InterestRepository;
import quest.gekko.pulse.service.integration.embedding.TextEmbedder;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InterestMatcherTest {
    private final InterestRepository interests = mock(InterestRepository.class);
    private final List<String> embedded = new ArrayList<>();

    // interest names embed onto axes; everything else leans toward space
    private final TextEmbedder embedder = text -> {
        embedded.add(text);
        return switch (text) {
            case "Space" -> new float[]{1f, 0f};
            case "Finance" -> new float[]{0f, 1f};
            case "Gardening" -> new float[0];
            default -> new float[]{1f, 0.1f};
        };
    };

    private final InterestMatcher matcher = new InterestMatcher(interests, embedder,
            Caffeine.newBuilder().maximumSize(100).build(),
            new PulseProperties.Interests(100, 0.23, 10));

    private static Interest interest(String id, String name, int order) {
        Interest i = new Interest();
        i.setId(id);
        i.setName(name);
        i.setSortOrder(order);
        return i;
    }

    @BeforeEach
    void catalog() {
        when(interests.findAllByOrderBySortOrderAsc()).thenReturn(List.of(
                interest("space", "Space", 1),
                interest("finance", "Finance", 2),
                interest("garden", "Gardening", 3)));
    }

    @Test
    void similarInterestsAboveThresholdMatch() {
        assertThat(matcher.match("Rocket reaches orbit", null)).containsExactly("space");
    }

    @Test
    void lexicalHitsCanCarryAWeakEmbedding() {
        assertThat(matcher.match("Finance ministers meet", "")).containsExactly("space", "finance");
    }

    @Test
    void lexicalHitsAloneStayBelowTheThreshold() {
        assertThat(matcher.match("Gardening tips for autumn", null)).containsExactly("space");
    }

    @Test
    void interestEmbeddingsAreCachedButFailuresAreRetried() {
        matcher.match("Rocket reaches orbit", null);
        matcher.match("Another orbit story", null);

        assertThat(embedded).filteredOn("Space"::equals).hasSize(1);
        assertThat(embedded).filteredOn("Gardening"::equals).hasSize(2);
    }

    @Test
    void emptyCatalogMatchesNothing() {
        when(interests.findAllByOrderBySortOrderAsc()).thenReturn(List.of());

        assertThat(matcher.match("Anything", null)).isEmpty();
        assertThat(embedded).isEmpty();
    }
}

package quest.gekko.pulse.dto;

import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.domain.Trend;

import java.time.Instant;
import java.util.List;

/**
 * One card of the Pulse surface.
 */
public record PulseItemDTO(
        String articleId,
        String title,
        String sourceId,
        Instant publishedAt,
        String summary,
        String imageUrl,
        double heat,
        Trend trend,
        List<String> reasons,
        List<String> topics,
        double scoreGlobal,

        // only on personal cards
        Double scorePersonal,
        boolean saved
) {

    /**
     * Create a PulseItemDTO from a ranked item
     */
    public static PulseItemDTO from(RankedItem it, boolean saved) {
        return new PulseItemDTO(it.getArticleId(), it.getTitle(), it.getSourceId() == null ? "" : it.getSourceId(),
                it.getPublishedAt(), it.getSummary(), it.getImageUrl(), it.getHeat(), it.getTrend(),
                it.getReasons(), it.getTopics(), it.getScoreGlobal(), it.getScorePersonal(), saved);
    }
}

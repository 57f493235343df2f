package quest.gekko.pulse.service.integration.reranker;

import java.time.Instant;
import java.util.List;

public record RerankInput(String id, String title, String sourceId, Instant publishedAt, String summary, List<String> tags) {
}

package quest.gekko.pulse.service.integration.reranker;

import java.util.List;

/**
 * External oracle that orders candidates by editorial importance.
 */
public interface ImportanceReranker {

    /**
     * Returns at most {@code topK} choices, best first. Failures are reported as an empty list;
     * only caller cancellation ({@link java.util.concurrent.CancellationException}) escapes.
     */
    List<RerankChoice> rerank(List<RerankInput> items, int topK);
}

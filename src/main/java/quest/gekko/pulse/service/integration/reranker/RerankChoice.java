package quest.gekko.pulse.service.integration.reranker;

import java.util.List;

/**
 * One pick of the oracle. {@code score} is within [0, 1] and there are at most three reasons.
 */
public record RerankChoice(String id, double score, List<String> reasons) {
}

package quest.gekko.pulse.service.integration.reranker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.exception.RerankerException;
import quest.gekko.pulse.util.TextTokens;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.random.RandomGenerator;

/**
 * Asks an OpenAI compatible chat model to act as front-page editor over the heuristic window.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "pulse.reranker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OpenAiImportanceReranker implements ImportanceReranker {
    static final String SYSTEM_PROMPT =
            "You are a front-page editor. Rank the MOST important stories for a general audience TODAY. "
                    + "Prioritize: policy/geopolitics, major corporate actions, disasters, war/ceasefire, security, "
                    + "macro/markets, public health. Deprioritize: deals/discounts, product reviews, shopping guides, "
                    + "minor app updates, gossip. Prefer stories corroborated by reputable outlets and with wider impact. "
                    + "Return strict JSON: {\"top\":[{\"id\":\"...\",\"score\":0..1,\"reasons\":[\"...\"]}]} ";

    private final WebClient http;
    private final ObjectMapper objectMapper;
    private final PulseProperties.OpenAi openAi;
    private final Duration timeout;
    private final RerankRetryPolicy retryPolicy;
    private final RetryTemplate retryTemplate;

    @Autowired
    public OpenAiImportanceReranker(@Qualifier("openAiWebClient") WebClient http,
                                    ObjectMapper objectMapper,
                                    PulseProperties.OpenAi openAi,
                                    PulseProperties.Reranker reranker,
                                    RandomGenerator pulseRandom) {
        this(http, objectMapper, openAi, Duration.ofSeconds(reranker.effectiveTimeoutSeconds()),
                RerankRetryPolicy.DEFAULT, pulseRandom, new ThreadWaitSleeper());
    }

    OpenAiImportanceReranker(WebClient http, ObjectMapper objectMapper, PulseProperties.OpenAi openAi,
                             Duration timeout, RerankRetryPolicy retryPolicy, RandomGenerator random, Sleeper sleeper) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.openAi = openAi;
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
        this.retryTemplate = retryPolicy.newTemplate(random, sleeper);
    }

    @Override
    public List<RerankChoice> rerank(List<RerankInput> items, int topK) {
        if (items == null || items.isEmpty() || topK <= 0) return List.of();
        if (!openAi.hasApiKey()) {
            log.warn("Reranker has no API key configured, using heuristics");
            return List.of();
        }
        String payload;
        try {
            payload = payload(items, topK);
        } catch (JsonProcessingException e) {
            log.warn("Reranker payload could not be built: {}", e.getMessage());
            return List.of();
        }

        String response;
        try {
            response = retryTemplate.execute(ctx -> call(payload, ctx.getRetryCount() + 1));
        } catch (BackOffInterruptedException e) {
            throw cancelled(e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) throw cancelled(e);
            log.warn("Reranker giving up: {}", e.getMessage());
            return List.of();
        }

        try {
            return parse(response);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Reranker returned malformed JSON: {}", e.getMessage());
            return List.of();
        }
    }

    private String call(String payload, int attempt) {
        try {
            return http.post()
                    .uri("/v1/chat/completions")
                    .bodyValue(payload)
                    .exchangeToMono(resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .flatMap(body -> resp.statusCode().is2xxSuccessful()
                                    ? Mono.just(body)
                                    : Mono.<String>error(RerankerException.forStatus(resp.statusCode().value(), body))))
                    .timeout(timeout)
                    .block();
        } catch (RerankerException e) {
            log.warn("Reranker HTTP {} (attempt {}/{})", e.getStatus(), attempt, retryPolicy.maxAttempts());
            throw e;
        } catch (WebClientRequestException e) {
            log.warn("Reranker I/O error (attempt {}/{}): {}", attempt, retryPolicy.maxAttempts(), e.getMessage());
            throw new RerankerException("Reranker I/O error: " + e.getMessage(), e, true);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("Reranker timed out after {}s", timeout.toSeconds());
                throw new RerankerException("Reranker timed out", e, false);
            }
            throw e;
        }
    }

    String payload(List<RerankInput> items, int topK) throws JsonProcessingException {
        ArrayNode compact = objectMapper.createArrayNode();
        for (RerankInput i : items) {
            ObjectNode n = compact.addObject();
            n.put("id", i.id());
            n.put("t", TextTokens.truncate(i.title(), 240));
            n.put("s", i.sourceId());
            n.put("p", i.publishedAt() == null ? null : i.publishedAt().toString());
            n.put("sum", TextTokens.truncate(i.summary(), 320));
            ArrayNode tags = n.putArray("tags");
            if (i.tags() != null) i.tags().stream().limit(8).forEach(tags::add);
        }
        ObjectNode user = objectMapper.createObjectNode();
        user.set("items", compact);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", openAi.chatModel());
        body.put("temperature", 0.1);
        body.putObject("response_format").put("type", "json_object");
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system")
                .put("content", SYSTEM_PROMPT + "Limit to top " + topK + ". Keep scores monotonic (desc).");
        messages.addObject().put("role", "user").put("content", objectMapper.writeValueAsString(user));
        return objectMapper.writeValueAsString(body);
    }

    List<RerankChoice> parse(String response) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(response);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) return List.of();
        JsonNode top = objectMapper.readTree(content.asText()).path("top");
        if (!top.isArray()) return List.of();

        List<RerankChoice> out = new ArrayList<>();
        for (JsonNode el : top) {
            String id = el.path("id").asText("");
            if (id.isBlank()) continue;
            JsonNode s = el.path("score");
            double score = s.isNumber() ? TextTokens.clamp(s.asDouble(), 0, 1) : 0.5;
            List<String> reasons = new ArrayList<>(3);
            for (JsonNode r : el.path("reasons")) {
                String text = r.asText("");
                if (!text.isEmpty() && reasons.size() < 3) reasons.add(text);
            }
            out.add(new RerankChoice(id, score, reasons));
        }
        return out;
    }

    private static CancellationException cancelled(Throwable cause) {
        Thread.currentThread().interrupt();
        CancellationException ce = new CancellationException("Reranker call cancelled");
        ce.initCause(cause);
        return ce;
    }
}

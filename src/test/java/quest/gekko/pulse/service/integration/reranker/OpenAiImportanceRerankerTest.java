package quest.gekko.pulse.service.integration.reranker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import quest.gekko.pulse.config.PulseProperties;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiImportanceRerankerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final PulseProperties.OpenAi OPEN_AI =
            new PulseProperties.OpenAi("http://oracle.test", "sk-test", "gpt-4o-mini", "text-embedding-3-small");
    private static final RerankRetryPolicy FAST = new RerankRetryPolicy(3, 10, 2.0, 0);

    private final Deque<Mono<ClientResponse>> responses = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<Long> sleeps = new ArrayList<>();

    private final WebClient http = WebClient.builder()
            .baseUrl("http://oracle.test")
            .exchangeFunction(request -> {
                calls.incrementAndGet();
                Mono<ClientResponse> next = responses.poll();
                return next != null ? next : Mono.error(new IllegalStateException("unexpected call"));
            })
            .build();

    private OpenAiImportanceReranker reranker(Duration timeout, Sleeper sleeper) {
        return new OpenAiImportanceReranker(http, MAPPER, OPEN_AI, timeout, FAST, new Random(1), sleeper);
    }

    private OpenAiImportanceReranker reranker() {
        return reranker(Duration.ofSeconds(5), sleeps::add);
    }

    private void respond(HttpStatus status, String body) {
        responses.add(Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build()));
    }

    private static String chat(String content) {
        ObjectNode root = MAPPER.createObjectNode();
        root.putArray("choices").addObject().putObject("message").put("content", content);
        return root.toString();
    }

    private static List<RerankInput> inputs(int n) {
        List<RerankInput> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(new RerankInput("id" + i, "Title " + i, "Reuters", Instant.parse("2026-10-17T10:00:00Z"),
                    "Summary " + i, List.of("politics")));
        }
        return out;
    }

    private static final String TOP = "{\"top\":["
            + "{\"id\":\"id3\",\"score\":0.9,\"reasons\":[\"War\",\"Policy\",\"Markets\",\"Extra\"]},"
            + "{\"id\":\"id1\",\"score\":7},"
            + "{\"id\":\"\",\"score\":0.4},"
            + "{\"id\":\"id2\",\"score\":\"high\"}]}";

    @Test
    void parsesChoicesClampingScoresAndCappingReasons() {
        respond(HttpStatus.OK, chat(TOP));

        List<RerankChoice> choices = reranker().rerank(inputs(10), 6);

        assertThat(choices).extracting(RerankChoice::id).containsExactly("id3", "id1", "id2");
        assertThat(choices.get(0).score()).isEqualTo(0.9);
        assertThat(choices.get(0).reasons()).containsExactly("War", "Policy", "Markets");
        assertThat(choices.get(1).score()).isEqualTo(1.0);
        assertThat(choices.get(2).score()).isEqualTo(0.5);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void serverErrorsAreRetriedWithBackoff() {
        respond(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        respond(HttpStatus.BAD_GATEWAY, "");
        respond(HttpStatus.OK, chat(TOP));

        List<RerankChoice> choices = reranker().rerank(inputs(10), 6);

        assertThat(choices).hasSize(3);
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(10L, 20L);
    }

    @Test
    void rateLimitingThatNeverClearsGivesUpAfterThreeAttempts() {
        respond(HttpStatus.TOO_MANY_REQUESTS, "");
        respond(HttpStatus.TOO_MANY_REQUESTS, "");
        respond(HttpStatus.TOO_MANY_REQUESTS, "");

        assertThat(reranker().rerank(inputs(10), 6)).isEmpty();
        assertThat(calls).hasValue(3);
    }

    @Test
    void clientErrorsAreNotRetried() {
        respond(HttpStatus.BAD_REQUEST, "{\"error\":\"bad\"}");

        assertThat(reranker().rerank(inputs(10), 6)).isEmpty();
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void transientIoErrorsAreRetried() {
        responses.add(Mono.error(new WebClientRequestException(new IOException("connection reset"),
                HttpMethod.POST, URI.create("http://oracle.test/v1/chat/completions"), new HttpHeaders())));
        respond(HttpStatus.OK, chat(TOP));

        assertThat(reranker().rerank(inputs(10), 6)).hasSize(3);
        assertThat(calls).hasValue(2);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void timeoutIsNotRetried() {
        responses.add(Mono.never());

        assertThat(reranker(Duration.ofMillis(50), sleeps::add).rerank(inputs(10), 6)).isEmpty();
        assertThat(calls).hasValue(1);
    }

    @Test
    void malformedContentReadsAsNoChoices() {
        respond(HttpStatus.OK, chat("not json at all"));
        respond(HttpStatus.OK, "{\"choices\":[]}");

        assertThat(reranker().rerank(inputs(10), 6)).isEmpty();
        assertThat(reranker().rerank(inputs(10), 6)).isEmpty();
    }

    @Test
    void interruptionDuringBackoffCancelsTheCall() {
        respond(HttpStatus.SERVICE_UNAVAILABLE, "");
        OpenAiImportanceReranker interrupted = reranker(Duration.ofSeconds(5), ms -> {
            throw new InterruptedException();
        });

        try {
            assertThatThrownBy(() -> interrupted.rerank(inputs(10), 6)).isInstanceOf(CancellationException.class);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }
    }

    @Test
    void missingApiKeyMakesNoCall() {
        PulseProperties.OpenAi keyless = new PulseProperties.OpenAi("http://oracle.test", " ", "gpt-4o-mini", "e");
        OpenAiImportanceReranker noKey = new OpenAiImportanceReranker(http, MAPPER, keyless, Duration.ofSeconds(5),
                FAST, new Random(1), sleeps::add);

        assertThat(noKey.rerank(inputs(10), 6)).isEmpty();
        assertThat(calls).hasValue(0);
    }

    @Test
    void payloadCarriesCompactItemsAndTheRequestedLimit() throws Exception {
        RerankInput longOne = new RerankInput("x", "t".repeat(300), "AP News", null, null, List.of("a", "b"));

        JsonNode body = MAPPER.readTree(reranker().payload(List.of(longOne), 7));

        assertThat(body.path("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.path("response_format").path("type").asText()).isEqualTo("json_object");
        assertThat(body.path("messages").get(0).path("content").asText()).endsWith("Limit to top 7. Keep scores monotonic (desc).");
        JsonNode item = MAPPER.readTree(body.path("messages").get(1).path("content").asText()).path("items").get(0);
        assertThat(item.path("id").asText()).isEqualTo("x");
        assertThat(item.path("t").asText()).hasSize(240);
        assertThat(item.path("p").isNull()).isTrue();
        assertThat(item.path("sum").asText()).isEmpty();
    }
}

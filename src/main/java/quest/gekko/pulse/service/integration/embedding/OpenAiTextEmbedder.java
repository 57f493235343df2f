package quest.gekko.pulse.service.integration.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.util.TextTokens;

import java.time.Duration;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiTextEmbedder implements TextEmbedder {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final int MAX_INPUT_CHARS = 8_000;

    private final WebClient openAiWebClient;
    private final PulseProperties.OpenAi openAi;

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank() || !openAi.hasApiKey()) return new float[0];
        try {
            JsonNode resp = openAiWebClient.post()
                    .uri("/v1/embeddings")
                    .bodyValue(Map.of("model", openAi.embeddingModel(), "input", TextTokens.truncate(text, MAX_INPUT_CHARS)))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(TIMEOUT)
                    .block();
            JsonNode vec = resp == null ? null : resp.path("data").path(0).path("embedding");
            if (vec == null || !vec.isArray()) return new float[0];
            float[] out = new float[vec.size()];
            for (int i = 0; i < out.length; i++) out[i] = (float) vec.get(i).asDouble();
            return out;
        } catch (RuntimeException e) {
            log.warn("Embedding request failed: {}", e.getMessage());
            return new float[0];
        }
    }
}

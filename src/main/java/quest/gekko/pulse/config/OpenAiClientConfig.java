package quest.gekko.pulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class OpenAiClientConfig {

    @Bean
    public WebClient openAiWebClient(final WebClient.Builder builder, final PulseProperties.OpenAi openAi) {
        WebClient.Builder b = builder.baseUrl(openAi.baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (openAi.hasApiKey()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + openAi.apiKey());
        }
        return b.build();
    }
}

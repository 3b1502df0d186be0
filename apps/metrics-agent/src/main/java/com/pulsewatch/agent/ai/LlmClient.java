package com.pulsewatch.agent.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsewatch.agent.config.AgentProperties;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client for OpenAI-compatible {@code /chat/completions} endpoints (Groq by default).
 */
@Component
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_TOKENS = 500;

    private final AgentProperties.Ai settings;
    private final RestClient restClient;
    private final Function<String, String> environment;

    public record Message(String role, String content) {}

    public record ChatCompletionRequest(
            String model,
            List<Message> messages,
            double temperature,
            Integer max_tokens,
            double top_p) {}

    public record Completion(String text, String model) {}

    @Autowired
    public LlmClient(AgentProperties properties) {
        this(properties, System::getenv);
    }

    LlmClient(AgentProperties properties, Function<String, String> environment) {
        this.settings = properties.ai();
        this.environment = environment;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(settings.timeout());
        this.restClient = RestClient.builder()
                .baseUrl(settings.endpoint())
                .requestFactory(requestFactory)
                .build();
        log.info("LLM client configured: endpoint={}, model={}, fallbackModel={}, readTimeout={}",
                settings.endpoint(), settings.model(), settings.fallbackModel(), settings.timeout());
    }

    public boolean hasCredentials() {
        return resolveApiKey().isPresent();
    }

    public String model() {
        return settings.model();
    }

    public Optional<Completion> complete(List<Message> messages) {
        return complete(messages, settings.model(), true);
    }

    private Optional<Completion> complete(List<Message> messages, String model, boolean allowFallback) {
        Optional<String> apiKey = resolveApiKey();
        if (apiKey.isEmpty()) {
            return Optional.empty();
        }
        ChatCompletionRequest requestBody = new ChatCompletionRequest(model, messages, 0.3, MAX_TOKENS, 0.9);
        try {
            JsonNode response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(apiKey.get()))
                    .body(requestBody)
                    .retrieve()
                    .body(JsonNode.class);
            return extractText(response).map(text -> new Completion(text, model));
        } catch (RestClientResponseException ex) {
            String body = ex.getResponseBodyAsString();
            if (allowFallback && isModelUnavailable(body) && !Objects.equals(settings.fallbackModel(), model)) {
                log.warn("LLM model '{}' unavailable ({}). Retrying with '{}'.", model, ex.getStatusCode(), settings.fallbackModel());
                return complete(messages, settings.fallbackModel(), false);
            }
            log.warn("LLM call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("LLM call failed: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    private static boolean isModelUnavailable(String body) {
        return body != null && (body.contains("model_not_found") || body.contains("model_decommissioned"));
    }

    private static Optional<String> extractText(JsonNode response) {
        if (response == null) {
            return Optional.empty();
        }
        JsonNode choices = response.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            return Optional.empty();
        }
        JsonNode content = choices.get(0).path("message").path("content");
        return content.isTextual() ? Optional.of(content.asText()).filter(s -> !s.isBlank()) : Optional.empty();
    }

    private Optional<String> resolveApiKey() {
        if (settings.hasApiKey()) {
            return Optional.of(settings.apiKey());
        }
        String envKey = environment.apply("GROQ_API_KEY");
        if (envKey != null && !envKey.isBlank()) {
            return Optional.of(envKey);
        }
        return Optional.empty();
    }
}

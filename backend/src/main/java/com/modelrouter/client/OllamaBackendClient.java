package com.modelrouter.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.exception.BackendRejectedException;
import com.modelrouter.exception.RoutingException;
import com.modelrouter.model.routing.ModelBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Talks to Ollama-compatible servers: {@code POST /api/generate} without streaming for
 * completions and {@code GET /api/tags} as the liveness check.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OllamaBackendClient implements BackendClient {

    static final String GENERATE_PATH = "/api/generate";
    static final String PROBE_PATH = "/api/tags";

    private final WebClient backendWebClient;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<String> generate(ModelBackend backend, String prompt) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", backend.getModel());
        body.put("prompt", prompt);
        body.put("stream", false);

        return backendWebClient.post()
                .uri(backend.getBaseUrl() + GENERATE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(raw -> extractText(backend, raw));
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(errorBody -> {
                                log.error("Backend {} error: HTTP {} - {}", backend.getId(), response.statusCode(), errorBody);
                                return Mono.error(new BackendRejectedException(backend.getId(),
                                        response.statusCode().value(), extractErrorMessage(errorBody, response.statusCode().value())));
                            });
                })
                .onErrorMap(e -> !(e instanceof RoutingException), e -> new BackendRejectedException(backend.getId(), e));
    }

    @Override
    public Mono<Void> probe(ModelBackend backend) {
        return backendWebClient.get()
                .uri(backend.getBaseUrl() + PROBE_PATH)
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    private String extractText(ModelBackend backend, String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new BackendRejectedException(backend.getId(), 200, "malformed response body");
        }
        if (root == null || !root.isObject()) {
            throw new BackendRejectedException(backend.getId(), 200, "empty response body");
        }
        if (root.hasNonNull("error")) {
            throw new BackendRejectedException(backend.getId(), 200, root.path("error").asText());
        }
        JsonNode text = root.path("response");
        if (!text.isTextual()) {
            throw new BackendRejectedException(backend.getId(), 200, "response field missing");
        }
        return text.asText();
    }

    private String extractErrorMessage(String errorBody, int status) {
        String errorMsg = "HTTP " + status;
        if (errorBody.isBlank()) {
            return errorMsg;
        }
        try {
            JsonNode root = objectMapper.readTree(errorBody);
            JsonNode err = root.path("error");
            if (err.isTextual()) {
                errorMsg = errorMsg + ": " + err.asText();
            } else if (err.isObject() && err.has("message")) {
                errorMsg = errorMsg + ": " + err.path("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse error body", e);
        }
        return errorMsg;
    }
}

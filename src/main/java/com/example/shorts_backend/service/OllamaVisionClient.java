package com.example.shorts_backend.service;

import com.example.shorts_backend.config.OllamaProperties;
import com.example.shorts_backend.dto.analysis.FrameInsight;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Talks to a local Ollama server running a vision model.
 */
@Component
public class OllamaVisionClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaVisionClient.class);

    static final String PROMPT = """
            You are rating a single frame from a long video for short-form clip potential.

            Give an ENGAGEMENT SCORE from 0 to 100 considering:
            - visual interest and composition
            - action or movement
            - emotional content such as reactions and expressions
            - how well it would do on TikTok or YouTube Shorts

            Reply with JSON only, exactly in this shape:
            {
                "score": <0-100>,
                "description": "<description of at most 10 words>",
                "content_type": "<action|reaction|tutorial|entertainment|other>",
                "has_person": <true|false>,
                "has_text": <true|false>,
                "mood": "<exciting|funny|emotional|informative|calm>",
                "viral_potential": "<high|medium|low>"
            }""";

    private final WebClient client;
    private final OllamaProperties props;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public OllamaVisionClient(@Qualifier("ollamaWebClient") WebClient client, OllamaProperties props, ObjectMapper objectMapper) {
        this.client = client;
        this.props = props;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }

    public String model() {
        return props.getModel();
    }

    /**
     * Checks that the server answers and has the configured model, pulling it once when missing and
     * auto-pull is enabled.
     */
    public boolean isAvailable() {
        if (!props.isEnabled()) {
            return false;
        }
        try {
            if (hasModel()) {
                LOGGER.debug("Ollama model '{}' available at {}", props.getModel(), props.getBaseUrl());
                return true;
            }
            if (!props.isAutoPull()) {
                LOGGER.warn("Ollama model '{}' not installed and auto-pull disabled", props.getModel());
                return false;
            }
            LOGGER.info("Pulling Ollama model '{}'", props.getModel());
            pullModel();
            return true;
        } catch (Exception e) {
            LOGGER.warn("Ollama not available at {}: {}", props.getBaseUrl(), e.toString());
            return false;
        }
    }

    /**
     * Sends one JPEG frame to the model and parses its rating.
     */
    public FrameInsight describeFrame(byte[] jpeg) {
        Map<String, Object> body = Map.of(
                "model", props.getModel(),
                "stream", false,
                "messages", List.of(Map.of(
                        "role", "user",
                        "content", PROMPT,
                        "images", List.of(Base64.getEncoder().encodeToString(jpeg)))),
                "options", Map.of(
                        "temperature", props.getTemperature(),
                        "num_predict", props.getNumPredict()));

        long start = System.currentTimeMillis();
        JsonNode response = client.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .map(err -> new IllegalStateException("Ollama error " + resp.statusCode() + ": " + err)))
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();

        String content = response == null ? null : response.path("message").path("content").asText(null);
        FrameInsight insight = FrameInsight.parse(content, objectMapper);
        LOGGER.trace("Ollama frame rated score={} type={} in {} ms", insight.baseScore(), insight.contentType(), System.currentTimeMillis() - start);
        return insight;
    }

    /** True when the server lists the configured model. Never pulls. */
    public boolean hasModel() {
        JsonNode tags = client.get()
                .uri("/api/tags")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(5))
                .block();
        String wanted = baseName(props.getModel());
        if (tags == null) {
            return false;
        }
        for (JsonNode m : tags.path("models")) {
            if (wanted.equals(baseName(m.path("name").asText("")))) {
                return true;
            }
        }
        return false;
    }

    private void pullModel() {
        client.post()
                .uri("/api/pull")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", props.getModel(), "stream", false))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .map(err -> new IllegalStateException("Ollama pull failed " + resp.statusCode() + ": " + err)))
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(Math.max(1, props.getPullTimeoutSeconds())))
                .block();
    }

    private static String baseName(String model) {
        int colon = model.indexOf(':');
        return colon < 0 ? model : model.substring(0, colon);
    }
}

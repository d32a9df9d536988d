package com.contextinsight.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OpenAI 호환 chat completions 클라이언트 (OpenAI, OpenRouter, Ollama, vLLM 등).
 * 추출 보조용이며 비활성 상태가 기본이다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${pipeline.llm.enabled:false}")
    private boolean enabled;

    @Value("${pipeline.llm.base-url:${LLM_OPENAI_BASE_URL:https://api.openai.com/v1}}")
    private String baseUrl;

    @Value("${pipeline.llm.api-key:${LLM_OPENAI_API_KEY:${OPENAI_API_KEY:}}}")
    private String apiKey;

    @Value("${pipeline.llm.model:gpt-4o-mini}")
    private String model;

    @Value("${pipeline.llm.timeout-seconds:60}")
    private int timeoutSeconds;

    @PostConstruct
    public void init() {
        log.info("LlmClient initialized - enabled: {}, baseUrl: {}, model: {}", isEnabled(), baseUrl, model);
    }

    public boolean isEnabled() {
        return enabled && baseUrl != null && !baseUrl.isBlank();
    }

    /**
     * 단일 사용자 프롬프트 완성. 실패 시 빈 Optional.
     */
    public Optional<String> complete(String prompt) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String endpoint = baseUrl.endsWith("/") ? baseUrl + "chat/completions" : baseUrl + "/chat/completions";
        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", 0,
                "messages", List.of(Map.of("role", "user", "content", prompt)));

        try {
            String response = webClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(timeoutSeconds));

            if (response == null) {
                return Optional.empty();
            }
            JsonNode content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
            return content.isTextual() ? Optional.of(content.asText()) : Optional.empty();
        } catch (Exception e) {
            log.warn("LLM completion failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

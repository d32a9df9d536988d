package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.exception.RankingTierUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 텍스트 임베딩 서비스.
 * HuggingFace Text Embeddings Inference (TEI) 서버의 /embed 를 호출한다.
 * 사용 가능 여부는 기동 시 헬스 체크로 한 번 결정한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService implements EmbeddingPort {

    private static final String TIER = "embedding";
    private static final int MAX_INPUT_CHARS = 8000;

    private final WebClient webClient;

    @Value("${pipeline.embedding.enabled:false}")
    private boolean enabled;

    @Value("${pipeline.embedding.base-url:http://localhost:8011}")
    private String baseUrl;

    @Value("${pipeline.embedding.model:intfloat/multilingual-e5-large}")
    private String modelName;

    @Value("${pipeline.embedding.timeout-seconds:30}")
    private int timeoutSeconds;

    private volatile boolean available;

    @PostConstruct
    public void init() {
        available = enabled && healthCheck();
        log.info("EmbeddingService initialized: enabled={}, available={}, baseUrl={}, model={}",
                enabled, available, baseUrl, modelName);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public float[] embed(String text) {
        List<float[]> vectors = embedAll(List.of(text == null ? "" : text));
        return vectors.get(0);
    }

    /**
     * 일괄 임베딩 (TEI는 inputs 배열을 받는다)
     */
    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (!available) {
            throw RankingTierUnavailableException.disabled(TIER);
        }
        if (texts.isEmpty()) {
            return List.of();
        }
        List<String> inputs = texts.stream()
                .map(t -> t.length() > MAX_INPUT_CHARS ? t.substring(0, MAX_INPUT_CHARS) : t)
                .toList();
        try {
            float[][] result = webClient.post()
                    .uri(endpoint("/embed"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("inputs", inputs))
                    .retrieve()
                    .bodyToMono(float[][].class)
                    .block(Duration.ofSeconds(timeoutSeconds));
            if (result == null || result.length != inputs.size()) {
                throw new IllegalStateException("Expected " + inputs.size() + " embeddings, got "
                        + (result == null ? 0 : result.length));
            }
            return Arrays.asList(result);
        } catch (RankingTierUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Embedding request failed ({} inputs): {}", inputs.size(), e.getMessage());
            throw RankingTierUnavailableException.callFailed(TIER, e);
        }
    }

    private boolean healthCheck() {
        try {
            webClient.get()
                    .uri(endpoint("/health"))
                    .retrieve()
                    .toBodilessEntity()
                    .block(Duration.ofSeconds(5));
            return true;
        } catch (Exception e) {
            log.warn("Embedding server health check failed: {}", e.getMessage());
            return false;
        }
    }

    private String endpoint(String path) {
        return (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl) + path;
    }
}

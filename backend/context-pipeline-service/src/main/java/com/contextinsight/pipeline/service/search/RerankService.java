package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.exception.RankingTierUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Cross-encoder 리랭크 서비스 (TEI /rerank)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RerankService implements RerankPort {

    private static final String TIER = "rerank";

    private final WebClient webClient;

    @Value("${pipeline.rerank.enabled:false}")
    private boolean enabled;

    @Value("${pipeline.rerank.base-url:http://localhost:8012}")
    private String baseUrl;

    @Value("${pipeline.rerank.timeout-seconds:30}")
    private int timeoutSeconds;

    private volatile boolean available;

    @PostConstruct
    public void init() {
        available = enabled && healthCheck();
        log.info("RerankService initialized: enabled={}, available={}, baseUrl={}", enabled, available, baseUrl);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public List<Double> rerank(String query, List<String> texts) {
        if (!available) {
            throw RankingTierUnavailableException.disabled(TIER);
        }
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            JsonNode response = webClient.post()
                    .uri(endpoint("/rerank"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("query", query, "texts", texts, "raw_scores", false))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(timeoutSeconds));

            if (response == null || !response.isArray()) {
                throw new IllegalStateException("Unexpected rerank response");
            }
            // 응답은 점수순 정렬이므로 index 로 원래 순서 복원
            List<Double> scores = new ArrayList<>(Collections.nCopies(texts.size(), 0.0));
            for (JsonNode entry : response) {
                int index = entry.path("index").asInt(-1);
                if (index >= 0 && index < texts.size()) {
                    scores.set(index, entry.path("score").asDouble(0.0));
                }
            }
            return scores;
        } catch (RankingTierUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Rerank request failed ({} texts): {}", texts.size(), e.getMessage());
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
            log.warn("Rerank server health check failed: {}", e.getMessage());
            return false;
        }
    }

    private String endpoint(String path) {
        return (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl) + path;
    }
}

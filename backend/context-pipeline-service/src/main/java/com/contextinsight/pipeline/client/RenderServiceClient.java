package com.contextinsight.pipeline.client;

import com.contextinsight.pipeline.entity.FetchFailureType;
import com.contextinsight.pipeline.exception.FetchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 헤드리스 브라우저 렌더링 서비스(Crawl4AI 호환) 클라이언트.
 * POST /crawl 로 URL을 보내고 네트워크 유휴 상태까지 기다린 HTML을 받는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RenderServiceClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${pipeline.render.base-url:http://web-crawler:11235}")
    private String baseUrl;

    @Value("${pipeline.render.wait-until:networkidle}")
    private String waitUntil;

    @Value("${pipeline.render.settle-millis:2000}")
    private long settleMillis;

    @Data
    @Builder
    public static class RenderResult {
        private String url;
        private int statusCode;
        private String title;
        private String html;
    }

    /**
     * 렌더링된 페이지 요청.
     *
     * @throws FetchException 렌더링 서비스 오류 또는 대상 페이지 오류
     */
    public RenderResult render(String targetUrl, Duration timeout) {
        String endpoint = baseUrl.endsWith("/") ? baseUrl + "crawl" : baseUrl + "/crawl";

        Map<String, Object> crawlerConfig = new LinkedHashMap<>();
        crawlerConfig.put("wait_until", waitUntil);
        crawlerConfig.put("delay_before_return_html", settleMillis / 1000.0);
        crawlerConfig.put("page_timeout", timeout.toMillis());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("urls", List.of(targetUrl));
        body.put("browser_config", Map.of("headless", true));
        body.put("crawler_config", crawlerConfig);

        String responseBody;
        try {
            responseBody = webClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchangeToMono(response -> readBody(targetUrl, response))
                    // 브라우저 대기 시간만큼 여유
                    .timeout(timeout.plusMillis(settleMillis))
                    .block();
        } catch (FetchException e) {
            throw e;
        } catch (Exception e) {
            throw FetchException.fromThrowable(targetUrl, e);
        }

        return parseResult(targetUrl, responseBody);
    }

    private Mono<String> readBody(String targetUrl, ClientResponse response) {
        if (!response.statusCode().is2xxSuccessful()) {
            int status = response.statusCode().value();
            return response.releaseBody().then(Mono.error(new FetchException(targetUrl, FetchFailureType.OTHER,
                    status, "Render service returned HTTP " + status, null)));
        }
        return response.bodyToMono(String.class).defaultIfEmpty("");
    }

    RenderResult parseResult(String targetUrl, String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (Exception e) {
            throw new FetchException(targetUrl, FetchFailureType.OTHER, null,
                    "Unreadable render service response", e);
        }

        JsonNode result = root;
        if (root.has("results") && root.get("results").isArray() && !root.get("results").isEmpty()) {
            result = root.get("results").get(0);
        } else if (root.has("result")) {
            result = root.get("result");
        }

        if (result.has("success") && !result.get("success").asBoolean(true)) {
            int status = result.path("status_code").asInt(0);
            if (status >= 400) {
                throw FetchException.httpStatus(targetUrl, status);
            }
            throw new FetchException(targetUrl, FetchFailureType.fromException(
                    new IllegalStateException(textOf(result, "error_message"))),
                    "Render failed: " + textOf(result, "error_message"));
        }

        int status = result.path("status_code").asInt(200);
        if (status >= 400) {
            throw FetchException.httpStatus(targetUrl, status);
        }

        String html = firstNonBlank(textOf(result, "html"), textOf(result, "cleaned_html"));
        if (html == null) {
            throw new FetchException(targetUrl, FetchFailureType.OTHER, "Render service returned no HTML");
        }

        return RenderResult.builder()
                .url(firstNonBlank(textOf(result, "url"), targetUrl))
                .statusCode(status)
                .title(textOf(result.path("metadata"), "title"))
                .html(html)
                .build();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    private static String textOf(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        return v.isTextual() ? v.asText() : v.toString();
    }
}

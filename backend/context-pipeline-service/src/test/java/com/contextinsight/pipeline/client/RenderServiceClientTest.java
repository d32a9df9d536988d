package com.contextinsight.pipeline.client;

import com.contextinsight.pipeline.entity.FetchFailureType;
import com.contextinsight.pipeline.exception.FetchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RenderServiceClient 단위 테스트
 */
class RenderServiceClientTest {

    private static final String TARGET = "https://immigration.example.gov/apply";

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private RenderServiceClient client(int status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(HttpStatusCode.valueOf(status))
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(body)
                            .build());
                })
                .build();
        RenderServiceClient client = new RenderServiceClient(webClient, new ObjectMapper());
        ReflectionTestUtils.setField(client, "baseUrl", "http://renderer:11235/");
        ReflectionTestUtils.setField(client, "waitUntil", "networkidle");
        ReflectionTestUtils.setField(client, "settleMillis", 0L);
        return client;
    }

    @Test
    @DisplayName("POST /crawl 결과의 첫 항목에서 HTML과 제목 추출")
    void rendersPage() {
        // given
        RenderServiceClient client = client(200, """
                {"success": true, "results": [{
                  "url": "https://immigration.example.gov/apply",
                  "success": true, "status_code": 200,
                  "html": "<html><body>Apply</body></html>",
                  "metadata": {"title": "Apply online"}
                }]}
                """);

        // when
        RenderServiceClient.RenderResult result = client.render(TARGET, Duration.ofSeconds(5));

        // then
        assertThat(result.getHtml()).contains("Apply");
        assertThat(result.getTitle()).isEqualTo("Apply online");
        assertThat(result.getStatusCode()).isEqualTo(200);
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().toString()).isEqualTo("http://renderer:11235/crawl");
    }

    @Test
    @DisplayName("렌더링 서비스 자체의 오류 응답은 OTHER")
    void renderServiceErrorIsOther() {
        RenderServiceClient client = client(500, "{\"detail\": \"boom\"}");

        assertThatThrownBy(() -> client.render(TARGET, Duration.ofSeconds(5)))
                .isInstanceOf(FetchException.class)
                .extracting(e -> ((FetchException) e).getFailureType())
                .isEqualTo(FetchFailureType.OTHER);
    }

    @Test
    @DisplayName("대상 페이지의 403은 BLOCKED")
    void targetStatusIsClassified() {
        RenderServiceClient client = client(200, "{}");

        assertThatThrownBy(() -> client.parseResult(TARGET,
                "{\"results\": [{\"success\": false, \"status_code\": 403, \"error_message\": \"denied\"}]}"))
                .isInstanceOf(FetchException.class)
                .extracting(e -> ((FetchException) e).getFailureType())
                .isEqualTo(FetchFailureType.BLOCKED);
    }

    @Test
    @DisplayName("html이 없으면 cleaned_html, 둘 다 없으면 실패")
    void htmlFallback() {
        RenderServiceClient client = client(200, "{}");

        RenderServiceClient.RenderResult result = client.parseResult(TARGET,
                "{\"result\": {\"cleaned_html\": \"<p>clean</p>\"}}");
        assertThat(result.getHtml()).isEqualTo("<p>clean</p>");
        assertThat(result.getUrl()).isEqualTo(TARGET);

        assertThatThrownBy(() -> client.parseResult(TARGET, "{\"results\": [{\"success\": true}]}"))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("no HTML");
    }

    @Test
    @DisplayName("렌더링 타임아웃 메시지는 TIMEOUT")
    void renderTimeoutMessage() {
        RenderServiceClient client = client(200, "{}");

        assertThatThrownBy(() -> client.parseResult(TARGET,
                "{\"results\": [{\"success\": false, \"error_message\": \"Page.goto: Timeout 30000ms exceeded\"}]}"))
                .isInstanceOf(FetchException.class)
                .extracting(e -> ((FetchException) e).getFailureType())
                .isEqualTo(FetchFailureType.TIMEOUT);
    }
}

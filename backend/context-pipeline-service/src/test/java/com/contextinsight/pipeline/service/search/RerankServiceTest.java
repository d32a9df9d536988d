package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.exception.RankingTierUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RerankService 단위 테스트
 */
class RerankServiceTest {

    private static RerankService service(boolean enabled, ExchangeFunction exchange) {
        RerankService service = new RerankService(WebClient.builder().exchangeFunction(exchange).build());
        ReflectionTestUtils.setField(service, "enabled", enabled);
        ReflectionTestUtils.setField(service, "baseUrl", "http://reranker:8012/");
        ReflectionTestUtils.setField(service, "timeoutSeconds", 5);
        service.init();
        return service;
    }

    private static ExchangeFunction server(int rerankStatus, String rerankBody) {
        return request -> {
            if (request.url().getPath().equals("/health")) {
                return Mono.just(ClientResponse.create(HttpStatusCode.valueOf(200)).build());
            }
            return Mono.just(ClientResponse.create(HttpStatusCode.valueOf(rerankStatus))
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(rerankBody)
                    .build());
        };
    }

    @Test
    @DisplayName("점수순 응답을 입력 순서로 복원")
    void restoresInputOrder() {
        // given
        RerankService service = service(true, server(200,
                "[{\"index\":2,\"score\":0.9},{\"index\":0,\"score\":0.5},{\"index\":1,\"score\":0.1}]"));

        // when
        List<Double> scores = service.rerank("work permit", List.of("a", "b", "c"));

        // then
        assertThat(service.isAvailable()).isTrue();
        assertThat(scores).containsExactly(0.5, 0.1, 0.9);
    }

    @Test
    @DisplayName("비활성화 시 헬스 체크 없이 사용 불가")
    void disabledIsUnavailable() {
        RerankService service = service(false, request -> {
            throw new AssertionError("no request expected");
        });

        assertThat(service.isAvailable()).isFalse();
        assertThatThrownBy(() -> service.rerank("q", List.of("a")))
                .isInstanceOf(RankingTierUnavailableException.class);
    }

    @Test
    @DisplayName("헬스 체크 실패 시 사용 불가")
    void failedHealthCheck() {
        RerankService service = service(true, request -> Mono.error(new IllegalStateException("connection refused")));

        assertThat(service.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("서버 오류는 RankingTierUnavailableException")
    void serverErrorIsTierFailure() {
        RerankService service = service(true, server(500, "{\"error\":\"overloaded\"}"));

        assertThatThrownBy(() -> service.rerank("q", List.of("a", "b")))
                .isInstanceOf(RankingTierUnavailableException.class);
    }

    @Test
    @DisplayName("빈 입력은 호출 없이 빈 목록")
    void emptyInput() {
        RerankService service = service(true, server(500, "unused"));

        assertThat(service.rerank("q", List.of())).isEmpty();
    }
}

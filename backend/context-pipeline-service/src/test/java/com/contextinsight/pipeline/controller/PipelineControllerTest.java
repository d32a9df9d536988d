package com.contextinsight.pipeline.controller;

import com.contextinsight.pipeline.dto.Citation;
import com.contextinsight.pipeline.dto.ContextBundle;
import com.contextinsight.pipeline.dto.ContextItem;
import com.contextinsight.pipeline.dto.CrawlRequest;
import com.contextinsight.pipeline.dto.CrawlSummary;
import com.contextinsight.pipeline.dto.ExtractionSummary;
import com.contextinsight.pipeline.dto.ProvenanceType;
import com.contextinsight.pipeline.entity.StoredDocument;
import com.contextinsight.pipeline.exception.PipelineException;
import com.contextinsight.pipeline.exception.StoreConflictException;
import com.contextinsight.pipeline.service.ContentStoreService;
import com.contextinsight.pipeline.service.crawl.CrawlCoordinatorService;
import com.contextinsight.pipeline.service.extraction.ExtractionEngine;
import com.contextinsight.pipeline.service.search.ContextRetrievalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PipelineController 단위 테스트
 */
@WebFluxTest(PipelineController.class)
@ActiveProfiles("test")
class PipelineControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private CrawlCoordinatorService crawlCoordinatorService;

    @MockBean
    private ExtractionEngine extractionEngine;

    @MockBean
    private ContextRetrievalService contextRetrievalService;

    @MockBean
    private ContentStoreService contentStoreService;

    @Test
    @DisplayName("POST /api/v1/crawl - 요청 시드로 크롤 실행")
    void crawlWithSeeds() {
        // given
        when(crawlCoordinatorService.crawl(anyList(), eq(1), isNull()))
                .thenReturn(List.of(new CrawlSummary("canada", 3, 2, 1, 0, false)));

        // when & then
        webTestClient.post()
                .uri("/api/v1/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "seeds", List.of(Map.of("url", "https://canada.example.gov/visa", "topic", "canada")),
                        "maxDepth", 1))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].topic").isEqualTo("canada")
                .jsonPath("$[0].accepted").isEqualTo(2)
                .jsonPath("$[0].rejected").isEqualTo(1);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CrawlRequest.SeedUrl>> seeds = ArgumentCaptor.forClass(List.class);
        verify(crawlCoordinatorService).crawl(seeds.capture(), eq(1), isNull());
        assertThat(seeds.getValue()).containsExactly(
                new CrawlRequest.SeedUrl("https://canada.example.gov/visa", "canada"));
    }

    @Test
    @DisplayName("POST /api/v1/crawl - 본문이 없으면 설정된 시드로 실행")
    void crawlConfiguredSeeds() {
        when(crawlCoordinatorService.crawlConfiguredSeeds())
                .thenReturn(List.of(new CrawlSummary("uk", 1, 1, 0, 0, false)));

        webTestClient.post()
                .uri("/api/v1/crawl")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].topic").isEqualTo("uk");

        verify(crawlCoordinatorService, never()).crawl(anyList(), any(), any());
    }

    @Test
    @DisplayName("POST /api/v1/crawl - 빈 URL은 400")
    void crawlRejectsBlankSeedUrl() {
        webTestClient.post()
                .uri("/api/v1/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("seeds", List.of(Map.of("url", "", "topic", "canada"))))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("POST /api/v1/crawl - 알 수 없는 페치 전략은 400 CONFIG_ERROR")
    void crawlConfigurationError() {
        when(crawlCoordinatorService.crawlConfiguredSeeds())
                .thenThrow(PipelineException.invalidConfiguration("Unknown fetch strategy 'selenium'"));

        webTestClient.post()
                .uri("/api/v1/crawl")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("CONFIG_ERROR");
    }

    @Test
    @DisplayName("POST /api/v1/extraction - 토픽 추출 결과")
    void extraction() {
        when(extractionEngine.extractTopic("canada"))
                .thenReturn(new ExtractionSummary("canada", 4, 2, 1, 1, List.of("canada::work permit")));

        webTestClient.post()
                .uri("/api/v1/extraction?topic=canada")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.recordsWritten").isEqualTo(2)
                .jsonPath("$.conflictedKeys[0]").isEqualTo("canada::work permit");
    }

    @Test
    @DisplayName("POST /api/v1/extraction - 저장 충돌은 409")
    void extractionConflict() {
        when(extractionEngine.extractTopic(isNull()))
                .thenThrow(StoreConflictException.retriesExhausted("canada::work permit", 5, null));

        webTestClient.post()
                .uri("/api/v1/extraction")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("STORE_CONFLICT");
    }

    @Test
    @DisplayName("GET /api/v1/context - 컨텍스트 번들 반환")
    void context() {
        // given
        ContextBundle bundle = new ContextBundle("work permit age",
                List.of(new ContextItem("record:1", ProvenanceType.ENTITY_RECORD, "Work permit", "canada", "work",
                        0.5, List.of("https://canada.example.gov/work"))),
                "=== CATEGORIZED ENTRIES ===",
                List.of(new Citation("https://canada.example.gov/work", ProvenanceType.ENTITY_RECORD)),
                List.of("keyword"));
        when(contextRetrievalService.retrieve("work permit age", "canada", null, 3)).thenReturn(bundle);

        // when & then
        webTestClient.get()
                .uri(uri -> uri.path("/api/v1/context")
                        .queryParam("query", "work permit age")
                        .queryParam("topic", "canada")
                        .queryParam("maxItems", 3)
                        .build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items[0].key").isEqualTo("record:1")
                .jsonPath("$.items[0].provenance").isEqualTo("entity_record")
                .jsonPath("$.citations[0].provenanceType").isEqualTo("entity_record")
                .jsonPath("$.rankingTiers[0]").isEqualTo("keyword");
    }

    @Test
    @DisplayName("GET /api/v1/context - query 누락은 400")
    void contextRequiresQuery() {
        webTestClient.get()
                .uri("/api/v1/context")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("GET /api/v1/documents/history - URL 정규화 후 이력 조회")
    void documentHistory() {
        // given
        StoredDocument v2 = StoredDocument.builder().url("https://canada.example.gov/work").title("Work permit")
                .version(2).latest(true).contentHash("h2").fetchedAt(LocalDateTime.now()).build();
        StoredDocument v1 = v2.toBuilder().version(1).latest(false).contentHash("h1").build();
        when(contentStoreService.getDocumentHistory("https://canada.example.gov/work")).thenReturn(List.of(v2, v1));

        // when & then
        webTestClient.get()
                .uri("/api/v1/documents/history?url=HTTPS://Canada.Example.gov:443/work")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].version").isEqualTo(2)
                .jsonPath("$[0].latest").isEqualTo(true)
                .jsonPath("$[1].latest").isEqualTo(false);
    }

    @Test
    @DisplayName("GET /api/v1/records/history - 레코드 이력 조회")
    void recordHistory() {
        when(contentStoreService.getRecordHistory("canada::work permit")).thenReturn(List.of());

        webTestClient.get()
                .uri(uri -> uri.path("/api/v1/records/history").queryParam("key", "canada::work permit").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }
}

package com.contextinsight.pipeline.controller;

import com.contextinsight.pipeline.dto.ContextBundle;
import com.contextinsight.pipeline.dto.CrawlRequest;
import com.contextinsight.pipeline.dto.CrawlSummary;
import com.contextinsight.pipeline.dto.ExtractionSummary;
import com.contextinsight.pipeline.dto.VersionInfo;
import com.contextinsight.pipeline.service.ContentStoreService;
import com.contextinsight.pipeline.service.crawl.CrawlCoordinatorService;
import com.contextinsight.pipeline.service.crawl.UrlNormalizer;
import com.contextinsight.pipeline.service.extraction.ExtractionEngine;
import com.contextinsight.pipeline.service.search.ContextRetrievalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * 파이프라인 REST API.
 * 서비스 호출은 블로킹이므로 boundedElastic 스케줄러에서 실행한다.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    private final CrawlCoordinatorService crawlCoordinatorService;
    private final ExtractionEngine extractionEngine;
    private final ContextRetrievalService contextRetrievalService;
    private final ContentStoreService contentStoreService;

    /**
     * 크롤 실행. 요청 본문이 없거나 seeds가 비면 설정된 시드를 사용한다.
     */
    @PostMapping("/crawl")
    public Mono<List<CrawlSummary>> crawl(@Valid @RequestBody(required = false) CrawlRequest request) {
        return Mono.fromCallable(() -> {
                    if (request == null || request.getSeeds() == null || request.getSeeds().isEmpty()) {
                        return crawlCoordinatorService.crawlConfiguredSeeds();
                    }
                    return crawlCoordinatorService.crawl(request.getSeeds(), request.getMaxDepth(),
                            request.getMaxDocsPerTopic());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/extraction")
    public Mono<ExtractionSummary> extract(@RequestParam(required = false) String topic) {
        return Mono.fromCallable(() -> extractionEngine.extractTopic(topic))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/context")
    public Mono<ContextBundle> context(@RequestParam String query,
                                       @RequestParam(required = false) String topic,
                                       @RequestParam(required = false) String category,
                                       @RequestParam(required = false) Integer maxItems) {
        return Mono.fromCallable(() -> contextRetrievalService.retrieve(query, topic, category, maxItems))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/documents/history")
    public Mono<List<VersionInfo>> documentHistory(@RequestParam String url) {
        return Mono.fromCallable(() -> contentStoreService.getDocumentHistory(UrlNormalizer.normalize(url).orElse(url)).stream()
                        .map(VersionInfo::from)
                        .toList())
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/records/history")
    public Mono<List<VersionInfo>> recordHistory(@RequestParam String key) {
        return Mono.fromCallable(() -> contentStoreService.getRecordHistory(key).stream()
                        .map(VersionInfo::from)
                        .toList())
                .subscribeOn(Schedulers.boundedElastic());
    }
}

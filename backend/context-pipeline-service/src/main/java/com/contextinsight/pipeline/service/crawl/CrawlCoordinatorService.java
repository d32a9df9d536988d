package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.config.PipelineProperties.CrawlPolicy;
import com.contextinsight.pipeline.dto.CrawlRequest;
import com.contextinsight.pipeline.dto.CrawlSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * 다중 토픽 크롤 조정.
 *
 * 시드를 토픽별로 묶어 토픽마다 독립된 프론티어를 crawlExecutor에서 병렬 실행한다.
 * run-deadline-seconds가 설정되면 마감 시 모든 프론티어에 취소를 건다.
 * 토픽 실행마다 pipeline.crawl.pages (topic, outcome) 카운터와 pipeline.crawl.duration 타이머를 남긴다.
 */
@Service
@Slf4j
public class CrawlCoordinatorService {

    private final CrawlFrontierFactory frontierFactory;
    private final PipelineProperties properties;
    private final Executor crawlExecutor;
    private final TaskScheduler deadlineScheduler;
    private final MeterRegistry meterRegistry;

    public CrawlCoordinatorService(CrawlFrontierFactory frontierFactory,
                                   PipelineProperties properties,
                                   @Qualifier("crawlExecutor") Executor crawlExecutor,
                                   @Qualifier("crawlDeadlineScheduler") TaskScheduler deadlineScheduler,
                                   MeterRegistry meterRegistry) {
        this.frontierFactory = frontierFactory;
        this.properties = properties;
        this.crawlExecutor = crawlExecutor;
        this.deadlineScheduler = deadlineScheduler;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 단일 토픽 동기 실행
     */
    public CrawlSummary crawlTopic(String topic, List<String> seedUrls, CrawlPolicy policy,
                                   CrawlCancellation cancellation) {
        String normalized = normalizeTopic(topic);
        Timer.Sample sample = Timer.start(meterRegistry);
        CrawlSummary summary = frontierFactory.create(normalized, policy).crawl(seedUrls, cancellation);
        sample.stop(meterRegistry.timer("pipeline.crawl.duration", "topic", normalized));
        recordOutcomes(summary);
        return summary;
    }

    /**
     * (url, topic) 시드 목록 실행. 토픽별 설정 정책에 maxDepth/maxDocsPerTopic 재정의를 적용한다.
     */
    public List<CrawlSummary> crawl(List<CrawlRequest.SeedUrl> seeds, Integer maxDepth, Integer maxDocsPerTopic) {
        Map<String, List<String>> seedsByTopic = new LinkedHashMap<>();
        for (CrawlRequest.SeedUrl seed : seeds) {
            seedsByTopic.computeIfAbsent(normalizeTopic(seed.getTopic()), t -> new ArrayList<>()).add(seed.getUrl());
        }

        List<TopicRun> runs = new ArrayList<>();
        seedsByTopic.forEach((topic, urls) -> {
            CrawlPolicy policy = policyFor(topic);
            if (maxDepth != null) {
                policy.setMaxDepth(maxDepth);
            }
            if (maxDocsPerTopic != null) {
                policy.setMaxDocsPerTopic(maxDocsPerTopic);
            }
            runs.add(new TopicRun(topic, urls, policy));
        });
        return runAll(runs);
    }

    /**
     * pipeline.seeds 설정 전체 실행
     */
    public List<CrawlSummary> crawlConfiguredSeeds() {
        List<TopicRun> runs = properties.getSeeds().stream()
                .filter(seed -> seed.getTopic() != null && !seed.getSeedUrls().isEmpty())
                .map(seed -> new TopicRun(normalizeTopic(seed.getTopic()), seed.getSeedUrls(),
                        policyFor(seed.getTopic())))
                .toList();
        if (runs.isEmpty()) {
            log.warn("No crawl seeds configured (pipeline.seeds)");
        }
        return runAll(runs);
    }

    private List<CrawlSummary> runAll(List<TopicRun> runs) {
        CrawlCancellation cancellation = new CrawlCancellation();
        long deadline = properties.getCrawl().getRunDeadlineSeconds();
        ScheduledFuture<?> deadlineTask = null;
        if (deadline > 0) {
            deadlineTask = deadlineScheduler.schedule(() -> {
                log.info("Crawl run deadline of {}s elapsed, cancelling", deadline);
                cancellation.cancel();
            }, Instant.now().plusSeconds(deadline));
        }

        log.info("Starting crawl run for {} topic(s)", runs.size());
        try {
            List<CompletableFuture<CrawlSummary>> futures = runs.stream()
                    .map(run -> submit(run, cancellation))
                    .toList();
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            if (deadlineTask != null) {
                deadlineTask.cancel(false);
            }
        }
    }

    private CompletableFuture<CrawlSummary> submit(TopicRun run, CrawlCancellation cancellation) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> crawlTopic(run.topic(), run.seedUrls(), run.policy(), cancellation),
                            crawlExecutor)
                    .exceptionally(ex -> {
                        log.error("[{}] Crawl run failed: {}", run.topic(), ex.getMessage(), ex);
                        return CrawlSummary.failed(run.topic());
                    });
        } catch (RejectedExecutionException e) {
            log.error("[{}] Crawl run rejected by crawlExecutor: {}", run.topic(), e.getMessage());
            return CompletableFuture.completedFuture(CrawlSummary.failed(run.topic()));
        }
    }

    private void recordOutcomes(CrawlSummary summary) {
        meterRegistry.counter("pipeline.crawl.pages", "topic", summary.topic(), "outcome", "accepted")
                .increment(summary.accepted());
        meterRegistry.counter("pipeline.crawl.pages", "topic", summary.topic(), "outcome", "rejected")
                .increment(summary.rejected());
        meterRegistry.counter("pipeline.crawl.pages", "topic", summary.topic(), "outcome", "errored")
                .increment(summary.errored());
    }

    private CrawlPolicy policyFor(String topic) {
        PipelineProperties.Seed seed = properties.findSeed(topic);
        CrawlPolicy configured = seed != null && seed.getCrawlPolicy() != null
                ? seed.getCrawlPolicy()
                : properties.getCrawl().getDefaultPolicy();
        return configured.copy();
    }

    static String normalizeTopic(String topic) {
        return topic == null ? "" : topic.trim().toLowerCase(Locale.ROOT);
    }

    private record TopicRun(String topic, List<String> seedUrls, CrawlPolicy policy) {
    }
}

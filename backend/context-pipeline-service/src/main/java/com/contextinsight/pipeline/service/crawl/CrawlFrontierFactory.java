package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.config.PipelineProperties.CrawlPolicy;
import com.contextinsight.pipeline.service.ContentStoreService;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 토픽 실행마다 새 프론티어 생성.
 * SHARED 범위일 때만 속도 제한기를 인스턴스 간에 공유한다.
 */
@Component
public class CrawlFrontierFactory {

    private final FetchStrategyRegistry strategyRegistry;
    private final ContentStoreService contentStore;
    private final PipelineProperties properties;
    private final CrawlRateLimiter sharedRateLimiter;

    public CrawlFrontierFactory(FetchStrategyRegistry strategyRegistry,
                                ContentStoreService contentStore,
                                PipelineProperties properties) {
        this.strategyRegistry = strategyRegistry;
        this.contentStore = contentStore;
        this.properties = properties;
        this.sharedRateLimiter = new CrawlRateLimiter(properties.getCrawl().getDelayMs(), false);
    }

    public CrawlFrontier create(String topic, CrawlPolicy policy) {
        PipelineProperties.Crawl crawl = properties.getCrawl();
        return CrawlFrontier.builder()
                .topic(topic)
                .policy(policy)
                .fetchStrategy(strategyRegistry.resolve(policy.getFetchStrategy()))
                .contentStore(contentStore)
                .rateLimiter(rateLimiterFor(crawl))
                .fetchTimeout(Duration.ofSeconds(crawl.getFetchTimeoutSeconds()))
                .minContentLength(crawl.getMinContentLength())
                .build();
    }

    private CrawlRateLimiter rateLimiterFor(PipelineProperties.Crawl crawl) {
        return switch (crawl.getRateLimitScope()) {
            case SHARED -> sharedRateLimiter;
            case PER_DOMAIN -> new CrawlRateLimiter(crawl.getDelayMs(), true);
            case PER_TASK -> new CrawlRateLimiter(crawl.getDelayMs(), false);
        };
    }
}

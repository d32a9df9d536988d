package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.config.PipelineProperties.CrawlPolicy;
import com.contextinsight.pipeline.dto.CrawlSummary;
import com.contextinsight.pipeline.dto.CrawledPage;
import com.contextinsight.pipeline.entity.StoredDocument;
import com.contextinsight.pipeline.exception.FetchException;
import com.contextinsight.pipeline.exception.StoreConflictException;
import com.contextinsight.pipeline.service.ContentStoreService;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 토픽 하나에 대한 BFS 크롤 실행.
 *
 * 큐, 방문 집합, 카운터는 인스턴스에 속하며 인스턴스는 한 번만 실행할 수 있다.
 * 페치 실패와 저장 충돌은 해당 URL에만 영향을 주고 순회는 계속된다.
 */
@Slf4j
public class CrawlFrontier {

    private final String topic;
    private final CrawlPolicy policy;
    private final FetchStrategy fetchStrategy;
    private final ContentStoreService contentStore;
    private final CrawlRateLimiter rateLimiter;
    private final RelevancePolicy relevancePolicy;
    private final UrlExclusionFilter exclusionFilter;
    private final Duration fetchTimeout;
    private final int minContentLength;

    private final Deque<QueuedUrl> queue = new ArrayDeque<>();
    private final Set<String> discovered = new HashSet<>();
    private final Set<String> visited = new HashSet<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private int fetched;
    private int accepted;
    private int rejected;
    private int errored;

    @Builder
    public CrawlFrontier(String topic,
                         CrawlPolicy policy,
                         FetchStrategy fetchStrategy,
                         ContentStoreService contentStore,
                         CrawlRateLimiter rateLimiter,
                         Duration fetchTimeout,
                         int minContentLength) {
        this.topic = topic;
        this.policy = policy;
        this.fetchStrategy = fetchStrategy;
        this.contentStore = contentStore;
        this.rateLimiter = rateLimiter != null ? rateLimiter : CrawlRateLimiter.unlimited();
        this.relevancePolicy = new RelevancePolicy(policy.getRequiredKeywords(), policy.getOptionalKeywords());
        this.exclusionFilter = new UrlExclusionFilter(policy.getExcludePatterns());
        this.fetchTimeout = fetchTimeout != null ? fetchTimeout : Duration.ofSeconds(30);
        this.minContentLength = minContentLength;
    }

    /**
     * 시드 URL에서 시작해 maxDepth까지 동일 출처 링크를 따라간다.
     */
    public CrawlSummary crawl(List<String> seedUrls, CrawlCancellation cancellation) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("CrawlFrontier for topic " + topic + " has already run");
        }
        CrawlCancellation cancel = cancellation != null ? cancellation : new CrawlCancellation();

        for (String seed : seedUrls) {
            Optional<String> normalized = UrlNormalizer.normalize(seed);
            if (normalized.isEmpty()) {
                log.warn("[{}] Ignoring invalid seed URL: {}", topic, seed);
                continue;
            }
            enqueue(normalized.get(), 0);
        }

        log.info("[{}] Crawl started: {} seeds, maxDepth={}, maxDocs={}, strategy={}",
                topic, queue.size(), policy.getMaxDepth(), policy.getMaxDocsPerTopic(), fetchStrategy.name());

        boolean cancelled = false;
        while (!queue.isEmpty()) {
            if (cancel.isCancelled()) {
                cancelled = true;
                break;
            }
            if (accepted >= policy.getMaxDocsPerTopic()) {
                log.info("[{}] Document cap {} reached", topic, policy.getMaxDocsPerTopic());
                break;
            }

            QueuedUrl next = queue.poll();
            if (next.depth() > policy.getMaxDepth() || !visited.add(next.url())) {
                continue;
            }

            if (exclusionFilter.isExcluded(next.url())) {
                rejected++;
                log.debug("[{}] Excluded by pattern: {}", topic, next.url());
                continue;
            }

            try {
                rateLimiter.acquire(next.url());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelled = true;
                break;
            }

            process(next);
        }

        CrawlSummary summary = new CrawlSummary(topic, fetched, accepted, rejected, errored, cancelled);
        log.info("[{}] Crawl finished: fetched={}, accepted={}, rejected={}, errored={}, cancelled={}",
                topic, fetched, accepted, rejected, errored, cancelled);
        return summary;
    }

    private void process(QueuedUrl entry) {
        CrawledPage page;
        try {
            page = fetchStrategy.fetch(entry.url(), fetchTimeout);
            fetched++;
        } catch (FetchException e) {
            errored++;
            log.warn("[{}] Fetch failed ({}): {} - {}", topic, e.getFailureType().getCode(), entry.url(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            errored++;
            log.warn("[{}] Unexpected fetch error: {} - {}", topic, entry.url(), e.toString());
            return;
        }

        if (page.contentLength() < minContentLength) {
            rejected++;
            log.debug("[{}] Content too short ({} chars): {}", topic, page.contentLength(), entry.url());
            return;
        }

        RelevancePolicy.Verdict verdict = relevancePolicy.evaluate(page.title(), page.content());
        if (!verdict.relevant()) {
            rejected++;
            log.debug("[{}] No required keyword: {}", topic, entry.url());
            return;
        }

        try {
            contentStore.putDocument(StoredDocument.builder()
                    .url(entry.url())
                    .topic(topic)
                    .title(page.title())
                    .contentText(page.content())
                    .rawMarkup(page.rawHtml())
                    .outboundLinks(page.links())
                    .depth(entry.depth())
                    .fetchStrategy(page.source())
                    .relevanceScore(verdict.score())
                    .build());
            accepted++;
        } catch (StoreConflictException e) {
            errored++;
            log.error("[{}] Store conflict for {}: {}", topic, entry.url(), e.getMessage());
            return;
        }

        int childDepth = entry.depth() + 1;
        if (childDepth > policy.getMaxDepth()) {
            return;
        }
        for (String link : page.links()) {
            UrlNormalizer.normalize(link)
                    .filter(normalized -> UrlNormalizer.sameOrigin(normalized, entry.url()))
                    .ifPresent(normalized -> enqueue(normalized, childDepth));
        }
    }

    private void enqueue(String url, int depth) {
        if (discovered.add(url)) {
            queue.add(new QueuedUrl(url, depth));
        }
    }

    private record QueuedUrl(String url, int depth) {
    }
}

package com.contextinsight.pipeline.service.crawl;

import java.util.HashMap;
import java.util.Map;

/**
 * 페치 간 최소 간격 강제.
 * perDomain이면 호스트별 시계를, 아니면 인스턴스 하나의 시계를 쓴다.
 */
public class CrawlRateLimiter {

    private static final String GLOBAL_KEY = "*";

    private final long minDelayMillis;
    private final boolean perDomain;
    private final Map<String, Long> nextAllowedAt = new HashMap<>();

    public CrawlRateLimiter(long minDelayMillis, boolean perDomain) {
        this.minDelayMillis = minDelayMillis;
        this.perDomain = perDomain;
    }

    public static CrawlRateLimiter unlimited() {
        return new CrawlRateLimiter(0, false);
    }

    /**
     * 다음 페치가 허용될 때까지 대기
     */
    public synchronized void acquire(String url) throws InterruptedException {
        if (minDelayMillis <= 0) {
            return;
        }
        String key = perDomain ? UrlNormalizer.hostOf(url) : GLOBAL_KEY;
        long now = System.currentTimeMillis();
        long wait = nextAllowedAt.getOrDefault(key, 0L) - now;
        if (wait > 0) {
            Thread.sleep(wait);
            now = System.currentTimeMillis();
        }
        nextAllowedAt.put(key, now + minDelayMillis);
    }
}

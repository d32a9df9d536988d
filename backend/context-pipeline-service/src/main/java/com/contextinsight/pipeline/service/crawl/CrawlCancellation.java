package com.contextinsight.pipeline.service.crawl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 협조적 취소 플래그. 프론티어가 큐에서 꺼낼 때마다 확인한다.
 */
public class CrawlCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

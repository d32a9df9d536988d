package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.dto.CrawledPage;
import com.contextinsight.pipeline.exception.FetchException;

import java.time.Duration;

/**
 * 페이지 페치 전략
 */
public interface FetchStrategy {

    /**
     * 설정에서 참조하는 전략 이름 (예: "lightweight", "rendering")
     */
    String name();

    /**
     * @param url     정규화된 절대 URL
     * @param timeout 요청 타임아웃
     * @return 파싱된 페이지
     * @throws FetchException 페치 실패 (TIMEOUT, BLOCKED, NOT_FOUND, OTHER)
     */
    CrawledPage fetch(String url, Duration timeout);
}

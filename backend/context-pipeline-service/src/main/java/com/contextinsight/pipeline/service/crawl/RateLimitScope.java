package com.contextinsight.pipeline.service.crawl;

/**
 * 크롤 속도 제한 범위
 */
public enum RateLimitScope {
    /** 토픽 실행(프론티어) 단위 */
    PER_TASK,
    /** 실행 내 호스트 단위 */
    PER_DOMAIN,
    /** 프로세스 전체 공유 */
    SHARED
}

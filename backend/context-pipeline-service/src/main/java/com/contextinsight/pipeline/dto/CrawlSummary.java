package com.contextinsight.pipeline.dto;

/**
 * 토픽 단위 크롤 실행 결과
 *
 * @param fetched  페치 성공 수
 * @param accepted 저장된 문서 수
 * @param rejected 제외 패턴/짧은 본문/관련성 미달로 거부된 수
 * @param errored  페치 실패 및 저장 충돌 수
 */
public record CrawlSummary(
        String topic,
        int fetched,
        int accepted,
        int rejected,
        int errored,
        boolean cancelled
) {
    public static CrawlSummary failed(String topic) {
        return new CrawlSummary(topic, 0, 0, 0, 1, false);
    }
}

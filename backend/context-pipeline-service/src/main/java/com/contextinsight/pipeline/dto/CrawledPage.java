package com.contextinsight.pipeline.dto;

import java.util.List;

/**
 * 페치 결과 페이지
 *
 * @param url        요청 URL (정규화)
 * @param statusCode HTTP 상태 코드
 * @param title      페이지 제목
 * @param content    정제된 본문 텍스트
 * @param rawHtml    원본 마크업
 * @param source     사용한 페치 전략 이름
 * @param links      정규화된 절대 링크 (중복 제거)
 */
public record CrawledPage(
        String url,
        int statusCode,
        String title,
        String content,
        String rawHtml,
        String source,
        List<String> links
) {
    public CrawledPage {
        links = links != null ? List.copyOf(links) : List.of();
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }

    public int contentLength() {
        return content != null ? content.length() : 0;
    }
}

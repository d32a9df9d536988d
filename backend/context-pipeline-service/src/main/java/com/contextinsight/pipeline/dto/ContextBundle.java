package com.contextinsight.pipeline.dto;

import java.util.List;

/**
 * 답변 생성 단계로 넘기는 컨텍스트 번들
 *
 * @param renderedText  섹션별로 렌더링된 컨텍스트 텍스트
 * @param citations     (sourceUrl, provenanceType) 목록
 * @param rankingTiers  이번 질의에 적용된 랭킹 단계 이름
 */
public record ContextBundle(
        String query,
        List<ContextItem> items,
        String renderedText,
        List<Citation> citations,
        List<String> rankingTiers
) {
    public static ContextBundle empty(String query) {
        return new ContextBundle(query, List.of(), "", List.of(), List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}

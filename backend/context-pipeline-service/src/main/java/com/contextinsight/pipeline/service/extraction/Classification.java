package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.entity.RecordType;

/**
 * 문서 분류 결과
 *
 * @param category        엔티티 카테고리 또는 일반 콘텐츠 유형
 * @param matchedKeywords 일치한 서로 다른 키워드 수
 */
public record Classification(RecordType type, String category, int matchedKeywords) {
}

package com.contextinsight.pipeline.service.search;

import java.util.List;

/**
 * 쿼리-문서 쌍 리랭크 포트
 */
public interface RerankPort {

    boolean isAvailable();

    /**
     * @return texts와 같은 순서의 점수
     * @throws com.contextinsight.pipeline.exception.RankingTierUnavailableException 호출 실패
     */
    List<Double> rerank(String query, List<String> texts);
}

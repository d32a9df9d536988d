package com.contextinsight.pipeline.service.search;

import java.util.List;

/**
 * 랭킹 체인의 한 단계.
 * 가용 여부는 기동 시 체인 구성에 쓰이며, 실행 중 실패는
 * RankingTierUnavailableException 으로 알려 이전 단계 결과로 강등된다.
 */
public interface RankingTier {

    String name();

    boolean isAvailable();

    /**
     * @param candidates 이전 단계 결과 (정렬됨)
     * @param limit      최종 항목 수
     * @return 정렬된 결과
     */
    List<ScoredCandidate> rank(String query, List<ScoredCandidate> candidates, int limit);
}

package com.contextinsight.pipeline.service.search;

import java.time.LocalDateTime;
import java.util.Comparator;

public record ScoredCandidate(RetrievalCandidate candidate, double score) {

    /**
     * 점수 내림차순, 동점이면 최신 버전 우선. List.sort 와 함께 쓰면 안정 정렬.
     */
    public static final Comparator<ScoredCandidate> RANKING_ORDER = Comparator
            .comparingDouble(ScoredCandidate::score).reversed()
            .thenComparing(sc -> sc.candidate().getVersionTimestamp(),
                    Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    public ScoredCandidate withScore(double newScore) {
        return new ScoredCandidate(candidate, newScore);
    }
}

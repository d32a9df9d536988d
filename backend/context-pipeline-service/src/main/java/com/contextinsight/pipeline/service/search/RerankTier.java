package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.exception.RankingTierUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 상위 rerankTopN 후보만 리랭커로 재채점해 limit 개를 남긴다.
 */
@Component
@RequiredArgsConstructor
public class RerankTier implements RankingTier {

    public static final String NAME = "rerank";

    private final RerankPort rerankPort;
    private final PipelineProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return rerankPort.isAvailable();
    }

    @Override
    public List<ScoredCandidate> rank(String query, List<ScoredCandidate> candidates, int limit) {
        int topN = Math.min(properties.getRetrieval().getRerankTopN(), candidates.size());
        List<ScoredCandidate> head = candidates.subList(0, topN);

        List<Double> scores = rerankPort.rerank(query, head.stream()
                .map(sc -> sc.candidate().getSearchText())
                .toList());
        if (scores.size() != head.size()) {
            throw RankingTierUnavailableException.callFailed(NAME,
                    new IllegalStateException("expected " + head.size() + " scores, got " + scores.size()));
        }

        List<ScoredCandidate> reranked = new ArrayList<>(head.size());
        for (int i = 0; i < head.size(); i++) {
            reranked.add(head.get(i).withScore(scores.get(i)));
        }
        reranked.sort(ScoredCandidate.RANKING_ORDER);
        return reranked.subList(0, Math.min(limit, reranked.size()));
    }
}

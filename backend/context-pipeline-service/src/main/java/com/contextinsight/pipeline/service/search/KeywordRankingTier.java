package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 키워드 겹침 단독 점수 (가중치 1.0). 항상 사용 가능한 기본 단계.
 */
@Component
@RequiredArgsConstructor
public class KeywordRankingTier implements RankingTier {

    public static final String NAME = "keyword";

    private final KeywordScorer keywordScorer;
    private final PipelineProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<ScoredCandidate> rank(String query, List<ScoredCandidate> candidates, int limit) {
        Set<String> terms = keywordScorer.terms(query);
        double minScore = properties.getRetrieval().getMinScore();

        List<ScoredCandidate> scored = new ArrayList<>();
        for (ScoredCandidate candidate : candidates) {
            double score = keywordScorer.overlap(terms, candidate.candidate().getSearchText());
            if (score > minScore) {
                scored.add(candidate.withScore(score));
            }
        }
        scored.sort(ScoredCandidate.RANKING_ORDER);
        return scored;
    }
}

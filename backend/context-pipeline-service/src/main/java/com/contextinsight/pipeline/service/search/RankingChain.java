package com.contextinsight.pipeline.service.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 기동 시 사용 가능한 단계로 구성되는 랭킹 체인.
 *
 * 1차 채점: hybrid (임베딩 가능 시) 또는 keyword
 * 2차: rerank (리랭커 가능 시)
 * 실행 중 단계 실패는 직전 단계 결과로 강등한다.
 */
@Component
@Slf4j
public class RankingChain {

    private final RankingTier keywordTier;
    private final RankingTier primaryTier;
    private final RankingTier rerankTier;

    public RankingChain(KeywordRankingTier keywordTier, HybridRankingTier hybridTier, RerankTier rerankTier) {
        this.keywordTier = keywordTier;
        this.primaryTier = hybridTier.isAvailable() ? hybridTier : keywordTier;
        this.rerankTier = rerankTier.isAvailable() ? rerankTier : null;
        log.info("Ranking chain composed: {}", composition());
    }

    public record Result(List<ScoredCandidate> ranked, List<String> tiers) {
    }

    public Result rank(String query, List<RetrievalCandidate> candidates, int maxItems) {
        List<ScoredCandidate> initial = candidates.stream()
                .map(c -> new ScoredCandidate(c, 0.0))
                .toList();
        List<String> applied = new ArrayList<>();

        List<ScoredCandidate> ranked;
        try {
            ranked = primaryTier.rank(query, initial, maxItems);
            applied.add(primaryTier.name());
        } catch (RuntimeException e) {
            log.warn("Ranking tier '{}' failed, falling back to '{}': {}",
                    primaryTier.name(), keywordTier.name(), e.getMessage());
            ranked = keywordTier.rank(query, initial, maxItems);
            applied.add(keywordTier.name());
        }

        if (rerankTier != null && !ranked.isEmpty()) {
            try {
                ranked = rerankTier.rank(query, ranked, maxItems);
                applied.add(rerankTier.name());
            } catch (RuntimeException e) {
                log.warn("Ranking tier '{}' failed, keeping '{}' order: {}",
                        rerankTier.name(), applied.get(applied.size() - 1), e.getMessage());
            }
        }

        List<ScoredCandidate> top = ranked.subList(0, Math.min(maxItems, ranked.size()));
        return new Result(List.copyOf(top), List.copyOf(applied));
    }

    public List<String> composition() {
        List<String> names = new ArrayList<>();
        names.add(primaryTier.name());
        if (rerankTier != null) {
            names.add(rerankTier.name());
        }
        return names;
    }
}

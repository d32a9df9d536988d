package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.exception.RankingTierUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 하이브리드 점수: semanticWeight * 코사인 유사도 + keywordWeight * 키워드 겹침.
 * 후보 임베딩은 불변 행 키 단위로 캐시한다.
 */
@Component
@Slf4j
public class HybridRankingTier implements RankingTier {

    public static final String NAME = "hybrid";
    private static final int MAX_EMBED_CHARS = 2000;

    private final EmbeddingPort embeddingPort;
    private final KeywordScorer keywordScorer;
    private final PipelineProperties properties;
    private final Map<String, float[]> embeddingCache = new ConcurrentHashMap<>();

    public HybridRankingTier(EmbeddingPort embeddingPort, KeywordScorer keywordScorer, PipelineProperties properties) {
        this.embeddingPort = embeddingPort;
        this.keywordScorer = keywordScorer;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return embeddingPort.isAvailable();
    }

    @Override
    public List<ScoredCandidate> rank(String query, List<ScoredCandidate> candidates, int limit) {
        PipelineProperties.Retrieval config = properties.getRetrieval();
        Set<String> terms = keywordScorer.terms(query);

        float[] queryVector = embeddingPort.embed(query);
        Map<String, float[]> vectors = candidateVectors(candidates);

        List<ScoredCandidate> scored = new ArrayList<>();
        for (ScoredCandidate candidate : candidates) {
            RetrievalCandidate c = candidate.candidate();
            double semantic = clamp(cosineSimilarity(queryVector, vectors.get(c.getKey())));
            double keyword = keywordScorer.overlap(terms, c.getSearchText());
            double score = config.getSemanticWeight() * semantic + config.getKeywordWeight() * keyword;
            if (score > config.getMinScore()) {
                scored.add(candidate.withScore(score));
            }
        }
        scored.sort(ScoredCandidate.RANKING_ORDER);
        return scored;
    }

    private Map<String, float[]> candidateVectors(List<ScoredCandidate> candidates) {
        List<RetrievalCandidate> missing = candidates.stream()
                .map(ScoredCandidate::candidate)
                .filter(c -> !embeddingCache.containsKey(c.getKey()))
                .toList();

        if (!missing.isEmpty()) {
            List<float[]> embedded = embeddingPort.embedAll(missing.stream()
                    .map(c -> truncate(c.getSearchText()))
                    .toList());
            if (embedded.size() != missing.size()) {
                throw RankingTierUnavailableException.callFailed(NAME,
                        new IllegalStateException("embedding count mismatch"));
            }
            if (embeddingCache.size() + missing.size() > properties.getRetrieval().getEmbeddingCacheSize()) {
                log.debug("Embedding cache full ({}), clearing", embeddingCache.size());
                embeddingCache.clear();
            }
            for (int i = 0; i < missing.size(); i++) {
                embeddingCache.put(missing.get(i).getKey(), embedded.get(i));
            }
        }

        Map<String, float[]> vectors = new ConcurrentHashMap<>();
        for (ScoredCandidate candidate : candidates) {
            String key = candidate.candidate().getKey();
            float[] vector = embeddingCache.get(key);
            if (vector != null) {
                vectors.put(key, vector);
            }
        }
        return vectors;
    }

    /**
     * 코사인 유사도. 차원이 다르거나 영벡터면 0.
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String truncate(String text) {
        return text.length() > MAX_EMBED_CHARS ? text.substring(0, MAX_EMBED_CHARS) : text;
    }
}

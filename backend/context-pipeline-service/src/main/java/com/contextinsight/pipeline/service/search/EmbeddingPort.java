package com.contextinsight.pipeline.service.search;

import java.util.ArrayList;
import java.util.List;

/**
 * 텍스트 임베딩 포트
 */
public interface EmbeddingPort {

    /**
     * 기동 시 결정된 사용 가능 여부
     */
    boolean isAvailable();

    /**
     * @throws com.contextinsight.pipeline.exception.RankingTierUnavailableException 호출 실패
     */
    float[] embed(String text);

    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}

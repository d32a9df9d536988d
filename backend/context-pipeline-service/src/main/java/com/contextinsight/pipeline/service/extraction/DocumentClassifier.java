package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.entity.RecordType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 키워드 수 기반 문서 분류.
 *
 * 엔티티 카테고리와 일반 콘텐츠 유형 각각에서 가장 많이 일치한 항목을 고른 뒤
 * 두 계열 모두 minKeywordMatches 미만이면 분류하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class DocumentClassifier {

    private final PipelineProperties properties;

    public Optional<Classification> classify(String title, String text) {
        PipelineProperties.Extraction config = properties.getExtraction();
        String haystack = ((title != null ? title : "") + " " + (text != null ? text : "")).toLowerCase(Locale.ROOT);

        Classification entity = best(RecordType.ENTITY, config.getEntityCategories(), haystack);
        Classification general = best(RecordType.GENERAL, config.getGeneralContentTypes(), haystack);

        int min = config.getMinKeywordMatches();
        boolean entityOk = entity != null && entity.matchedKeywords() >= min;
        boolean generalOk = general != null && general.matchedKeywords() >= min;

        if (!entityOk && !generalOk) {
            return Optional.empty();
        }
        if (entityOk && (!generalOk || entity.matchedKeywords() >= general.matchedKeywords() * config.getEntityBias())) {
            return Optional.of(entity);
        }
        return Optional.of(general);
    }

    // 동점이면 먼저 선언된 항목 유지
    private static Classification best(RecordType type, Map<String, List<String>> families, String haystack) {
        Classification best = null;
        for (Map.Entry<String, List<String>> family : families.entrySet()) {
            int count = (int) family.getValue().stream()
                    .map(k -> k.toLowerCase(Locale.ROOT))
                    .distinct()
                    .filter(haystack::contains)
                    .count();
            if (best == null || count > best.matchedKeywords()) {
                best = new Classification(type, family.getKey(), count);
            }
        }
        return best;
    }
}

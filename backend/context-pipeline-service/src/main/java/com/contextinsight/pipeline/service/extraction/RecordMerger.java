package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.entity.KnowledgeRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 기존 최신 레코드와 새 추출 결과 병합.
 * 먼저 기록된 값이 우선하며 빈 필드만 채운다. 출처 URL은 기존 순서를 유지한 합집합.
 */
@Component
public class RecordMerger {

    public record MergeResult(KnowledgeRecord record, boolean changed) {
    }

    public MergeResult merge(Optional<KnowledgeRecord> current, KnowledgeRecord candidate) {
        if (current.isEmpty()) {
            return new MergeResult(candidate, true);
        }
        KnowledgeRecord existing = current.get();

        Set<String> sources = new LinkedHashSet<>(existing.getSourceUrls());
        sources.addAll(candidate.getSourceUrls());

        Map<String, String> fields = new LinkedHashMap<>(existing.getFields());
        candidate.getFields().forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                fields.putIfAbsent(key, value);
            }
        });
        keepExistingAgeBound(existing.getFields(), fields);

        String summary = isBlank(existing.getSummary()) ? candidate.getSummary() : existing.getSummary();
        List<String> keyPoints = existing.getKeyPoints().isEmpty()
                ? candidate.getKeyPoints()
                : existing.getKeyPoints();

        boolean changed = !fields.equals(existing.getFields())
                || sources.size() != existing.getSourceUrls().size()
                || !Objects.equals(summary, existing.getSummary())
                || !keyPoints.equals(existing.getKeyPoints());

        KnowledgeRecord merged = existing.toBuilder()
                .id(null)
                .fields(fields)
                .sourceUrls(new ArrayList<>(sources))
                .summary(summary)
                .keyPoints(new ArrayList<>(keyPoints))
                .createdAt(null)
                .build();
        return new MergeResult(merged, changed);
    }

    /**
     * 병합 결과가 ageMin &gt; ageMax 이면 이번에 채워진 쪽을 버린다
     */
    private static void keepExistingAgeBound(Map<String, String> existing, Map<String, String> merged) {
        Integer min = parseInt(merged.get(FieldExtractionRules.AGE_MIN));
        Integer max = parseInt(merged.get(FieldExtractionRules.AGE_MAX));
        if (min == null || max == null || min <= max) {
            return;
        }
        if (existing.containsKey(FieldExtractionRules.AGE_MIN)) {
            merged.remove(FieldExtractionRules.AGE_MAX);
        } else {
            merged.remove(FieldExtractionRules.AGE_MIN);
        }
    }

    private static Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

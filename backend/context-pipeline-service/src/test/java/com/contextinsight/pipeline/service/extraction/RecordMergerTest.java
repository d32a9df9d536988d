package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.RecordType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * RecordMerger 단위 테스트
 */
class RecordMergerTest {

    private final RecordMerger merger = new RecordMerger();

    private static KnowledgeRecord record(Map<String, String> fields, String... sources) {
        return KnowledgeRecord.builder()
                .logicalKey("canada::work permit")
                .recordType(RecordType.ENTITY)
                .topic("canada")
                .category("work")
                .name("Work permit")
                .fields(new LinkedHashMap<>(fields))
                .sourceUrls(new ArrayList<>(List.of(sources)))
                .build();
    }

    @Test
    @DisplayName("기존 레코드가 없으면 후보 그대로, changed=true")
    void noExistingRecord() {
        KnowledgeRecord candidate = record(Map.of("ageMin", "18"), "https://a.example.gov/1");

        RecordMerger.MergeResult result = merger.merge(Optional.empty(), candidate);

        assertThat(result.changed()).isTrue();
        assertThat(result.record()).isSameAs(candidate);
    }

    @Test
    @DisplayName("기존 값 우선, 빈 필드만 채우고 출처는 합집합")
    void firstWriterWinsAndSourcesUnion() {
        // given
        KnowledgeRecord existing = record(Map.of("ageMin", "18"), "https://a.example.gov/1").toBuilder()
                .id(7L)
                .version(1)
                .createdAt(LocalDateTime.now())
                .build();
        KnowledgeRecord candidate = record(new LinkedHashMap<>(Map.of("ageMin", "21")), "https://a.example.gov/2");
        candidate.getFields().put("ageMax", "45");

        // when
        RecordMerger.MergeResult result = merger.merge(Optional.of(existing), candidate);

        // then
        assertThat(result.changed()).isTrue();
        assertThat(result.record().getId()).isNull();
        assertThat(result.record().getCreatedAt()).isNull();
        assertThat(result.record().getFields()).containsExactly(entry("ageMin", "18"), entry("ageMax", "45"));
        assertThat(result.record().getSourceUrls())
                .containsExactly("https://a.example.gov/1", "https://a.example.gov/2");
        // 원본은 변경되지 않음
        assertThat(existing.getFields()).containsOnlyKeys("ageMin");
    }

    @Test
    @DisplayName("새 정보가 없으면 changed=false")
    void unchangedWhenNothingNew() {
        KnowledgeRecord existing = record(Map.of("ageMin", "18"), "https://a.example.gov/1");
        KnowledgeRecord candidate = record(Map.of("ageMin", "30"), "https://a.example.gov/1");

        RecordMerger.MergeResult result = merger.merge(Optional.of(existing), candidate);

        assertThat(result.changed()).isFalse();
    }

    @Test
    @DisplayName("요약/핵심 포인트는 기존 값이 비어 있을 때만 채움")
    void summaryFilledOnlyWhenMissing() {
        KnowledgeRecord existing = record(Map.of(), "https://a.example.gov/1");
        KnowledgeRecord candidate = record(Map.of(), "https://a.example.gov/1").toBuilder()
                .summary("How to apply.")
                .keyPoints(List.of("Submit your form online before the deadline."))
                .build();

        RecordMerger.MergeResult first = merger.merge(Optional.of(existing), candidate);
        assertThat(first.changed()).isTrue();
        assertThat(first.record().getSummary()).isEqualTo("How to apply.");

        KnowledgeRecord other = candidate.toBuilder().summary("Different summary.").build();
        RecordMerger.MergeResult second = merger.merge(Optional.of(first.record()), other);
        assertThat(second.changed()).isFalse();
        assertThat(second.record().getSummary()).isEqualTo("How to apply.");
    }

    @Test
    @DisplayName("병합 결과의 나이 범위가 뒤집히면 기존 경계를 유지")
    void invertedMergedAgeRangeKeepsExistingBound() {
        // given
        KnowledgeRecord minOnly = record(Map.of("ageMin", "50"), "https://a.example.gov/1");
        KnowledgeRecord maxOnly = record(Map.of("ageMax", "30"), "https://a.example.gov/2");

        // when
        RecordMerger.MergeResult minFirst = merger.merge(Optional.of(minOnly), maxOnly);
        RecordMerger.MergeResult maxFirst = merger.merge(Optional.of(maxOnly), minOnly);

        // then
        assertThat(minFirst.record().getFields()).containsOnly(entry("ageMin", "50"));
        assertThat(maxFirst.record().getFields()).containsOnly(entry("ageMax", "30"));
        assertThat(minFirst.record().getSourceUrls())
                .containsExactly("https://a.example.gov/1", "https://a.example.gov/2");
    }

    @Test
    @DisplayName("일관된 나이 경계는 병합")
    void consistentAgeBoundsAreMerged() {
        KnowledgeRecord minOnly = record(Map.of("ageMin", "18"), "https://a.example.gov/1");
        KnowledgeRecord maxOnly = record(Map.of("ageMax", "30"), "https://a.example.gov/2");

        RecordMerger.MergeResult result = merger.merge(Optional.of(minOnly), maxOnly);

        assertThat(result.record().getFields()).containsOnly(entry("ageMin", "18"), entry("ageMax", "30"));
    }
}

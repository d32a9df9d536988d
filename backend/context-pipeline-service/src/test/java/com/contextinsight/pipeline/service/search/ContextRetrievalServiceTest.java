package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.dto.Citation;
import com.contextinsight.pipeline.dto.ContextBundle;
import com.contextinsight.pipeline.dto.ProvenanceType;
import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.RecordType;
import com.contextinsight.pipeline.entity.StoredDocument;
import com.contextinsight.pipeline.service.ContentStoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ContextRetrievalService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class ContextRetrievalServiceTest {

    @Mock
    private ContentStoreService contentStore;

    @Mock
    private EmbeddingPort embeddingPort;

    @Mock
    private RerankPort rerankPort;

    private ContextRetrievalService service;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        PipelineProperties.Seed canada = new PipelineProperties.Seed();
        canada.setTopic("canada");
        properties.setSeeds(List.of(canada));

        KeywordScorer scorer = new KeywordScorer();
        RankingChain chain = new RankingChain(
                new KeywordRankingTier(scorer, properties),
                new HybridRankingTier(embeddingPort, scorer, properties),
                new RerankTier(rerankPort, properties));
        service = new ContextRetrievalService(contentStore, new QueryFilterDetector(properties), chain,
                new ContextRenderer(), properties);
    }

    private static KnowledgeRecord workPermit() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("ageMin", "18");
        return KnowledgeRecord.builder()
                .id(1L)
                .logicalKey("canada::work permit")
                .recordType(RecordType.ENTITY)
                .topic("canada")
                .category("work")
                .name("Work permit")
                .fields(fields)
                .sourceUrls(new ArrayList<>(List.of("https://canada.example.gov/work")))
                .version(1)
                .build();
    }

    private static KnowledgeRecord applyGuide() {
        return KnowledgeRecord.builder()
                .id(2L)
                .logicalKey("canada::how to apply")
                .recordType(RecordType.GENERAL)
                .topic("canada")
                .category("guide")
                .name("How to apply")
                .fields(new LinkedHashMap<>(Map.of("contentType", "guide")))
                .summary("Apply online through the portal.")
                .keyPoints(new ArrayList<>(List.of("Create an account first.")))
                .sourceUrls(new ArrayList<>(List.of("https://canada.example.gov/apply")))
                .version(1)
                .build();
    }

    private static StoredDocument document(long id, String url, String title, String text) {
        return StoredDocument.builder()
                .id(id)
                .url(url)
                .topic("canada")
                .title(title)
                .contentText(text)
                .version(1)
                .build();
    }

    private static KnowledgeRecord studyPermit() {
        return workPermit().toBuilder()
                .id(3L)
                .logicalKey("canada::study permit")
                .category("study")
                .name("Study permit")
                .sourceUrls(new ArrayList<>(List.of("https://canada.example.gov/study")))
                .build();
    }

    private static KnowledgeRecord workPermitGuide() {
        return applyGuide().toBuilder()
                .logicalKey("canada::how to apply for a work permit")
                .name("How to apply for a work permit")
                .summary("Apply for a work permit online through the portal.")
                .build();
    }

    @Test
    @DisplayName("토픽/카테고리 감지 시 단일 레코드는 카테고리 포맷으로 렌더링")
    void categoryFilterRendersEntityRecord() {
        // given
        when(contentStore.getKnownTopics()).thenReturn(Set.of("canada"));
        when(contentStore.getLatestRecords("canada", null)).thenReturn(List.of(workPermit()));
        when(contentStore.getLatestDocuments("canada")).thenReturn(List.of());

        // when
        ContextBundle bundle = service.retrieve("Canada work permit age limit", null, null, null);

        // then
        assertThat(bundle.isEmpty()).isFalse();
        assertThat(bundle.items()).hasSize(1);
        assertThat(bundle.items().get(0).key()).isEqualTo("record:1");
        assertThat(bundle.items().get(0).provenance()).isEqualTo(ProvenanceType.ENTITY_RECORD);
        assertThat(bundle.renderedText()).isEqualTo("""
                === CATEGORIZED ENTRIES ===

                [1] Work permit (topic: canada, category: work)
                - ageMin: 18
                Provenance: entity_record | Sources: https://canada.example.gov/work""");
        assertThat(bundle.citations())
                .containsExactly(new Citation("https://canada.example.gov/work", ProvenanceType.ENTITY_RECORD));
        assertThat(bundle.rankingTiers()).containsExactly(KeywordRankingTier.NAME);
    }

    @Test
    @DisplayName("카테고리 필터는 ENTITY 레코드에만 적용, 일반 정보와 문서 발췌는 유지")
    void categoryFilterKeepsGeneralContent() {
        // given
        when(contentStore.getKnownTopics()).thenReturn(Set.of("canada"));
        when(contentStore.getLatestRecords("canada", null))
                .thenReturn(List.of(workPermit(), studyPermit(), workPermitGuide()));
        when(contentStore.getLatestDocuments("canada")).thenReturn(List.of(
                document(12, "https://canada.example.gov/checklist", "Work permit checklist",
                        "Checklist for a Canada work permit application.")));

        // when
        ContextBundle bundle = service.retrieve("How do I apply for a Canada work permit?", null, null, 5);

        // then
        assertThat(bundle.items()).extracting(item -> item.key())
                .containsExactlyInAnyOrder("record:1", "record:2", "document:12");
        assertThat(bundle.items()).extracting(item -> item.provenance())
                .contains(ProvenanceType.ENTITY_RECORD, ProvenanceType.GENERAL_RECORD,
                        ProvenanceType.DOCUMENT_EXCERPT);
        assertThat(bundle.renderedText())
                .contains("=== CATEGORIZED ENTRIES ===")
                .contains("=== GENERAL INFORMATION ===")
                .contains("=== DOCUMENT EXCERPTS ===")
                .doesNotContain("Study permit");
    }

    @Test
    @DisplayName("레코드 출처와 겹치지 않는 문서만 발췌로 포함, 인용은 중복 제거")
    void documentsComplementRecords() {
        // given
        when(contentStore.getKnownTopics()).thenReturn(Set.of("canada"));
        when(contentStore.getLatestRecords("canada", null)).thenReturn(List.of(applyGuide()));
        when(contentStore.getLatestDocuments("canada")).thenReturn(List.of(
                document(10, "https://canada.example.gov/apply", "How to apply", "Apply online through the portal."),
                document(11, "https://canada.example.gov/portal", "Online portal", "Apply online and pay the fee.")));

        // when
        ContextBundle bundle = service.retrieve("apply online canada", null, null, 5);

        // then
        assertThat(bundle.items()).extracting(item -> item.key()).containsExactly("record:2", "document:11");
        assertThat(bundle.renderedText())
                .contains("=== GENERAL INFORMATION ===")
                .contains("=== DOCUMENT EXCERPTS ===")
                .doesNotContain("=== CATEGORIZED ENTRIES ===");
        assertThat(bundle.renderedText().indexOf("GENERAL INFORMATION"))
                .isLessThan(bundle.renderedText().indexOf("DOCUMENT EXCERPTS"));
        assertThat(bundle.citations()).containsExactly(
                new Citation("https://canada.example.gov/apply", ProvenanceType.GENERAL_RECORD),
                new Citation("https://canada.example.gov/portal", ProvenanceType.DOCUMENT_EXCERPT));
    }

    @Test
    @DisplayName("일치하는 후보가 없으면 빈 번들")
    void noMatchesGivesEmptyBundle() {
        // given
        when(contentStore.getKnownTopics()).thenReturn(Set.of("canada"));
        when(contentStore.getLatestRecords(null, null)).thenReturn(List.of());
        when(contentStore.getLatestDocuments(null)).thenReturn(List.of());

        // when
        ContextBundle bundle = service.retrieve("quantum chromodynamics lecture notes", null, null, null);

        // then
        assertThat(bundle.isEmpty()).isTrue();
        assertThat(bundle.renderedText()).isEmpty();
        assertThat(bundle.citations()).isEmpty();
    }

    @Test
    @DisplayName("후보가 있어도 점수가 없으면 항목 없음")
    void unrelatedCandidatesAreNotReturned() {
        when(contentStore.getKnownTopics()).thenReturn(Set.of());
        when(contentStore.getLatestRecords(anyString(), any())).thenReturn(List.of(workPermit()));
        when(contentStore.getLatestDocuments(anyString())).thenReturn(List.of());

        ContextBundle bundle = service.retrieve("quantum chromodynamics", "canada", null, null);

        assertThat(bundle.isEmpty()).isTrue();
        assertThat(bundle.renderedText()).isEmpty();
    }

    @Test
    @DisplayName("빈 질의는 저장소 조회 없이 빈 번들")
    void blankQuery() {
        ContextBundle bundle = service.retrieve("  ", null, null, null);

        assertThat(bundle.isEmpty()).isTrue();
        verifyNoInteractions(contentStore);
    }
}

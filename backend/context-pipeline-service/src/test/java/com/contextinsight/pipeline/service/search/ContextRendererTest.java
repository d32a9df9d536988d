package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.dto.ProvenanceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ContextRenderer 단위 테스트
 */
class ContextRendererTest {

    private final ContextRenderer renderer = new ContextRenderer();

    private static ScoredCandidate entity(String title, double score) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("ageMin", "18");
        fields.put("fee", "$100");
        return new ScoredCandidate(RetrievalCandidate.builder()
                .key("record:" + title)
                .provenance(ProvenanceType.ENTITY_RECORD)
                .topic("canada")
                .category("work")
                .title(title)
                .searchText(title)
                .sourceUrls(List.of("https://canada.example.gov/a", "https://canada.example.gov/b"))
                .fields(fields)
                .keyPoints(List.of())
                .build(), score);
    }

    private static ScoredCandidate general(String title, double score) {
        return new ScoredCandidate(RetrievalCandidate.builder()
                .key("record:" + title)
                .provenance(ProvenanceType.GENERAL_RECORD)
                .topic("canada")
                .category("guide")
                .title(title)
                .searchText(title)
                .sourceUrls(List.of("https://canada.example.gov/guide"))
                .fields(Map.of("contentType", "guide"))
                .summary("Apply online.")
                .keyPoints(List.of("Create an account first."))
                .build(), score);
    }

    private static ScoredCandidate excerpt(String title, double score) {
        return new ScoredCandidate(RetrievalCandidate.builder()
                .key("document:" + title)
                .provenance(ProvenanceType.DOCUMENT_EXCERPT)
                .topic("canada")
                .title(title)
                .searchText(title)
                .sourceUrls(List.of("https://canada.example.gov/page"))
                .fields(Map.of())
                .keyPoints(List.of())
                .excerpt("Excerpt text.")
                .build(), score);
    }

    @Test
    @DisplayName("섹션 순서는 엔티티, 일반, 문서 발췌이고 섹션 안에서는 순위 순")
    void rendersSectionsInFixedOrder() {
        // when
        ContextRenderer.Rendered rendered = renderer.render(List.of(
                excerpt("Portal page", 0.9),
                entity("Work permit", 0.8),
                general("How to apply", 0.7),
                entity("Open work permit", 0.6)), 10_000);

        // then
        assertThat(rendered.included()).hasSize(4);
        assertThat(rendered.text()).isEqualTo("""
                === CATEGORIZED ENTRIES ===

                [1] Work permit (topic: canada, category: work)
                - ageMin: 18
                - fee: $100
                Provenance: entity_record | Sources: https://canada.example.gov/a, https://canada.example.gov/b

                [2] Open work permit (topic: canada, category: work)
                - ageMin: 18
                - fee: $100
                Provenance: entity_record | Sources: https://canada.example.gov/a, https://canada.example.gov/b

                === GENERAL INFORMATION ===

                [1] How to apply (topic: canada, type: guide)
                Summary: Apply online.
                Key Points:
                - Create an account first.
                Provenance: general_record | Sources: https://canada.example.gov/guide

                === DOCUMENT EXCERPTS ===

                [1] Portal page (topic: canada)
                Excerpt text.
                Provenance: document_excerpt | Sources: https://canada.example.gov/page""");
    }

    @Test
    @DisplayName("예산을 넘기면 이후 항목은 제외")
    void stopsAtBudget() {
        // given
        ScoredCandidate first = entity("Work permit", 0.9);
        String single = renderer.render(List.of(first), 10_000).text();

        // when
        ContextRenderer.Rendered rendered = renderer.render(List.of(first, entity("Second", 0.8)), single.length() + 10);

        // then
        assertThat(rendered.included()).containsExactly(first);
        assertThat(rendered.text()).isEqualTo(single);
    }

    @Test
    @DisplayName("첫 항목이 예산보다 크면 잘라서 포함")
    void oversizedFirstEntryIsTruncated() {
        ContextRenderer.Rendered rendered = renderer.render(List.of(entity("Work permit", 0.9)), 60);

        assertThat(rendered.included()).hasSize(1);
        assertThat(rendered.text()).startsWith("=== CATEGORIZED ENTRIES ===\n\n[1] Work permit");
        assertThat(rendered.text().length()).isLessThanOrEqualTo(60);
    }

    @Test
    void emptyInput() {
        ContextRenderer.Rendered rendered = renderer.render(List.of(), 100);

        assertThat(rendered.text()).isEmpty();
        assertThat(rendered.included()).isEmpty();
    }
}

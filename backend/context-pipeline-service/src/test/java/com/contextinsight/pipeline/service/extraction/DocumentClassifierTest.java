package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.entity.RecordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DocumentClassifier 단위 테스트
 */
class DocumentClassifierTest {

    private PipelineProperties properties;
    private DocumentClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        classifier = new DocumentClassifier(properties);
    }

    @Test
    @DisplayName("엔티티 카테고리 키워드가 충분하면 ENTITY")
    void classifiesEntity() {
        // when
        Optional<Classification> result = classifier.classify("Skilled Worker Visa",
                "You need a job offer from an approved employer and a work permit before you travel.");

        // then
        assertThat(result).isPresent();
        assertThat(result.get().type()).isEqualTo(RecordType.ENTITY);
        assertThat(result.get().category()).isEqualTo("work");
        assertThat(result.get().matchedKeywords()).isEqualTo(4);
    }

    @Test
    @DisplayName("일반 콘텐츠 유형 키워드가 우세하면 GENERAL")
    void classifiesGeneral() {
        Optional<Classification> result = classifier.classify("How to apply",
                "A step by step guide with tips for your application.");

        assertThat(result).isPresent();
        assertThat(result.get().type()).isEqualTo(RecordType.GENERAL);
        assertThat(result.get().category()).isEqualTo("guide");
    }

    @Test
    @DisplayName("두 계열 모두 최소 일치 수 미만이면 분류하지 않음")
    void lowConfidence() {
        assertThat(classifier.classify("Welcome", "Thank you for visiting our website.")).isEmpty();
    }

    @Test
    @DisplayName("동점이면 엔티티 우선, entityBias를 올리면 일반으로")
    void entityBiasBreaksTies() {
        String title = "Student visa FAQ";
        String text = "Answers for university applicants.";

        assertThat(classifier.classify(title, text))
                .get()
                .extracting(Classification::type)
                .isEqualTo(RecordType.ENTITY);

        properties.getExtraction().setEntityBias(2.0);
        assertThat(classifier.classify(title, text))
                .get()
                .extracting(Classification::category)
                .isEqualTo("faq");
    }

    @Test
    @DisplayName("minKeywordMatches 조정")
    void thresholdIsTunable() {
        properties.getExtraction().setMinKeywordMatches(1);

        assertThat(classifier.classify("Tourist information", "Plan your stay."))
                .get()
                .extracting(Classification::category)
                .isEqualTo("tourist");
    }
}

package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.dto.ExtractionSummary;
import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.RecordType;
import com.contextinsight.pipeline.entity.StoredDocument;
import com.contextinsight.pipeline.exception.StoreConflictException;
import com.contextinsight.pipeline.service.ContentStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 문서 → 지식 레코드 추출 엔진
 *
 * 1. 분류 (엔티티 카테고리 / 일반 콘텐츠 유형)
 * 2. 엔티티: 규칙 기반 필드 추출 (+ LLM 보조), 일반: 요약 + 핵심 포인트
 * 3. topic::name 키로 기존 최신 레코드와 병합, 변경 시에만 새 버전 저장
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionEngine {

    private final ContentStoreService contentStore;
    private final DocumentClassifier classifier;
    private final FieldExtractionRules fieldRules;
    private final GeneralContentSummarizer summarizer;
    private final AssistedExtractor assistedExtractor;
    private final RecordMerger recordMerger;
    private final PipelineProperties properties;

    /**
     * 단일 문서 추출.
     *
     * @return 병합 후 최신 레코드, 분류 신뢰도가 낮으면 빈 Optional
     * @throws StoreConflictException 레코드 버전 전환 실패
     */
    public Optional<KnowledgeRecord> classifyAndExtract(StoredDocument document) {
        return extract(document).record();
    }

    /**
     * 토픽의 최신 문서 전체 추출 (topic이 null이면 전체 토픽)
     */
    public ExtractionSummary extractTopic(String topic) {
        String normalizedTopic = topic == null || topic.isBlank() ? null : topic.trim().toLowerCase(Locale.ROOT);
        List<StoredDocument> documents = contentStore.getLatestDocuments(normalizedTopic);
        log.info("Extraction started for topic {}: {} documents", normalizedTopic != null ? normalizedTopic : "*",
                documents.size());

        int processed = 0;
        int written = 0;
        int skipped = 0;
        int failed = 0;
        List<String> conflicted = new ArrayList<>();

        for (StoredDocument document : documents) {
            processed++;
            try {
                Outcome outcome = extract(document);
                if (outcome.record().isEmpty()) {
                    skipped++;
                } else if (outcome.written()) {
                    written++;
                }
            } catch (StoreConflictException e) {
                failed++;
                conflicted.add(e.getLogicalKey());
                log.error("Record write failed for {}: {}", document.getUrl(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.warn("Extraction failed for {}: {}", document.getUrl(), e.toString());
            }
        }

        ExtractionSummary summary = new ExtractionSummary(normalizedTopic, processed, written, skipped, failed,
                List.copyOf(conflicted));
        log.info("Extraction finished: {}", summary);
        return summary;
    }

    private Outcome extract(StoredDocument document) {
        String text = document.getContentText();
        if (text == null || text.length() < properties.getCrawl().getMinContentLength()) {
            log.debug("Skipping {}: content too short", document.getUrl());
            return Outcome.SKIPPED;
        }

        Optional<Classification> classification = classifier.classify(document.getTitle(), text);
        if (classification.isEmpty()) {
            log.debug("Low confidence classification, no record for {}", document.getUrl());
            return Outcome.SKIPPED;
        }

        String name = EntityNames.displayName(document.getTitle());
        String normalizedName = EntityNames.normalize(name);
        if (normalizedName.isEmpty()) {
            log.debug("Skipping {}: no usable title", document.getUrl());
            return Outcome.SKIPPED;
        }

        KnowledgeRecord candidate = buildCandidate(document, classification.get(), name, normalizedName);
        Optional<KnowledgeRecord> current = contentStore.getLatestRecord(candidate.getLogicalKey());
        RecordMerger.MergeResult merge = recordMerger.merge(current, candidate);

        if (!merge.changed()) {
            log.debug("Record {} unchanged by {}", candidate.getLogicalKey(), document.getUrl());
            return new Outcome(current, false);
        }
        KnowledgeRecord saved = contentStore.putRecord(merge.record());
        log.debug("Record {} -> v{} ({} fields, {} sources)", saved.getLogicalKey(), saved.getVersion(),
                saved.getFields().size(), saved.getSourceUrls().size());
        return new Outcome(Optional.of(saved), true);
    }

    private KnowledgeRecord buildCandidate(StoredDocument document, Classification classification,
                                           String name, String normalizedName) {
        KnowledgeRecord.KnowledgeRecordBuilder builder = KnowledgeRecord.builder()
                .logicalKey(EntityNames.logicalKey(document.getTopic(), normalizedName))
                .recordType(classification.type())
                .topic(document.getTopic())
                .category(classification.category())
                .name(name)
                .sourceUrls(new ArrayList<>(List.of(document.getUrl())));

        if (classification.type() == RecordType.ENTITY) {
            Map<String, String> fields = fieldRules.extract(document.getContentText());
            if (assistedExtractor.isAvailable()) {
                List<String> missing = FieldExtractionRules.FIELD_ORDER.stream()
                        .filter(f -> !fields.containsKey(f))
                        .toList();
                assistedExtractor.extract(document.getTitle(), document.getContentText(), missing)
                        .forEach(fields::putIfAbsent);
                fieldRules.dropInvertedAgeRange(fields);
            }
            return builder.fields(ordered(fields)).build();
        }

        GeneralContentSummarizer.Summary summary = summarizer.summarize(
                document.getContentText(), document.getRawMarkup(), classification.category());
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("contentType", classification.category());
        return builder
                .fields(fields)
                .summary(summary.summary())
                .keyPoints(new ArrayList<>(summary.keyPoints()))
                .build();
    }

    private static Map<String, String> ordered(Map<String, String> fields) {
        Map<String, String> ordered = new LinkedHashMap<>();
        FieldExtractionRules.FIELD_ORDER.stream()
                .filter(fields::containsKey)
                .forEach(f -> ordered.put(f, fields.get(f)));
        return ordered;
    }

    private record Outcome(Optional<KnowledgeRecord> record, boolean written) {
        static final Outcome SKIPPED = new Outcome(Optional.empty(), false);
    }
}

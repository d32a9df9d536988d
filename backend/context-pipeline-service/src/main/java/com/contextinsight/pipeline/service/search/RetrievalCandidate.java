package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.dto.ProvenanceType;
import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.RecordType;
import com.contextinsight.pipeline.entity.StoredDocument;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 랭킹 대상 후보 (최신 레코드 또는 문서 발췌)
 */
@Value
@Builder
public class RetrievalCandidate {

    /** 불변 행 식별자 ("record:12", "document:7"), 임베딩 캐시 키 */
    String key;
    ProvenanceType provenance;
    String topic;
    String category;
    String title;
    /** 키워드/임베딩 점수 계산용 텍스트 */
    String searchText;
    List<String> sourceUrls;
    Map<String, String> fields;
    String summary;
    List<String> keyPoints;
    String excerpt;
    LocalDateTime versionTimestamp;

    public static RetrievalCandidate fromRecord(KnowledgeRecord record) {
        StringBuilder text = new StringBuilder(record.getName());
        if (record.getCategory() != null) {
            text.append(' ').append(record.getCategory());
        }
        record.getFields().forEach((k, v) -> text.append(' ').append(k).append(' ').append(v));
        if (record.getSummary() != null) {
            text.append(' ').append(record.getSummary());
        }
        record.getKeyPoints().forEach(p -> text.append(' ').append(p));

        return RetrievalCandidate.builder()
                .key("record:" + record.getId())
                .provenance(record.getRecordType() == RecordType.ENTITY
                        ? ProvenanceType.ENTITY_RECORD
                        : ProvenanceType.GENERAL_RECORD)
                .topic(record.getTopic())
                .category(record.getCategory())
                .title(record.getName())
                .searchText(text.toString())
                .sourceUrls(List.copyOf(record.getSourceUrls()))
                .fields(Collections.unmodifiableMap(new LinkedHashMap<>(record.getFields())))
                .summary(record.getSummary())
                .keyPoints(List.copyOf(record.getKeyPoints()))
                .versionTimestamp(record.getCreatedAt())
                .build();
    }

    public static RetrievalCandidate fromDocument(StoredDocument document, int excerptChars) {
        String content = document.getContentText() != null ? document.getContentText() : "";
        String excerpt = content.length() > excerptChars ? content.substring(0, excerptChars) + "..." : content;
        String title = document.getTitle() != null ? document.getTitle() : document.getUrl();

        return RetrievalCandidate.builder()
                .key("document:" + document.getId())
                .provenance(ProvenanceType.DOCUMENT_EXCERPT)
                .topic(document.getTopic())
                .title(title)
                .searchText(title + " " + content)
                .sourceUrls(List.of(document.getUrl()))
                .fields(Map.of())
                .keyPoints(List.of())
                .excerpt(excerpt)
                .versionTimestamp(document.getFetchedAt())
                .build();
    }
}

package com.contextinsight.pipeline.entity;

import com.contextinsight.pipeline.entity.converter.StringListConverter;
import com.contextinsight.pipeline.entity.converter.StringMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 추출된 지식 레코드의 한 버전.
 * logicalKey = topic + "::" + 정규화된 이름
 */
@Entity
@Table(name = "knowledge_records", indexes = {
        @Index(name = "idx_records_key_latest", columnList = "logical_key, is_latest"),
        @Index(name = "idx_records_topic_category", columnList = "topic, category, is_latest")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_records_key_version", columnNames = {"logical_key", "version"})
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "logical_key", nullable = false, length = 512)
    private String logicalKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, length = 16)
    private RecordType recordType;

    @Column(name = "topic", nullable = false, length = 128)
    private String topic;

    /** ENTITY: 엔티티 카테고리, GENERAL: 콘텐츠 유형 */
    @Column(name = "category", length = 64)
    private String category;

    @Column(name = "name", nullable = false, length = 512)
    private String name;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "fields", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> fields = new LinkedHashMap<>();

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Convert(converter = StringListConverter.class)
    @Column(name = "key_points", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> keyPoints = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "source_urls", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> sourceUrls = new ArrayList<>();

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "is_latest", nullable = false)
    @Builder.Default
    private Boolean latest = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

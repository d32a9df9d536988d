package com.contextinsight.pipeline.entity;

import com.contextinsight.pipeline.entity.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
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
import java.util.List;

/**
 * 크롤링된 문서의 한 버전.
 * 같은 URL의 버전 중 latest=true 행은 항상 최대 하나다.
 */
@Entity
@Table(name = "crawled_documents", indexes = {
        @Index(name = "idx_documents_url_latest", columnList = "url, is_latest"),
        @Index(name = "idx_documents_topic_latest", columnList = "topic, is_latest"),
        @Index(name = "idx_documents_content_hash", columnList = "content_hash")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_documents_url_version", columnNames = {"url", "version"})
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StoredDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 정규화된 URL (논리 키) */
    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    @Column(name = "topic", nullable = false, length = 128)
    private String topic;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "content_text", columnDefinition = "TEXT")
    private String contentText;

    @Column(name = "raw_markup", columnDefinition = "TEXT")
    private String rawMarkup;

    @Convert(converter = StringListConverter.class)
    @Column(name = "outbound_links", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> outboundLinks = new ArrayList<>();

    @Column(name = "depth", nullable = false)
    private Integer depth;

    @Column(name = "fetch_strategy", length = 32)
    private String fetchStrategy;

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(name = "relevance_score")
    private Double relevanceScore;

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "is_latest", nullable = false)
    @Builder.Default
    private Boolean latest = true;

    @CreationTimestamp
    @Column(name = "fetched_at", nullable = false, updatable = false)
    private LocalDateTime fetchedAt;
}

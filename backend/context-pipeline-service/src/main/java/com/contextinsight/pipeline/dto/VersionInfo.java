package com.contextinsight.pipeline.dto;

import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.StoredDocument;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 버전 이력 조회 응답 항목
 */
public record VersionInfo(
        String logicalKey,
        int version,
        boolean latest,
        LocalDateTime createdAt,
        String title,
        String contentHash,
        List<String> sourceUrls
) {
    public static VersionInfo from(StoredDocument document) {
        return new VersionInfo(document.getUrl(), document.getVersion(), Boolean.TRUE.equals(document.getLatest()),
                document.getFetchedAt(), document.getTitle(), document.getContentHash(), List.of(document.getUrl()));
    }

    public static VersionInfo from(KnowledgeRecord record) {
        return new VersionInfo(record.getLogicalKey(), record.getVersion(), Boolean.TRUE.equals(record.getLatest()),
                record.getCreatedAt(), record.getName(), null, List.copyOf(record.getSourceUrls()));
    }
}

package com.contextinsight.pipeline.dto;

import java.util.List;

/**
 * 번들에 포함된 랭킹 항목
 */
public record ContextItem(
        String key,
        ProvenanceType provenance,
        String title,
        String topic,
        String category,
        double score,
        List<String> sourceUrls
) {
}

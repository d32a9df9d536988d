package com.contextinsight.pipeline.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 크롤 실행 요청. seeds가 비어 있으면 설정된 시드로 실행한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlRequest {

    @Valid
    @Builder.Default
    private List<SeedUrl> seeds = new ArrayList<>();

    @Min(0)
    private Integer maxDepth;

    @Min(1)
    private Integer maxDocsPerTopic;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeedUrl {
        @NotBlank
        private String url;
        @NotBlank
        private String topic;
    }
}

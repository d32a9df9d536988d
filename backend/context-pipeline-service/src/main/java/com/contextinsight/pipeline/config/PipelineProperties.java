package com.contextinsight.pipeline.config;

import com.contextinsight.pipeline.service.crawl.RateLimitScope;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 설정
 *
 * application.yml의 pipeline.* 항목과 매핑된다.
 * 엔티티 카테고리/일반 콘텐츠 유형 키워드는 선언 순서가 동점 처리 순서다.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    private Crawl crawl = new Crawl();
    private List<Seed> seeds = new ArrayList<>();
    private Extraction extraction = new Extraction();
    private Retrieval retrieval = new Retrieval();
    private Store store = new Store();

    /**
     * 토픽 시드 정의 목록에서 topic에 해당하는 항목 검색
     */
    public Seed findSeed(String topic) {
        if (topic == null) {
            return null;
        }
        return seeds.stream()
                .filter(s -> topic.equalsIgnoreCase(s.getTopic()))
                .findFirst()
                .orElse(null);
    }

    @Data
    public static class Crawl {
        /** 페치 간 최소 간격 (ms) */
        private long delayMs = 1000;
        private RateLimitScope rateLimitScope = RateLimitScope.PER_TASK;
        private int fetchTimeoutSeconds = 30;
        private int minContentLength = 100;
        private int maxTextLength = 50000;
        private int maxRawLength = 200000;
        private int maxLinksPerPage = 100;
        /** 실행 전체 마감 시간 (초), 0이면 무제한 */
        private long runDeadlineSeconds = 0;
        private CrawlPolicy defaultPolicy = new CrawlPolicy();
    }

    @Data
    public static class CrawlPolicy {
        private int maxDepth = 2;
        private int maxDocsPerTopic = 100;
        private List<String> requiredKeywords = new ArrayList<>();
        private List<String> optionalKeywords = new ArrayList<>();
        private List<String> excludePatterns = new ArrayList<>(List.of(
                "*.pdf", "*.docx", "*.xlsx", "/news/", "/media/", "/contact/", "/about/"));
        private String fetchStrategy = "lightweight";

        public CrawlPolicy copy() {
            CrawlPolicy copy = new CrawlPolicy();
            copy.setMaxDepth(maxDepth);
            copy.setMaxDocsPerTopic(maxDocsPerTopic);
            copy.setRequiredKeywords(new ArrayList<>(requiredKeywords));
            copy.setOptionalKeywords(new ArrayList<>(optionalKeywords));
            copy.setExcludePatterns(new ArrayList<>(excludePatterns));
            copy.setFetchStrategy(fetchStrategy);
            return copy;
        }
    }

    @Data
    public static class Seed {
        private String topic;
        private List<String> seedUrls = new ArrayList<>();
        /** 질의에서 토픽을 감지할 때 쓰는 별칭 */
        private List<String> aliases = new ArrayList<>();
        /** 없으면 crawl.default-policy 사용 */
        private CrawlPolicy crawlPolicy;
    }

    @Data
    public static class Extraction {
        private int minKeywordMatches = 2;
        private double entityBias = 1.0;
        private int summaryMaxChars = 600;
        private int maxKeyPoints = 7;
        private Map<String, List<String>> entityCategories = defaultEntityCategories();
        private Map<String, List<String>> generalContentTypes = defaultGeneralContentTypes();
    }

    @Data
    public static class Retrieval {
        private double semanticWeight = 0.6;
        private double keywordWeight = 0.4;
        private int rerankTopN = 20;
        private int defaultMaxItems = 5;
        private int maxContextTokens = 3000;
        private double minScore = 0.0;
        private boolean includeDocuments = true;
        private int excerptChars = 800;
        private int embeddingCacheSize = 10000;
    }

    @Data
    public static class Store {
        private int maxWriteAttempts = 5;
        private long retryBackoffMs = 25;
        private boolean skipUnchanged = true;
    }

    static Map<String, List<String>> defaultEntityCategories() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("work", new ArrayList<>(List.of("work visa", "work permit", "skilled worker",
                "employment", "employer", "job offer", "occupation", "sponsorship")));
        categories.put("study", new ArrayList<>(List.of("student visa", "study permit", "university",
                "enrolment", "enrollment", "tuition", "course of study", "college")));
        categories.put("family", new ArrayList<>(List.of("spouse", "partner visa", "family",
                "dependant", "dependent", "child", "parent visa", "relative")));
        categories.put("business", new ArrayList<>(List.of("business visa", "investor", "entrepreneur",
                "start-up", "startup", "investment", "self-employed")));
        categories.put("tourist", new ArrayList<>(List.of("tourist", "visitor visa", "holiday",
                "travel", "sightseeing", "tourism")));
        return categories;
    }

    static Map<String, List<String>> defaultGeneralContentTypes() {
        Map<String, List<String>> types = new LinkedHashMap<>();
        types.put("guide", new ArrayList<>(List.of("how to", "step", "guide", "instructions", "tips")));
        types.put("faq", new ArrayList<>(List.of("faq", "frequently asked", "question", "answer")));
        types.put("process", new ArrayList<>(List.of("process", "procedure", "apply online", "submit",
                "application form")));
        types.put("requirements", new ArrayList<>(List.of("requirements", "eligibility", "documents",
                "must provide", "checklist")));
        types.put("timeline", new ArrayList<>(List.of("timeline", "deadline", "processing times", "stages",
                "wait times")));
        types.put("overview", new ArrayList<>(List.of("overview", "introduction", "learn more",
                "information")));
        return types;
    }
}

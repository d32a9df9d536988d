package com.contextinsight.pipeline.service.crawl;

import java.util.List;
import java.util.Locale;

/**
 * 키워드 기반 관련성 판정.
 * 필수 키워드 중 하나 이상 포함 시 관련 (필수 목록이 비면 모두 통과),
 * 선택 키워드는 점수만 올린다.
 */
public class RelevancePolicy {

    private static final double OPTIONAL_WEIGHT = 0.5;

    private final List<String> requiredKeywords;
    private final List<String> optionalKeywords;

    public RelevancePolicy(List<String> requiredKeywords, List<String> optionalKeywords) {
        this.requiredKeywords = lower(requiredKeywords);
        this.optionalKeywords = lower(optionalKeywords);
    }

    public Verdict evaluate(String title, String text) {
        String haystack = ((title != null ? title : "") + " " + (text != null ? text : "")).toLowerCase(Locale.ROOT);

        int required = (int) requiredKeywords.stream().filter(haystack::contains).count();
        int optional = (int) optionalKeywords.stream().filter(haystack::contains).count();

        boolean relevant = requiredKeywords.isEmpty() || required > 0;
        return new Verdict(relevant, required, optional, required + OPTIONAL_WEIGHT * optional);
    }

    private static List<String> lower(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    public record Verdict(boolean relevant, int requiredMatches, int optionalMatches, double score) {
    }
}

package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 질의에서 토픽/카테고리 필터 결정.
 * 명시 필터가 우선이며, 없으면 토픽 id와 별칭, 엔티티 카테고리 키워드를 단어 단위로 찾는다.
 */
@Component
@RequiredArgsConstructor
public class QueryFilterDetector {

    private final PipelineProperties properties;

    public record QueryFilters(String topic, String category) {
        public boolean isActive() {
            return topic != null || category != null;
        }
    }

    public QueryFilters detect(String query, String explicitTopic, String explicitCategory,
                               Collection<String> knownTopics) {
        String lowerQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);
        String topic = normalize(explicitTopic);
        String category = normalize(explicitCategory);

        if (topic == null) {
            topic = detectTopic(lowerQuery, knownTopics);
        }
        if (category == null) {
            category = detectCategory(lowerQuery);
        }
        return new QueryFilters(topic, category);
    }

    private String detectTopic(String lowerQuery, Collection<String> knownTopics) {
        Map<String, String> vocabulary = new LinkedHashMap<>();
        for (PipelineProperties.Seed seed : properties.getSeeds()) {
            String topic = normalize(seed.getTopic());
            if (topic == null) {
                continue;
            }
            vocabulary.putIfAbsent(topic, topic);
            for (String alias : seed.getAliases()) {
                String normalizedAlias = normalize(alias);
                if (normalizedAlias != null) {
                    vocabulary.putIfAbsent(normalizedAlias, topic);
                }
            }
        }
        for (String known : knownTopics) {
            String topic = normalize(known);
            if (topic != null) {
                vocabulary.putIfAbsent(topic, topic);
            }
        }

        for (Map.Entry<String, String> term : vocabulary.entrySet()) {
            if (containsWord(lowerQuery, term.getKey())) {
                return term.getValue();
            }
        }
        return null;
    }

    private String detectCategory(String lowerQuery) {
        for (Map.Entry<String, List<String>> category : properties.getExtraction().getEntityCategories().entrySet()) {
            if (containsWord(lowerQuery, category.getKey().toLowerCase(Locale.ROOT))) {
                return category.getKey();
            }
            for (String keyword : category.getValue()) {
                if (containsWord(lowerQuery, keyword.toLowerCase(Locale.ROOT))) {
                    return category.getKey();
                }
            }
        }
        return null;
    }

    private static boolean containsWord(String text, String term) {
        if (term.isEmpty()) {
            return false;
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(term) + "(?![\\p{L}\\p{N}])")
                .matcher(text)
                .find();
    }

    private static String normalize(String value) {
        return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}

package com.contextinsight.pipeline.service.search;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 쿼리 용어 겹침 비율 계산
 */
@Component
public class KeywordScorer {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "her", "was", "one", "our",
            "out", "has", "have", "had", "his", "how", "its", "may", "new", "now", "who", "did", "get", "what",
            "when", "where", "which", "with", "this", "that", "from", "they", "will", "would", "there", "their",
            "about", "into", "than", "then", "them", "these", "those", "does", "need", "should", "could", "your");

    /**
     * 쿼리의 서로 다른 용어 (소문자, 3자 이상, 불용어 제외)
     */
    public Set<String> terms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        if (query == null) {
            return terms;
        }
        Matcher m = TOKEN.matcher(query.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String token = m.group();
            if (token.length() > 2 && !STOPWORDS.contains(token)) {
                terms.add(stem(token));
            }
        }
        return terms;
    }

    /**
     * terms 중 text 에 등장하는 비율 [0, 1]
     */
    public double overlap(Set<String> terms, String text) {
        if (terms.isEmpty() || text == null || text.isEmpty()) {
            return 0.0;
        }
        Set<String> tokens = new LinkedHashSet<>();
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            tokens.add(stem(m.group()));
        }
        long hits = terms.stream().filter(tokens::contains).count();
        return (double) hits / terms.size();
    }

    // 단순 복수형 정규화
    private static String stem(String token) {
        if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}

package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 일반 정보 문서 요약 및 핵심 포인트 추출 (결정적)
 */
@Component
@RequiredArgsConstructor
public class GeneralContentSummarizer {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final int MIN_POINT_LENGTH = 20;
    private static final int MAX_POINT_LENGTH = 240;

    private final PipelineProperties properties;

    public record Summary(String summary, List<String> keyPoints) {
    }

    public Summary summarize(String text, String rawMarkup, String contentType) {
        List<String> sentences = sentences(text);
        String summary = leadingSentences(sentences, properties.getExtraction().getSummaryMaxChars());
        List<String> keyPoints = keyPoints(rawMarkup, sentences, summary, contentType);
        return new Summary(summary, keyPoints);
    }

    private static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return SENTENCE_BOUNDARY.splitAsStream(text.replaceAll("\\s+", " ").trim())
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String leadingSentences(List<String> sentences, int maxChars) {
        StringBuilder sb = new StringBuilder();
        for (String sentence : sentences) {
            int added = sb.length() == 0 ? sentence.length() : sentence.length() + 1;
            if (sb.length() + added > maxChars) {
                break;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(sentence);
        }
        if (sb.length() == 0 && !sentences.isEmpty()) {
            String first = sentences.get(0);
            return first.length() > maxChars ? first.substring(0, Math.max(0, maxChars - 3)) + "..." : first;
        }
        return sb.toString();
    }

    private List<String> keyPoints(String rawMarkup, List<String> sentences, String summary, String contentType) {
        int max = properties.getExtraction().getMaxKeyPoints();
        Set<String> points = new LinkedHashSet<>();

        if (rawMarkup != null && !rawMarkup.isBlank()) {
            Document doc = Jsoup.parse(rawMarkup);
            doc.select("nav, header, footer, aside, script, style").remove();
            for (Element li : doc.select("li")) {
                String item = li.text().trim();
                // 링크만 있는 항목은 메뉴로 본다
                String linkText = li.select("a").text().trim();
                if (item.length() < MIN_POINT_LENGTH || item.length() > MAX_POINT_LENGTH || item.equals(linkText)) {
                    continue;
                }
                points.add(item);
                if (points.size() >= max) {
                    break;
                }
            }
        }

        if (points.size() < 2) {
            List<String> keywords = properties.getExtraction().getGeneralContentTypes()
                    .getOrDefault(contentType, List.of());
            for (String sentence : sentences) {
                if (points.size() >= max) {
                    break;
                }
                if (sentence.length() < MIN_POINT_LENGTH || sentence.length() > MAX_POINT_LENGTH
                        || summary.contains(sentence)) {
                    continue;
                }
                String lower = sentence.toLowerCase(Locale.ROOT);
                boolean bearing = keywords.stream().anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)))
                        || lower.matches(".*\\d.*");
                if (bearing) {
                    points.add(sentence);
                }
            }
        }
        return new ArrayList<>(points);
    }
}

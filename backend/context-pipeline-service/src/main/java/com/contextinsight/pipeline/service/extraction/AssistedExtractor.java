package com.contextinsight.pipeline.service.extraction;

import com.contextinsight.pipeline.client.LlmClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LLM 보조 필드 추출.
 * 규칙으로 채우지 못한 필드만 요청하며 응답 값은 규칙과 같은 검증을 거친다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssistedExtractor {

    private static final int MAX_PROMPT_TEXT = 6000;

    private final LlmClient llmClient;
    private final FieldExtractionRules rules;
    private final ObjectMapper objectMapper;

    public boolean isAvailable() {
        return llmClient.isEnabled();
    }

    public Map<String, String> extract(String title, String text, Collection<String> missingFields) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!isAvailable() || missingFields.isEmpty()) {
            return result;
        }

        Optional<String> reply = llmClient.complete(buildPrompt(title, text, missingFields));
        if (reply.isEmpty()) {
            return result;
        }

        try {
            JsonNode node = objectMapper.readTree(stripCodeFence(reply.get()));
            for (String field : missingFields) {
                JsonNode value = node.get(field);
                if (value == null || value.isNull()) {
                    continue;
                }
                rules.validate(field, value.asText()).ifPresent(v -> result.put(field, v));
            }
        } catch (Exception e) {
            log.warn("Unparseable assisted extraction reply for '{}': {}", title, e.getMessage());
        }
        return result;
    }

    private static String buildPrompt(String title, String text, Collection<String> fields) {
        String body = text.length() > MAX_PROMPT_TEXT ? text.substring(0, MAX_PROMPT_TEXT) : text;
        return """
                Extract the following fields from the page below and answer with a single JSON object.
                Use null for anything the page does not state. Fields: %s
                - ageMin / ageMax / experienceYears: integers
                - education: one of phd, masters, bachelors, diploma, secondary
                - fee: currency and amount, e.g. "$100"
                - processingTime: e.g. "3-6 weeks"
                - languageTest: test and score, e.g. "IELTS 6.5"

                Title: %s

                %s
                """.formatted(String.join(", ", fields), title, body);
    }

    static String stripCodeFence(String reply) {
        String trimmed = reply.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        return start >= 0 && end > start ? trimmed.substring(start, end + 1) : trimmed;
    }
}

package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.dto.ProvenanceType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 랭킹 결과 → 섹션별 컨텍스트 텍스트.
 * 순위대로 항목을 추가하다가 문자 예산을 넘기면 멈춘다.
 */
@Component
public class ContextRenderer {

    private static final Map<ProvenanceType, String> SECTION_HEADERS = new EnumMap<>(ProvenanceType.class);

    static {
        SECTION_HEADERS.put(ProvenanceType.ENTITY_RECORD, "=== CATEGORIZED ENTRIES ===");
        SECTION_HEADERS.put(ProvenanceType.GENERAL_RECORD, "=== GENERAL INFORMATION ===");
        SECTION_HEADERS.put(ProvenanceType.DOCUMENT_EXCERPT, "=== DOCUMENT EXCERPTS ===");
    }

    public record Rendered(String text, List<ScoredCandidate> included) {
    }

    public Rendered render(List<ScoredCandidate> ranked, int budgetChars) {
        Map<ProvenanceType, List<String>> sections = new EnumMap<>(ProvenanceType.class);
        List<ScoredCandidate> included = new ArrayList<>();
        int used = 0;

        for (ScoredCandidate scored : ranked) {
            ProvenanceType type = scored.candidate().getProvenance();
            List<String> entries = sections.computeIfAbsent(type, t -> new ArrayList<>());
            String entry = formatEntry(entries.size() + 1, scored.candidate());
            int cost = entry.length() + 2 + (entries.isEmpty() ? SECTION_HEADERS.get(type).length() + 2 : 0);

            if (used + cost > budgetChars) {
                if (included.isEmpty()) {
                    // 첫 항목이 예산보다 크면 잘라서라도 포함
                    int room = Math.max(0, budgetChars - SECTION_HEADERS.get(type).length() - 4);
                    entries.add(entry.substring(0, Math.min(entry.length(), room)));
                    included.add(scored);
                } else if (entries.isEmpty()) {
                    sections.remove(type);
                }
                break;
            }
            entries.add(entry);
            included.add(scored);
            used += cost;
        }

        List<String> blocks = new ArrayList<>();
        for (ProvenanceType type : ProvenanceType.values()) {
            List<String> entries = sections.get(type);
            if (entries != null && !entries.isEmpty()) {
                blocks.add(SECTION_HEADERS.get(type) + "\n\n" + String.join("\n\n", entries));
            }
        }
        return new Rendered(String.join("\n\n", blocks), included);
    }

    private static String formatEntry(int index, RetrievalCandidate c) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(index).append("] ").append(c.getTitle());

        switch (c.getProvenance()) {
            case ENTITY_RECORD -> {
                sb.append(" (topic: ").append(c.getTopic()).append(", category: ").append(c.getCategory()).append(')');
                c.getFields().forEach((k, v) -> sb.append("\n- ").append(k).append(": ").append(v));
            }
            case GENERAL_RECORD -> {
                sb.append(" (topic: ").append(c.getTopic()).append(", type: ").append(c.getCategory()).append(')');
                if (c.getSummary() != null && !c.getSummary().isBlank()) {
                    sb.append("\nSummary: ").append(c.getSummary());
                }
                if (!c.getKeyPoints().isEmpty()) {
                    sb.append("\nKey Points:");
                    c.getKeyPoints().forEach(p -> sb.append("\n- ").append(p));
                }
            }
            case DOCUMENT_EXCERPT -> {
                sb.append(" (topic: ").append(c.getTopic()).append(')');
                sb.append('\n').append(c.getExcerpt());
            }
        }

        sb.append("\nProvenance: ").append(c.getProvenance().getCode());
        sb.append(" | Sources: ").append(String.join(", ", c.getSourceUrls()));
        return sb.toString();
    }
}

package com.contextinsight.pipeline.service.search;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.dto.Citation;
import com.contextinsight.pipeline.dto.ContextBundle;
import com.contextinsight.pipeline.dto.ContextItem;
import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.RecordType;
import com.contextinsight.pipeline.entity.StoredDocument;
import com.contextinsight.pipeline.service.ContentStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 질의 → 컨텍스트 번들
 *
 * 필터 결정 → 후보 수집 → 랭킹 체인 → 예산 내 렌더링.
 * 일치 후보가 없으면 빈 번들을 반환한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextRetrievalService {

    private static final int CHARS_PER_TOKEN = 4;

    private final ContentStoreService contentStore;
    private final QueryFilterDetector filterDetector;
    private final RankingChain rankingChain;
    private final ContextRenderer renderer;
    private final PipelineProperties properties;

    public ContextBundle retrieve(String query, String topicFilter, String categoryFilter, Integer maxItems) {
        if (query == null || query.isBlank()) {
            return ContextBundle.empty(query);
        }
        PipelineProperties.Retrieval config = properties.getRetrieval();
        int limit = maxItems != null && maxItems > 0 ? maxItems : config.getDefaultMaxItems();

        QueryFilterDetector.QueryFilters filters = filterDetector.detect(
                query, topicFilter, categoryFilter, contentStore.getKnownTopics());

        List<RetrievalCandidate> candidates = collectCandidates(filters, config);
        if (candidates.isEmpty()) {
            log.debug("No candidates for query '{}' (filters: {})", query, filters);
            return ContextBundle.empty(query);
        }

        RankingChain.Result ranking = rankingChain.rank(query, candidates, limit);
        ContextRenderer.Rendered rendered = renderer.render(ranking.ranked(),
                config.getMaxContextTokens() * CHARS_PER_TOKEN);

        List<ContextItem> items = rendered.included().stream()
                .map(sc -> new ContextItem(
                        sc.candidate().getKey(),
                        sc.candidate().getProvenance(),
                        sc.candidate().getTitle(),
                        sc.candidate().getTopic(),
                        sc.candidate().getCategory(),
                        sc.score(),
                        sc.candidate().getSourceUrls()))
                .toList();

        log.debug("Query '{}': {} candidates, {} items via {}", query, candidates.size(), items.size(),
                ranking.tiers());
        return new ContextBundle(query, items, rendered.text(), citations(rendered.included()), ranking.tiers());
    }

    private List<RetrievalCandidate> collectCandidates(QueryFilterDetector.QueryFilters filters,
                                                       PipelineProperties.Retrieval config) {
        List<RetrievalCandidate> candidates = new ArrayList<>();
        Set<String> recordSources = new HashSet<>();
        for (KnowledgeRecord record : contentStore.getLatestRecords(filters.topic(), null)) {
            if (!matchesCategory(record, filters.category())) {
                continue;
            }
            candidates.add(RetrievalCandidate.fromRecord(record));
            recordSources.addAll(record.getSourceUrls());
        }

        // 일반 정보와 문서 발췌는 토픽 필터만 적용
        if (config.isIncludeDocuments()) {
            for (StoredDocument document : contentStore.getLatestDocuments(filters.topic())) {
                if (!recordSources.contains(document.getUrl())) {
                    candidates.add(RetrievalCandidate.fromDocument(document, config.getExcerptChars()));
                }
            }
        }
        return candidates;
    }

    /**
     * 카테고리 필터는 ENTITY 레코드에만 적용한다. GENERAL 레코드의 category는 콘텐츠 유형이다.
     */
    private static boolean matchesCategory(KnowledgeRecord record, String category) {
        return category == null
                || record.getRecordType() != RecordType.ENTITY
                || category.equalsIgnoreCase(record.getCategory());
    }

    private static List<Citation> citations(List<ScoredCandidate> included) {
        Set<Citation> citations = new LinkedHashSet<>();
        for (ScoredCandidate sc : included) {
            for (String url : sc.candidate().getSourceUrls()) {
                citations.add(new Citation(url, sc.candidate().getProvenance()));
            }
        }
        return List.copyOf(citations);
    }
}

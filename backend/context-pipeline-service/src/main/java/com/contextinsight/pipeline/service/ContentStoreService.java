package com.contextinsight.pipeline.service;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.StoredDocument;
import com.contextinsight.pipeline.exception.StoreConflictException;
import com.contextinsight.pipeline.repository.KnowledgeRecordRepository;
import com.contextinsight.pipeline.repository.StoredDocumentRepository;
import com.contextinsight.pipeline.util.ContentHashes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 버전 관리 콘텐츠 저장소.
 *
 * 문서(URL 키)와 지식 레코드(topic::name 키)를 append-only로 저장한다.
 * 파이프라인의 다른 컴포넌트는 리포지토리 대신 이 서비스만 사용한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentStoreService {

    private final StoredDocumentRepository documentRepository;
    private final KnowledgeRecordRepository recordRepository;
    private final VersionFlipService versionFlipService;
    private final PipelineProperties properties;

    // ========== Documents ==========

    /**
     * 문서의 새 버전 저장.
     * 최신 버전과 콘텐츠 해시가 같으면 (skip-unchanged) 기존 최신 버전을 반환한다.
     *
     * @throws StoreConflictException 버전 전환 실패
     */
    public StoredDocument putDocument(StoredDocument draft) {
        if (draft.getContentHash() == null) {
            draft.setContentHash(computeContentHash(draft.getUrl(), draft.getTitle(), draft.getContentText()));
        }

        if (properties.getStore().isSkipUnchanged()) {
            Optional<StoredDocument> current = documentRepository.findByUrlAndLatestTrue(draft.getUrl());
            if (current.isPresent() && draft.getContentHash().equals(current.get().getContentHash())) {
                log.debug("Unchanged content, keeping version {} of {}", current.get().getVersion(), draft.getUrl());
                return current.get();
            }
        }

        StoredDocument saved = writeWithRetry(draft.getUrl(), () -> versionFlipService.supersedeAndInsert(draft));
        log.debug("Stored document {} v{}", saved.getUrl(), saved.getVersion());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<StoredDocument> getLatestDocument(String url) {
        return documentRepository.findByUrlAndLatestTrue(url);
    }

    /**
     * 토픽의 최신 문서 목록 (topic이 null이면 전체)
     */
    @Transactional(readOnly = true)
    public List<StoredDocument> getLatestDocuments(String topic) {
        return topic == null
                ? documentRepository.findByLatestTrueOrderByIdAsc()
                : documentRepository.findByTopicAndLatestTrueOrderByIdAsc(topic);
    }

    @Transactional(readOnly = true)
    public List<StoredDocument> getDocumentHistory(String url) {
        return documentRepository.findByUrlOrderByVersionDesc(url);
    }

    // ========== Records ==========

    /**
     * 레코드의 새 버전 저장. 변경 여부 판단은 호출자(추출 엔진) 책임.
     *
     * @throws StoreConflictException 버전 전환 실패
     */
    public KnowledgeRecord putRecord(KnowledgeRecord draft) {
        KnowledgeRecord saved = writeWithRetry(draft.getLogicalKey(), () -> versionFlipService.supersedeAndInsert(draft));
        log.debug("Stored record {} v{}", saved.getLogicalKey(), saved.getVersion());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<KnowledgeRecord> getLatestRecord(String logicalKey) {
        return recordRepository.findByLogicalKeyAndLatestTrue(logicalKey);
    }

    /**
     * 최신 레코드 조회. topic, category 모두 선택 조건.
     */
    @Transactional(readOnly = true)
    public List<KnowledgeRecord> getLatestRecords(String topic, String category) {
        if (topic != null && category != null) {
            return recordRepository.findByTopicAndCategoryAndLatestTrueOrderByIdAsc(topic, category);
        }
        if (topic != null) {
            return recordRepository.findByTopicAndLatestTrueOrderByIdAsc(topic);
        }
        if (category != null) {
            return recordRepository.findByCategoryAndLatestTrueOrderByIdAsc(category);
        }
        return recordRepository.findByLatestTrueOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public List<KnowledgeRecord> getRecordHistory(String logicalKey) {
        return recordRepository.findByLogicalKeyOrderByVersionDesc(logicalKey);
    }

    /**
     * 저장소에 최신 행이 존재하는 토픽 목록
     */
    @Transactional(readOnly = true)
    public Set<String> getKnownTopics() {
        Set<String> topics = new LinkedHashSet<>(recordRepository.findLatestTopics());
        topics.addAll(documentRepository.findLatestTopics());
        return topics;
    }

    /**
     * 콘텐츠 해시 계산 (URL + 제목 + 본문)
     */
    public String computeContentHash(String url, String title, String content) {
        return ContentHashes.sha256Hex(url, title, content);
    }

    private <T> T writeWithRetry(String logicalKey, Supplier<T> write) {
        int maxAttempts = Math.max(1, properties.getStore().getMaxWriteAttempts());
        List<Throwable> conflicts = new ArrayList<>();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return write.get();
            } catch (TransientDataAccessException | DataIntegrityViolationException e) {
                conflicts.add(e);
                log.debug("Version flip conflict on {} (attempt {}/{}): {}",
                        logicalKey, attempt, maxAttempts, e.getMessage());
                backoff(logicalKey, attempt);
            } catch (DataAccessException e) {
                log.error("Version flip failed for {}: {}", logicalKey, e.getMessage());
                throw StoreConflictException.writeFailed(logicalKey, e);
            }
        }

        Throwable last = conflicts.isEmpty() ? null : conflicts.get(conflicts.size() - 1);
        log.error("Version flip for {} gave up after {} attempts", logicalKey, maxAttempts);
        throw StoreConflictException.retriesExhausted(logicalKey, maxAttempts, last);
    }

    private void backoff(String logicalKey, int attempt) {
        long delay = properties.getStore().getRetryBackoffMs() * attempt;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StoreConflictException.interrupted(logicalKey);
        }
    }
}

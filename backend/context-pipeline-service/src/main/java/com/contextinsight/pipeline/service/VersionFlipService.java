package com.contextinsight.pipeline.service;

import com.contextinsight.pipeline.entity.KnowledgeRecord;
import com.contextinsight.pipeline.entity.StoredDocument;
import com.contextinsight.pipeline.entity.VersionHead;
import com.contextinsight.pipeline.entity.VersionNamespace;
import com.contextinsight.pipeline.repository.KnowledgeRecordRepository;
import com.contextinsight.pipeline.repository.StoredDocumentRepository;
import com.contextinsight.pipeline.repository.VersionHeadRepository;
import com.contextinsight.pipeline.util.ContentHashes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * supersede-and-insert 트랜잭션.
 *
 * 한 트랜잭션 안에서 버전 헤드 락 → 기존 latest 해제 → 새 버전 삽입 → 헤드 갱신.
 * 재시도는 {@link ContentStoreService}가 담당한다.
 */
@Service
@RequiredArgsConstructor
public class VersionFlipService {

    private final VersionHeadRepository versionHeadRepository;
    private final StoredDocumentRepository documentRepository;
    private final KnowledgeRecordRepository recordRepository;

    @Transactional
    public StoredDocument supersedeAndInsert(StoredDocument draft) {
        VersionHead head = lockHead(VersionNamespace.DOCUMENT, draft.getUrl());
        int next = head.getLatestVersion() + 1;

        documentRepository.supersedeLatest(draft.getUrl());
        StoredDocument saved = documentRepository.save(draft.toBuilder()
                .id(null)
                .version(next)
                .latest(true)
                .build());

        head.setLatestVersion(next);
        return saved;
    }

    @Transactional
    public KnowledgeRecord supersedeAndInsert(KnowledgeRecord draft) {
        VersionHead head = lockHead(VersionNamespace.RECORD, draft.getLogicalKey());
        int next = head.getLatestVersion() + 1;

        recordRepository.supersedeLatest(draft.getLogicalKey());
        KnowledgeRecord saved = recordRepository.save(draft.toBuilder()
                .id(null)
                .version(next)
                .latest(true)
                .build());

        head.setLatestVersion(next);
        return saved;
    }

    private VersionHead lockHead(VersionNamespace namespace, String logicalKey) {
        String headId = ContentHashes.sha256Hex(namespace.name(), logicalKey);
        // 헤드가 없으면 PK 충돌로 동시 생성이 걸러진다
        return versionHeadRepository.findByIdForUpdate(headId)
                .orElseGet(() -> versionHeadRepository.saveAndFlush(VersionHead.builder()
                        .id(headId)
                        .namespace(namespace)
                        .logicalKey(logicalKey)
                        .latestVersion(0)
                        .build()));
    }
}

package com.contextinsight.pipeline.repository;

import com.contextinsight.pipeline.entity.StoredDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StoredDocumentRepository extends JpaRepository<StoredDocument, Long> {

    Optional<StoredDocument> findByUrlAndLatestTrue(String url);

    List<StoredDocument> findByLatestTrueOrderByIdAsc();

    List<StoredDocument> findByTopicAndLatestTrueOrderByIdAsc(String topic);

    List<StoredDocument> findByUrlOrderByVersionDesc(String url);

    long countByUrlAndLatestTrue(String url);

    @Query("SELECT DISTINCT d.topic FROM StoredDocument d WHERE d.latest = true")
    List<String> findLatestTopics();

    /**
     * 현재 latest 버전을 과거 버전으로 전환
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE StoredDocument d SET d.latest = false WHERE d.url = :url AND d.latest = true")
    int supersedeLatest(@Param("url") String url);
}

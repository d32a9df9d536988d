package com.contextinsight.pipeline.repository;

import com.contextinsight.pipeline.entity.KnowledgeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface KnowledgeRecordRepository extends JpaRepository<KnowledgeRecord, Long> {

    Optional<KnowledgeRecord> findByLogicalKeyAndLatestTrue(String logicalKey);

    List<KnowledgeRecord> findByLatestTrueOrderByIdAsc();

    List<KnowledgeRecord> findByTopicAndLatestTrueOrderByIdAsc(String topic);

    List<KnowledgeRecord> findByCategoryAndLatestTrueOrderByIdAsc(String category);

    List<KnowledgeRecord> findByTopicAndCategoryAndLatestTrueOrderByIdAsc(String topic, String category);

    List<KnowledgeRecord> findByLogicalKeyOrderByVersionDesc(String logicalKey);

    long countByLogicalKeyAndLatestTrue(String logicalKey);

    @Query("SELECT DISTINCT r.topic FROM KnowledgeRecord r WHERE r.latest = true")
    List<String> findLatestTopics();

    @Modifying(flushAutomatically = true)
    @Query("UPDATE KnowledgeRecord r SET r.latest = false WHERE r.logicalKey = :key AND r.latest = true")
    int supersedeLatest(@Param("key") String logicalKey);
}

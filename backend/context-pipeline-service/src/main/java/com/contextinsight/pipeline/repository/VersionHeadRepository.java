package com.contextinsight.pipeline.repository;

import com.contextinsight.pipeline.entity.VersionHead;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VersionHeadRepository extends JpaRepository<VersionHead, String> {

    /**
     * SELECT ... FOR UPDATE. 같은 키의 동시 버전 전환은 여기서 대기한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM VersionHead h WHERE h.id = :id")
    Optional<VersionHead> findByIdForUpdate(@Param("id") String id);
}

package com.contextinsight.pipeline.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 논리 키별 버전 헤드.
 * 버전 전환 트랜잭션은 이 행을 비관적 락으로 잡아 같은 키의 쓰기를 직렬화한다.
 */
@Entity
@Table(name = "version_heads")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionHead {

    /** SHA-256(namespace:logicalKey) */
    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "namespace", nullable = false, length = 16)
    private VersionNamespace namespace;

    @Column(name = "logical_key", nullable = false, length = 2048)
    private String logicalKey;

    @Column(name = "latest_version", nullable = false)
    private Integer latestVersion;

    @Version
    @Column(name = "lock_version")
    private Long lockVersion;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}

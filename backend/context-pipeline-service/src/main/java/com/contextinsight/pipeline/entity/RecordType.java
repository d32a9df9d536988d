package com.contextinsight.pipeline.entity;

/**
 * 지식 레코드 종류
 */
public enum RecordType {
    /** 카테고리가 지정된 엔티티 (구조화 필드 보유) */
    ENTITY,
    /** 일반 정보 (요약 + 핵심 포인트) */
    GENERAL
}

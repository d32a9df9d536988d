package com.contextinsight.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 컨텍스트 항목 출처 유형
 */
public enum ProvenanceType {
    ENTITY_RECORD("entity_record"),
    GENERAL_RECORD("general_record"),
    DOCUMENT_EXCERPT("document_excerpt");

    private final String code;

    ProvenanceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

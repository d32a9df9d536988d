package com.contextinsight.pipeline.dto;

public record Citation(String sourceUrl, ProvenanceType provenanceType) {
}

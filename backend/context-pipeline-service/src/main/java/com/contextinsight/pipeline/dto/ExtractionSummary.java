package com.contextinsight.pipeline.dto;

import java.util.List;

/**
 * 토픽 단위 추출 실행 결과
 *
 * @param conflictedKeys 저장 충돌로 쓰지 못한 레코드 키
 */
public record ExtractionSummary(
        String topic,
        int processed,
        int recordsWritten,
        int skipped,
        int failed,
        List<String> conflictedKeys
) {
}

package com.contextinsight.pipeline.exception;

/**
 * 버전 전환(supersede-and-insert) 쓰기 실패.
 * 부분 전환은 latest 불변식을 깨뜨리므로 호출자에게 그대로 전달된다.
 */
public class StoreConflictException extends PipelineException {

    private final String logicalKey;

    public StoreConflictException(String logicalKey, String message, Throwable cause) {
        super("STORE_CONFLICT", message, cause);
        this.logicalKey = logicalKey;
    }

    public String getLogicalKey() {
        return logicalKey;
    }

    /**
     * 동시 쓰기 충돌로 재시도 횟수 초과
     */
    public static StoreConflictException retriesExhausted(String logicalKey, int attempts, Throwable cause) {
        return new StoreConflictException(logicalKey,
                "Version flip for " + logicalKey + " still conflicting after " + attempts + " attempts", cause);
    }

    /**
     * 재시도 불가능한 쓰기 실패
     */
    public static StoreConflictException writeFailed(String logicalKey, Throwable cause) {
        return new StoreConflictException(logicalKey, "Version flip for " + logicalKey + " failed", cause);
    }

    /**
     * 재시도 대기 중 인터럽트
     */
    public static StoreConflictException interrupted(String logicalKey) {
        return new StoreConflictException(logicalKey, "Interrupted while retrying version flip for " + logicalKey, null);
    }
}

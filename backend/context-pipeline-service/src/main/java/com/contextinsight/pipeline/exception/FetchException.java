package com.contextinsight.pipeline.exception;

import com.contextinsight.pipeline.entity.FetchFailureType;

/**
 * 단일 URL 페치 실패.
 * 크롤 실행 전체를 중단시키지 않으며, 프론티어가 기록 후 다음 URL로 진행한다.
 */
public class FetchException extends PipelineException {

    private final String url;
    private final FetchFailureType failureType;
    private final Integer statusCode;

    public FetchException(String url, FetchFailureType failureType, String message) {
        this(url, failureType, null, message, null);
    }

    public FetchException(String url, FetchFailureType failureType, Integer statusCode, String message, Throwable cause) {
        super("FETCH_" + failureType.name(), message, cause);
        this.url = url;
        this.failureType = failureType;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    public FetchFailureType getFailureType() {
        return failureType;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * 비정상 HTTP 상태 코드
     */
    public static FetchException httpStatus(String url, int statusCode) {
        FetchFailureType type = FetchFailureType.fromStatus(statusCode);
        return new FetchException(url, type, statusCode, "HTTP " + statusCode + " for " + url, null);
    }

    /**
     * 전송 계층 예외 (타임아웃, 연결 실패 등)
     */
    public static FetchException fromThrowable(String url, Throwable cause) {
        if (cause instanceof FetchException fetchException) {
            return fetchException;
        }
        FetchFailureType type = FetchFailureType.fromException(cause);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new FetchException(url, type, null, type.getDescription() + ": " + detail, cause);
    }
}

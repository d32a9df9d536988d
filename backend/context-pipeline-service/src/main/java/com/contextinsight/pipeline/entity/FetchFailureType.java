package com.contextinsight.pipeline.entity;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * 페치 실패 유형.
 * HTTP 상태 코드 또는 예외로부터 분류한다.
 */
public enum FetchFailureType {

    TIMEOUT("timeout", "요청 시간 초과"),
    BLOCKED("blocked", "접근 차단 (403/429)"),
    NOT_FOUND("not_found", "페이지 없음 (404/410)"),
    OTHER("other", "기타 오류");

    private final String code;
    private final String description;

    FetchFailureType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static FetchFailureType fromStatus(int statusCode) {
        return switch (statusCode) {
            case 401, 403, 429 -> BLOCKED;
            case 404, 410 -> NOT_FOUND;
            case 408, 504 -> TIMEOUT;
            default -> OTHER;
        };
    }

    /**
     * 예외 체인을 따라가며 유형 판별
     */
    public static FetchFailureType fromException(Throwable e) {
        Throwable current = e;
        int guard = 0;
        while (current != null && guard++ < 10) {
            if (current instanceof TimeoutException || current instanceof SocketTimeoutException) {
                return TIMEOUT;
            }
            String name = current.getClass().getSimpleName().toLowerCase();
            if (name.contains("timeout")) {
                return TIMEOUT;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase();
                if (lower.contains("timed out") || lower.contains("timeout")) {
                    return TIMEOUT;
                }
                if (lower.contains("403") || lower.contains("forbidden") || lower.contains("429")
                        || lower.contains("too many requests")) {
                    return BLOCKED;
                }
            }
            current = current.getCause();
        }
        return OTHER;
    }
}

package com.aerocharts.core.error;

/** 실패 종류. retryable은 호출자 재시도 가능 여부(엔진 자체는 재시도하지 않음) */
public enum ChartFailureKind {
    /** 식별자에 맞는 소스 없음 */
    UNKNOWN_SOURCE(false, "unknown airport"),
    /** 현재 AIRAC 폴더를 찾지 못함 */
    VERSION_UNRESOLVED(true, "could not determine the current publication"),
    /** 소스가 해당 공항을 모름 */
    NOT_FOUND(false, "airport not found in source"),
    /** 네트워크 실패, 5xx, 429 */
    UPSTREAM_UNAVAILABLE(true, "could not reach source"),
    /** 페이지 구조가 예상과 다름 */
    PARSE_MISMATCH(false, "source structure changed"),
    /** 타임아웃 초과 */
    BACKEND_TIMEOUT(true, "could not reach source (timed out)"),
    /** 401/403, 로그인 벽 */
    ACCESS_RESTRICTED(false, "source requires authorization");

    private final boolean retryable;
    private final String summary;

    ChartFailureKind(boolean retryable, String summary) {
        this.retryable = retryable;
        this.summary = summary;
    }

    public boolean isRetryable() { return retryable; }

    /** 사용자에게 보여줄 짧은 문구 */
    public String summary() { return summary; }

    /** HTTP 상태코드 → 실패 종류. 2xx/3xx는 null */
    public static ChartFailureKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) return ACCESS_RESTRICTED;
        if (status == 404 || status == 410) return NOT_FOUND;
        if (status == 429 || status >= 500 || status < 0) return UPSTREAM_UNAVAILABLE;
        if (status >= 400) return PARSE_MISMATCH;
        return null;
    }
}

package com.aerocharts.core.retry;

import com.aerocharts.core.error.ChartSourceException;

import java.time.Duration;

/** 호출자 측 재시도 정책. 엔진은 스스로 재시도하지 않는다 */
public interface RetryPolicy {
    /** attempt는 1부터(방금 실패한 시도 번호). true면 지연 후 재시도 */
    boolean shouldRetry(ChartSourceException failure, int attempt);
    /** attempt 실패 후 다음 시도 전 지연 */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함) */
    int maxAttempts();

    /** 재시도 없음 */
    static RetryPolicy none() {
        return new DefaultRetryPolicy(1, 1);
    }
}

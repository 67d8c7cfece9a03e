package com.aerocharts.core.util;

import java.time.Duration;

/** 대기 추상화(테스트에서 실제 sleep 없이 기록용으로 교체) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** Thread.sleep 기반 기본 구현. 0 이하는 즉시 반환 */
    static Sleeper system() {
        return d -> {
            long ms = d == null ? 0 : d.toMillis();
            if (ms > 0) Thread.sleep(ms);
        };
    }
}

package com.aerocharts.core.browser;

import com.aerocharts.core.error.ChartSourceException;

import java.time.Duration;

/**
 * 스크립트 가능한 브라우저 세션 1개(페이지 1개).
 * 생성한 스레드에서만 사용하고, 같은 스레드에서 close 한다.
 */
public interface BrowserSession extends AutoCloseable {

    /** 이동 실패: 타임아웃 → BACKEND_TIMEOUT, 네트워크 → UPSTREAM_UNAVAILABLE, 4xx/5xx → 상태코드 매핑 */
    void navigate(String url, Duration timeout) throws ChartSourceException;

    /** 셀렉터가 없으면 PARSE_MISMATCH */
    void click(String selector, Duration timeout) throws ChartSourceException;

    /** 셀렉터가 없으면 PARSE_MISMATCH */
    void fill(String selector, String text, Duration timeout) throws ChartSourceException;

    void press(String selector, String key, Duration timeout) throws ChartSourceException;

    /** 나타나면 true, 시간 안에 안 나타나면 false */
    boolean waitFor(String selector, Duration timeout) throws ChartSourceException;

    /** 네트워크가 잠잠해질 때까지 대기(최선 노력, 실패해도 예외 없음) */
    void settle(Duration max);

    /** 현재 렌더링된 HTML */
    String content() throws ChartSourceException;

    String currentUrl();

    @Override
    void close();
}

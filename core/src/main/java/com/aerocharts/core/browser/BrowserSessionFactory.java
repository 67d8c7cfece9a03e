package com.aerocharts.core.browser;

import com.aerocharts.core.error.ChartSourceException;

/** 세션 생성기. 풀이 permit을 얻은 뒤 호출한다 */
public interface BrowserSessionFactory extends AutoCloseable {

    BrowserSession open() throws ChartSourceException;

    @Override
    default void close() {}
}

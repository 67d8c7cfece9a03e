package com.aerocharts.core.browser;

import com.aerocharts.core.config.ResolverConfig;
import com.aerocharts.core.error.ChartSourceException;

import java.util.Objects;

/** 세션마다 Chromium을 새로 띄운다(세션 간 쿠키/상태 공유 없음) */
public final class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

    private final boolean headless;
    private final String userAgent;

    public PlaywrightBrowserSessionFactory(ResolverConfig config) {
        Objects.requireNonNull(config, "config");
        this.headless = config.browser().isHeadless();
        this.userAgent = config.getUserAgent();
    }

    @Override
    public BrowserSession open() throws ChartSourceException {
        return PlaywrightBrowserSession.launch(headless, userAgent);
    }
}

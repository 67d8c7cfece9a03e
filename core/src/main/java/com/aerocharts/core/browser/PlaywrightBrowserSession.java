package com.aerocharts.core.browser;

import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Playwright(Chromium) 세션. Playwright 객체는 스레드 안전하지 않으므로
 * 세션마다 자체 Playwright 인스턴스를 만들고 세션을 연 스레드에서만 쓴다.
 */
final class PlaywrightBrowserSession implements BrowserSession {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    private PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    static PlaywrightBrowserSession launch(boolean headless, String userAgent) throws ChartSourceException {
        Playwright pw = null;
        try {
            pw = Playwright.create();
            Browser browser = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            BrowserContext ctx = browser.newContext(new Browser.NewContextOptions().setUserAgent(userAgent));
            Page page = ctx.newPage();
            return new PlaywrightBrowserSession(pw, browser, ctx, page);
        } catch (PlaywrightException e) {
            if (pw != null) pw.close();
            throw new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE,
                    "browser launch failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void navigate(String url, Duration timeout) throws ChartSourceException {
        Response resp;
        try {
            resp = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout((double) timeout.toMillis()));
        } catch (TimeoutError e) {
            throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT, "navigation timed out: " + url, e);
        } catch (PlaywrightException e) {
            throw new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE,
                    "navigation failed: " + url + " (" + e.getMessage() + ")", e);
        }
        if (resp != null) {
            ChartFailureKind kind = ChartFailureKind.fromHttpStatus(resp.status());
            if (kind != null) {
                throw new ChartSourceException(kind, "HTTP " + resp.status() + " from " + url);
            }
        }
    }

    @Override
    public void click(String selector, Duration timeout) throws ChartSourceException {
        try {
            page.click(selector, new Page.ClickOptions().setTimeout((double) timeout.toMillis()));
        } catch (TimeoutError e) {
            throw missing(selector, e);
        } catch (PlaywrightException e) {
            throw failed("click", selector, e);
        }
    }

    @Override
    public void fill(String selector, String text, Duration timeout) throws ChartSourceException {
        try {
            page.fill(selector, text, new Page.FillOptions().setTimeout((double) timeout.toMillis()));
        } catch (TimeoutError e) {
            throw missing(selector, e);
        } catch (PlaywrightException e) {
            throw failed("fill", selector, e);
        }
    }

    @Override
    public void press(String selector, String key, Duration timeout) throws ChartSourceException {
        try {
            page.press(selector, key, new Page.PressOptions().setTimeout((double) timeout.toMillis()));
        } catch (TimeoutError e) {
            throw missing(selector, e);
        } catch (PlaywrightException e) {
            throw failed("press", selector, e);
        }
    }

    @Override
    public boolean waitFor(String selector, Duration timeout) throws ChartSourceException {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout((double) timeout.toMillis()));
            return true;
        } catch (TimeoutError e) {
            return false;
        } catch (PlaywrightException e) {
            throw failed("wait", selector, e);
        }
    }

    @Override
    public void settle(Duration max) {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE,
                    new Page.WaitForLoadStateOptions().setTimeout((double) max.toMillis()));
        } catch (TimeoutError e) {
            // 롱폴링 페이지는 idle이 안 올 수 있음
            LOG.debug("network idle not reached within {} ms: {}", max.toMillis(), page.url());
        }
    }

    @Override
    public String content() throws ChartSourceException {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE, "page content unavailable", e);
        }
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } finally {
            playwright.close();
        }
    }

    private static ChartSourceException missing(String selector, Throwable cause) {
        return new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                "expected element not found: " + selector, cause);
    }

    private static ChartSourceException failed(String op, String selector, PlaywrightException e) {
        return new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE,
                op + " failed on " + selector + ": " + e.getMessage(), e);
    }
}

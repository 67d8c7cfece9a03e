package com.aerocharts.core.adapter;

import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.browser.BrowserSession;
import com.aerocharts.core.browser.BrowserSessionPool;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.html.ChartLinkExtractor;
import com.aerocharts.core.html.LinkCandidate;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.util.StructuredLog;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 자바스크립트로 그려지는 SPA 소스(ANAC Argentina 등).
 * 세션은 fetch 시작에 빌리고 모든 종료 경로(취소 포함)에서 반환한다.
 *
 * 스크립트:
 *   navigate(browser-url) → [click(tab-selector)] → fill(search-selector, 식별자) → [press Enter]
 *   → waitFor(results-selector) → settle → 렌더링된 HTML에서 행별 링크 추출
 *
 * options:
 *   browser-url       시작 URL 템플릿(기본 {base})
 *   tab-selector      관할 탭(선택)
 *   search-selector   검색 입력(필수)
 *   submit-key        입력 후 누를 키(기본 Enter, "none"이면 안 누름)
 *   results-selector  결과 행 셀렉터(필수). 안 나타나면 NOT_FOUND
 *   link-pattern      문서 링크 href 정규식(기본 .pdf)
 *   filter-identifier true면 행 텍스트/링크에 식별자가 있는 것만(기본 true)
 *   step-timeout-ms   단계별 대기 상한(기본 30000)
 *   settle-ms         결과 후 네트워크 안정 대기 상한(기본 2000)
 */
public final class BrowserAutomationAdapter implements IChartAdapter {

    private static final StructuredLog SLOG = StructuredLog.get(BrowserAutomationAdapter.class);

    private final BrowserSessionPool pool;

    public BrowserAutomationAdapter(BrowserSessionPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public AdapterKind kind() { return AdapterKind.BROWSER_AUTOMATION; }

    @Override
    public List<RawChart> fetch(String identifier, SourceDescriptor d) throws ChartSourceException {
        String id = identifier.trim().toUpperCase(Locale.ROOT);
        String searchSel = d.requireOption("search-selector");
        String resultsSel = d.requireOption("results-selector");
        Duration step = Duration.ofMillis(Long.parseLong(d.option("step-timeout-ms", "30000")));
        Duration settle = Duration.ofMillis(Long.parseLong(d.option("settle-ms", "2000")));
        String url = IdentifierTemplate.expand(d.option("browser-url", "{base}"), id, d);
        StructuredLog log = SLOG.with("source", d.getId()).with("icao", id);

        String html;
        String pageUrl;
        try (BrowserSessionPool.Lease lease = pool.lease()) {
            BrowserSession s = lease.session();
            log.debug("browser-navigate", "url", url);
            s.navigate(url, step);

            var tab = d.option("tab-selector");
            if (tab.isPresent()) s.click(tab.get(), step);

            s.fill(searchSel, id, step);
            String key = d.option("submit-key", "Enter");
            if (!"none".equalsIgnoreCase(key)) s.press(searchSel, key, step);

            if (!s.waitFor(resultsSel, step)) {
                throw new ChartSourceException(ChartFailureKind.NOT_FOUND,
                        "no results for " + id + " on " + d.getDisplayName());
            }
            s.settle(settle);
            html = s.content();
            pageUrl = s.currentUrl();
        }

        return extract(html, pageUrl, id, d);
    }

    /** 렌더링된 HTML → 행별 문서 링크 */
    static List<RawChart> extract(String html, String pageUrl, String id, SourceDescriptor d) {
        Document doc = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        ChartLinkExtractor extractor = new ChartLinkExtractor(
                d.option("row-link-selector", ChartLinkExtractor.DEFAULT_SELECTOR),
                d.option("link-pattern").map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                        .orElse(ChartLinkExtractor.DEFAULT_LINK_PATTERN));
        boolean filter = Boolean.parseBoolean(d.option("filter-identifier", "true"));

        List<RawChart> out = new ArrayList<>();
        for (Element row : doc.select(d.requireOption("results-selector"))) {
            if (filter && !row.text().toUpperCase(Locale.ROOT).contains(id)
                    && !row.html().toUpperCase(Locale.ROOT).contains(id)) {
                continue;
            }
            for (LinkCandidate c : extractor.extract(row)) {
                out.add(RawChart.builder()
                        .title(c.getTitle())
                        .locator(c.getHref())
                        .baseUrl(pageUrl)
                        .build());
            }
        }
        return out;
    }
}

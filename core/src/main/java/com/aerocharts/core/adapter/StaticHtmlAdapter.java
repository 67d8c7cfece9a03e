package com.aerocharts.core.adapter;

import com.aerocharts.core.adapter.version.VersionPointer;
import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.api.IPageFetcher;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.html.LinkCandidate;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.ChartCategory;
import com.aerocharts.core.model.PageResponse;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.util.StructuredLog;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 정적 HTML 소스(FAA, eAIP 계열).
 * 흐름: [버전 해석] → [landing-page에서 공항 링크 찾기] → 공항 페이지 → 문서 링크 추출
 *
 * 추가 options:
 *   landing-page  검색/목록 페이지 템플릿. 있으면 여기서 식별자가 들어간 첫 링크를 공항 페이지로 사용
 */
public final class StaticHtmlAdapter implements IChartAdapter {

    private static final StructuredLog SLOG = StructuredLog.get(StaticHtmlAdapter.class);

    private final HtmlSourcePages pages;

    public StaticHtmlAdapter(IPageFetcher fetcher) {
        this.pages = new HtmlSourcePages(fetcher);
    }

    @Override
    public AdapterKind kind() { return AdapterKind.STATIC_HTML; }

    @Override
    public List<RawChart> fetch(String identifier, SourceDescriptor d) throws ChartSourceException {
        VersionPointer v = pages.versionFor(identifier, d);

        PageResponse page;
        if (d.option("landing-page").isPresent()) {
            page = pages.fetchFirst(List.of(airportLinkFromLanding(identifier, d, v)));
        } else {
            page = pages.fetchFirst(pages.pageUrls("airport-page", "{base}", identifier, d, v));
        }

        Document doc = HtmlSourcePages.parse(page);
        HtmlSourcePages.checkNotFound(doc, identifier, d);
        Element root = HtmlSourcePages.container(doc, d);

        Map<String, ChartCategory> hints = HtmlSourcePages.sectionHints(d);
        String pageUrl = page.getFinalUri().toString();
        List<RawChart> out = new ArrayList<>();
        for (LinkCandidate c : HtmlSourcePages.extractor(d).extract(root)) {
            out.add(HtmlSourcePages.toRaw(c, pageUrl, hints));
        }
        SLOG.with("source", d.getId()).debug("page-parsed",
                "icao", identifier, "url", pageUrl, "links", out.size());
        return out;
    }

    private String airportLinkFromLanding(String identifier, SourceDescriptor d, VersionPointer v)
            throws ChartSourceException {
        PageResponse landing = pages.fetchFirst(pages.pageUrls("landing-page", "{base}", identifier, d, v));
        Document doc = HtmlSourcePages.parse(landing);
        String id = identifier.toUpperCase(Locale.ROOT);
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (href.toUpperCase(Locale.ROOT).contains(id) || a.text().toUpperCase(Locale.ROOT).contains(id)) {
                String abs = a.absUrl("href");
                return abs.isEmpty() ? href : abs;
            }
        }
        throw new ChartSourceException(ChartFailureKind.NOT_FOUND,
                identifier + " is not listed on " + landing.getFinalUri());
    }
}

package com.aerocharts.core.adapter;

import com.aerocharts.core.adapter.version.VersionPointer;
import com.aerocharts.core.adapter.version.VersionResolver;
import com.aerocharts.core.api.IPageFetcher;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.html.ChartLinkExtractor;
import com.aerocharts.core.html.LinkCandidate;
import com.aerocharts.core.model.ChartCategory;
import com.aerocharts.core.model.PageResponse;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * HTML 페이지 기반 어댑터가 함께 쓰는 페이지 도구: 버전 폴더 해석, 공항 페이지 fetch, 링크 추출.
 * 상태 없음(fetcher만 보유). 각 어댑터가 필드로 갖는다.
 *
 * 공통 options:
 *   airport-page    공항 페이지 URL 템플릿. '|'로 여러 개(앞에서부터 시도, 404면 다음)
 *   version-index   있으면 AIRAC 폴더를 먼저 해석({version} 사용 가능)
 *   container       링크를 찾을 영역 CSS 셀렉터. 지정했는데 없으면 PARSE_MISMATCH
 *   not-found-text  페이지에 이 문구가 있으면 NOT_FOUND
 *   link-selector   앵커 셀렉터(기본 a[href])
 *   link-pattern    문서 링크로 인정할 href 정규식(기본 .pdf)
 *   section-hints   "제목 일부=분류코드; ..." 앞 제목이 맞으면 분류 힌트로 사용
 */
final class HtmlSourcePages {

    private final IPageFetcher fetcher;
    private final VersionResolver versions;

    HtmlSourcePages(IPageFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.versions = new VersionResolver(fetcher);
    }

    /** version-index가 있거나 템플릿이 {version}을 쓰면 해석, 아니면 null */
    VersionPointer versionFor(String identifier, SourceDescriptor d) throws ChartSourceException {
        boolean needed = d.option("version-index").isPresent()
                || d.option("airport-page", "").contains("{version");
        return needed ? versions.resolve(identifier, d) : null;
    }

    /** 템플릿 후보를 순서대로 시도. 모두 NOT_FOUND면 마지막 NOT_FOUND를 던진다 */
    PageResponse fetchFirst(List<String> urls) throws ChartSourceException {
        ChartSourceException lastNotFound = null;
        for (String url : urls) {
            try {
                return fetcher.get(URI.create(stripFragment(url)));
            } catch (ChartSourceException e) {
                if (e.kind() != ChartFailureKind.NOT_FOUND) throw e;
                lastNotFound = e;
            }
        }
        if (lastNotFound != null) throw lastNotFound;
        throw new IllegalStateException("no page url");
    }

    List<String> pageUrls(String key, String def, String identifier,
                          SourceDescriptor d, VersionPointer v) {
        List<String> out = new ArrayList<>();
        for (String t : d.option(key, def).split("\\|")) {
            String tt = t.trim();
            if (!tt.isEmpty()) out.add(IdentifierTemplate.expand(tt, identifier, d, v));
        }
        return out;
    }

    static Document parse(PageResponse page) {
        return Jsoup.parse(page.getBody(), page.getFinalUri().toString());
    }

    static void checkNotFound(Document doc, String identifier, SourceDescriptor d) throws ChartSourceException {
        var marker = d.option("not-found-text");
        if (marker.isPresent() && doc.text().toLowerCase(Locale.ROOT)
                .contains(marker.get().toLowerCase(Locale.ROOT))) {
            throw new ChartSourceException(ChartFailureKind.NOT_FOUND,
                    identifier + " is not published by " + d.getDisplayName());
        }
    }

    static Element container(Document doc, SourceDescriptor d) throws ChartSourceException {
        var sel = d.option("container");
        if (sel.isEmpty()) return doc.body() != null ? doc.body() : doc;
        Element c = doc.selectFirst(sel.get());
        if (c == null) {
            throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                    "expected container '" + sel.get() + "' not found on " + doc.location());
        }
        return c;
    }

    static ChartLinkExtractor extractor(SourceDescriptor d) {
        return new ChartLinkExtractor(
                d.option("link-selector", ChartLinkExtractor.DEFAULT_SELECTOR),
                d.option("link-pattern").map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                        .orElse(ChartLinkExtractor.DEFAULT_LINK_PATTERN));
    }

    static RawChart toRaw(LinkCandidate c, String pageUrl, Map<String, ChartCategory> hints) {
        return RawChart.builder()
                .title(c.getTitle())
                .locator(c.getHref())
                .baseUrl(pageUrl)
                .sectionHint(hintFor(c.getHeading(), hints))
                .build();
    }

    /** "Departure Procedure (DP)=SID; Instrument Approach Procedure (IAP)=APP" */
    static Map<String, ChartCategory> sectionHints(SourceDescriptor d) {
        Map<String, ChartCategory> out = new LinkedHashMap<>();
        var raw = d.option("section-hints");
        if (raw.isEmpty()) return out;
        for (String pair : raw.get().split(";")) {
            int eq = pair.lastIndexOf('=');
            if (eq <= 0) continue;
            String key = pair.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            if (!key.isEmpty()) out.put(key, ChartCategory.parse(pair.substring(eq + 1)));
        }
        return out;
    }

    private static ChartCategory hintFor(String heading, Map<String, ChartCategory> hints) {
        if (heading == null || hints.isEmpty()) return null;
        String h = heading.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, ChartCategory> e : hints.entrySet()) {
            if (h.contains(e.getKey())) return e.getValue();
        }
        return null;
    }

    static String stripFragment(String url) {
        int h = url.indexOf('#');
        return h < 0 ? url : url.substring(0, h);
    }
}

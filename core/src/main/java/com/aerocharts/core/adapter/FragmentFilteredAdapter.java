package com.aerocharts.core.adapter;

import com.aerocharts.core.adapter.version.VersionPointer;
import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.api.IPageFetcher;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.html.LinkCandidate;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.ChartCategory;
import com.aerocharts.core.model.PageResponse;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.util.StructuredLog;
import org.jsoup.nodes.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 한 페이지가 모든 공항을 담고 URL fragment로만 구분되는 소스(ENAIRE 등).
 * fragment는 서버로 가지 않으므로 페이지 전체를 받고, 요청한 식별자가 들어간 링크만 남긴다.
 *
 * 추가 options:
 *   match-context  true면 같은 행/컨테이너 텍스트에 식별자가 있어도 통과(기본 false: href/제목만)
 */
public final class FragmentFilteredAdapter implements IChartAdapter {

    private static final StructuredLog SLOG = StructuredLog.get(FragmentFilteredAdapter.class);

    private final HtmlSourcePages pages;

    public FragmentFilteredAdapter(IPageFetcher fetcher) {
        this.pages = new HtmlSourcePages(fetcher);
    }

    @Override
    public AdapterKind kind() { return AdapterKind.FRAGMENT_FILTERED; }

    @Override
    public List<RawChart> fetch(String identifier, SourceDescriptor d) throws ChartSourceException {
        VersionPointer v = pages.versionFor(identifier, d);
        PageResponse page = pages.fetchFirst(pages.pageUrls("airport-page", "{base}", identifier, d, v));

        Document doc = HtmlSourcePages.parse(page);
        HtmlSourcePages.checkNotFound(doc, identifier, d);

        String id = identifier.trim().toUpperCase(Locale.ROOT);
        boolean matchContext = Boolean.parseBoolean(d.option("match-context", "false"));
        Map<String, ChartCategory> hints = HtmlSourcePages.sectionHints(d);
        String pageUrl = page.getFinalUri().toString();

        List<LinkCandidate> all = HtmlSourcePages.extractor(d).extract(HtmlSourcePages.container(doc, d));
        List<RawChart> out = new ArrayList<>();
        for (LinkCandidate c : all) {
            if (belongsTo(c, id, matchContext)) out.add(HtmlSourcePages.toRaw(c, pageUrl, hints));
        }
        SLOG.with("source", d.getId()).debug("fragment-filtered",
                "icao", id, "links", all.size(), "kept", out.size());
        return out;
    }

    static boolean belongsTo(LinkCandidate c, String id, boolean matchContext) {
        if (c.getHref().toUpperCase(Locale.ROOT).contains(id)) return true;
        if (c.getTitle() != null && c.getTitle().toUpperCase(Locale.ROOT).contains(id)) return true;
        return matchContext && c.getContext().toUpperCase(Locale.ROOT).contains(id);
    }
}

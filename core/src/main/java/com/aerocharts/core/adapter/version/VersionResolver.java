package com.aerocharts.core.adapter.version;

import com.aerocharts.core.adapter.IdentifierTemplate;
import com.aerocharts.core.api.IPageFetcher;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.PageResponse;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.util.StructuredLog;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 인덱스 페이지에서 AIRAC 폴더 후보를 모아 날짜가 가장 늦은 것을 고른다.
 * 비교는 항상 날짜 기준(사전순 아님).
 *
 * 후보 출처: 인덱스 URL의 리다이렉트 최종 경로, 링크 href/텍스트, 표 행 텍스트.
 *
 * options:
 *   version-index        인덱스 URL 템플릿(기본 {base})
 *   version-pattern      날짜를 찾는 정규식, 그룹 1 = 날짜(기본 yyyy-M-d(0 채움 선택) 또는 yyyyMMdd)
 *   version-date-formats 쉼표 구분 DateTimeFormatter 패턴(기본 yyyy-M-d,yyyyMMdd)
 */
public final class VersionResolver {

    private static final StructuredLog SLOG = StructuredLog.get(VersionResolver.class);

    public static final String DEFAULT_PATTERN = "(\\d{4}-\\d{1,2}-\\d{1,2}|\\d{8})";
    public static final String DEFAULT_FORMATS = "yyyy-M-d,yyyyMMdd";

    private final IPageFetcher fetcher;

    public VersionResolver(IPageFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    public VersionPointer resolve(String identifier, SourceDescriptor d) throws ChartSourceException {
        String index = IdentifierTemplate.expand(d.option("version-index", "{base}"), identifier, d);
        PageResponse page;
        try {
            page = fetcher.get(URI.create(index));
        } catch (ChartSourceException e) {
            if (e.kind() == ChartFailureKind.NOT_FOUND || e.kind() == ChartFailureKind.PARSE_MISMATCH) {
                throw new ChartSourceException(ChartFailureKind.VERSION_UNRESOLVED,
                        "version index unavailable: " + index, e);
            }
            throw e;
        }

        List<String> candidates = collectCandidates(page);
        VersionPointer v = select(candidates, pattern(d), formatters(d));
        SLOG.with("source", d.getId()).info("version-selected",
                "tag", v.getTag(), "date", v.getDate().toString(), "candidates", candidates.size());
        return v;
    }

    /** 기본 패턴/포맷으로 선택 */
    public static VersionPointer select(List<String> candidates) throws ChartSourceException {
        return select(candidates, Pattern.compile(DEFAULT_PATTERN), parseFormats(DEFAULT_FORMATS));
    }

    /** 날짜가 가장 늦은 후보. 같은 날짜면 먼저 나온 것. 파싱 가능한 후보가 없으면 VERSION_UNRESOLVED */
    public static VersionPointer select(List<String> candidates, Pattern pattern,
                                       List<DateTimeFormatter> formats) throws ChartSourceException {
        VersionPointer best = null;
        for (String c : candidates) {
            if (c == null) continue;
            Matcher m = pattern.matcher(c);
            while (m.find()) {
                String text = m.groupCount() >= 1 && m.group(1) != null ? m.group(1) : m.group();
                LocalDate date = parse(text, formats);
                if (date == null) continue;
                if (best == null || date.isAfter(best.getDate())) {
                    best = new VersionPointer(c.trim(), text, date);
                }
                break;
            }
        }
        if (best == null) {
            throw new ChartSourceException(ChartFailureKind.VERSION_UNRESOLVED,
                    "no dated publication folder among " + candidates.size() + " candidate(s)");
        }
        return best;
    }

    // ------------ candidates ------------

    static List<String> collectCandidates(PageResponse page) {
        List<String> out = new ArrayList<>();
        URI finalUri = page.getFinalUri();
        if (finalUri != null && !finalUri.equals(page.getRequestUri()) && finalUri.getPath() != null) {
            addSegments(out, finalUri.getPath());
        }

        Document doc = Jsoup.parse(page.getBody(), page.getFinalUri().toString());
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            int q = href.indexOf('?');
            addSegments(out, q >= 0 ? href.substring(0, q) : href);
            String text = a.text().trim();
            if (!text.isEmpty()) out.add(text);
        }
        for (Element tr : doc.select("tr")) {
            String text = tr.text().trim();
            if (!text.isEmpty()) out.add(text);
        }
        for (Element opt : doc.select("option[value]")) {
            out.add(opt.attr("value"));
        }
        return out;
    }

    private static void addSegments(List<String> out, String path) {
        for (String seg : path.split("/")) {
            if (!seg.isBlank()) out.add(seg);
        }
    }

    // ------------ parsing ------------

    private static LocalDate parse(String text, List<DateTimeFormatter> formats) {
        for (DateTimeFormatter f : formats) {
            try {
                return LocalDate.parse(text, f);
            } catch (DateTimeParseException ignore) {
                // 다음 포맷 시도
            }
        }
        return null;
    }

    private static Pattern pattern(SourceDescriptor d) {
        return Pattern.compile(d.option("version-pattern", DEFAULT_PATTERN));
    }

    private static List<DateTimeFormatter> formatters(SourceDescriptor d) {
        return parseFormats(d.option("version-date-formats", DEFAULT_FORMATS));
    }

    /** yyyy는 STRICT 해석을 위해 uuuu로 바꾼다 */
    static List<DateTimeFormatter> parseFormats(String csv) {
        List<DateTimeFormatter> out = new ArrayList<>();
        for (String p : csv.split(",")) {
            String v = p.trim();
            if (v.isEmpty()) continue;
            out.add(DateTimeFormatter.ofPattern(v.replace("yyyy", "uuuu")).withResolverStyle(ResolverStyle.STRICT));
        }
        return out;
    }
}

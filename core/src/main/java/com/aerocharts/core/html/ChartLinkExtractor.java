package com.aerocharts.core.html;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * jsoup 기반 차트 링크 추출기: linkSelector로 앵커를 고르고 linkPattern에 맞는 href만 수집.
 *
 * 제목 결정 순서:
 * 링크 텍스트 → img alt → title 속성 → 같은 행(tr)의 다른 셀 → 부모 컨테이너(li/div/td/p) →
 * 가장 가까운 앞 제목(h1~h6) → 파일명
 * "PDF", "Download" 같은 일반 라벨은 제목으로 쓰지 않는다.
 */
public final class ChartLinkExtractor {

    public static final String DEFAULT_SELECTOR = "a[href]";
    public static final Pattern DEFAULT_LINK_PATTERN = Pattern.compile("(?i)\\.pdf([?#].*)?$");

    private static final Set<String> GENERIC_LABELS = Set.of(
            "pdf", "[pdf]", "(pdf)", "download", "descargar", "descarga", "ver", "view", "open",
            "link", "here", "click here", "baixar", "telecharger", "télécharger", "abrir");
    private static final String HEADINGS = "h1,h2,h3,h4,h5,h6";
    private static final int MAX_CONTEXT = 300;

    private final String linkSelector;
    private final Pattern linkPattern;

    public ChartLinkExtractor() {
        this(DEFAULT_SELECTOR, DEFAULT_LINK_PATTERN);
    }

    public ChartLinkExtractor(String linkSelector, Pattern linkPattern) {
        this.linkSelector = Objects.requireNonNull(linkSelector, "linkSelector");
        this.linkPattern = Objects.requireNonNull(linkPattern, "linkPattern");
    }

    /** 문서 순서대로 반환(중복 제거 안 함) */
    public List<LinkCandidate> extract(Element root) {
        List<LinkCandidate> out = new ArrayList<>();
        for (Element a : root.select(linkSelector)) {
            String href = a.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#")) continue;
            String lower = href.toLowerCase(Locale.ROOT);
            if (lower.startsWith("javascript:") || lower.startsWith("mailto:")) continue;
            if (!linkPattern.matcher(href).find()) continue;

            String heading = nearestHeading(a);
            String context = contextText(a);
            out.add(new LinkCandidate(href, titleFor(a, href, heading), context, heading));
        }
        return out;
    }

    public List<LinkCandidate> extract(Document doc) {
        return extract(doc.body() != null ? doc.body() : doc);
    }

    // ------------ title ------------

    static String titleFor(Element a, String href, String heading) {
        String t = usable(a.text());
        if (t != null) return t;

        Element img = a.selectFirst("img[alt]");
        if (img != null && (t = usable(img.attr("alt"))) != null) return t;

        if ((t = usable(a.attr("title"))) != null) return t;

        Element tr = a.closest("tr");
        if (tr != null) {
            for (Element cell : tr.children()) {
                if (!cell.is("td, th") || cell.select("a[href]").contains(a)) continue;
                if ((t = usable(cell.text())) != null) return t;
            }
        }

        Element container = a.parent();
        if (container != null && container.is("li, div, td, p, span, dd")) {
            if ((t = usable(container.ownText())) != null) return t;
        }

        if (heading != null && (t = usable(heading)) != null) return t;

        return filename(href);
    }

    private static String usable(String s) {
        if (s == null) return null;
        String v = s.replace('\u00A0', ' ').trim().replaceAll("\\s+", " ");
        if (v.isEmpty()) return null;
        if (GENERIC_LABELS.contains(v.toLowerCase(Locale.ROOT))) return null;
        return v;
    }

    /** 마지막 경로 세그먼트(디코드, 확장자 제거) */
    public static String filename(String href) {
        String s = href;
        int cut = indexOfAny(s, '?', '#');
        if (cut >= 0) s = s.substring(0, cut);
        int slash = s.lastIndexOf('/');
        if (slash >= 0) s = s.substring(slash + 1);
        try {
            s = URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ignore) {
            // 깨진 %XX는 원문 유지
        }
        int dot = s.lastIndexOf('.');
        if (dot > 0) s = s.substring(0, dot);
        s = s.replace('_', ' ').trim();
        return s.isEmpty() ? href : s;
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a), j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }

    // ------------ structure ------------

    /** 같은 행 또는 가장 가까운 블록 컨테이너 텍스트 */
    static String contextText(Element a) {
        Element box = a.closest("tr");
        if (box == null) box = a.closest("li, dd, p, div, td");
        String s = box == null ? a.text() : box.text();
        return s.length() > MAX_CONTEXT ? s.substring(0, MAX_CONTEXT) : s;
    }

    /** 문서 순서상 링크 앞에 있는 가장 가까운 h1~h6 텍스트. 없으면 null */
    static String nearestHeading(Element a) {
        for (Element cur = a; cur != null; cur = cur.parent()) {
            for (Element sib = cur.previousElementSibling(); sib != null; sib = sib.previousElementSibling()) {
                if (sib.is(HEADINGS)) return sib.text();
                Elements nested = sib.select(HEADINGS);
                if (!nested.isEmpty()) return nested.last().text();
            }
        }
        return null;
    }
}

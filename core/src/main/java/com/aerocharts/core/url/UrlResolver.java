package com.aerocharts.core.url;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 로케이터(상대/절대) + 기준 페이지 → 절대 URL.
 *
 * 규칙:
 * - 절대 로케이터는 join 생략, 상대 로케이터는 표준 상대 URL 규칙으로 join
 * - 마지막 경로 세그먼트만 퍼센트 인코딩(기존 %XX 유지 → 멱등)
 * - 스킴/호스트(대소문자 포함)와 '/' 보존, 쿼리·프래그먼트는 손대지 않음
 * 상태 없음. 중복 제거는 {@link UrlResolutionScope} 담당.
 */
public final class UrlResolver {

    private static final Pattern ABSOLUTE = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:.*");
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    public String resolve(String locator, String pageUrl) {
        Objects.requireNonNull(locator, "locator");
        String loc = locator.trim().replace('\\', '/');
        if (loc.isEmpty()) throw new IllegalArgumentException("locator is blank");

        String joined;
        if (isAbsolute(loc)) {
            joined = loc;
        } else {
            if (pageUrl == null || pageUrl.isBlank()) {
                throw new IllegalArgumentException("relative locator without base url: " + locator);
            }
            joined = join(loc, pageUrl.trim());
        }
        return encodeLastSegment(joined);
    }

    /** 새 해석 스코프(해석 1회당 1개) */
    public UrlResolutionScope newScope() {
        return new UrlResolutionScope(this);
    }

    static boolean isAbsolute(String s) {
        return s.startsWith("//") ? false : ABSOLUTE.matcher(s).matches();
    }

    // ------------ join ------------

    private static String join(String loc, String pageUrl) {
        Parts base = Parts.split(pageUrl);
        Parts rel = Parts.split(loc);

        URI baseUri = URI.create(encodePath(base.path));
        // "https://host" + "a.pdf" 가 "https://hosta.pdf"가 되는 문제 방지
        if (baseUri.getRawAuthority() != null && (baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty())) {
            baseUri = URI.create(baseUri + "/");
        }

        String path;
        String query;
        if (rel.path.isEmpty()) {
            // "?x=1" 또는 "#frag" 형태: 기준 경로 유지
            path = baseUri.toString();
            query = rel.query != null ? rel.query : base.query;
        } else {
            path = baseUri.resolve(encodePath(rel.path)).toString();
            query = rel.query;
        }
        StringBuilder sb = new StringBuilder(path);
        if (query != null) sb.append('?').append(query);
        if (rel.fragment != null) sb.append('#').append(rel.fragment);
        return sb.toString();
    }

    // ------------ encoding ------------

    private static String encodeLastSegment(String url) {
        Parts p = Parts.split(url);
        String head = p.path;
        int authorityEnd = authorityEnd(head);
        int slash = head.lastIndexOf('/');
        String out;
        if (slash < authorityEnd) {
            // 경로 없음(https://host)
            out = head;
        } else {
            String prefix = head.substring(0, slash + 1);
            String last = head.substring(slash + 1);
            out = encodePath(prefix) + encodeSegment(last);
        }
        StringBuilder sb = new StringBuilder(out);
        if (p.query != null) sb.append('?').append(p.query);
        if (p.fragment != null) sb.append('#').append(p.fragment);
        return sb.toString();
    }

    /** "scheme://authority" 끝 인덱스. 스킴이 없으면 0 */
    private static int authorityEnd(String s) {
        int i = s.indexOf("://");
        if (i < 0) return 0;
        int slash = s.indexOf('/', i + 3);
        return slash < 0 ? s.length() : slash;
    }

    /**
     * 경로 전체를 URI에 넣을 수 있게 최소 인코딩('/'는 보존).
     * 중간 세그먼트의 공백처럼 URI 파싱이 불가능한 문자만 바뀐다.
     */
    private static String encodePath(String path) {
        StringBuilder sb = new StringBuilder(path.length() + 16);
        int start = 0;
        int schemeEnd = path.indexOf("://");
        if (schemeEnd >= 0) {
            int a = authorityEnd(path);
            sb.append(path, 0, a);
            start = a;
        }
        String rest = path.substring(start);
        String[] segs = rest.split("/", -1);
        for (int i = 0; i < segs.length; i++) {
            if (i > 0) sb.append('/');
            sb.append(encodeSegment(segs[i]));
        }
        return sb.toString();
    }

    /** 세그먼트 인코딩: unreserved, sub-delims, ':', '@' 와 기존 %XX 는 그대로 */
    static String encodeSegment(String seg) {
        StringBuilder sb = new StringBuilder(seg.length() + 16);
        byte[] bytes = seg.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            if (b == '%' && i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2])) {
                sb.append('%').append((char) bytes[i + 1]).append((char) bytes[i + 2]);
                i += 2;
            } else if (isAllowed(b)) {
                sb.append((char) b);
            } else {
                sb.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
            }
        }
        return sb.toString();
    }

    private static boolean isAllowed(int c) {
        if (c >= 'a' && c <= 'z') return true;
        if (c >= 'A' && c <= 'Z') return true;
        if (c >= '0' && c <= '9') return true;
        switch (c) {
            case '-': case '.': case '_': case '~':
            case '!': case '$': case '&': case '\'': case '(': case ')':
            case '*': case '+': case ',': case ';': case '=':
            case ':': case '@':
                return true;
            default:
                return false;
        }
    }

    private static boolean isHex(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    /** path / query / fragment 분리(원문 그대로) */
    private static final class Parts {
        final String path;
        final String query;
        final String fragment;

        private Parts(String path, String query, String fragment) {
            this.path = path;
            this.query = query;
            this.fragment = fragment;
        }

        static Parts split(String s) {
            String fragment = null;
            int h = s.indexOf('#');
            if (h >= 0) {
                fragment = s.substring(h + 1);
                s = s.substring(0, h);
            }
            String query = null;
            int q = s.indexOf('?');
            if (q >= 0) {
                query = s.substring(q + 1);
                s = s.substring(0, q);
            }
            return new Parts(s, query, fragment);
        }
    }
}

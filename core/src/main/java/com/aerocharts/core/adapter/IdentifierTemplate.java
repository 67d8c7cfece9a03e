package com.aerocharts.core.adapter;

import com.aerocharts.core.adapter.version.VersionPointer;
import com.aerocharts.core.model.SourceDescriptor;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * URL 템플릿 치환.
 * {base} baseEndpoint, {icao} 대문자 식별자, {icao_lower}, {icao3} K로 시작하는 4글자면 K 제거(FAA 3레터),
 * {version} 선택된 폴더 태그, {version_date} 폴더에서 찾은 날짜 문자열
 */
public final class IdentifierTemplate {

    private IdentifierTemplate() {}

    public static String expand(String template, String identifier, SourceDescriptor d, VersionPointer version) {
        String icao = identifier.trim().toUpperCase(Locale.ROOT);
        String base = d.getBaseEndpoint() == null ? "" : d.getBaseEndpoint();
        String out = template
                .replace("{base}", base)
                .replace("{icao_lower}", encode(icao.toLowerCase(Locale.ROOT)))
                .replace("{icao3}", encode(faaCode(icao)))
                .replace("{icao}", encode(icao));
        if (version != null) {
            out = out.replace("{version_date}", version.getDateText())
                    .replace("{version}", version.getTag());
        } else if (out.contains("{version")) {
            throw new IllegalStateException("template needs a version but source '" + d.getId()
                    + "' has no version discovery: " + template);
        }
        return out;
    }

    public static String expand(String template, String identifier, SourceDescriptor d) {
        return expand(template, identifier, d, null);
    }

    /** KJFK → JFK. 그 외는 그대로 */
    static String faaCode(String icao) {
        return (icao.length() == 4 && icao.startsWith("K")) ? icao.substring(1) : icao;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}

package com.aerocharts.core.registry;

import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.model.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 식별자 접두사 → 소스 라우팅 테이블. 생성 후 불변, 순수 조회.
 *
 * 가장 긴 접두사가 이긴다: 3글자 오버라이드(UTD) > 2글자 국가(UT) > 1글자 지역(K).
 * 같은 접두사를 두 소스가 주장하면 생성 시 거부.
 * 제외 접두사(excludedPrefixes)는 더 짧은 접두사로 내려가지 않고 미지원 처리.
 */
public final class SourceRegistry {

    private final Map<String, SourceDescriptor> byPrefix;
    private final Map<String, SourceDescriptor> byId;
    private final Set<String> blocked;
    private final int longestPrefix;

    public SourceRegistry(List<SourceDescriptor> sources) {
        Map<String, SourceDescriptor> prefixes = new LinkedHashMap<>();
        Map<String, SourceDescriptor> ids = new LinkedHashMap<>();
        Set<String> excluded = new HashSet<>();
        int longest = 0;
        for (SourceDescriptor d : sources) {
            if (ids.putIfAbsent(d.getId(), d) != null) {
                throw new IllegalArgumentException("duplicate source id: " + d.getId());
            }
            for (String p : d.getIdentifierPrefixes()) {
                SourceDescriptor prev = prefixes.putIfAbsent(p, d);
                if (prev != null) {
                    throw new IllegalArgumentException("prefix '" + p + "' is claimed by both '"
                            + prev.getId() + "' and '" + d.getId() + "'");
                }
                longest = Math.max(longest, p.length());
            }
            for (String p : d.getExcludedPrefixes()) {
                excluded.add(p);
                longest = Math.max(longest, p.length());
            }
        }
        this.byPrefix = Collections.unmodifiableMap(prefixes);
        this.byId = Collections.unmodifiableMap(ids);
        this.blocked = Set.copyOf(excluded);
        this.longestPrefix = longest;
    }

    /** 가장 긴 접두사 매칭. 없으면 UNKNOWN_SOURCE */
    public SourceDescriptor resolve(String identifier) throws ChartSourceException {
        String id = normalize(identifier);
        if (id.isEmpty()) {
            throw new ChartSourceException(ChartFailureKind.UNKNOWN_SOURCE,
                    "identifier is blank", null, identifier, null);
        }
        for (int len = Math.min(longestPrefix, id.length()); len >= 1; len--) {
            String p = id.substring(0, len);
            SourceDescriptor d = byPrefix.get(p);
            if (d != null) return d;
            if (blocked.contains(p)) break;
        }
        throw new ChartSourceException(ChartFailureKind.UNKNOWN_SOURCE,
                "no chart source configured for " + id, null, id, null);
    }

    /** 소스 ID 지정(수동 오버라이드). 없으면 UNKNOWN_SOURCE */
    public SourceDescriptor byId(String sourceId) throws ChartSourceException {
        SourceDescriptor d = sourceId == null ? null : byId.get(sourceId.trim().toLowerCase(Locale.ROOT));
        if (d == null) {
            throw new ChartSourceException(ChartFailureKind.UNKNOWN_SOURCE,
                    "unknown source id: " + sourceId, sourceId, null, null);
        }
        return d;
    }

    public Optional<SourceDescriptor> find(String sourceId) {
        return Optional.ofNullable(sourceId == null ? null : byId.get(sourceId.trim().toLowerCase(Locale.ROOT)));
    }

    /** 설정된 모든 접두사(정렬) */
    public List<String> prefixes() {
        return List.copyOf(new TreeSet<>(byPrefix.keySet()));
    }

    public List<SourceInfo> sources() {
        List<SourceInfo> out = new ArrayList<>(byId.size());
        for (SourceDescriptor d : byId.values()) out.add(d.toInfo());
        return Collections.unmodifiableList(out);
    }

    public List<SourceDescriptor> descriptors() {
        return List.copyOf(byId.values());
    }

    public static String normalize(String identifier) {
        return identifier == null ? "" : identifier.trim().toUpperCase(Locale.ROOT);
    }
}

package com.aerocharts.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 소스(발행 기관) 1개의 설정. 시작 시 한 번 로드되고 이후 읽기 전용.
 * options: 어댑터별 문자열 설정(페이지 템플릿, 셀렉터, 버전 탐색 등)
 */
public final class SourceDescriptor {
    private final String id;
    private final String displayName;
    private final List<String> identifierPrefixes;
    private final List<String> excludedPrefixes;
    private final AdapterKind adapterKind;
    private final String baseEndpoint;
    private final TimeoutClass timeoutClass;
    private final Map<String, String> options;

    private SourceDescriptor(Builder b) {
        this.id = b.id;
        this.displayName = (b.displayName == null || b.displayName.isBlank()) ? b.id : b.displayName;
        this.identifierPrefixes = List.copyOf(b.prefixes);
        this.excludedPrefixes = List.copyOf(b.excluded);
        this.adapterKind = b.adapterKind;
        this.baseEndpoint = b.baseEndpoint;
        this.timeoutClass = b.timeoutClass;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(b.options));
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public List<String> getIdentifierPrefixes() { return identifierPrefixes; }
    /** 짧은 접두사의 예외(예: U 전체 중 UA/UT 제외). 다른 소스가 가져가지 않으면 미지원 */
    public List<String> getExcludedPrefixes() { return excludedPrefixes; }
    public AdapterKind getAdapterKind() { return adapterKind; }
    public String getBaseEndpoint() { return baseEndpoint; }
    public TimeoutClass getTimeoutClass() { return timeoutClass; }
    public Map<String, String> getOptions() { return options; }

    /** OfflineDatabase일 때만 true */
    public boolean isOffline() { return adapterKind == AdapterKind.OFFLINE_DATABASE; }

    public Optional<String> option(String key) {
        String v = options.get(key);
        return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v);
    }

    public String option(String key, String def) {
        return option(key).orElse(def);
    }

    /** 필수 옵션. 없으면 IllegalStateException(설정 오류) */
    public String requireOption(String key) {
        return option(key).orElseThrow(() ->
                new IllegalStateException("source '" + id + "' is missing option '" + key + "'"));
    }

    public SourceInfo toInfo() {
        return new SourceInfo(id, displayName, identifierPrefixes, adapterKind, isOffline());
    }

    @Override
    public String toString() {
        return "SourceDescriptor{" + id + ", " + adapterKind + ", prefixes=" + identifierPrefixes + '}';
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private String displayName;
        private final List<String> prefixes = new ArrayList<>();
        private final List<String> excluded = new ArrayList<>();
        private AdapterKind adapterKind;
        private String baseEndpoint;
        private TimeoutClass timeoutClass;
        private final Map<String, String> options = new LinkedHashMap<>();

        public Builder id(String id) { this.id = id; return this; }
        public Builder displayName(String name) { this.displayName = name; return this; }
        public Builder prefix(String p) { this.prefixes.add(p); return this; }
        public Builder prefixes(List<String> ps) { this.prefixes.addAll(ps); return this; }
        public Builder excludedPrefixes(List<String> ps) { this.excluded.addAll(ps); return this; }
        public Builder adapterKind(AdapterKind k) { this.adapterKind = k; return this; }
        public Builder baseEndpoint(String url) { this.baseEndpoint = url; return this; }
        public Builder timeoutClass(TimeoutClass t) { this.timeoutClass = t; return this; }
        public Builder option(String k, String v) { this.options.put(k, v); return this; }
        public Builder options(Map<String, String> m) { this.options.putAll(m); return this; }

        public SourceDescriptor build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(adapterKind, "adapterKind");
            if (id.isBlank()) throw new IllegalArgumentException("source id is blank");
            id = id.trim().toLowerCase(Locale.ROOT);
            if (prefixes.isEmpty()) {
                throw new IllegalArgumentException("source '" + id + "' has no identifier prefixes");
            }
            normalizePrefixes(prefixes);
            normalizePrefixes(excluded);

            if (timeoutClass == null) {
                timeoutClass = (adapterKind == AdapterKind.BROWSER_AUTOMATION) ? TimeoutClass.SLOW
                        : (adapterKind == AdapterKind.OFFLINE_DATABASE) ? TimeoutClass.FAST
                        : TimeoutClass.MODERATE;
            }
            if (adapterKind == AdapterKind.BROWSER_AUTOMATION && timeoutClass != TimeoutClass.SLOW) {
                throw new IllegalArgumentException("browser automation source '" + id + "' must use timeout class SLOW");
            }
            if (adapterKind != AdapterKind.OFFLINE_DATABASE && (baseEndpoint == null || baseEndpoint.isBlank())) {
                throw new IllegalArgumentException("source '" + id + "' requires baseEndpoint");
            }
            return new SourceDescriptor(this);
        }

        private void normalizePrefixes(List<String> list) {
            List<String> norm = new ArrayList<>(list.size());
            for (String p : list) {
                String v = p == null ? "" : p.trim().toUpperCase(Locale.ROOT);
                if (v.isEmpty()) throw new IllegalArgumentException("source '" + id + "' has a blank prefix");
                if (!norm.contains(v)) norm.add(v);
            }
            list.clear();
            list.addAll(norm);
        }
    }
}

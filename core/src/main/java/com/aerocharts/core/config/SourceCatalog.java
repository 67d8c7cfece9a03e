package com.aerocharts.core.config;

import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.registry.SourceRegistry;

import java.util.List;
import java.util.Objects;

/** 로드된 카탈로그: 엔진 설정 + 소스 목록 */
public final class SourceCatalog {
    private final ResolverConfig config;
    private final List<SourceDescriptor> sources;

    public SourceCatalog(ResolverConfig config, List<SourceDescriptor> sources) {
        this.config = Objects.requireNonNull(config, "config");
        this.sources = List.copyOf(sources);
    }

    public ResolverConfig getConfig() { return config; }
    public List<SourceDescriptor> getSources() { return sources; }

    /** 접두사 충돌이 있으면 IllegalArgumentException */
    public SourceRegistry registry() {
        return new SourceRegistry(sources);
    }
}

package com.aerocharts.core.model;

import java.util.List;

/** 소스 목록 조회용 요약 */
public final class SourceInfo {
    private final String sourceId;
    private final String name;
    private final List<String> prefixes;
    private final AdapterKind adapterKind;
    private final boolean offline;

    public SourceInfo(String sourceId, String name, List<String> prefixes, AdapterKind adapterKind, boolean offline) {
        this.sourceId = sourceId;
        this.name = name;
        this.prefixes = List.copyOf(prefixes);
        this.adapterKind = adapterKind;
        this.offline = offline;
    }

    public String getSourceId() { return sourceId; }
    public String getName() { return name; }
    public List<String> getPrefixes() { return prefixes; }
    public AdapterKind getAdapterKind() { return adapterKind; }
    public boolean isOffline() { return offline; }
}

package com.aerocharts.core.adapter;

import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.api.IPageFetcher;
import com.aerocharts.core.browser.BrowserSessionPool;
import com.aerocharts.core.config.ResolverConfig;
import com.aerocharts.core.model.AdapterKind;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 어댑터 종류별 구현체 1개씩(공유, 읽기 전용 상태만 가짐) */
public final class AdapterFactory {

    private AdapterFactory() {}

    public static Map<AdapterKind, IChartAdapter> create(ResolverConfig config, IPageFetcher fetcher,
                                                         ObjectMapper mapper, BrowserSessionPool browsers) {
        Map<AdapterKind, IChartAdapter> m = new EnumMap<>(AdapterKind.class);
        m.put(AdapterKind.STATIC_HTML, new StaticHtmlAdapter(fetcher));
        m.put(AdapterKind.FRAGMENT_FILTERED, new FragmentFilteredAdapter(fetcher));
        m.put(AdapterKind.JSON_API, new JsonApiAdapter(fetcher, mapper));
        m.put(AdapterKind.OFFLINE_DATABASE, new OfflineDatabaseAdapter(mapper, config.getDataDir()));
        m.put(AdapterKind.BROWSER_AUTOMATION, new BrowserAutomationAdapter(browsers));
        return Collections.unmodifiableMap(m);
    }
}

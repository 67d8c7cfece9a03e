package com.aerocharts.core.api;

import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.PageResponse;

import java.net.URI;
import java.util.Map;

/**
 * 페이지 GET. 2xx만 반환하고 나머지는 실패 종류로 변환해 던진다.
 * 401/403 → ACCESS_RESTRICTED, 404/410 → NOT_FOUND, 429/5xx/네트워크 → UPSTREAM_UNAVAILABLE
 */
public interface IPageFetcher {

    default PageResponse get(URI uri) throws ChartSourceException {
        return get(uri, Map.of());
    }

    PageResponse get(URI uri, Map<String, String> headers) throws ChartSourceException;
}

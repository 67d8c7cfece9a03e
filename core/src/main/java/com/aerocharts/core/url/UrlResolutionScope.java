package com.aerocharts.core.url;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 해석 1회 동안 발행한 URL을 추적. 같은 URL은 한 번만 통과시킨다.
 * 스레드 안전하지 않음(해석 1회 = 단일 스레드).
 */
public final class UrlResolutionScope {
    private final UrlResolver resolver;
    private final Set<String> emitted = new LinkedHashSet<>();

    UrlResolutionScope(UrlResolver resolver) {
        this.resolver = resolver;
    }

    /** 새 URL이면 절대 URL, 이미 나온 URL이면 empty */
    public Optional<String> resolveNew(String locator, String pageUrl) {
        String url = resolver.resolve(locator, pageUrl);
        return emitted.add(url) ? Optional.of(url) : Optional.empty();
    }

    public int size() { return emitted.size(); }
}

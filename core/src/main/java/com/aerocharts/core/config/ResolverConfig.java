package com.aerocharts.core.config;

import com.aerocharts.core.model.TimeoutClass;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 엔진 설정(sources.yml의 `resolver:` 섹션 매핑 대상). 순수 설정 보관용.
 * 시스템 프로퍼티 오버라이드는 {@link #applySystemOverrides()}.
 */
public final class ResolverConfig {

    /** 브라우저 자동화 하위 설정: YAML `resolver.browser:` */
    public static final class BrowserCfg {
        /** 동시에 열 수 있는 브라우저 세션 수 */
        private int poolSize = 2;
        private boolean headless = true;
        /** 세션 획득 대기 상한(밀리초). 넘으면 BackendTimeout */
        private int acquireTimeoutMs = 60_000;

        public int getPoolSize() { return poolSize; }
        public BrowserCfg setPoolSize(int v) { this.poolSize = v; return this; }

        public boolean isHeadless() { return headless; }
        public BrowserCfg setHeadless(boolean v) { this.headless = v; return this; }

        public int getAcquireTimeoutMs() { return acquireTimeoutMs; }
        public BrowserCfg setAcquireTimeoutMs(int v) { this.acquireTimeoutMs = v; return this; }
    }

    // ---------- 타임아웃 등급 ----------
    private Duration fastTimeout = Duration.ofSeconds(10);
    private Duration moderateTimeout = Duration.ofSeconds(30);
    private Duration slowTimeout = Duration.ofSeconds(120);

    // ---------- HTTP ----------
    private Duration connectTimeout = Duration.ofSeconds(10);
    private boolean followRedirects = true;
    private String userAgent = "Mozilla/5.0 (compatible; AeroCharts/0.3; +https://aerocharts.example)";

    // ---------- 실행 ----------
    /** 어댑터 워커 스레드 수(동시 해석 상한) */
    private int concurrency = 4;

    /** 오프라인 DB 상대 경로의 기준 디렉터리 */
    private Path dataDir = Path.of("data");

    private final BrowserCfg browser = new BrowserCfg();

    public static ResolverConfig defaults() {
        return new ResolverConfig();
    }

    // ---------- getters ----------
    public Duration timeoutFor(TimeoutClass c) {
        switch (Objects.requireNonNull(c, "timeoutClass")) {
            case FAST: return fastTimeout;
            case SLOW: return slowTimeout;
            case MODERATE:
            default:   return moderateTimeout;
        }
    }

    public Duration getFastTimeout() { return fastTimeout; }
    public Duration getModerateTimeout() { return moderateTimeout; }
    public Duration getSlowTimeout() { return slowTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public int getConcurrency() { return concurrency; }
    public Path getDataDir() { return dataDir; }
    public BrowserCfg browser() { return browser; }

    // ---------- fluent setters ----------
    public ResolverConfig setFastTimeout(Duration d) { this.fastTimeout = d; return this; }
    public ResolverConfig setModerateTimeout(Duration d) { this.moderateTimeout = d; return this; }
    public ResolverConfig setSlowTimeout(Duration d) { this.slowTimeout = d; return this; }
    public ResolverConfig setConnectTimeout(Duration d) { this.connectTimeout = d; return this; }
    public ResolverConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ResolverConfig setUserAgent(String v) { this.userAgent = v; return this; }
    public ResolverConfig setConcurrency(int v) { this.concurrency = v; return this; }
    public ResolverConfig setDataDir(Path v) { this.dataDir = v; return this; }

    /** -Dac.timeout.fastMs / moderateMs / slowMs, -Dac.concurrency, -Dac.browser.headless */
    public ResolverConfig applySystemOverrides() {
        fastTimeout = sysMs("ac.timeout.fastMs", fastTimeout);
        moderateTimeout = sysMs("ac.timeout.moderateMs", moderateTimeout);
        slowTimeout = sysMs("ac.timeout.slowMs", slowTimeout);
        concurrency = sysInt("ac.concurrency", concurrency);
        String headless = System.getProperty("ac.browser.headless");
        if (headless != null && !headless.isBlank()) browser.setHeadless(Boolean.parseBoolean(headless.trim()));
        String dir = System.getProperty("ac.dataDir");
        if (dir != null && !dir.isBlank()) dataDir = Path.of(dir.trim());
        return this;
    }

    /** 필수값/범위 검증. 위반 시 IllegalArgumentException */
    public void validate() {
        requirePositive(fastTimeout, "fastTimeout");
        requirePositive(moderateTimeout, "moderateTimeout");
        requirePositive(slowTimeout, "slowTimeout");
        requirePositive(connectTimeout, "connectTimeout");
        if (fastTimeout.compareTo(moderateTimeout) > 0 || moderateTimeout.compareTo(slowTimeout) > 0) {
            throw new IllegalArgumentException("timeouts must satisfy fast <= moderate <= slow");
        }
        if (concurrency < 1 || concurrency > 64) {
            throw new IllegalArgumentException("concurrency must be 1..64 (was " + concurrency + ")");
        }
        if (browser.getPoolSize() < 1) {
            throw new IllegalArgumentException("browser.poolSize must be >= 1");
        }
        if (browser.getAcquireTimeoutMs() < 0) {
            throw new IllegalArgumentException("browser.acquireTimeoutMs must be >= 0");
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent is blank");
        }
        Objects.requireNonNull(dataDir, "dataDir");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    private static Duration sysMs(String key, Duration def) {
        int v = sysInt(key, -1);
        return v > 0 ? Duration.ofMillis(v) : def;
    }

    private static int sysInt(String key, int def) {
        try {
            String v = System.getProperty(key);
            return (v == null || v.isBlank()) ? def : Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}

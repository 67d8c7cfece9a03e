package com.aerocharts.core.http;

import com.aerocharts.core.api.IPageFetcher;
import com.aerocharts.core.config.ResolverConfig;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.PageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Map;
import java.util.Objects;

/** java.net.http 기반 페이지 fetcher. 요청 타임아웃은 slow 등급(상한은 오케스트레이터가 강제) */
public class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final ResolverConfig config;
    private final HttpSender sender;

    public HttpPageFetcher(ResolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getConnectTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(ResolverConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public PageResponse get(URI uri, Map<String, String> headers) throws ChartSourceException {
        Objects.requireNonNull(uri, "uri");
        long start = System.nanoTime();
        HttpRequest.Builder rb = HttpRequest.newBuilder(uri)
                .timeout(config.getSlowTimeout())
                .header("User-Agent", config.getUserAgent())
                .GET();
        headers.forEach(rb::header);

        HttpResponse<String> resp;
        try {
            resp = sender.send(rb.build());
        } catch (HttpTimeoutException e) {
            throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT, "request timed out: " + uri, e);
        } catch (IOException e) {
            throw new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE,
                    "request failed: " + uri + " (" + e + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT, "interrupted while fetching " + uri, e);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        int status = resp.statusCode();
        LOG.debug("GET {} -> {} ({} ms)", uri, status, elapsedMs);

        ChartFailureKind kind = ChartFailureKind.fromHttpStatus(status);
        if (kind != null) {
            throw new ChartSourceException(kind, "HTTP " + status + " from " + uri);
        }
        return PageResponse.builder()
                .requestUri(uri)
                .finalUri(resp.uri() == null ? uri : resp.uri())
                .statusCode(status)
                .body(resp.body())
                .contentType(resp.headers().firstValue("Content-Type").orElse(null))
                .responseTimeMs(elapsedMs)
                .build();
    }
}

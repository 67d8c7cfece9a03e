package com.aerocharts.core.model;

import java.net.URI;
import java.util.Objects;

/** 페이지 GET 결과(텍스트 본문). finalUri는 리다이렉트 후 최종 주소 */
public final class PageResponse {
    private final URI requestUri;
    private final URI finalUri;
    private final int statusCode;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;

    private PageResponse(Builder b) {
        this.requestUri = b.requestUri;
        this.finalUri = b.finalUri == null ? b.requestUri : b.finalUri;
        this.statusCode = b.statusCode;
        this.body = b.body == null ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getRequestUri() { return requestUri; }
    public URI getFinalUri() { return finalUri; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI requestUri;
        private URI finalUri;
        private int statusCode;
        private String body;
        private String contentType;
        private long responseTimeMs;

        public Builder requestUri(URI v) { this.requestUri = v; return this; }
        public Builder finalUri(URI v) { this.finalUri = v; return this; }
        public Builder statusCode(int v) { this.statusCode = v; return this; }
        public Builder body(String v) { this.body = v; return this; }
        public Builder contentType(String v) { this.contentType = v; return this; }
        public Builder responseTimeMs(long v) { this.responseTimeMs = v; return this; }

        public PageResponse build() {
            Objects.requireNonNull(requestUri, "requestUri");
            return new PageResponse(this);
        }
    }
}

package com.webaudit.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Fetcher 입력: 메서드/헤더/본문/타임아웃(없으면 설정 기본값). */
public final class FetchRequest {
    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final String body;
    private final Duration timeout;

    private FetchRequest(Builder b) {
        this.uri = b.uri;
        this.method = b.method;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.timeout = b.timeout;
    }

    public static FetchRequest get(URI uri) {
        return builder(uri).build();
    }

    public static Builder builder(URI uri) { return new Builder(uri); }

    public URI getUri() { return uri; }
    public String getMethod() { return method; }
    public Map<String, String> getHeaders() { return headers; }
    /** null 이면 본문 없음 */
    public String getBody() { return body; }
    /** null 이면 Fetcher 기본 타임아웃 사용 */
    public Duration getTimeout() { return timeout; }

    /** 로그/리포트용 요청 라인 (예: "GET /path?q=1") */
    public String requestLine() {
        String path = (uri.getRawPath() == null || uri.getRawPath().isEmpty()) ? "/" : uri.getRawPath();
        String q = uri.getRawQuery();
        return method + " " + (q == null ? path : path + "?" + q);
    }

    @Override public String toString() { return requestLine(); }

    public static final class Builder {
        private final URI uri;
        private String method = "GET";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private Duration timeout;

        private Builder(URI uri) { this.uri = Objects.requireNonNull(uri, "uri"); }

        public Builder method(String method) {
            this.method = (method == null || method.isBlank()) ? "GET" : method.trim().toUpperCase(Locale.ROOT);
            return this;
        }
        public Builder header(String name, String value) {
            if (name != null && value != null) headers.put(name, value);
            return this;
        }
        public Builder body(String body) { this.body = body; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }

        public FetchRequest build() { return new FetchRequest(this); }
    }
}

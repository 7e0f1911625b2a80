package com.webaudit.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** HTTP 응답 캡처(본문은 텍스트 기준, 상한 초과분은 잘림) */
public final class FetchResponse {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long elapsedMs;
    private final boolean truncated;

    private FetchResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.elapsedMs = b.elapsedMs;
        this.truncated = b.truncated;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getElapsedMs() { return elapsedMs; }
    public boolean isTruncated() { return truncated; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        for (var e : headers.entrySet()) {
            String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                return (e.getValue() != null) ? e.getValue() : List.of();
            }
        }
        return List.of();
    }

    /** Content-Type 이 없거나 html 계열이면 true (파싱 대상 판정) */
    public boolean isHtmlLike() {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("html") || ct.contains("xml") || ct.startsWith("text/plain");
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long elapsedMs;
        private boolean truncated;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }
        public Builder truncated(boolean truncated) { this.truncated = truncated; return this; }

        public FetchResponse build() {
            Objects.requireNonNull(url, "url");
            return new FetchResponse(this);
        }
    }
}

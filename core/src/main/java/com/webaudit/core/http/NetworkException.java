package com.webaudit.core.http;

import java.net.URI;

/** 연결 리셋/DNS 실패 등 네트워크 오류(재시도 소진 후 전달) */
public class NetworkException extends FetchException {
    private final int attempts;

    public NetworkException(URI uri, int attempts, Throwable cause) {
        super(uri, "network error after " + attempts + " attempt(s): " + describe(cause), cause);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }

    static String describe(Throwable t) {
        if (t == null) return "unknown";
        String m = t.getMessage();
        return t.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
    }
}

package com.webaudit.core.http;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 일시적 네트워크 오류에서만 재시도. 250ms → 500ms → 1000ms (±10% Jitter)
 * HTTP 응답(4xx/5xx 포함)은 예외가 아니므로 여기까지 오지 않는다.
 * 연결 거부/타임아웃은 일시적 오류로 보지 않는다.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(2, 250); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
    }

    @Override public boolean shouldRetry(IOException failure, int attempt) {
        if (attempt >= maxAttempts) return false;
        return isTransient(failure);
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(10, attempt - 1);   // 1,2,4...
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    /** 연결 리셋, DNS 실패, 읽기 중 끊김 등 */
    static boolean isTransient(IOException e) {
        if (e == null) return false;
        if (e instanceof HttpTimeoutException) return false;
        return !(e instanceof ConnectException);
    }
}

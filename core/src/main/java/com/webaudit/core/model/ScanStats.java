package com.webaudit.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Fetcher 텔레메트리 누적기 (스레드 세이프). */
public final class ScanStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함)
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicLong failuresTotal = new AtomicLong(0);   // 최종 실패(재시도 소진/타임아웃)
    private final AtomicLong sumElapsedMs  = new AtomicLong(0);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** 요청 시작. 현재 동시 실행 수를 관측해 최대값 갱신 */
    public void enter() {
        int cur = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
    }

    public void exit(long elapsedMs) {
        inFlight.decrementAndGet();
        sumElapsedMs.addAndGet(Math.max(0, elapsedMs));
    }

    public void addAttempt() { attemptsTotal.incrementAndGet(); }
    public void addRetry() { retriesTotal.incrementAndGet(); }
    public void addFailure() { failuresTotal.incrementAndGet(); }

    public Snapshot snapshot() {
        long attempts = attemptsTotal.get();
        long avg = sumElapsedMs.get() / Math.max(1, attempts);
        return new Snapshot(attempts, retriesTotal.get(), failuresTotal.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long attemptsTotal;
        public final long retriesTotal;
        public final long failuresTotal;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;
        public Snapshot(long a, long r, long f, int c, long avg) {
            this.attemptsTotal = a;
            this.retriesTotal = r;
            this.failuresTotal = f;
            this.maxObservedConcurrency = c;
            this.avgLatencyMs = avg;
        }
    }
}

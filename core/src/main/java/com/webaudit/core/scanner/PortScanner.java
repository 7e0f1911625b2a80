package com.webaudit.core.scanner;

import com.webaudit.core.model.PortTable;
import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * TCP connect 포트 스캐너.
 * - DNS 는 1회만 해석(실패 시 error 테이블)
 * - connect 타임아웃/거부/도달불가 모두 closed
 * - 동시 connect 수는 concurrency 로 제한
 */
public final class PortScanner {

    private static final Logger LOG = LoggerFactory.getLogger(PortScanner.class);

    private final Duration connectTimeout;
    private final int concurrency;

    public PortScanner(ScanConfig config) {
        this(config.getPortConnectTimeout(), config.getPortConcurrency());
    }

    public PortScanner(Duration connectTimeout, int concurrency) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.concurrency = Math.max(1, concurrency);
    }

    public PortTable scan(String host, List<Integer> ports) throws InterruptedException {
        Objects.requireNonNull(host, "host");
        // 1) DNS 1회 (fail-fast)
        InetAddress addr;
        try {
            addr = InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            LOG.warn("Port scan skipped, unknown host: {}", host);
            return PortTable.error(host, "unknown host: " + host);
        }

        List<Integer> targets = List.copyOf(new LinkedHashSet<>(ports));
        Map<Integer, Boolean> result = new TreeMap<>();
        if (targets.isEmpty()) return new PortTable(host, new TreeMap<>(result), null);

        // 2) 제한된 병렬
        int threads = Math.min(concurrency, targets.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new NamedThreadFactory("ports"));
        Semaphore sem = new Semaphore(concurrency);
        try {
            Map<Integer, CompletableFuture<Boolean>> futures = new TreeMap<>();
            for (Integer port : targets) {
                futures.put(port, CompletableFuture.supplyAsync(() -> connect(addr, port, sem), pool));
            }

            // 3) 전체 상한: 라운드 수 × connect 타임아웃 + 여유
            long rounds = (targets.size() + threads - 1) / threads;
            long budgetMs = rounds * connectTimeout.toMillis() + 2_000;
            CompletableFuture<Void> all = CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]));
            try {
                all.get(budgetMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                LOG.warn("Port scan budget exceeded on {} ({}ms); unfinished ports count as closed", host, budgetMs);
            } catch (ExecutionException e) {
                LOG.warn("Port scan task failed on {}: {}", host, e.getCause() != null ? e.getCause().toString() : e.toString());
            }

            futures.forEach((port, f) -> result.put(port, Boolean.TRUE.equals(f.getNow(Boolean.FALSE))));
        } finally {
            pool.shutdownNow();
        }
        return new PortTable(host, new TreeMap<>(result), null);
    }

    private boolean connect(InetAddress addr, int port, Semaphore sem) {
        boolean acquired = false;
        try {
            sem.acquire();
            acquired = true;
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(addr, port), (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
                return true;
            }
        } catch (IOException e) {
            return false;     // refused / timeout / unreachable → closed
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            if (acquired) sem.release();
        }
    }
}

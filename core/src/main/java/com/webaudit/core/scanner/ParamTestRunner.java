package com.webaudit.core.scanner;

import com.webaudit.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * InjectionPoint 병렬 실행기(파라미터 테스트 공용).
 * 지점별 실패는 debug 로그만 남기고 나머지는 계속 진행한다.
 */
final class ParamTestRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ParamTestRunner.class);

    /** 지점 하나를 검사. 결과 없음은 Optional.empty() */
    @FunctionalInterface
    interface PointCheck<F> {
        Optional<F> check(InjectionPoint point) throws Exception;
    }

    private final String name;
    private final int concurrency;

    ParamTestRunner(String name, int concurrency) {
        this.name = name;
        this.concurrency = Math.max(1, concurrency);
    }

    <F> void run(List<InjectionPoint> points, PointCheck<F> check, Consumer<? super F> sink) throws InterruptedException {
        if (points.isEmpty()) return;
        int threads = Math.min(concurrency, points.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new NamedThreadFactory(name));
        try {
            List<Future<?>> futures = new ArrayList<>(points.size());
            for (InjectionPoint p : points) {
                futures.add(pool.submit(() -> {
                    try {
                        check.check(p).ifPresent(sink);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    } catch (Exception e) {
                        LOG.debug("{} point failed: {} {} ({})", name, p.method(), p.location(), e.toString());
                    }
                }));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    LOG.debug("{} task failed: {}", name, String.valueOf(e.getCause()));
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}

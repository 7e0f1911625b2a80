package com.webaudit.core.service;

import com.webaudit.core.api.ICrawler;
import com.webaudit.core.api.IFetcher;
import com.webaudit.core.api.IParamTester;
import com.webaudit.core.api.ScanArgumentException;
import com.webaudit.core.api.ScanBusyException;
import com.webaudit.core.api.ScanNotFoundException;
import com.webaudit.core.crawler.CrawlAccumulator;
import com.webaudit.core.crawler.Crawler;
import com.webaudit.core.http.Fetcher;
import com.webaudit.core.model.CrawlResult;
import com.webaudit.core.model.FormSpec;
import com.webaudit.core.model.HeaderReport;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.model.PortTable;
import com.webaudit.core.model.Report;
import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.model.ScanJob;
import com.webaudit.core.model.ScanRequest;
import com.webaudit.core.model.ScanStats;
import com.webaudit.core.model.SqliFinding;
import com.webaudit.core.model.SqlmapArgs;
import com.webaudit.core.model.SqlmapRun;
import com.webaudit.core.model.XssFinding;
import com.webaudit.core.scanner.HeaderChecker;
import com.webaudit.core.scanner.PortScanner;
import com.webaudit.core.scanner.SqliTester;
import com.webaudit.core.scanner.XssTester;
import com.webaudit.core.scanner.sqlmap.ProcessLaunchException;
import com.webaudit.core.scanner.sqlmap.SqlmapCommand;
import com.webaudit.core.scanner.sqlmap.SqlmapRunner;
import com.webaudit.core.service.export.JsonReportExporter;
import com.webaudit.core.util.NamedThreadFactory;
import com.webaudit.core.util.StructuredLog;
import com.webaudit.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 2단계 스캔 오케스트레이터.
 *  - Phase 1(runBase): ports / headers / crawl 병렬 → crawl 종료 후 xss / sqli 병렬
 *  - Phase 2(runDeep): scan_id 로 잡을 다시 열어 sqlmap run 을 덧붙임
 *  - 하위 스캔 하나의 실패는 로그 + 빈/에러 그룹으로 대체(잡 전체는 계속)
 *  - Phase 1 전체는 phase1Timeout 안에서 끝나며, 초과분은 지금까지의 부분 결과로 채운다
 */
public final class ScanOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(ScanOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanOrchestrator.class);

    static final String TIMED_OUT = "timed out";

    private final ScanConfig config;
    private final ScanJobStore store;
    private final ScanStats stats;
    private final ICrawler crawler;
    private final PortScanner portScanner;
    private final HeaderChecker headerChecker;
    private final IParamTester<XssFinding> xssTester;
    private final IParamTester<SqliFinding> sqliTester;
    private final SqlmapRunner sqlmapRunner;
    private final JsonReportExporter exporter;

    /** 기본 구성(메모리 저장소) */
    public ScanOrchestrator(ScanConfig config) {
        this(config, new InMemoryScanJobStore());
    }

    public ScanOrchestrator(ScanConfig config, ScanJobStore store) {
        this(config, store, new ScanStats());
    }

    private ScanOrchestrator(ScanConfig config, ScanJobStore store, ScanStats stats) {
        this(config, store, stats, new Fetcher(config, stats));
    }

    private ScanOrchestrator(ScanConfig config, ScanJobStore store, ScanStats stats, IFetcher fetcher) {
        this(config, store, stats,
                new Crawler(fetcher),
                new PortScanner(config),
                new HeaderChecker(fetcher),
                new XssTester(fetcher, config.getParamConcurrency()),
                new SqliTester(fetcher, config.getParamConcurrency(), config.getSqliThreshold()),
                new SqlmapRunner(config.sqlmap()),
                new JsonReportExporter(config.getOutputDir()));
    }

    /** DI/테스트용 */
    public ScanOrchestrator(ScanConfig config, ScanJobStore store, ScanStats stats,
                            ICrawler crawler, PortScanner portScanner, HeaderChecker headerChecker,
                            IParamTester<XssFinding> xssTester, IParamTester<SqliFinding> sqliTester,
                            SqlmapRunner sqlmapRunner, JsonReportExporter exporter) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.store = Objects.requireNonNull(store, "store");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.portScanner = Objects.requireNonNull(portScanner, "portScanner");
        this.headerChecker = Objects.requireNonNull(headerChecker, "headerChecker");
        this.xssTester = Objects.requireNonNull(xssTester, "xssTester");
        this.sqliTester = Objects.requireNonNull(sqliTester, "sqliTester");
        this.sqlmapRunner = Objects.requireNonNull(sqlmapRunner, "sqlmapRunner");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    /* =========================
       Phase 1
       ========================= */

    public ScanJob runBase(ScanRequest request) throws InterruptedException {
        URI target = validate(request);
        ScanJob job = ScanJob.create(request);
        StructuredLog slog = SLOG.with("scanId", job.getId());
        job.startBase();
        store.put(job);
        slog.info("job-transition", "status", job.getStatus().wireName(), "phase", 1);

        LOG.info("Phase1 start: target={}, maxPages={}, cc={}, scanId={}",
                target, request.maxPages(), request.concurrency(), job.getId());
        slog.info("phase1-start", "target", target.toString(),
                "maxPages", request.maxPages(), "cc", request.concurrency());
        long t0 = System.nanoTime();

        try {
            runPhase1(job, target, slog);
        } catch (InterruptedException | RuntimeException e) {
            job.fail();
            store.put(job);
            slog.error("job-failed", e, "phase", 1);
            throw e;
        }

        job.finishBase();
        export(job, slog);
        store.put(job);

        Report r = job.getReport();
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        ScanStats.Snapshot snap = stats.snapshot();
        LOG.info("Phase1 done: scanId={}, pages={}, openPorts={}, xss={}, sqli={}, {}ms",
                job.getId(), r.getCrawl().pages().size(), r.getPorts().openCount(),
                r.getXss().size(), r.getSqli().size(), ms);
        slog.info("phase1-done",
                "pages", r.getCrawl().pages().size(),
                "xss", r.getXss().size(),
                "sqli", r.getSqli().size(),
                "ms", ms,
                "attempts", snap.attemptsTotal,
                "retries", snap.retriesTotal,
                "maxObservedCC", snap.maxObservedConcurrency);
        return job;
    }

    private void runPhase1(ScanJob job, URI target, StructuredLog slog) throws InterruptedException {
        ScanRequest req = job.getRequest();
        Report report = job.getReport();
        long deadline = System.nanoTime() + config.getPhase1Timeout().toNanos();

        CrawlAccumulator acc = new CrawlAccumulator();
        ConcurrentLinkedQueue<XssFinding> xssQ = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<SqliFinding> sqliQ = new ConcurrentLinkedQueue<>();

        ExecutorService pool = Executors.newFixedThreadPool(5, new NamedThreadFactory("phase1"));
        try {
            // ---- 1) 독립 하위 스캔 ----
            Future<PortTable> fPorts = pool.submit(() -> portScanner.scan(target.getHost(), config.getPorts()));
            Future<HeaderReport> fHeaders = pool.submit(() -> headerChecker.check(target));
            Future<CrawlResult> fCrawl = pool.submit(() -> {
                crawler.crawl(target, req.maxPages(), req.concurrency(), acc);
                return acc.snapshot();
            });

            // ---- 2) crawl → testers ----
            Outcome<CrawlResult> crawl = await(fCrawl, deadline, "crawl", slog);
            CrawlResult crawlResult = crawl.value != null ? crawl.value : acc.snapshot();
            report.setCrawl(crawlResult);

            List<PageRecord> pages = crawlResult.pages();
            Future<?> fXss = null;
            Future<?> fSqli = null;
            if (System.nanoTime() < deadline && !pages.isEmpty()) {
                fXss = pool.submit(() -> { xssTester.test(pages, xssQ::add); return null; });
                fSqli = pool.submit(() -> { sqliTester.test(pages, sqliQ::add); return null; });
            }
            if (fXss != null) await(fXss, deadline, "xss", slog);
            if (fSqli != null) await(fSqli, deadline, "sqli", slog);
            report.setXss(new ArrayList<>(xssQ));
            report.setSqli(new ArrayList<>(sqliQ));

            // ---- 3) ports / headers ----
            Outcome<PortTable> ports = await(fPorts, deadline, "ports", slog);
            report.setPorts(ports.value != null ? ports.value : PortTable.error(target.getHost(), ports.error));

            Outcome<HeaderReport> headers = await(fHeaders, deadline, "headers", slog);
            report.setHeaders(headers.value != null ? headers.value : HeaderReport.error(target.toString(), headers.error));
        } finally {
            pool.shutdownNow();
        }
    }

    /* =========================
       Phase 2
       ========================= */

    /**
     * @param url 비어 있으면 잡의 target
     * @param args null 이면 Phase 1 요청에 실려 온 인자
     */
    public ScanJob runDeep(String scanId, String url, SqlmapArgs args) throws ProcessLaunchException, InterruptedException {
        if (scanId == null || scanId.isBlank()) throw new ScanArgumentException("scan_id is required");
        ScanJob job = store.get(scanId)
                .orElseThrow(() -> new ScanNotFoundException(scanId, "scan not found: " + scanId));
        if (!job.isBaseCompleted()) {
            throw new ScanNotFoundException(scanId, "base scan not completed: " + scanId);
        }
        String target = (url == null || url.isBlank()) ? job.getTarget() : url.trim();
        SqlmapArgs effective = (args != null) ? args : job.getRequest().sqlmapArgs();
        SqlmapCommand cmd = sqlmapRunner.command(scanId, target, effective, firstPostForm(job.getReport().getCrawl()));

        StructuredLog slog = SLOG.with("scanId", scanId);
        try {
            job.startDeep();
        } catch (IllegalStateException e) {
            throw new ScanBusyException("scan is already running: " + scanId);
        }
        store.put(job);
        slog.info("job-transition", "status", job.getStatus().wireName(), "phase", 2);
        LOG.info("Phase2 start: scanId={}, target={}, args={}", scanId, cmd.target(), effective);

        SqlmapRun run;
        try {
            run = sqlmapRunner.run(scanId, cmd);
        } catch (ProcessLaunchException | InterruptedException | RuntimeException e) {
            job.finishDeep(false);
            export(job, slog);
            store.put(job);
            slog.error("job-failed", e, "phase", 2);
            throw e;
        }

        job.getReport().appendSqlmapRun(run);
        job.finishDeep(run.succeeded());
        export(job, slog);
        store.put(job);

        LOG.info("Phase2 done: scanId={}, run={}, exit={}, findings={}",
                scanId, run.status(), run.exitCode(), run.findings().size());
        slog.info("job-transition", "status", job.getStatus().wireName(), "phase", 2);
        return job;
    }

    /** Phase 1 후 runSqlmap 이면 Phase 2 */
    public ScanJob runFull(ScanRequest request) throws ProcessLaunchException, InterruptedException {
        ScanJob job = runBase(request);
        if (!request.runSqlmap()) return job;
        return runDeep(job.getId(), request.url(), request.sqlmapArgs());
    }

    public ScanJobStore getStore() { return store; }

    public ScanConfig getConfig() { return config; }

    public ScanStats.Snapshot getRuntimeSnapshot() { return stats.snapshot(); }

    /* =========================
       helpers
       ========================= */

    /** URL/범위 검증. 통과하면 정규화된 target */
    URI validate(ScanRequest request) {
        if (request == null) throw new ScanArgumentException("request is required");
        URI target = UrlUtils.normalize(request.url());
        if (target == null || !UrlUtils.isHttp(target)) {
            throw new ScanArgumentException("url must be an absolute http(s) URL: " + request.url());
        }
        if (request.maxPages() < 1 || request.maxPages() > config.getMaxPagesLimit()) {
            throw new ScanArgumentException("max_pages must be between 1 and " + config.getMaxPagesLimit());
        }
        if (request.concurrency() < 1 || request.concurrency() > config.getMaxConcurrencyLimit()) {
            throw new ScanArgumentException("concurrency must be between 1 and " + config.getMaxConcurrencyLimit());
        }
        return target;
    }

    private static FormSpec firstPostForm(CrawlResult crawl) {
        if (crawl == null) return null;
        for (PageRecord p : crawl.pages()) {
            for (FormSpec f : p.forms()) {
                if (f.isPost() && !f.inputs().isEmpty()) return f;
            }
        }
        return null;
    }

    private void export(ScanJob job, StructuredLog slog) {
        try {
            job.setReportPath(exporter.export(job));
            LOG.info("Report written: {}", job.getReportPath());
        } catch (IOException e) {
            LOG.warn("Report export failed: scanId={} ({})", job.getId(), e.toString());
            slog.error("export-failed", e);
        }
    }

    /** 값 또는 에러 메시지 */
    private static final class Outcome<T> {
        final T value;
        final String error;

        private Outcome(T value, String error) { this.value = value; this.error = error; }
    }

    /**
     * deadline 까지 대기. 초과 시 cancel(true) 후 "timed out",
     * 작업 예외는 로그만 남기고 메시지로 대체.
     */
    private static <T> Outcome<T> await(Future<T> f, long deadline, String group, StructuredLog slog)
            throws InterruptedException {
        long left = deadline - System.nanoTime();
        try {
            return new Outcome<>(f.get(Math.max(0L, left), TimeUnit.NANOSECONDS), null);
        } catch (TimeoutException e) {
            f.cancel(true);
            LOG.warn("Sub-scan timed out: {}", group);
            slog.warn("subscan-timeout", "group", group);
            return new Outcome<>(null, TIMED_OUT);
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.warn("Sub-scan failed: {} ({})", group, cause.toString());
            slog.error("subscan-failed", cause, "group", group);
            String msg = cause.getMessage();
            return new Outcome<>(null, msg != null ? msg : cause.getClass().getSimpleName());
        }
    }
}

package com.webaudit.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 엔진 설정 (webaudit.yml 매핑 대상).
 * 요청별 값(max_pages/concurrency)은 ScanRequest 로 들어오고, 여기 limits 로 상한 검증한다.
 */
public final class ScanConfig {

    /** 포트 스캔 기본 대상 */
    public static final List<Integer> DEFAULT_PORTS =
            List.of(80, 443, 21, 22, 25, 53, 110, 143, 3306, 5432, 8000, 8080, 8443);

    /** sqlmap 실행 방식 */
    public enum SqlmapMode { DOCKER, LOCAL }

    /** YAML `sqlmap:` 섹션 */
    public static final class SqlmapCfg {
        private SqlmapMode mode = SqlmapMode.DOCKER;
        private String image = "webaudit-sqlmap:latest";
        private String executable = "sqlmap";
        private Duration timeout = Duration.ofSeconds(600);
        private int maxOutputBytes = 1024 * 1024;
        private String localhostAlias = "host.docker.internal";

        public SqlmapMode getMode() { return mode; }
        public String getImage() { return image; }
        public String getExecutable() { return executable; }
        public Duration getTimeout() { return timeout; }
        public int getMaxOutputBytes() { return maxOutputBytes; }
        public String getLocalhostAlias() { return localhostAlias; }

        public SqlmapCfg setMode(SqlmapMode mode) { this.mode = (mode != null ? mode : SqlmapMode.DOCKER); return this; }
        public SqlmapCfg setImage(String image) { this.image = image; return this; }
        public SqlmapCfg setExecutable(String executable) { this.executable = executable; return this; }
        public SqlmapCfg setTimeout(Duration timeout) { this.timeout = timeout; return this; }
        public SqlmapCfg setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; return this; }
        public SqlmapCfg setLocalhostAlias(String alias) { this.localhostAlias = alias; return this; }
    }

    /** YAML `server:` 섹션 */
    public static final class ServerCfg {
        private String host = "0.0.0.0";
        private int port = 8000;

        public String getHost() { return host; }
        public int getPort() { return port; }
        public ServerCfg setHost(String host) { this.host = host; return this; }
        public ServerCfg setPort(int port) { this.port = port; return this; }
    }

    // ---------- HTTP ----------
    private String userAgent = "webaudit/1.0";
    private Duration timeout = Duration.ofSeconds(10);   // 요청 타임아웃
    private boolean followRedirects = true;
    private int fetchMaxAttempts = 2;                    // 네트워크 오류 재시도 포함 총 시도
    private long fetchBackoffMs = 250;
    private int maxBodyChars = 2_000_000;

    // ---------- 요청 상한/기본 ----------
    private int maxPagesLimit = 50;
    private int maxConcurrencyLimit = 5;
    private int defaultMaxPages = 50;
    private int defaultConcurrency = 5;

    // ---------- 포트 ----------
    private List<Integer> ports = DEFAULT_PORTS;
    private Duration portConnectTimeout = Duration.ofMillis(1000);
    private int portConcurrency = 16;

    // ---------- 테스터 ----------
    private int paramConcurrency = 10;
    private double sqliThreshold = 0.90;
    private Duration phase1Timeout = Duration.ofSeconds(300);

    // ---------- 출력 ----------
    private Path outputDir = Path.of("out");

    private final SqlmapCfg sqlmap = new SqlmapCfg();
    private final ServerCfg server = new ServerCfg();

    // ---------- getters ----------
    public String getUserAgent() { return userAgent; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getFetchMaxAttempts() { return fetchMaxAttempts; }
    public long getFetchBackoffMs() { return fetchBackoffMs; }
    public int getMaxBodyChars() { return maxBodyChars; }
    public int getMaxPagesLimit() { return maxPagesLimit; }
    public int getMaxConcurrencyLimit() { return maxConcurrencyLimit; }
    public int getDefaultMaxPages() { return defaultMaxPages; }
    public int getDefaultConcurrency() { return defaultConcurrency; }
    public List<Integer> getPorts() { return ports; }
    public Duration getPortConnectTimeout() { return portConnectTimeout; }
    public int getPortConcurrency() { return portConcurrency; }
    public int getParamConcurrency() { return paramConcurrency; }
    public double getSqliThreshold() { return sqliThreshold; }
    public Duration getPhase1Timeout() { return phase1Timeout; }
    public Path getOutputDir() { return outputDir; }
    public SqlmapCfg sqlmap() { return sqlmap; }
    public ServerCfg server() { return server; }

    // ---------- fluent setters ----------
    public ScanConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public ScanConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ScanConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScanConfig setFetchMaxAttempts(int v) { this.fetchMaxAttempts = v; return this; }
    public ScanConfig setFetchBackoffMs(long v) { this.fetchBackoffMs = v; return this; }
    public ScanConfig setMaxBodyChars(int v) { this.maxBodyChars = v; return this; }
    public ScanConfig setMaxPagesLimit(int v) { this.maxPagesLimit = v; return this; }
    public ScanConfig setMaxConcurrencyLimit(int v) { this.maxConcurrencyLimit = v; return this; }
    public ScanConfig setDefaultMaxPages(int v) { this.defaultMaxPages = v; return this; }
    public ScanConfig setDefaultConcurrency(int v) { this.defaultConcurrency = v; return this; }
    public ScanConfig setPorts(List<Integer> ports) {
        if (ports != null && !ports.isEmpty()) this.ports = List.copyOf(ports);
        return this;
    }
    public ScanConfig setPortConnectTimeout(Duration d) { this.portConnectTimeout = d; return this; }
    public ScanConfig setPortConcurrency(int v) { this.portConcurrency = v; return this; }
    public ScanConfig setParamConcurrency(int v) { this.paramConcurrency = v; return this; }
    public ScanConfig setSqliThreshold(double v) { this.sqliThreshold = v; return this; }
    public ScanConfig setPhase1Timeout(Duration d) { this.phase1Timeout = d; return this; }
    public ScanConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(userAgent, "userAgent");
        requirePositive(timeout, "timeout");
        if (fetchMaxAttempts < 1) throw new IllegalArgumentException("fetch.maxAttempts must be >= 1");
        if (fetchBackoffMs < 0) throw new IllegalArgumentException("fetch.backoffMs must be >= 0");
        if (maxBodyChars < 1024) throw new IllegalArgumentException("fetch.maxBodyChars must be >= 1024");

        if (maxPagesLimit < 1) throw new IllegalArgumentException("limits.maxPages must be >= 1");
        if (maxConcurrencyLimit < 1) throw new IllegalArgumentException("limits.maxConcurrency must be >= 1");
        if (defaultMaxPages < 1 || defaultMaxPages > maxPagesLimit)
            throw new IllegalArgumentException("crawl.maxPages must be between 1 and " + maxPagesLimit);
        if (defaultConcurrency < 1 || defaultConcurrency > maxConcurrencyLimit)
            throw new IllegalArgumentException("crawl.concurrency must be between 1 and " + maxConcurrencyLimit);

        Objects.requireNonNull(ports, "ports");
        for (Integer p : ports) {
            if (p == null || p < 1 || p > 65535) throw new IllegalArgumentException("ports must be in 1..65535: " + p);
        }
        requirePositive(portConnectTimeout, "ports.connectTimeout");
        if (portConcurrency < 1) throw new IllegalArgumentException("ports.concurrency must be >= 1");

        if (paramConcurrency < 1) throw new IllegalArgumentException("params.concurrency must be >= 1");
        if (sqliThreshold <= 0.0 || sqliThreshold > 1.0)
            throw new IllegalArgumentException("sqli.threshold must be in (0, 1]");
        requirePositive(phase1Timeout, "phase1.timeout");
        Objects.requireNonNull(outputDir, "outputDir");

        Objects.requireNonNull(sqlmap.getImage(), "sqlmap.image");
        Objects.requireNonNull(sqlmap.getExecutable(), "sqlmap.executable");
        requirePositive(sqlmap.getTimeout(), "sqlmap.timeout");
        if (sqlmap.getMaxOutputBytes() < 1024) throw new IllegalArgumentException("sqlmap.maxOutputBytes must be >= 1024");

        if (server.getPort() < 0 || server.getPort() > 65535)
            throw new IllegalArgumentException("server.port must be in 0..65535");
    }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }

    /** 밀리초(long) 반환 */
    public long getTimeoutMs() { return timeout.toMillis(); }

    public ScanConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }
}

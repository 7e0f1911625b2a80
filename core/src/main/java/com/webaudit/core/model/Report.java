package com.webaudit.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ScanJob 하나의 결과 집계.
 * - 기본 그룹(ports/crawl/headers/xss/sqli)은 Phase 1 에서 한 번만 기록
 * - sqlmap 그룹은 Phase 2 실행마다 run 이 append
 */
public final class Report {

    private volatile PortTable ports;
    private volatile CrawlResult crawl;
    private volatile HeaderReport headers;
    private volatile List<XssFinding> xss;
    private volatile List<SqliFinding> sqli;
    private final List<SqlmapRun> sqlmapRuns = new CopyOnWriteArrayList<>();

    public synchronized void setPorts(PortTable ports) {
        ensureUnset(this.ports, "ports");
        this.ports = ports;
    }

    public synchronized void setCrawl(CrawlResult crawl) {
        ensureUnset(this.crawl, "crawl");
        this.crawl = crawl;
    }

    public synchronized void setHeaders(HeaderReport headers) {
        ensureUnset(this.headers, "headers");
        this.headers = headers;
    }

    public synchronized void setXss(List<XssFinding> xss) {
        ensureUnset(this.xss, "xss");
        this.xss = List.copyOf(xss);
    }

    public synchronized void setSqli(List<SqliFinding> sqli) {
        ensureUnset(this.sqli, "sqli");
        this.sqli = List.copyOf(sqli);
    }

    public void appendSqlmapRun(SqlmapRun run) {
        sqlmapRuns.add(run);
    }

    public PortTable getPorts() { return ports; }
    public CrawlResult getCrawl() { return crawl; }
    public HeaderReport getHeaders() { return headers; }
    public List<XssFinding> getXss() { return xss == null ? List.of() : xss; }
    public List<SqliFinding> getSqli() { return sqli == null ? List.of() : sqli; }
    public List<SqlmapRun> getSqlmapRuns() { return List.copyOf(sqlmapRuns); }

    /** 모든 run 의 finding 을 실행 순서대로 평탄화 */
    public List<SqlmapFinding> getSqlmapFindings() {
        List<SqlmapFinding> out = new ArrayList<>();
        for (SqlmapRun r : sqlmapRuns) out.addAll(r.findings());
        return out;
    }

    /** 종류 무관 전체 finding (actionable 필터/요약용) */
    public List<Finding> allFindings() {
        List<Finding> out = new ArrayList<>();
        if (ports != null) out.addAll(ports.findings());
        if (headers != null) out.addAll(headers.findings());
        out.addAll(getXss());
        out.addAll(getSqli());
        out.addAll(getSqlmapFindings());
        return out;
    }

    public boolean isBaseComplete() {
        return ports != null && crawl != null && headers != null && xss != null && sqli != null;
    }

    private static void ensureUnset(Object current, String group) {
        if (current != null) {
            throw new IllegalStateException("report group already written: " + group);
        }
    }
}

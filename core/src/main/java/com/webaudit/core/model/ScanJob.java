package com.webaudit.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * 스캔 잡. 상태 전이는 startBase, finishBase, startDeep, finishDeep, fail 로만 일어나고, 허용되지 않은 전이는 IllegalStateException.
 */
public final class ScanJob {

    private final String id;
    private final String target;
    private final ScanRequest request;
    private final Instant createdAt;
    private final Report report = new Report();

    private JobStatus status = JobStatus.CREATED;
    private int phase = 0;                 // 0: 시작 전, 1: base, 2: deep
    private boolean baseCompleted = false;
    private Instant updatedAt;
    private volatile Path reportPath;

    public ScanJob(String id, ScanRequest request, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.request = Objects.requireNonNull(request, "request");
        this.target = request.url();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public static ScanJob create(ScanRequest request) {
        return new ScanJob(UUID.randomUUID().toString(), request, Instant.now());
    }

    /** Phase 1 시작 */
    public synchronized void startBase() {
        require(status == JobStatus.CREATED, JobStatus.RUNNING);
        phase = 1;
        set(JobStatus.RUNNING);
    }

    /** Phase 1 종료(개별 실패와 무관하게 항상 partial) */
    public synchronized void finishBase() {
        require(status == JobStatus.RUNNING && phase == 1, JobStatus.PARTIAL);
        baseCompleted = true;
        set(JobStatus.PARTIAL);
    }

    /** Phase 2 시작. base 가 끝난 잡이면 complete/failed 이후에도 재실행 가능 */
    public synchronized void startDeep() {
        require(baseCompleted && status != JobStatus.RUNNING, JobStatus.RUNNING);
        phase = 2;
        set(JobStatus.RUNNING);
    }

    public synchronized void finishDeep(boolean success) {
        JobStatus to = success ? JobStatus.COMPLETE : JobStatus.FAILED;
        require(status == JobStatus.RUNNING && phase == 2, to);
        set(to);
    }

    /** Phase 1 도중 복구 불가 오류 */
    public synchronized void fail() {
        require(status == JobStatus.RUNNING, JobStatus.FAILED);
        set(JobStatus.FAILED);
    }

    private void require(boolean ok, JobStatus to) {
        if (!ok) {
            throw new IllegalStateException("illegal job transition: " + status + "(phase " + phase + ") -> " + to);
        }
    }

    private void set(JobStatus to) {
        this.status = to;
        this.updatedAt = Instant.now();
    }

    public String getId() { return id; }
    public String getTarget() { return target; }
    public ScanRequest getRequest() { return request; }
    public Instant getCreatedAt() { return createdAt; }
    public Report getReport() { return report; }
    public synchronized JobStatus getStatus() { return status; }
    public synchronized int getPhase() { return phase; }
    public synchronized boolean isBaseCompleted() { return baseCompleted; }
    public synchronized Instant getUpdatedAt() { return updatedAt; }
    public Path getReportPath() { return reportPath; }
    public void setReportPath(Path reportPath) { this.reportPath = reportPath; }
}

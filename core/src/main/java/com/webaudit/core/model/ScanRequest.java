package com.webaudit.core.model;

import java.util.Objects;

/**
 * 스캔 1건의 요청값. 범위 검증은 오케스트레이터가 설정 상한과 함께 수행한다.
 */
public record ScanRequest(String url, int maxPages, int concurrency, boolean runSqlmap, SqlmapArgs sqlmapArgs) {

    public ScanRequest {
        Objects.requireNonNull(url, "url");
        sqlmapArgs = (sqlmapArgs == null) ? SqlmapArgs.defaults() : sqlmapArgs;
    }

    /** Phase 1 전용 요청 */
    public static ScanRequest base(String url, int maxPages, int concurrency) {
        return new ScanRequest(url, maxPages, concurrency, false, null);
    }
}

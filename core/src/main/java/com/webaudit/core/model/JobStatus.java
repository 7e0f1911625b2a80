package com.webaudit.core.model;

import java.util.Locale;

/**
 * ScanJob 상태.
 * CREATED → RUNNING(1) → PARTIAL → RUNNING(2) → COMPLETE | FAILED
 */
public enum JobStatus {
    CREATED, RUNNING, PARTIAL, COMPLETE, FAILED;

    /** API/리포트 표기(소문자) */
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
